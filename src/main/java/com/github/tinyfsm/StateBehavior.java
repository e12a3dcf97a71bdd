package com.github.tinyfsm;

import java.util.Optional;

/**
 * The contract every state of a {@link StateMachine} fulfils. A state decides how it reacts to an
 * event and what happens to the shared context when it becomes, or stops being, the current state.
 * 
 * Notes for implementors:<br>
 * 1. states are values. An enum is the natural fit: the set of states is closed and a switch over
 * the constant gives the decision table in one place.<br>
 * 
 * 2. the context is the only channel for side effects. It belongs to the machine and is lent to
 * exactly one of {@link #handle}, {@link #enter} or {@link #exit} at a time, so never hold on to
 * it past the call.<br>
 * 
 * 3. {@link #handle} is total. A (state, event) pair with no meaning for this state returns
 * {@link Optional#empty()}, which the machine treats as "stay put".<br>
 *
 * @param <S> the state type, usually the implementing enum itself
 * @param <E> the event type
 * @param <C> the context type
 */
public interface StateBehavior<S extends StateBehavior<S, E, C>, E, C> {

  /**
   * Decide the next state for the given event. Returning a state, even this one, asks the machine
   * to run the exit/enter protocol; returning empty leaves the machine where it is.
   */
  Optional<S> handle(final E event, final C context);

  /**
   * Invoked once this state has been committed as the current state.
   */
  default void enter(final C context) {}

  /**
   * Invoked while this state is still current, right before it is replaced.
   */
  default void exit(final C context) {}

}
