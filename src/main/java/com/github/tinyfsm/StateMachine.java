package com.github.tinyfsm;

import java.util.List;
import java.util.function.Supplier;

/**
 * A simple Finite State Machine. The machine holds exactly one current state and one context; the
 * states themselves, through {@link StateBehavior}, decide where an event leads.
 * 
 * Notes for users:<br>
 * 1. this FSM instance is NOT thread-safe. Every call runs to completion on the caller's thread;
 * if a machine has to be driven from several threads, serialize access to the whole instance.<br>
 * 
 * 2. states may be enum constants or immutable value objects carrying data (with equals and
 * hashCode). The same state values can drive any number of machines, each with its own
 * context.<br>
 * 
 * 3. every state-driven transition runs exit(old), then commits the new state, then runs
 * enter(new). Nothing else on the same machine can observe the state in between.<br>
 * 
 * 4. building a machine does not enter the initial state. If the initial state needs its enter
 * side effects, build the context accordingly or {@link #transition(StateBehavior)} into it.<br>
 * 
 * 5. a machine must not be called back from within its own handle/enter/exit. Doing so is
 * rejected with an {@link IllegalStateException}.<br>
 *
 * @param <S> the state type
 * @param <E> the event type
 * @param <C> the context type
 */
public interface StateMachine<S extends StateBehavior<S, E, C>, E, C> {

  /**
   * Deliver an event to the current state. If the state answers with a next state, the full
   * exit/commit/enter protocol runs exactly as for {@link #transition(StateBehavior)}.
   * 
   * Returns true iff a transition happened.
   */
  boolean handle(final E event);

  /**
   * Transition the machine to the given state, running exit on the current state and enter on the
   * new one. Both hooks fire even when nextState equals the current state.
   * 
   * Returns true iff the state transition was applied.
   */
  boolean transition(final S nextState);

  /**
   * Overwrite the current state without calling exit or enter. Meant for initialization and test
   * scenarios; keeping the context consistent afterwards is up to the caller.
   */
  void forceState(final S nextState);

  /**
   * Read/report the current state of the state machine.
   */
  S getCurrentState();

  /**
   * The context owned by this machine. Don't mutate it from outside the machine's hooks.
   */
  C getContext();

  /**
   * The last states the machine was put into, oldest first. Bounded by
   * {@link StateMachineConfiguration#getRouteCapacity()}; older entries are pruned.
   */
  List<S> getStateTransitionRoute();

  /**
   * Reports the id of this StateMachine instance. You can have as many instances as you like.
   */
  String getId();

  /**
   * Returns the config that this fsm is wired with.
   */
  StateMachineConfiguration getConfiguration();

  /**
   * Report statistics for this FSM
   */
  StateMachineStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build FSMs.
   */
  public final static class StateMachineBuilder<S extends StateBehavior<S, E, C>, E, C> {
    private final S initialState;
    private C context;
    private Supplier<? extends C> contextSupplier;
    private StateMachineConfiguration config;

    public static <S extends StateBehavior<S, E, C>, E, C> StateMachineBuilder<S, E, C> newBuilder(
        final S initialState) {
      return new StateMachineBuilder<>(initialState);
    }

    /**
     * Start from the first constant declared by the given enum of states.
     */
    public static <S extends Enum<S> & StateBehavior<S, E, C>, E, C> StateMachineBuilder<S, E, C> forStates(
        final Class<S> stateType) throws StateMachineException {
      final S[] states = stateType == null ? null : stateType.getEnumConstants();
      if (states == null || states.length == 0) {
        throw new StateMachineException(StateMachineException.Code.INVALID_STATE,
            "No states declared by " + stateType);
      }
      return new StateMachineBuilder<>(states[0]);
    }

    public StateMachineBuilder<S, E, C> context(final C context) {
      this.context = context;
      this.contextSupplier = null;
      return this;
    }

    /**
     * Supplies the default context, eg. the no-arg constructor of the context type.
     */
    public StateMachineBuilder<S, E, C> contextSupplier(final Supplier<? extends C> contextSupplier) {
      this.contextSupplier = contextSupplier;
      this.context = null;
      return this;
    }

    public StateMachineBuilder<S, E, C> config(final StateMachineConfiguration config) {
      this.config = config;
      return this;
    }

    public StateMachine<S, E, C> build() throws StateMachineException {
      C machineContext = context;
      if (machineContext == null && contextSupplier != null) {
        try {
          machineContext = contextSupplier.get();
        } catch (RuntimeException problem) {
          throw new StateMachineException(StateMachineException.Code.INVALID_CONTEXT, problem);
        }
      }
      return new StateMachineImpl<>(initialState, machineContext,
          config != null ? config : StateMachineConfiguration.defaults());
    }

    private StateMachineBuilder(final S initialState) {
      this.initialState = initialState;
    }
  }

}
