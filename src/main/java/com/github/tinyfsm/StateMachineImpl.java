package com.github.tinyfsm;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.tinyfsm.StateMachineException.Code;

/**
 * A simple Finite State Machine.
 * 
 * Notes for users:<br>
 * 1. this FSM instance is NOT thread-safe. There are no locks here; callers sharing one instance
 * across threads must serialize access to it.<br>
 * 
 * 2. the machine is the sole owner of its context. The context is handed to one of
 * {@link StateBehavior#handle}, {@link StateBehavior#exit} or {@link StateBehavior#enter} at a
 * time and each of them runs to completion before the next is called.<br>
 * 
 * 3. the state objects themselves are intended to be stateless values. All mutable data lives in
 * the context, so the same states can drive any number of machines.<br>
 * 
 * 4. this class may be extended to carry auxiliary fields next to the state and context, eg. a
 * game character machine that also tracks the player's name. Subclasses should not override the
 * dispatch methods.<br>
 */
public class StateMachineImpl<S extends StateBehavior<S, E, C>, E, C>
    implements StateMachine<S, E, C> {
  private static final Logger logger = LogManager.getLogger(StateMachineImpl.class.getSimpleName());

  private final String machineId = UUID.randomUUID().toString();
  private final StateMachineConfiguration config;
  private final StateMachineStatistics machineStats;

  private final C context;
  private S currentState;

  // bounded at config.routeCapacity, oldest first
  private final Deque<S> boundedStateRoute = new ArrayDeque<>();

  // set for the duration of handle/transition/forceState to catch callbacks into the machine
  private boolean dispatching;

  public StateMachineImpl(final S initialState, final C context) throws StateMachineException {
    this(initialState, context, StateMachineConfiguration.defaults());
  }

  public StateMachineImpl(final S initialState, final C context,
      final StateMachineConfiguration config) throws StateMachineException {
    if (initialState == null) {
      throw new StateMachineException(Code.INVALID_STATE);
    }
    if (context == null) {
      throw new StateMachineException(Code.INVALID_CONTEXT);
    }
    if (config == null) {
      throw new StateMachineException(Code.INVALID_MACHINE_CONFIG,
          "State machine configuration cannot be null");
    }
    this.config = config;
    this.context = context;
    this.currentState = initialState;
    this.machineStats = new StateMachineStatistics(machineId);
    recordRoute(initialState);
    logInfo(String.format("Fired up state machine in %s with %s", initialState, config));
  }

  @Override
  public boolean handle(final E event) {
    beginDispatch("handle");
    try {
      machineStats.deliveredEvents++;
      final Optional<S> nextState = currentState.handle(event, context);
      if (nextState == null) {
        logWarning(String.format("%s answered %s with null, treating it as no transition",
            currentState, event));
      }
      if (nextState == null || !nextState.isPresent()) {
        machineStats.ignoredEvents++;
        logDebug("No transition from {} on {}", currentState, event);
        return false;
      }
      swapState(nextState.get(), event);
      machineStats.eventTransitions++;
      return true;
    } finally {
      dispatching = false;
    }
  }

  @Override
  public boolean transition(final S nextState) {
    if (nextState == null) {
      logError(String.format("Invalid transition from %s to null state", currentState));
      return false;
    }
    beginDispatch("transition");
    try {
      swapState(nextState, null);
      machineStats.explicitTransitions++;
      return true;
    } finally {
      dispatching = false;
    }
  }

  @Override
  public void forceState(final S nextState) {
    if (nextState == null) {
      logError(String.format("Invalid forced state change from %s to null state", currentState));
      return;
    }
    beginDispatch("forceState");
    try {
      logDebug("Forcing state {}->{}", currentState, nextState);
      currentState = nextState;
      recordRoute(nextState);
      machineStats.forcedStates++;
    } finally {
      dispatching = false;
    }
  }

  @Override
  public S getCurrentState() {
    return currentState;
  }

  @Override
  public C getContext() {
    return context;
  }

  @Override
  public List<S> getStateTransitionRoute() {
    return Collections.unmodifiableList(new ArrayList<>(boundedStateRoute));
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public StateMachineConfiguration getConfiguration() {
    return config;
  }

  @Override
  public StateMachineStatistics getStatistics() {
    return machineStats;
  }

  /**
   * exit(current) -> commit(next) -> enter(next). If exit throws, the current state stays; if
   * enter throws, next is already committed.
   */
  private void swapState(final S nextState, final E event) {
    final S previousState = currentState;
    previousState.exit(context);
    currentState = nextState;
    recordRoute(nextState);
    nextState.enter(context);
    if (event != null) {
      logDebug("Transitioned {}->{} on {}", previousState, nextState, event);
    } else {
      logDebug("Transitioned {}->{}", previousState, nextState);
    }
  }

  private void beginDispatch(final String operation) {
    if (dispatching) {
      throw new IllegalStateException("[m:" + machineId + "] Reentrant " + operation
          + "() while the machine is already dispatching in " + currentState);
    }
    dispatching = true;
  }

  private void recordRoute(final S state) {
    final int routeCapacity = config.getRouteCapacity();
    if (routeCapacity == 0) {
      return;
    }
    boundedStateRoute.addLast(state);
    while (boundedStateRoute.size() > routeCapacity) {
      boundedStateRoute.removeFirst();
    }
  }

  private void logError(final String message) {
    logger.error(new StringBuilder().append("[m:").append(machineId).append("][n:")
        .append(config.getName()).append("] ").append(message).toString());
  }

  private void logWarning(final String message) {
    logger.warn(new StringBuilder().append("[m:").append(machineId).append("][n:")
        .append(config.getName()).append("] ").append(message).toString());
  }

  private void logInfo(final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineId).append("][n:")
        .append(config.getName()).append("] ").append(message).toString());
  }

  // parameters are only rendered once debug is enabled
  private void logDebug(final String message, final Object... params) {
    if (logger.isDebugEnabled()) {
      final Object[] args = new Object[params.length + 2];
      args[0] = machineId;
      args[1] = config.getName();
      System.arraycopy(params, 0, args, 2, params.length);
      logger.debug("[m:{}][n:{}] " + message, args);
    }
  }

  @Override
  public String toString() {
    return "StateMachine [machineId=" + machineId + ", name=" + config.getName()
        + ", currentState=" + currentState + ", context=" + context + "]";
  }

}
