package com.github.tinyfsm;

/**
 * Simple statistics holder for a single machine. Counters are plain fields updated by the owning
 * machine on its caller's thread; read them from that same thread.
 */
public final class StateMachineStatistics {
  private final String stateMachineId;
  private final long startTstampMillis = System.currentTimeMillis();

  long deliveredEvents;
  long ignoredEvents;
  long eventTransitions;
  long explicitTransitions;
  long forcedStates;

  StateMachineStatistics(final String stateMachineId) {
    this.stateMachineId = stateMachineId;
  }

  public String getMachineId() {
    return stateMachineId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public long getDeliveredEvents() {
    return deliveredEvents;
  }

  /**
   * Events the current state answered with no transition.
   */
  public long getIgnoredEvents() {
    return ignoredEvents;
  }

  public long getEventTransitions() {
    return eventTransitions;
  }

  public long getExplicitTransitions() {
    return explicitTransitions;
  }

  public long getForcedStates() {
    return forcedStates;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startTstampMillis;
  }

  @Override
  public String toString() {
    return "StateMachineStatistics [stateMachineId=" + stateMachineId + ", deliveredEvents="
        + deliveredEvents + ", ignoredEvents=" + ignoredEvents + ", eventTransitions="
        + eventTransitions + ", explicitTransitions=" + explicitTransitions + ", forcedStates="
        + forcedStates + ", aliveTimeMillis=" + getAliveTimeMillis() + "]";
  }

}
