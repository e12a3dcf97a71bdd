package com.github.tinyfsm;

/**
 * This class encapsulates all the configuration parameters for a StateMachine. Use the
 * {@code StateMachineConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. the name shows up in every log line the machine emits, next to its generated id. If not set,
 * it defaults to {@value #defaultMachineName}.<br>
 * 2. routeCapacity bounds the number of recent states kept for
 * {@link StateMachine#getStateTransitionRoute()}. It defaults to {@value #defaultRouteCapacity};
 * 0 turns route tracking off.<br>
 */
public final class StateMachineConfiguration {
  final static int maxMachineNameLength = 20;
  final static String defaultMachineName = "fsm";
  final static int defaultRouteCapacity = 100;

  private final String name;
  private final int routeCapacity;

  public String getName() {
    return name;
  }

  public int getRouteCapacity() {
    return routeCapacity;
  }

  /**
   * Configuration with every parameter at its default.
   */
  public static StateMachineConfiguration defaults() {
    return new StateMachineConfiguration(defaultMachineName, defaultRouteCapacity);
  }

  public final static class StateMachineConfigurationBuilder {
    private String name = defaultMachineName;
    private int routeCapacity = defaultRouteCapacity;

    public static StateMachineConfigurationBuilder newBuilder() {
      return new StateMachineConfigurationBuilder();
    }

    public StateMachineConfigurationBuilder name(final String name) {
      this.name = name;
      return this;
    }

    public StateMachineConfigurationBuilder routeCapacity(final int routeCapacity) {
      this.routeCapacity = routeCapacity;
      return this;
    }

    public StateMachineConfiguration build() throws StateMachineException {
      final StateMachineConfiguration config =
          new StateMachineConfiguration(name == null ? null : name.trim(), routeCapacity);
      config.validate();
      return config;
    }

    private StateMachineConfigurationBuilder() {}
  }

  private void validate() throws StateMachineException {
    if (name == null || name.isEmpty() || name.length() > maxMachineNameLength) {
      throw new StateMachineException(StateMachineException.Code.INVALID_MACHINE_NAME);
    }
    if (routeCapacity < 0) {
      throw new StateMachineException(StateMachineException.Code.INVALID_MACHINE_CONFIG,
          "Route capacity cannot be negative: " + routeCapacity);
    }
  }

  @Override
  public String toString() {
    return "StateMachineConfiguration [name=" + name + ", routeCapacity=" + routeCapacity + "]";
  }

  private StateMachineConfiguration(final String name, final int routeCapacity) {
    this.name = name;
    this.routeCapacity = routeCapacity;
  }

}
