package com.github.tinyfsm;

/**
 * Unified single exception that's thrown while assembling a state machine. The code enum
 * encapsulates the various misconfiguration conditions. Once built, a machine never throws it:
 * events a state does not care about simply resolve to no transition.
 */
public final class StateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public StateMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public StateMachineException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_STATE("Initial state is null or the state type declares no states"),
    // 2.
    INVALID_CONTEXT("Context is null or its supplier failed to provide one"),
    // 3.
    INVALID_MACHINE_NAME("State machine name cannot be blank or greater than "
        + StateMachineConfiguration.maxMachineNameLength + " characters"),
    // 4.
    INVALID_MACHINE_CONFIG("State machine configuration is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
