package com.github.tinyfsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.fail;

import java.util.Optional;

import org.junit.Test;

import com.github.tinyfsm.StateMachine.StateMachineBuilder;
import com.github.tinyfsm.StateMachineConfiguration.StateMachineConfigurationBuilder;
import com.github.tinyfsm.StateMachineException.Code;
import com.github.tinyfsm.StateMachineTest.DoorContext;
import com.github.tinyfsm.StateMachineTest.DoorEvent;
import com.github.tinyfsm.StateMachineTest.DoorState;

/**
 * Tests for assembling machines and their configuration.
 */
public class StateMachineConfigurationTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testDefaults() throws StateMachineException {
    final StateMachineConfiguration config = StateMachineConfigurationBuilder.newBuilder().build();
    assertEquals("fsm", config.getName());
    assertEquals(100, config.getRouteCapacity());
    assertEquals(config.toString(), StateMachineConfiguration.defaults().toString());
  }

  @Test
  public void testNameIsTrimmed() throws StateMachineException {
    final StateMachineConfiguration config =
        StateMachineConfigurationBuilder.newBuilder().name("  turnstile ").build();
    assertEquals("turnstile", config.getName());
  }

  @Test
  public void testInvalidNames() {
    for (final String name : new String[] {null, "", "   ", "a-name-longer-than-twenty"}) {
      try {
        StateMachineConfigurationBuilder.newBuilder().name(name).build();
        fail("Expected name '" + name + "' to be rejected");
      } catch (StateMachineException expected) {
        assertEquals(Code.INVALID_MACHINE_NAME, expected.getCode());
      }
    }
  }

  @Test
  public void testNegativeRouteCapacity() {
    try {
      StateMachineConfigurationBuilder.newBuilder().routeCapacity(-1).build();
      fail("Expected negative route capacity to be rejected");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_MACHINE_CONFIG, expected.getCode());
    }
  }

  @Test
  public void testMissingInitialState() {
    try {
      StateMachineBuilder.<DoorState, DoorEvent, DoorContext>newBuilder(null)
          .context(new DoorContext()).build();
      fail("Expected null initial state to be rejected");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_STATE, expected.getCode());
    }
  }

  @Test
  public void testStateTypeWithoutStates() {
    try {
      StateMachineBuilder.forStates(NoState.class);
      fail("Expected an empty state enum to be rejected");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_STATE, expected.getCode());
    }
  }

  @Test
  public void testMissingContext() {
    try {
      StateMachineBuilder.newBuilder(DoorState.CLOSED).build();
      fail("Expected missing context to be rejected");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_CONTEXT, expected.getCode());
    }
  }

  @Test
  public void testFailingContextSupplier() {
    try {
      StateMachineBuilder.newBuilder(DoorState.CLOSED).contextSupplier(() -> {
        throw new IllegalStateException("no door");
      }).build();
      fail("Expected failing context supplier to be rejected");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_CONTEXT, expected.getCode());
      assertNotNull(expected.getCause());
    }
  }

  @Test
  public void testNullConfiguration() {
    try {
      new StateMachineImpl<>(DoorState.CLOSED, new DoorContext(), null);
      fail("Expected null configuration to be rejected");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_MACHINE_CONFIG, expected.getCode());
    }
  }

  @Test
  public void testLastContextWins() throws StateMachineException {
    final DoorContext context = new DoorContext();
    final StateMachine<DoorState, DoorEvent, DoorContext> machine =
        StateMachineBuilder.newBuilder(DoorState.CLOSED).contextSupplier(DoorContext::new)
            .context(context).build();
    assertEquals(context, machine.getContext());
  }

  public static enum NoState implements StateBehavior<NoState, DoorEvent, DoorContext> {
    ;

    @Override
    public Optional<NoState> handle(final DoorEvent event, final DoorContext context) {
      return Optional.empty();
    }
  }

}
