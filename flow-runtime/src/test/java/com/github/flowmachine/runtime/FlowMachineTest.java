package com.github.flowmachine.runtime;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

/**
 * Tests to maintain the sanity and correctness of the flow state machine and sequencer.
 */
public class FlowMachineTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Logger logger = LogManager.getLogger(FlowMachineTest.class.getSimpleName());

  private final List<String> fired = new ArrayList<>();

  @Test
  public void testTransitionFiresExitThenEnter() {
    // 1. prep the machine: A -go-> B
    final FlowMachine machine = new FlowMachine();
    machine.addState("A", record("A.onEnter"), record("A.onExit"));
    machine.addState("B", record("B.onEnter"), record("B.onExit"));
    machine.addTransition(0, 1, "go", "");

    // 2. start lands on state 0
    machine.start();
    assertEquals(0, machine.getCurrentState());
    assertEquals(Arrays.asList("A.onEnter"), fired);

    // 3. emit moves to B, hooks fire once each and in order
    fired.clear();
    assertTrue(machine.emit("go"));
    assertEquals(1, machine.getCurrentState());
    assertEquals("B", machine.getCurrentStateName());
    assertEquals(Arrays.asList("A.onExit", "B.onEnter"), fired);
    logger.info(machine);
  }

  @Test
  public void testFirstDeclaredTransitionWins() {
    final FlowMachine machine = new FlowMachine();
    machine.addState("idle", null, null);
    machine.addState("walk", record("walk"), null);
    machine.addState("run", record("run"), null);
    machine.addTransition(0, 1, "move", "");
    machine.addTransition(0, 2, "move", "true");
    machine.start();

    assertTrue(machine.emit("move"));
    assertEquals(1, machine.getCurrentState());
    assertEquals(Arrays.asList("walk"), fired);
  }

  @Test
  public void testFailingGuardFallsThroughToNextCandidate() {
    final FlowMachine machine = new FlowMachine();
    machine.addState("idle", null, null);
    machine.addState("walk", null, null);
    machine.addState("run", null, null);
    machine.addTransition(0, 2, "move", "speed > 5");
    machine.addTransition(0, 1, "move", "");
    machine.start();

    machine.variables().setNumber("speed", 2);
    assertTrue(machine.emit("move"));
    assertEquals(1, machine.getCurrentState());
  }

  @Test
  public void testGuardSeesVariables() {
    final FlowMachine machine = new FlowMachine();
    machine.addState("alive", null, null);
    machine.addState("dead", null, null);
    machine.addTransition(0, 1, "hit", "hp <= 0 && !invulnerable");
    machine.start();

    machine.variables().setNumber("hp", 3);
    machine.variables().setBool("invulnerable", false);
    assertFalse(machine.emit("hit"));
    assertEquals(0, machine.getCurrentState());

    machine.variables().setNumber("hp", 0);
    machine.variables().setBool("invulnerable", true);
    assertFalse(machine.emit("hit"));

    machine.variables().setBool("invulnerable", false);
    assertTrue(machine.emit("hit"));
    assertEquals(1, machine.getCurrentState());
  }

  @Test
  public void testBareIdentifierGuardUsesConditionCallback() {
    final boolean[] doorOpen = {false};
    final ActionRegistry actions = new ActionRegistry();
    actions.registerCondition("doorOpen", () -> doorOpen[0]);
    final FlowMachine machine = new FlowMachine(actions);
    machine.addState("inside", null, null);
    machine.addState("outside", null, null);
    machine.addTransition(0, 1, "leave", "doorOpen");
    machine.start();

    assertFalse(machine.emit("leave"));
    doorOpen[0] = true;
    assertTrue(machine.emit("leave"));
  }

  @Test
  public void testUnmatchedEventIsNoop() {
    final FlowMachine machine = new FlowMachine();
    machine.addState("A", null, record("A.onExit"));
    machine.addState("B", null, null);
    machine.addTransition(1, 0, "back", "");
    machine.start();

    assertFalse(machine.emit("back"));
    assertFalse(machine.emit("unknown"));
    assertFalse(machine.emit(null));
    assertEquals(0, machine.getCurrentState());
    assertTrue(fired.isEmpty());
    assertEquals(3, machine.getStatistics().getEventsIgnored());
  }

  @Test
  public void testSelfTransitionRefiresHooks() {
    final FlowMachine machine = new FlowMachine();
    machine.addState("A", record("enter"), record("exit"));
    machine.addTransition(0, 0, "again", "");
    machine.start();
    fired.clear();

    assertTrue(machine.emit("again"));
    assertEquals(Arrays.asList("exit", "enter"), fired);
  }

  @Test
  public void testNoStatesIsInert() {
    final FlowMachine machine = new FlowMachine();
    machine.start();
    assertFalse(machine.emit("anything"));
    assertNull(machine.getCurrentStateName());
  }

  @Test
  public void testSequencerLoopsForever() {
    // 1. three one-second steps
    final FlowMachine machine = new FlowMachine();
    machine.addStep("s0", 1.0, record("s0.start"), null, record("s0.end"));
    machine.addStep("s1", 1.0, record("s1.start"), null, null);
    machine.addStep("s2", 1.0, record("s2.start"), null, null);

    // 2. start fires step 0
    machine.start();
    assertEquals(0, machine.getCurrentStep());

    // 3. three full ticks wrap back around to step 0
    machine.update(1.0);
    assertEquals(1, machine.getCurrentStep());
    machine.update(1.0);
    assertEquals(2, machine.getCurrentStep());
    machine.update(1.0);
    assertEquals(0, machine.getCurrentStep());

    assertEquals(2, count("s0.start"));
    assertEquals(1, count("s0.end"));
    assertEquals(Arrays.asList("s0.start", "s0.end", "s1.start", "s2.start", "s0.start"), fired);
    assertEquals(3, machine.getStatistics().getStepsCompleted());
    assertEquals(1, machine.getStatistics().getSequenceLoops());
  }

  @Test
  public void testStepWaitsForItsDuration() {
    final List<Double> deltas = new ArrayList<>();
    final FlowMachine machine = new FlowMachine();
    machine.addStep("wait", 1.0, null, dt -> deltas.add(dt), record("wait.end"));
    machine.addStep("next", 5.0, record("next.start"), null, null);
    machine.start();

    machine.update(0.25);
    machine.update(0.5);
    assertEquals(0, machine.getCurrentStep());
    assertEquals(0.75, machine.getStepTimer(), 1e-9);
    assertTrue(fired.isEmpty());

    machine.update(0.25);
    assertEquals(1, machine.getCurrentStep());
    assertEquals(0.0, machine.getStepTimer(), 0.0);
    assertEquals(Arrays.asList(0.25, 0.5, 0.25), deltas);
    assertEquals(Arrays.asList("wait.end", "next.start"), fired);
  }

  @Test
  public void testOneAdvancePerTick() {
    final FlowMachine machine = new FlowMachine();
    machine.addStep("a", 0.1, null, null, null);
    machine.addStep("b", 0.1, null, null, null);
    machine.addStep("c", 0.1, null, null, null);
    machine.start();

    machine.update(10.0);
    assertEquals(1, machine.getCurrentStep());
    assertEquals("b", machine.getCurrentStepName());
  }

  @Test
  public void testNonFiniteDeltaIsIgnored() {
    final List<Double> deltas = new ArrayList<>();
    final FlowMachine machine = new FlowMachine();
    machine.addStep("a", 1.0, null, dt -> deltas.add(dt), record("a.end"));
    machine.addStep("b", 1.0, record("b.start"), null, null);
    machine.start();

    machine.update(0.5);
    machine.update(Double.NaN);
    machine.update(Double.POSITIVE_INFINITY);
    assertEquals(0.5, machine.getStepTimer(), 0.0);
    assertEquals(0, machine.getCurrentStep());

    // the sequencer keeps going afterwards
    machine.update(0.5);
    assertEquals(1, machine.getCurrentStep());
    assertEquals(Arrays.asList(0.5, 0.5), deltas);
    assertEquals(Arrays.asList("a.end", "b.start"), fired);
  }

  @Test
  public void testZeroDurationStepAdvancesEveryTick() {
    final FlowMachine machine = new FlowMachine();
    machine.addStep("flash", 0.0, record("flash"), null, null);
    machine.start();
    machine.update(0.0);
    machine.update(0.0);
    assertEquals(0, machine.getCurrentStep());
    assertEquals(3, count("flash"));
  }

  @Test
  public void testNoStepsIsInert() {
    final FlowMachine machine = new FlowMachine();
    machine.addState("only", null, null);
    machine.start();
    machine.update(1.0);
    assertEquals(0, machine.getCurrentStep());
    assertEquals(0.0, machine.getStepTimer(), 0.0);
    assertNull(machine.getCurrentStepName());
  }

  @Test
  public void testStepHookMayEmit() {
    final FlowMachine machine = new FlowMachine();
    machine.addState("waiting", null, null);
    machine.addState("timedOut", record("timedOut"), null);
    machine.addTransition(0, 1, "timeout", "");
    machine.addStep("timer", 2.0, null, null, () -> machine.emit("timeout"));
    machine.start();

    machine.update(1.0);
    assertEquals(0, machine.getCurrentState());
    machine.update(1.0);
    assertEquals(1, machine.getCurrentState());
    assertEquals(Arrays.asList("timedOut"), fired);
  }

  @Test
  public void testStartResets() {
    final FlowMachine machine = new FlowMachine();
    machine.addState("A", null, null);
    machine.addState("B", null, null);
    machine.addTransition(0, 1, "go", "");
    machine.addStep("s0", 1.0, null, null, null);
    machine.addStep("s1", 1.0, null, null, null);
    machine.start();
    machine.emit("go");
    machine.update(1.0);

    machine.start();
    assertEquals(0, machine.getCurrentState());
    assertEquals(0, machine.getCurrentStep());
    assertEquals(0, machine.getStatistics().getTransitionsTaken());
  }

  @Test
  public void testRejectsDanglingTransition() {
    final FlowMachine machine = new FlowMachine();
    machine.addState("A", null, null);
    try {
      machine.addTransition(0, 1, "go", "");
      fail("expected transition to missing state to be rejected");
    } catch (IllegalArgumentException expected) {
      logger.info(expected.getMessage());
    }
    assertEquals(0, machine.getTransitionCount());
  }

  @Test
  public void testRejectsUnparsableCondition() {
    final FlowMachine machine = new FlowMachine();
    machine.addState("A", null, null);
    machine.addState("B", null, null);
    try {
      machine.addTransition(0, 1, "go", "a && (b");
      fail("expected bad condition to be rejected");
    } catch (IllegalArgumentException expected) {
      assertTrue(expected.getMessage().contains("Expected ')'"));
    }
  }

  private Runnable record(final String label) {
    return () -> fired.add(label);
  }

  private int count(final String label) {
    int count = 0;
    for (final String entry : fired) {
      if (entry.equals(label)) {
        count++;
      }
    }
    return count;
  }
}
