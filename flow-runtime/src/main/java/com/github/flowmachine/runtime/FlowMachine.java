package com.github.flowmachine.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleConsumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.flowmachine.FlowException;

/**
 * Runtime of one flow: an event-driven Finite State Machine and a looping timed sequencer that
 * share a variable store and an action registry. Generated flow classes extend this and register
 * their tables from the constructor.
 *
 * Notes for users:<br>
 * 1. this instance is NOT thread-safe. It is driven from the host's frame loop: {@link #update}
 * once per frame and {@link #emit} once per input event, all on the same thread<br>
 *
 * 2. the state machine only moves on {@link #emit}; transitions are scanned in declaration order
 * and the first one that leaves the current state on that event with a passing guard is taken.
 * Later candidates are never looked at<br>
 *
 * 3. the sequencer moves on every {@link #update}, independently of the state machine. It advances
 * at most one step per tick and wraps around after the last step forever<br>
 *
 * 4. hooks are plain callbacks; a null hook does nothing. Hooks may call back into {@link #emit}<br>
 *
 * 5. it is designed to not be singleton within a process, so, if there's a desire to have many
 * flows running, just create as many as needed<br>
 */
public class FlowMachine {
  private static final Logger logger = LogManager.getLogger(FlowMachine.class.getSimpleName());

  private final List<StateEntry> states = new ArrayList<>();
  private final List<TransitionEntry> transitions = new ArrayList<>();
  private final List<StepEntry> steps = new ArrayList<>();

  private final ActionRegistry actions;
  private final VariableStore variables = new VariableStore();
  private final FlowStatistics statistics = new FlowStatistics();

  private int currentState;
  private int currentStep;
  private double stepTimer;

  public FlowMachine() {
    this(new ActionRegistry());
  }

  public FlowMachine(final ActionRegistry actions) {
    if (actions == null) {
      throw new IllegalArgumentException("ActionRegistry cannot be null");
    }
    this.actions = actions;
  }

  ///// Table registration /////

  public final FlowMachine addState(final String name, final Runnable onEnter,
      final Runnable onExit) {
    states.add(new StateEntry(name, onEnter, onExit));
    return this;
  }

  /**
   * Both endpoints must already be registered and the condition must parse.
   *
   * @throws IllegalArgumentException otherwise
   */
  public final FlowMachine addTransition(final int fromState, final int toState,
      final String eventName, final String condition) {
    if (fromState < 0 || fromState >= states.size() || toState < 0 || toState >= states.size()) {
      throw new IllegalArgumentException(String.format(
          "Transition %d->%d references a state outside 0..%d", fromState, toState,
          states.size() - 1));
    }
    final TransitionGuard guard;
    try {
      guard = TransitionGuard.compile(condition);
    } catch (FlowException problem) {
      throw new IllegalArgumentException(problem.getMessage(), problem);
    }
    transitions.add(new TransitionEntry(fromState, toState, eventName, guard));
    return this;
  }

  public final FlowMachine addStep(final String name, final double duration,
      final Runnable onStart, final DoubleConsumer onUpdate, final Runnable onEnd) {
    if (duration < 0.0 || Double.isNaN(duration)) {
      throw new IllegalArgumentException("Step " + name + " has invalid duration " + duration);
    }
    steps.add(new StepEntry(name, duration, onStart, onUpdate, onEnd));
    return this;
  }

  ///// Driving the flow /////

  /**
   * Reset both machines to their first entries and fire the entry hooks.
   */
  public void start() {
    currentState = 0;
    currentStep = 0;
    stepTimer = 0.0;
    statistics.reset();
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Starting flow with %d states, %d transitions, %d steps",
          states.size(), transitions.size(), steps.size()));
    }
    if (!states.isEmpty()) {
      fire(states.get(0).onEnter);
    }
    if (!steps.isEmpty()) {
      fire(steps.get(0).onStart);
    }
  }

  /**
   * Offer an event to the state machine. Returns true iff a transition was taken.
   */
  public boolean emit(final String eventName) {
    statistics.eventsEmitted++;
    if (eventName == null || states.isEmpty()) {
      statistics.eventsIgnored++;
      return false;
    }
    for (final TransitionEntry transition : transitions) {
      if (transition.fromState != currentState || !transition.eventName.equals(eventName)) {
        continue;
      }
      if (!transition.guard.test(actions, variables)) {
        continue;
      }
      final StateEntry from = states.get(currentState);
      final StateEntry to = states.get(transition.toState);
      fire(from.onExit);
      currentState = transition.toState;
      fire(to.onEnter);
      statistics.transitionsTaken++;
      if (logger.isDebugEnabled()) {
        logger.debug(String.format("Event %s moved flow %s->%s", eventName, from.name, to.name));
      }
      return true;
    }
    statistics.eventsIgnored++;
    return false;
  }

  /**
   * Advance the sequencer by dt seconds. A NaN or infinite dt is dropped without touching the step
   * timer or calling any hook.
   */
  public void update(final double dt) {
    if (steps.isEmpty()) {
      return;
    }
    if (Double.isNaN(dt) || Double.isInfinite(dt)) {
      logger.warn("Ignoring non-finite frame delta " + dt + " in step "
          + steps.get(currentStep).name);
      return;
    }
    stepTimer += dt;
    final StepEntry step = steps.get(currentStep);
    if (step.onUpdate != null) {
      step.onUpdate.accept(dt);
    }
    if (stepTimer >= step.duration) {
      fire(step.onEnd);
      statistics.stepsCompleted++;
      currentStep = (currentStep + 1) % steps.size();
      if (currentStep == 0) {
        statistics.sequenceLoops++;
      }
      stepTimer = 0.0;
      fire(steps.get(currentStep).onStart);
    }
  }

  ///// Introspection /////

  public int getCurrentState() {
    return currentState;
  }

  /**
   * Name of the current state, or null if the flow has no states.
   */
  public String getCurrentStateName() {
    return states.isEmpty() ? null : states.get(currentState).name;
  }

  public int getCurrentStep() {
    return currentStep;
  }

  public String getCurrentStepName() {
    return steps.isEmpty() ? null : steps.get(currentStep).name;
  }

  public double getStepTimer() {
    return stepTimer;
  }

  public int getStateCount() {
    return states.size();
  }

  public int getTransitionCount() {
    return transitions.size();
  }

  public int getStepCount() {
    return steps.size();
  }

  public VariableStore variables() {
    return variables;
  }

  public ActionRegistry actions() {
    return actions;
  }

  public FlowStatistics getStatistics() {
    return statistics;
  }

  private static void fire(final Runnable hook) {
    if (hook != null) {
      hook.run();
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + " [currentState=" + getCurrentStateName()
        + ", currentStep=" + getCurrentStepName() + ", stepTimer=" + stepTimer + ", "
        + statistics + "]";
  }

  private static final class StateEntry {
    private final String name;
    private final Runnable onEnter;
    private final Runnable onExit;

    private StateEntry(final String name, final Runnable onEnter, final Runnable onExit) {
      this.name = name;
      this.onEnter = onEnter;
      this.onExit = onExit;
    }
  }

  private static final class TransitionEntry {
    private final int fromState;
    private final int toState;
    private final String eventName;
    private final TransitionGuard guard;

    private TransitionEntry(final int fromState, final int toState, final String eventName,
        final TransitionGuard guard) {
      this.fromState = fromState;
      this.toState = toState;
      this.eventName = eventName == null ? "" : eventName;
      this.guard = guard;
    }
  }

  private static final class StepEntry {
    private final String name;
    private final double duration;
    private final Runnable onStart;
    private final DoubleConsumer onUpdate;
    private final Runnable onEnd;

    private StepEntry(final String name, final double duration, final Runnable onStart,
        final DoubleConsumer onUpdate, final Runnable onEnd) {
      this.name = name;
      this.duration = duration;
      this.onStart = onStart;
      this.onUpdate = onUpdate;
      this.onEnd = onEnd;
    }
  }
}
