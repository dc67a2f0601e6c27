package com.github.flowmachine.runtime;

/**
 * Simple statistics holder for a running flow.
 */
public final class FlowStatistics {
  private final long startMillis = System.currentTimeMillis();
  int eventsEmitted;
  int transitionsTaken;
  int eventsIgnored;
  int stepsCompleted;
  int sequenceLoops;

  public int getEventsEmitted() {
    return eventsEmitted;
  }

  public int getTransitionsTaken() {
    return transitionsTaken;
  }

  public int getEventsIgnored() {
    return eventsIgnored;
  }

  public int getStepsCompleted() {
    return stepsCompleted;
  }

  public int getSequenceLoops() {
    return sequenceLoops;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startMillis;
  }

  void reset() {
    eventsEmitted = 0;
    transitionsTaken = 0;
    eventsIgnored = 0;
    stepsCompleted = 0;
    sequenceLoops = 0;
  }

  @Override
  public String toString() {
    return "FlowStatistics [eventsEmitted=" + eventsEmitted + ", transitionsTaken="
        + transitionsTaken + ", eventsIgnored=" + eventsIgnored + ", stepsCompleted="
        + stepsCompleted + ", sequenceLoops=" + sequenceLoops + ", aliveTimeMillis="
        + getAliveTimeMillis() + "]";
  }
}
