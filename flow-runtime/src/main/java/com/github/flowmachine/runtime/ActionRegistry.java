package com.github.flowmachine.runtime;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleConsumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Name-keyed callbacks that generated flow code forwards its hooks to. The host program populates
 * it before the first {@code update} or {@code emit}. Each machine owns its own registry; invoking a
 * name that was never registered is a no-op.
 */
public final class ActionRegistry {
  private static final Logger logger = LogManager.getLogger(ActionRegistry.class.getSimpleName());

  private final Map<String, Runnable> actions = new HashMap<>();
  private final Map<String, DoubleConsumer> updateActions = new HashMap<>();
  private final Map<String, BooleanSupplier> conditions = new HashMap<>();
  private int missedInvocations;

  public ActionRegistry register(final String name, final Runnable action) {
    actions.put(name, action);
    return this;
  }

  public ActionRegistry registerUpdate(final String name, final DoubleConsumer action) {
    updateActions.put(name, action);
    return this;
  }

  public ActionRegistry registerCondition(final String name, final BooleanSupplier condition) {
    conditions.put(name, condition);
    return this;
  }

  /**
   * Invoke the action registered under the name. Returns false if there is none.
   */
  public boolean run(final String name) {
    final Runnable action = actions.get(name);
    if (action == null) {
      missed(name);
      return false;
    }
    action.run();
    return true;
  }

  /**
   * Invoke the per-tick action registered under the name, falling back to a plain action of the
   * same name. Returns false if neither exists.
   */
  public boolean update(final String name, final double dt) {
    final DoubleConsumer action = updateActions.get(name);
    if (action != null) {
      action.accept(dt);
      return true;
    }
    return run(name);
  }

  public Optional<BooleanSupplier> findCondition(final String name) {
    return Optional.ofNullable(conditions.get(name));
  }

  public int getMissedInvocations() {
    return missedInvocations;
  }

  private void missed(final String name) {
    missedInvocations++;
    if (logger.isDebugEnabled()) {
      logger.debug("No action registered for hook " + name);
    }
  }

  @Override
  public String toString() {
    return "ActionRegistry [actions=" + actions.keySet() + ", updateActions="
        + updateActions.keySet() + ", conditions=" + conditions.keySet() + ", missedInvocations="
        + missedInvocations + "]";
  }
}
