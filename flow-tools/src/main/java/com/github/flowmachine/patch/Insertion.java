package com.github.flowmachine.patch;

/**
 * The edits the host patcher makes, in the order it makes them.
 */
public enum Insertion {
  // import lines for the generated classes, after the imports marker line
  IMPORTS,
  // the runtime instance, at the top of the host class body
  FIELD,
  // flow start, at the top of the init hook
  INIT,
  // per-tick sequencer update, at the top of the update hook
  UPDATE,
  // key to event forwarding, at the top of the input hook
  INPUT;
}
