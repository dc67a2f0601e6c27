package com.github.flowmachine.patch;

public enum InsertionOutcome {
  INSERTED,
  // the snippet was found in the file already
  ALREADY_PRESENT,
  // soft failure, only this insertion was skipped
  MARKER_NOT_FOUND;
}
