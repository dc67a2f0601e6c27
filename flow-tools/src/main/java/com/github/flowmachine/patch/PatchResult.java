package com.github.flowmachine.patch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.github.flowmachine.FlowException;

/**
 * Outcome of patching one host source. A result can be successful while some insertions were
 * skipped because their markers are missing; check {@link #getOutcomes()} or
 * {@link #getWarnings()} for partial success.
 */
public final class PatchResult {
  private final boolean successful;
  private final String description;
  private final FlowException error;
  private final String patchedText;
  private final boolean changed;
  private final Map<Insertion, InsertionOutcome> outcomes;

  PatchResult(final boolean successful, final String description, final FlowException error,
      final String patchedText, final boolean changed,
      final Map<Insertion, InsertionOutcome> outcomes) {
    this.successful = successful;
    this.description = description;
    this.error = error;
    this.patchedText = patchedText;
    this.changed = changed;
    this.outcomes = outcomes == null ? new EnumMap<>(Insertion.class) : new EnumMap<>(outcomes);
  }

  static PatchResult failure(final FlowException error) {
    return new PatchResult(false, error.getMessage(), error, null, false, null);
  }

  public boolean isSuccessful() {
    return successful;
  }

  public String getDescription() {
    return description;
  }

  public FlowException getError() {
    return error;
  }

  /**
   * The host text after patching, or null if the host could not be read.
   */
  public String getPatchedText() {
    return patchedText;
  }

  public boolean isChanged() {
    return changed;
  }

  public Map<Insertion, InsertionOutcome> getOutcomes() {
    return Collections.unmodifiableMap(outcomes);
  }

  public InsertionOutcome getOutcome(final Insertion insertion) {
    return outcomes.get(insertion);
  }

  public List<String> getWarnings() {
    final List<String> warnings = new ArrayList<>();
    for (final Map.Entry<Insertion, InsertionOutcome> entry : outcomes.entrySet()) {
      if (entry.getValue() == InsertionOutcome.MARKER_NOT_FOUND) {
        warnings.add("Skipped " + entry.getKey() + ": marker not found");
      }
    }
    return warnings;
  }

  @Override
  public String toString() {
    return "PatchResult [successful=" + successful + ", changed=" + changed + ", outcomes="
        + outcomes + ", description=" + description + ", error=" + error + "]";
  }
}
