package com.github.flowmachine.patch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.flowmachine.FlowException;
import com.github.flowmachine.FlowException.Code;
import com.github.flowmachine.generator.GeneratorConfiguration;

/**
 * Wires a generated flow into an existing host source file by textual insertion: imports, a
 * runtime field, a start call in the init hook, an update call in the update hook and key
 * forwarding in the input hook.
 *
 * Notes for users:<br>
 * 1. every insertion checks whether its snippet is already in the file and does nothing if so, so
 * patching the same file again leaves it byte-identical<br>
 *
 * 2. every insertion is located by its own marker. A missing marker skips that insertion only and
 * is reported as a warning, the others still go in<br>
 *
 * 3. markers only match in code: text inside comments and string literals is passed over, and a
 * marker does not match as the prefix of a longer name ({@code class Game} does not match
 * {@code class GameState}). The imports marker must also start its line<br>
 *
 * 4. only the presence of the inserted lines is checked. Edits made to them by hand are not
 * tracked and a changed line is inserted again<br>
 */
public final class HostPatcher {
  private static final Logger logger = LogManager.getLogger(HostPatcher.class.getSimpleName());

  private static final String nestedIndent = "  ";

  private final HostPatchConfiguration config;

  public HostPatcher(final HostPatchConfiguration config) {
    this.config = config;
  }

  public HostPatchConfiguration getConfiguration() {
    return config;
  }

  /**
   * Patch the host file in place. The file is rewritten only if its text changed.
   */
  public PatchResult patch(final Path hostFile) {
    final String original;
    try {
      original = new String(Files.readAllBytes(hostFile), StandardCharsets.UTF_8);
    } catch (IOException problem) {
      final FlowException error =
          new FlowException(Code.IO_FAILURE, "Failed to read host file " + hostFile, problem);
      logger.error(error.getMessage(), problem);
      return PatchResult.failure(error);
    }
    final PatchResult patched = patch(original);
    if (patched.isChanged()) {
      try {
        Files.write(hostFile, patched.getPatchedText().getBytes(StandardCharsets.UTF_8));
      } catch (IOException problem) {
        final FlowException error =
            new FlowException(Code.IO_FAILURE, "Failed to write host file " + hostFile, problem);
        logger.error(error.getMessage(), problem);
        return PatchResult.failure(error);
      }
    }
    logger.info("Patched host file " + hostFile + ": " + patched.getOutcomes());
    return patched;
  }

  /**
   * Patch host source text. Never fails; skipped insertions show up in the result.
   */
  public PatchResult patch(final String hostSource) {
    final String lineBreak = hostSource.contains("\r\n") ? "\r\n" : "\n";
    final Map<Insertion, InsertionOutcome> outcomes = new EnumMap<>(Insertion.class);
    String text = hostSource;

    final Edit imports = insertImports(text, lineBreak);
    outcomes.put(Insertion.IMPORTS, imports.outcome);
    text = imports.text;

    final Edit field = insertInBlock(text, config.getClassMarker(), fieldSnippet(), lineBreak);
    outcomes.put(Insertion.FIELD, field.outcome);
    text = field.text;

    final Edit init = insertInBlock(text, config.getInitMarker(), initSnippet(), lineBreak);
    outcomes.put(Insertion.INIT, init.outcome);
    text = init.text;

    final Edit update = insertInBlock(text, config.getUpdateMarker(), updateSnippet(), lineBreak);
    outcomes.put(Insertion.UPDATE, update.outcome);
    text = update.text;

    final Edit input = insertInBlock(text, config.getInputMarker(), inputSnippet(), lineBreak);
    outcomes.put(Insertion.INPUT, input.outcome);
    text = input.text;

    for (final Map.Entry<Insertion, InsertionOutcome> outcome : outcomes.entrySet()) {
      if (outcome.getValue() == InsertionOutcome.MARKER_NOT_FOUND) {
        logger.warn("Skipped " + outcome.getKey() + " insertion, marker not found");
      }
    }
    final boolean changed = !text.equals(hostSource);
    return new PatchResult(true, changed ? "Patched host source" : "Host source already patched",
        null, text, changed, outcomes);
  }

  ///// Snippets /////

  List<String> importSnippets() {
    final GeneratorConfiguration generated = config.getGeneratorConfiguration();
    final List<String> imports = new ArrayList<>();
    imports.add("import " + generated.getPackageName() + "." + generated.getRuntimeClassName()
        + ";");
    imports.add("import " + generated.getPackageName() + "." + generated.getTriggerClassName()
        + ";");
    return imports;
  }

  String fieldSnippet() {
    final String runtime = config.getGeneratorConfiguration().getRuntimeClassName();
    return "private final " + runtime + " " + config.getFieldName() + " = new " + runtime + "();";
  }

  String initSnippet() {
    return config.getFieldName() + ".start();";
  }

  String updateSnippet() {
    return config.getFieldName() + ".update(" + config.getDeltaName() + ");";
  }

  String inputSnippet() {
    return config.getGeneratorConfiguration().getTriggerClassName() + ".forward("
        + config.getFieldName() + ", " + config.getKeyName() + ");";
  }

  ///// Text surgery /////

  private Edit insertImports(final String text, final String lineBreak) {
    final List<String> missing = new ArrayList<>();
    for (final String snippet : importSnippets()) {
      if (!text.contains(snippet)) {
        missing.add(snippet);
      }
    }
    if (missing.isEmpty()) {
      return new Edit(text, InsertionOutcome.ALREADY_PRESENT);
    }
    final int marker = findMarker(text, config.getImportsMarker(), true);
    if (marker < 0) {
      return new Edit(text, InsertionOutcome.MARKER_NOT_FOUND);
    }
    final StringBuilder lines = new StringBuilder();
    for (final String snippet : missing) {
      lines.append(snippet).append(lineBreak);
    }
    final int lineEnd = text.indexOf('\n', marker);
    if (lineEnd < 0) {
      // marker sits on the last line
      return new Edit(text + lineBreak + lines, InsertionOutcome.INSERTED);
    }
    final int insertAt = lineEnd + 1;
    return new Edit(text.substring(0, insertAt) + lines + text.substring(insertAt),
        InsertionOutcome.INSERTED);
  }

  private static Edit insertInBlock(final String text, final String marker, final String snippet,
      final String lineBreak) {
    if (text.contains(snippet)) {
      return new Edit(text, InsertionOutcome.ALREADY_PRESENT);
    }
    final int markerAt = findMarker(text, marker, false);
    if (markerAt < 0) {
      return new Edit(text, InsertionOutcome.MARKER_NOT_FOUND);
    }
    final int brace = text.indexOf('{', markerAt);
    if (brace < 0) {
      return new Edit(text, InsertionOutcome.MARKER_NOT_FOUND);
    }
    final String line = lineBreak + indentationOf(text, markerAt) + nestedIndent + snippet;
    return new Edit(text.substring(0, brace + 1) + line + text.substring(brace + 1),
        InsertionOutcome.INSERTED);
  }

  /**
   * Offset of the first occurrence of marker in code, or -1. Comments, string and char literals
   * and text blocks are skipped.
   */
  static int findMarker(final String text, final String marker, final boolean atLineStart) {
    int at = 0;
    while (at < text.length()) {
      if (text.startsWith("//", at)) {
        final int lineEnd = text.indexOf('\n', at);
        at = lineEnd < 0 ? text.length() : lineEnd;
      } else if (text.startsWith("/*", at)) {
        final int commentEnd = text.indexOf("*/", at + 2);
        if (commentEnd < 0) {
          return -1;
        }
        at = commentEnd + 2;
      } else if (text.charAt(at) == '"' || text.charAt(at) == '\'') {
        at = skipLiteral(text, at);
      } else if (text.startsWith(marker, at) && isWholeMarker(text, marker, at)
          && (!atLineStart || startsLine(text, at))) {
        return at;
      } else {
        at++;
      }
    }
    return -1;
  }

  /**
   * Offset just past the literal opening at the given offset.
   */
  private static int skipLiteral(final String text, final int open) {
    if (text.startsWith("\"\"\"", open)) {
      final int close = text.indexOf("\"\"\"", open + 3);
      return close < 0 ? text.length() : close + 3;
    }
    final char quote = text.charAt(open);
    int at = open + 1;
    while (at < text.length()) {
      final char c = text.charAt(at);
      if (c == '\\') {
        at += 2;
      } else if (c == quote || c == '\n') {
        return at + 1;
      } else {
        at++;
      }
    }
    return text.length();
  }

  private static boolean isWholeMarker(final String text, final String marker, final int at) {
    if (at > 0 && Character.isJavaIdentifierPart(marker.charAt(0))
        && Character.isJavaIdentifierPart(text.charAt(at - 1))) {
      return false;
    }
    final int end = at + marker.length();
    return end >= text.length()
        || !Character.isJavaIdentifierPart(marker.charAt(marker.length() - 1))
        || !Character.isJavaIdentifierPart(text.charAt(end));
  }

  private static boolean startsLine(final String text, final int at) {
    for (int i = at - 1; i >= 0 && text.charAt(i) != '\n'; i--) {
      if (text.charAt(i) != ' ' && text.charAt(i) != '\t') {
        return false;
      }
    }
    return true;
  }

  /**
   * Leading whitespace of the line holding the given offset.
   */
  private static String indentationOf(final String text, final int offset) {
    final int lineStart = text.lastIndexOf('\n', offset) + 1;
    int end = lineStart;
    while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
      end++;
    }
    return text.substring(lineStart, end);
  }

  private static final class Edit {
    private final String text;
    private final InsertionOutcome outcome;

    private Edit(final String text, final InsertionOutcome outcome) {
      this.text = text;
      this.outcome = outcome;
    }
  }
}
