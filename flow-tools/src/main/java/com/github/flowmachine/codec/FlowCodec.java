package com.github.flowmachine.codec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.flowmachine.FlowException;
import com.github.flowmachine.FlowException.Code;
import com.github.flowmachine.OperationResult;
import com.github.flowmachine.model.FlowEventTrigger;
import com.github.flowmachine.model.FlowModel;
import com.github.flowmachine.model.FlowSequenceStep;
import com.github.flowmachine.model.FlowState;
import com.github.flowmachine.model.FlowTransition;
import com.github.flowmachine.model.FlowVariable;
import com.github.flowmachine.model.VariableType;

/**
 * Reads and writes flows in the line-oriented flow file format. Every line is one record: a tag
 * followed by pipe-delimited fields.
 *
 * <pre>
 * FLOW|name|version
 * STATE|name|onEnter|onExit|x|y
 * TRANS|fromState|toState|eventName|condition
 * STEP|name|duration|onStart|onUpdate|onEnd|x|y
 * TRIGGER|eventName|key
 * VAR|name|type|value
 * </pre>
 *
 * where type is one of Number, Bool or String.
 *
 * Notes for users:<br>
 * 1. writing replaces '|', newlines and tabs inside fields with '_'. There is no way back, so only
 * fields free of those characters survive a save/load cycle unchanged<br>
 *
 * 2. reading is forgiving: a record with too few fields or an unknown tag is dropped on its own,
 * and a number that does not parse reads as zero. Only a well-formed version other than the current
 * one fails a load; a version field that is not a number reads as the current version<br>
 *
 * 3. {@link #save} and {@link #load} never throw; failures come back in the
 * {@link OperationResult}<br>
 */
public final class FlowCodec {
  private static final Logger logger = LogManager.getLogger(FlowCodec.class.getSimpleName());

  static final String FLOW = "FLOW";
  static final String STATE = "STATE";
  static final String TRANS = "TRANS";
  static final String STEP = "STEP";
  static final String TRIGGER = "TRIGGER";
  static final String VAR = "VAR";

  private static final char separator = '|';

  ///// Text form /////

  public String encode(final FlowModel model) {
    final StringBuilder out = new StringBuilder();
    record(out, FLOW, model.getName(), Integer.toString(model.getVersion()));
    for (final FlowState state : model.getStates()) {
      record(out, STATE, state.getName(), state.getOnEnter(), state.getOnExit(),
          Float.toString(state.getX()), Float.toString(state.getY()));
    }
    for (final FlowTransition transition : model.getTransitions()) {
      record(out, TRANS, Integer.toString(transition.getFromState()),
          Integer.toString(transition.getToState()), transition.getEventName(),
          transition.getCondition());
    }
    for (final FlowSequenceStep step : model.getSteps()) {
      record(out, STEP, step.getName(), Double.toString(step.getDuration()), step.getOnStart(),
          step.getOnUpdate(), step.getOnEnd(), Float.toString(step.getX()),
          Float.toString(step.getY()));
    }
    for (final FlowEventTrigger trigger : model.getTriggers()) {
      record(out, TRIGGER, trigger.getEventName(), trigger.getKey());
    }
    for (final FlowVariable variable : model.getVariables()) {
      record(out, VAR, variable.getName(), variable.getType().getLabel(), valueOf(variable));
    }
    return out.toString();
  }

  public FlowModel decode(final String text) throws FlowException {
    final FlowModel model = new FlowModel();
    if (text == null || text.isEmpty()) {
      return model;
    }
    final String[] lines = text.split("\n", -1);
    for (int lineNumber = 1; lineNumber <= lines.length; lineNumber++) {
      String line = lines[lineNumber - 1];
      if (line.endsWith("\r")) {
        line = line.substring(0, line.length() - 1);
      }
      if (line.trim().isEmpty()) {
        continue;
      }
      final String[] fields = line.split("\\|", -1);
      final String tag = fields[0];
      final int required = requiredFields(tag);
      if (required < 0) {
        logger.warn(String.format("Dropping line %d: unknown record tag %s", lineNumber, tag));
        continue;
      }
      if (fields.length - 1 < required) {
        logger.warn(String.format("Dropping line %d: %s record needs %d fields, found %d",
            lineNumber, tag, required, fields.length - 1));
        continue;
      }
      readRecord(model, tag, fields);
    }
    return model;
  }

  ///// File form /////

  public OperationResult save(final FlowModel model, final Path file) {
    try {
      final Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.write(file, encode(model).getBytes(StandardCharsets.UTF_8));
    } catch (IOException problem) {
      final FlowException error =
          new FlowException(Code.IO_FAILURE, "Failed to save flow to " + file, problem);
      logger.error(error.getMessage(), problem);
      return OperationResult.failure(error);
    }
    logger.info("Saved flow " + model.getName() + " to " + file);
    return OperationResult.success("Saved " + file);
  }

  /**
   * Read the file and, if it decodes, replace the content of target with it. On failure target is
   * left as it was.
   */
  public OperationResult load(final Path file, final FlowModel target) {
    final FlowModel loaded;
    try {
      final String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
      loaded = decode(text);
    } catch (IOException problem) {
      final FlowException error =
          new FlowException(Code.IO_FAILURE, "Failed to load flow from " + file, problem);
      logger.error(error.getMessage(), problem);
      return OperationResult.failure(error);
    } catch (FlowException problem) {
      logger.error("Rejected flow file " + file + ": " + problem.getMessage());
      return OperationResult.failure(problem);
    }
    target.replaceWith(loaded);
    logger.info("Loaded flow " + target);
    return OperationResult.success("Loaded " + file);
  }

  ///// Records /////

  private static int requiredFields(final String tag) {
    switch (tag) {
      case FLOW:
        return 2;
      case STATE:
        return 5;
      case TRANS:
        return 4;
      case STEP:
        return 7;
      case TRIGGER:
        return 2;
      case VAR:
        return 3;
      default:
        return -1;
    }
  }

  private static void readRecord(final FlowModel model, final String tag, final String[] fields)
      throws FlowException {
    switch (tag) {
      case FLOW:
        final Integer version = parseVersion(fields[2]);
        if (version == null) {
          logger.warn(String.format("Malformed version %s in FLOW record, reading as version %d",
              fields[2], FlowModel.CURRENT_VERSION));
        } else if (version != FlowModel.CURRENT_VERSION) {
          throw new FlowException(Code.UNSUPPORTED_VERSION, "Flow file version " + fields[2]
              + " is not supported, expected " + FlowModel.CURRENT_VERSION);
        }
        model.setName(fields[1]);
        model.setVersion(FlowModel.CURRENT_VERSION);
        break;
      case STATE:
        final FlowState state = new FlowState(fields[1], fields[2], fields[3]);
        state.setPosition(parseFloat(fields[4]), parseFloat(fields[5]));
        model.addState(state);
        break;
      case TRANS:
        model.addTransition(new FlowTransition(parseInt(fields[1]), parseInt(fields[2]),
            fields[3], fields[4]));
        break;
      case STEP:
        final FlowSequenceStep step = new FlowSequenceStep(fields[1], parseDouble(fields[2]),
            fields[3], fields[4], fields[5]);
        step.setPosition(parseFloat(fields[6]), parseFloat(fields[7]));
        model.addStep(step);
        break;
      case TRIGGER:
        model.addTrigger(new FlowEventTrigger(fields[1], fields[2]));
        break;
      case VAR:
        model.addVariable(readVariable(fields[1], VariableType.fromLabel(fields[2]), fields[3]));
        break;
      default:
        break;
    }
  }

  private static FlowVariable readVariable(final String name, final VariableType type,
      final String value) {
    switch (type) {
      case BOOL:
        return FlowVariable.bool(name, "true".equalsIgnoreCase(value) || "1".equals(value));
      case STRING:
        return FlowVariable.string(name, value);
      default:
        return FlowVariable.number(name, parseDouble(value));
    }
  }

  private static String valueOf(final FlowVariable variable) {
    switch (variable.getType()) {
      case BOOL:
        return Boolean.toString(variable.getBoolValue());
      case STRING:
        return variable.getStringValue();
      default:
        return Double.toString(variable.getNumberValue());
    }
  }

  private static void record(final StringBuilder out, final String tag, final String... fields) {
    out.append(tag);
    for (final String field : fields) {
      out.append(separator).append(escape(field));
    }
    out.append('\n');
  }

  static String escape(final String field) {
    if (field == null) {
      return "";
    }
    return field.replace('|', '_').replace('\n', '_').replace('\r', '_').replace('\t', '_');
  }

  /**
   * The version number, or null if the field is not an integer.
   */
  private static Integer parseVersion(final String text) {
    try {
      return Integer.valueOf(text.trim());
    } catch (NumberFormatException malformed) {
      return null;
    }
  }

  private static int parseInt(final String text) {
    try {
      return Integer.parseInt(text.trim());
    } catch (NumberFormatException malformed) {
      return 0;
    }
  }

  private static float parseFloat(final String text) {
    try {
      return Float.parseFloat(text.trim());
    } catch (NumberFormatException malformed) {
      return 0.0f;
    }
  }

  private static double parseDouble(final String text) {
    try {
      return Double.parseDouble(text.trim());
    } catch (NumberFormatException malformed) {
      return 0.0;
    }
  }
}
