package com.github.flowmachine.generator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.flowmachine.FlowException;
import com.github.flowmachine.FlowException.Code;
import com.github.flowmachine.OperationResult;
import com.github.flowmachine.model.FlowModel;

/**
 * Generates a flow's sources and writes them into an output directory, replacing whatever an
 * earlier export left there. Failures are reported in the result and never thrown.
 */
public final class FlowExporter {
  private static final Logger logger = LogManager.getLogger(FlowExporter.class.getSimpleName());

  private final RuntimeGenerator generator;

  public FlowExporter() {
    this(new RuntimeGenerator());
  }

  public FlowExporter(final RuntimeGenerator generator) {
    this.generator = generator;
  }

  public OperationResult export(final FlowModel model, final Path outputDir) {
    final GeneratedSources sources;
    try {
      sources = generator.generate(model);
    } catch (FlowException problem) {
      logger.error("Cannot export flow " + model.getName() + ": " + problem.getMessage());
      return OperationResult.failure(problem);
    }
    final Path runtimeFile = outputDir.resolve(sources.getRuntimeFileName());
    final Path triggerFile = outputDir.resolve(sources.getTriggerFileName());
    try {
      Files.createDirectories(outputDir);
      Files.write(runtimeFile, sources.getRuntimeSource().getBytes(StandardCharsets.UTF_8));
      Files.write(triggerFile, sources.getTriggerSource().getBytes(StandardCharsets.UTF_8));
    } catch (IOException problem) {
      final FlowException error = new FlowException(Code.IO_FAILURE,
          "Failed to write generated sources to " + outputDir, problem);
      logger.error(error.getMessage(), problem);
      return OperationResult.failure(error);
    }
    logger.info(String.format("Exported flow %s to %s and %s", model.getName(), runtimeFile,
        triggerFile));
    return OperationResult.success("Wrote " + runtimeFile + " and " + triggerFile);
  }
}
