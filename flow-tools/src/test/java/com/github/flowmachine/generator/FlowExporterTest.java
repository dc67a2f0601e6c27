package com.github.flowmachine.generator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.github.flowmachine.FlowException;
import com.github.flowmachine.OperationResult;
import com.github.flowmachine.model.FlowModel;
import com.github.flowmachine.model.FlowTransition;

public class FlowExporterTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private final FlowExporter exporter = new FlowExporter();

  @Test
  public void testExportWritesBothFiles() throws Exception {
    final Path out = folder.getRoot().toPath().resolve("generated");
    final OperationResult result = exporter.export(RuntimeGeneratorTest.robotModel(), out);
    assertTrue(result.isSuccessful());

    final GeneratedSources expected = new RuntimeGenerator().generate(RuntimeGeneratorTest.robotModel());
    assertEquals(expected.getRuntimeSource(), read(out.resolve("GeneratedFlow.java")));
    assertEquals(expected.getTriggerSource(), read(out.resolve("FlowTriggers.java")));
  }

  @Test
  public void testExportOverwritesEarlierOutput() throws Exception {
    final Path out = folder.newFolder("out").toPath();
    Files.write(out.resolve("GeneratedFlow.java"), "stale".getBytes(StandardCharsets.UTF_8));
    assertTrue(exporter.export(RuntimeGeneratorTest.robotModel(), out).isSuccessful());
    assertTrue(read(out.resolve("GeneratedFlow.java")).contains("extends FlowMachine"));
  }

  @Test
  public void testInvalidModelWritesNothing() throws Exception {
    final FlowModel model = new FlowModel("dangling");
    model.addTransition(new FlowTransition(0, 1, "go", ""));
    final Path out = folder.getRoot().toPath().resolve("never");
    final OperationResult result = exporter.export(model, out);
    assertFalse(result.isSuccessful());
    assertEquals(FlowException.Code.INVALID_MODEL, result.getError().getCode());
    assertFalse(Files.exists(out));
  }

  @Test
  public void testUnwritableDirectory() throws Exception {
    final File blocker = folder.newFile("blocker");
    final OperationResult result =
        exporter.export(RuntimeGeneratorTest.robotModel(), blocker.toPath().resolve("out"));
    assertFalse(result.isSuccessful());
    assertEquals(FlowException.Code.IO_FAILURE, result.getError().getCode());
  }

  private static String read(final Path file) throws Exception {
    return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
  }
}
