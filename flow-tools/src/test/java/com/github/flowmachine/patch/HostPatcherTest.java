package com.github.flowmachine.patch;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.github.flowmachine.FlowException;
import com.github.flowmachine.generator.GeneratorConfiguration.GeneratorConfigurationBuilder;
import com.github.flowmachine.patch.HostPatchConfiguration.HostPatchConfigurationBuilder;

/**
 * Tests for wiring generated flows into host sources.
 */
public class HostPatcherTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Logger logger = LogManager.getLogger(HostPatcherTest.class.getSimpleName());

  private static final String HOST = String.join("\n",
      "package com.example.game;",
      "",
      "import java.util.List;",
      "",
      "public class Game {",
      "  void onInit() {",
      "  }",
      "",
      "  void onUpdate(double dt) {",
      "  }",
      "",
      "  void onKey(String key) {",
      "  }",
      "}",
      "");

  private static final String PATCHED = String.join("\n",
      "package com.example.game;",
      "import generated.flow.GeneratedFlow;",
      "import generated.flow.FlowTriggers;",
      "",
      "import java.util.List;",
      "",
      "public class Game {",
      "  private final GeneratedFlow flow = new GeneratedFlow();",
      "  void onInit() {",
      "    flow.start();",
      "  }",
      "",
      "  void onUpdate(double dt) {",
      "    flow.update(dt);",
      "  }",
      "",
      "  void onKey(String key) {",
      "    FlowTriggers.forward(flow, key);",
      "  }",
      "}",
      "");

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private HostPatcher patcher;

  @Before
  public void setUp() throws FlowException {
    patcher = new HostPatcher(HostPatchConfiguration.defaults());
  }

  @Test
  public void testPatchInsertsEverySnippet() {
    final PatchResult result = patcher.patch(HOST);
    logger.info(result.getPatchedText());
    assertTrue(result.isSuccessful());
    assertTrue(result.isChanged());
    assertEquals(PATCHED, result.getPatchedText());
    for (final Insertion insertion : Insertion.values()) {
      assertEquals(InsertionOutcome.INSERTED, result.getOutcome(insertion));
    }
    assertTrue(result.getWarnings().isEmpty());
  }

  @Test
  public void testPatchIsIdempotent() {
    final String once = patcher.patch(HOST).getPatchedText();
    final PatchResult twice = patcher.patch(once);
    assertTrue(twice.isSuccessful());
    assertFalse(twice.isChanged());
    assertEquals(once, twice.getPatchedText());
    for (final Insertion insertion : Insertion.values()) {
      assertEquals(InsertionOutcome.ALREADY_PRESENT, twice.getOutcome(insertion));
    }
  }

  @Test
  public void testMissingMarkerSkipsOnlyItsInsertion() {
    final String host = HOST.replace("  void onKey(String key) {\n  }\n", "");
    final PatchResult result = patcher.patch(host);
    assertTrue(result.isSuccessful());
    assertEquals(InsertionOutcome.MARKER_NOT_FOUND, result.getOutcome(Insertion.INPUT));
    assertEquals(InsertionOutcome.INSERTED, result.getOutcome(Insertion.FIELD));
    assertEquals(InsertionOutcome.INSERTED, result.getOutcome(Insertion.UPDATE));
    assertEquals(1, result.getWarnings().size());
    assertTrue(result.getPatchedText().contains("    flow.update(dt);"));
    assertFalse(result.getPatchedText().contains("FlowTriggers.forward"));
  }

  @Test
  public void testPartiallyPatchedHostIsCompleted() {
    final String host = HOST.replace("  void onInit() {\n", "  void onInit() {\n    flow.start();\n");
    final PatchResult result = patcher.patch(host);
    assertEquals(InsertionOutcome.ALREADY_PRESENT, result.getOutcome(Insertion.INIT));
    assertEquals(PATCHED, result.getPatchedText());
  }

  @Test
  public void testPackageWordInHeaderCommentIsSkipped() {
    final String header = String.join("\n",
        "/*",
        " * Classes in this package drive the game.",
        " */",
        "// package notes: see the wiki",
        "");
    final PatchResult result = patcher.patch(header + HOST);
    assertEquals(header + PATCHED, result.getPatchedText());
    assertEquals(result.getPatchedText(), patcher.patch(result.getPatchedText()).getPatchedText());
  }

  @Test
  public void testMarkersInCommentsAndStringsAreSkipped() {
    final String host = HOST
        .replace("public class Game {", "/** Owned by class Game { } */\npublic class Game {")
        .replace("  void onInit() {\n",
            "  String hint = \"void onInit() {\";\n  void onInit() {\n");
    final String patched = patcher.patch(host).getPatchedText();
    assertTrue(patched.contains("/** Owned by class Game { } */\npublic class Game {\n"
        + "  private final GeneratedFlow flow = new GeneratedFlow();"));
    assertTrue(patched.contains("\"void onInit() {\";\n  void onInit() {\n    flow.start();"));
  }

  @Test
  public void testClassMarkerNeedsWholeName() {
    final String host = HOST.replace("public class Game {",
        "class GameState {\n}\n\npublic class Game {");
    final String patched = patcher.patch(host).getPatchedText();
    assertTrue(patched.contains("class GameState {\n}"));
    assertTrue(patched.contains(
        "public class Game {\n  private final GeneratedFlow flow = new GeneratedFlow();"));
  }

  @Test
  public void testFindMarker() {
    assertEquals(-1, HostPatcher.findMarker("// class Game {", "class Game", false));
    assertEquals(-1, HostPatcher.findMarker("class GameLoop {", "class Game", false));
    assertEquals(0, HostPatcher.findMarker("class Game{", "class Game", false));
    assertEquals(-1, HostPatcher.findMarker("int x; package a;", "package ", true));
    assertEquals(2, HostPatcher.findMarker("  package a;", "package ", true));
    assertEquals(-1,
        HostPatcher.findMarker("/* unterminated package a;", "package ", true));
  }

  @Test
  public void testWindowsLineEndingsKept() {
    final PatchResult result = patcher.patch(HOST.replace("\n", "\r\n"));
    final String patched = result.getPatchedText();
    assertEquals(PATCHED.replace("\n", "\r\n"), patched);
    assertFalse(patched.replace("\r\n", "").contains("\n"));
  }

  @Test
  public void testCustomNames() throws FlowException {
    final HostPatchConfiguration config = HostPatchConfigurationBuilder.newBuilder()
        .generatorConfiguration(GeneratorConfigurationBuilder.newBuilder()
            .packageName("com.example.flows").runtimeClassName("DoorFlow")
            .triggerClassName("DoorKeys").build())
        .classMarker("class Door").initMarker("void open(").updateMarker("void tick(")
        .inputMarker("void press(").fieldName("door").deltaName("seconds").keyName("button")
        .build();
    final String host = String.join("\n",
        "package com.example;",
        "class Door {",
        "    void open() {",
        "    }",
        "    void tick(float seconds) {",
        "    }",
        "    void press(String button) {",
        "    }",
        "}");
    final String patched = new HostPatcher(config).patch(host).getPatchedText();
    assertTrue(patched.contains("import com.example.flows.DoorFlow;\n"));
    assertTrue(patched.contains("import com.example.flows.DoorKeys;\n"));
    assertTrue(patched.contains("class Door {\n  private final DoorFlow door = new DoorFlow();"));
    assertTrue(patched.contains("void open() {\n      door.start();"));
    assertTrue(patched.contains("      door.update(seconds);"));
    assertTrue(patched.contains("      DoorKeys.forward(door, button);"));
  }

  @Test
  public void testInvalidConfiguration() {
    try {
      HostPatchConfigurationBuilder.newBuilder().classMarker("").fieldName("new").build();
      fail("expected configuration to be rejected");
    } catch (FlowException expected) {
      assertEquals(FlowException.Code.INVALID_CONFIG, expected.getCode());
      assertTrue(expected.getMessage().contains("Class marker cannot be empty"));
      assertTrue(expected.getMessage().contains("Field name 'new' is not a valid identifier"));
    }
  }

  @Test
  public void testPatchFileTwiceIsByteIdentical() throws Exception {
    final Path host = folder.newFile("Game.java").toPath();
    Files.write(host, HOST.getBytes(StandardCharsets.UTF_8));

    assertTrue(patcher.patch(host).isChanged());
    final byte[] once = Files.readAllBytes(host);
    assertEquals(PATCHED, new String(once, StandardCharsets.UTF_8));

    final FileTime stamp = FileTime.fromMillis(1000000000000L);
    Files.setLastModifiedTime(host, stamp);
    final PatchResult again = patcher.patch(host);
    assertTrue(again.isSuccessful());
    assertFalse(again.isChanged());
    assertArrayEquals(once, Files.readAllBytes(host));
    assertEquals(stamp, Files.getLastModifiedTime(host));
  }

  @Test
  public void testMissingHostFile() {
    final PatchResult result = patcher.patch(folder.getRoot().toPath().resolve("Absent.java"));
    assertFalse(result.isSuccessful());
    assertEquals(FlowException.Code.IO_FAILURE, result.getError().getCode());
    assertEquals(null, result.getPatchedText());
  }
}
