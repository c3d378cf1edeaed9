package com.github.fsmgen;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import picocli.CommandLine;

/**
 * Tests for the command line surface and its exit status.
 */
public class FsmGenCommandTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private Path graph(final String resource) throws Exception {
    final Path dot = folder.newFile().toPath();
    Files.write(dot, SampleGraphs.resource(resource).getBytes(StandardCharsets.UTF_8));
    return dot;
  }

  private static String runtimeOption() {
    return "--runtime-header=" + SampleGraphs.runtimeHeader();
  }

  private static String read(final Path path) throws Exception {
    return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
  }

  @Test
  public void testGenerate() throws Exception {
    final Path out = folder.getRoot().toPath().resolve("out");
    assertEquals(CommandLine.ExitCode.OK,
        FsmGenCommand.run(runtimeOption(), graph(SampleGraphs.liveDemoResource).toString(),
            out.toString()));
    assertTrue(read(out.resolve("Inc/Events.hpp")).contains("NUM_TIMERS = 2"));
    assertEquals(SampleGraphs.resource(SampleGraphs.runtimeResource),
        read(out.resolve("Inc/tinyfsm.hpp")));
    assertTrue(Files.isRegularFile(out.resolve("Src/FSM2.cpp")));
  }

  @Test
  public void testStubsAndFifoSize() throws Exception {
    final Path out = folder.getRoot().toPath().resolve("out");
    assertEquals(CommandLine.ExitCode.OK, FsmGenCommand.run(runtimeOption(), "--stubs",
        "--fifo-size=8", "--platform-header=board.h",
        graph(SampleGraphs.liveDemoResource).toString(), out.toString()));
    assertFalse(read(out.resolve("Inc/Events.hpp")).contains("NUM_TIMERS"));
    assertFalse(read(out.resolve("Src/FSM1.cpp")).contains("start_timer"));
    assertTrue(read(out.resolve("Inc/fsm_fifo.hpp")).contains("#define FIFO_SIZE 8\n"));
    assertTrue(read(out.resolve("Src/fsm_fifo.cpp")).contains("#include \"board.h\"\n"));
  }

  @Test
  public void testMissingInput() {
    final Path out = folder.getRoot().toPath().resolve("out");
    assertEquals(FsmGenCommand.exitFailure, FsmGenCommand.run(runtimeOption(),
        folder.getRoot().toPath().resolve("nope.dot").toString(), out.toString()));
    assertFalse(Files.exists(out));
  }

  @Test
  public void testInvalidLabel() throws Exception {
    final Path out = folder.getRoot().toPath().resolve("out");
    assertEquals(FsmGenCommand.exitFailure, FsmGenCommand.run(runtimeOption(),
        graph(SampleGraphs.badLabelResource).toString(), out.toString()));
    assertFalse(Files.exists(out));
  }

  @Test
  public void testInvalidConfiguration() throws Exception {
    final Path out = folder.getRoot().toPath().resolve("out");
    assertEquals(FsmGenCommand.exitFailure, FsmGenCommand.run(runtimeOption(),
        "--fifo-size=0", graph(SampleGraphs.liveDemoResource).toString(), out.toString()));
    assertFalse(Files.exists(out));
  }

  @Test
  public void testUsageError() {
    assertEquals(CommandLine.ExitCode.USAGE, FsmGenCommand.run());
  }

  @Test
  public void testRuntimeHeaderOptionRequired() throws Exception {
    final Path out = folder.getRoot().toPath().resolve("out");
    assertEquals(CommandLine.ExitCode.USAGE,
        FsmGenCommand.run(graph(SampleGraphs.liveDemoResource).toString(), out.toString()));
    assertFalse(Files.exists(out));
  }
}
