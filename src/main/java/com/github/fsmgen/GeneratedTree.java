package com.github.fsmgen;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmgen.FsmGenException.Code;

/**
 * The complete set of generated artifacts, held in memory until {@link #commit(Path)}. Paths are
 * relative to the output directory and use '/' separators (Inc/Events.hpp, Src/FSM1.cpp, ...).
 * 
 * Committing stages every file inside the output directory first and only then moves them into
 * place, so a failure while writing leaves the previous tree untouched. All validation happens
 * before a tree exists, hence a rejected input never produces partial output either.
 */
public final class GeneratedTree {
  private static final Logger logger = LogManager.getLogger(GeneratedTree.class.getSimpleName());

  public static final String includeDir = "Inc";
  public static final String sourceDir = "Src";
  private static final String stagingPrefix = ".fsm-gen-staging-";

  // K=relative path, V=file bytes. Insertion ordered.
  private final Map<String, byte[]> artifacts = new LinkedHashMap<>();
  private final CompilationStatistics statistics;

  GeneratedTree(final CompilationStatistics statistics) {
    this.statistics = statistics;
  }

  public CompilationStatistics getStatistics() {
    return statistics;
  }

  void add(final String relativePath, final String content) {
    add(relativePath, content.getBytes(StandardCharsets.UTF_8));
  }

  void add(final String relativePath, final byte[] content) {
    if (artifacts.putIfAbsent(relativePath, content.clone()) != null) {
      throw new IllegalStateException("Artifact generated twice: " + relativePath);
    }
  }

  void addHeader(final String fileName, final String content) {
    add(includeDir + "/" + fileName, content);
  }

  void addHeader(final String fileName, final byte[] content) {
    add(includeDir + "/" + fileName, content);
  }

  void addSource(final String fileName, final String content) {
    add(sourceDir + "/" + fileName, content);
  }

  public List<String> paths() {
    return Collections.unmodifiableList(new ArrayList<>(artifacts.keySet()));
  }

  /**
   * Content of a generated artifact decoded as UTF-8, or null if the tree has no such path.
   */
  public String content(final String relativePath) {
    final byte[] bytes = artifacts.get(relativePath);
    return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
  }

  /**
   * Exact bytes that {@link #commit(Path)} writes for an artifact, or null if there is none.
   */
  public byte[] bytes(final String relativePath) {
    final byte[] bytes = artifacts.get(relativePath);
    return bytes == null ? null : bytes.clone();
  }

  public boolean contains(final String relativePath) {
    return artifacts.containsKey(relativePath);
  }

  public int size() {
    return artifacts.size();
  }

  /**
   * Write the tree under {@code outputDir}, creating it and its Inc/ and Src/ directories as
   * needed. Existing generated files are replaced; unrelated files are left alone.
   */
  public void commit(final Path outputDir) throws FsmGenException {
    Path staging = null;
    try {
      Files.createDirectories(outputDir.resolve(includeDir));
      Files.createDirectories(outputDir.resolve(sourceDir));
      staging = Files.createTempDirectory(outputDir, stagingPrefix);

      for (final Map.Entry<String, byte[]> artifact : artifacts.entrySet()) {
        final Path staged = staging.resolve(artifact.getKey());
        Files.createDirectories(staged.getParent());
        Files.write(staged, artifact.getValue());
      }
      logger.info("Staged " + artifacts.size() + " artifacts in " + staging);

      for (final String relativePath : artifacts.keySet()) {
        final Path target = outputDir.resolve(relativePath);
        Files.createDirectories(target.getParent());
        move(staging.resolve(relativePath), target);
      }
      logger.info("Committed " + artifacts.size() + " artifacts to " + outputDir);
    } catch (IOException problem) {
      throw new FsmGenException(Code.OUTPUT_FAILURE,
          "Failed to write generated tree to " + outputDir + ": " + problem.getMessage(), problem);
    } finally {
      if (staging != null) {
        deleteQuietly(staging);
      }
    }
  }

  private static void move(final Path from, final Path to) throws IOException {
    try {
      Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException unsupported) {
      logger.debug("Atomic move not supported for " + to + ", falling back to plain move");
      Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(final Path directory) {
    try (Stream<Path> walk = Files.walk(directory)) {
      final List<Path> paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
      for (final Path path : paths) {
        Files.deleteIfExists(path);
      }
    } catch (IOException problem) {
      logger.warn("Failed to clean up staging directory " + directory, problem);
    }
  }

  @Override
  public String toString() {
    return "GeneratedTree [artifacts=" + artifacts.keySet() + "]";
  }
}
