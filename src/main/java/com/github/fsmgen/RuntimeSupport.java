package com.github.fsmgen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmgen.FsmGenException.Code;

/**
 * Supplies the tinyfsm runtime header that is copied verbatim into Inc/. The runtime is an external
 * library, so the header always comes from the file named by the configuration; its bytes are
 * passed through untouched.
 */
final class RuntimeSupport {
  private static final Logger logger = LogManager.getLogger(RuntimeSupport.class.getSimpleName());

  static byte[] load(final Optional<Path> runtimeHeader) throws FsmGenException {
    if (!runtimeHeader.isPresent()) {
      throw new FsmGenException(Code.RUNTIME_SUPPORT_MISSING,
          "No runtime support header configured, point --runtime-header at tinyfsm.hpp");
    }
    final Path path = runtimeHeader.get();
    if (!Files.isRegularFile(path)) {
      throw new FsmGenException(Code.RUNTIME_SUPPORT_MISSING,
          "Runtime support header not found: " + path);
    }
    try {
      logger.debug("Using runtime support header " + path);
      return Files.readAllBytes(path);
    } catch (IOException problem) {
      throw new FsmGenException(Code.RUNTIME_SUPPORT_MISSING,
          "Failed to read runtime support header " + path, problem);
    }
  }

  private RuntimeSupport() {}
}
