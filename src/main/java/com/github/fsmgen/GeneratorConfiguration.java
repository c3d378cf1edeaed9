package com.github.fsmgen;

import java.nio.file.Path;
import java.util.Optional;

/**
 * This class encapsulates all the configuration parameters for a generator run. Use the
 * {@code GeneratorConfigurationBuilder} to build it.
 * 
 * The configuration is handed explicitly to every emitter. Notes:<br>
 * 1. If the fifo size is not set, a default capacity of 100 events is used.<br>
 * 2. The runtime header names the tinyfsm.hpp to copy into the output; compiling without one
 * fails since the runtime library is not shipped with the generator.<br>
 * 3. The platform header is included by the generated fifo and user states sources and is expected
 * to provide the interrupt enable/disable primitives.<br>
 */
public final class GeneratorConfiguration {
  static final int defaultFifoSize = 100;
  static final String defaultPlatformHeader = "main.h";

  private final CodegenMode codegenMode;
  private final OverlapPolicy overlapPolicy;
  private final int fifoSize;
  private final String platformHeader;
  private final Optional<Path> runtimeHeader;

  public boolean emitTimers() {
    return codegenMode == CodegenMode.FULL;
  }

  public OverlapPolicy getOverlapPolicy() {
    return overlapPolicy;
  }

  public int getFifoSize() {
    return fifoSize;
  }

  public String getPlatformHeader() {
    return platformHeader;
  }

  public Optional<Path> getRuntimeHeader() {
    return runtimeHeader;
  }

  public static GeneratorConfiguration defaults() {
    return new GeneratorConfiguration(CodegenMode.FULL, OverlapPolicy.REJECT, defaultFifoSize,
        defaultPlatformHeader, Optional.empty());
  }

  public final static class GeneratorConfigurationBuilder {
    private CodegenMode codegenMode = CodegenMode.FULL;
    private OverlapPolicy overlapPolicy = OverlapPolicy.REJECT;
    private int fifoSize = defaultFifoSize;
    private String platformHeader = defaultPlatformHeader;
    private Path runtimeHeader;

    public static GeneratorConfigurationBuilder newBuilder() {
      return new GeneratorConfigurationBuilder();
    }

    public GeneratorConfigurationBuilder stubs(final boolean stubs) {
      this.codegenMode = stubs ? CodegenMode.STUBS : CodegenMode.FULL;
      return this;
    }

    public GeneratorConfigurationBuilder overlapPolicy(final OverlapPolicy overlapPolicy) {
      this.overlapPolicy = overlapPolicy;
      return this;
    }

    public GeneratorConfigurationBuilder fifoSize(final int fifoSize) {
      this.fifoSize = fifoSize;
      return this;
    }

    public GeneratorConfigurationBuilder platformHeader(final String platformHeader) {
      this.platformHeader = platformHeader;
      return this;
    }

    public GeneratorConfigurationBuilder runtimeHeader(final Path runtimeHeader) {
      this.runtimeHeader = runtimeHeader;
      return this;
    }

    public GeneratorConfiguration build() throws FsmGenException {
      final GeneratorConfiguration config = new GeneratorConfiguration(codegenMode, overlapPolicy,
          fifoSize, platformHeader, Optional.ofNullable(runtimeHeader));
      config.validate();
      return config;
    }

    private GeneratorConfigurationBuilder() {}
  }

  private void validate() throws FsmGenException {
    StringBuilder messages = new StringBuilder();
    if (codegenMode == null) {
      messages.append("CodegenMode cannot be null. ");
    }
    if (overlapPolicy == null) {
      messages.append("OverlapPolicy cannot be null. ");
    }
    // the ring keeps one slot free to tell full from empty
    if (fifoSize < 2) {
      messages.append("Fifo size must be at least 2, was ").append(fifoSize).append(". ");
    }
    if (platformHeader == null || platformHeader.trim().isEmpty()) {
      messages.append("Platform header cannot be blank. ");
    }
    if (messages.length() > 0) {
      throw new FsmGenException(FsmGenException.Code.INVALID_CONFIG, messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "GeneratorConfiguration [codegenMode=" + codegenMode + ", overlapPolicy="
        + overlapPolicy + ", fifoSize=" + fifoSize + ", platformHeader=" + platformHeader
        + ", runtimeHeader=" + runtimeHeader.map(Path::toString).orElse("<unset>") + "]";
  }

  private GeneratorConfiguration(final CodegenMode codegenMode, final OverlapPolicy overlapPolicy,
      final int fifoSize, final String platformHeader, final Optional<Path> runtimeHeader) {
    this.codegenMode = codegenMode;
    this.overlapPolicy = overlapPolicy;
    this.fifoSize = fifoSize;
    this.platformHeader = platformHeader == null ? null : platformHeader.trim();
    this.runtimeHeader = runtimeHeader;
  }

}
