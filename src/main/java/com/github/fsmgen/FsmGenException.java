package com.github.fsmgen;

/**
 * Unified single exception that's thrown and handled by the generator. The code enum encapsulates
 * the various failure conditions; every one of them is fatal to the current run and the CLI maps
 * all of them to a nonzero exit status.
 */
public final class FsmGenException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public FsmGenException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public FsmGenException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public FsmGenException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public FsmGenException(final Code code, final Throwable throwable) {
    super(code.getDescription(), throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INPUT_NOT_FOUND("Input graph file not found"),
    // 2.
    GRAPH_READ_FAILURE("Failed to read the input graph description"),
    // 3.
    INVALID_EVENT_LABEL("Edge label is neither empty, a timer label nor an identifier"),
    // 4.
    INVALID_NODE_ID("Node id cannot be used to name a generated state or hook"),
    // 5.
    AMBIGUOUS_REACTION("State has more than one outgoing edge for the same event"),
    // 6.
    OVERLAPPING_PARTITIONS("A state is reachable from more than one entry state"),
    // 7.
    RUNTIME_SUPPORT_MISSING("Runtime support header could not be found"),
    // 8.
    OUTPUT_FAILURE("Failed to write the generated output tree"),
    // 9.
    INVALID_CONFIG("Generator configuration is invalid"),
    // 10.
    UNKNOWN_FAILURE("Generator failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
