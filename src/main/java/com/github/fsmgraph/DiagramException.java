package com.github.fsmgraph;

/**
 * Unified single exception that's thrown and handled by the diagram library. The code enum
 * encapsulates the various error conditions.
 *
 * Not every DiagramException is thrown. Markup and structural problems found while flattening or
 * building a graph are collected as values (see {@link GraphModel#getProblems()}) so that lenient
 * callers still get a best-effort graph while strict callers can fail their build on them. In that
 * role {@link #getSubject()} names the offending state or trigger.
 */
public final class DiagramException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;
  private final String subject;

  public DiagramException(final Code code) {
    super(code.getDescription());
    this.code = code;
    this.subject = null;
  }

  public DiagramException(final Code code, final String message) {
    super(message);
    this.code = code;
    this.subject = null;
  }

  public DiagramException(final Code code, final String subject, final String message) {
    super(message);
    this.code = code;
    this.subject = subject;
  }

  public DiagramException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
    this.subject = null;
  }

  public Code getCode() {
    return code;
  }

  /**
   * The state or trigger this problem is attributed to, null if not attributable.
   */
  public String getSubject() {
    return subject;
  }

  @Override
  public String toString() {
    return "DiagramException [code=" + code + ", subject=" + subject + ", message=" + getMessage()
        + "]";
  }

  public static enum Code {
    // 1.
    MODEL_BINDING_CONFLICT(
        "Model already exposes graph retrieval. Graph retrieval cannot be bound to it."),
    // 2.
    MARKUP_INCOMPLETE("Machine markup is missing expected keys. Graph creation incomplete."),
    // 3.
    STYLE_TRACKING_UNAVAILABLE("Model does not expose a current state. Active state not styled."),
    // 4.
    DUPLICATE_STATE_NAME("Qualified state name is declared more than once"),
    // 5.
    INVALID_STATE_NAME("State name cannot be null, empty or contain the separator '"
        + HierarchyFlattener.SEPARATOR + "'"),
    // 6.
    INVALID_TRANSITION("Transition has neither a source nor a wildcard source"),
    // 7.
    INVALID_INITIAL_STATE("Initial state is not a child of its parent state"),
    // 8.
    UNKNOWN_STATE("Transition references a state that is not part of the machine"),
    // 9.
    INVALID_DIAGRAM_CONFIG("Diagram configuration is invalid"),
    // 10.
    BACKEND_UNAVAILABLE("No graph rendering backend is available"),
    // 11.
    RENDER_FAILURE("Failed to draw graph. Check exception stacktrace for more details."),
    // 12.
    NO_OBSERVED_MODEL("No model is registered with the diagram machine");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
