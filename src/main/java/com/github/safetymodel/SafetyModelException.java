package com.github.safetymodel;

/**
 * Unified single exception that's thrown and handled by the safety model and its session. The idea
 * is to use the code enum to encapsulate the various error conditions. Identity and
 * synchronization errors are recoverable at the call site: the caller aborts the single user
 * action and the rest of the model stays usable.
 */
public final class SafetyModelException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  // only set for SYNCHRONIZATION_ABORT and BROKEN_IDENTITY
  private final String fieldName;
  private final Long nodeId;

  public SafetyModelException(final Code code) {
    this(code, code.getDescription());
  }

  public SafetyModelException(final Code code, final String message) {
    super(message);
    this.code = code;
    this.fieldName = null;
    this.nodeId = null;
  }

  public SafetyModelException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
    this.fieldName = null;
    this.nodeId = null;
  }

  private SafetyModelException(final Code code, final String message, final String fieldName,
      final Long nodeId) {
    super(message);
    this.code = code;
    this.fieldName = fieldName;
    this.nodeId = nodeId;
  }

  static SafetyModelException brokenIdentity(final long nodeId, final String reason) {
    return new SafetyModelException(Code.BROKEN_IDENTITY,
        "Clone chain of node " + nodeId + " does not terminate at a primary instance: " + reason,
        null, nodeId);
  }

  static SafetyModelException synchronizationAbort(final long nodeId, final String fieldName,
      final Object value, final Class<?> expectedType) {
    return new SafetyModelException(Code.SYNCHRONIZATION_ABORT,
        String.format("Cannot synchronize field '%s' of node %d: value %s is not a %s", fieldName,
            nodeId, value, expectedType.getSimpleName()),
        fieldName, nodeId);
  }

  public Code getCode() {
    return code;
  }

  /**
   * Name of the shared field that failed to synchronize, null for every other code.
   */
  public String getFieldName() {
    return fieldName;
  }

  /**
   * Id of the offending node for identity and synchronization failures, null otherwise.
   */
  public Long getNodeId() {
    return nodeId;
  }

  public static enum Code {
    // 1.
    BROKEN_IDENTITY("Clone chain does not terminate at a primary instance"),
    // 2.
    SYNCHRONIZATION_ABORT(
        "Failed to copy a shared field during synchronization, no instance was modified"),
    // 3.
    CLONE_NOT_ALLOWED("Node kind cannot be cloned"),
    // 4.
    INVALID_NODE("Node is null, unknown to this model or already placed elsewhere"),
    // 5.
    INVALID_SNAPSHOT("Snapshot is malformed and cannot be imported"),
    // 6.
    INVALID_SESSION_CONFIG("Model session configuration is invalid"),
    // 7.
    UNKNOWN_STRATEGY("Coalescing strategy is not one of v1, v2, v3, v4"),
    // 8.
    SESSION_CLOSED("Model session is closed and cannot service requests");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
