package ca.gc.cra.certifai.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by CERTIFAI command-line tools.
 * <p><strong>Why:</strong> Provides consistent process status semantics so hooks and CI jobs can react
 * deterministically.</p>
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** The policy check ran and reported violations. */
  POLICY_FAILURE(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** A lifecycle precondition failed or an inline annotation is malformed; nothing was written. */
  LIFECYCLE_REJECTED(6),
  /** An agent was not permitted to certify or finalize; nothing was written. */
  PERMISSION_DENIED(7),
  /** The registry is malformed or its lock could not be obtained. */
  REGISTRY_CORRUPTION(8),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
