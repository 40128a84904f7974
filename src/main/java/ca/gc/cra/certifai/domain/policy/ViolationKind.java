package ca.gc.cra.certifai.domain.policy;

/**
 * Categories of policy violations.
 *
 * @since 0.1.0
 */
public enum ViolationKind {
  /** AI-composed artifact lacks high scrutiny from a human or a qualifying agent. */
  AI_COMPOSED_REQUIRES_HIGH_SCRUTINY,
  /** Coverage ratio is below {@code enforcement.min_coverage}. */
  MIN_COVERAGE,
  /** Registry entry has no matching artifact in the current scan. */
  ORPHANED_REGISTRY_ENTRY
}
