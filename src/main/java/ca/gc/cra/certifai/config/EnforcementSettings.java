package ca.gc.cra.certifai.config;

/**
 * {@code enforcement} section of the policy.
 *
 * @param aiComposedRequiresHighScrutiny flag AI-composed artifacts lacking high scrutiny
 * @param minCoverage minimum coverage ratio in {@code [0, 1]}; {@code null} disables the check
 * @param ignoreUnannotated exclude Pristine artifacts from coverage (and from batch annotation)
 * @param reopenedCountsAsCertified let reviews that predate a reopening keep counting
 * @param failOnOrphans report registry entries without a live artifact as violations
 * @since 0.1.0
 */
public record EnforcementSettings(
    boolean aiComposedRequiresHighScrutiny,
    Double minCoverage,
    boolean ignoreUnannotated,
    boolean reopenedCountsAsCertified,
    boolean failOnOrphans) {

  public EnforcementSettings {
    if (minCoverage != null && (minCoverage.isNaN() || minCoverage < 0d || minCoverage > 1d)) {
      throw new IllegalArgumentException("enforcement.min_coverage must be within [0, 1] (was " + minCoverage + ")");
    }
  }

  public static EnforcementSettings defaults() {
    return new EnforcementSettings(true, null, false, false, false);
  }
}
