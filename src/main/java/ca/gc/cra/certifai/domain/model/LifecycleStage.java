package ca.gc.cra.certifai.domain.model;

/**
 * Certification stage of an artifact.
 *
 * <p>{@code PRISTINE -> ANNOTATED -> UNDER_REVIEW -> FINALIZED}; reopening returns a finalized artifact
 * to {@code ANNOTATED} or {@code UNDER_REVIEW}, never to {@code PRISTINE}.</p>
 *
 * @since 0.1.0
 */
public enum LifecycleStage {
  PRISTINE,
  ANNOTATED,
  UNDER_REVIEW,
  FINALIZED;

  /**
   * Derives the stage of an artifact from its effective metadata.
   *
   * @param metadata effective metadata; {@code null} when no inline annotation exists
   * @param staleReviewsCount whether reviews predating a reopening still count
   * @return derived stage
   */
  public static LifecycleStage of(TagMetadata metadata, boolean staleReviewsCount) {
    if (metadata == null) {
      return PRISTINE;
    }
    if (metadata.done()) {
      return FINALIZED;
    }
    boolean reviewed = !metadata.reviewers().isEmpty() || !metadata.isPendingCertification();
    if (!reviewed || (metadata.isStale() && !staleReviewsCount)) {
      return ANNOTATED;
    }
    return UNDER_REVIEW;
  }
}
