package ca.gc.cra.certifai.domain.model;

/**
 * Declaration kinds tracked as artifacts.
 *
 * @since 0.1.0
 */
public enum ArtifactKind {
  CLASS,
  INTERFACE,
  ENUM,
  RECORD,
  ANNOTATION,
  METHOD,
  CONSTRUCTOR;

  /**
   * Indicates whether the kind is function-like (method or constructor).
   *
   * @return {@code true} for methods and constructors
   */
  public boolean isFunction() {
    return this == METHOD || this == CONSTRUCTOR;
  }
}
