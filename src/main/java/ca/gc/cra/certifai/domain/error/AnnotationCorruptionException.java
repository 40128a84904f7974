package ca.gc.cra.certifai.domain.error;

/**
 * Raised when an inline provenance annotation cannot be decoded.
 *
 * @since 0.1.0
 */
public final class AnnotationCorruptionException extends CertifaiException {
  private static final long serialVersionUID = 1L;

  public AnnotationCorruptionException(String message) {
    super(message);
  }

  public AnnotationCorruptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
