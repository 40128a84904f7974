package ca.gc.cra.certifai.domain.error;

/**
 * Base type for lifecycle failures a caller is expected to report and recover from.
 *
 * @since 0.1.0
 */
public class CertifaiException extends Exception {
  private static final long serialVersionUID = 1L;

  public CertifaiException(String message) {
    super(message);
  }

  public CertifaiException(String message, Throwable cause) {
    super(message, cause);
  }
}
