package ca.gc.cra.certifai.domain.error;

/**
 * Raised when a transition's precondition does not hold for the artifact's current state.
 *
 * @since 0.1.0
 */
public final class LifecycleException extends CertifaiException {
  private static final long serialVersionUID = 1L;

  public LifecycleException(String message) {
    super(message);
  }
}
