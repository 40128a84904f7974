package ca.gc.cra.certifai.domain.error;

/**
 * Raised when an agent is not allow-listed, exceeds its scrutiny bound, or lacks finalize rights.
 * No metadata is mutated when this is thrown.
 *
 * @since 0.1.0
 */
public final class AgentPermissionException extends CertifaiException {
  private static final long serialVersionUID = 1L;

  private final String agentId;

  public AgentPermissionException(String agentId, String reason) {
    super("Agent " + agentId + " " + reason);
    this.agentId = agentId;
  }

  public String agentId() {
    return agentId;
  }
}
