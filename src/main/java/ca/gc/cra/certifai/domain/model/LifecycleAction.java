package ca.gc.cra.certifai.domain.model;

import java.util.Optional;

/**
 * Lifecycle events recorded in {@link TagMetadata#history()}.
 *
 * @since 0.1.0
 */
public enum LifecycleAction {
  ANNOTATED("annotated"),
  CERTIFIED("certified"),
  AGENT_CERTIFIED("agent-certified"),
  FINALIZED("finalized"),
  REOPENED("reopened");

  private final String wireName;

  LifecycleAction(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static Optional<LifecycleAction> fromWireName(String value) {
    for (LifecycleAction action : values()) {
      if (action.wireName.equals(value)) {
        return Optional.of(action);
      }
    }
    return Optional.empty();
  }
}
