package ca.gc.cra.certifai.config;

import ca.gc.cra.certifai.domain.model.Scrutiny;
import java.util.Objects;

/**
 * Bounds on what an automated reviewer may do.
 *
 * @param id agent identity; never {@code null}
 * @param maxScrutiny highest scrutiny the agent may claim; never {@code null}
 * @param allowFinalize whether the agent's review may be the one that finalizes an artifact
 * @param notes operator notes; may be {@code null}
 * @since 0.1.0
 */
public record AgentPermission(String id, Scrutiny maxScrutiny, boolean allowFinalize, String notes) {
  public AgentPermission {
    id = Objects.requireNonNull(id, "id");
    maxScrutiny = Objects.requireNonNull(maxScrutiny, "maxScrutiny");
  }
}
