package ca.gc.cra.certifai.application.lifecycle;

import ca.gc.cra.certifai.domain.registry.RegistryEntry;
import java.util.Objects;

/**
 * Registry entry whose artifact is absent from the current scan (deleted or renamed).
 *
 * <p>Reported, never resolved automatically; the entry stays in the registry.</p>
 *
 * @param entry orphaned entry
 * @since 0.1.0
 */
public record ReopenConflict(RegistryEntry entry) {
  public ReopenConflict {
    entry = Objects.requireNonNull(entry, "entry");
  }

  public String describe() {
    return "Registry entry " + entry.id() + " (finalized " + entry.finalizedAt() + ") has no matching artifact";
  }
}
