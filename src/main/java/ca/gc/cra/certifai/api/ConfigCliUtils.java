package ca.gc.cra.certifai.api;

import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.model.Scrutiny;
import java.util.Map;

/**
 * Shared helpers for reading typed values out of parsed CLI arguments.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  static ArtifactId requireArtifact(Map<String, String> args) {
    String value = args.get("artifact");
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("artifact=PATH::QUALIFIED_NAME is required");
    }
    return ArtifactId.parse(value.trim());
  }

  /**
   * Parses the optional {@code scrutiny} argument.
   *
   * @param args command arguments
   * @return scrutiny, or {@code null} when absent
   * @throws IllegalArgumentException when the value is not a scrutiny level
   */
  static Scrutiny optionalScrutiny(Map<String, String> args) {
    String value = args.get("scrutiny");
    if (value == null) {
      return null;
    }
    return Scrutiny.parse(value)
        .orElseThrow(() -> new IllegalArgumentException("scrutiny must be auto|low|medium|high (was '" + value + "')"));
  }
}
