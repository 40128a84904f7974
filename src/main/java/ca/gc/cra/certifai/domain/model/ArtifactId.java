package ca.gc.cra.certifai.domain.model;

import java.util.Objects;

/**
 * Stable identity of an artifact across scans: repository-relative path plus qualified name.
 *
 * <p>The string form {@code path::qualifiedName} keys registry entries.</p>
 *
 * @param path repository-relative path using {@code /} separators; never blank
 * @param qualifiedName qualified declaration name, including parameter types for methods; never blank
 * @since 0.1.0
 */
public record ArtifactId(String path, String qualifiedName) implements Comparable<ArtifactId> {
  /** Separator between path and qualified name in the string form. */
  public static final String SEPARATOR = "::";

  public ArtifactId {
    path = Objects.requireNonNull(path, "path").replace('\\', '/');
    qualifiedName = Objects.requireNonNull(qualifiedName, "qualifiedName");
    if (path.isBlank() || qualifiedName.isBlank()) {
      throw new IllegalArgumentException("artifact path and qualified name must not be blank");
    }
  }

  /**
   * Parses the {@code path::qualifiedName} form.
   *
   * @param value identity string; must not be {@code null}
   * @return parsed identity
   * @throws IllegalArgumentException when the separator is missing
   */
  public static ArtifactId parse(String value) {
    Objects.requireNonNull(value, "value");
    int idx = value.indexOf(SEPARATOR);
    if (idx <= 0 || idx + SEPARATOR.length() >= value.length()) {
      throw new IllegalArgumentException("artifact identity must be path::qualifiedName (was '" + value + "')");
    }
    return new ArtifactId(value.substring(0, idx), value.substring(idx + SEPARATOR.length()));
  }

  /**
   * Qualified name without the parameter list, e.g. {@code p.Calc.add} for {@code p.Calc.add(int, int)}.
   * Overloads and signature edits of one member share it.
   *
   * @return enclosing type plus member name
   */
  public String memberName() {
    int idx = qualifiedName.indexOf('(');
    return idx < 0 ? qualifiedName : qualifiedName.substring(0, idx);
  }

  @Override
  public int compareTo(ArtifactId other) {
    int byPath = path.compareTo(other.path);
    return byPath != 0 ? byPath : qualifiedName.compareTo(other.qualifiedName);
  }

  @Override
  public String toString() {
    return path + SEPARATOR + qualifiedName;
  }
}
