package ca.gc.cra.certifai.domain.model;

/**
 * Source-control attribution of a declaration line.
 *
 * @param commit abbreviated or full commit id; never {@code null}
 * @param author author name; never {@code null}
 * @since 0.1.0
 */
public record Attribution(String commit, String author) {
  public Attribution {
    if (commit == null || author == null) {
      throw new NullPointerException("commit and author are required");
    }
  }

  public String shortCommit() {
    return commit.length() > 7 ? commit.substring(0, 7) : commit;
  }
}
