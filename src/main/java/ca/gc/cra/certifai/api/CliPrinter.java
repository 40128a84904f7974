package ca.gc.cra.certifai.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Console output helper for CLI reports and usage text.
 *
 * <p>Writes to the native stdout descriptor so reports stay separate from log output, which goes to stderr.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final int LABEL_WIDTH = 18;
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints zero or more lines.
   *
   * @param lines lines to emit
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
  }

  /**
   * Prints an aligned {@code label : value} summary line.
   *
   * @param label left-hand label
   * @param value right-hand value; {@code null} prints {@code <none>}
   */
  public static void printField(String label, Object value) {
    writer().println(String.format(Locale.ROOT, " %-" + LABEL_WIDTH + "s: %s", label,
        value == null ? "<none>" : value));
  }

  /**
   * Overrides the CLI writer for tests.
   *
   * @param writer writer to use during the test
   */
  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
