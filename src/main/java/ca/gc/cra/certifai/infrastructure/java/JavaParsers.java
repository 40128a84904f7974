package ca.gc.cra.certifai.infrastructure.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.printer.DefaultPrettyPrinter;
import com.github.javaparser.printer.Printer;
import com.github.javaparser.printer.configuration.DefaultConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration.ConfigOption;
import com.github.javaparser.printer.configuration.PrinterConfiguration;

/**
 * JavaParser setup shared by the scanner, digester, codec and rewriter.
 *
 * <p>{@link JavaParser} instances are not thread-safe; callers create one per task through {@link #newParser()}.</p>
 */
final class JavaParsers {
  private JavaParsers() {}

  static JavaParser newParser() {
    ParserConfiguration configuration = new ParserConfiguration()
        .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
        .setAttributeComments(true);
    return new JavaParser(configuration);
  }

  /**
   * Printer emitting code without comments or Javadoc at a fixed indentation.
   *
   * @return new printer
   */
  static Printer canonicalPrinter() {
    PrinterConfiguration configuration = new DefaultPrinterConfiguration()
        .removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_COMMENTS))
        .removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_JAVADOC));
    return new DefaultPrettyPrinter(configuration);
  }

  static String describe(ParseResult<?> result) {
    if (result.getProblems().isEmpty()) {
      return "unparsable source";
    }
    Problem first = result.getProblems().get(0);
    String location = first.getLocation()
        .flatMap(tokens -> tokens.getBegin().getRange())
        .map(range -> "line " + range.begin.line + ": ")
        .orElse("");
    return location + first.getMessage();
  }
}
