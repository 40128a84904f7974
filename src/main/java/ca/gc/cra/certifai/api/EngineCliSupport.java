package ca.gc.cra.certifai.api;

import ca.gc.cra.certifai.application.lifecycle.ProvenanceEngine;
import ca.gc.cra.certifai.config.CompositionRoot;
import ca.gc.cra.certifai.config.ConfigMerger;
import ca.gc.cra.certifai.config.EngineConfig;
import ca.gc.cra.certifai.config.PolicyConfig;
import ca.gc.cra.certifai.config.PolicyConfigLoader;
import ca.gc.cra.certifai.config.YamlConfigLoader;
import ca.gc.cra.certifai.domain.error.AgentPermissionException;
import ca.gc.cra.certifai.domain.error.CertifaiException;
import ca.gc.cra.certifai.domain.error.RegistryCorruptionException;
import ca.gc.cra.certifai.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared bootstrap for subcommands: argument parsing, configuration merge, engine wiring and the mapping from
 * failures to {@link ExitCode}s.
 */
final class EngineCliSupport {
  private static final Logger log = LoggerFactory.getLogger(EngineCliSupport.class);

  /** YAML section holding engine settings; the rest of the file is the policy. */
  static final String ENGINE_SECTION = "engine";

  private EngineCliSupport() {}

  /** Body of one subcommand, run against a wired engine. */
  @FunctionalInterface
  interface Command {
    ExitCode run(ProvenanceEngine engine, Map<String, String> args, CliInput input)
        throws CertifaiException, IOException;
  }

  /**
   * Parses arguments, wires an engine and runs a command, translating failures into exit codes.
   *
   * @param name command name used in log lines
   * @param usage one-line usage printed on argument errors
   * @param help full help text
   * @param commandKeys {@code key=value} arguments owned by the command
   * @param args raw arguments after the command name
   * @param command command body
   * @return exit code
   */
  static ExitCode run(
      String name,
      String usage,
      String help,
      Set<String> commandKeys,
      String[] args,
      Command command) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(help.stripTrailing());
      return ExitCode.SUCCESS;
    }
    configureLogging(input, name);

    Map<String, String> kv;
    Map<String, String> commandArgs;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      commandArgs = CliArgsParser.extract(kv, commandKeys);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }

    CompositionRoot composition;
    try {
      composition = compose(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", name, ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration for {}", name, ex);
      return ExitCode.IO_ERROR;
    }

    try {
      ProvenanceEngine engine = composition.engine();
      return command.run(engine, commandArgs, input);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", name, ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    } catch (AgentPermissionException ex) {
      log.error("{} denied: {}", name, ex.getMessage());
      return ExitCode.PERMISSION_DENIED;
    } catch (CertifaiException ex) {
      log.error("{} rejected: {}", name, ex.getMessage());
      return ExitCode.LIFECYCLE_REJECTED;
    } catch (RegistryCorruptionException ex) {
      log.error("{} aborted: {}", name, ex.getMessage(), ex);
      return ExitCode.REGISTRY_CORRUPTION;
    } catch (IOException ex) {
      log.error("{} I/O failure", name, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {}", name, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  /**
   * Builds the composition root from engine arguments, the engine section of the YAML file and defaults.
   *
   * @param kv engine arguments ({@code root}, {@code registry}, {@code lockTimeoutMillis}, {@code scanThreads},
   *     {@code exclude}) plus an optional {@code config=PATH}; modified in place
   * @return composition root
   * @throws IOException when the configuration file cannot be read
   * @throws IllegalArgumentException when an argument or configuration value is invalid
   */
  static CompositionRoot compose(Map<String, String> kv) throws IOException {
    String configPath = ConfigCliUtils.extractConfigPath(kv);
    CliArgsParser.requireKnown(kv, EngineConfig.defaults().keySet());

    Path configFile = null;
    if (configPath != null) {
      configFile = Path.of(configPath);
      if (!Files.isRegularFile(configFile)) {
        throw new IllegalArgumentException("configuration file does not exist: " + configFile);
      }
    } else {
      Path root = Path.of(kv.getOrDefault("root", "."));
      configFile = PolicyConfigLoader.locate(root).orElse(null);
    }

    Optional<Map<String, String>> yaml = configFile == null
        ? Optional.empty()
        : YamlConfigLoader.load(configFile, ENGINE_SECTION);
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(yaml, kv, EngineConfig.defaults(), log::warn);
    EngineConfig engineConfig = EngineConfig.fromMap(effective);
    PolicyConfig policy = configFile == null ? PolicyConfig.defaults() : PolicyConfigLoader.load(configFile);
    log.debug("Engine configuration: root={}, registry={}, policy={}", engineConfig.root(),
        engineConfig.registryFile(), configFile == null ? "<defaults>" : configFile);
    return new CompositionRoot(engineConfig, policy);
  }

  private static void configureLogging(CliInput input, String name) {
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", name);
    } else if (input.quiet()) {
      LoggingConfigurator.enableQuietLogging();
    }
  }
}
