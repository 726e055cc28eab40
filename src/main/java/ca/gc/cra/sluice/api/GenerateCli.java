package ca.gc.cra.sluice.api;

import ca.gc.cra.sluice.config.GenerateConfig;
import ca.gc.cra.sluice.infrastructure.io.SampleFileGenerator;
import ca.gc.cra.sluice.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for {@code sluice generate}: writes a sample input file of repeated {@code 'a'} bytes.
 *
 * @since 0.1.0
 */
public final class GenerateCli {
  private static final Logger log = LoggerFactory.getLogger(GenerateCli.class);
  private static final String SUMMARY_USAGE = "usage: generate [out=PATH] [sizeBytes=N] [chunkBytes=N] [config=FILE]";
  private static final String HELP_TEXT = """
      sluice generate

      Usage:
        generate out=large.txt sizeBytes=104857600

      Options:
        out=PATH         File to create or overwrite (default large.txt)
        sizeBytes=N      File size in bytes (default 104857600)
        chunkBytes=N     Bytes per write (default 1048576)
        config=FILE      YAML file with common/generate sections
        --verbose        Enable DEBUG logging
        --help           Show this message
      """;

  private GenerateCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    GenerateConfig config;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      config = GenerateConfig.fromMap(ConfigCliUtils.effectiveConfig("generate", kv, log));
    } catch (ConfigCliUtils.ConfigFileException ex) {
      log.error(ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid generate arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      long written = new SampleFileGenerator(config.chunkBytes()).generate(config.output(), config.sizeBytes());
      CliPrinter.printf("generated %s (%d bytes)", config.output(), written);
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Failed to generate {}", config.output(), ex);
      return ExitCode.IO_ERROR;
    }
  }
}
