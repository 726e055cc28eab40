package ca.gc.cra.sluice.api;

import ca.gc.cra.sluice.application.flow.ManualTransferUseCase;
import ca.gc.cra.sluice.application.pipeline.PipeTransferUseCase;
import ca.gc.cra.sluice.application.pipeline.PipelineOrchestrator;
import ca.gc.cra.sluice.config.CompositionRoot;
import ca.gc.cra.sluice.config.TransferConfig;
import ca.gc.cra.sluice.domain.transfer.TransferException;
import ca.gc.cra.sluice.domain.transfer.TransferMode;
import ca.gc.cra.sluice.domain.transfer.TransferReport;
import ca.gc.cra.sluice.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.sluice.infrastructure.report.MemoryUsageReporter;
import ca.gc.cra.sluice.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for {@code sluice transfer}: copies a file through the bounded-memory transfer core.
 *
 * @since 0.1.0
 */
public final class TransferCli {
  private static final Logger log = LoggerFactory.getLogger(TransferCli.class);
  private static final long SHUTDOWN_GRACE_SECONDS = 5;
  private static final String SUMMARY_USAGE =
      "usage: transfer in=PATH out=PATH [mode=manual|pipeline|pipe|compare] [chunkBytes=N] "
          + "[highWaterBytes=N] [lowWaterBytes=N] [latencyMs=N] [--slow] [config=FILE] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      sluice transfer

      Usage:
        transfer in=large.txt out=output.txt [options]

      Options:
        in=PATH                  File to read (default large.txt)
        out=PATH                 File to write (default output.txt); compare mode writes
                                 <out>.manual and <out>.pipeline
        mode=MODE                manual | pipeline | pipe | compare (default pipeline)
        chunkBytes=N             Bytes per chunk read from the input (default 65536)
        highWaterBytes=N         Buffered bytes at which a component saturates (default 65536)
        lowWaterBytes=N          Buffered bytes at which it drains (default = highWaterBytes)
        latencyMs=N              Per-chunk delay of the latency stage (default 10)
        --slow                   Insert the latency stage between source and sink
        config=FILE              YAML file with common/transfer sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL         OTLP endpoint when metricsExporter=otlp
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private TransferCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the command and returns its exit code without terminating the JVM.
   *
   * @param args command arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> effective;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      if (input.hasFlag("--slow")) {
        kv.put("latencyEnabled", "true");
      }
      effective = new LinkedHashMap<>(ConfigCliUtils.effectiveConfig("transfer", kv, log));
    } catch (ConfigCliUtils.ConfigFileException ex) {
      log.error(ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (ConfigCliUtils.parseBoolean(effective, "verbose", false)) {
      LoggingConfigurator.enableVerboseLogging();
    }

    TransferConfig config;
    try {
      TelemetryConfigurator.configureMetrics(effective);
      config = TransferConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid transfer arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (!Files.isRegularFile(config.input())) {
      log.error("Input file does not exist: {} (run 'sluice generate' to create one)", config.input());
      return ExitCode.IO_ERROR;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(config, metrics);
      MemoryUsageReporter memory = new MemoryUsageReporter();
      log.info("Transfer {} -> {} mode={} chunkBytes={} watermarks={}/{} latency={}",
          config.input(), config.output(), config.mode(), config.chunkBytes(),
          config.watermarks().highWaterBytes(), config.watermarks().lowWaterBytes(),
          config.latencyEnabled() ? config.latencyMs() + "ms" : "off");
      return switch (config.mode()) {
        case MANUAL -> runManual(root, memory);
        case PIPELINE -> runPipeline(root, memory);
        case PIPE -> runPipe(root, memory);
        case COMPARE -> runCompare(root, memory);
      };
    }
  }

  private static ExitCode runCompare(CompositionRoot root, MemoryUsageReporter memory) {
    ExitCode manual = runManual(root, memory);
    if (manual == ExitCode.INTERRUPTED) {
      return manual;
    }
    ExitCode pipeline = runPipeline(root, memory);
    return manual != ExitCode.SUCCESS ? manual : pipeline;
  }

  private static ExitCode runManual(CompositionRoot root, MemoryUsageReporter memory) {
    memory.report("before manual transfer");
    try {
      ManualTransferUseCase useCase = root.manualTransfer(root.config().outputFor(TransferMode.MANUAL));
      return succeeded("manual", useCase.run());
    } catch (TransferException ex) {
      return failed("manual", ex);
    } catch (IOException ex) {
      log.error("Manual transfer could not open its files", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Manual transfer interrupted");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in manual transfer", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      memory.report("after manual transfer");
    }
  }

  private static ExitCode runPipe(CompositionRoot root, MemoryUsageReporter memory) {
    memory.report("before pipe transfer");
    try {
      PipeTransferUseCase useCase = root.pipeTransfer(root.config().outputFor(TransferMode.PIPE));
      return succeeded("pipe", useCase.run());
    } catch (TransferException ex) {
      return failed("pipe", ex);
    } catch (IOException ex) {
      log.error("Pipe transfer could not open its files", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in pipe transfer", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      memory.report("after pipe transfer");
    }
  }

  private static ExitCode runPipeline(CompositionRoot root, MemoryUsageReporter memory) {
    memory.report("before pipeline transfer");
    PipelineOrchestrator orchestrator;
    try {
      orchestrator = root.pipelineTransfer(root.config().outputFor(TransferMode.PIPELINE));
    } catch (IOException ex) {
      log.error("Pipeline transfer could not open its files", ex);
      return ExitCode.IO_ERROR;
    }
    CountDownLatch finished = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      log.warn("Shutdown requested; cancelling pipeline");
      orchestrator.cancel();
      try {
        if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
          log.warn("Pipeline did not unwind within {}s", SHUTDOWN_GRACE_SECONDS);
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "sluice-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    try {
      return succeeded("pipeline", orchestrator.run());
    } catch (TransferException ex) {
      return failed("pipeline", ex);
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in pipeline transfer", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      finished.countDown();
      removeHook(hook);
      memory.report("after pipeline transfer");
    }
  }

  private static ExitCode succeeded(String label, TransferReport report) {
    CliPrinter.printf(
        "%s: %d bytes in %d ms, %d backpressure events, peak buffered %d bytes (total %d)",
        label,
        report.bytesConsumed(),
        report.elapsed().toMillis(),
        report.backpressureEvents(),
        report.peakBufferedBytes(),
        report.peakBufferedTotal());
    return ExitCode.SUCCESS;
  }

  private static ExitCode failed(String label, TransferException ex) {
    log.error("{} transfer failed ({}): {}", label, ex.kind(), ex.getMessage(), ex);
    CliPrinter.printf("%s: failed (%s in %s)", label, ex.kind(), ex.stage());
    return ExitCode.forFailure(ex.kind());
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutting down; shutdown hook stays registered");
    }
  }
}
