package ca.gc.cra.sluice.config;

import ca.gc.cra.sluice.application.flow.ManualTransferUseCase;
import ca.gc.cra.sluice.application.pipeline.PipeTransferUseCase;
import ca.gc.cra.sluice.application.pipeline.PipelineOrchestrator;
import ca.gc.cra.sluice.application.port.ChunkStage;
import ca.gc.cra.sluice.application.port.MetricsPort;
import ca.gc.cra.sluice.application.port.ReadableResource;
import ca.gc.cra.sluice.application.port.ResourceProvider;
import ca.gc.cra.sluice.application.port.SessionScheduler;
import ca.gc.cra.sluice.application.port.TransferObserver;
import ca.gc.cra.sluice.application.port.WritableResource;
import ca.gc.cra.sluice.application.session.BufferLedger;
import ca.gc.cra.sluice.application.session.SessionTopology;
import ca.gc.cra.sluice.application.session.TransferSession;
import ca.gc.cra.sluice.application.stage.LatencyStage;
import ca.gc.cra.sluice.application.stage.ResourceChunkSink;
import ca.gc.cra.sluice.application.stage.ResourceChunkSource;
import ca.gc.cra.sluice.infrastructure.io.FileResourceProvider;
import ca.gc.cra.sluice.infrastructure.report.CompositeTransferObserver;
import ca.gc.cra.sluice.infrastructure.report.LoggingTransferObserver;
import ca.gc.cra.sluice.infrastructure.report.MetricsTransferObserver;
import ca.gc.cra.sluice.infrastructure.scheduler.EventLoopScheduler;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires transfer sessions from a {@link TransferConfig}.
 * <p><strong>Why:</strong> Keeps component construction in one place; each session gets fresh components,
 * a fresh scheduler and its own observer so sessions share nothing.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open resources and assemble {@code source -> [latency] -> sink}.</li>
 *   <li>Create the manual use case, the pipe use case or the pipeline orchestrator over that topology.</li>
 *   <li>Combine log and metrics reporting into the session observer.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Factory methods only read immutable state; sessions built from one root
 * may run on different threads.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final TransferConfig config;
  private final MetricsPort metrics;
  private final Supplier<? extends SessionScheduler> schedulers;

  /**
   * Creates a root using wall-clock event loops.
   *
   * @param config transfer settings
   * @param metrics metrics adapter shared by all sessions
   */
  public CompositionRoot(TransferConfig config, MetricsPort metrics) {
    this(config, metrics, EventLoopScheduler::new);
  }

  /**
   * Creates a root with an explicit scheduler factory.
   *
   * @param config transfer settings
   * @param metrics metrics adapter shared by all sessions
   * @param schedulers supplies one scheduler per session
   */
  public CompositionRoot(
      TransferConfig config, MetricsPort metrics, Supplier<? extends SessionScheduler> schedulers) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.schedulers = Objects.requireNonNull(schedulers, "schedulers");
  }

  public TransferConfig config() {
    return config;
  }

  /**
   * Builds a manual-mode session writing to {@code output}.
   *
   * @param output destination file
   * @return ready-to-run use case
   * @throws IOException if either file cannot be opened
   */
  public ManualTransferUseCase manualTransfer(Path output) throws IOException {
    SessionTopology topology = topology(new FileResourceProvider(config.input(), output));
    return new ManualTransferUseCase(topology, TransferSession.newId(), observer());
  }

  /**
   * Builds a pipeline-mode session writing to {@code output}.
   *
   * @param output destination file
   * @return ready-to-run orchestrator
   * @throws IOException if either file cannot be opened
   */
  public PipelineOrchestrator pipelineTransfer(Path output) throws IOException {
    SessionTopology topology = topology(new FileResourceProvider(config.input(), output));
    return new PipelineOrchestrator(topology, TransferSession.newId(), observer());
  }

  /**
   * Builds a pipe-mode session writing to {@code output}.
   *
   * @param output destination file
   * @return ready-to-run use case
   * @throws IOException if either file cannot be opened
   */
  public PipeTransferUseCase pipeTransfer(Path output) throws IOException {
    SessionTopology topology = topology(new FileResourceProvider(config.input(), output));
    return new PipeTransferUseCase(topology, TransferSession.newId(), observer());
  }

  /**
   * Opens both resources and assembles the components of one session.
   *
   * @param resources resource supplier for this session
   * @return components bound to a fresh scheduler and ledger
   * @throws IOException if a resource cannot be opened; nothing stays open in that case
   */
  public SessionTopology topology(ResourceProvider resources) throws IOException {
    Objects.requireNonNull(resources, "resources");
    SessionScheduler scheduler = schedulers.get();
    BufferLedger ledger = new BufferLedger();
    ReadableResource readable = resources.openReadable();
    WritableResource writable;
    try {
      writable = resources.openWritable();
    } catch (IOException | RuntimeException ex) {
      closeQuietly(readable);
      throw ex;
    }
    ResourceChunkSource source =
        new ResourceChunkSource("source", readable, config.chunkBytes(), scheduler);
    List<ChunkStage> stages = config.latencyEnabled()
        ? List.of(new LatencyStage("latency", config.latencyMs(), config.watermarks(), scheduler, ledger))
        : List.of();
    ResourceChunkSink sink =
        new ResourceChunkSink("sink", writable, config.watermarks(), scheduler, ledger);
    log.debug("Session topology: chunkBytes={} watermarks={} latency={}",
        config.chunkBytes(), config.watermarks(), config.latencyEnabled() ? config.latencyMs() + "ms" : "off");
    return new SessionTopology(source, stages, sink, scheduler, ledger);
  }

  /**
   * Creates the reporting collaborator for one session.
   *
   * @return observer logging events and recording metrics
   */
  public TransferObserver observer() {
    return CompositeTransferObserver.of(new LoggingTransferObserver(), new MetricsTransferObserver(metrics));
  }

  private static void closeQuietly(ReadableResource readable) {
    try {
      readable.close();
    } catch (IOException ex) {
      log.warn("Failed to close input after output open failure", ex);
    }
  }
}
