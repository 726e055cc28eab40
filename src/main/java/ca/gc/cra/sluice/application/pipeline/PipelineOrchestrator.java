package ca.gc.cra.sluice.application.pipeline;

import ca.gc.cra.sluice.application.flow.HopBridge;
import ca.gc.cra.sluice.application.port.ChunkEmitter;
import ca.gc.cra.sluice.application.port.ChunkSink;
import ca.gc.cra.sluice.application.port.TransferObserver;
import ca.gc.cra.sluice.application.session.SessionTopology;
import ca.gc.cra.sluice.application.session.TransferSession;
import ca.gc.cra.sluice.domain.transfer.TransferException;
import ca.gc.cra.sluice.domain.transfer.TransferReport;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Links {@code source -> stages... -> sink} and drives the session to one outcome.
 * <p><strong>Why:</strong> Manual wiring leaves cleanup to each hop; here every failure, from any component or
 * from cancellation, funnels into a single teardown that aborts every component exactly once.</p>
 * <p><strong>Role:</strong> Application service behind pipeline mode.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run the {@link HopBridge} contract on every link.</li>
 *   <li>Resolve successfully only after every link finished; resolve at most once.</li>
 *   <li>Surface the first error to the caller after teardown completed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #run()} drives the scheduler on the calling thread;
 * {@link #cancel()} may be called from any thread.</p>
 * <p><strong>Observability:</strong> Places {@code sessionId} in the MDC while running; logs link outcomes
 * at DEBUG and the session outcome at INFO.</p>
 *
 * @since 0.1.0
 */
public final class PipelineOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);
  private static final String STAGE = "pipeline";

  private final SessionTopology topology;
  private final TransferSession session;
  private final List<Link> links = new ArrayList<>();
  private final Set<Object> tornDown = Collections.newSetFromMap(new IdentityHashMap<>());
  private final AtomicBoolean started = new AtomicBoolean();
  private int finishedLinks;

  /**
   * Creates an orchestrator for one session.
   *
   * @param topology components of this session
   * @param sessionId identifier used in logs and events
   * @param observer reporting collaborator for this session
   */
  public PipelineOrchestrator(SessionTopology topology, String sessionId, TransferObserver observer) {
    this.topology = Objects.requireNonNull(topology, "topology");
    this.session = new TransferSession(
        sessionId, topology.scheduler(), Objects.requireNonNull(observer, "observer"), topology.ledger());
  }

  /**
   * Runs the pipeline to completion on the calling thread.
   *
   * @return final counters once every link finished
   * @throws TransferException the first failure, after all components were torn down; interruption of the
   *     calling thread surfaces as {@code PIPELINE_ABORT} with the interrupt flag restored
   */
  public TransferReport run() throws TransferException {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("pipeline already started");
    }
    String previousSession = MDC.get("sessionId");
    MDC.put("sessionId", session.id());
    try {
      link();
      session.begin();
      log.info("Pipeline {} started with {} link(s)", session.id(), links.size());
      for (int i = links.size() - 1; i >= 0; i--) {
        links.get(i).start();
      }
      try {
        topology.scheduler().runUntil(session::isResolved);
      } catch (InterruptedException ex) {
        fail(TransferException.aborted(STAGE, "interrupted"));
        Thread.currentThread().interrupt();
      } catch (RuntimeException ex) {
        fail(TransferException.aborted(STAGE, "unexpected failure: " + ex));
        throw ex;
      }
      if (session.failure().isPresent()) {
        TransferException error = session.failure().get();
        log.info("Pipeline {} failed: {} ({})", session.id(), error.getMessage(), error.kind());
        throw error;
      }
      TransferReport report = session.report()
          .orElseThrow(() -> new IllegalStateException("pipeline " + session.id() + " stopped unresolved"));
      log.info("Pipeline {} finished: {} bytes, {} backpressure events",
          session.id(), report.bytesConsumed(), report.backpressureEvents());
      return report;
    } finally {
      if (previousSession == null) {
        MDC.remove("sessionId");
      } else {
        MDC.put("sessionId", previousSession);
      }
    }
  }

  /**
   * Requests cancellation; {@link #run()} then tears the pipeline down and throws {@code PIPELINE_ABORT}.
   * No-op once the session resolved.
   */
  public void cancel() {
    topology.scheduler().execute(() -> fail(TransferException.aborted(STAGE, "cancelled")));
  }

  public TransferSession session() {
    return session;
  }

  private void link() {
    ChunkEmitter upstream = topology.source();
    List<ChunkSink> sinks = topology.sinks();
    for (int i = 0; i < sinks.size(); i++) {
      links.add(new Link(upstream, sinks.get(i), i == 0));
      if (i < topology.stages().size()) {
        upstream = topology.stages().get(i);
      }
    }
  }

  private void fail(TransferException error) {
    if (!session.fail(error)) {
      return;
    }
    log.debug("Tearing down pipeline {}: {}", session.id(), error.getMessage());
    for (Link link : links) {
      link.markErrored();
    }
    abortOnce(topology.source(), error);
    for (ChunkSink component : topology.sinks()) {
      abortOnce(component, error);
    }
  }

  private void abortOnce(Object component, TransferException error) {
    if (!tornDown.add(component)) {
      return;
    }
    if (component instanceof ChunkEmitter emitter) {
      emitter.abort(error);
    } else if (component instanceof ChunkSink sink) {
      sink.abort(error);
    }
  }

  private void linkFinished(Link link) {
    finishedLinks++;
    log.debug("Link {} finished ({}/{})", link.hop(), finishedLinks, links.size());
    if (finishedLinks == links.size() && !session.isResolved()) {
      session.complete(topology.sink().bytesDelivered(), topology.peakBufferedByComponent());
    }
  }

  /** Hop of the pipeline; every failure goes to the central teardown. */
  private final class Link extends HopBridge {
    Link(ChunkEmitter upstream, ChunkSink downstream, boolean sourceLink) {
      super(upstream, downstream, PipelineOrchestrator.this.session, sourceLink);
    }

    @Override
    public void fail(TransferException error) {
      PipelineOrchestrator.this.fail(error);
    }

    @Override
    protected void onHopFinished() {
      linkFinished(this);
    }
  }
}
