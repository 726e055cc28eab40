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
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Chains every hop with automatic pause/resume, but leaves error cleanup to the call
 * site.
 * <p><strong>Why:</strong> Sits between the two other strategies: links are wired for the caller as in
 * {@link PipelineOrchestrator}, yet on failure the caller only knows the two ends and aborts the source and
 * the sink itself. Intermediate stages are not torn down.</p>
 * <p><strong>Role:</strong> Application use case for pipe mode.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; run once, on the thread that should drive the session
 * scheduler.</p>
 * <p><strong>Observability:</strong> Places {@code sessionId} in the MDC while running.</p>
 *
 * @since 0.1.0
 */
public final class PipeTransferUseCase {
  private static final Logger log = LoggerFactory.getLogger(PipeTransferUseCase.class);
  private static final String STAGE = "pipe";

  private final SessionTopology topology;
  private final TransferSession session;
  private final List<PipeLink> links = new ArrayList<>();
  private int finishedLinks;
  private boolean endpointsAborted;
  private boolean started;

  /**
   * Creates the use case.
   *
   * @param topology components of this session
   * @param sessionId identifier used in logs and events
   * @param observer reporting collaborator for this session
   */
  public PipeTransferUseCase(SessionTopology topology, String sessionId, TransferObserver observer) {
    this.topology = Objects.requireNonNull(topology, "topology");
    this.session = new TransferSession(
        sessionId, topology.scheduler(), Objects.requireNonNull(observer, "observer"), topology.ledger());
  }

  /**
   * Runs the transfer to completion on the calling thread.
   *
   * @return final counters once every link finished
   * @throws TransferException the first failure reported by any link; interruption of the calling thread
   *     surfaces as {@code PIPELINE_ABORT} with the interrupt flag restored
   */
  public TransferReport run() throws TransferException {
    if (started) {
      throw new IllegalStateException("pipe transfer already started");
    }
    started = true;
    String previousSession = MDC.get("sessionId");
    MDC.put("sessionId", session.id());
    try {
      chain();
      session.begin();
      log.info("Pipe transfer {} started with {} link(s)", session.id(), links.size());
      for (int i = links.size() - 1; i >= 0; i--) {
        links.get(i).start();
      }
      try {
        topology.scheduler().runUntil(session::isResolved);
      } catch (InterruptedException ex) {
        onFailure(TransferException.aborted(STAGE, "interrupted"));
        Thread.currentThread().interrupt();
      }
      if (session.failure().isPresent()) {
        throw session.failure().get();
      }
      TransferReport report = session.report()
          .orElseThrow(() -> new IllegalStateException("pipe " + session.id() + " stopped unresolved"));
      log.info("Pipe transfer {} finished: {} bytes, {} backpressure events",
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

  public TransferSession session() {
    return session;
  }

  private void chain() {
    ChunkEmitter upstream = topology.source();
    List<ChunkSink> sinks = topology.sinks();
    for (int i = 0; i < sinks.size(); i++) {
      links.add(new PipeLink(upstream, sinks.get(i), i == 0));
      if (i < topology.stages().size()) {
        upstream = topology.stages().get(i);
      }
    }
  }

  private void onFailure(TransferException error) {
    if (!session.fail(error)) {
      return;
    }
    log.warn("Pipe transfer {} failed in {}: {}", session.id(), error.stage(), error.getMessage());
    if (!endpointsAborted) {
      endpointsAborted = true;
      topology.source().abort(error);
      topology.sink().abort(error);
    }
  }

  private void linkFinished(PipeLink link) {
    finishedLinks++;
    log.debug("Link {} finished ({}/{})", link.hop(), finishedLinks, links.size());
    if (finishedLinks == links.size() && !session.isResolved()) {
      session.complete(topology.sink().bytesDelivered(), topology.peakBufferedByComponent());
    }
  }

  /** Hop that only stops itself on failure and hands the error to the caller. */
  private final class PipeLink extends HopBridge {
    PipeLink(ChunkEmitter upstream, ChunkSink downstream, boolean sourceLink) {
      super(upstream, downstream, PipeTransferUseCase.this.session, sourceLink);
    }

    @Override
    public void fail(TransferException error) {
      if (markErrored()) {
        onFailure(error);
      }
    }

    @Override
    protected void onHopFinished() {
      linkFinished(this);
    }
  }
}
