package ca.gc.cra.sluice.application.flow;

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
 * <strong>What:</strong> Runs a transfer with caller-wired {@link FlowController}s, one per hop.
 * <p><strong>Why:</strong> Retained as the baseline against which the pipeline orchestrator's centralized
 * teardown is compared; cleanup here is ad hoc.</p>
 * <p><strong>Role:</strong> Application use case for manual mode.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; run once, on the thread that should drive the session
 * scheduler.</p>
 * <p><strong>Observability:</strong> Places {@code sessionId} in the MDC while running.</p>
 *
 * @implNote On interruption only the source and the terminal sink are aborted, mirroring a caller that tears
 * down the two ends it knows about; intermediate stages are left to the discarded scheduler.
 * @since 0.1.0
 */
public final class ManualTransferUseCase {
  private static final Logger log = LoggerFactory.getLogger(ManualTransferUseCase.class);

  private final SessionTopology topology;
  private final TransferSession session;
  private final List<FlowController> controllers = new ArrayList<>();
  private int finishedHops;
  private boolean started;

  /**
   * Creates the use case.
   *
   * @param topology components of this session
   * @param sessionId identifier used in logs and events
   * @param observer reporting collaborator for this session
   */
  public ManualTransferUseCase(
      SessionTopology topology, String sessionId, TransferObserver observer) {
    this.topology = Objects.requireNonNull(topology, "topology");
    this.session = new TransferSession(
        sessionId, topology.scheduler(), Objects.requireNonNull(observer, "observer"), topology.ledger());
  }

  /**
   * Runs the transfer to completion on the calling thread.
   *
   * @return final counters
   * @throws TransferException the first failure observed by any hop
   * @throws InterruptedException if the calling thread is interrupted while the session is idle
   */
  public TransferReport run() throws TransferException, InterruptedException {
    if (started) {
      throw new IllegalStateException("manual transfer already started");
    }
    started = true;
    String previousSession = MDC.get("sessionId");
    MDC.put("sessionId", session.id());
    try {
      wireHops();
      session.begin();
      log.info("Manual transfer {} started across {} hop(s)", session.id(), controllers.size());
      // downstream hops first so every sink is bound before chunks arrive
      for (int i = controllers.size() - 1; i >= 0; i--) {
        controllers.get(i).start();
      }
      try {
        topology.scheduler().runUntil(() -> session.isResolved() || finishedHops == controllers.size());
      } catch (InterruptedException ex) {
        TransferException aborted = TransferException.aborted("manual", "interrupted");
        session.fail(aborted);
        topology.source().abort(aborted);
        topology.sink().abort(aborted);
        throw ex;
      }
      if (session.failure().isPresent()) {
        throw session.failure().get();
      }
      TransferReport report =
          session.complete(topology.sink().bytesDelivered(), topology.peakBufferedByComponent());
      log.info("Manual transfer {} finished: {} bytes, {} backpressure events",
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

  private void wireHops() {
    FlowController.Completion completion = new FlowController.Completion() {
      @Override
      public void onHopFinished(FlowController controller) {
        finishedHops++;
        log.debug("Hop {} finished ({}/{})", controller.hop(), finishedHops, controllers.size());
      }

      @Override
      public void onHopFailed(FlowController controller, TransferException error) {
        log.warn("Hop {} failed: {}", controller.hop(), error.getMessage());
      }
    };
    ChunkEmitter upstream = topology.source();
    List<ChunkSink> sinks = topology.sinks();
    for (int i = 0; i < sinks.size(); i++) {
      ChunkSink downstream = sinks.get(i);
      controllers.add(new FlowController(upstream, downstream, session, i == 0, completion));
      if (i < topology.stages().size()) {
        upstream = topology.stages().get(i);
      }
    }
  }
}
