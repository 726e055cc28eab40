package ca.gc.cra.sluice.application.flow;

import ca.gc.cra.sluice.application.port.ChunkEmitter;
import ca.gc.cra.sluice.application.port.ChunkSink;
import ca.gc.cra.sluice.application.session.TransferSession;
import ca.gc.cra.sluice.domain.transfer.TransferException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Manual-mode bridge for one hop: pauses the upstream on saturation and resumes it on
 * drain.
 * <p><strong>Why:</strong> Pausing the producer, never queueing its output, is what bounds memory; the
 * controller itself holds no chunk.</p>
 * <p><strong>Role:</strong> Wired by {@link ManualTransferUseCase}, one instance per hop.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run the {@link HopBridge} contract for its hop.</li>
 *   <li>On any error, abort both ends of its hop and report to its {@link Completion}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the session scheduler thread.</p>
 * <p><strong>Observability:</strong> Logs hop failures at DEBUG; saturation and drain are logged by the base
 * bridge.</p>
 *
 * @implNote Cleanup beyond the hop's two endpoints is left to the caller; a latency stage relays aborts to
 * its other side, which is the only cross-hop propagation manual mode gets.
 * @since 0.1.0
 */
public final class FlowController extends HopBridge {
  private static final Logger log = LoggerFactory.getLogger(FlowController.class);

  /** Receives the terminal outcome of a hop. */
  public interface Completion {
    void onHopFinished(FlowController controller);

    void onHopFailed(FlowController controller, TransferException error);
  }

  private final Completion completion;

  /**
   * Creates a controller.
   *
   * @param upstream emitter feeding the hop
   * @param downstream sink receiving the hop's chunks
   * @param session session counters
   * @param sourceHop {@code true} when {@code upstream} is the session's source, so produced bytes are counted
   * @param completion receiver of the hop's terminal outcome
   */
  public FlowController(
      ChunkEmitter upstream,
      ChunkSink downstream,
      TransferSession session,
      boolean sourceHop,
      Completion completion) {
    super(upstream, downstream, session, sourceHop);
    this.completion = Objects.requireNonNull(completion, "completion");
  }

  /**
   * Aborts both endpoints of this hop; no-op once the hop is terminal.
   *
   * @param error failure to propagate
   */
  @Override
  public void fail(TransferException error) {
    if (!markErrored()) {
      return;
    }
    log.debug("{} errored: {}", hop(), error.getMessage());
    // record before aborting: a stage echoes the abort to the neighbouring hop
    session.fail(error);
    upstream.abort(error);
    downstream.abort(error);
    completion.onHopFailed(this, error);
  }

  @Override
  protected void onHopFinished() {
    completion.onHopFinished(this);
  }
}
