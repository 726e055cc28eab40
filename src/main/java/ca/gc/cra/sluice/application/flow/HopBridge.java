package ca.gc.cra.sluice.application.flow;

import ca.gc.cra.sluice.application.port.ChunkEmitter;
import ca.gc.cra.sluice.application.port.ChunkSink;
import ca.gc.cra.sluice.application.port.EmitterListener;
import ca.gc.cra.sluice.application.port.SinkListener;
import ca.gc.cra.sluice.application.session.TransferSession;
import ca.gc.cra.sluice.domain.transfer.AcceptResult;
import ca.gc.cra.sluice.domain.transfer.Chunk;
import ca.gc.cra.sluice.domain.transfer.FlowState;
import ca.gc.cra.sluice.domain.transfer.TransferException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Pause/resume bridge between one emitter and the sink it feeds.
 * <p><strong>Why:</strong> Every bridge strategy runs the same hop contract; only what happens on failure and
 * on completion differs, so those are the two extension points.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Move through {@link FlowState} by checked transitions only.</li>
 *   <li>Suspend the upstream on saturation, resume it on drain, and count each suspension.</li>
 *   <li>Report signals that arrive in the wrong state as {@code PROTOCOL_VIOLATION}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the session scheduler thread.</p>
 *
 * @since 0.1.0
 */
public abstract class HopBridge implements EmitterListener, SinkListener {
  private static final Logger log = LoggerFactory.getLogger(HopBridge.class);

  protected final ChunkEmitter upstream;
  protected final ChunkSink downstream;
  protected final TransferSession session;
  private final boolean sourceHop;
  private final String hop;

  private FlowState state = FlowState.IDLE;

  /**
   * Creates a bridge.
   *
   * @param upstream emitter feeding the hop
   * @param downstream sink receiving the hop's chunks
   * @param session session counters
   * @param sourceHop {@code true} when {@code upstream} is the session's source, so produced bytes are counted
   */
  protected HopBridge(ChunkEmitter upstream, ChunkSink downstream, TransferSession session, boolean sourceHop) {
    this.upstream = Objects.requireNonNull(upstream, "upstream");
    this.downstream = Objects.requireNonNull(downstream, "downstream");
    this.session = Objects.requireNonNull(session, "session");
    this.sourceHop = sourceHop;
    this.hop = upstream.name() + "->" + downstream.name();
  }

  /** Binds both endpoints and lets the upstream flow. */
  public void start() {
    transition(FlowState.ACTIVE);
    downstream.start(this);
    upstream.start(this);
  }

  public String hop() {
    return hop;
  }

  public FlowState state() {
    return state;
  }

  /**
   * Handles a failure seen by this hop.
   *
   * @param error failure to propagate
   */
  public abstract void fail(TransferException error);

  /** Called once, after the downstream confirmed it finished. */
  protected abstract void onHopFinished();

  /**
   * Moves a live hop to {@link FlowState#ERRORED}.
   *
   * @return {@code false} when the hop was already terminal
   */
  public final boolean markErrored() {
    if (state.isTerminal()) {
      return false;
    }
    transition(FlowState.ERRORED);
    return true;
  }

  @Override
  public void onChunk(Chunk chunk) {
    if (state.isTerminal()) {
      return;
    }
    if (state != FlowState.ACTIVE) {
      fail(TransferException.protocolViolation(upstream.name(), "emitted a chunk while hop was " + state));
      return;
    }
    if (sourceHop) {
      session.recordProduced(chunk);
    }
    AcceptResult result;
    try {
      result = downstream.accept(chunk);
    } catch (TransferException ex) {
      fail(ex);
      return;
    }
    if (result.saturated() && state == FlowState.ACTIVE) {
      transition(FlowState.SATURATED);
      upstream.suspend();
      session.recordBackpressure(hop, chunk.endOffset());
      log.debug("{} saturated at offset {}; upstream suspended", hop, chunk.endOffset());
    }
  }

  @Override
  public void onDrained() {
    if (state.isTerminal()) {
      return;
    }
    if (state != FlowState.SATURATED) {
      fail(TransferException.protocolViolation(downstream.name(), "drained while hop was " + state));
      return;
    }
    transition(FlowState.ACTIVE);
    log.debug("{} drained; resuming upstream", hop);
    upstream.resume();
  }

  @Override
  public void onEnd() {
    if (state.isTerminal()) {
      return;
    }
    if (state != FlowState.ACTIVE) {
      fail(TransferException.protocolViolation(upstream.name(), "ended while hop was " + state));
      return;
    }
    transition(FlowState.ENDING);
    downstream.finish();
  }

  @Override
  public void onFinished() {
    if (state.isTerminal()) {
      return;
    }
    if (state != FlowState.ENDING) {
      fail(TransferException.protocolViolation(downstream.name(), "finished while hop was " + state));
      return;
    }
    transition(FlowState.FINISHED);
    onHopFinished();
  }

  @Override
  public void onError(TransferException error) {
    fail(error);
  }

  private void transition(FlowState next) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException(hop + ": illegal transition " + state + " -> " + next);
    }
    state = next;
  }
}
