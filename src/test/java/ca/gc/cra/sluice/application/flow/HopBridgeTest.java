package ca.gc.cra.sluice.application.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sluice.application.session.SessionTopology;
import ca.gc.cra.sluice.application.session.TransferSession;
import ca.gc.cra.sluice.domain.transfer.FlowState;
import ca.gc.cra.sluice.domain.transfer.TransferErrorKind;
import ca.gc.cra.sluice.domain.transfer.TransferException;
import ca.gc.cra.sluice.domain.transfer.Watermarks;
import ca.gc.cra.sluice.testutil.CapturingWritableResource;
import ca.gc.cra.sluice.testutil.PatternReadableResource;
import ca.gc.cra.sluice.testutil.RecordingObserver;
import ca.gc.cra.sluice.testutil.Topologies;
import ca.gc.cra.sluice.testutil.VirtualTimeScheduler;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class HopBridgeTest {
  private final VirtualTimeScheduler scheduler = new VirtualTimeScheduler();
  private final RecordingObserver observer = new RecordingObserver();

  private RecordingBridge bridge(long size, int highWater) {
    SessionTopology topology = Topologies.build(
        new PatternReadableResource(size), CapturingWritableResource.keepingBytes(),
        64, Watermarks.single(highWater), -1, scheduler);
    TransferSession session = new TransferSession("hop", scheduler, observer, topology.ledger());
    return new RecordingBridge(topology, session);
  }

  @Test
  void runsToFinishedAndReportsCompletionOnce() {
    RecordingBridge bridge = bridge(256, 64);

    bridge.start();
    scheduler.runUntilIdle();

    assertEquals(FlowState.FINISHED, bridge.state());
    assertEquals(1, bridge.finished);
    assertTrue(bridge.failures.isEmpty());
    assertEquals(4, observer.backpressure.size());
  }

  @Test
  void finishedBeforeEndIsProtocolViolation() {
    RecordingBridge bridge = bridge(256, 64);
    bridge.start();

    bridge.onFinished();

    assertEquals(1, bridge.failures.size());
    assertEquals(TransferErrorKind.PROTOCOL_VIOLATION, bridge.failures.get(0).kind());
    assertEquals("sink", bridge.failures.get(0).stage());
    assertEquals(FlowState.ERRORED, bridge.state());
    assertEquals(0, bridge.finished);
  }

  @Test
  void endWhileIdleIsProtocolViolationNamingUpstream() {
    RecordingBridge bridge = bridge(256, 64);

    bridge.onEnd();

    assertEquals("source", bridge.failures.get(0).stage());
    assertEquals(FlowState.ERRORED, bridge.state());
  }

  @Test
  void erroredHopRejectsRestartAndIgnoresSignals() {
    RecordingBridge bridge = bridge(256, 64);
    bridge.start();

    assertTrue(bridge.markErrored());
    assertFalse(bridge.markErrored());
    bridge.onDrained();
    bridge.onEnd();
    bridge.onFinished();

    assertTrue(bridge.failures.isEmpty());
    IllegalStateException ex = assertThrows(IllegalStateException.class, bridge::start);
    assertTrue(ex.getMessage().contains("ERRORED -> ACTIVE"));
  }

  /** Bridge that records outcomes and stops itself on failure. */
  private static final class RecordingBridge extends HopBridge {
    private final List<TransferException> failures = new ArrayList<>();
    private int finished;

    RecordingBridge(SessionTopology topology, TransferSession session) {
      super(topology.source(), topology.sink(), session, true);
    }

    @Override
    public void fail(TransferException error) {
      if (markErrored()) {
        failures.add(error);
      }
    }

    @Override
    protected void onHopFinished() {
      finished++;
    }
  }
}
