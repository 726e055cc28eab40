package ca.gc.cra.sluice.application.pipeline;

import static ca.gc.cra.sluice.testutil.Topologies.KIB;
import static ca.gc.cra.sluice.testutil.Topologies.MIB;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sluice.application.port.TransferObserver;
import ca.gc.cra.sluice.application.session.SessionTopology;
import ca.gc.cra.sluice.domain.transfer.TransferErrorKind;
import ca.gc.cra.sluice.domain.transfer.TransferException;
import ca.gc.cra.sluice.domain.transfer.TransferReport;
import ca.gc.cra.sluice.domain.transfer.Watermarks;
import ca.gc.cra.sluice.testutil.CapturingWritableResource;
import ca.gc.cra.sluice.testutil.PatternReadableResource;
import ca.gc.cra.sluice.testutil.RecordingObserver;
import ca.gc.cra.sluice.testutil.Topologies;
import ca.gc.cra.sluice.testutil.VirtualTimeScheduler;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class PipeTransferUseCaseTest {
  private final VirtualTimeScheduler scheduler = new VirtualTimeScheduler();
  private final RecordingObserver observer = new RecordingObserver();

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  void copiesThroughLatencyStageWithinBufferBound() throws TransferException {
    long size = 4L * MIB;
    int chunk = 16 * KIB;
    long capacity = 64 * KIB;
    CapturingWritableResource writable = CapturingWritableResource.checksumOnly();
    SessionTopology topology = Topologies.build(
        new PatternReadableResource(size), writable, chunk, Watermarks.single(capacity), 10, scheduler);

    TransferReport report = new PipeTransferUseCase(topology, "pipe-1", observer).run();

    assertEquals(size, report.bytesConsumed());
    assertEquals(PatternReadableResource.crc32(size), writable.crc32());
    assertTrue(report.backpressureEvents() > 0);
    assertTrue(report.peakBufferedTotal() <= capacity + chunk,
        "total peak " + report.peakBufferedTotal() + " exceeds bound");
    assertEquals(1, writable.closeCount());
    assertEquals(List.of(report), observer.completed);
  }

  @Test
  void backpressureMatchesOrchestratorForSameConfiguration() throws TransferException {
    SessionTopology piped = Topologies.build(
        new PatternReadableResource(2L * MIB), CapturingWritableResource.checksumOnly(),
        16 * KIB, new Watermarks(64 * KIB, 16 * KIB), 3, new VirtualTimeScheduler());
    SessionTopology orchestrated = Topologies.build(
        new PatternReadableResource(2L * MIB), CapturingWritableResource.checksumOnly(),
        16 * KIB, new Watermarks(64 * KIB, 16 * KIB), 3, new VirtualTimeScheduler());

    long viaPipe = new PipeTransferUseCase(piped, "pipe-2", TransferObserver.NO_OP).run().backpressureEvents();
    long viaPipeline =
        new PipelineOrchestrator(orchestrated, "pipeline-2", TransferObserver.NO_OP).run().backpressureEvents();

    assertEquals(viaPipeline, viaPipe);
  }

  @Test
  void zeroByteInputCompletesWithoutBackpressure() throws TransferException {
    CapturingWritableResource writable = CapturingWritableResource.keepingBytes();
    SessionTopology topology = Topologies.build(
        new PatternReadableResource(0), writable, 64 * KIB, Watermarks.single(64 * KIB), 10, scheduler);

    TransferReport report = new PipeTransferUseCase(topology, "pipe-0", observer).run();

    assertEquals(0, report.bytesConsumed());
    assertEquals(0, report.backpressureEvents());
    assertEquals(1, writable.closeCount());
  }

  @Test
  void sinkFailureMakesCallerAbortBothEnds() {
    PatternReadableResource readable = new PatternReadableResource(MIB);
    CapturingWritableResource writable = CapturingWritableResource.failingAt(256 * KIB);
    SessionTopology topology = Topologies.build(
        readable, writable, 64 * KIB, Watermarks.single(64 * KIB), -1, scheduler);

    TransferException ex = assertThrows(TransferException.class,
        () -> new PipeTransferUseCase(topology, "pipe-3", observer).run());

    assertEquals(TransferErrorKind.SINK_WRITE, ex.kind());
    assertEquals(1, Topologies.source(topology).abortCount());
    assertEquals(1, Topologies.sink(topology).aborts());
    assertEquals(0, Topologies.sink(topology).acceptsAfterError());
    assertEquals(256L * KIB, writable.written());
    assertEquals(1, readable.closeCount());
    assertEquals(1, writable.closeCount());
    assertEquals(List.of(TransferErrorKind.SINK_WRITE), observer.errors);
  }

  @Test
  void sourceFailureBehindStageAbortsSourceAndSink() {
    PatternReadableResource readable = PatternReadableResource.failingAt(MIB, 256 * KIB);
    CapturingWritableResource writable = CapturingWritableResource.checksumOnly();
    SessionTopology topology = Topologies.build(
        readable, writable, 64 * KIB, Watermarks.single(64 * KIB), 10, scheduler);

    TransferException ex = assertThrows(TransferException.class,
        () -> new PipeTransferUseCase(topology, "pipe-4", observer).run());

    assertEquals(TransferErrorKind.SOURCE_READ, ex.kind());
    assertEquals("source", ex.stage());
    assertEquals(1, Topologies.source(topology).abortCount());
    assertEquals(1, Topologies.sink(topology).aborts());
    assertEquals(1, readable.closeCount());
    assertEquals(1, writable.closeCount());
  }

  @Test
  void interruptionAbortsEndsAndKeepsInterruptFlag() {
    SessionTopology topology = Topologies.build(
        new PatternReadableResource(MIB), CapturingWritableResource.checksumOnly(),
        64 * KIB, Watermarks.single(64 * KIB), 10, scheduler);
    PipeTransferUseCase pipe = new PipeTransferUseCase(topology, "pipe-5", observer);

    Thread.currentThread().interrupt();
    TransferException ex = assertThrows(TransferException.class, pipe::run);

    assertEquals(TransferErrorKind.PIPELINE_ABORT, ex.kind());
    assertTrue(Thread.currentThread().isInterrupted());
    assertEquals(1, Topologies.source(topology).abortCount());
    assertEquals(1, Topologies.sink(topology).aborts());
  }

  @Test
  void runsOnlyOnce() throws TransferException {
    SessionTopology topology = Topologies.build(
        new PatternReadableResource(16), CapturingWritableResource.keepingBytes(),
        8, Watermarks.single(64), -1, scheduler);
    PipeTransferUseCase pipe = new PipeTransferUseCase(topology, "pipe-6", observer);
    pipe.run();

    assertThrows(IllegalStateException.class, pipe::run);
  }
}
