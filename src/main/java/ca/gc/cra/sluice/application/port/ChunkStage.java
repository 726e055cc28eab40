package ca.gc.cra.sluice.application.port;

/**
 * Intermediate component that accepts chunks like a sink and re-emits them like a source.
 *
 * <p>An abort received on either side is reported to the listeners on both sides so a bridge holding only
 * one end of the stage still learns about the failure. Bridges that already failed ignore the echo.</p>
 *
 * @since 0.1.0
 */
public interface ChunkStage extends ChunkSink, ChunkEmitter {}
