package ca.gc.cra.sluice.application.port;

import ca.gc.cra.sluice.domain.transfer.TransferException;

/**
 * <strong>What:</strong> Upstream half of the capability contract shared by both bridge strategies.
 * <p><strong>Why:</strong> Sources and latency stages must be pausable in exactly the same way so the manual
 * flow controller and the pipeline orchestrator apply one backpressure rule.</p>
 * <p><strong>Role:</strong> Application port implemented by {@link ChunkSource} and {@link ChunkStage}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Deliver chunks, then exactly one terminal signal, to the bound {@link EmitterListener}.</li>
 *   <li>Stop invoking the listener while suspended.</li>
 *   <li>Release owned resources exactly once on abort.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the session scheduler thread.</p>
 *
 * @since 0.1.0
 */
public interface ChunkEmitter {
  /**
   * Component name used in errors, logs and reports.
   *
   * @return stable, human-readable name
   */
  String name();

  /**
   * Binds the listener and begins emitting when data is available.
   *
   * @param listener receiver of chunks and terminal signals; must not be {@code null}
   * @throws IllegalStateException if already started
   */
  void start(EmitterListener listener);

  /** Stops invoking the listener until {@link #resume()}; no-op when already suspended. */
  void suspend();

  /** Restarts emission after {@link #suspend()}; no-op when not suspended. */
  void resume();

  /**
   * Reports whether the emitter is currently suspended.
   *
   * @return {@code true} between {@link #suspend()} and {@link #resume()}
   */
  boolean isSuspended();

  /**
   * Terminates the emitter, releasing its resources; no-op once terminal.
   *
   * @param cause failure that triggered the abort; must not be {@code null}
   */
  void abort(TransferException cause);
}
