package ca.gc.cra.sluice.application.port;

import java.util.function.BooleanSupplier;

/**
 * <strong>What:</strong> Single logical thread of control for one transfer session.
 * <p><strong>Why:</strong> Components coordinate through posted tasks and timers instead of blocking waits, so
 * suspension never parks a thread.</p>
 * <p><strong>Role:</strong> Port implemented by {@code EventLoopScheduler}; tests use a virtual-time
 * implementation.</p>
 * <p><strong>Thread-safety:</strong> {@link #execute(Runnable)}, {@link #schedule(Runnable, long)} and
 * {@link Cancellable#cancel()} may be called from any thread; tasks run on the thread inside
 * {@link #runUntil(BooleanSupplier)}.</p>
 *
 * @since 0.1.0
 */
public interface SessionScheduler {
  /**
   * Queues a task to run after the tasks already queued.
   *
   * @param task task to run on the loop thread
   */
  void execute(Runnable task);

  /**
   * Queues a task to run once {@code delayMillis} elapsed on this scheduler's clock.
   *
   * @param task task to run on the loop thread
   * @param delayMillis delay in milliseconds; zero or negative runs as soon as possible
   * @return handle that prevents the task from running when cancelled in time
   */
  Cancellable schedule(Runnable task, long delayMillis);

  /**
   * Current reading of this scheduler's monotonic clock.
   *
   * @return nanoseconds from an arbitrary origin
   */
  long nowNanos();

  /**
   * Runs tasks on the calling thread until {@code done} reports {@code true}.
   *
   * @param done condition evaluated after every task
   * @throws InterruptedException if the calling thread is interrupted while idle
   */
  void runUntil(BooleanSupplier done) throws InterruptedException;

  /** Handle returned by {@link #schedule(Runnable, long)}. */
  interface Cancellable {
    /**
     * Prevents the task from running.
     *
     * @return {@code true} if the task had not run yet
     */
    boolean cancel();
  }
}
