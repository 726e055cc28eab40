package ca.gc.cra.sluice.infrastructure.scheduler;

import ca.gc.cra.sluice.application.port.SessionScheduler;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wall-clock {@link SessionScheduler} that runs tasks on the thread calling
 * {@link #runUntil(BooleanSupplier)}.
 * <p><strong>Why:</strong> One logical thread per session keeps component state free of locks; the loop parks
 * only when no task is ready, never while a component waits on another.</p>
 * <p><strong>Role:</strong> Infrastructure adapter created per session by the composition root.</p>
 * <p><strong>Thread-safety:</strong> Submission and cancellation are guarded by a lock and wake the loop, so
 * any thread may post work (cancellation requests in particular).</p>
 * <p><strong>Performance:</strong> Ready tasks run FIFO; timers sit in a heap ordered by due time then
 * submission order.</p>
 *
 * @since 0.1.0
 */
public final class EventLoopScheduler implements SessionScheduler {
  private static final Logger log = LoggerFactory.getLogger(EventLoopScheduler.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition wakeup = lock.newCondition();
  private final ArrayDeque<Runnable> ready = new ArrayDeque<>();
  private final PriorityQueue<Timer> timers = new PriorityQueue<>();
  private long sequence;

  @Override
  public void execute(Runnable task) {
    Objects.requireNonNull(task, "task");
    lock.lock();
    try {
      ready.addLast(task);
      wakeup.signal();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Cancellable schedule(Runnable task, long delayMillis) {
    Objects.requireNonNull(task, "task");
    long due = nowNanos() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, delayMillis));
    lock.lock();
    try {
      Timer timer = new Timer(due, sequence++, task);
      timers.add(timer);
      wakeup.signal();
      return timer;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public long nowNanos() {
    return System.nanoTime();
  }

  @Override
  public void runUntil(BooleanSupplier done) throws InterruptedException {
    Objects.requireNonNull(done, "done");
    while (!done.getAsBoolean()) {
      Runnable task = awaitNext();
      task.run();
    }
  }

  /**
   * Number of tasks and timers not yet run.
   *
   * @return pending work count
   */
  public int pendingTasks() {
    lock.lock();
    try {
      return ready.size() + timers.size();
    } finally {
      lock.unlock();
    }
  }

  private Runnable awaitNext() throws InterruptedException {
    lock.lock();
    try {
      while (true) {
        if (Thread.interrupted()) {
          throw new InterruptedException("event loop interrupted");
        }
        promoteDueTimers();
        Runnable task = ready.pollFirst();
        if (task != null) {
          return task;
        }
        Timer next = timers.peek();
        if (next == null) {
          log.trace("Event loop idle; waiting for work");
          wakeup.await();
        } else {
          wakeup.awaitNanos(next.dueNanos - nowNanos());
        }
      }
    } finally {
      lock.unlock();
    }
  }

  private void promoteDueTimers() {
    long now = nowNanos();
    Timer timer;
    while ((timer = timers.peek()) != null && timer.dueNanos - now <= 0) {
      timers.poll();
      ready.addLast(timer);
    }
  }

  private final class Timer implements Cancellable, Comparable<Timer>, Runnable {
    private final long dueNanos;
    private final long seq;
    private final Runnable task;
    private boolean cancelled;
    private boolean fired;

    Timer(long dueNanos, long seq, Runnable task) {
      this.dueNanos = dueNanos;
      this.seq = seq;
      this.task = task;
    }

    @Override
    public void run() {
      lock.lock();
      try {
        if (cancelled) {
          return;
        }
        fired = true;
      } finally {
        lock.unlock();
      }
      task.run();
    }

    @Override
    public boolean cancel() {
      lock.lock();
      try {
        if (fired || cancelled) {
          return false;
        }
        cancelled = true;
        // a due timer may already sit in the ready queue; run() skips it
        timers.remove(this);
        return true;
      } finally {
        lock.unlock();
      }
    }

    @Override
    public int compareTo(Timer other) {
      int byDue = Long.compare(dueNanos - other.dueNanos, 0L);
      return byDue != 0 ? byDue : Long.compare(seq, other.seq);
    }
  }
}
