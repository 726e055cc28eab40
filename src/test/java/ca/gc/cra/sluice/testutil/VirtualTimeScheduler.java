package ca.gc.cra.sluice.testutil;

import ca.gc.cra.sluice.application.port.SessionScheduler;
import java.util.ArrayDeque;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Deterministic {@link SessionScheduler} whose clock jumps to the next timer whenever no task is ready.
 * <p>Single-threaded; a run that has neither ready tasks nor timers left fails fast instead of hanging.</p>
 */
public final class VirtualTimeScheduler implements SessionScheduler {
  private final ArrayDeque<Runnable> ready = new ArrayDeque<>();
  private final PriorityQueue<Timer> timers = new PriorityQueue<>();
  private long nowNanos;
  private long sequence;
  private long tasksRun;

  @Override
  public void execute(Runnable task) {
    ready.addLast(task);
  }

  @Override
  public Cancellable schedule(Runnable task, long delayMillis) {
    Timer timer = new Timer(nowNanos + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, delayMillis)), sequence++, task);
    timers.add(timer);
    return timer;
  }

  @Override
  public long nowNanos() {
    return nowNanos;
  }

  @Override
  public void runUntil(BooleanSupplier done) throws InterruptedException {
    while (!done.getAsBoolean()) {
      if (Thread.interrupted()) {
        throw new InterruptedException("virtual scheduler interrupted");
      }
      if (!runOne()) {
        throw new IllegalStateException("scheduler stalled: no ready task and no pending timer");
      }
    }
  }

  /** Runs tasks and timers until nothing is left. */
  public void runUntilIdle() {
    while (runOne()) {
      // drain
    }
  }

  /**
   * Runs ready tasks without advancing the clock.
   *
   * @return number of tasks run
   */
  public int runReady() {
    int count = 0;
    while (!ready.isEmpty()) {
      ready.pollFirst().run();
      tasksRun++;
      count++;
    }
    return count;
  }

  /**
   * Advances the clock by {@code millis}, running everything that becomes due on the way.
   *
   * @param millis virtual milliseconds to advance
   */
  public void advance(long millis) {
    long target = nowNanos + TimeUnit.MILLISECONDS.toNanos(millis);
    runReady();
    while (!timers.isEmpty() && timers.peek().dueNanos <= target) {
      Timer timer = timers.poll();
      nowNanos = timer.dueNanos;
      timer.fire();
      runReady();
    }
    nowNanos = target;
  }

  public long elapsedMillis() {
    return TimeUnit.NANOSECONDS.toMillis(nowNanos);
  }

  public int pendingTimers() {
    return timers.size();
  }

  public int readyTasks() {
    return ready.size();
  }

  public long tasksRun() {
    return tasksRun;
  }

  private boolean runOne() {
    Runnable task = ready.pollFirst();
    if (task != null) {
      task.run();
      tasksRun++;
      return true;
    }
    Timer timer = timers.poll();
    if (timer == null) {
      return false;
    }
    nowNanos = Math.max(nowNanos, timer.dueNanos);
    timer.fire();
    tasksRun++;
    return true;
  }

  private final class Timer implements Cancellable, Comparable<Timer> {
    private final long dueNanos;
    private final long seq;
    private final Runnable task;
    private boolean done;

    Timer(long dueNanos, long seq, Runnable task) {
      this.dueNanos = dueNanos;
      this.seq = seq;
      this.task = task;
    }

    void fire() {
      if (!done) {
        done = true;
        task.run();
      }
    }

    @Override
    public boolean cancel() {
      if (done) {
        return false;
      }
      done = true;
      timers.remove(this);
      return true;
    }

    @Override
    public int compareTo(Timer other) {
      int byDue = Long.compare(dueNanos, other.dueNanos);
      return byDue != 0 ? byDue : Long.compare(seq, other.seq);
    }
  }
}
