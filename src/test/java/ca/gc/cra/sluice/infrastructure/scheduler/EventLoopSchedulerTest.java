package ca.gc.cra.sluice.infrastructure.scheduler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sluice.application.port.SessionScheduler;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class EventLoopSchedulerTest {
  private final EventLoopScheduler scheduler = new EventLoopScheduler();

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  void runsReadyTasksInSubmissionOrder() throws InterruptedException {
    List<Integer> order = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      int n = i;
      scheduler.execute(() -> order.add(n));
    }

    scheduler.runUntil(() -> order.size() == 5);

    assertEquals(List.of(0, 1, 2, 3, 4), order);
    assertEquals(0, scheduler.pendingTasks());
  }

  @Test
  void timersFireInDueOrderAfterTheirDelay() throws InterruptedException {
    List<String> fired = new ArrayList<>();
    long start = scheduler.nowNanos();
    scheduler.schedule(() -> fired.add("late"), 40);
    scheduler.schedule(() -> fired.add("early"), 10);

    scheduler.runUntil(() -> fired.size() == 2);

    assertEquals(List.of("early", "late"), fired);
    assertTrue(scheduler.nowNanos() - start >= TimeUnit.MILLISECONDS.toNanos(40));
  }

  @Test
  void cancelledTimerNeverRuns() throws InterruptedException {
    AtomicBoolean ran = new AtomicBoolean();
    AtomicBoolean done = new AtomicBoolean();
    SessionScheduler.Cancellable timer = scheduler.schedule(() -> ran.set(true), 5);
    scheduler.schedule(() -> done.set(true), 20);

    assertTrue(timer.cancel());
    assertFalse(timer.cancel());
    scheduler.runUntil(done::get);

    assertFalse(ran.get());
  }

  @Test
  void cancelAfterFiringReportsFalse() throws InterruptedException {
    AtomicBoolean ran = new AtomicBoolean();
    SessionScheduler.Cancellable timer = scheduler.schedule(() -> ran.set(true), 0);

    scheduler.runUntil(ran::get);

    assertFalse(timer.cancel());
  }

  @Test
  void taskSubmittedFromAnotherThreadWakesTheLoop() throws InterruptedException {
    AtomicBoolean done = new AtomicBoolean();
    Thread submitter = new Thread(() -> {
      try {
        Thread.sleep(20);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      scheduler.execute(() -> done.set(true));
    });
    submitter.start();

    scheduler.runUntil(done::get);
    submitter.join();

    assertTrue(done.get());
  }

  @Test
  void interruptedCallerGetsInterruptedException() {
    scheduler.schedule(() -> { }, 10_000);
    Thread.currentThread().interrupt();

    assertThrows(InterruptedException.class, () -> scheduler.runUntil(() -> false));
    assertEquals(1, scheduler.pendingTasks());
  }
}
