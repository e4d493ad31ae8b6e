package relay.dispatch;

import org.junit.jupiter.api.Test;
import relay.testing.RecordingMetricsExporter;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolTest {

  // ── Construction ────────────────────────────────────────────────

  @Test
  void rejectsZeroSize() {
    assertThrows(IllegalArgumentException.class, () ->
        new WorkerPool(0, "w-", null, Duration.ofSeconds(1)));
  }

  @Test
  void rejectsNegativeDrainTimeout() {
    assertThrows(IllegalArgumentException.class, () ->
        new WorkerPool(1, "w-", null, Duration.ofSeconds(-1)));
  }

  // ── Admission ───────────────────────────────────────────────────

  @Test
  void neverRunsMoreThanSizeConcurrently() throws Exception {
    RecordingMetricsExporter metrics = new RecordingMetricsExporter();
    AtomicInteger running = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    CountDownLatch done = new CountDownLatch(20);

    try (WorkerPool pool = new WorkerPool(3, "w-", metrics, Duration.ofSeconds(5))) {
      for (int i = 0; i < 20; i++) {
        pool.submit(() -> {
          peak.accumulateAndGet(running.incrementAndGet(), Math::max);
          try {
            Thread.sleep(10);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          running.decrementAndGet();
          done.countDown();
        });
      }
      assertTrue(done.await(10, TimeUnit.SECONDS));
    }

    assertTrue(peak.get() <= 3, "peak=" + peak.get());
    assertTrue(metrics.maxInFlight() <= 3, "maxInFlight=" + metrics.maxInFlight());
    assertEquals(0, metrics.inFlight());
  }

  @Test
  void submitBlocksWhileSaturated() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    AtomicBoolean secondAdmitted = new AtomicBoolean();

    try (WorkerPool pool = new WorkerPool(1, "w-", null, Duration.ofSeconds(5))) {
      pool.submit(() -> awaitQuietly(release));
      Thread submitter = new Thread(() -> {
        try {
          pool.submit(() -> { });
          secondAdmitted.set(true);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      });
      submitter.start();
      Thread.sleep(100);
      assertFalse(secondAdmitted.get());
      assertEquals(1, pool.inFlight());

      release.countDown();
      submitter.join(5_000);
      assertTrue(secondAdmitted.get());
    }
  }

  @Test
  void inFlightReturnsToZeroWhenTasksThrowErrors() throws Exception {
    RecordingMetricsExporter metrics = new RecordingMetricsExporter();
    CountDownLatch ran = new CountDownLatch(2);

    try (WorkerPool pool = new WorkerPool(2, "w-", metrics, Duration.ofSeconds(5))) {
      pool.submit(() -> {
        ran.countDown();
        throw new IllegalStateException("boom");
      });
      pool.submit(() -> {
        ran.countDown();
        throw new AssertionError("fatal");
      });
      assertTrue(ran.await(5, TimeUnit.SECONDS));
      long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
      while (pool.inFlight() != 0 && System.nanoTime() < deadline) {
        Thread.sleep(5);
      }
      assertEquals(0, pool.inFlight());
      assertEquals(0, metrics.inFlight());
    }
  }

  // ── Shutdown ────────────────────────────────────────────────────

  @Test
  void closeDrainsRunningTasks() throws Exception {
    AtomicBoolean finished = new AtomicBoolean();
    WorkerPool pool = new WorkerPool(1, "w-", null, Duration.ofSeconds(5));
    pool.submit(() -> {
      try {
        Thread.sleep(100);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      finished.set(true);
    });

    pool.close();

    assertTrue(finished.get());
  }

  @Test
  void closeInterruptsTasksAfterDrainTimeout() throws Exception {
    AtomicBoolean interrupted = new AtomicBoolean();
    CountDownLatch started = new CountDownLatch(1);
    WorkerPool pool = new WorkerPool(1, "w-", null, Duration.ofMillis(50));
    pool.submit(() -> {
      started.countDown();
      try {
        Thread.sleep(10_000);
      } catch (InterruptedException e) {
        interrupted.set(true);
      }
    });
    assertTrue(started.await(5, TimeUnit.SECONDS));

    pool.close();

    assertTrue(interrupted.get());
  }

  @Test
  void submitAfterCloseIsRejected() {
    WorkerPool pool = new WorkerPool(1, "w-", null, Duration.ofSeconds(1));
    pool.close();

    assertThrows(RejectedExecutionException.class, () -> pool.submit(() -> { }));
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await(10, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
