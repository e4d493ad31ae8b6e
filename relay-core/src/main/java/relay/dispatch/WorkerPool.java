package relay.dispatch;

import relay.spi.MetricsExporter;
import relay.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed-size pool that bounds the number of deliveries processed at once.
 *
 * <p>{@link #submit} blocks the calling thread while every worker is busy. Nothing is
 * queued beyond the worker count, so with a broker prefetch equal to the pool size
 * the broker holds the backlog.
 *
 * <p>The in-flight count is exact: it is incremented when a task is admitted and
 * decremented when the task finishes, whatever it throws.
 */
public final class WorkerPool implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(WorkerPool.class.getName());

  private final int size;
  private final Semaphore permits;
  private final ExecutorService workers;
  private final MetricsExporter metrics;
  private final long drainTimeoutMs;
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  /**
   * @param size         maximum concurrent tasks, at least 1
   * @param threadPrefix worker thread name prefix
   * @param metrics      receives the in-flight gauge
   * @param drainTimeout how long {@link #close()} waits for running tasks
   */
  public WorkerPool(int size, String threadPrefix, MetricsExporter metrics, Duration drainTimeout) {
    if (size < 1) {
      throw new IllegalArgumentException("size must be >= 1, got: " + size);
    }
    Objects.requireNonNull(threadPrefix, "threadPrefix");
    Objects.requireNonNull(drainTimeout, "drainTimeout");
    if (drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must be >= 0");
    }
    this.size = size;
    this.permits = new Semaphore(size);
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    this.drainTimeoutMs = drainTimeout.toMillis();
    this.workers = Executors.newFixedThreadPool(size, new DaemonThreadFactory(threadPrefix));
  }

  /**
   * Runs a task on a worker, blocking until one is free.
   *
   * @param task the task
   * @throws InterruptedException if interrupted while waiting for a worker
   * @throws RejectedExecutionException if the pool is closed
   */
  public void submit(Runnable task) throws InterruptedException {
    Objects.requireNonNull(task, "task");
    if (!accepting.get()) {
      throw new RejectedExecutionException("WorkerPool is closed");
    }
    permits.acquire();
    updateInFlight(1);
    try {
      workers.execute(() -> {
        try {
          task.run();
        } catch (Throwable t) {
          logger.log(Level.SEVERE, "Worker task failed", t);
        } finally {
          release();
        }
      });
    } catch (RejectedExecutionException e) {
      release();
      throw e;
    }
  }

  private void release() {
    updateInFlight(-1);
    permits.release();
  }

  // count changes and gauge writes happen in the same order
  private void updateInFlight(int delta) {
    synchronized (inFlight) {
      metrics.recordInFlight(inFlight.addAndGet(delta));
    }
  }

  public int inFlight() {
    return inFlight.get();
  }

  public int size() {
    return size;
  }

  /**
   * Stops admitting tasks, waits up to the drain timeout for running ones, then
   * interrupts whatever is left.
   */
  @Override
  public void close() {
    if (!accepting.getAndSet(false)) {
      return;
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. In flight: " + inFlight.get());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
