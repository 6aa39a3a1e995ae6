package net.lanplay.mDNS.utils;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The background workers of one engine: a single scheduled "engine" thread that owns the record
 * cache, timers and registrations, and a factory for the daemon threads that read sockets.
 *
 * Every task submitted here runs on the engine thread, so engine state needs no locking.
 */
public class Executors {

  private static final Logger LOG = LoggerFactory.getLogger(Executors.class);

  public static final int DEFAULT_NETWORK_THREAD_PRIORITY = Thread.NORM_PRIORITY + 2;

  public static final int DEFAULT_ENGINE_THREAD_PRIORITY = Thread.NORM_PRIORITY;

  private static final AtomicInteger ENGINE_COUNT = new AtomicInteger();

  private final ScheduledThreadPoolExecutor engineExecutor;

  private final ThreadFactory networkThreadFactory;

  private final int engineNumber = ENGINE_COUNT.incrementAndGet();

  public Executors() {
    engineExecutor = new ScheduledThreadPoolExecutor(1, r -> {
      Thread t = new Thread(r, "mDNS Engine Thread " + engineNumber);
      t.setDaemon(true);
      t.setPriority(DEFAULT_ENGINE_THREAD_PRIORITY);
      t.setContextClassLoader(Executors.class.getClassLoader());
      return t;
    });

    // Pending timers are not worth waiting for at shutdown, queued work is.
    engineExecutor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    engineExecutor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    engineExecutor.setRemoveOnCancelPolicy(true);

    AtomicInteger readThreads = new AtomicInteger();
    networkThreadFactory = r -> {
      Thread t = new Thread(r,
          "mDNS Network Read Thread " + engineNumber + "-" + readThreads.incrementAndGet());
      t.setDaemon(true);
      t.setPriority(DEFAULT_NETWORK_THREAD_PRIORITY);
      t.setContextClassLoader(Executors.class.getClassLoader());
      return t;
    };
  }

  /**
   * Schedules a task on the engine thread.
   *
   * @return The future of the task, or null if the engine is shutting down
   */
  public ScheduledFuture<?> schedule(final Runnable command, final long delay, final TimeUnit unit) {
    try {
      return engineExecutor.schedule(guard(command), delay, unit);
    } catch (RejectedExecutionException e) {
      LOG.trace("Engine executor shut down, task not scheduled", e);
      return null;
    }
  }

  public ScheduledFuture<?> scheduleWithFixedDelay(final Runnable command, final long initialDelay,
      final long delay, final TimeUnit unit) {
    try {
      return engineExecutor.scheduleWithFixedDelay(guard(command), initialDelay, delay, unit);
    } catch (RejectedExecutionException e) {
      LOG.trace("Engine executor shut down, task not scheduled", e);
      return null;
    }
  }

  /**
   * Runs a task on the engine thread.
   *
   * @return false if the engine is shutting down and the task was dropped
   */
  public boolean execute(final Runnable command) {
    try {
      engineExecutor.execute(guard(command));
      return true;
    } catch (RejectedExecutionException e) {
      LOG.trace("Engine executor shut down, task dropped", e);
      return false;
    }
  }

  public Thread newNetworkThread(final Runnable runnable) {
    return networkThreadFactory.newThread(runnable);
  }

  /**
   * Lets queued tasks finish and waits for the engine thread to exit, then interrupts it if it
   * has not exited within the timeout.
   *
   * @return true if the engine thread exited within the timeout
   */
  public boolean shutdown(final long timeout, final TimeUnit unit) {
    engineExecutor.shutdown();
    try {
      if (engineExecutor.awaitTermination(timeout, unit)) {
        return true;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }

    LOG.warn("mDNS engine thread {} did not exit within {} {}, forcing shutdown", engineNumber,
        timeout, unit);
    engineExecutor.shutdownNow();
    return false;
  }

  /**
   * A failing task must not take the engine thread down with it, nor cancel a periodic timer.
   */
  private static Runnable guard(final Runnable command) {
    return () -> {
      try {
        command.run();
      } catch (RuntimeException e) {
        LOG.error("Unexpected error on the mDNS engine thread", e);
      }
    };
  }
}
