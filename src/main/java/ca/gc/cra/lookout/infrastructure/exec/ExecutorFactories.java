package ca.gc.cra.lookout.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors that drive session monitoring.
 *
 * <p>All threads are daemons so an abandoned monitor never keeps the JVM alive.</p>
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds the single-threaded scheduler that runs the poll loop.
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on the thread
   * @return scheduler that drops pending ticks on shutdown
   */
  public static ScheduledExecutorService newPollScheduler(String prefix, UncaughtExceptionHandler handler) {
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(1, threadFactory(prefix, "lookout-poll", handler));
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    scheduler.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    return scheduler;
  }

  /**
   * Builds the fixed-size pool that performs file reads.
   *
   * <p>The queue is unbounded, but each tracked file admits at most one queued or running read, so its length
   * never exceeds the number of tracked files.</p>
   *
   * @param size number of reader threads
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler
   * @return configured executor service
   */
  public static ExecutorService newReaderPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        threadFactory(prefix, "lookout-read", handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a thread factory producing named daemon threads.
   *
   * @param prefix thread-name prefix; {@code fallback} when blank
   * @param fallback prefix used when {@code prefix} is blank
   * @param handler uncaught exception handler; {@code null} keeps the JVM default
   * @return thread factory
   */
  public static ThreadFactory threadFactory(String prefix, String fallback, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallback : prefix;
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      if (handler != null) {
        thread.setUncaughtExceptionHandler(handler);
      }
      return thread;
    };
  }
}
