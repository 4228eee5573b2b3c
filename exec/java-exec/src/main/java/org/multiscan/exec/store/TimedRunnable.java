/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.multiscan.exec.store;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.multiscan.common.exceptions.UserException;
import org.slf4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.Lists;

/**
 * Class used to allow parallel executions of tasks in a simplified way. Also maintains and reports timings of task
 * completion. A multi-file scan runs one task per file: reading the file's schema or building its column mapping.
 * @param <V> The value that will be returned when the task is executed.
 */
public abstract class TimedRunnable<V> implements Runnable {

  private volatile Exception e;
  private volatile long threadStart;
  private volatile long timeNanos;
  private volatile V value;

  @Override
  public final void run() {
    long start = System.nanoTime();
    threadStart = start;
    try {
      value = runInner();
    } catch (Exception e) {
      this.e = e;
    } finally {
      timeNanos = System.nanoTime() - start;
    }
  }

  protected abstract V runInner() throws Exception;

  /**
   * Wraps a failure of {@link #runInner()} that is not already a {@link UserException}.
   */
  protected abstract UserException convertToUserException(Exception e);

  public long getThreadStart() {
    return threadStart;
  }

  public long getTimeSpentNanos() {
    return timeNanos;
  }

  public final V getValue() {
    if (e != null) {
      if (e instanceof UserException) {
        throw (UserException) e;
      } else {
        throw convertToUserException(e);
      }
    }

    return value;
  }

  private static class LatchedRunnable implements Runnable {
    final CountDownLatch latch;
    final Runnable runnable;

    public LatchedRunnable(CountDownLatch latch, Runnable runnable) {
      this.latch = latch;
      this.runnable = runnable;
    }

    @Override
    public void run() {
      try {
        runnable.run();
      } finally {
        latch.countDown();
      }
    }
  }

  /**
   * Execute the list of runnables with the given parallelization. At end, return values and report completion time
   * stats to provided logger. Each runnable is allowed a certain timeout. If the timeout exceeds, existing/pending
   * tasks will be cancelled and a resource {@link UserException} is thrown.
   * <p>When tasks fail, every task still runs to completion; the first failure, in list order, is thrown with the
   * later ones attached as suppressed exceptions.
   *
   * @param activity Name of activity for reporting in logger.
   * @param logger The logger to use to report results.
   * @param runnables List of runnables that should be executed and timed. If this list has one item, task will be
   *                  completed in-thread. Runnable must handle {@link InterruptedException}s.
   * @param parallelism The number of threads that should be run to complete this task.
   * @param timeoutPerRunnableMs Time allowed for a single runnable, in milliseconds.
   * @return The list of outcome objects, in the order of the runnables.
   */
  public static <V> List<V> run(final String activity, final Logger logger, final List<? extends TimedRunnable<V>> runnables,
                                int parallelism, long timeoutPerRunnableMs) {
    Preconditions.checkArgument(parallelism > 0, "Parallelism must be positive, got %s", parallelism);
    Stopwatch watch = logger.isDebugEnabled() ? Stopwatch.createStarted() : null;
    long timedRunnableStart = System.nanoTime();
    if (runnables.isEmpty()) {
      return Lists.newArrayList();
    }
    if (runnables.size() == 1) {
      parallelism = 1;
      runnables.get(0).run();
    } else {
      parallelism = Math.min(parallelism, runnables.size());
      final CountDownLatch latch = new CountDownLatch(runnables.size());
      final ExecutorService threadPool = Executors.newFixedThreadPool(parallelism);
      try {
        for (TimedRunnable<V> runnable : runnables) {
          threadPool.submit(new LatchedRunnable(latch, runnable));
        }

        final long timeout = (long) Math.ceil((timeoutPerRunnableMs * runnables.size()) / (double) parallelism);
        if (!awaitUninterruptibly(latch, timeout, logger)) {
          // Issue a shutdown request. This will cause existing threads to interrupt and pending threads to cancel.
          threadPool.shutdownNow();

          try {
            // Give interrupted tasks a chance to wrap up so that potential thread leaks can be identified.
            threadPool.awaitTermination(5, TimeUnit.SECONDS);
          } catch (final InterruptedException e) {
            logger.warn("Interrupted while waiting for pending threads in activity '{}' to terminate.", activity);
            Thread.currentThread().interrupt();
          }

          throw UserException.resourceError()
              .message("Waited for %dms, but tasks for '%s' are not complete. " +
                  "Total runnable size %d, parallelism %d.", timeout, activity, runnables.size(), parallelism)
              .build(logger);
        }
      } finally {
        if (!threadPool.isShutdown()) {
          threadPool.shutdown();
        }
      }
    }

    List<V> values = Lists.newArrayList();
    long sum = 0;
    long max = 0;
    long count = 0;
    // measure thread creation times
    long earliestStart = Long.MAX_VALUE;
    long latestStart = 0;
    long totalStart = 0;
    UserException excep = null;
    for (final TimedRunnable<V> reader : runnables) {
      try {
        values.add(reader.getValue());
        sum += reader.getTimeSpentNanos();
        count++;
        max = Math.max(max, reader.getTimeSpentNanos());
        long startOffset = reader.getThreadStart() - timedRunnableStart;
        earliestStart = Math.min(earliestStart, startOffset);
        latestStart = Math.max(latestStart, startOffset);
        totalStart += startOffset;
      } catch (UserException e) {
        if (excep == null) {
          excep = e;
        } else if (excep != e) {
          excep.addSuppressed(e);
        }
      }
    }

    if (watch != null && count > 0) {
      double avg = (sum / 1000.0 / 1000.0) / (count * 1.0d);
      double avgStart = (totalStart / 1000.0) / (count * 1.0d);

      logger.debug(
          String.format("%s: Executed %d out of %d using %d threads. "
              + "Time: %dms total, %fms avg, %dms max.",
              activity, count, runnables.size(), parallelism, watch.elapsed(TimeUnit.MILLISECONDS), avg, max / 1000 / 1000));
      logger.debug(
          String.format("%s: Executed %d out of %d using %d threads. "
              + "Earliest start: %f \u03BCs, Latest start: %f \u03BCs, Average start: %f \u03BCs .",
              activity, count, runnables.size(), parallelism, earliestStart / 1000.0, latestStart / 1000.0, avgStart));
      watch.stop();
    }

    if (excep != null) {
      throw excep;
    }

    return values;
  }

  /**
   * Waits for the latch, ignoring interrupts until the wait time is used up.
   *
   * @return true if the latch reached zero in time
   */
  private static boolean awaitUninterruptibly(CountDownLatch latch, long waitMillis, Logger logger) {
    final long targetMillis = System.currentTimeMillis() + waitMillis;
    boolean interrupted = false;
    try {
      while (true) {
        final long wait = targetMillis - System.currentTimeMillis();
        if (wait < 1) {
          return latch.getCount() == 0;
        }
        try {
          return latch.await(wait, TimeUnit.MILLISECONDS);
        } catch (final InterruptedException e) {
          logger.trace("Interrupted while waiting for tasks to complete. Continuing to wait.");
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
