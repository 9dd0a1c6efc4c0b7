/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.sieve.util;

import com.google.common.collect.Lists;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a task over a collection of items, optionally in parallel and with retries.
 *
 * <p>Build jobs run one task per data file through this class; cleanup paths use it with {@link
 * Builder#suppressFailureWhenFinished()} so that one failed delete does not stop the others.
 */
public class Tasks {
  private static final Logger LOG = LoggerFactory.getLogger(Tasks.class);

  // retry backoff
  private static final long MIN_SLEEP_MS = 100;
  private static final long MAX_SLEEP_MS = 10000;
  private static final long MAX_DURATION_MS = 60000;
  private static final double SCALE_FACTOR = 2.0;

  private Tasks() {}

  public interface FailureTask<I, E extends Exception> {
    void run(I item, Exception exception) throws E;
  }

  public interface Task<I, E extends Exception> {
    void run(I item) throws E;
  }

  public static class Builder<I> {
    private final Iterable<I> items;
    private ExecutorService service = null;
    private FailureTask<I, ?> onFailure = null;
    private boolean stopOnFailure = false;
    private boolean throwFailureWhenFinished = true;
    private int maxAttempts = 1; // not all operations can be retried

    public Builder(Iterable<I> items) {
      this.items = items;
    }

    public Builder<I> executeWith(ExecutorService svc) {
      this.service = svc;
      return this;
    }

    public Builder<I> onFailure(FailureTask<I, ?> task) {
      this.onFailure = task;
      return this;
    }

    public Builder<I> stopOnFailure() {
      this.stopOnFailure = true;
      return this;
    }

    public Builder<I> throwFailureWhenFinished() {
      this.throwFailureWhenFinished = true;
      return this;
    }

    public Builder<I> suppressFailureWhenFinished() {
      this.throwFailureWhenFinished = false;
      return this;
    }

    public Builder<I> retry(int nTimes) {
      this.maxAttempts = nTimes + 1;
      return this;
    }

    public boolean run(Task<I, RuntimeException> task) {
      return run(task, RuntimeException.class);
    }

    public <E extends Exception> boolean run(Task<I, E> task, Class<E> exceptionClass) throws E {
      if (service != null) {
        return runParallel(task, exceptionClass);
      } else {
        return runSingleThreaded(task, exceptionClass);
      }
    }

    private <E extends Exception> boolean runSingleThreaded(
        Task<I, E> task, Class<E> exceptionClass) throws E {
      List<Throwable> exceptions = Lists.newArrayList();

      for (I item : items) {
        try {
          runTaskWithRetry(task, item);
        } catch (Exception e) {
          exceptions.add(e);

          if (onFailure != null) {
            tryRunOnFailure(item, e);
          }

          if (stopOnFailure) {
            break;
          }
        }
      }

      if (throwFailureWhenFinished && !exceptions.isEmpty()) {
        Tasks.throwOne(exceptions, exceptionClass);
      }

      return exceptions.isEmpty();
    }

    private void tryRunOnFailure(I item, Exception failure) {
      try {
        onFailure.run(item, failure);
      } catch (Exception failException) {
        failure.addSuppressed(failException);
        LOG.error("Failed to clean up on failure", failException);
        // keep going
      }
    }

    private <E extends Exception> boolean runParallel(
        final Task<I, E> task, Class<E> exceptionClass) throws E {
      final Queue<Throwable> exceptions = new ConcurrentLinkedQueue<>();
      final AtomicBoolean taskFailed = new AtomicBoolean(false);

      List<Future<?>> futures = Lists.newArrayList();

      for (final I item : items) {
        futures.add(
            service.submit(
                () -> {
                  if (stopOnFailure && taskFailed.get()) {
                    return;
                  }

                  boolean threw = true;
                  try {
                    runTaskWithRetry(task, item);
                    threw = false;

                  } catch (Exception e) {
                    exceptions.add(e);

                    if (onFailure != null) {
                      tryRunOnFailure(item, e);
                    }
                  } finally {
                    if (threw) {
                      taskFailed.set(true);
                    }
                  }
                }));
      }

      exceptions.addAll(waitFor(futures));

      if (throwFailureWhenFinished && !exceptions.isEmpty()) {
        Tasks.throwOne(exceptions, exceptionClass);
      } else if (throwFailureWhenFinished && taskFailed.get()) {
        throw new RuntimeException("Task set failed with an uncaught throwable");
      }

      return !taskFailed.get();
    }

    private <E extends Exception> void runTaskWithRetry(Task<I, E> task, I item) throws E {
      long start = System.currentTimeMillis();
      int attempt = 0;
      while (true) {
        attempt += 1;

        try {
          task.run(item);
          break;

        } catch (Exception e) {
          long durationMs = System.currentTimeMillis() - start;
          if (attempt >= maxAttempts || (durationMs > MAX_DURATION_MS && attempt > 1)) {
            if (durationMs > MAX_DURATION_MS) {
              LOG.info("Stopping retries after {} ms", durationMs);
            }
            throw e;
          }

          int delayMs =
              (int)
                  Math.min(
                      MIN_SLEEP_MS * Math.pow(SCALE_FACTOR, attempt - 1), (double) MAX_SLEEP_MS);
          int jitter = ThreadLocalRandom.current().nextInt(Math.max(1, (int) (delayMs * 0.1)));

          LOG.warn("Retrying task after failure: {}", e.getMessage(), e);

          try {
            TimeUnit.MILLISECONDS.sleep(delayMs + jitter);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(ie);
          }
        }
      }
    }
  }

  private static Collection<Throwable> waitFor(Collection<Future<?>> futures) {
    List<Throwable> uncaught = Lists.newArrayList();
    for (Future<?> future : futures) {
      try {
        future.get();

      } catch (InterruptedException e) {
        LOG.warn("Interrupted while waiting for tasks to finish", e);
        for (Future<?> other : futures) {
          other.cancel(true);
        }
        for (Throwable t : uncaught) {
          e.addSuppressed(t);
        }
        Thread.currentThread().interrupt();
        throw new RuntimeException(e);

      } catch (CancellationException e) {
        // ignore cancellations

      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Error) {
          for (Throwable t : uncaught) {
            cause.addSuppressed(t);
          }
          throw (Error) cause;
        }

        if (cause != null) {
          uncaught.add(cause);
        }

        LOG.warn("Task threw uncaught exception", cause);
      }
    }

    return uncaught;
  }

  public static <I> Builder<I> foreach(Iterable<I> items) {
    return new Builder<>(items);
  }

  private static <E extends Exception> void throwOne(
      Collection<Throwable> exceptions, Class<E> allowedException) throws E {
    Iterator<Throwable> iter = exceptions.iterator();
    Throwable exception = iter.next();
    Class<? extends Throwable> exceptionClass = exception.getClass();

    while (iter.hasNext()) {
      Throwable other = iter.next();
      if (!exceptionClass.isInstance(other)) {
        exception.addSuppressed(other);
      }
    }

    ExceptionUtil.castAndThrow(exception, allowedException);
  }
}
