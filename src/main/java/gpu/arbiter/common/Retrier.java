// Copyright 2026 The Buildfarm Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package gpu.arbiter.common;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.base.Predicates;
import com.google.common.base.Supplier;
import com.google.common.base.Throwables;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * @class Retrier
 * @brief Runs a call repeatedly until it succeeds or the backoff is exhausted.
 * @details A single policy object shared by every call site that talks to flaky external processes.
 *     Failures that the predicate does not consider retriable are surfaced immediately.
 */
public class Retrier {
  public interface Backoff {
    long STOP = -1L;

    /** Returns the delay before the next attempt, or {@link #STOP} when no attempts remain. */
    long nextDelayMillis();

    int getRetryAttempts();

    @SuppressWarnings("Guava")
    Supplier<Backoff> NO_RETRIES =
        () ->
            new Backoff() {
              @Override
              public long nextDelayMillis() {
                return STOP;
              }

              @Override
              public int getRetryAttempts() {
                return 0;
              }
            };

    @SuppressWarnings("Guava")
    static Supplier<Backoff> exponential(
        Duration initial, Duration max, double multiplier, double jitter, int maxAttempts) {
      Preconditions.checkArgument(multiplier > 1, "multipler must be > 1");
      Preconditions.checkArgument(jitter >= 0 && jitter <= 1, "jitter must be in the range (0, 1)");
      Preconditions.checkArgument(maxAttempts >= 0, "maxAttempts must be >= 0");
      return () ->
          new Backoff() {
            private final long maxMillis = max.toMillis();
            private long nextDelayMillis = initial.toMillis();
            private int attempts = 0;

            @Override
            public long nextDelayMillis() {
              if (attempts == maxAttempts) {
                return STOP;
              }
              attempts++;
              double jitterRatio = jitter * (ThreadLocalRandom.current().nextDouble(2.0) - 1);
              long result = (long) (nextDelayMillis * (1 + jitterRatio));
              // Advance current by the non-jittered result.
              nextDelayMillis = (long) (nextDelayMillis * multiplier);
              if (nextDelayMillis > maxMillis) {
                nextDelayMillis = maxMillis;
              }
              return result;
            }

            @Override
            public int getRetryAttempts() {
              return attempts;
            }
          };
    }
  }

  @SuppressWarnings("Guava")
  public static final Predicate<Exception> RETRY_IO =
      e -> e instanceof IOException && !Thread.currentThread().isInterrupted();

  @SuppressWarnings("Guava")
  public static final Predicate<Exception> RETRY_NONE = Predicates.alwaysFalse();

  public static final Retrier NO_RETRIES = new Retrier(Backoff.NO_RETRIES, RETRY_NONE);

  @SuppressWarnings("Guava")
  private final Supplier<Backoff> backoffSupplier;

  @SuppressWarnings("Guava")
  private final Predicate<Exception> isRetriable;

  @SuppressWarnings("Guava")
  public Retrier(Supplier<Backoff> backoffSupplier, Predicate<Exception> isRetriable) {
    this.backoffSupplier = backoffSupplier;
    this.isRetriable = isRetriable;
  }

  public <T> T execute(Callable<T> c) throws IOException, InterruptedException {
    Backoff backoff = backoffSupplier.get();
    while (true) {
      try {
        return c.call();
      } catch (RetryException e) {
        throw e; // Nested retries are always pass-through.
      } catch (InterruptedException e) {
        throw e;
      } catch (Exception e) {
        long delay = backoff.nextDelayMillis();
        if (delay < 0 || !isRetriable.apply(e)) {
          Throwables.throwIfUnchecked(e);
          throw new RetryException(e, backoff.getRetryAttempts());
        }
        sleep(delay);
      }
    }
  }

  @VisibleForTesting
  void sleep(long timeMillis) throws InterruptedException {
    Preconditions.checkArgument(
        timeMillis >= 0L, "timeMillis must not be negative: %s", timeMillis);
    TimeUnit.MILLISECONDS.sleep(timeMillis);
  }
}
