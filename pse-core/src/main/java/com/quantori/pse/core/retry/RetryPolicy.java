package com.quantori.pse.core.retry;

import com.quantori.pse.api.TransportException;
import com.quantori.pse.core.configuration.RetryProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded retry of operations that may fail with a transient transport error.
 *
 * <p>The delay before retry number {@code n} (1-based) is {@code baseDelay + log2(n) * scale}, so
 * the wait grows very slowly even for large attempt budgets. When the last attempt fails the failure
 * is rethrown without sleeping. Failures that are not transient are rethrown at once.
 *
 * <p>The policy keeps no state between calls, one instance is shared by all identifiers.
 */
@Slf4j
@Getter
public class RetryPolicy {
  private static final double LN_2 = Math.log(2);

  private final int maxAttempts;
  private final Duration baseDelay;
  private final Duration scale;
  private final Sleeper sleeper;

  public RetryPolicy(int maxAttempts, Duration baseDelay, Duration scale, Sleeper sleeper) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
    this.baseDelay = baseDelay;
    this.scale = scale;
    this.sleeper = sleeper;
  }

  public static RetryPolicy of(RetryProperties properties) {
    return of(properties, Sleeper.THREAD);
  }

  public static RetryPolicy of(RetryProperties properties, Sleeper sleeper) {
    return new RetryPolicy(
        properties.getMaxAttempts(), properties.getBaseDelay(), properties.getScale(), sleeper);
  }

  /** Delay before the given retry, {@code attempt} starts from 1. */
  public Duration delay(int attempt) {
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt starts from 1: " + attempt);
    }
    long growth = Math.round(Math.log(attempt) / LN_2 * scale.toMillis());
    return baseDelay.plusMillis(growth);
  }

  public <T> T execute(String operation, Supplier<T> action) {
    int attempt = 0;
    while (true) {
      try {
        return action.get();
      } catch (RuntimeException e) {
        attempt++;
        if (!isTransient(e)) {
          throw e;
        }
        if (attempt >= maxAttempts) {
          log.warn("Giving up on {} after {} attempts: {}", operation, attempt, e.getMessage());
          throw e;
        }
        Duration delay = delay(attempt);
        log.debug("Attempt {} of {} failed ({}), retrying in {}", attempt, operation, e.getMessage(), delay);
        pause(operation, delay, e);
      }
    }
  }

  public static boolean isTransient(Throwable error) {
    for (Throwable current = error; current != null; current = current.getCause()) {
      if (current instanceof TransportException transportException) {
        return transportException.isTransientFailure();
      }
      if (current instanceof IOException || current instanceof UncheckedIOException) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
    }
    return false;
  }

  private void pause(String operation, Duration delay, RuntimeException failure) {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      TransportException interrupted =
          new TransportException("Interrupted while waiting to retry " + operation, e, false);
      interrupted.addSuppressed(failure);
      throw interrupted;
    }
  }
}
