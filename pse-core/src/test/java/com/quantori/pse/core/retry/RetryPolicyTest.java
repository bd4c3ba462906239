package com.quantori.pse.core.retry;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.quantori.pse.api.TransportException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {
  private final List<Duration> sleeps = new ArrayList<>();
  private final RetryPolicy policy =
      new RetryPolicy(5, Duration.ofSeconds(60), Duration.ofSeconds(10), sleeps::add);

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  void delayGrowsLogarithmically() {
    assertEquals(Duration.ofSeconds(60), policy.delay(1));
    assertEquals(Duration.ofSeconds(70), policy.delay(2));
    assertEquals(Duration.ofSeconds(80), policy.delay(4));
    assertEquals(Duration.ofSeconds(90), policy.delay(8));
    assertEquals(Duration.ofMillis(75_850), policy.delay(3));
  }

  @Test
  void succeedsAfterTransientFailures() {
    AtomicInteger calls = new AtomicInteger();

    String value = policy.execute("test", () -> {
      if (calls.incrementAndGet() <= 3) {
        throw new TransportException("busy", true, 503);
      }
      return "ok";
    });

    assertEquals("ok", value);
    assertEquals(4, calls.get());
    assertThat(sleeps, contains(policy.delay(1), policy.delay(2), policy.delay(3)));
    for (int i = 1; i < sleeps.size(); i++) {
      assertTrue(sleeps.get(i).compareTo(sleeps.get(i - 1)) >= 0);
    }
  }

  @Test
  void rethrowsLastFailureAfterMaxAttempts() {
    AtomicInteger calls = new AtomicInteger();
    List<TransportException> thrown = new ArrayList<>();

    TransportException error = assertThrows(TransportException.class, () -> policy.execute("test", () -> {
      calls.incrementAndGet();
      TransportException e = new TransportException("timeout", new IOException("read timed out"), true);
      thrown.add(e);
      throw e;
    }));

    assertEquals(5, calls.get());
    assertThat(sleeps, hasSize(4));
    assertThat(error, sameInstance(thrown.get(thrown.size() - 1)));
  }

  @Test
  void nonTransientFailureIsNotRetried() {
    AtomicInteger calls = new AtomicInteger();

    assertThrows(TransportException.class, () -> policy.execute("test", () -> {
      calls.incrementAndGet();
      throw new TransportException("forbidden", false, 403);
    }));

    assertEquals(1, calls.get());
    assertThat(sleeps, empty());
  }

  @Test
  void programmingErrorsAreNotRetried() {
    assertThrows(IllegalStateException.class, () -> policy.execute("test", () -> {
      throw new IllegalStateException("bug");
    }));
    assertThat(sleeps, empty());
  }

  @Test
  void singleAttemptNeverSleeps() {
    RetryPolicy once = new RetryPolicy(1, Duration.ofSeconds(1), Duration.ofSeconds(1), sleeps::add);

    assertThrows(UncheckedIOException.class, () -> once.execute("test", () -> {
      throw new UncheckedIOException(new IOException("reset"));
    }));
    assertThat(sleeps, empty());
  }

  @Test
  void interruptAbortsWithNonTransientFailure() {
    RetryPolicy interrupted = new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(1), delay -> {
      throw new InterruptedException("stop");
    });

    TransportException error = assertThrows(TransportException.class,
        () -> interrupted.execute("test", () -> {
          throw new TransportException("busy", true, 503);
        }));

    assertFalse(error.isTransientFailure());
    assertTrue(Thread.currentThread().isInterrupted());
    assertEquals(1, error.getSuppressed().length);
  }

  @Test
  void transientFailuresAreRecognisedThroughCauses() {
    assertTrue(RetryPolicy.isTransient(new RuntimeException(new IOException("reset"))));
    assertTrue(RetryPolicy.isTransient(new TransportException("busy", true, 429)));
    assertFalse(RetryPolicy.isTransient(new TransportException("gone", false, 410)));
    assertFalse(RetryPolicy.isTransient(new IllegalArgumentException()));
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> policy.delay(0));
    assertThrows(IllegalArgumentException.class,
        () -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, sleeps::add));
  }
}
