package com.quantori.pse.core.retry;

import java.time.Duration;

/** Blocks the calling thread between two attempts. */
@FunctionalInterface
public interface Sleeper {
  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
