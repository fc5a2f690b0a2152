package com.example.couchbaseconnect.core.retry;

import java.time.Duration;

/** Blocks the calling thread between retry attempts. */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD =
      duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);

  void sleep(final Duration duration) throws InterruptedException;
}
