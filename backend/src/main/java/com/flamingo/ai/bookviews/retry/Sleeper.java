package com.flamingo.ai.bookviews.retry;

import java.time.Duration;

/** Blocking wait between retry attempts. Replaced by a recording fake in tests. */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
