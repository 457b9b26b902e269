package com.codeheadsystems.iracing.client.manager;

import java.time.Duration;

/**
 * Monotonic time source and sleeper used for token expiry and request scheduling.
 */
public interface SchedulingClock {

  /**
   * System-backed clock: {@link System#nanoTime()} and {@link Thread#sleep(long)}.
   */
  SchedulingClock SYSTEM = new SchedulingClock() {
    @Override
    public long nanoTime() {
      return System.nanoTime();
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
      if (!duration.isNegative() && !duration.isZero()) {
        Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
      }
    }
  };

  /**
   * Current monotonic time in nanoseconds. Only differences between values are meaningful.
   *
   * @return the time
   */
  long nanoTime();

  /**
   * Blocks the calling thread for the given duration.
   *
   * @param duration how long to sleep
   * @throws InterruptedException if interrupted while sleeping
   */
  void sleep(Duration duration) throws InterruptedException;
}
