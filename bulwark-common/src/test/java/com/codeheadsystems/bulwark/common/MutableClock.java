package com.codeheadsystems.bulwark.common;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Test clock that only moves when told to.
 */
public class MutableClock extends Clock {

  private volatile long millis;

  public MutableClock(long startMillis) {
    this.millis = startMillis;
  }

  public void advance(Duration duration) {
    millis += duration.toMillis();
  }

  public void setMillis(long millis) {
    this.millis = millis;
  }

  @Override
  public long millis() {
    return millis;
  }

  @Override
  public Instant instant() {
    return Instant.ofEpochMilli(millis);
  }

  @Override
  public ZoneId getZone() {
    return ZoneOffset.UTC;
  }

  @Override
  public Clock withZone(ZoneId zone) {
    return this;
  }
}
