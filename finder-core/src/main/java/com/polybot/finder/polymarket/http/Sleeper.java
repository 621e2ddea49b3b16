package com.polybot.finder.polymarket.http;

import java.util.concurrent.TimeUnit;

@FunctionalInterface
public interface Sleeper {

  void sleep(long millis) throws InterruptedException;

  static Sleeper system() {
    return TimeUnit.MILLISECONDS::sleep;
  }
}
