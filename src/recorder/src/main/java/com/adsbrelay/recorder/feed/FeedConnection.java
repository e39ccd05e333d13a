package com.adsbrelay.recorder.feed;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** Handle on one open feed connection; completes once when the link goes down. */
public final class FeedConnection {
  private final CountDownLatch closed = new CountDownLatch(1);
  private volatile Runnable closer = () -> {};
  private volatile String closeReason;

  void bind(Runnable closer) {
    this.closer = closer;
  }

  /** Records that the link is gone. Only the first reason is kept. */
  public void markClosed(String reason) {
    if (closeReason == null) {
      closeReason = reason;
    }
    closed.countDown();
  }

  public boolean awaitClosed(Duration timeout) throws InterruptedException {
    return closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  public boolean isClosed() {
    return closed.getCount() == 0;
  }

  public String closeReason() {
    return closeReason;
  }

  /** Closes the link from this side. */
  public void close() {
    if (!isClosed()) {
      closer.run();
    }
    markClosed("closed by subscriber");
  }
}
