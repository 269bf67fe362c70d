package com.tradefeed.ingest.ingest;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** Counters shared by every connection of one ingest service. */
public class IngestStats {
  private final AtomicInteger activeConnections = new AtomicInteger();
  private final AtomicLong totalMessages = new AtomicLong();
  private final AtomicLong errorMessages = new AtomicLong();
  private final AtomicLong connectionErrors = new AtomicLong();

  public void connectionOpened() {
    activeConnections.incrementAndGet();
  }

  public void connectionClosed() {
    activeConnections.updateAndGet(current -> current > 0 ? current - 1 : 0);
  }

  public void tradeReceived() {
    totalMessages.incrementAndGet();
  }

  public void malformedFrame() {
    errorMessages.incrementAndGet();
  }

  public void connectionError() {
    connectionErrors.incrementAndGet();
  }

  public int activeConnections() {
    return activeConnections.get();
  }

  public IngestStatsSnapshot snapshot() {
    return new IngestStatsSnapshot(
        activeConnections.get(),
        totalMessages.get(),
        errorMessages.get(),
        connectionErrors.get());
  }
}
