package com.tradefeed.ingest.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class IngestStatsTest {

  @Test
  void activeConnectionsNeverDropBelowZero() {
    IngestStats stats = new IngestStats();

    stats.connectionOpened();
    stats.connectionClosed();
    stats.connectionClosed();

    assertEquals(0, stats.activeConnections());
  }

  @Test
  void snapshotCopiesEveryCounter() {
    IngestStats stats = new IngestStats();
    stats.connectionOpened();
    stats.tradeReceived();
    stats.tradeReceived();
    stats.malformedFrame();
    stats.connectionError();

    assertEquals(new IngestStatsSnapshot(1, 2L, 1L, 1L), stats.snapshot());
  }
}
