package com.tradefeed.integration.binance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tradefeed.domain.trades.ConnectionSnapshot;
import com.tradefeed.domain.trades.ConnectionStatus;
import com.tradefeed.domain.trades.Pair;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class BinanceTradeStreamConnectionTest {
  private static final List<Pair> PAIRS = List.of(Pair.of("BTCUSDT"), Pair.of("ETHUSDT"));

  private final FakeStreamTransport transport = new FakeStreamTransport();
  private final RecordingEventHandler handler = new RecordingEventHandler();
  private BinanceTradeStreamConnection connection;
  private Thread runner;

  @AfterEach
  void tearDown() throws Exception {
    if (connection != null) {
      connection.stop();
    }
    if (runner != null) {
      runner.join(TimeUnit.SECONDS.toMillis(5));
    }
  }

  @Test
  void shouldSubscribeChunkThroughCombinedStreamUri() throws Exception {
    transport.thenAccept();
    start(3);

    transport.awaitSession();

    assertEquals(
        URI.create("wss://stream.example.test:9443/stream?streams=btcusdt@trade/ethusdt@trade"),
        transport.openedUris().get(0));
  }

  @Test
  void shouldHandFramesToHandlerInReceiveOrderAndKeepStreamingAfterBadFrame() throws Exception {
    transport.thenAccept();
    handler.expectFrames(4);
    start(3);

    FakeStreamTransport.FakeSession session = transport.awaitSession();
    session.deliver("trade-1");
    session.deliver("bad-frame");
    session.deliver("skip-depth");
    session.deliver("trade-2");

    assertTrue(handler.awaitFrames());
    eventually(() -> connection.snapshot().messages() == 2L);
    assertEquals(List.of("trade-1", "bad-frame", "skip-depth", "trade-2"), handler.frames);
    ConnectionSnapshot snapshot = connection.snapshot();
    assertEquals(ConnectionStatus.STREAMING, snapshot.status());
    assertTrue(snapshot.active());
    assertEquals(1L, snapshot.errors());
    eventually(() -> session.requested() == 4);
    assertFalse(session.isClosed());
  }

  @Test
  void shouldGiveUpAfterMaxRetriesWhenTransportKeepsRefusing() throws Exception {
    start(3);

    assertTrue(handler.failed.await(5, TimeUnit.SECONDS));
    runner.join(TimeUnit.SECONDS.toMillis(5));

    assertEquals(4, transport.openAttempts());
    assertEquals(ConnectionStatus.FAILED, connection.status());
    assertEquals(3, connection.snapshot().retryCount());
    assertEquals(
        List.of(
            "error:IOException",
            "reconnect:1",
            "error:IOException",
            "reconnect:2",
            "error:IOException",
            "reconnect:3",
            "error:IOException",
            "failed:3"),
        handler.events);
    assertEquals(
        List.of(Duration.ofMillis(1L), Duration.ofMillis(2L), Duration.ofMillis(4L)),
        handler.delays);
  }

  @Test
  void shouldReconnectAfterRemoteCloseAndResetRetries() throws Exception {
    transport.thenRefuse().thenAccept().thenAccept();
    handler.expectConnections(2);
    start(5);

    FakeStreamTransport.FakeSession first = transport.awaitSession();
    eventually(() -> connection.snapshot().retryCount() == 0 && connection.snapshot().active());
    first.remoteClose(1001, "going away");

    FakeStreamTransport.FakeSession second = transport.awaitSession();
    assertTrue(handler.awaitConnections());
    eventually(() -> connection.status() == ConnectionStatus.STREAMING);

    assertTrue(first.isClosed());
    assertFalse(second.isClosed());
    assertEquals(0, connection.snapshot().retryCount());
    assertEquals(
        List.of(
            "error:IOException",
            "reconnect:1",
            "connected",
            "disconnected:1001",
            "error:REMOTE_CLOSE",
            "reconnect:1",
            "connected"),
        handler.events);
  }

  @Test
  void shouldTreatTransportErrorAsConnectionFailure() throws Exception {
    transport.thenAccept().thenAccept();
    handler.expectConnections(2);
    start(5);

    transport.awaitSession().fail(new IllegalStateException("socket reset"));

    assertTrue(handler.awaitConnections());
    assertTrue(handler.events.contains("disconnected:1006"));
    assertTrue(handler.events.contains("error:IllegalStateException"));
  }

  @Test
  void shouldStopCleanlyWhileStreaming() throws Exception {
    transport.thenAccept();
    start(3);
    FakeStreamTransport.FakeSession session = transport.awaitSession();
    eventually(() -> connection.status() == ConnectionStatus.STREAMING);

    connection.stop();
    runner.join(TimeUnit.SECONDS.toMillis(5));

    assertFalse(runner.isAlive());
    assertTrue(session.isClosed());
    assertEquals(ConnectionStatus.STOPPED, connection.status());
    assertFalse(connection.snapshot().active());
    assertEquals(List.of("connected", "disconnected:1000"), handler.events);
  }

  private void start(int maxRetries) {
    BinanceTradeStreamConfig config =
        new BinanceTradeStreamConfig(
            URI.create("wss://stream.example.test:9443/"),
            50,
            Duration.ofSeconds(1),
            Duration.ofMillis(1),
            Duration.ofMillis(8),
            maxRetries);
    JitteredExponentialBackoff backoff =
        new JitteredExponentialBackoff(
            config.reconnectBaseBackoff(), config.reconnectMaxBackoff(), 0.0d, () -> 0.0d);
    connection =
        new BinanceTradeStreamConnection("conn-0", PAIRS, transport, config, backoff, handler);
    runner = new Thread(connection, "trade-stream-test");
    runner.setDaemon(true);
    runner.start();
  }

  private static void eventually(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("Condition not met in time");
      }
      Thread.sleep(5L);
    }
  }
}
