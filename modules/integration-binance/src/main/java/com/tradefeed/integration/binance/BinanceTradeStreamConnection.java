package com.tradefeed.integration.binance;

import com.tradefeed.domain.trades.ConnectionSnapshot;
import com.tradefeed.domain.trades.ConnectionStateMachine;
import com.tradefeed.domain.trades.ConnectionStatus;
import com.tradefeed.domain.trades.Pair;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supervises one combined-stream subscription for a fixed chunk of pairs.
 *
 * <p>{@link #run()} blocks the calling thread for the life of the connection: it connects, hands
 * frames to the handler one at a time, and reconnects with jittered backoff until it is stopped or
 * runs out of retries.
 */
public class BinanceTradeStreamConnection implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(BinanceTradeStreamConnection.class);

  private static final String CONNECT_TIMEOUT_CODE = "CONNECT_TIMEOUT";
  private static final String REMOTE_CLOSE_CODE = "REMOTE_CLOSE";
  private static final String IO_ERROR_CODE = "IO_ERROR";
  private static final int NORMAL_CLOSURE = 1000;
  private static final int ABNORMAL_CLOSURE = 1006;

  private final String connectionId;
  private final List<Pair> pairs;
  private final URI streamUri;
  private final BinanceStreamTransport transport;
  private final BinanceTradeStreamConfig config;
  private final JitteredExponentialBackoff backoff;
  private final BinanceTradeStreamEventHandler handler;

  private final AtomicReference<ConnectionStatus> status =
      new AtomicReference<>(ConnectionStatus.CONNECTING);
  private final AtomicBoolean stopped = new AtomicBoolean(false);
  private final AtomicBoolean active = new AtomicBoolean(false);
  private final AtomicInteger retryCount = new AtomicInteger(0);
  private final AtomicLong messages = new AtomicLong();
  private final AtomicLong errors = new AtomicLong();
  private final AtomicReference<StreamSession> sessionRef = new AtomicReference<>();
  private final AtomicReference<BlockingQueue<SessionEvent>> eventsRef = new AtomicReference<>();
  private final CountDownLatch stopSignal = new CountDownLatch(1);

  public BinanceTradeStreamConnection(
      String connectionId,
      List<Pair> pairs,
      BinanceStreamTransport transport,
      BinanceTradeStreamConfig config,
      JitteredExponentialBackoff backoff,
      BinanceTradeStreamEventHandler handler) {
    if (connectionId == null || connectionId.isBlank()) {
      throw new IllegalArgumentException("connectionId is required");
    }
    if (pairs == null || pairs.isEmpty()) {
      throw new IllegalArgumentException("pairs must not be empty");
    }
    this.connectionId = connectionId;
    this.pairs = List.copyOf(pairs);
    this.transport = Objects.requireNonNull(transport, "transport is required");
    this.config = Objects.requireNonNull(config, "config is required");
    this.backoff = Objects.requireNonNull(backoff, "backoff is required");
    this.handler = handler == null ? BinanceTradeStreamEventHandler.noop() : handler;
    this.streamUri = config.combinedStreamUri(this.pairs);
  }

  @Override
  public void run() {
    while (!stopped.get()) {
      Throwable failure = streamOnce();
      if (stopped.get()) {
        break;
      }
      reportFailure(failure);
      int attempts = retryCount.get();
      if (attempts >= config.maxRetries()) {
        transition(ConnectionStatus.FAILED);
        log.error(
            "Trade stream abandoned connectionId={} retries={} pairs={}",
            connectionId,
            attempts,
            pairs.size());
        handler.onFailed(connectionId, attempts);
        return;
      }
      Duration delay = backoff.backoffForRetry(attempts);
      int nextRetry = retryCount.incrementAndGet();
      transition(ConnectionStatus.BACKOFF);
      log.warn(
          "Trade stream reconnect scheduled connectionId={} retry={} delayMs={}",
          connectionId,
          nextRetry,
          delay.toMillis());
      handler.onReconnectScheduled(connectionId, nextRetry, delay);
      if (awaitStop(delay)) {
        break;
      }
      transition(ConnectionStatus.CONNECTING);
    }
    transition(ConnectionStatus.STOPPED);
    log.info("Trade stream stopped connectionId={}", connectionId);
  }

  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    stopSignal.countDown();
    BlockingQueue<SessionEvent> events = eventsRef.get();
    if (events != null) {
      events.offer(SessionEvent.stopped());
    }
    StreamSession session = sessionRef.getAndSet(null);
    if (session != null) {
      session.close();
    }
  }

  public ConnectionSnapshot snapshot() {
    return new ConnectionSnapshot(
        connectionId,
        pairs,
        status.get(),
        retryCount.get(),
        active.get(),
        messages.get(),
        errors.get());
  }

  public String connectionId() {
    return connectionId;
  }

  public List<Pair> pairs() {
    return pairs;
  }

  public ConnectionStatus status() {
    return status.get();
  }

  URI streamUri() {
    return streamUri;
  }

  /** Returns the failure that ended the session, or {@code null} when it ended by stop. */
  private Throwable streamOnce() {
    BlockingQueue<SessionEvent> events = new LinkedBlockingQueue<>();
    eventsRef.set(events);
    log.info(
        "Connecting trade stream connectionId={} pairs={} uri={}",
        connectionId,
        pairs.size(),
        streamUri);

    StreamSession session;
    CompletableFuture<StreamSession> pending =
        transport.open(streamUri, config.connectTimeout(), new QueueingListener(events));
    try {
      session = pending.get(config.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      pending.cancel(true);
      stop();
      return null;
    } catch (TimeoutException ex) {
      pending.cancel(true);
      return new ConnectTimeoutException(
          "Trade stream connect timed out after " + config.connectTimeout().toMillis() + "ms");
    } catch (ExecutionException ex) {
      return ex.getCause() == null ? ex : ex.getCause();
    }

    sessionRef.set(session);
    if (stopped.get()) {
      closeSession();
      return null;
    }
    retryCount.set(0);
    active.set(true);
    transition(ConnectionStatus.STREAMING);
    log.info("Trade stream connected connectionId={} pairs={}", connectionId, pairs.size());
    handler.onConnected(connectionId, pairs);
    SessionEvent terminal = SessionEvent.stopped();
    try {
      terminal = readFrames(events, session);
    } finally {
      active.set(false);
      closeSession();
      handler.onDisconnected(connectionId, terminal.statusCode(), terminal.reason());
    }
    if (terminal.stopRequested()) {
      return null;
    }
    if (terminal.error() != null) {
      return terminal.error();
    }
    return new RemoteCloseException(
        "Trade stream closed by remote status="
            + terminal.statusCode()
            + " reason="
            + terminal.reason());
  }

  private SessionEvent readFrames(BlockingQueue<SessionEvent> events, StreamSession session) {
    while (true) {
      SessionEvent event;
      try {
        event = events.take();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        stop();
        return SessionEvent.stopped();
      }
      if (event.stopRequested() || stopped.get()) {
        return SessionEvent.stopped();
      }
      if (event.payload() == null) {
        return event;
      }
      handleFrame(event.payload());
      session.requestNext();
    }
  }

  private void handleFrame(String payload) {
    FrameOutcome outcome;
    try {
      outcome = handler.onFrame(connectionId, payload);
    } catch (RuntimeException ex) {
      log.warn(
          "Trade frame handler failed connectionId={} error={}", connectionId, sanitizeMessage(ex));
      outcome = FrameOutcome.MALFORMED;
    }
    if (outcome == null) {
      return;
    }
    if (outcome.isTrade()) {
      messages.incrementAndGet();
    } else if (outcome == FrameOutcome.MALFORMED) {
      errors.incrementAndGet();
    }
  }

  private void reportFailure(Throwable failure) {
    Throwable error = unwrapCompletionException(failure);
    String code = errorCode(error);
    String message = sanitizeMessage(error);
    log.warn(
        "Trade stream connection failed connectionId={} code={} error={}",
        connectionId,
        code,
        message);
    handler.onConnectionError(connectionId, code, message, error);
  }

  private boolean awaitStop(Duration delay) {
    try {
      return stopSignal.await(Math.max(0L, delay.toMillis()), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      stop();
      return true;
    }
  }

  private void closeSession() {
    StreamSession session = sessionRef.getAndSet(null);
    if (session != null) {
      session.close();
    }
  }

  private void transition(ConnectionStatus next) {
    ConnectionStatus current = status.get();
    if (current == next) {
      return;
    }
    if (current.isTerminal()) {
      return;
    }
    ConnectionStateMachine.validateTransition(current, next);
    status.set(next);
  }

  private static String errorCode(Throwable error) {
    if (error instanceof ConnectTimeoutException) {
      return CONNECT_TIMEOUT_CODE;
    }
    if (error instanceof RemoteCloseException) {
      return REMOTE_CLOSE_CODE;
    }
    String simpleName = error == null ? null : error.getClass().getSimpleName();
    return simpleName == null || simpleName.isBlank() ? IO_ERROR_CODE : simpleName;
  }

  private static Throwable unwrapCompletionException(Throwable throwable) {
    if (throwable instanceof CompletionException completionException
        && completionException.getCause() != null) {
      return completionException.getCause();
    }
    return throwable;
  }

  private static String sanitizeMessage(Throwable error) {
    if (error == null) {
      return "";
    }
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      return error.getClass().getSimpleName();
    }
    String compact = message.replaceAll("\\s+", " ").trim();
    return compact.length() <= 300 ? compact : compact.substring(0, 300);
  }

  private static final class ConnectTimeoutException extends RuntimeException {
    private ConnectTimeoutException(String message) {
      super(message);
    }
  }

  private static final class RemoteCloseException extends RuntimeException {
    private RemoteCloseException(String message) {
      super(message);
    }
  }

  private record SessionEvent(
      String payload, int statusCode, String reason, Throwable error, boolean stopRequested) {
    static SessionEvent frame(String payload) {
      return new SessionEvent(payload, 0, null, null, false);
    }

    static SessionEvent closed(int statusCode, String reason) {
      return new SessionEvent(null, statusCode, reason, null, false);
    }

    static SessionEvent failed(Throwable error) {
      return new SessionEvent(null, ABNORMAL_CLOSURE, "ws_error", error, false);
    }

    static SessionEvent stopped() {
      return new SessionEvent(null, NORMAL_CLOSURE, "stopped", null, true);
    }
  }

  private static final class QueueingListener implements StreamFrameListener {
    private final BlockingQueue<SessionEvent> events;

    private QueueingListener(BlockingQueue<SessionEvent> events) {
      this.events = events;
    }

    @Override
    public void onFrame(String payload) {
      events.offer(SessionEvent.frame(payload));
    }

    @Override
    public void onClosed(int statusCode, String reason) {
      events.offer(SessionEvent.closed(statusCode, reason));
    }

    @Override
    public void onError(Throwable error) {
      events.offer(SessionEvent.failed(error));
    }
  }
}
