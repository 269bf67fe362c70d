package com.tradefeed.integration.binance;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JdkWebSocketStreamTransport implements BinanceStreamTransport {
  private static final Logger log = LoggerFactory.getLogger(JdkWebSocketStreamTransport.class);
  private static final long CLOSE_TIMEOUT_MS = 2_000L;

  private final HttpClient httpClient;

  public JdkWebSocketStreamTransport(HttpClient httpClient) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
  }

  @Override
  public CompletableFuture<StreamSession> open(
      URI uri, Duration connectTimeout, StreamFrameListener listener) {
    Objects.requireNonNull(listener, "listener is required");
    return httpClient
        .newWebSocketBuilder()
        .connectTimeout(connectTimeout)
        .buildAsync(uri, new Listener(listener))
        .thenApply(JdkStreamSession::new);
  }

  private static final class JdkStreamSession implements StreamSession {
    private final WebSocket webSocket;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private JdkStreamSession(WebSocket webSocket) {
      this.webSocket = webSocket;
    }

    @Override
    public void requestNext() {
      if (!closed.get()) {
        webSocket.request(1);
      }
    }

    @Override
    public void close() {
      if (!closed.compareAndSet(false, true)) {
        return;
      }
      try {
        webSocket
            .sendClose(WebSocket.NORMAL_CLOSURE, "stopped")
            .get(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        webSocket.abort();
      } catch (Exception ex) {
        log.debug("Graceful websocket close failed, aborting", ex);
        webSocket.abort();
      }
    }
  }

  private static final class Listener implements WebSocket.Listener {
    private final StreamFrameListener delegate;
    private final StringBuilder frameBuffer = new StringBuilder();
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    private Listener(StreamFrameListener delegate) {
      this.delegate = delegate;
    }

    @Override
    public void onOpen(WebSocket webSocket) {
      webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
      frameBuffer.append(data);
      if (last) {
        String payload = frameBuffer.toString();
        frameBuffer.setLength(0);
        delegate.onFrame(payload);
      } else {
        webSocket.request(1);
      }
      return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
      if (terminated.compareAndSet(false, true)) {
        delegate.onClosed(statusCode, reason == null ? "" : reason);
      }
      return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
      if (terminated.compareAndSet(false, true)) {
        delegate.onError(error);
      }
    }
  }
}
