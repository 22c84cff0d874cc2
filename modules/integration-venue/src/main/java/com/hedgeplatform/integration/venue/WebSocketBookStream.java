package com.hedgeplatform.integration.venue;

import com.hedgeplatform.domain.hedge.Instrument;
import com.hedgeplatform.domain.hedge.OrderBookSnapshot;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One WebSocket connection carrying top-of-book updates. Started once; a dropped connection is
 * reported through {@link OrderBookListener#onDisconnected} and is never reopened here.
 */
public class WebSocketBookStream implements OrderBookSubscription {
  private static final Logger log = LoggerFactory.getLogger(WebSocketBookStream.class);
  private static final int ABNORMAL_CLOSURE = 1006;
  private static final int INTERNAL_ERROR = 1011;

  private final String venueId;
  private final URI streamUri;
  private final Instrument instrument;
  private final BookTickerCodec codec;
  private final OrderBookListener listener;
  private final HttpClient httpClient;
  private final Clock clock;
  private final Duration connectTimeout;
  private final MeterRegistry meterRegistry;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean terminated = new AtomicBoolean(false);
  private final AtomicBoolean closedByCaller = new AtomicBoolean(false);
  private final AtomicReference<WebSocket> webSocketRef = new AtomicReference<>();

  public WebSocketBookStream(
      String venueId,
      URI streamUri,
      Instrument instrument,
      BookTickerCodec codec,
      OrderBookListener listener,
      HttpClient httpClient,
      Clock clock,
      Duration connectTimeout,
      MeterRegistry meterRegistry) {
    this.venueId = Objects.requireNonNull(venueId, "venueId is required");
    this.streamUri = Objects.requireNonNull(streamUri, "streamUri is required");
    this.instrument = Objects.requireNonNull(instrument, "instrument is required");
    this.codec = Objects.requireNonNull(codec, "codec is required");
    this.listener = Objects.requireNonNull(listener, "listener is required");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    this.clock = Objects.requireNonNull(clock, "clock is required");
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout is required");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry is required");
  }

  public WebSocketBookStream start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("book stream for " + venueId + " cannot be restarted");
    }
    log.info("Connecting book stream venue={} instrument={} uri={}", venueId, instrument, streamUri);
    httpClient
        .newWebSocketBuilder()
        .connectTimeout(connectTimeout)
        .buildAsync(streamUri, new Listener())
        .whenComplete(
            (webSocket, error) -> {
              if (error != null) {
                terminate(ABNORMAL_CLOSURE, "connect_failed", error);
              }
            });
    return this;
  }

  @Override
  public String venueId() {
    return venueId;
  }

  @Override
  public boolean isActive() {
    return started.get() && !terminated.get();
  }

  @Override
  public void close() {
    closedByCaller.set(true);
    WebSocket webSocket = webSocketRef.getAndSet(null);
    if (webSocket != null) {
      try {
        webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "closed").join();
      } catch (CompletionException ex) {
        webSocket.abort();
      }
    }
    terminated.set(true);
  }

  void handleMessage(String payload) {
    Optional<OrderBookSnapshot> snapshot;
    try {
      snapshot = codec.parse(payload, instrument, clock.instant());
    } catch (RuntimeException ex) {
      meterRegistry.counter("venue.ws.messages.total", "venue", venueId, "type", "parse_error").increment();
      log.debug("Unparseable book frame venue={} payload={}", venueId, abbreviate(payload), ex);
      return;
    }
    if (snapshot.isEmpty()) {
      meterRegistry.counter("venue.ws.messages.total", "venue", venueId, "type", "ignored").increment();
      return;
    }
    meterRegistry.counter("venue.ws.snapshot.total", "venue", venueId).increment();
    listener.onSnapshot(snapshot.get());
  }

  private void terminate(int statusCode, String reason, Throwable error) {
    if (!terminated.compareAndSet(false, true)) {
      return;
    }
    WebSocket socket = webSocketRef.getAndSet(null);
    if (socket != null) {
      socket.abort();
    }
    if (closedByCaller.get()) {
      return;
    }
    Throwable cause = unwrap(error);
    meterRegistry.counter("venue.ws.disconnect.total", "venue", venueId).increment();
    listener.onDisconnected(
        new StreamDisconnectException(venueId, statusCode, reason == null ? "" : reason, cause));
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException completion && completion.getCause() != null) {
      return completion.getCause();
    }
    return error;
  }

  private static String abbreviate(String payload) {
    return payload.length() <= 200 ? payload : payload.substring(0, 200);
  }

  private final class Listener implements WebSocket.Listener {
    private final StringBuilder frameBuffer = new StringBuilder();

    @Override
    public void onOpen(WebSocket webSocket) {
      webSocketRef.set(webSocket);
      codec
          .subscribeMessage(instrument, clock.instant())
          .ifPresent(message -> webSocket.sendText(message, true));
      listener.onConnected(venueId);
      webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
      frameBuffer.append(data);
      if (last) {
        String payload = frameBuffer.toString();
        frameBuffer.setLength(0);
        handleMessage(payload);
      }
      webSocket.request(1);
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
      terminate(statusCode, reason, null);
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
      terminate(INTERNAL_ERROR, "ws_error", error);
    }
  }
}
