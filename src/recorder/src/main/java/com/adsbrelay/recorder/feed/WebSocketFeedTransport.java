package com.adsbrelay.recorder.feed;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import org.springframework.stereotype.Component;

/** {@link FeedTransport} backed by the JDK {@link HttpClient} WebSocket client. */
@Component
public class WebSocketFeedTransport implements FeedTransport {
  private final HttpClient httpClient;

  public WebSocketFeedTransport(HttpClient httpClient) {
    this.httpClient = httpClient;
  }

  @Override
  public CompletableFuture<FeedConnection> open(URI uri, Consumer<String> onMessage) {
    FeedConnection connection = new FeedConnection();
    return httpClient.newWebSocketBuilder()
        .buildAsync(uri, new Listener(connection, onMessage))
        .thenApply(webSocket -> {
          connection.bind(() -> webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "bye")
              .whenComplete((ignored, error) -> webSocket.abort()));
          return connection;
        });
  }

  private static final class Listener implements WebSocket.Listener {
    private final FeedConnection connection;
    private final Consumer<String> onMessage;
    private final StringBuilder partial = new StringBuilder();

    private Listener(FeedConnection connection, Consumer<String> onMessage) {
      this.connection = connection;
      this.onMessage = onMessage;
    }

    @Override
    public void onOpen(WebSocket webSocket) {
      webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
      partial.append(data);
      if (last) {
        String message = partial.toString();
        partial.setLength(0);
        onMessage.accept(message);
      }
      webSocket.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
      connection.markClosed("closed by feed (" + statusCode + ")");
      return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
      connection.markClosed(error.getClass().getSimpleName() + ": " + error.getMessage());
    }
  }
}
