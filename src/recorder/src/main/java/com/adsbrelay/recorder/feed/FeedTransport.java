package com.adsbrelay.recorder.feed;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/** Opens connections to the snapshot broadcast. */
public interface FeedTransport {
  /**
   * Starts connecting to the feed.
   *
   * @param uri feed endpoint
   * @param onMessage receives every complete text message, on the transport's thread
   * @return future completing with the open connection, or exceptionally when the handshake fails
   */
  CompletableFuture<FeedConnection> open(URI uri, Consumer<String> onMessage);
}
