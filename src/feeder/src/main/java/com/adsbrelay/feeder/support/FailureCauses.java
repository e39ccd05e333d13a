package com.adsbrelay.feeder.support;

import java.io.EOFException;
import java.nio.channels.ClosedChannelException;
import java.util.List;
import java.util.Locale;

/** Classifies transport failures for logging. */
public final class FailureCauses {
  private static final List<String> PEER_GONE_MESSAGES = List.of(
      "broken pipe",
      "connection reset",
      "connection abort",
      "socket closed",
      "session closed",
      "forcibly closed by the remote host");

  private FailureCauses() {
  }

  /**
   * Tells whether a failure anywhere in the cause chain means the peer went away.
   *
   * <p>Such failures are routine for WebSocket subscribers and the raw feed, and are logged at
   * DEBUG rather than WARN.
   */
  public static boolean isPeerDisconnect(Throwable error) {
    for (Throwable cause = error; cause != null; cause = nextCause(cause)) {
      if (cause instanceof EOFException || cause instanceof ClosedChannelException) {
        return true;
      }
      String message = cause.getMessage();
      if (message != null) {
        String normalized = message.toLowerCase(Locale.ROOT);
        if (PEER_GONE_MESSAGES.stream().anyMatch(normalized::contains)) {
          return true;
        }
      }
    }
    return false;
  }

  /** One-line {@code SimpleName: message} of the innermost cause. */
  public static String rootCauseSummary(Throwable error) {
    Throwable root = error;
    for (Throwable cause = nextCause(error); cause != null; cause = nextCause(cause)) {
      root = cause;
    }
    String message = root.getMessage();
    return message == null || message.isBlank()
        ? root.getClass().getSimpleName()
        : root.getClass().getSimpleName() + ": " + message;
  }

  private static Throwable nextCause(Throwable current) {
    Throwable cause = current.getCause();
    return cause == current ? null : cause;
  }
}
