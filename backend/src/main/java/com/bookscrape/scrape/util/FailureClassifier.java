package com.bookscrape.scrape.util;

import com.bookscrape.scrape.http.HttpStatusException;
import com.bookscrape.scrape.model.FailureKind;
import com.bookscrape.scrape.model.FetchFailure;

import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

public final class FailureClassifier {
  public static final int NO_STATUS = 0;

  private static final int MAX_CAUSE_DEPTH = 16;

  private FailureClassifier() {}

  /**
   * Maps a raw fetch failure to exactly one {@link FailureKind}. First match wins:
   * deadline or cancellation, transport timeout, connection failure, then the
   * status code, then any remaining cause.
   *
   * @param cause the failure, possibly wrapped; may be {@code null}
   * @param statusCode the HTTP status, or {@link #NO_STATUS} when none was received
   */
  public static FetchFailure classify(Throwable cause, int statusCode) {
    if (hasCause(cause, TimeoutException.class, CancellationException.class)) {
      return new FetchFailure(FailureKind.TIMEOUT, cause, statusCode);
    }
    if (hasCause(cause, HttpTimeoutException.class, SocketTimeoutException.class)) {
      return new FetchFailure(FailureKind.TIMEOUT, cause, statusCode);
    }
    if (hasCause(cause, SocketException.class, UnknownHostException.class)) {
      return new FetchFailure(FailureKind.CONNECTION, cause, statusCode);
    }
    if (statusCode > NO_STATUS) {
      FailureKind kind = fromHttpStatus(statusCode);
      if (kind != null) {
        Throwable wrapped = cause == null ? new HttpStatusException(statusCode) : cause;
        return new FetchFailure(kind, wrapped, statusCode);
      }
    }
    if (cause != null) {
      return new FetchFailure(FailureKind.OTHER, cause, statusCode);
    }
    return new FetchFailure(FailureKind.UNKNOWN, null, statusCode);
  }

  public static FailureKind fromHttpStatus(int status) {
    return switch (status) {
      case 403 -> FailureKind.FORBIDDEN;
      case 404 -> FailureKind.NOT_FOUND;
      case 429 -> FailureKind.RATE_LIMITED;
      default -> null;
    };
  }

  @SafeVarargs
  private static boolean hasCause(Throwable error, Class<? extends Throwable>... types) {
    Throwable current = error;
    int depth = 0;
    while (current != null && depth < MAX_CAUSE_DEPTH) {
      for (Class<? extends Throwable> type : types) {
        if (type.isInstance(current)) {
          return true;
        }
      }
      if (current.getCause() == current) {
        return false;
      }
      current = current.getCause();
      depth++;
    }
    return false;
  }
}
