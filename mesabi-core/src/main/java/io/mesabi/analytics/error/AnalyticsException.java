package io.mesabi.analytics.error;

import java.util.Objects;

/**
 * Base failure for the analytics core. Callers switch on {@link #kind()} and show {@link #getMessage()};
 * driver stack traces never leave the engine.
 */
public class AnalyticsException extends RuntimeException {
  private final ErrorKind kind;

  public AnalyticsException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public AnalyticsException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() { return kind; }
}
