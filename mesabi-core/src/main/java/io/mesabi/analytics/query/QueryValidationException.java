package io.mesabi.analytics.query;

import io.mesabi.analytics.error.AnalyticsException;
import io.mesabi.analytics.error.ErrorKind;

/**
 * Raised when a request references an unknown subject/field, an operator the field does not support,
 * or a value that cannot be coerced to the field's column type.
 * <p>
 * Always raised before any SQL reaches the store.
 */
public final class QueryValidationException extends AnalyticsException {
  public QueryValidationException(String message) {
    super(ErrorKind.BAD_REQUEST, message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(ErrorKind.BAD_REQUEST, message, cause);
  }
}
