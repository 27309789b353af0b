package io.mesabi.analytics.error;

/** Stable failure classification exposed to callers. */
public enum ErrorKind {
  /** The request cannot be compiled (unknown subject/field/operator, bad value, bad alias). */
  BAD_REQUEST,
  /** The backing store rejected or failed the compiled statement. */
  QUERY_EXECUTION_FAILED
}
