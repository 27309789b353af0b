package io.mesabi.analytics.catalog;

/** Parts extracted from the subject's temporal column for derived dimensions and filters. */
public enum DatePart {
  /**
   * Day of week. Requests use Monday=1 .. Sunday=7; the store numbers Sunday=0 .. Saturday=6, so only 7 moves.
   */
  DAY_OF_WEEK(0, 7) {
    @Override public int toStoreValue(int requested) { return requested == 7 ? 0 : requested; }
  },
  HOUR(0, 23);

  private final int min;
  private final int max;

  DatePart(int min, int max) {
    this.min = min;
    this.max = max;
  }

  public int min() { return min; }
  public int max() { return max; }

  public int toStoreValue(int requested) { return requested; }
}
