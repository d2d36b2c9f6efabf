package io.b2mash.readiness.grading;

public enum Trend {
  UP,
  DOWN,
  STABLE;

  static final int THRESHOLD = 3;

  /** Direction of a score change between two consecutive periods. */
  public static Trend of(int scoreDelta) {
    if (scoreDelta >= THRESHOLD) {
      return UP;
    }
    if (scoreDelta <= -THRESHOLD) {
      return DOWN;
    }
    return STABLE;
  }
}
