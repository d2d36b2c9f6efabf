package io.b2mash.readiness.checkin;

/**
 * Converts the four 1-10 wellness inputs of a check-in into a 0-100 readiness score and a traffic
 * light status. Stress is inverted: a stress of 10 contributes 0.
 */
public final class ReadinessCalculator {

  static final int GREEN_THRESHOLD = 70;
  static final int YELLOW_THRESHOLD = 40;

  private ReadinessCalculator() {}

  public record Readiness(int score, ReadinessStatus status) {}

  public static Readiness calculate(int mood, int stress, int sleep, int physicalHealth) {
    double moodScore = mood * 10.0;
    double stressScore = (10 - stress) * 10.0;
    double sleepScore = sleep * 10.0;
    double physicalScore = physicalHealth * 10.0;
    int score = (int) Math.round((moodScore + stressScore + sleepScore + physicalScore) / 4);
    return new Readiness(score, statusFor(score));
  }

  public static ReadinessStatus statusFor(int score) {
    if (score >= GREEN_THRESHOLD) {
      return ReadinessStatus.GREEN;
    }
    if (score >= YELLOW_THRESHOLD) {
      return ReadinessStatus.YELLOW;
    }
    return ReadinessStatus.RED;
  }
}
