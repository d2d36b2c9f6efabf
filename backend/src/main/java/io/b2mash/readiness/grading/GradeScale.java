package io.b2mash.readiness.grading;

/** Maps a 0-100 team score to letter grades. */
public final class GradeScale {

  /**
   * @param grade letter with modifier, e.g. {@code B+}
   * @param label human-readable band
   * @param color display band: GREEN, YELLOW, ORANGE or RED
   */
  public record LetterGrade(String grade, String label, String color) {}

  private GradeScale() {}

  public static LetterGrade letterFor(int score) {
    if (score >= 97) return new LetterGrade("A+", "Outstanding", "GREEN");
    if (score >= 93) return new LetterGrade("A", "Excellent", "GREEN");
    if (score >= 90) return new LetterGrade("A-", "Excellent", "GREEN");
    if (score >= 87) return new LetterGrade("B+", "Very Good", "GREEN");
    if (score >= 83) return new LetterGrade("B", "Good", "GREEN");
    if (score >= 80) return new LetterGrade("B-", "Good", "YELLOW");
    if (score >= 77) return new LetterGrade("C+", "Satisfactory", "YELLOW");
    if (score >= 73) return new LetterGrade("C", "Satisfactory", "YELLOW");
    if (score >= 70) return new LetterGrade("C-", "Satisfactory", "YELLOW");
    if (score >= 67) return new LetterGrade("D+", "Needs Improvement", "ORANGE");
    if (score >= 63) return new LetterGrade("D", "Needs Improvement", "ORANGE");
    if (score >= 60) return new LetterGrade("D-", "Needs Improvement", "ORANGE");
    return new LetterGrade("F", "Critical", "RED");
  }

  /** Four-band roll-up used in company overviews. */
  public static String simpleGrade(int score) {
    if (score >= 90) return "A";
    if (score >= 80) return "B";
    if (score >= 70) return "C";
    return "D";
  }
}
