package io.b2mash.readiness.grading;

public enum RiskTier {
  /** Too few check-ins in the period to be graded. */
  ONBOARDING,
  AT_RISK,
  NEEDS_ATTENTION,
  ON_TRACK
}
