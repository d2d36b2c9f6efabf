package io.b2mash.readiness.absence;

public enum AbsenceReasonCategory {
  SICK,
  EMERGENCY,
  PERSONAL,
  FORGOT_CHECKIN,
  TECHNICAL_ISSUE,
  OTHER
}
