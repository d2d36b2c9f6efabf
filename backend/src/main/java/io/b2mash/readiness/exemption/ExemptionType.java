package io.b2mash.readiness.exemption;

public enum ExemptionType {
  SICK_LEAVE,
  PERSONAL_LEAVE,
  MEDICAL_APPOINTMENT,
  FAMILY_EMERGENCY,
  OTHER
}
