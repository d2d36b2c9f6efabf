package io.b2mash.readiness.exemption;

public enum ExemptionStatus {
  PENDING,
  APPROVED,
  REJECTED,
  CANCELLED
}
