package io.b2mash.readiness.absence;

public enum AbsenceStatus {
  /** Detected; awaiting the worker's justification, or the reviewer once justified. */
  PENDING_JUSTIFICATION,
  EXCUSED,
  UNEXCUSED;

  public boolean isTerminal() {
    return this != PENDING_JUSTIFICATION;
  }
}
