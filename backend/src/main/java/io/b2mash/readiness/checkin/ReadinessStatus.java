package io.b2mash.readiness.checkin;

public enum ReadinessStatus {
  GREEN,
  YELLOW,
  RED
}
