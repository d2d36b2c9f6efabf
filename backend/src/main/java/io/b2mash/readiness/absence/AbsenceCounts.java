package io.b2mash.readiness.absence;

public record AbsenceCounts(long pending, long excused, long unexcused, long total) {}
