package io.github.drompincen.postscheduler.runtime.schedule;

public record RecoveryReport(int registered, int skippedPast, int failed) {}
