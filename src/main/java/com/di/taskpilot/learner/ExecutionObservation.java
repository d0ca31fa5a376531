package com.di.taskpilot.learner;

/**
 * Resource figures observed for one execution.
 *
 * @param cpu             fraction of host CPU, 0-1
 * @param ramMb           memory in MB
 * @param durationSeconds wall-clock duration
 */
public record ExecutionObservation(double cpu, double ramMb, double durationSeconds) {
}
