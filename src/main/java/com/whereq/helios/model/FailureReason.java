package com.whereq.helios.model;

/**
 * Why a task ended without completing
 */
public enum FailureReason {
    ADMISSION_DENIED,
    DEADLINE_EXCEEDED,
    EXECUTOR_FAILURE,
    DEPENDENCY_FAILED,
    CANCELLED
}
