package com.aiadvent.mcp.pages.retry;

import java.time.Duration;

/**
 * One failed try inside a retry loop.
 *
 * @param counted whether the try counted towards the attempt limit; server-mandated rate limit
 *     waits do not
 */
public record OperationAttempt(
    int attemptNumber, FailureClass failureClass, Duration computedDelay, boolean counted) {}
