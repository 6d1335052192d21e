/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol;

/**
 * Where connection handlers hand off parsed requests.
 */
@FunctionalInterface
public interface RequestSink {

    /**
     * Try to accept a request without blocking.
     *
     * @return false if the sink is full; the caller keeps the request and retries
     */
    boolean offer(InboundRequest request);
}
