/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol.core;

import com.fsdrelay.protocol.InboundRequest;

/**
 * Interface for handlers that implement the semantics of one or more FSD commands.
 */
public interface CommandHandler {
    /**
     * Check if this handler can process the given command.
     *
     * @param command The command mnemonic (e.g., "ID", "AP", "TM")
     * @return true if this handler can process the command
     */
    boolean canHandle(String command);

    /**
     * Handle the request. Runs on the dispatcher thread.
     *
     * @param request The parsed packet and the connection it came from
     * @throws Exception if processing fails
     */
    void handle(InboundRequest request) throws Exception;
}
