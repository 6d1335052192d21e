/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol.core;

import com.fsdrelay.protocol.InboundRequest;
import com.fsdrelay.protocol.RequestSink;
import com.fsdrelay.utils.LoggerUtil;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Routes inbound requests to command handlers.
 *
 * <p>All handling happens on a single consumer thread draining a bounded FIFO
 * queue, so commands are processed one at a time in arrival order.
 */
public class PacketDispatcher implements RequestSink {

    public static final int DEFAULT_QUEUE_CAPACITY = 1000;
    private static final String THREAD_NAME = "fsd-dispatcher";

    private final BlockingQueue<InboundRequest> queue;
    private final List<CommandHandler> handlers = new CopyOnWriteArrayList<>();

    private volatile boolean running;
    private Thread worker;

    public PacketDispatcher() {
        this(DEFAULT_QUEUE_CAPACITY);
    }

    public PacketDispatcher(int queueCapacity) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("Dispatcher queue capacity must be at least 1");
        }
        this.queue = new LinkedBlockingQueue<>(queueCapacity);
    }

    /**
     * Handlers are consulted in registration order; the first match wins.
     */
    public PacketDispatcher register(CommandHandler handler) {
        handlers.add(handler);
        return this;
    }

    @Override
    public boolean offer(InboundRequest request) {
        return submit(request);
    }

    /**
     * Enqueue without blocking.
     *
     * @return false if the queue is full
     */
    public boolean submit(InboundRequest request) {
        boolean accepted = queue.offer(request);
        if (!accepted) {
            LoggerUtil.debug(() -> "Dispatcher queue full, refused " + request.command() + " from " + request.connectionId());
        }
        return accepted;
    }

    /**
     * Route one request on the calling thread.
     *
     * @return true if a handler claimed the command
     */
    public boolean dispatch(InboundRequest request) {
        String command = request.command();
        for (CommandHandler handler : handlers) {
            if (!handler.canHandle(command)) {
                continue;
            }
            try {
                handler.handle(request);
            } catch (Exception e) {
                LoggerUtil.error("[" + request.connectionId() + "] Handler " + handler.getClass().getSimpleName()
                        + " failed on " + command, e);
            }
            return true;
        }
        LoggerUtil.debug(() -> "[" + request.connectionId() + "] Unhandled command " + command + ": " + request.packet());
        return false;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        worker = new Thread(this::runLoop, THREAD_NAME);
        worker.setDaemon(true);
        worker.start();
        LoggerUtil.info("Packet dispatcher started with " + handlers.size() + " handlers");
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        worker.interrupt();
        try {
            worker.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        int dropped = queue.size();
        queue.clear();
        LoggerUtil.info("Packet dispatcher stopped" + (dropped > 0 ? " (" + dropped + " queued requests dropped)" : ""));
    }

    private void runLoop() {
        while (running) {
            try {
                dispatch(queue.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    public boolean isRunning() {
        return running;
    }

    public int queuedRequests() {
        return queue.size();
    }
}
