/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol;

import com.fsdrelay.auth.SessionRegistry;
import com.fsdrelay.bus.BroadcastBus;
import com.fsdrelay.bus.BroadcastMessage;
import com.fsdrelay.bus.Subscription;
import com.fsdrelay.protocol.core.ServerPackets;
import com.fsdrelay.utils.LoggerUtil;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.util.concurrent.EventExecutor;

import java.security.SecureRandom;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-connection handler. One instance per channel.
 *
 * <p>Reading side: decoded lines are parsed and handed to the {@link RequestSink}.
 * When the sink is full, reads are paused and the refused requests are retried in
 * arrival order from the channel's event loop.
 *
 * <p>Writing side: the connection's bus {@link Subscription} is drained on the
 * event loop whenever something is published. Draining stops while the channel is
 * not writable and picks up again from {@link #channelWritabilityChanged}.
 */
public class FsdClientHandler extends SimpleChannelInboundHandler<String> {

    public static final long PENDING_RETRY_MILLIS = 10;
    private static final int TOKEN_BYTES = 11;
    private static final SecureRandom TOKEN_RANDOM = new SecureRandom();

    private final SessionRegistry registry;
    private final BroadcastBus bus;
    private final RequestSink sink;
    private final String protocolVersion;

    private final ArrayDeque<InboundRequest> pending = new ArrayDeque<>();
    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);
    private boolean draining;
    private boolean retryScheduled;

    private ConnectionId connectionId;
    private Subscription subscription;

    public FsdClientHandler(SessionRegistry registry, BroadcastBus bus, RequestSink sink, String protocolVersion) {
        this.registry = registry;
        this.bus = bus;
        this.sink = sink;
        this.protocolVersion = protocolVersion;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        connectionId = ConnectionId.of(ctx.channel().remoteAddress());
        registry.register(connectionId);
        subscription = bus.subscribe(connectionId, () -> requestDrain(ctx));
        LoggerUtil.info(prefix() + "Connection ESTABLISHED | clients=" + registry.size());

        Packet identification = ServerPackets.serverIdentification(protocolVersion, newToken());
        ctx.writeAndFlush(PacketCodec.format(identification)).addListener(closeOnFailure(ctx));
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line) {
        if (line.isBlank()) {
            return;
        }
        Packet packet;
        try {
            packet = PacketCodec.parse(line);
        } catch (PacketParseException e) {
            LoggerUtil.warn(prefix() + "Dropping unparsable line: " + e.getMessage());
            return;
        }
        LoggerUtil.debug(() -> prefix() + "IN  " + packet);

        InboundRequest request = new InboundRequest(connectionId, packet);
        if (pending.isEmpty() && sink.offer(request)) {
            return;
        }
        pending.addLast(request);
        if (ctx.channel().config().isAutoRead()) {
            ctx.channel().config().setAutoRead(false);
            LoggerUtil.warn(prefix() + "Dispatcher queue full, pausing reads");
        }
        scheduleRetry(ctx);
    }

    private void scheduleRetry(ChannelHandlerContext ctx) {
        if (retryScheduled) {
            return;
        }
        retryScheduled = true;
        ctx.executor().schedule(() -> {
            retryScheduled = false;
            flushPending(ctx);
        }, PENDING_RETRY_MILLIS, TimeUnit.MILLISECONDS);
    }

    private void flushPending(ChannelHandlerContext ctx) {
        if (!ctx.channel().isActive()) {
            pending.clear();
            return;
        }
        while (!pending.isEmpty()) {
            if (!sink.offer(pending.peekFirst())) {
                scheduleRetry(ctx);
                return;
            }
            pending.pollFirst();
        }
        if (!ctx.channel().config().isAutoRead()) {
            ctx.channel().config().setAutoRead(true);
            LoggerUtil.info(prefix() + "Dispatcher caught up, resuming reads");
        }
    }

    private void requestDrain(ChannelHandlerContext ctx) {
        EventExecutor executor = ctx.executor();
        if (executor.inEventLoop()) {
            drainBus(ctx);
        } else if (drainScheduled.compareAndSet(false, true)) {
            executor.execute(() -> {
                drainScheduled.set(false);
                drainBus(ctx);
            });
        }
    }

    /**
     * Write every pending bus message addressed to this connection.
     * Must run on the channel's event loop.
     */
    private void drainBus(ChannelHandlerContext ctx) {
        if (draining || subscription == null || subscription.isClosed()) {
            return;
        }
        draining = true;
        try {
            long lagged = subscription.takeLagged();
            if (lagged > 0) {
                LoggerUtil.warn(prefix() + "Lagging behind broadcast, dropped " + lagged + " messages");
            }
            while (ctx.channel().isActive()) {
                if (!ctx.channel().isWritable()) {
                    LoggerUtil.debug(() -> prefix() + "Channel not writable, pausing drain");
                    return;
                }
                BroadcastMessage message = subscription.poll();
                if (message == null) {
                    return;
                }
                if (message.isDisconnect()) {
                    LoggerUtil.warn(prefix() + "Disconnecting"
                            + (message.getReason() != null ? ": " + message.getReason() : ""));
                    ctx.close();
                    return;
                }
                LoggerUtil.debug(() -> prefix() + "OUT " + message.getPacket());
                ctx.writeAndFlush(PacketCodec.format(message.getPacket())).addListener(closeOnFailure(ctx));
            }
        } finally {
            draining = false;
        }
    }

    private ChannelFutureListener closeOnFailure(ChannelHandlerContext ctx) {
        return future -> {
            if (!future.isSuccess()) {
                LoggerUtil.warn(prefix() + "Write failed, closing: " + future.cause());
                ctx.close();
            }
        };
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (ctx.channel().isWritable()) {
            LoggerUtil.debug(() -> prefix() + "Backpressure END | bufferHeadroom="
                    + ctx.channel().bytesBeforeUnwritable() + " bytes");
            drainBus(ctx);
        } else {
            LoggerUtil.debug(() -> prefix() + "Backpressure START | needToFlush="
                    + ctx.channel().bytesBeforeWritable() + " bytes");
        }
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (subscription != null) {
            subscription.close();
        }
        int discarded = pending.size();
        pending.clear();

        if (connectionId != null) {
            Optional<Session> removed = registry.remove(connectionId);
            String who = removed.map(Session::getDisplayName).orElse(connectionId.toString());
            String duration = removed.map(Session::getSessionDuration).orElse("00:00:00");
            LoggerUtil.info(prefix() + "Connection CLOSED | client=" + who + " | duration=" + duration
                    + (discarded > 0 ? " | discardedRequests=" + discarded : ""));
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof TooLongFrameException) {
            LoggerUtil.warn(prefix() + "Discarded oversized line: " + cause.getMessage());
            return;
        }
        LoggerUtil.error(prefix() + "Pipeline error", cause);
        ctx.close();
    }

    public ConnectionId getConnectionId() {
        return connectionId;
    }

    public int pendingRequests() {
        return pending.size();
    }

    /**
     * 22 lowercase hex characters.
     */
    static String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        TOKEN_RANDOM.nextBytes(bytes);
        return ByteBufUtil.hexDump(bytes);
    }

    private String prefix() {
        return "[" + (connectionId != null ? connectionId : "?") + "] ";
    }
}
