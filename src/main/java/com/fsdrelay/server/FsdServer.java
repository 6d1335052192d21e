/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.server;

import com.fsdrelay.auth.ClientWhitelist;
import com.fsdrelay.auth.SessionRegistry;
import com.fsdrelay.auth.UserAuthenticator;
import com.fsdrelay.bus.BroadcastBus;
import com.fsdrelay.protocol.FsdClientHandler;
import com.fsdrelay.protocol.auth.IdentificationHandler;
import com.fsdrelay.protocol.auth.LoginHandler;
import com.fsdrelay.protocol.auth.LogoffHandler;
import com.fsdrelay.protocol.core.PacketDispatcher;
import com.fsdrelay.protocol.flightplan.FlightPlanHandler;
import com.fsdrelay.protocol.message.TextMessageHandler;
import com.fsdrelay.protocol.position.PositionUpdateHandler;
import com.fsdrelay.protocol.request.ClientQueryHandler;
import com.fsdrelay.protocol.request.ClientResponseHandler;
import com.fsdrelay.protocol.request.MetarRequestHandler;
import com.fsdrelay.utils.LoggerUtil;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * The relay server: accepts FSD clients and wires every connection to the
 * shared session registry, broadcast bus and command dispatcher.
 */
public class FsdServer {

    public static final int MAX_LINE_LENGTH = 4096;

    private final ServerConfig config;
    private final SessionRegistry registry;
    private final BroadcastBus bus;
    private final PacketDispatcher dispatcher;
    private final HeartbeatTask heartbeat;

    private NioEventLoopGroup bossGroup;
    private NioEventLoopGroup workerGroup;
    private Channel serverChannel;

    public FsdServer(ServerConfig config, ClientWhitelist whitelist, UserAuthenticator authenticator) {
        this.config = config;
        this.registry = new SessionRegistry();
        this.bus = new BroadcastBus(config.getBroadcastCapacity());
        this.dispatcher = createDispatcher(config, registry, bus, whitelist, authenticator);
        this.heartbeat = new HeartbeatTask(bus, config.getHeartbeatIntervalSeconds());
    }

    /**
     * Dispatcher with every command handler registered.
     */
    public static PacketDispatcher createDispatcher(ServerConfig config, SessionRegistry registry, BroadcastBus bus,
                                                    ClientWhitelist whitelist, UserAuthenticator authenticator) {
        return new PacketDispatcher(config.getDispatcherQueueCapacity())
                .register(new IdentificationHandler(registry, bus, whitelist))
                .register(new LoginHandler(registry, bus, authenticator))
                .register(new LogoffHandler(registry, bus))
                .register(new TextMessageHandler(registry, bus))
                .register(new ClientQueryHandler(registry, bus))
                .register(new ClientResponseHandler(registry, bus))
                .register(new MetarRequestHandler(registry, bus))
                .register(new PositionUpdateHandler(registry, bus))
                .register(new FlightPlanHandler(registry, bus));
    }

    public void start() throws InterruptedException {
        dispatcher.start();

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        try {
            ServerBootstrap sb = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<Channel>() {
                        @Override
                        protected void initChannel(Channel ch) {
                            if (registry.size() >= config.getMaxClients()) {
                                LoggerUtil.warn("Rejecting " + ch.remoteAddress() + ": server full ("
                                        + config.getMaxClients() + " clients)");
                                ch.close();
                                return;
                            }
                            ch.pipeline().addLast("logger", new LoggingHandler("FSD", LogLevel.DEBUG));
                            ch.pipeline().addLast("framer", new LineBasedFrameDecoder(MAX_LINE_LENGTH));
                            ch.pipeline().addLast("decoder", new StringDecoder(StandardCharsets.US_ASCII));
                            ch.pipeline().addLast("encoder", new StringEncoder(StandardCharsets.US_ASCII));
                            ch.pipeline().addLast("handler",
                                    new FsdClientHandler(registry, bus, dispatcher, config.getProtocolVersion()));
                        }
                    })
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childOption(ChannelOption.WRITE_BUFFER_WATER_MARK, new WriteBufferWaterMark(32 * 1024, 64 * 1024));

            LoggerUtil.info("Binding " + config.getBindAddress() + ":" + config.getPort() + " ...");
            ChannelFuture bindFuture = sb.bind(config.getBindAddress(), config.getPort()).sync();
            serverChannel = bindFuture.channel();
            LoggerUtil.info("Server ready on " + config.getBindAddress() + ":" + getBoundPort());

        } catch (Exception e) {
            dispatcher.stop();
            if (bossGroup != null) bossGroup.shutdownGracefully();
            if (workerGroup != null) workerGroup.shutdownGracefully();
            throw e;
        }

        heartbeat.start();
    }

    public void stop() {
        heartbeat.stop();
        try {
            if (serverChannel != null && serverChannel.isOpen()) serverChannel.close().sync();
            if (bossGroup != null) bossGroup.shutdownGracefully().sync();
            if (workerGroup != null) workerGroup.shutdownGracefully().sync();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LoggerUtil.error("Interrupted while stopping server");
        }
        dispatcher.stop();
        LoggerUtil.info("Server stopped (" + registry.size() + " sessions at shutdown)");
    }

    /**
     * Actual listening port; differs from the configured one when that is 0.
     */
    public int getBoundPort() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public SessionRegistry getRegistry() {
        return registry;
    }

    public BroadcastBus getBus() {
        return bus;
    }

    public PacketDispatcher getDispatcher() {
        return dispatcher;
    }

    public ServerConfig getConfig() {
        return config;
    }
}
