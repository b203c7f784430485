package com.warden.attestorservice.infrastructure.module;

import io.grpc.ManagedChannel;
import io.grpc.netty.NettyChannelBuilder;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollDomainSocketChannel;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.unix.DomainSocketAddress;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plaintext Netty channels over unix-domain sockets, backed by native epoll.
 *
 * <p>The event loop group is created on first use and shared by all channels; {@link #close()}
 * releases it. Channels themselves are owned by the caller.
 */
public class UnixSocketChannelFactory implements ModuleChannelFactory, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UnixSocketChannelFactory.class);

    private EventLoopGroup eventLoopGroup;

    @Override
    public ManagedChannel open(Path socketPath) {
        if (!Epoll.isAvailable()) {
            throw new IllegalStateException(
                    "unix-domain sockets unavailable: " + Epoll.unavailabilityCause().getMessage());
        }
        return NettyChannelBuilder.forAddress(new DomainSocketAddress(socketPath.toString()))
                .eventLoopGroup(eventLoopGroup())
                .channelType(EpollDomainSocketChannel.class)
                .usePlaintext()
                .build();
    }

    private synchronized EventLoopGroup eventLoopGroup() {
        if (eventLoopGroup == null) {
            eventLoopGroup = new EpollEventLoopGroup(1);
            log.debug("Created epoll event loop group for attestation-module channels");
        }
        return eventLoopGroup;
    }

    @Override
    public synchronized void close() {
        if (eventLoopGroup != null) {
            eventLoopGroup.shutdownGracefully();
            eventLoopGroup = null;
        }
    }
}
