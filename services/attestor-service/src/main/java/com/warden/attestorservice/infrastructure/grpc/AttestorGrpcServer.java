package com.warden.attestorservice.infrastructure.grpc;

import io.grpc.BindableService;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.netty.NettyServerBuilder;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Runs the WorkloadAttestor gRPC server inside the Spring lifecycle.
 *
 * <p>Interceptors run correlation first, then exception mapping, so status rewrites are logged
 * with the call's correlation id.
 */
public class AttestorGrpcServer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(AttestorGrpcServer.class);

    private final String bindAddress;
    private final int port;
    private final BindableService service;
    private final GrpcExceptionInterceptor exceptionInterceptor;
    private final GrpcCorrelationInterceptor correlationInterceptor;

    private volatile Server server;

    public AttestorGrpcServer(String bindAddress, int port, BindableService service,
                              GrpcExceptionInterceptor exceptionInterceptor,
                              GrpcCorrelationInterceptor correlationInterceptor) {
        this.bindAddress = bindAddress;
        this.port = port;
        this.service = service;
        this.exceptionInterceptor = exceptionInterceptor;
        this.correlationInterceptor = correlationInterceptor;
    }

    @Override
    public void start() {
        // ServerInterceptors.intercept applies the last interceptor first.
        Server built = NettyServerBuilder.forAddress(new InetSocketAddress(bindAddress, port))
                .addService(ServerInterceptors.intercept(service, exceptionInterceptor, correlationInterceptor))
                .build();
        try {
            built.start();
        } catch (IOException e) {
            throw new UncheckedIOException("could not start gRPC server on " + bindAddress + ":" + port, e);
        }
        server = built;
        log.info("WorkloadAttestor gRPC server listening on {}", built.getListenSockets());
    }

    @Override
    public void stop() {
        Server running = server;
        if (running == null) {
            return;
        }
        running.shutdown();
        try {
            if (!running.awaitTermination(5, TimeUnit.SECONDS)) {
                running.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.shutdownNow();
        }
        server = null;
        log.info("WorkloadAttestor gRPC server stopped");
    }

    @Override
    public boolean isRunning() {
        return server != null;
    }

    /** Bound port, or -1 when not running. */
    public int port() {
        Server running = server;
        return running == null ? -1 : running.getPort();
    }

    /** Sockets the server accepts connections on, empty when not running. */
    public List<? extends SocketAddress> listenAddresses() {
        Server running = server;
        return running == null ? List.of() : running.getListenSockets();
    }
}
