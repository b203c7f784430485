package com.warden.attestorservice.infrastructure.grpc;

import static org.assertj.core.api.Assertions.assertThat;

import com.warden.attestor.v1.WorkloadAttestorGrpc;
import java.net.InetSocketAddress;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AttestorGrpcServer")
class AttestorGrpcServerTest {

    private AttestorGrpcServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private AttestorGrpcServer serverOn(String bindAddress) {
        return new AttestorGrpcServer(bindAddress, 0, new WorkloadAttestorGrpc.WorkloadAttestorImplBase() { },
                new GrpcExceptionInterceptor(), new GrpcCorrelationInterceptor());
    }

    @Test
    @DisplayName("listens only on the configured loopback address, never the wildcard")
    void bindsLoopback() {
        server = serverOn("127.0.0.1");

        server.start();

        assertThat(server.isRunning()).isTrue();
        assertThat(server.port()).isPositive();
        assertThat(server.listenAddresses()).isNotEmpty().allSatisfy(address -> {
            assertThat(address).isInstanceOf(InetSocketAddress.class);
            var inet = ((InetSocketAddress) address).getAddress();
            assertThat(inet.isAnyLocalAddress()).isFalse();
            assertThat(inet.isLoopbackAddress()).isTrue();
        });
    }

    @Test
    @DisplayName("reports no listen sockets once stopped")
    void stopReleasesSockets() {
        server = serverOn("127.0.0.1");
        server.start();

        server.stop();

        assertThat(server.isRunning()).isFalse();
        assertThat(server.port()).isEqualTo(-1);
        assertThat(server.listenAddresses()).isEmpty();
    }
}
