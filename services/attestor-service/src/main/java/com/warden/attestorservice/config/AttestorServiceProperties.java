package com.warden.attestorservice.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service wiring bound from {@code attestor.service.*}.
 *
 * <pre>
 * attestor:
 *   service:
 *     name: attestor-service
 *     environment: production
 *     grpc-port: 9090
 *     grpc-bind-address: 127.0.0.1
 *     proc-root: /host/proc
 *     identity-db-root: /etc
 *     module-timeout: 1s
 *     auth-timeout: 2s
 *     initial-configuration: '{"discover_workload_path": true}'
 * </pre>
 *
 * <p>The attestor configuration document itself normally arrives through the Configure RPC;
 * {@code initial-configuration} only seeds it at startup.
 *
 * @param name service name used in logs and metric tags. Required.
 * @param environment deployment environment (default {@code development}).
 * @param grpcPort port of the WorkloadAttestor gRPC server (default 9090).
 * @param grpcBindAddress interface the gRPC server listens on (default loopback {@code 127.0.0.1}).
 * @param procRoot procfs mount point; blank falls back to {@code HOST_PROC}, then {@code /proc}.
 * @param identityDbRoot directory holding {@code passwd} and {@code group} (default {@code /etc}).
 * @param moduleTimeout bound on one attestation-module call (default 1s).
 * @param authTimeout bound on one auth-service call (default 2s).
 * @param initialConfiguration attestor configuration applied at startup, or blank for none.
 */
@ConfigurationProperties(prefix = "attestor.service")
@Validated
public record AttestorServiceProperties(
        @NotBlank String name,
        String environment,
        int grpcPort,
        String grpcBindAddress,
        String procRoot,
        String identityDbRoot,
        Duration moduleTimeout,
        Duration authTimeout,
        String initialConfiguration) {

    public static final Duration DEFAULT_MODULE_TIMEOUT = Duration.ofSeconds(1);
    public static final Duration DEFAULT_AUTH_TIMEOUT = Duration.ofSeconds(2);
    public static final String DEFAULT_GRPC_BIND_ADDRESS = "127.0.0.1";

    public AttestorServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (grpcPort <= 0) {
            grpcPort = 9090;
        }
        if (grpcBindAddress == null || grpcBindAddress.isBlank()) {
            grpcBindAddress = DEFAULT_GRPC_BIND_ADDRESS;
        }
        if (identityDbRoot == null || identityDbRoot.isBlank()) {
            identityDbRoot = "/etc";
        }
        if (moduleTimeout == null || moduleTimeout.isZero() || moduleTimeout.isNegative()) {
            moduleTimeout = DEFAULT_MODULE_TIMEOUT;
        }
        if (authTimeout == null || authTimeout.isZero() || authTimeout.isNegative()) {
            authTimeout = DEFAULT_AUTH_TIMEOUT;
        }
    }

    public boolean hasInitialConfiguration() {
        return initialConfiguration != null && !initialConfiguration.isBlank();
    }
}
