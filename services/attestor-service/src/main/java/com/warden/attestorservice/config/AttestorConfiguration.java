package com.warden.attestorservice.config;

import com.warden.attestation.Attestor;
import com.warden.attestation.ConfigStore;
import com.warden.attestation.ContentDigestor;
import com.warden.attestation.ExternalAttestationStrategy;
import com.warden.attestation.IdentityDatabaseNameResolver;
import com.warden.attestation.LocalAttestationStrategy;
import com.warden.attestation.ProcessIdentityResolver;
import com.warden.attestation.ProcfsProcessInfoSource;
import com.warden.attestorservice.infrastructure.auth.RestAuthValidator;
import com.warden.attestorservice.infrastructure.grpc.AttestorGrpcServer;
import com.warden.attestorservice.infrastructure.grpc.GrpcCorrelationInterceptor;
import com.warden.attestorservice.infrastructure.grpc.GrpcExceptionInterceptor;
import com.warden.attestorservice.infrastructure.grpc.WorkloadAttestorGrpcService;
import com.warden.attestorservice.infrastructure.module.GrpcAttestationModuleClient;
import com.warden.attestorservice.infrastructure.module.UnixSocketChannelFactory;
import com.warden.observability.MetricFactory;
import com.warden.observability.SensitiveDataRedactor;
import com.warden.observability.SpanHelper;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the attestation pipeline and its adapters.
 *
 * <p>The gRPC server can be switched off with {@code attestor.service.grpc-enabled=false}; tests
 * do that and drive the service through the in-process transport instead.
 */
@Configuration
public class AttestorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AttestorConfiguration.class);

    @Bean
    ConfigStore configStore(AttestorServiceProperties properties) {
        var store = new ConfigStore();
        if (properties.hasInitialConfiguration()) {
            store.configure(properties.initialConfiguration());
            log.info("Applied initial attestor configuration");
        } else {
            log.info("No initial attestor configuration; waiting for Configure");
        }
        return store;
    }

    @Bean
    ProcfsProcessInfoSource processInfoSource(AttestorServiceProperties properties) {
        String override = properties.procRoot();
        if (override == null || override.isBlank()) {
            override = System.getenv(ProcfsProcessInfoSource.HOST_PROC_ENV);
        }
        var source = new ProcfsProcessInfoSource(
                ProcfsProcessInfoSource.resolveProcRoot(override), ProcfsProcessInfoSource.isLinux());
        log.info("Reading process information from {}", source.procRoot());
        return source;
    }

    @Bean
    LocalAttestationStrategy localAttestationStrategy(
            ProcfsProcessInfoSource processInfoSource, AttestorServiceProperties properties) {
        return new LocalAttestationStrategy(
                new ProcessIdentityResolver(processInfoSource),
                new IdentityDatabaseNameResolver(Path.of(properties.identityDbRoot())),
                new ContentDigestor());
    }

    @Bean(destroyMethod = "close")
    UnixSocketChannelFactory moduleChannelFactory() {
        return new UnixSocketChannelFactory();
    }

    @Bean
    GrpcAttestationModuleClient attestationModuleClient(
            UnixSocketChannelFactory moduleChannelFactory, AttestorServiceProperties properties) {
        return new GrpcAttestationModuleClient(moduleChannelFactory, properties.moduleTimeout());
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService authValidationExecutor() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "auth-validation-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    RestAuthValidator authValidator(
            RestClient.Builder restClientBuilder,
            AttestorServiceProperties properties,
            ExecutorService authValidationExecutor) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMillis = timeoutMillis(properties.authTimeout());
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);
        RestClient restClient = restClientBuilder.requestFactory(requestFactory).build();
        return new RestAuthValidator(restClient, properties.authTimeout(), authValidationExecutor);
    }

    /** Millisecond value for the HTTP client's int-typed timeouts. */
    static int timeoutMillis(Duration timeout) {
        try {
            return Math.toIntExact(timeout.toMillis());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("auth-timeout too large: " + timeout, e);
        }
    }

    @Bean
    SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    ExternalAttestationStrategy externalAttestationStrategy(
            GrpcAttestationModuleClient attestationModuleClient,
            RestAuthValidator authValidator,
            SensitiveDataRedactor sensitiveDataRedactor) {
        return new ExternalAttestationStrategy(attestationModuleClient, authValidator, sensitiveDataRedactor);
    }

    @Bean
    Attestor attestor(
            ConfigStore configStore,
            LocalAttestationStrategy localAttestationStrategy,
            ExternalAttestationStrategy externalAttestationStrategy) {
        return new Attestor(configStore, localAttestationStrategy, externalAttestationStrategy);
    }

    @Bean
    MetricFactory metricFactory(MeterRegistry meterRegistry, AttestorServiceProperties properties) {
        return new MetricFactory(meterRegistry, properties.name());
    }

    @Bean
    SpanHelper spanHelper(AttestorServiceProperties properties) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(properties.name()));
    }

    @Bean
    WorkloadAttestorGrpcService workloadAttestorGrpcService(
            Attestor attestor,
            MetricFactory metricFactory,
            SpanHelper spanHelper,
            SensitiveDataRedactor sensitiveDataRedactor) {
        return new WorkloadAttestorGrpcService(attestor, metricFactory, spanHelper, sensitiveDataRedactor);
    }

    @Bean
    @ConditionalOnProperty(prefix = "attestor.service", name = "grpc-enabled", havingValue = "true", matchIfMissing = true)
    AttestorGrpcServer attestorGrpcServer(
            AttestorServiceProperties properties, WorkloadAttestorGrpcService workloadAttestorGrpcService) {
        return new AttestorGrpcServer(
                properties.grpcBindAddress(),
                properties.grpcPort(),
                workloadAttestorGrpcService,
                new GrpcExceptionInterceptor(),
                new GrpcCorrelationInterceptor());
    }
}
