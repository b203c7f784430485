package com.warden.attestorservice.infrastructure.grpc;

import com.warden.attestation.AttestationException;
import com.warden.attestation.Attestor;
import com.warden.attestation.ConfigSnapshot;
import com.warden.attestation.ConfigStore;
import com.warden.attestor.v1.AttestRequest;
import com.warden.attestor.v1.AttestResponse;
import com.warden.attestor.v1.ConfigureRequest;
import com.warden.attestor.v1.ConfigureResponse;
import com.warden.attestor.v1.WorkloadAttestorGrpc;
import com.warden.observability.CorrelationContext;
import com.warden.observability.CorrelationContextHolder;
import com.warden.observability.MetricFactory;
import com.warden.observability.SensitiveDataRedactor;
import com.warden.observability.SpanHelper;
import io.grpc.Context;
import io.grpc.Deadline;
import io.grpc.stub.StreamObserver;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.SpanKind;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * gRPC adapter of the attestor.
 *
 * <p>Attest runs in a server span and propagates the inbound deadline to the pipeline.
 * Failures go to {@code onError} untouched; {@link GrpcExceptionInterceptor} turns them into
 * status codes.
 */
public class WorkloadAttestorGrpcService extends WorkloadAttestorGrpc.WorkloadAttestorImplBase {

    private static final Logger log = LoggerFactory.getLogger(WorkloadAttestorGrpcService.class);

    static final String REQUESTS_METRIC = "attestor.attest.requests";
    static final String DURATION_METRIC = "attestor.attest.duration";
    static final String OUTCOME_SUCCESS = "success";
    static final String STRATEGY_NONE = "none";

    private final Attestor attestor;
    private final ConfigStore configStore;
    private final MetricFactory metrics;
    private final SpanHelper spans;
    private final SensitiveDataRedactor redactor;

    public WorkloadAttestorGrpcService(Attestor attestor, MetricFactory metrics, SpanHelper spans,
                                       SensitiveDataRedactor redactor) {
        this.attestor = attestor;
        this.configStore = attestor.configStore();
        this.metrics = metrics;
        this.spans = spans;
        this.redactor = redactor;
    }

    @Override
    public void attest(AttestRequest request, StreamObserver<AttestResponse> responseObserver) {
        int pid = request.getPid();
        CorrelationContext context = CorrelationContextHolder.get()
                .orElseGet(() -> new CorrelationContext(UUID.randomUUID().toString(), "Attest", null))
                .withPid(pid);

        CorrelationContextHolder.runWithContext(context, () -> {
            String strategy = STRATEGY_NONE;
            Timer.Sample sample = Timer.start(metrics.registry());
            try {
                ConfigSnapshot snapshot = configStore.current();
                strategy = snapshot.config().strategy().name().toLowerCase(Locale.ROOT);
                Instant deadline = deadlineOf(Context.current());
                List<String> selectors = spans.inSpan("WorkloadAttestor/Attest", SpanKind.SERVER,
                        Map.of("attestor.strategy", strategy), () -> attestor.attest(snapshot, pid, deadline));
                record(sample, strategy, OUTCOME_SUCCESS);
                log.info("Attested pid {} with {} selectors", pid, selectors.size());
                if (log.isDebugEnabled()) {
                    log.debug("Selectors for pid {}: {}", pid,
                            selectors.stream().map(redactor::redactSelector).toList());
                }
                responseObserver.onNext(AttestResponse.newBuilder().addAllSelectorValues(selectors).build());
                responseObserver.onCompleted();
            } catch (AttestationException e) {
                record(sample, strategy, e.kind().name().toLowerCase(Locale.ROOT));
                log.warn("Attestation of pid {} failed [{}]: {}", pid, e.kind(), e.getMessage());
                responseObserver.onError(e);
            } catch (RuntimeException e) {
                record(sample, strategy, "internal");
                log.error("Attestation of pid {} failed unexpectedly", pid, e);
                responseObserver.onError(e);
            }
        });
    }

    @Override
    public void configure(ConfigureRequest request, StreamObserver<ConfigureResponse> responseObserver) {
        try {
            ConfigSnapshot snapshot = configStore.configure(request.getConfiguration());
            responseObserver.onNext(ConfigureResponse.newBuilder().setConfigVersion(snapshot.version()).build());
            responseObserver.onCompleted();
        } catch (AttestationException e) {
            log.warn("Configure rejected [{}]: {}", e.kind(), e.getMessage());
            responseObserver.onError(e);
        } catch (RuntimeException e) {
            log.error("Configure failed unexpectedly", e);
            responseObserver.onError(e);
        }
    }

    /** Converts the gRPC deadline of {@code context} to an instant, or null when there is none. */
    static Instant deadlineOf(Context context) {
        Deadline deadline = context.getDeadline();
        if (deadline == null) {
            return null;
        }
        return Instant.now().plusNanos(deadline.timeRemaining(TimeUnit.NANOSECONDS));
    }

    private void record(Timer.Sample sample, String strategy, String outcome) {
        sample.stop(metrics.timer(DURATION_METRIC, "Attest latency", "strategy", strategy));
        metrics.counter(REQUESTS_METRIC, "Attest requests by outcome", "strategy", strategy, "outcome", outcome)
                .increment();
    }
}
