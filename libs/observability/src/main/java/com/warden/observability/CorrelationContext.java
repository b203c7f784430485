package com.warden.observability;

/**
 * Immutable correlation context for one inbound attestor call.
 * <p>
 * Every gRPC call establishes a {@code CorrelationContext} so that the log lines of one
 * attestation (config read, resolution, fetch, validation) can be grouped together. The values
 * are copied into SLF4J MDC by {@link CorrelationContextHolder}.
 *
 * @param correlationId id taken from the caller's {@code x-correlation-id} metadata, or generated
 * @param operation     RPC being served, e.g. {@code Attest} or {@code Configure} (nullable)
 * @param pid           process id under attestation, as a string (nullable outside Attest)
 */
public record CorrelationContext(
        String correlationId,
        String operation,
        String pid
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the RPC operation. */
    public static final String MDC_OPERATION = "operation";

    /** MDC key for the attested process id. */
    public static final String MDC_PID = "pid";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy of this context bound to the given process id.
     */
    public CorrelationContext withPid(int pid) {
        return new CorrelationContext(correlationId, operation, Integer.toString(pid));
    }
}
