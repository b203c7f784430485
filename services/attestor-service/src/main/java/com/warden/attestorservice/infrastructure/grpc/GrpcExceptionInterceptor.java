package com.warden.attestorservice.infrastructure.grpc;

import com.warden.attestation.AttestationException;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps exceptions raised by the attestor RPCs to gRPC status codes.
 *
 * <ul>
 *   <li>{@link AttestationException} → code chosen by its {@link com.warden.attestation.ErrorKind},
 *       with the kind in the {@value #ERROR_KIND_TRAILER} trailer
 *   <li>{@link IllegalArgumentException} → {@code INVALID_ARGUMENT}
 *   <li>{@link IllegalStateException} → {@code FAILED_PRECONDITION}
 *   <li>{@link StatusRuntimeException} → its own status
 *   <li>anything else → {@code INTERNAL}
 * </ul>
 *
 * <p>Service methods hand failures to {@code responseObserver.onError}; gRPC turns those into
 * {@code UNKNOWN} with the exception as cause, which is what this interceptor rewrites.
 */
public class GrpcExceptionInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(GrpcExceptionInterceptor.class);

    public static final String ERROR_KIND_TRAILER = "x-attestation-error-kind";

    public static final Metadata.Key<String> ERROR_KIND_KEY =
            Metadata.Key.of(ERROR_KIND_TRAILER, Metadata.ASCII_STRING_MARSHALLER);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        ServerCall<ReqT, RespT> wrappedCall =
                new ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT>(call) {
                    @Override
                    public void close(Status status, Metadata trailers) {
                        if (status.getCode() == Status.Code.UNKNOWN && status.getCause() != null) {
                            Throwable cause = status.getCause();
                            status = mapException(cause);
                            if (cause instanceof AttestationException attestation) {
                                trailers.put(ERROR_KIND_KEY, attestation.kind().name());
                            }
                        }
                        super.close(status, trailers);
                    }
                };

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT>(
                next.startCall(wrappedCall, headers)) {};
    }

    /** Maps an exception to a gRPC Status. Package-private for testing. */
    Status mapException(Throwable throwable) {
        if (throwable instanceof AttestationException attestation) {
            return statusFor(attestation)
                    .withDescription(attestation.getMessage())
                    .withCause(attestation);
        }
        if (throwable instanceof IllegalArgumentException) {
            log.warn("gRPC bad request: {}", throwable.getMessage());
            return Status.INVALID_ARGUMENT
                    .withDescription(throwable.getMessage())
                    .withCause(throwable);
        }
        if (throwable instanceof IllegalStateException) {
            log.warn("gRPC failed precondition: {}", throwable.getMessage());
            return Status.FAILED_PRECONDITION
                    .withDescription(throwable.getMessage())
                    .withCause(throwable);
        }
        if (throwable instanceof StatusRuntimeException sre) {
            return sre.getStatus();
        }
        log.error("gRPC internal error", throwable);
        return Status.INTERNAL.withDescription("Internal server error").withCause(throwable);
    }

    static Status statusFor(AttestationException e) {
        return switch (e.kind()) {
            case NOT_CONFIGURED -> Status.FAILED_PRECONDITION;
            case INVALID_CONFIG, EMPTY_CONFIG -> Status.INVALID_ARGUMENT;
            case VALIDATION_REJECTED -> Status.PERMISSION_DENIED;
            case FETCH_ERROR, VALIDATION_ERROR -> Status.UNAVAILABLE;
            default -> Status.INTERNAL;
        };
    }
}
