package com.warden.attestorservice.infrastructure.grpc;

import com.warden.observability.CorrelationContext;
import com.warden.observability.CorrelationContextHolder;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import java.util.UUID;

/**
 * Establishes a {@link CorrelationContext} for every inbound call.
 *
 * <p>The id comes from the {@code x-correlation-id} metadata or is generated. gRPC may deliver
 * the listener callbacks of one call on different executor threads, so the context is set
 * around each callback and removed afterwards.
 */
public class GrpcCorrelationInterceptor implements ServerInterceptor {

    public static final Metadata.Key<String> CORRELATION_ID_KEY =
            Metadata.Key.of("x-correlation-id", Metadata.ASCII_STRING_MARSHALLER);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        String correlationId = headers.get(CORRELATION_ID_KEY);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        var context = new CorrelationContext(
                correlationId, call.getMethodDescriptor().getBareMethodName(), null);

        ServerCall.Listener<ReqT> listener;
        CorrelationContextHolder.set(context);
        try {
            listener = next.startCall(call, headers);
        } finally {
            CorrelationContextHolder.clear();
        }

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(listener) {
            @Override
            public void onMessage(ReqT message) {
                CorrelationContextHolder.runWithContext(context, () -> super.onMessage(message));
            }

            @Override
            public void onHalfClose() {
                CorrelationContextHolder.runWithContext(context, super::onHalfClose);
            }

            @Override
            public void onCancel() {
                CorrelationContextHolder.runWithContext(context, super::onCancel);
            }

            @Override
            public void onComplete() {
                CorrelationContextHolder.runWithContext(context, super::onComplete);
            }

            @Override
            public void onReady() {
                CorrelationContextHolder.runWithContext(context, super::onReady);
            }
        };
    }
}
