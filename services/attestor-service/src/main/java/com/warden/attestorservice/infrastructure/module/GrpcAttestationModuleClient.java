package com.warden.attestorservice.infrastructure.module;

import com.warden.attestation.AttestationModuleClient;
import com.warden.attestation.ExternalAttestation;
import com.warden.attestation.FetchException;
import com.warden.attestation.GroupInfo;
import com.warden.attestation.SubjectIdentity;
import com.warden.attestation.SystemIdentity;
import com.warden.usermodule.v1.AttestationServiceGrpc;
import com.warden.usermodule.v1.Empty;
import com.warden.usermodule.v1.SystemInfo;
import com.warden.usermodule.v1.UserAttestation;
import com.warden.usermodule.v1.UserInfo;
import io.grpc.Deadline;
import io.grpc.ManagedChannel;
import io.grpc.StatusRuntimeException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches the user attestation from the external module over gRPC.
 *
 * <p>One channel per call, closed before returning. The call is bounded by the module timeout,
 * or by the caller deadline when that is earlier. Every failure becomes a {@link FetchException}.
 */
public class GrpcAttestationModuleClient implements AttestationModuleClient {

    private static final Logger log = LoggerFactory.getLogger(GrpcAttestationModuleClient.class);

    private final ModuleChannelFactory channelFactory;
    private final Duration timeout;

    public GrpcAttestationModuleClient(ModuleChannelFactory channelFactory, Duration timeout) {
        if (channelFactory == null) {
            throw new IllegalArgumentException("channelFactory must not be null");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.channelFactory = channelFactory;
        this.timeout = timeout;
    }

    @Override
    public ExternalAttestation fetch(Path socketPath, Instant deadline) {
        if (socketPath == null) {
            throw new FetchException("no attestation socket configured");
        }
        ManagedChannel channel;
        try {
            channel = channelFactory.open(socketPath);
        } catch (RuntimeException e) {
            throw new FetchException(
                    "could not connect to attestation module at %s: %s".formatted(socketPath, e.getMessage()), e);
        }
        try {
            UserAttestation response = AttestationServiceGrpc.newBlockingStub(channel)
                    .withDeadline(callDeadline(deadline, Instant.now()))
                    .getUserAttestation(Empty.getDefaultInstance());
            log.debug("Received attestation from module at {}", socketPath);
            return toAttestation(response);
        } catch (StatusRuntimeException e) {
            throw new FetchException("could not get attestation: " + e.getStatus().getCode()
                    + describe(e), e);
        } finally {
            channel.shutdownNow();
        }
    }

    /** The module timeout from {@code now}, cut short by {@code callerDeadline} if earlier. */
    Deadline callDeadline(Instant callerDeadline, Instant now) {
        Duration budget = timeout;
        if (callerDeadline != null) {
            Duration remaining = Duration.between(now, callerDeadline);
            if (remaining.compareTo(budget) < 0) {
                budget = remaining.isNegative() ? Duration.ZERO : remaining;
            }
        }
        return Deadline.after(budget.toNanos(), TimeUnit.NANOSECONDS);
    }

    static ExternalAttestation toAttestation(UserAttestation response) {
        if (!response.hasUserInfo()) {
            throw new FetchException("attestation module returned no user info");
        }
        UserInfo userInfo = response.getUserInfo();
        if (!userInfo.hasSystemInfo()) {
            throw new FetchException("attestation module returned no system info");
        }
        SystemInfo system = userInfo.getSystemInfo();
        var groups = system.getSupplementaryGroupsList().stream()
                .map(g -> new GroupInfo(g.getGroupId(), g.getGroupName()))
                .toList();
        var systemIdentity = new SystemIdentity(
                system.getUserId(), system.getUsername(), system.getGroupId(), system.getGroupName(), groups);
        return new ExternalAttestation(
                response.getToken(),
                new SubjectIdentity(userInfo.getName(), userInfo.getSecret(), systemIdentity));
    }

    private static String describe(StatusRuntimeException e) {
        String description = e.getStatus().getDescription();
        return description == null ? "" : " " + description;
    }
}
