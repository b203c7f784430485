package com.warden.attestorservice.infrastructure.module;

import io.grpc.ManagedChannel;
import java.nio.file.Path;

/** Opens a channel to the attestation module listening on a unix socket. */
@FunctionalInterface
public interface ModuleChannelFactory {

    ManagedChannel open(Path socketPath);
}
