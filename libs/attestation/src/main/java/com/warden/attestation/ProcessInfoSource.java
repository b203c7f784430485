package com.warden.attestation;

import java.io.IOException;

/**
 * Opens a {@link ProcessInfo} for a pid.
 */
@FunctionalInterface
public interface ProcessInfoSource {

    /**
     * @throws IOException if the process does not exist or cannot be inspected
     */
    ProcessInfo open(int pid) throws IOException;
}
