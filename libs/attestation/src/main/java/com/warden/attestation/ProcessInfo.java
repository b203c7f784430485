package com.warden.attestation;

import java.io.IOException;
import java.util.List;

/**
 * Raw OS view of one process, as exposed by the process table.
 * <p>
 * Id lists are in platform order; on Linux that is real, effective, saved set, filesystem.
 */
public interface ProcessInfo {

    int pid();

    List<String> uids() throws IOException;

    List<String> gids() throws IOException;

    /**
     * Supplementary group ids. Platforms without a way to enumerate them return an empty list.
     */
    List<String> groups() throws IOException;

    /** Executable path as reported by the OS for the process. */
    String exe() throws IOException;

    /**
     * Executable path usable from this process's mount namespace. Equal to {@link #exe()} on
     * platforms without a namespaced view.
     */
    String namespacedExe() throws IOException;
}
