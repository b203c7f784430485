package com.warden.attestation;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes the SHA-256 of an executable with an optional size cap.
 * <p>
 * With a positive limit the size is checked before the first byte is read. A zero or negative
 * limit hashes the whole file; deciding whether to hash at all is the caller's business.
 */
public final class ContentDigestor {

    private static final int BUFFER_SIZE = 64 * 1024;

    /**
     * @param path  file to hash
     * @param limit maximum size in bytes; {@code <= 0} means no cap
     * @return lowercase hex SHA-256
     * @throws DigestException on open, size, limit or read failure
     */
    public String digest(Path path, long limit) {
        SeekableByteChannel channel;
        try {
            channel = Files.newByteChannel(path, StandardOpenOption.READ);
        } catch (IOException | SecurityException e) {
            throw new DigestException(DigestException.Failure.OPEN, "open %s: %s".formatted(path, e.getMessage()), e);
        }
        try (channel) {
            return digest(channel, path.toString(), limit);
        } catch (IOException e) {
            throw new DigestException(DigestException.Failure.READ, "close %s: %s".formatted(path, e.getMessage()), e);
        }
    }

    /**
     * Hashes an already opened channel. The channel is not closed.
     */
    String digest(SeekableByteChannel channel, String name, long limit) {
        if (limit > 0) {
            long size;
            try {
                size = channel.size();
            } catch (IOException e) {
                throw new DigestException(DigestException.Failure.STAT, "stat %s: %s".formatted(name, e.getMessage()), e);
            }
            if (size > limit) {
                throw new DigestException(DigestException.Failure.SIZE_LIMIT_EXCEEDED,
                        "workload %s exceeds size limit (%d > %d)".formatted(name, size, limit));
            }
        }

        MessageDigest sha256 = newSha256();
        ByteBuffer buffer = ByteBuffer.allocate(BUFFER_SIZE);
        try {
            while (channel.read(buffer) != -1) {
                buffer.flip();
                sha256.update(buffer);
                buffer.clear();
            }
        } catch (IOException e) {
            throw new DigestException(DigestException.Failure.READ, "read %s: %s".formatted(name, e.getMessage()), e);
        }
        return HexFormat.of().formatHex(sha256.digest());
    }

    private static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
