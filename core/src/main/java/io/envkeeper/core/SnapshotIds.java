// file: src/main/java/io/envkeeper/core/SnapshotIds.java
package io.envkeeper.core;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Content hashing for snapshot ids.
 * <p>
 * id = hex(SHA-256( field(sessionId) | field(encoding) | field(parentId or "") | field(payload) ))
 * where field(x) = int32 big-endian length + bytes.
 * <p>
 * Length prefixes keep ("ab","c") and ("a","bc") apart. The capture time is not
 * hashed, so two captures of the same bytes under the same parent share an id.
 */
public final class SnapshotIds {

    private SnapshotIds() {
        // utility
    }

    public static String compute(String sessionId, String encoding, String parentId, byte[] payload) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(encoding, "encoding");
        Objects.requireNonNull(payload, "payload");

        MessageDigest md = sha256();
        update(md, sessionId.getBytes(StandardCharsets.UTF_8));
        update(md, encoding.getBytes(StandardCharsets.UTF_8));
        update(md, (parentId == null ? "" : parentId).getBytes(StandardCharsets.UTF_8));
        update(md, payload);
        return HexFormat.of().formatHex(md.digest());
    }

    /** Cheap syntactic check used before touching the filesystem with an id. */
    public static boolean looksValid(String id) {
        if (id == null || id.length() != 64) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            boolean hex = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f');
            if (!hex) {
                return false;
            }
        }
        return true;
    }

    private static void update(MessageDigest md, byte[] bytes) {
        md.update(ByteBuffer.allocate(4).putInt(bytes.length).array());
        md.update(bytes);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
