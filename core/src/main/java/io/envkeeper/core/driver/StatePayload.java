package io.envkeeper.core.driver;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Captured environment state: raw bytes plus their declared encoding tag.
 * Bytes are copied on the way in and out.
 */
public final class StatePayload {
    public static final String JSON = "application/json";
    public static final String TEXT = "text/plain";
    public static final String BINARY = "application/octet-stream";

    private final byte[] bytes;
    private final String encoding;

    public StatePayload(byte[] bytes, String encoding) {
        Objects.requireNonNull(bytes, "bytes");
        this.bytes = Arrays.copyOf(bytes, bytes.length);
        this.encoding = (encoding == null || encoding.isBlank()) ? BINARY : encoding;
    }

    public static StatePayload utf8(String text, String encoding) {
        return new StatePayload(text.getBytes(StandardCharsets.UTF_8), encoding);
    }

    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public String encoding() {
        return encoding;
    }

    public String asUtf8() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatePayload p)) return false;
        return encoding.equals(p.encoding) && Arrays.equals(bytes, p.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * encoding.hashCode() + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "StatePayload{" + encoding + ", " + bytes.length + " bytes}";
    }
}
