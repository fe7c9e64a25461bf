// file: src/main/java/io/envkeeper/storage/RecordCodec.java
package io.envkeeper.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.zip.CRC32;

/**
 * Binary framing for journal records.
 * <p>
 * On-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xE4C5
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes)]
 *     - UTF-8 JSON document written by {@link JournalCodec}
 * <p>
 * Framing is binary so torn writes are detectable; the payload stays text so a
 * journal segment can still be read with {@code strings} or a hex viewer.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xE4C5;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private RecordCodec() {
    }

    /** Prepend the header to a payload. */
    static byte[] frame(byte[] payload) {
        ByteBuffer b = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        b.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        b.put(payload);
        return b.array();
    }

    /** Parsed header; {@code null} from {@link #readHeader} means garbage. */
    record Header(int length, int crc) {}

    static Header readHeader(ByteBuffer hdr) {
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != MAGIC || ver != VERSION || len < 0) {
            return null;
        }
        return new Header(len, crc);
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }
}
