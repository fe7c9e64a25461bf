// file: src/main/java/io/envkeeper/storage/record/SnapshotManifest.java
package io.envkeeper.storage.record;

import java.util.List;

/**
 * Human-readable manifest written next to each snapshot payload.
 * Example ("&lt;id&gt;.json"):
 *   {
 *     "snapshotId": "5e88...",
 *     "sessionId": "sess-1",
 *     "capturedAtMillis": 1700000000000,
 *     "parentSnapshotId": "0b1c...",
 *     "encoding": "application/json",
 *     "payloadSize": 512,
 *     "payloadFile": "5e88....payload",
 *     "chain": ["0b1c...", "77aa..."]
 *   }
 * {@code chain} lists the ancestors from parent to root, so history can be
 * read from one file without walking the store.
 */
public class SnapshotManifest {
    public String snapshotId;
    public String sessionId;
    public long capturedAtMillis;
    public String parentSnapshotId;
    public String encoding;
    public long payloadSize;
    public String payloadFile;
    public List<String> chain;
}
