package io.envkeeper.server.dto;

import io.envkeeper.core.Snapshot;
import io.envkeeper.storage.record.SnapshotManifest;

import java.util.Base64;

/** GET /snapshots/{id}: the payload (base64) plus its manifest. */
public class SnapshotResponse {
    public String snapshotId;
    public String sessionId;
    public long capturedAtMillis;
    public String encoding;
    public String parentSnapshotId;
    public String payloadBase64;
    public SnapshotManifest manifest;

    public static SnapshotResponse from(Snapshot s, SnapshotManifest manifest) {
        var dto = new SnapshotResponse();
        dto.snapshotId = s.snapshotId();
        dto.sessionId = s.sessionId();
        dto.capturedAtMillis = s.capturedAtMillis();
        dto.encoding = s.encoding();
        dto.parentSnapshotId = s.parentSnapshotId();
        dto.payloadBase64 = Base64.getEncoder().encodeToString(s.payload());
        dto.manifest = manifest;
        return dto;
    }
}
