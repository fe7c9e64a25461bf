package io.envkeeper.server.dto;

/** Response of POST /sessions/{id}/snapshots. */
public class CaptureResponse {
    public String sessionId;
    public String snapshotId;
}
