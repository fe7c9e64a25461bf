package io.envkeeper.server.dto;

import java.util.Map;

/**
 * JSON body for POST /sessions.
 * Example:
 *   {
 *     "kind": "other",
 *     "config": { "command": "exec /bin/sh", "env.LANG": "C" }
 *   }
 */
public class CreateSessionRequest {
    public String kind;
    public Map<String, String> config;
}
