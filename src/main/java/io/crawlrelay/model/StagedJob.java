package io.crawlrelay.model;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-disk form of one pending job. The location of the file is not part of the
 * record; see {@link PendingJob}.
 */
public record StagedJob(
        String messageId,
        long receivedAtMs,
        Map<String, String> attributes,
        String dataB64,
        int attempts,
        Long lastAttemptAtMs,
        String lastError,
        Long lastErrorAtMs
) {
    public StagedJob {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        dataB64 = dataB64 == null ? "" : dataB64;
    }

    public static StagedJob received(String messageId, byte[] data, Map<String, String> attributes, long nowMs) {
        String encoded = Base64.getEncoder().encodeToString(data == null ? new byte[0] : data);
        return new StagedJob(messageId, nowMs, attributes, encoded, 0, null, null, null);
    }

    public byte[] data() {
        return Base64.getDecoder().decode(dataB64);
    }

    public Map<String, String> mutableAttributes() {
        return new LinkedHashMap<>(attributes);
    }

    public StagedJob withAttempt(long nowMs) {
        return new StagedJob(messageId, receivedAtMs, attributes, dataB64, attempts + 1, nowMs, lastError, lastErrorAtMs);
    }

    public StagedJob withError(String error, long nowMs) {
        return new StagedJob(messageId, receivedAtMs, attributes, dataB64, attempts, lastAttemptAtMs, error, nowMs);
    }
}
