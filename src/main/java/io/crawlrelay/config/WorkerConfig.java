package io.crawlrelay.config;

import java.nio.file.Path;
import java.util.List;

/**
 * Resolved, read-only settings for one subscription worker.
 */
public record WorkerConfig(
        String subscriptionName,
        Path workingDir,
        String executablePath,
        List<String> entryArgs,
        List<String> extraArgs,
        Path stagingDir,
        Path logDir,
        String retryChannel,
        int maxRetries,
        long timeoutMs
) {
    public WorkerConfig {
        if (subscriptionName == null || subscriptionName.isBlank()) {
            throw new IllegalArgumentException("subscriptionName cannot be empty");
        }
        if (workingDir == null) {
            throw new IllegalArgumentException("workingDir is required: " + subscriptionName);
        }
        if (executablePath == null || executablePath.isBlank()) {
            throw new IllegalArgumentException("executablePath is required: " + subscriptionName);
        }
        if (stagingDir == null) {
            throw new IllegalArgumentException("stagingDir is required: " + subscriptionName);
        }
        entryArgs = entryArgs == null ? List.of() : List.copyOf(entryArgs);
        extraArgs = extraArgs == null ? List.of() : List.copyOf(extraArgs);
        retryChannel = retryChannel == null || retryChannel.isBlank() ? null : retryChannel.trim();
        maxRetries = Math.max(0, maxRetries);
        timeoutMs = Math.max(0L, timeoutMs);
    }

    public boolean retryEnabled() {
        return retryChannel != null && maxRetries > 0;
    }
}
