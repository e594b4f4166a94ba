package io.crawlrelay.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import io.crawlrelay.config.WorkerConfig;
import io.crawlrelay.util.Jsons;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the crawler command line: executable, fixed entry arguments, the
 * {@code args} array of the message body, then the configured extra arguments.
 */
public final class JobCommand {
    private JobCommand() {
    }

    public static List<String> build(WorkerConfig config, byte[] body, String messageId, Logger log) {
        List<String> command = new ArrayList<>();
        command.add(config.executablePath());
        command.addAll(config.entryArgs());
        command.addAll(payloadArgs(body, messageId, log));
        command.addAll(config.extraArgs());
        return command;
    }

    static List<String> payloadArgs(byte[] body, String messageId, Logger log) {
        if (body == null || body.length == 0) {
            return List.of();
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(body);
        } catch (IOException e) {
            log.warn("JSON decode failed. message_id={} raw={}", messageId, new String(body, StandardCharsets.UTF_8));
            return List.of();
        }
        if (root == null || !root.isObject()) {
            log.warn("Message body is not a JSON object. message_id={}", messageId);
            return List.of();
        }
        JsonNode args = root.path("args");
        if (!args.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>(args.size());
        for (JsonNode arg : args) {
            if (arg.isNull()) {
                continue;
            }
            values.add(arg.isValueNode() ? arg.asText() : arg.toString());
        }
        return values;
    }

    public static String display(List<String> command) {
        StringBuilder sb = new StringBuilder();
        for (String token : command) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(token.contains(" ") ? "\"" + token + "\"" : token);
        }
        return sb.toString();
    }
}
