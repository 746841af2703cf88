package io.maildigest.source;

import com.fasterxml.jackson.databind.JsonNode;
import io.maildigest.util.Jsons;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tolerant readers for gateway stdout. Anything that does not look like the
 * expected shape reads as "no information" rather than an error.
 */
public final class GatewayParsers {
    private GatewayParsers() {
    }

    public static MessageBatch parseMessages(String stdout) {
        JsonNode root = readTree(stdout);
        if (root == null) {
            return MessageBatch.empty();
        }
        if (root.isArray()) {
            return new MessageBatch(readMessages(root), null);
        }
        if (root.isObject()) {
            if (root.path("messages").isArray()) {
                String cursor = firstText(root, "historyId", "cursor");
                return new MessageBatch(readMessages(root.path("messages")), cursor);
            }
            RawMessage single = readMessage(root);
            if (single != null) {
                return new MessageBatch(List.of(single), null);
            }
        }
        return MessageBatch.empty();
    }

    public static Optional<RawThread> parseThread(String stdout) {
        JsonNode root = readTree(stdout);
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        String id = text(root.path("id"));
        JsonNode messages = root.path("messages");
        if (id == null || !messages.isArray()) {
            return Optional.empty();
        }
        return Optional.of(new RawThread(id, readMessages(messages)));
    }

    private static JsonNode readTree(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return null;
        }
        try {
            return Jsons.mapper().readTree(stdout.trim());
        } catch (Exception ignored) {
            return null;
        }
    }

    private static List<RawMessage> readMessages(JsonNode array) {
        List<RawMessage> out = new ArrayList<>();
        for (JsonNode node : array) {
            RawMessage message = readMessage(node);
            if (message != null) {
                out.add(message);
            }
        }
        return out;
    }

    private static RawMessage readMessage(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String id = text(node.path("id"));
        if (id == null) {
            return null;
        }
        List<String> labels = new ArrayList<>();
        JsonNode labelNode = node.path("labelIds");
        if (labelNode.isArray()) {
            labelNode.forEach(label -> {
                if (label.isTextual()) {
                    labels.add(label.asText());
                }
            });
        }
        return new RawMessage(
                id,
                text(node.path("threadId")),
                text(node.path("subject")),
                text(node.path("from")),
                text(node.path("to")),
                text(node.path("date")),
                text(node.path("body")),
                List.copyOf(labels)
        );
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node.path(field));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            String value = node.asText();
            return value.isBlank() ? null : value;
        }
        if (node.isNumber()) {
            return node.asText();
        }
        return null;
    }
}
