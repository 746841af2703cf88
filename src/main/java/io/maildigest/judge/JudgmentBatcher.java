package io.maildigest.judge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.maildigest.model.Importance;
import io.maildigest.model.MessageRecord;
import io.maildigest.model.Verdict;
import io.maildigest.observability.AuditLogger;
import io.maildigest.util.Jsons;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Classifies one batch of messages through the {@link JudgmentEngine}.
 *
 * <p>Every failure fails open: a message the judge did not clearly rate is
 * treated as {@code high} with {@code notify=true}.
 */
public final class JudgmentBatcher implements Classifier {
    static final String REASON_EMPTY = "classification failed: empty response (fail open)";
    static final String REASON_UNPARSEABLE = "classification failed: unparseable response (fail open)";
    static final String REASON_NOT_ARRAY = "classification failed: response is not an array (fail open)";
    static final String REASON_MISSING = "missing from classifier response (fail open)";
    static final String REASON_PLACEHOLDER = "no reason given";

    private static final Pattern LEADING_FENCE = Pattern.compile("^```(?:json)?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```$");

    private final JudgmentEngine engine;
    private final long timeoutMs;
    private final AuditLogger auditLogger;

    public JudgmentBatcher(JudgmentEngine engine, long timeoutMs, AuditLogger auditLogger) {
        this.engine = engine;
        this.timeoutMs = timeoutMs;
        this.auditLogger = auditLogger;
    }

    @Override
    public List<Verdict> classify(List<MessageRecord> batch) {
        if (batch == null || batch.isEmpty()) {
            return List.of();
        }
        List<String> ids = batch.stream().map(MessageRecord::id).toList();
        Optional<String> response;
        try {
            response = engine.judge(buildPrompt(batch), timeoutMs);
        } catch (JudgmentException | RuntimeException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "classifier.run",
                    "classifier",
                    "batch",
                    "fail_open",
                    Map.of("size", batch.size(), "error", String.valueOf(e.getMessage()))
            ));
            return failOpen(ids, "classification failed: " + e.getMessage() + " (fail open)");
        }
        return parseResponse(response.orElse(""), ids);
    }

    public static String buildPrompt(List<MessageRecord> batch) {
        ArrayNode summaries = Jsons.mapper().createArrayNode();
        for (MessageRecord email : batch) {
            ObjectNode node = summaries.addObject();
            node.put("id", email.id());
            node.put("from", email.from());
            node.put("to", email.to());
            node.put("subject", email.subject());
            node.put("date", email.date());
            node.put("body", email.body());
            node.put("account", email.account());
            node.put("threadLength", email.threadLength());
            node.put("hasAttachments", email.hasAttachments());
        }
        return String.join("\n",
                "You are triaging emails for the user. For each email, decide:",
                "- importance: \"high\" | \"medium\" | \"low\"",
                "- reason: one sentence explaining why",
                "- notify: boolean (should the user be interrupted for this?)",
                "",
                "Consider: sender relationship, urgency signals, whether it requires action,",
                "time sensitivity, financial/legal implications, personal importance.",
                "",
                "Respond with ONLY a valid JSON array. Each element must have: id, importance, reason, notify.",
                "Example: [{\"id\": \"<message id>\", \"importance\": \"medium\", \"reason\": \"...\", \"notify\": false}]",
                "",
                "Emails to triage (" + batch.size() + "):",
                Jsons.toJson(summaries)
        );
    }

    /**
     * Maps a judge answer onto {@code ids}, one verdict per id in order.
     */
    public static List<Verdict> parseResponse(String text, List<String> ids) {
        if (text == null || text.isBlank()) {
            return failOpen(ids, REASON_EMPTY);
        }
        String cleaned = TRAILING_FENCE.matcher(LEADING_FENCE.matcher(text.trim()).replaceFirst(""))
                .replaceFirst("")
                .trim();
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(cleaned);
        } catch (Exception e) {
            return failOpen(ids, REASON_UNPARSEABLE);
        }
        if (root == null || !root.isArray()) {
            return failOpen(ids, REASON_NOT_ARRAY);
        }

        Map<String, Verdict> byId = new HashMap<>();
        for (JsonNode item : root) {
            if (item == null || !item.isObject() || !item.path("id").isTextual()) {
                continue;
            }
            String id = item.path("id").asText();
            byId.put(id, new Verdict(
                    id,
                    importanceOf(item.path("importance")),
                    item.path("reason").isTextual() ? item.path("reason").asText() : REASON_PLACEHOLDER,
                    !item.path("notify").isBoolean() || item.path("notify").asBoolean()
            ));
        }

        List<Verdict> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            Verdict verdict = byId.get(id);
            out.add(verdict == null ? Verdict.failOpen(id, REASON_MISSING) : verdict);
        }
        return out;
    }

    private static Importance importanceOf(JsonNode node) {
        if (!node.isTextual()) {
            return Importance.HIGH;
        }
        String value = node.asText();
        for (Importance importance : Importance.values()) {
            if (importance.wireName().equals(value)) {
                return importance;
            }
        }
        return Importance.HIGH;
    }

    private static List<Verdict> failOpen(List<String> ids, String reason) {
        return ids.stream().map(id -> Verdict.failOpen(id, reason)).toList();
    }
}
