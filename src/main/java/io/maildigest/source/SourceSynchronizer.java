package io.maildigest.source;

import io.maildigest.model.MessageRecord;
import io.maildigest.observability.AuditLogger;
import io.maildigest.text.BodyCleaner;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class SourceSynchronizer implements AccountSyncer {
    private static final Pattern ANGLE_ADDRESS = Pattern.compile("<([^>]+)>");
    private static final String ATTACHMENT_LABEL = "ATTACHMENT";

    private final SourceGateway gateway;
    private final BodyCleaner cleaner;
    private final Set<String> ownerAddresses;
    private final int rescanDays;
    private final int bodyMaxLength;
    private final Clock clock;
    private final AuditLogger auditLogger;

    public SourceSynchronizer(
            SourceGateway gateway,
            BodyCleaner cleaner,
            List<String> ownerAccounts,
            int rescanDays,
            int bodyMaxLength,
            Clock clock,
            AuditLogger auditLogger
    ) {
        this.gateway = gateway;
        this.cleaner = cleaner;
        this.ownerAddresses = ownerAccounts.stream()
                .map(SourceSynchronizer::bareAddress)
                .filter(address -> !address.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        this.rescanDays = rescanDays;
        this.bodyMaxLength = bodyMaxLength;
        this.clock = clock;
        this.auditLogger = auditLogger;
    }

    @Override
    public SyncResult syncAccount(String account, String cursor, Set<String> knownIds) throws SourceException {
        MessageBatch batch;
        boolean rescanned = false;
        if (cursor != null && !cursor.isBlank()) {
            try {
                batch = gateway.changesSince(account, cursor);
            } catch (SourceException e) {
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "source.cursor.rejected",
                        "poller",
                        "account/" + account,
                        "rescan",
                        Map.of("cursor", cursor, "error", String.valueOf(e.getMessage()), "rescan_days", rescanDays)
                ));
                batch = gateway.searchRecent(account, rescanDays);
                rescanned = true;
            }
        } else {
            batch = gateway.searchRecent(account, rescanDays);
            rescanned = true;
        }

        List<MessageRecord> records = new ArrayList<>();
        for (RawMessage message : batch.messages()) {
            if (knownIds.contains(message.id())) {
                continue;
            }
            Optional<RawThread> thread = message.threadId() == null
                    ? Optional.empty()
                    : gateway.thread(account, message.threadId());
            if (thread.isPresent() && hasOwnerReply(thread.get())) {
                continue;
            }
            records.add(toRecord(account, message, thread.orElse(null)));
        }
        return new SyncResult(List.copyOf(records), batch.cursor(), rescanned);
    }

    @Override
    public boolean threadHasOwnerReply(String threadId, String account) throws SourceException {
        if (threadId == null) {
            return false;
        }
        return gateway.thread(account, threadId).map(this::hasOwnerReply).orElse(false);
    }

    boolean hasOwnerReply(RawThread thread) {
        if (thread.messages() == null) {
            return false;
        }
        return thread.messages().stream()
                .map(RawMessage::from)
                .filter(from -> from != null && !from.isBlank())
                .map(SourceSynchronizer::bareAddress)
                .anyMatch(ownerAddresses::contains);
    }

    /**
     * {@code "Jane <Jane@Example.com>"} and {@code "jane@example.com"} both
     * reduce to {@code jane@example.com}.
     */
    static String bareAddress(String from) {
        if (from == null) {
            return "";
        }
        Matcher matcher = ANGLE_ADDRESS.matcher(from);
        String address = matcher.find() ? matcher.group(1) : from;
        return address.trim().toLowerCase(Locale.ROOT);
    }

    private MessageRecord toRecord(String account, RawMessage message, RawThread thread) {
        int threadLength = thread == null || thread.messages() == null ? 1 : Math.max(1, thread.messages().size());
        return new MessageRecord(
                message.id(),
                message.threadId(),
                account,
                message.from() == null ? "unknown" : message.from(),
                message.to() == null ? account : message.to(),
                message.subject() == null ? "(no subject)" : message.subject(),
                message.date() == null ? clock.instant().toString() : message.date(),
                cleaner.clean(message.body(), bodyMaxLength),
                threadLength,
                message.hasLabel(ATTACHMENT_LABEL)
        );
    }
}
