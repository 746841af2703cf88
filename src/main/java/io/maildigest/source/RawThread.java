package io.maildigest.source;

import java.util.List;

public record RawThread(String id, List<RawMessage> messages) {
}
