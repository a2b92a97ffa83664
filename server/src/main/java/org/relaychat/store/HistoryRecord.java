package org.relaychat.store;

import java.time.Instant;

public record HistoryRecord(String username, String message, Instant timestamp) {}
