package org.relaychat.broadcast;

import java.util.List;

/**
 * Outcome of one {@link BroadcastRouter#deliver} call.
 *
 * @param attempted sends tried, one per snapshot member other than the excluded connection
 * @param delivered sends that completed
 * @param failed    usernames whose connection failed and was dropped
 */
public record DeliveryReport(int attempted, int delivered, List<String> failed) {

    public DeliveryReport {
        failed = List.copyOf(failed);
    }
}
