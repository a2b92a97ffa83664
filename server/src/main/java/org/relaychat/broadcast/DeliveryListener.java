package org.relaychat.broadcast;

import org.relaychat.net.ClientConnection;

/**
 * Notified after each send attempt made by the {@link BroadcastRouter}.
 * Called on the sending worker's thread, so implementations should be quick. A listener that throws
 * is logged and skipped.
 */
public interface DeliveryListener {

    default void onDelivered(ClientConnection recipient, String username, String text) {}

    default void onDeliveryFailed(ClientConnection recipient, String username, Exception cause) {}
}
