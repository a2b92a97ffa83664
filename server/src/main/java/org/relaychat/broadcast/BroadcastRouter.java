package org.relaychat.broadcast;

import org.relaychat.crypto.MessageCodec;
import org.relaychat.net.ClientConnection;
import org.relaychat.registry.ClientRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans a message out to every registered connection except its origin.
 *
 * <p>A recipient whose send fails is deregistered and closed, which in turn ends its own worker;
 * the remaining recipients are still served and the caller never sees the failure.
 */
public class BroadcastRouter {
    private static final Logger log = LoggerFactory.getLogger(BroadcastRouter.class);

    private final ClientRegistry registry;
    private final MessageCodec codec;
    private final List<DeliveryListener> listeners = new CopyOnWriteArrayList<>();

    public BroadcastRouter(ClientRegistry registry, MessageCodec codec) {
        this.registry = registry;
        this.codec = codec;
    }

    public void addListener(DeliveryListener listener) {
        listeners.add(listener);
    }

    public void removeListener(DeliveryListener listener) {
        listeners.remove(listener);
    }

    public DeliveryReport deliver(ChatMessage message, ClientConnection exclude) {
        return deliver(message.render(), exclude);
    }

    /**
     * Sends {@code text} to every snapshot member except {@code exclude}, which may be null
     * or a connection that is not registered. Returns once every recipient was attempted.
     */
    public DeliveryReport deliver(String text, ClientConnection exclude) {
        List<ClientRegistry.Entry> recipients = registry.snapshot();
        log.debug("Broadcasting to {} client(s) (excluding {}): {}", recipients.size(), exclude, text);

        int attempted = 0;
        int delivered = 0;
        List<String> failed = new ArrayList<>();
        for (ClientRegistry.Entry entry : recipients) {
            if (entry.connection() == exclude) {
                continue;
            }
            attempted++;
            if (send(entry.connection(), entry.username(), text)) {
                delivered++;
            } else {
                failed.add(entry.username());
            }
        }
        if (!failed.isEmpty()) {
            log.info("Broadcast reached {}/{} recipient(s); dropped {}", delivered, attempted, failed);
        }
        return new DeliveryReport(attempted, delivered, failed);
    }

    /**
     * Sends {@code text} to a single connection with the same failure handling as a broadcast.
     */
    public boolean sendTo(ClientConnection recipient, String username, String text) {
        return send(recipient, username, text);
    }

    private boolean send(ClientConnection recipient, String username, String text) {
        try {
            recipient.send(codec.encodeToLine(text));
        } catch (Exception e) {
            log.info("Send to '{}' on {} failed, dropping client: {}", username, recipient, e.toString());
            registry.deregister(recipient);
            recipient.close();
            for (DeliveryListener listener : listeners) {
                try {
                    listener.onDeliveryFailed(recipient, username, e);
                } catch (RuntimeException listenerError) {
                    log.warn("Delivery listener {} failed", listener, listenerError);
                }
            }
            return false;
        }
        for (DeliveryListener listener : listeners) {
            try {
                listener.onDelivered(recipient, username, text);
            } catch (RuntimeException listenerError) {
                log.warn("Delivery listener {} failed", listener, listenerError);
            }
        }
        return true;
    }
}
