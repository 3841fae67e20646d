package org.satmesh.routing.agent;

import org.satmesh.routing.engine.RoutingMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;

/**
 * Point-to-point delivery of one agent's routing messages.
 * <p>
 * Each target is resolved through the {@link AgentRegistry} and receives the message in its own
 * inbound queue. An unresolved target or a full queue drops that copy and counts a failure;
 * there is no retry, the next broadcast cycle carries the same information.
 * </p>
 */
public final class MessageDispatcher {
    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    private final AgentRegistry registry;
    private final AgentCounters counters;

    public MessageDispatcher(AgentRegistry registry, AgentCounters counters) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.counters = Objects.requireNonNull(counters, "counters");
    }

    /**
     * Delivers {@code message} to every target independently.
     *
     * @return number of copies enqueued.
     */
    public int broadcast(RoutingMessage message, Collection<String> targets) {
        Objects.requireNonNull(message, "message");
        int delivered = 0;
        for (String target : targets) {
            if (send(message, target)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Delivers one copy.
     *
     * @return true when the copy reached the target's queue.
     */
    public boolean send(RoutingMessage message, String target) {
        AgentHandle handle = registry.lookup(target);
        if (handle == null) {
            counters.deliveryFailed();
            log.debug("dropped update {}#{} for unresolved node {}", message.sender(), message.sequence(), target);
            return false;
        }
        if (!handle.deliver(message)) {
            counters.deliveryFailed();
            log.debug("dropped update {}#{}: node {} refused delivery", message.sender(), message.sequence(), target);
            return false;
        }
        counters.messageSent();
        return true;
    }
}
