package dora.chatsync.store;

import dora.chatsync.event.EventChannel;
import dora.chatsync.event.Subscription;
import dora.chatsync.model.ConversationKey;
import dora.chatsync.model.ConversationView;
import dora.chatsync.model.Message;
import dora.chatsync.model.TypingUser;
import dora.chatsync.shared.dto.MessageStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Single source of truth for conversation timelines.
 * <p>
 * Every mutating method must be called on the event loop. Each one leaves the affected timelines
 * sorted by timestamp and publishes a fresh {@link ConversationView} to their subscribers.
 * A record is unique by server id once it has one, and by correlation token before that.
 */
@Slf4j
public class ConversationStore {

    private final Map<ConversationKey, ConversationTimeline> timelines = new ConcurrentHashMap<>();
    private final Map<ConversationKey, EventChannel<ConversationView>> channels = new ConcurrentHashMap<>();
    private final EventChannel<ConversationView> allChanges = new EventChannel<>("conversation-changed");
    // FAILED locally for lack of an ack; the server may still confirm them
    private final Set<String> expiredTokens = new HashSet<>();

    // ---------------------------------------------------------------- reads

    public ConversationView view(ConversationKey key) {
        ConversationTimeline timeline = timelines.get(key);
        return timeline != null ? timeline.view() : ConversationView.empty(key);
    }

    public Set<ConversationKey> conversations() {
        return Set.copyOf(timelines.keySet());
    }

    public Optional<Message> findByToken(String correlationToken) {
        Located located = locateToken(correlationToken, null, message -> true);
        return located != null ? Optional.of(located.message()) : Optional.empty();
    }

    public Optional<String> oldestServerId(ConversationKey key) {
        ConversationTimeline timeline = timelines.get(key);
        return timeline != null ? Optional.ofNullable(timeline.oldestServerId()) : Optional.empty();
    }

    public Subscription subscribe(ConversationKey key, Consumer<ConversationView> listener) {
        return channels.computeIfAbsent(key, k -> new EventChannel<>("conversation " + k)).subscribe(listener);
    }

    public Subscription subscribeAll(Consumer<ConversationView> listener) {
        return allChanges.subscribe(listener);
    }

    // ---------------------------------------------------------------- phase 1: optimistic insert

    /**
     * Adds a locally composed record. A second insert with the same token replaces an unconfirmed record,
     * but a record the server already confirmed is never replaced.
     *
     * @return false if the token belongs to a confirmed record and nothing was inserted
     */
    public boolean insertPending(Message message) {
        if (message.getCorrelationToken() == null || message.hasServerId() || !message.isPending()) {
            throw new IllegalArgumentException("Pending record needs a correlation token, no id and PENDING status");
        }
        String token = message.getCorrelationToken();
        if (locateToken(token, null, Message::hasServerId) != null) {
            log.warn("Token {} already belongs to a confirmed message, insert ignored", token);
            return false;
        }
        Located existing = locateToken(token, null, m -> true);
        if (existing != null) {
            existing.timeline().remove(existing.index());
            publish(existing.timeline());
        }
        expiredTokens.remove(token);
        ConversationTimeline timeline = timeline(message.getConversationKey());
        timeline.add(message);
        timeline.sort();
        publish(timeline);
        return true;
    }

    // ---------------------------------------------------------------- phase 2: remote reconciliation

    /**
     * Applies a server acknowledgment. Searches every conversation by token and only touches a record
     * that is PENDING, or FAILED by {@link #expirePending} without a server verdict.
     *
     * @return false if no such record exists
     */
    public boolean reconcileAck(String correlationToken, String serverId, MessageStatus status) {
        Located pending = locateToken(correlationToken, null, this::awaitsAck);
        if (pending == null) {
            log.debug("Ack for {} matched no unconfirmed record", correlationToken);
            return false;
        }
        expiredTokens.remove(correlationToken);
        MessageStatus confirmed = confirmedStatus(status);
        Located sameId = locateId(serverId);
        if (sameId != null) {
            // the echo got here first without a token; keep that record and drop the optimistic one
            removeRecord(pending);
            Message existing = sameId.message();
            replaceRecord(sameId, existing.toBuilder()
                    .correlationToken(correlationToken)
                    .status(existing.getStatus().isAfter(confirmed) ? existing.getStatus() : confirmed)
                    .build());
            publishAll(pending.timeline(), sameId.timeline());
            return true;
        }
        pending.timeline().set(pending.index(), pending.message().toBuilder()
                .id(serverId)
                .status(confirmed)
                .failureReason(null)
                .build());
        pending.timeline().sort();
        publish(pending.timeline());
        return true;
    }

    /**
     * Marks a record FAILED on the server's word. This is terminal: later acks no longer apply.
     * Records already confirmed are left alone.
     *
     * @return false if no record awaiting an ack carries the token
     */
    public boolean reconcileFailure(String correlationToken, String reason) {
        Located pending = locateToken(correlationToken, null, this::awaitsAck);
        if (pending == null) {
            log.debug("Failure for {} matched no pending record", correlationToken);
            return false;
        }
        expiredTokens.remove(correlationToken);
        markFailed(pending, reason);
        return true;
    }

    /**
     * Marks a PENDING record FAILED because no ack came in time. Unlike {@link #reconcileFailure} the
     * record can still be confirmed by a late ack.
     *
     * @return false if no PENDING record carries the token
     */
    public boolean expirePending(String correlationToken, String reason) {
        Located pending = locateToken(correlationToken, null, Message::isPending);
        if (pending == null) {
            return false;
        }
        expiredTokens.add(correlationToken);
        markFailed(pending, reason);
        return true;
    }

    // ---------------------------------------------------------------- inbound

    public IngestOutcome ingest(Message message) {
        return ingest(message, null);
    }

    /**
     * Stores a received message.
     * <ol>
     *     <li>same id in the target conversation: overwrite its mutable fields</li>
     *     <li>a record carrying {@code echoToken}: that record becomes this message</li>
     *     <li>otherwise append</li>
     * </ol>
     */
    public IngestOutcome ingest(Message message, String echoToken) {
        requireServerId(message);
        ConversationTimeline target = timeline(message.getConversationKey());

        int sameId = target.indexOfId(message.getId());
        if (sameId >= 0) {
            Message existing = target.get(sameId);
            target.set(sameId, overwrite(existing, message, echoToken));
            ConversationTimeline strayCopy = dropUnconfirmed(echoToken);
            target.sort();
            publishAll(target, strayCopy);
            return IngestOutcome.UPDATED;
        }

        if (echoToken != null) {
            Located local = locateToken(echoToken, target, m -> !m.hasServerId());
            if (local != null) {
                expiredTokens.remove(echoToken);
                reconcileEcho(local, target, message, echoToken);
                return IngestOutcome.RECONCILED;
            }
        }

        target.add(message);
        target.sort();
        publish(target);
        return IngestOutcome.APPENDED;
    }

    // ---------------------------------------------------------------- history

    /**
     * Merges an older page. Records already present by id are left untouched, echoes of local records
     * reconcile them, everything else is added.
     *
     * @return number of records added
     */
    public int mergePage(ConversationKey key, Collection<InboundMessage> page, boolean hasMore) {
        ConversationTimeline target = timeline(key);
        Set<ConversationTimeline> touched = new LinkedHashSet<>();
        touched.add(target);
        int added = 0;
        for (InboundMessage inbound : page) {
            Message message = inbound.getMessage();
            requireServerId(message);
            if (target.indexOfId(message.getId()) >= 0) {
                continue;
            }
            Located local = inbound.getEchoToken() != null
                    ? locateToken(inbound.getEchoToken(), target, m -> !m.hasServerId())
                    : null;
            if (local != null) {
                expiredTokens.remove(inbound.getEchoToken());
                touched.add(local.timeline());
                local.timeline().set(local.index(), confirm(local.message(), message, inbound.getEchoToken()));
                continue;
            }
            target.add(message);
            added++;
        }
        target.setHasMore(hasMore);
        touched.forEach(ConversationTimeline::sort);
        touched.forEach(this::publish);
        return added;
    }

    // ---------------------------------------------------------------- typing

    public void startTyping(ConversationKey key, String userId, String username, Instant at) {
        ConversationTimeline timeline = timeline(key);
        if (timeline.putTyping(new TypingUser(userId, username, at))) {
            publish(timeline);
        }
    }

    public void stopTyping(ConversationKey key, String userId) {
        ConversationTimeline timeline = timelines.get(key);
        if (timeline != null && timeline.removeTyping(userId)) {
            publish(timeline);
        }
    }

    /**
     * Drops typing entries whose last signal is older than {@code cutoff}.
     */
    public void expireTyping(Instant cutoff) {
        for (ConversationTimeline timeline : timelines.values()) {
            if (timeline.expireTyping(cutoff)) {
                publish(timeline);
            }
        }
    }

    public void clearTyping() {
        for (ConversationTimeline timeline : timelines.values()) {
            if (timeline.clearTyping()) {
                publish(timeline);
            }
        }
    }

    // ---------------------------------------------------------------- internals

    private boolean awaitsAck(Message message) {
        if (message.hasServerId()) {
            return false;
        }
        return message.isPending()
                || (message.getStatus() == MessageStatus.FAILED && expiredTokens.contains(message.getCorrelationToken()));
    }

    private void markFailed(Located located, String reason) {
        located.timeline().set(located.index(), located.message().toBuilder()
                .status(MessageStatus.FAILED)
                .failureReason(reason)
                .build());
        publish(located.timeline());
    }

    private void reconcileEcho(Located local, ConversationTimeline target, Message message, String echoToken) {
        Message reconciled = confirm(local.message(), message, echoToken);
        if (local.timeline() == target) {
            target.set(local.index(), reconciled);
            target.sort();
            publish(target);
        } else {
            log.debug("Moving {} from {} to {}", echoToken, local.timeline().key(), target.key());
            local.timeline().remove(local.index());
            target.add(reconciled);
            target.sort();
            publishAll(local.timeline(), target);
        }
    }

    private static Message confirm(Message local, Message server, String echoToken) {
        return local.toBuilder()
                .id(server.getId())
                .correlationToken(echoToken)
                .conversationKey(server.getConversationKey())
                .timestamp(server.getTimestamp())
                .status(confirmedStatus(server.getStatus()))
                .senderId(server.getSenderId() != null ? server.getSenderId() : local.getSenderId())
                .senderUsername(server.getSenderUsername() != null ? server.getSenderUsername() : local.getSenderUsername())
                .failureReason(null)
                .build();
    }

    private static Message overwrite(Message existing, Message incoming, String echoToken) {
        return existing.toBuilder()
                .correlationToken(existing.getCorrelationToken() != null ? existing.getCorrelationToken() : echoToken)
                .status(incoming.getStatus())
                .content(incoming.getContent())
                .timestamp(incoming.getTimestamp())
                .replyToId(incoming.getReplyToId())
                .senderUsername(incoming.getSenderUsername() != null
                        ? incoming.getSenderUsername() : existing.getSenderUsername())
                .failureReason(null)
                .build();
    }

    private static MessageStatus confirmedStatus(MessageStatus status) {
        if (status == null || status == MessageStatus.PENDING || status == MessageStatus.FAILED) {
            return MessageStatus.SENT;
        }
        return status;
    }

    private static void requireServerId(Message message) {
        if (!message.hasServerId()) {
            throw new IllegalArgumentException("Received message has no server id");
        }
    }

    /**
     * Removes an unconfirmed copy still holding {@code token}, left behind when the confirmed record won.
     */
    private ConversationTimeline dropUnconfirmed(String token) {
        if (token == null) {
            return null;
        }
        Located stray = locateToken(token, null, message -> !message.hasServerId());
        if (stray == null) {
            return null;
        }
        expiredTokens.remove(token);
        removeRecord(stray);
        return stray.timeline();
    }

    private void removeRecord(Located located) {
        located.timeline().remove(located.index());
    }

    // Looks the record up again: a removal in the same timeline may have shifted its index.
    private void replaceRecord(Located located, Message replacement) {
        ConversationTimeline timeline = located.timeline();
        int index = timeline.indexOfId(located.message().getId());
        timeline.set(index, replacement);
        timeline.sort();
    }

    private Located locateToken(String token, ConversationTimeline preferred, Predicate<Message> filter) {
        if (token == null) {
            return null;
        }
        List<ConversationTimeline> order = new ArrayList<>();
        if (preferred != null) {
            order.add(preferred);
        }
        for (ConversationTimeline timeline : timelines.values()) {
            if (timeline != preferred) {
                order.add(timeline);
            }
        }
        for (ConversationTimeline timeline : order) {
            int index = timeline.indexOfToken(token, filter);
            if (index >= 0) {
                return new Located(timeline, index, timeline.get(index));
            }
        }
        return null;
    }

    private Located locateId(String id) {
        for (ConversationTimeline timeline : timelines.values()) {
            int index = timeline.indexOfId(id);
            if (index >= 0) {
                return new Located(timeline, index, timeline.get(index));
            }
        }
        return null;
    }

    private ConversationTimeline timeline(ConversationKey key) {
        return timelines.computeIfAbsent(key, ConversationTimeline::new);
    }

    private void publishAll(ConversationTimeline... touched) {
        Set<ConversationTimeline> distinct = new LinkedHashSet<>();
        for (ConversationTimeline timeline : touched) {
            if (timeline != null) {
                distinct.add(timeline);
            }
        }
        distinct.forEach(this::publish);
    }

    private void publish(ConversationTimeline timeline) {
        ConversationView view = timeline.refreshView();
        EventChannel<ConversationView> channel = channels.get(timeline.key());
        if (channel != null) {
            channel.publish(view);
        }
        allChanges.publish(view);
    }

    private static final class Located {
        private final ConversationTimeline timeline;
        private final int index;
        private final Message message;

        Located(ConversationTimeline timeline, int index, Message message) {
            this.timeline = timeline;
            this.index = index;
            this.message = message;
        }

        ConversationTimeline timeline() {
            return timeline;
        }

        int index() {
            return index;
        }

        Message message() {
            return message;
        }
    }
}
