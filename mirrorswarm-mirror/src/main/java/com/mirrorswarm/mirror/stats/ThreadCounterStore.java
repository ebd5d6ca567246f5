package com.mirrorswarm.mirror.stats;

import com.mirrorswarm.channel.discord.DiscordApi;
import com.mirrorswarm.channel.discord.DiscordClient;
import com.mirrorswarm.channel.discord.DiscordTypes;
import com.mirrorswarm.channel.discord.DiscordTypes.Channel;
import com.mirrorswarm.channel.discord.DiscordTypes.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Persistent counters stored in the titles of threads, one thread per
 * (backup channel, topic).
 * <p>
 * Messages feed an in-memory delta cache through {@link #check}; {@link #flush}
 * writes the pending deltas with a read-then-rename per counter. Pending
 * deltas are lost when the process dies, and concurrent flushes of the same
 * counter may lose an update: there is no lock around the read-modify-write.
 */
@Slf4j
public class ThreadCounterStore {

    /** One week, the longest auto-archive window. */
    public static final int AUTO_ARCHIVE_MINUTES = 10080;
    private static final int ANNOUNCEMENT_LOOKBACK = 10;

    private final DiscordClient client;
    private final String backupGuildId;
    private final List<StatTopic> topics;
    private final Map<CounterKey, Long> deltas = new ConcurrentHashMap<>();

    private volatile CounterThreadIndex index = CounterThreadIndex.empty();
    private volatile List<Channel> channels = List.of();

    public ThreadCounterStore(DiscordClient client, String backupGuildId, List<StatTopic> topics) {
        this.client = client;
        this.backupGuildId = backupGuildId;
        this.topics = List.copyOf(topics);
    }

    public List<StatTopic> topics() {
        return topics;
    }

    public CounterThreadIndex index() {
        return index;
    }

    // =========================================================================
    // Reconciliation
    // =========================================================================

    /**
     * Find the counter threads of {@code backupChannels}, creating
     * {@code "<topic> - 0"} for every missing one.
     */
    public CounterThreadIndex reconcile(Collection<Channel> backupChannels) {
        this.channels = List.copyOf(backupChannels);
        Map<CounterKey, String> found = scan(channels);
        provisionMissing(channels, found);
        index = new CounterThreadIndex(found);
        log.info("Counter store tracking {} counters in {} channels", found.size(), channels.size());
        return index;
    }

    /**
     * Start tracking a backup channel created after reconciliation. A tracked
     * channel with the same name is replaced, and its pending deltas move to
     * the new channel.
     */
    public synchronized CounterThreadIndex track(Channel backupChannel) {
        List<String> replaced = new ArrayList<>();
        List<Channel> next = new ArrayList<>();
        for (Channel channel : channels) {
            if (channel.getId().equals(backupChannel.getId()) || channel.getName().equals(backupChannel.getName())) {
                replaced.add(channel.getId());
            } else {
                next.add(channel);
            }
        }
        next.add(backupChannel);

        Map<CounterKey, String> found = scan(List.of(backupChannel));
        provisionMissing(List.of(backupChannel), found);

        Map<CounterKey, String> merged = new LinkedHashMap<>();
        index.asMap().forEach((key, threadId) -> {
            if (!replaced.contains(key.channelId())) {
                merged.put(key, threadId);
            }
        });
        merged.putAll(found);

        for (CounterKey key : List.copyOf(deltas.keySet())) {
            if (replaced.contains(key.channelId()) && !key.channelId().equals(backupChannel.getId())) {
                Long delta = deltas.remove(key);
                if (delta != null) {
                    deltas.merge(new CounterKey(backupChannel.getId(), key.topic()), delta, Long::sum);
                }
            }
        }

        channels = List.copyOf(next);
        index = new CounterThreadIndex(merged);
        log.info("Counter store now tracking #{} ({})", backupChannel.getName(), backupChannel.getId());
        return index;
    }

    /**
     * Rebuild the index from the platform without creating threads.
     */
    public CounterThreadIndex rescan() {
        index = new CounterThreadIndex(scan(channels));
        return index;
    }

    private Map<CounterKey, String> scan(List<Channel> backupChannels) {
        Map<String, Channel> byId = new HashMap<>();
        backupChannels.forEach(c -> byId.put(c.getId(), c));

        List<Channel> threads = new ArrayList<>(client.listActiveThreads(backupGuildId));
        for (Channel channel : backupChannels) {
            try {
                threads.addAll(client.listPublicArchivedThreads(channel.getId()));
            } catch (DiscordApi.ApiError e) {
                log.warn("Cannot list archived threads of #{}: {}", channel.getName(), e.getMessage());
            }
        }

        Map<CounterKey, String> found = new LinkedHashMap<>();
        for (Channel thread : threads) {
            if (!byId.containsKey(thread.getParentId())) {
                continue;
            }
            for (StatTopic topic : topics) {
                if (CounterTitle.matches(topic.title(), thread.getName())) {
                    CounterKey key = new CounterKey(thread.getParentId(), topic.title());
                    String previous = found.putIfAbsent(key, thread.getId());
                    if (previous != null && !previous.equals(thread.getId())) {
                        log.warn("Duplicate counter thread {} for {}, keeping {}", thread.getId(), key, previous);
                    }
                    break;
                }
            }
        }
        return found;
    }

    private void provisionMissing(List<Channel> backupChannels, Map<CounterKey, String> found) {
        for (Channel channel : backupChannels) {
            for (StatTopic topic : topics) {
                CounterKey key = new CounterKey(channel.getId(), topic.title());
                if (!found.containsKey(key)) {
                    found.put(key, provision(channel, topic));
                }
            }
        }
    }

    private String provision(Channel channel, StatTopic topic) {
        Channel thread = client.createThread(channel.getId(), CounterTitle.format(topic.title(), 0),
                AUTO_ARCHIVE_MINUTES);
        log.info("Created counter thread '{}' in #{}", thread.getName(), channel.getName());
        deleteCreationAnnouncement(channel);
        return thread.getId();
    }

    private void deleteCreationAnnouncement(Channel channel) {
        try {
            for (Message message : client.fetchRecentMessages(channel.getId(), ANNOUNCEMENT_LOOKBACK)) {
                if (message.getType() == DiscordTypes.MESSAGE_THREAD_CREATED) {
                    client.deleteMessage(channel.getId(), message.getId());
                    return;
                }
            }
        } catch (DiscordApi.ApiError e) {
            log.warn("Could not remove thread announcement in #{}: {}", channel.getName(), e.getMessage());
        }
    }

    // =========================================================================
    // Delta cache
    // =========================================================================

    /**
     * Add the increments {@code message} contributes in a backup channel.
     */
    public void check(String channelId, Message message) {
        for (StatTopic topic : topics) {
            Integer increment = topic.classify(message);
            if (increment != null) {
                deltas.merge(new CounterKey(channelId, topic.title()), increment.longValue(), Long::sum);
            }
        }
    }

    public long pendingDelta(String channelId, String topic) {
        return deltas.getOrDefault(new CounterKey(channelId, topic), 0L);
    }

    /**
     * Write every non-zero pending delta. Each delta is removed from the cache
     * before it is written; a failed counter loses its delta and the others
     * proceed.
     *
     * @return number of counters renamed
     */
    public int flush() {
        int written = 0;
        for (CounterKey key : List.copyOf(deltas.keySet())) {
            Long delta = deltas.remove(key);
            if (delta == null || delta == 0) {
                continue;
            }
            try {
                update(key.channelId(), key.topic(), delta, true);
                written++;
            } catch (CounterFormatException | DiscordApi.ApiError
                    | IllegalStateException | IllegalArgumentException e) {
                log.warn("Dropping delta {} for {}: {}", delta, key, e.getMessage());
            }
        }
        if (written > 0) {
            log.info("Flushed {} counters", written);
        }
        return written;
    }

    // =========================================================================
    // Rename primitive
    // =========================================================================

    public long update(String channelId, String topic, long value) {
        return update(channelId, topic, value, true);
    }

    /**
     * Set a counter. With {@code increment} the value is added to the current
     * title value, otherwise it replaces it.
     *
     * @return the value now in the title
     * @throws IllegalStateException  when the counter has no thread
     * @throws CounterFormatException when the current title cannot be read
     */
    public long update(String channelId, String topic, long value, boolean increment) {
        Optional<String> threadId = index.threadId(channelId, topic);
        if (threadId.isEmpty()) {
            throw new IllegalStateException("No counter thread for '" + topic + "' in channel " + channelId);
        }
        long next = value;
        if (increment) {
            Channel thread = client.getChannel(threadId.get());
            next += CounterTitle.parse(topic, thread.getName());
        }
        if (next < 0) {
            throw new IllegalArgumentException("Counter values are non-negative, got " + next);
        }
        client.renameThread(threadId.get(), CounterTitle.format(topic, next));
        return next;
    }
}
