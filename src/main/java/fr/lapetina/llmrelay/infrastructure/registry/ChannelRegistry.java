package fr.lapetina.llmrelay.infrastructure.registry;

import fr.lapetina.llmrelay.domain.model.Channel;
import fr.lapetina.llmrelay.domain.model.ChannelStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registry of the configured channels.
 *
 * Channels are immutable; status and weight changes replace the stored instance while
 * keeping its health record. Readers take a {@link #snapshot()} at request start and are
 * unaffected by later changes.
 */
public final class ChannelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChannelRegistry.class);

    private final Map<String, Channel> channels = new ConcurrentHashMap<>();
    private final List<Consumer<ChannelRegistryEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a new channel or replaces an existing one.
     */
    public void register(Channel channel) {
        Channel previous = channels.put(channel.getId(), channel);
        if (previous == null) {
            log.info("Channel registered: {}", channel);
            notifyListeners(new ChannelRegistryEvent(ChannelRegistryEvent.Type.ADDED, channel));
        } else {
            log.info("Channel updated: {}", channel);
            notifyListeners(new ChannelRegistryEvent(ChannelRegistryEvent.Type.UPDATED, channel));
        }
    }

    public Optional<Channel> remove(String channelId) {
        Channel removed = channels.remove(channelId);
        if (removed != null) {
            log.info("Channel removed: {}", removed);
            notifyListeners(new ChannelRegistryEvent(ChannelRegistryEvent.Type.REMOVED, removed));
        }
        return Optional.ofNullable(removed);
    }

    public Optional<Channel> get(String channelId) {
        return Optional.ofNullable(channels.get(channelId));
    }

    /**
     * All channels ordered by id.
     */
    public List<Channel> snapshot() {
        List<Channel> all = new ArrayList<>(channels.values());
        all.sort(Comparator.comparing(Channel::getId));
        return List.copyOf(all);
    }

    /**
     * Enabled channels ordered by id.
     */
    public List<Channel> getEnabledChannels() {
        return snapshot().stream()
                .filter(Channel::isEnabled)
                .toList();
    }

    /**
     * Changes a channel's status.
     *
     * @return the updated channel, or empty if unknown
     */
    public Optional<Channel> updateStatus(String channelId, ChannelStatus status) {
        Channel updated = channels.computeIfPresent(channelId, (id, current) -> current.withStatus(status));
        if (updated != null) {
            log.info("Channel status changed: channelId={}, status={}", channelId, status);
            notifyListeners(new ChannelRegistryEvent(ChannelRegistryEvent.Type.UPDATED, updated));
        }
        return Optional.ofNullable(updated);
    }

    /**
     * Changes a channel's status and weight in one step, firing a single update event.
     * A null argument leaves that attribute unchanged.
     *
     * @return the updated channel, or empty if unknown
     */
    public Optional<Channel> update(String channelId, ChannelStatus status, Double weight) {
        Channel updated = channels.computeIfPresent(channelId, (id, current) -> {
            Channel next = status != null ? current.withStatus(status) : current;
            return weight != null ? next.withWeight(weight) : next;
        });
        if (updated != null) {
            log.info("Channel updated: channelId={}, status={}, weight={}",
                    channelId, updated.getStatus(), updated.getWeight());
            notifyListeners(new ChannelRegistryEvent(ChannelRegistryEvent.Type.UPDATED, updated));
        }
        return Optional.ofNullable(updated);
    }

    /**
     * Replaces all channels with a new set. Used for configuration reload.
     * A channel keeping its id keeps its accumulated health.
     */
    public void replaceAll(Collection<Channel> newChannels) {
        Set<String> newIds = new HashSet<>();

        for (Channel channel : newChannels) {
            newIds.add(channel.getId());
            Channel existing = channels.get(channel.getId());
            if (existing != null) {
                channel = channel.toBuilder().health(existing.getHealth()).build();
            }
            register(channel);
        }

        for (String existingId : new ArrayList<>(channels.keySet())) {
            if (!newIds.contains(existingId)) {
                remove(existingId);
            }
        }

        log.info("Channel registry replaced: {} channels", channels.size());
    }

    public void addListener(Consumer<ChannelRegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<ChannelRegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(ChannelRegistryEvent event) {
        for (Consumer<ChannelRegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Error notifying listener", e);
            }
        }
    }

    public int size() {
        return channels.size();
    }

    /**
     * Event for channel registry changes.
     */
    public record ChannelRegistryEvent(Type type, Channel channel) {
        public enum Type {
            ADDED,
            REMOVED,
            UPDATED
        }
    }
}
