package fr.lapetina.llmrelay.infrastructure.registry;

import fr.lapetina.llmrelay.domain.model.Channel;
import fr.lapetina.llmrelay.domain.model.ChannelStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChannelRegistryTest {

    private ChannelRegistry registry;
    private List<ChannelRegistry.ChannelRegistryEvent> events;

    @BeforeEach
    void setUp() {
        registry = new ChannelRegistry();
        events = new ArrayList<>();
        registry.addListener(events::add);
    }

    private static Channel channel(String id) {
        return Channel.builder().id(id).baseUrl("http://localhost/" + id).build();
    }

    @Test
    @DisplayName("should return snapshots ordered by id")
    void shouldOrderSnapshots() {
        registry.register(channel("c"));
        registry.register(channel("a"));
        registry.register(channel("b"));

        assertThat(registry.snapshot()).extracting(Channel::getId).containsExactly("a", "b", "c");
        assertThat(registry.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("should list only enabled channels")
    void shouldFilterEnabledChannels() {
        registry.register(channel("a"));
        registry.register(channel("b").withStatus(ChannelStatus.DISABLED));
        registry.register(channel("c").withStatus(ChannelStatus.ARCHIVED));

        assertThat(registry.getEnabledChannels()).extracting(Channel::getId).containsExactly("a");
    }

    @Test
    @DisplayName("should keep health across status and weight changes")
    void shouldKeepHealthOnUpdate() {
        Channel original = channel("a");
        registry.register(original);
        original.getHealth().recordSuccess(100);

        Channel disabled = registry.updateStatus("a", ChannelStatus.DISABLED).orElseThrow();
        Channel reweighted = registry.update("a", null, 4.0).orElseThrow();

        assertThat(disabled.getStatus()).isEqualTo(ChannelStatus.DISABLED);
        assertThat(reweighted.getWeight()).isEqualTo(4.0);
        assertThat(reweighted.getStatus()).isEqualTo(ChannelStatus.DISABLED);
        assertThat(reweighted.getHealth()).isSameAs(original.getHealth());
    }

    @Test
    @DisplayName("should not affect a snapshot already taken")
    void shouldIsolateSnapshots() {
        registry.register(channel("a"));
        List<Channel> snapshot = registry.snapshot();

        registry.updateStatus("a", ChannelStatus.DISABLED);

        assertThat(snapshot.get(0).isEnabled()).isTrue();
        assertThat(registry.get("a").orElseThrow().isEnabled()).isFalse();
    }

    @Test
    @DisplayName("should return empty when updating an unknown channel")
    void shouldIgnoreUnknownChannel() {
        assertThat(registry.updateStatus("missing", ChannelStatus.DISABLED)).isEmpty();
        assertThat(registry.update("missing", ChannelStatus.DISABLED, 2.0)).isEmpty();
        assertThat(events).isEmpty();
    }

    @Test
    @DisplayName("should reject a negative weight")
    void shouldRejectNegativeWeight() {
        registry.register(channel("a"));

        assertThatThrownBy(() -> registry.update("a", ChannelStatus.DISABLED, -1.0))
                .isInstanceOf(IllegalArgumentException.class);
        Channel unchanged = registry.get("a").orElseThrow();
        assertThat(unchanged.getWeight()).isEqualTo(1.0);
        assertThat(unchanged.isEnabled()).isTrue();
        assertThat(events).extracting(ChannelRegistry.ChannelRegistryEvent::type)
                .containsExactly(ChannelRegistry.ChannelRegistryEvent.Type.ADDED);
    }

    @Test
    @DisplayName("should apply status and weight together with a single update event")
    void shouldUpdateStatusAndWeightTogether() {
        registry.register(channel("a"));
        events.clear();

        Channel updated = registry.update("a", ChannelStatus.DISABLED, 2.5).orElseThrow();

        assertThat(updated.getStatus()).isEqualTo(ChannelStatus.DISABLED);
        assertThat(updated.getWeight()).isEqualTo(2.5);
        assertThat(registry.get("a").orElseThrow()).isSameAs(updated);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).type()).isEqualTo(ChannelRegistry.ChannelRegistryEvent.Type.UPDATED);
        assertThat(events.get(0).channel()).isSameAs(updated);
    }

    @Test
    @DisplayName("should replace all channels and keep health of the surviving ones")
    void shouldReplaceAll() {
        Channel a = channel("a");
        registry.register(a);
        registry.register(channel("b"));
        a.getHealth().recordFailure();
        events.clear();

        registry.replaceAll(List.of(channel("a").withWeight(2.0), channel("c")));

        assertThat(registry.snapshot()).extracting(Channel::getId).containsExactly("a", "c");
        Channel replaced = registry.get("a").orElseThrow();
        assertThat(replaced.getWeight()).isEqualTo(2.0);
        assertThat(replaced.getHealth()).isSameAs(a.getHealth());
        assertThat(events).extracting(ChannelRegistry.ChannelRegistryEvent::type)
                .containsExactly(
                        ChannelRegistry.ChannelRegistryEvent.Type.UPDATED,
                        ChannelRegistry.ChannelRegistryEvent.Type.ADDED,
                        ChannelRegistry.ChannelRegistryEvent.Type.REMOVED
                );
    }
}
