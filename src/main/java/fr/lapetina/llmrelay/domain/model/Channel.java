package fr.lapetina.llmrelay.domain.model;

import java.net.URI;
import java.util.Objects;
import java.util.Set;

/**
 * An upstream model-serving back-end the relay can route a request to.
 *
 * <p>Configuration fields are immutable: a status or weight change produces a new instance.
 * The {@link ChannelHealth} is the only mutable part and is carried over to those copies,
 * so every snapshot of the same channel shares one rolling health record.
 */
public final class Channel {
    private final String id;
    private final String name;
    private final URI baseUrl;
    private final String apiKey;
    private final Set<String> models;
    private final ChannelStatus status;
    private final double weight;
    private final ChannelHealth health;

    private Channel(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Channel ID is required");
        this.name = builder.name != null ? builder.name : builder.id;
        this.baseUrl = builder.baseUrl;
        this.apiKey = builder.apiKey;
        this.models = builder.models != null ? Set.copyOf(builder.models) : Set.of();
        this.status = builder.status != null ? builder.status : ChannelStatus.ENABLED;
        if (!Double.isFinite(builder.weight) || builder.weight < 0) {
            throw new IllegalArgumentException("Channel weight must be a finite number >= 0: " + builder.weight);
        }
        this.weight = builder.weight;
        this.health = builder.health != null
                ? builder.health
                : new ChannelHealth(id, builder.healthSettings != null ? builder.healthSettings : ChannelHealth.Settings.defaults());
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public Set<String> getModels() {
        return models;
    }

    public ChannelStatus getStatus() {
        return status;
    }

    public double getWeight() {
        return weight;
    }

    public ChannelHealth getHealth() {
        return health;
    }

    public boolean isEnabled() {
        return status == ChannelStatus.ENABLED;
    }

    /**
     * Whether this channel serves the model. A channel without a model list serves every model.
     */
    public boolean serves(String model) {
        return models.isEmpty() || models.contains(model);
    }

    public Channel withStatus(ChannelStatus newStatus) {
        return toBuilder().status(newStatus).build();
    }

    public Channel withWeight(double newWeight) {
        return toBuilder().weight(newWeight).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .models(models)
                .status(status)
                .weight(weight)
                .health(health);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Channel channel = (Channel) o;
        return id.equals(channel.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Channel{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", baseUrl=" + baseUrl +
                ", status=" + status +
                ", weight=" + weight +
                '}';
    }

    public static final class Builder {
        private String id;
        private String name;
        private URI baseUrl;
        private String apiKey;
        private Set<String> models;
        private ChannelStatus status = ChannelStatus.ENABLED;
        private double weight = 1.0;
        private ChannelHealth health;
        private ChannelHealth.Settings healthSettings;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder baseUrl(String url) {
            this.baseUrl = url != null ? URI.create(url) : null;
            return this;
        }

        public Builder baseUrl(URI url) {
            this.baseUrl = url;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder models(Set<String> models) {
            this.models = models;
            return this;
        }

        public Builder status(ChannelStatus status) {
            this.status = status;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        /**
         * Shares an existing health record, typically when rebuilding a channel after a config change.
         */
        public Builder health(ChannelHealth health) {
            this.health = health;
            return this;
        }

        public Builder healthSettings(ChannelHealth.Settings healthSettings) {
            this.healthSettings = healthSettings;
            return this;
        }

        public Channel build() {
            return new Channel(this);
        }
    }
}
