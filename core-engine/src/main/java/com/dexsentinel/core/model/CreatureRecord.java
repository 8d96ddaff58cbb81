package com.dexsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Canonical creature record as held by the record store.
 *
 * <p>
 * Records arrive from the external catalog and may be incomplete or
 * malformed. Every field except {@code name} is therefore allowed to be
 * absent; the rule engine and the dashboard decide what an absent value
 * means. The {@code name} is the natural lookup key and the {@code id} never
 * changes once assigned.
 * </p>
 *
 * <h3>Immutability</h3>
 * <p>
 * Instances are immutable. Use {@link #toBuilder()} to derive a modified copy,
 * e.g. when simulating an anomaly.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = CreatureRecord.Builder.class)
public final class CreatureRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Integer id;
    private final String name;
    private final Integer height;
    private final Integer weight;
    private final Integer baseExperience;

    /** Category tags, e.g. "fire", "flying". */
    private final List<String> types;

    /** Capability tags, e.g. "blaze". */
    private final List<String> abilities;

    private final StatBlock stats;

    private final String spriteFront;
    private final String spriteShiny;

    private final Instant createdAt;
    private final Instant updatedAt;

    private CreatureRecord(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.height = builder.height;
        this.weight = builder.weight;
        this.baseExperience = builder.baseExperience;
        this.types = List.copyOf(builder.types);
        this.abilities = List.copyOf(builder.abilities);
        this.stats = builder.stats;
        this.spriteFront = builder.spriteFront;
        this.spriteShiny = builder.spriteShiny;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a builder pre-populated with this record's values.
     *
     * @return new builder
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .height(height)
                .weight(weight)
                .baseExperience(baseExperience)
                .types(types)
                .abilities(abilities)
                .stats(stats)
                .spriteFront(spriteFront)
                .spriteShiny(spriteShiny)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Integer getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Integer getHeight() {
        return height;
    }

    public Integer getWeight() {
        return weight;
    }

    public Integer getBaseExperience() {
        return baseExperience;
    }

    public List<String> getTypes() {
        return types;
    }

    public List<String> getAbilities() {
        return abilities;
    }

    public StatBlock getStats() {
        return stats;
    }

    public String getSpriteFront() {
        return spriteFront;
    }

    public String getSpriteShiny() {
        return spriteShiny;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link CreatureRecord}; also used by Jackson.
     *
     * <p>
     * Null tag lists and null list elements are dropped so that the built
     * record always exposes non-null, unmodifiable lists.
     * </p>
     */
    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder {
        private Integer id;
        private String name;
        private Integer height;
        private Integer weight;
        private Integer baseExperience;
        private List<String> types = new ArrayList<>();
        private List<String> abilities = new ArrayList<>();
        private StatBlock stats;
        private String spriteFront;
        private String spriteShiny;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(Integer id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder height(Integer height) {
            this.height = height;
            return this;
        }

        public Builder weight(Integer weight) {
            this.weight = weight;
            return this;
        }

        public Builder baseExperience(Integer baseExperience) {
            this.baseExperience = baseExperience;
            return this;
        }

        public Builder types(List<String> types) {
            this.types = copyTags(types);
            return this;
        }

        public Builder addType(String type) {
            if (type != null) {
                this.types.add(type);
            }
            return this;
        }

        public Builder abilities(List<String> abilities) {
            this.abilities = copyTags(abilities);
            return this;
        }

        public Builder stats(StatBlock stats) {
            this.stats = stats;
            return this;
        }

        public Builder spriteFront(String spriteFront) {
            this.spriteFront = spriteFront;
            return this;
        }

        public Builder spriteShiny(String spriteShiny) {
            this.spriteShiny = spriteShiny;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public CreatureRecord build() {
            return new CreatureRecord(this);
        }

        private static List<String> copyTags(List<String> source) {
            List<String> copy = new ArrayList<>();
            if (source != null) {
                source.stream().filter(Objects::nonNull).forEach(copy::add);
            }
            return copy;
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CreatureRecord that))
            return false;
        return Objects.equals(id, that.id)
                && Objects.equals(name, that.name)
                && Objects.equals(height, that.height)
                && Objects.equals(weight, that.weight)
                && Objects.equals(baseExperience, that.baseExperience)
                && types.equals(that.types)
                && abilities.equals(that.abilities)
                && Objects.equals(stats, that.stats)
                && Objects.equals(spriteFront, that.spriteFront)
                && Objects.equals(spriteShiny, that.spriteShiny);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, types, stats);
    }

    @Override
    public String toString() {
        return "CreatureRecord{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", types=" + types +
                ", stats=" + stats +
                '}';
    }
}
