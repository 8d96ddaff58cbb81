package com.dexsentinel.core.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The six base stats of a creature.
 *
 * <p>
 * Each dimension is nullable: {@code null} means the catalog did not provide a
 * value, which is different from a value of zero. Values are expected to be
 * non-negative but the type does not enforce it, so that malformed catalog
 * data can still be represented and flagged by the rule engine.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = StatBlock.Builder.class)
public final class StatBlock implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String HP = "hp";
    public static final String ATTACK = "attack";
    public static final String DEFENSE = "defense";
    public static final String SPECIAL_ATTACK = "special_attack";
    public static final String SPECIAL_DEFENSE = "special_defense";
    public static final String SPEED = "speed";

    private final Integer hp;
    private final Integer attack;
    private final Integer defense;
    private final Integer specialAttack;
    private final Integer specialDefense;
    private final Integer speed;

    private StatBlock(Builder builder) {
        this.hp = builder.hp;
        this.attack = builder.attack;
        this.defense = builder.defense;
        this.specialAttack = builder.specialAttack;
        this.specialDefense = builder.specialDefense;
        this.speed = builder.speed;
    }

    /**
     * Shorthand for a fully populated stat block.
     */
    public static StatBlock of(int hp, int attack, int defense,
            int specialAttack, int specialDefense, int speed) {
        return builder()
                .hp(hp)
                .attack(attack)
                .defense(defense)
                .specialAttack(specialAttack)
                .specialDefense(specialDefense)
                .speed(speed)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .hp(hp)
                .attack(attack)
                .defense(defense)
                .specialAttack(specialAttack)
                .specialDefense(specialDefense)
                .speed(speed);
    }

    /**
     * Return all six dimensions keyed by their canonical name, in a fixed order.
     * Absent dimensions map to {@code null}.
     *
     * @return unmodifiable ordered map of stat name to value
     */
    public Map<String, Integer> asMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put(HP, hp);
        map.put(ATTACK, attack);
        map.put(DEFENSE, defense);
        map.put(SPECIAL_ATTACK, specialAttack);
        map.put(SPECIAL_DEFENSE, specialDefense);
        map.put(SPEED, speed);
        return Collections.unmodifiableMap(map);
    }

    /**
     * @return {@code true} if every dimension has a value
     */
    public boolean isComplete() {
        return asMap().values().stream().allMatch(Objects::nonNull);
    }

    public Integer getHp() {
        return hp;
    }

    public Integer getAttack() {
        return attack;
    }

    public Integer getDefense() {
        return defense;
    }

    public Integer getSpecialAttack() {
        return specialAttack;
    }

    public Integer getSpecialDefense() {
        return specialDefense;
    }

    public Integer getSpeed() {
        return speed;
    }

    /**
     * Fluent builder for {@link StatBlock}; also used by Jackson.
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private Integer hp;
        private Integer attack;
        private Integer defense;
        private Integer specialAttack;
        private Integer specialDefense;
        private Integer speed;

        public Builder hp(Integer hp) {
            this.hp = hp;
            return this;
        }

        public Builder attack(Integer attack) {
            this.attack = attack;
            return this;
        }

        public Builder defense(Integer defense) {
            this.defense = defense;
            return this;
        }

        public Builder specialAttack(Integer specialAttack) {
            this.specialAttack = specialAttack;
            return this;
        }

        public Builder specialDefense(Integer specialDefense) {
            this.specialDefense = specialDefense;
            return this;
        }

        public Builder speed(Integer speed) {
            this.speed = speed;
            return this;
        }

        public StatBlock build() {
            return new StatBlock(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StatBlock that))
            return false;
        return Objects.equals(asMap(), that.asMap());
    }

    @Override
    public int hashCode() {
        return asMap().hashCode();
    }

    @Override
    public String toString() {
        return "StatBlock" + asMap();
    }
}
