package com.dexsentinel.core.rules;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The set of category tags the catalog is known to use.
 *
 * <p>
 * Membership is exact and case-sensitive; the catalog publishes lowercase
 * names.
 * </p>
 *
 * @since 1.0.0
 */
public final class TypeVocabulary {

    /** The 18 categories of the upstream catalog. */
    public static final TypeVocabulary DEFAULT = new TypeVocabulary(List.of(
            "normal", "fire", "water", "electric", "grass", "ice", "fighting",
            "poison", "ground", "flying", "psychic", "bug", "rock", "ghost",
            "dragon", "dark", "steel", "fairy"));

    private final Set<String> types;

    public TypeVocabulary(Collection<String> types) {
        Objects.requireNonNull(types, "types must not be null");
        this.types = Collections.unmodifiableSet(new LinkedHashSet<>(types));
    }

    /**
     * Build a vocabulary from configuration, falling back to {@link #DEFAULT}
     * when nothing is configured.
     */
    public static TypeVocabulary fromConfig(List<String> configured) {
        return configured == null || configured.isEmpty() ? DEFAULT : new TypeVocabulary(configured);
    }

    public boolean contains(String type) {
        return type != null && types.contains(type);
    }

    /**
     * @return {@code true} if every tag belongs to this vocabulary; vacuously
     *         true for an empty list
     */
    public boolean containsAll(List<String> tags) {
        return tags.stream().allMatch(this::contains);
    }

    public Set<String> types() {
        return types;
    }

    @Override
    public String toString() {
        return "TypeVocabulary" + types;
    }
}
