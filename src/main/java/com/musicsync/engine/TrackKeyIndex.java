package com.musicsync.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Tiered lookup over a set of track keys. Every caller that needs to correlate keys from different
 * sources goes through this class, so the tier order is defined once.
 * <p>
 * Tiers are tried in the fixed order {@link Tier#EXACT}, {@link Tier#LOWERCASE}, {@link Tier#NORMALIZED},
 * {@link Tier#DEEP}. The first tier that produces a hit answers the query; hits from looser tiers are
 * never combined with it.
 *
 * @param <V> value stored per key
 * @author Music Sync Team
 * @since 1.0
 */
public final class TrackKeyIndex<V> {

    public enum Tier {
        EXACT(UnaryOperator.identity()),
        LOWERCASE(TrackKey::lower),
        NORMALIZED(TrackKey::normalized),
        DEEP(TrackKey::deep);

        private final UnaryOperator<String> form;

        Tier(UnaryOperator<String> form) {
            this.form = form;
        }

        public String apply(String key) {
            return form.apply(key == null ? "" : key);
        }
    }

    /**
     * A hit: the tier that answered, the key as it was registered, and its value.
     */
    public record Match<V>(Tier tier, String key, V value) {}

    private final Map<String, V> entries = new LinkedHashMap<>();
    private final Map<Tier, Map<String, List<String>>> byTier = new EnumMap<>(Tier.class);

    public TrackKeyIndex() {
        for (Tier tier : Tier.values()) {
            byTier.put(tier, new LinkedHashMap<>());
        }
    }

    public TrackKeyIndex(Map<String, V> source) {
        this();
        if (source != null) {
            source.forEach(this::put);
        }
    }

    /**
     * Index of bare keys, for callers that only need membership.
     */
    public static TrackKeyIndex<String> ofKeys(Collection<String> keys) {
        TrackKeyIndex<String> index = new TrackKeyIndex<>();
        if (keys != null) {
            for (String k : keys) {
                index.put(k, k);
            }
        }
        return index;
    }

    public void put(String key, V value) {
        if (key == null) {
            return;
        }
        boolean fresh = !entries.containsKey(key);
        entries.put(key, value);
        if (fresh) {
            for (Tier tier : Tier.values()) {
                byTier.get(tier).computeIfAbsent(tier.apply(key), k -> new ArrayList<>()).add(key);
            }
        }
    }

    public int size() {
        return entries.size();
    }

    /**
     * Returns the first registered key matching {@code key} in the strictest tier that has any match.
     */
    public Optional<Match<V>> find(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (Tier tier : Tier.values()) {
            List<String> hits = byTier.get(tier).get(tier.apply(key));
            if (hits != null && !hits.isEmpty()) {
                String hit = hits.get(0);
                return Optional.of(new Match<>(tier, hit, entries.get(hit)));
            }
        }
        return Optional.empty();
    }

    /**
     * All registered keys sharing the strictest matching tier with {@code key}, in registration order.
     */
    public List<Match<V>> findAll(String key) {
        if (key == null) {
            return Collections.emptyList();
        }
        for (Tier tier : Tier.values()) {
            List<String> hits = byTier.get(tier).get(tier.apply(key));
            if (hits != null && !hits.isEmpty()) {
                List<Match<V>> out = new ArrayList<>(hits.size());
                for (String hit : hits) {
                    out.add(new Match<>(tier, hit, entries.get(hit)));
                }
                return out;
            }
        }
        return Collections.emptyList();
    }

    public Optional<V> get(String key) {
        return find(key).map(Match::value);
    }

    public boolean contains(String key) {
        return find(key).isPresent();
    }
}
