package io.tiermesh.tier;

import io.tiermesh.model.TierSpec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tiers ordered by rank together with their backends.
 */
public final class TierRegistry {
    private final List<TierSpec> tiers;
    private final Map<String, TierSpec> byId;
    private final Map<String, TierBackend> backends;

    public TierRegistry(List<TierSpec> tiers, Map<String, TierBackend> backends) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("At least one tier is required");
        }
        List<TierSpec> sorted = new ArrayList<>(tiers);
        sorted.sort(Comparator.comparingInt(TierSpec::rank));
        this.tiers = List.copyOf(sorted);
        this.byId = new LinkedHashMap<>();
        for (TierSpec tier : this.tiers) {
            if (byId.put(tier.id(), tier) != null) {
                throw new IllegalArgumentException("Duplicate tier id: " + tier.id());
            }
            if (!backends.containsKey(tier.id())) {
                throw new IllegalArgumentException("No backend registered for tier: " + tier.id());
            }
        }
        this.backends = Map.copyOf(backends);
    }

    public List<TierSpec> tiers() {
        return tiers;
    }

    public TierSpec tier(String tierId) {
        TierSpec tier = byId.get(tierId);
        if (tier == null) {
            throw new IllegalArgumentException("Unknown tier: " + tierId);
        }
        return tier;
    }

    public TierBackend backend(String tierId) {
        TierBackend backend = backends.get(tierId);
        if (backend == null) {
            throw new IllegalArgumentException("Unknown tier: " + tierId);
        }
        return backend;
    }

    public TierSpec lowest() {
        return tiers.get(0);
    }

    public TierSpec highest() {
        return tiers.get(tiers.size() - 1);
    }

    public boolean isHighest(String tierId) {
        return highest().id().equals(tierId);
    }

    /**
     * Destination for data leaving {@code tierId}: the next rank, or the highest tier
     * when the source is configured for direct archive.
     */
    public Optional<TierSpec> destinationFor(String tierId) {
        TierSpec source = tier(tierId);
        if (isHighest(source.id())) {
            return Optional.empty();
        }
        if (source.directArchive()) {
            return Optional.of(highest());
        }
        int index = tiers.indexOf(source);
        return Optional.of(tiers.get(index + 1));
    }

    /**
     * Rejects pairs that do not move exactly one rank up. A direct-archive source may
     * also go straight to the highest tier.
     */
    public void validatePair(String sourceTier, String destinationTier) {
        TierSpec source = tier(sourceTier);
        TierSpec destination = tier(destinationTier);
        if (isHighest(source.id())) {
            throw new IllegalArgumentException("Tier " + sourceTier + " is the highest tier and cannot migrate");
        }
        TierSpec next = tiers.get(tiers.indexOf(source) + 1);
        if (next.id().equals(destination.id())) {
            return;
        }
        if (source.directArchive() && isHighest(destination.id())) {
            return;
        }
        throw new IllegalArgumentException(
                "Migration " + sourceTier + " -> " + destinationTier + " is not allowed; expected destination " + next.id()
        );
    }
}
