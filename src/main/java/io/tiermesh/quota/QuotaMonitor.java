package io.tiermesh.quota;

import io.tiermesh.error.TierMeshException;
import io.tiermesh.events.CoreEvent;
import io.tiermesh.events.EventPublisher;
import io.tiermesh.migration.JobRegistry;
import io.tiermesh.model.MigrationJob;
import io.tiermesh.model.MigrationTrigger;
import io.tiermesh.model.QuotaSnapshot;
import io.tiermesh.model.SelectionPredicate;
import io.tiermesh.model.TierSpec;
import io.tiermesh.model.TriggerReason;
import io.tiermesh.observability.AuditLogger;
import io.tiermesh.storage.MetadataStore;
import io.tiermesh.tier.TierBackend;
import io.tiermesh.tier.TierIo;
import io.tiermesh.tier.TierRegistry;
import io.tiermesh.tier.TierUsage;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads tier usage and decides which tier pairs need a migration. Never moves data
 * itself; the returned triggers go to the migration dispatcher.
 */
public final class QuotaMonitor {
    private static final long DAY_MS = 24L * 60L * 60L * 1000L;

    private final TierRegistry tiers;
    private final TierIo tierIo;
    private final MetadataStore store;
    private final JobRegistry registry;
    private final EventPublisher events;
    private final AuditLogger auditLogger;
    private final SelectionPredicate basePredicate;
    private final Clock clock;

    public QuotaMonitor(
            TierRegistry tiers,
            TierIo tierIo,
            MetadataStore store,
            JobRegistry registry,
            EventPublisher events,
            AuditLogger auditLogger,
            SelectionPredicate basePredicate,
            Clock clock
    ) {
        this.tiers = tiers;
        this.tierIo = tierIo;
        this.store = store;
        this.registry = registry;
        this.events = events;
        this.auditLogger = auditLogger;
        this.basePredicate = basePredicate == null ? SelectionPredicate.any() : basePredicate;
        this.clock = clock;
    }

    /**
     * One check cycle: snapshots every tier and returns at most one trigger per
     * non-highest tier. A quota trigger wins over an age trigger for the same tier, and
     * pairs with a non-terminal job get none. A tier whose usage cannot be read is
     * audited and skipped for this cycle.
     */
    public List<MigrationTrigger> checkQuotas() {
        long nowMs = clock.millis();
        List<MigrationTrigger> triggers = new ArrayList<>();
        List<String> suppressed = new ArrayList<>();
        List<String> unreadable = new ArrayList<>();
        for (TierSpec tier : tiers.tiers()) {
            TierUsage usage;
            try {
                TierBackend backend = tiers.backend(tier.id());
                usage = tierIo.call("usage of " + tier.id(), backend::usage);
            } catch (TierMeshException e) {
                unreadable.add(tier.id());
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "quota.tier_unreadable",
                        "quota-monitor",
                        "tiers/" + tier.id(),
                        e.kind(),
                        null,
                        null,
                        Map.of("error", String.valueOf(e.getMessage()))
                ));
                continue;
            }
            QuotaSnapshot snapshot = new QuotaSnapshot(
                    tier.id(),
                    usage.usedBytes(),
                    tier.capacityBytes(),
                    percent(usage.usedBytes(), tier.capacityBytes()),
                    nowMs
            );
            store.upsertQuotaSnapshot(snapshot);

            Optional<TierSpec> destination = tiers.destinationFor(tier.id());
            if (destination.isEmpty()) {
                continue;
            }
            Optional<MigrationTrigger> trigger = quotaTrigger(tier, destination.get(), snapshot);
            if (trigger.isEmpty()) {
                trigger = ageTrigger(tier, destination.get(), nowMs);
            }
            if (trigger.isEmpty()) {
                continue;
            }
            if (pairBusy(trigger.get())) {
                suppressed.add(trigger.get().pairKey());
                continue;
            }
            triggers.add(trigger.get());
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "quota.check",
                "quota-monitor",
                "tiers",
                unreadable.isEmpty() ? "ok" : "partial",
                null,
                null,
                Map.of(
                        "triggers", triggers.stream().map(t -> t.pairKey() + ":" + t.reason()).toList(),
                        "suppressed", suppressed,
                        "unreadable", unreadable
                )
        ));
        return triggers;
    }

    public List<QuotaSnapshot> latestSnapshots() {
        return store.listQuotaSnapshots();
    }

    private Optional<MigrationTrigger> quotaTrigger(TierSpec tier, TierSpec destination, QuotaSnapshot snapshot) {
        if (snapshot.usedBytes() < tier.highWaterBytes()) {
            return Optional.empty();
        }
        long reclaim = snapshot.usedBytes() - tier.lowWaterBytes();
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("tier_id", tier.id());
        attributes.put("destination_tier", destination.id());
        attributes.put("used_bytes", snapshot.usedBytes());
        attributes.put("capacity_bytes", snapshot.capacityBytes());
        attributes.put("usage_percent", snapshot.usagePercent());
        attributes.put("high_water_percent", tier.highWaterPercent());
        attributes.put("reclaim_bytes", reclaim);
        events.publish(new CoreEvent(CoreEvent.QUOTA_THRESHOLD_CROSSED, tier.id(), snapshot.takenAtMs(), attributes));
        return Optional.of(new MigrationTrigger(
                tier.id(),
                destination.id(),
                TriggerReason.QUOTA,
                reclaim,
                basePredicate
        ));
    }

    private Optional<MigrationTrigger> ageTrigger(TierSpec tier, TierSpec destination, long nowMs) {
        if (tier.retentionDays() <= 0) {
            return Optional.empty();
        }
        long idleMs = tier.retentionDays() * DAY_MS;
        if (!store.hasRecordsIdleSince(tier.id(), nowMs - idleMs)) {
            return Optional.empty();
        }
        return Optional.of(new MigrationTrigger(
                tier.id(),
                destination.id(),
                TriggerReason.AGE,
                0L,
                new SelectionPredicate(
                        Math.max(idleMs, basePredicate.minIdleMs()),
                        basePredicate.minSizeBytes(),
                        basePredicate.maxSizeBytes()
                )
        ));
    }

    private boolean pairBusy(MigrationTrigger trigger) {
        if (registry.activeJob(trigger.pairKey()).isPresent()) {
            return true;
        }
        Optional<MigrationJob> persisted = store.findActiveJob(trigger.sourceTier(), trigger.destinationTier());
        return persisted.isPresent();
    }

    private static double percent(long used, long capacity) {
        if (capacity <= 0L) {
            return 0D;
        }
        return (used * 100D) / capacity;
    }
}
