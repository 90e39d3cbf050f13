package io.tiermesh.config;

import io.tiermesh.model.Endpoint;
import io.tiermesh.model.RouterAlgorithm;
import io.tiermesh.model.SelectionPolicy;
import io.tiermesh.model.TierSpec;
import io.tiermesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Effective runtime settings. Values come from {@code tiermesh-settings.json} in the
 * data root; anything missing or out of range falls back to the defaults.
 */
public record TierMeshSettings(
        List<TierSpec> tiers,
        List<Endpoint> endpoints,
        long quotaCheckIntervalMs,
        long probeIntervalMs,
        long probeTimeoutMs,
        int unhealthyAfterFailures,
        int healthyAfterSuccesses,
        double latencyEwmaAlpha,
        RouterAlgorithm routerAlgorithm,
        int routerRetryCap,
        SelectionPolicy selectionPolicy,
        int migrationBatchSize,
        long minIdleMs,
        long minRecordBytes,
        long maxRecordBytes,
        long tierIoTimeoutMs,
        int transientRetryAttempts,
        long retryBackoffMs,
        int archiveRetentionDays
) {
    private static final long GIB = 1024L * 1024L * 1024L;

    public static TierMeshSettings defaults() {
        return new TierMeshSettings(
                defaultTiers(),
                List.of(),
                TierMeshConfig.DEFAULT_QUOTA_CHECK_INTERVAL_MS,
                TierMeshConfig.DEFAULT_PROBE_INTERVAL_MS,
                TierMeshConfig.DEFAULT_PROBE_TIMEOUT_MS,
                TierMeshConfig.DEFAULT_UNHEALTHY_AFTER_FAILURES,
                TierMeshConfig.DEFAULT_HEALTHY_AFTER_SUCCESSES,
                TierMeshConfig.DEFAULT_LATENCY_EWMA_ALPHA,
                RouterAlgorithm.WEIGHTED_LATENCY,
                TierMeshConfig.DEFAULT_ROUTER_RETRY_CAP,
                SelectionPolicy.OLDEST_ACCESS_FIRST,
                TierMeshConfig.DEFAULT_MIGRATION_BATCH_SIZE,
                0L,
                0L,
                0L,
                TierMeshConfig.DEFAULT_TIER_IO_TIMEOUT_MS,
                TierMeshConfig.DEFAULT_TRANSIENT_RETRY_ATTEMPTS,
                TierMeshConfig.DEFAULT_RETRY_BACKOFF_MS,
                TierMeshConfig.DEFAULT_ARCHIVE_RETENTION_DAYS
        );
    }

    public static TierMeshSettings load(Path settingsFile) {
        TierMeshSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + settingsFile, e);
        }
    }

    static TierMeshSettings fromFile(SettingsFile file, TierMeshSettings defaults) {
        if (file == null) {
            return defaults;
        }
        List<TierSpec> tiers = file.tiers() == null || file.tiers().isEmpty()
                ? defaults.tiers()
                : resolveTiers(file.tiers());
        List<Endpoint> endpoints = file.endpoints() == null
                ? defaults.endpoints()
                : resolveEndpoints(file.endpoints());
        int unhealthyAfter = sanitizeInt(file.unhealthyAfterFailures(), defaults.unhealthyAfterFailures(), 1);
        int healthyAfter = sanitizeInt(file.healthyAfterSuccesses(), defaults.healthyAfterSuccesses(), 1);
        double alpha = file.latencyEwmaAlpha() == null
                || file.latencyEwmaAlpha() <= 0D
                || file.latencyEwmaAlpha() > 1D
                ? defaults.latencyEwmaAlpha()
                : file.latencyEwmaAlpha();
        return new TierMeshSettings(
                tiers,
                endpoints,
                sanitizeLong(file.quotaCheckIntervalMs(), defaults.quotaCheckIntervalMs(), 1_000L),
                sanitizeLong(file.probeIntervalMs(), defaults.probeIntervalMs(), 100L),
                sanitizeLong(file.probeTimeoutMs(), defaults.probeTimeoutMs(), 10L),
                unhealthyAfter,
                healthyAfter,
                alpha,
                file.routerAlgorithm() == null ? defaults.routerAlgorithm() : RouterAlgorithm.fromString(file.routerAlgorithm()),
                sanitizeInt(file.routerRetryCap(), defaults.routerRetryCap(), 0),
                file.selectionPolicy() == null ? defaults.selectionPolicy() : SelectionPolicy.fromString(file.selectionPolicy()),
                sanitizeInt(file.migrationBatchSize(), defaults.migrationBatchSize(), 1),
                sanitizeLong(file.minIdleMs(), defaults.minIdleMs(), 0L),
                sanitizeLong(file.minRecordBytes(), defaults.minRecordBytes(), 0L),
                sanitizeLong(file.maxRecordBytes(), defaults.maxRecordBytes(), 0L),
                sanitizeLong(file.tierIoTimeoutMs(), defaults.tierIoTimeoutMs(), 10L),
                sanitizeInt(file.transientRetryAttempts(), defaults.transientRetryAttempts(), 1),
                sanitizeLong(file.retryBackoffMs(), defaults.retryBackoffMs(), 0L),
                sanitizeInt(file.archiveRetentionDays(), defaults.archiveRetentionDays(), 0)
        );
    }

    public TierSpec tier(String tierId) {
        for (TierSpec tier : tiers) {
            if (tier.id().equals(tierId)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown tier: " + tierId);
    }

    private static List<TierSpec> defaultTiers() {
        return List.of(
                new TierSpec("core", 0, GIB, TierMeshConfig.DEFAULT_HIGH_WATER_PERCENT,
                        TierMeshConfig.DEFAULT_LOW_WATER_PERCENT, "tiers/core", false, 0),
                new TierSpec("main", 1, 16L * GIB, TierMeshConfig.DEFAULT_HIGH_WATER_PERCENT,
                        TierMeshConfig.DEFAULT_LOW_WATER_PERCENT, "tiers/main", false, 0),
                new TierSpec("archive", 2, 256L * GIB, TierMeshConfig.DEFAULT_HIGH_WATER_PERCENT,
                        TierMeshConfig.DEFAULT_LOW_WATER_PERCENT, "tiers/archive", false, 0)
        );
    }

    private static List<TierSpec> resolveTiers(List<TierFile> rows) {
        List<TierSpec> out = new ArrayList<>(rows.size());
        Set<String> ids = new HashSet<>();
        Set<Integer> ranks = new HashSet<>();
        for (int i = 0; i < rows.size(); i++) {
            TierFile row = rows.get(i);
            String id = row.id() == null ? "" : row.id().trim().toLowerCase(Locale.ROOT);
            if (id.isBlank()) {
                throw new IllegalArgumentException("Tier at index " + i + " has no id");
            }
            int rank = row.rank() == null ? i : row.rank();
            if (!ids.add(id)) {
                throw new IllegalArgumentException("Duplicate tier id: " + id);
            }
            if (!ranks.add(rank)) {
                throw new IllegalArgumentException("Duplicate tier rank " + rank + " for tier " + id);
            }
            if (row.capacityBytes() == null || row.capacityBytes() <= 0L) {
                throw new IllegalArgumentException("Tier " + id + " needs a positive capacityBytes");
            }
            int high = sanitizePercent(row.highWaterPercent(), TierMeshConfig.DEFAULT_HIGH_WATER_PERCENT);
            int low = sanitizePercent(row.lowWaterPercent(), TierMeshConfig.DEFAULT_LOW_WATER_PERCENT);
            if (low >= high) {
                throw new IllegalArgumentException("Tier " + id + " low-water mark must be below high-water mark");
            }
            out.add(new TierSpec(
                    id,
                    rank,
                    row.capacityBytes(),
                    high,
                    low,
                    row.location(),
                    Boolean.TRUE.equals(row.directArchive()),
                    row.retentionDays() == null ? 0 : Math.max(0, row.retentionDays())
            ));
        }
        out.sort(Comparator.comparingInt(TierSpec::rank));
        return List.copyOf(out);
    }

    private static List<Endpoint> resolveEndpoints(List<EndpointFile> rows) {
        List<Endpoint> out = new ArrayList<>(rows.size());
        Set<String> ids = new HashSet<>();
        for (EndpointFile row : rows) {
            if (row.id() == null || row.id().isBlank()) {
                throw new IllegalArgumentException("Endpoint without id in settings");
            }
            String id = row.id().trim();
            if (!ids.add(id)) {
                throw new IllegalArgumentException("Duplicate endpoint id: " + id);
            }
            String address = row.address() == null ? "" : row.address().trim();
            String healthUrl = row.healthUrl() == null || row.healthUrl().isBlank()
                    ? address
                    : row.healthUrl().trim();
            out.add(new Endpoint(id, address, healthUrl));
        }
        return List.copyOf(out);
    }

    private static int sanitizePercent(Integer value, int fallback) {
        if (value == null || value <= 0 || value > 100) {
            return fallback;
        }
        return value;
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    record SettingsFile(
            List<TierFile> tiers,
            List<EndpointFile> endpoints,
            Long quotaCheckIntervalMs,
            Long probeIntervalMs,
            Long probeTimeoutMs,
            Integer unhealthyAfterFailures,
            Integer healthyAfterSuccesses,
            Double latencyEwmaAlpha,
            String routerAlgorithm,
            Integer routerRetryCap,
            String selectionPolicy,
            Integer migrationBatchSize,
            Long minIdleMs,
            Long minRecordBytes,
            Long maxRecordBytes,
            Long tierIoTimeoutMs,
            Integer transientRetryAttempts,
            Long retryBackoffMs,
            Integer archiveRetentionDays
    ) {
    }

    record TierFile(
            String id,
            Integer rank,
            Long capacityBytes,
            Integer highWaterPercent,
            Integer lowWaterPercent,
            String location,
            Boolean directArchive,
            Integer retentionDays
    ) {
    }

    record EndpointFile(
            String id,
            String address,
            String healthUrl
    ) {
    }
}
