package io.tiermesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class TierMeshConfig {
    public static final String SETTINGS_FILE_NAME = "tiermesh-settings.json";
    public static final long DEFAULT_QUOTA_CHECK_INTERVAL_MS = 24L * 60L * 60L * 1000L;
    public static final int DEFAULT_HIGH_WATER_PERCENT = 85;
    public static final int DEFAULT_LOW_WATER_PERCENT = 60;
    public static final long DEFAULT_PROBE_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_PROBE_TIMEOUT_MS = 5_000L;
    public static final int DEFAULT_UNHEALTHY_AFTER_FAILURES = 3;
    public static final int DEFAULT_HEALTHY_AFTER_SUCCESSES = 2;
    public static final double DEFAULT_LATENCY_EWMA_ALPHA = 0.3D;
    public static final int DEFAULT_ROUTER_RETRY_CAP = 1;
    public static final int DEFAULT_MIGRATION_BATCH_SIZE = 500;
    public static final long DEFAULT_TIER_IO_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_TRANSIENT_RETRY_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_BACKOFF_MS = 200L;
    public static final int DEFAULT_ARCHIVE_RETENTION_DAYS = 2555;

    private final Path rootDir;

    public TierMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static TierMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new TierMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("tiermesh.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path tiersRoot() {
        return rootDir.resolve("tiers");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path payloadKeyFile() {
        return securityRoot().resolve("payload-keys.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    /**
     * Resolves a tier location from the settings file. Relative locations live under
     * the data root so a whole deployment can be moved by moving one directory.
     */
    public Path resolveTierLocation(String location, String tierId) {
        if (location == null || location.isBlank()) {
            return tiersRoot().resolve(tierId);
        }
        Path raw = Paths.get(location);
        return raw.isAbsolute() ? raw.normalize() : rootDir.resolve(raw).normalize();
    }
}
