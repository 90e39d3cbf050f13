package io.tiermesh.observability;

import io.tiermesh.model.EndpointState;
import io.tiermesh.model.HealthStatus;
import io.tiermesh.model.MigrationStatus;
import io.tiermesh.runtime.TierMeshRuntime;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(TierMeshRuntime.StatusOutcome status) {
        StringBuilder sb = new StringBuilder();
        Map<String, Number> used = new LinkedHashMap<>();
        Map<String, Number> capacity = new LinkedHashMap<>();
        Map<String, Number> percent = new LinkedHashMap<>();
        Map<String, Number> records = new LinkedHashMap<>();
        for (TierMeshRuntime.TierStatus tier : status.tiers()) {
            used.put(tier.tierId(), tier.usedBytes());
            capacity.put(tier.tierId(), tier.capacityBytes());
            percent.put(tier.tierId(), tier.usagePercent());
            records.put(tier.tierId(), tier.recordCount());
        }
        appendMapGauge(sb, "tiermesh_tier_used_bytes", "Bytes stored per tier", "tier", used);
        appendMapGauge(sb, "tiermesh_tier_capacity_bytes", "Configured capacity per tier", "tier", capacity);
        appendMapGauge(sb, "tiermesh_tier_usage_percent", "Used share of capacity per tier", "tier", percent);
        appendMapGauge(sb, "tiermesh_tier_records", "Catalogued records per tier", "tier", records);

        Map<String, Number> jobs = new LinkedHashMap<>();
        for (MigrationStatus value : MigrationStatus.values()) {
            jobs.put(value.name().toLowerCase(Locale.ROOT), status.jobsByStatus().getOrDefault(value.name(), 0L));
        }
        appendMapGauge(sb, "tiermesh_migration_jobs", "Migration jobs grouped by status", "status", jobs);
        appendGauge(sb, "tiermesh_migration_jobs_active", "Non-terminal migration jobs", null, null, status.activeJobs().size());

        Map<String, Number> byHealth = new LinkedHashMap<>();
        for (HealthStatus value : HealthStatus.values()) {
            byHealth.put(value.name().toLowerCase(Locale.ROOT), 0);
        }
        for (EndpointState state : status.endpoints()) {
            String key = state.status().name().toLowerCase(Locale.ROOT);
            byHealth.put(key, byHealth.get(key).intValue() + 1);
        }
        appendMapGauge(sb, "tiermesh_endpoints", "Endpoints grouped by health status", "status", byHealth);
        for (EndpointState state : status.endpoints()) {
            appendGauge(sb, "tiermesh_endpoint_healthy", "Endpoint routable without fallback (1=healthy)",
                    "endpoint", state.endpointId(), state.status() == HealthStatus.HEALTHY ? 1 : 0);
        }
        for (EndpointState state : status.endpoints()) {
            if (state.latencyKnown()) {
                appendGauge(sb, "tiermesh_endpoint_latency_ewma_ms", "Smoothed probe latency in milliseconds",
                        "endpoint", state.endpointId(), state.latencyEwmaMs());
            }
        }
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Number> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Number> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(render(e.getValue())).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, Number value) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(render(value)).append('\n');
    }

    private static String render(Number value) {
        if (value instanceof Double || value instanceof Float) {
            return String.format(Locale.ROOT, "%.3f", value.doubleValue());
        }
        return String.valueOf(value.longValue());
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
