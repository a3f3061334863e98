/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.config;

import java.time.ZoneId;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.data.store.StorePaths;

/**
 * Store layout and retention settings for the alert aggregation engine.
 *
 * <p>
 * <b>Persisted layout</b> (defaults match the layout the mobile and operator apps already read):
 *
 * <pre>
 * alertForms/&lt;uid&gt;/&lt;formId&gt;                              raw submissions
 * aggregation/&lt;phenomenon&gt;/&lt;bucketId&gt;/bounds               bucket bounding box
 * aggregation/&lt;phenomenon&gt;/&lt;bucketId&gt;/members/&lt;recordId&gt;  live alerts
 * aggregationCounts/&lt;phenomenon&gt;/&lt;bucketId&gt;/counter        live alert count
 * lastCleanupTimestamp, lastNumOfDeletedAlerts              last sweep statistics
 * </pre>
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code alerts.forms.root} - raw form namespace</li>
 * <li>{@code alerts.aggregation.members-root} - bucket namespace</li>
 * <li>{@code alerts.aggregation.counts-root} - counter namespace</li>
 * <li>{@code alerts.retention.window-millis} - retention window (default 24h)</li>
 * <li>{@code alerts.display-zone} - zone used to render the member display time</li>
 * <li>{@code alerts.sweep.last-cleanup-key}, {@code alerts.sweep.last-deleted-key} - sweep statistic keys</li>
 * </ul>
 */
@ApplicationScoped
public class AggregationConfig {

    public static final long DEFAULT_RETENTION_WINDOW_MILLIS = 86_400_000L;

    private final String formsRoot;
    private final String membersRoot;
    private final String countsRoot;
    private final long retentionWindowMillis;
    private final ZoneId displayZone;
    private final String lastCleanupKey;
    private final String lastDeletedKey;

    @Inject
    public AggregationConfig(@ConfigProperty(
            name = "alerts.forms.root",
            defaultValue = "alertForms") String formsRoot,
            @ConfigProperty(
                    name = "alerts.aggregation.members-root",
                    defaultValue = "aggregation") String membersRoot,
            @ConfigProperty(
                    name = "alerts.aggregation.counts-root",
                    defaultValue = "aggregationCounts") String countsRoot,
            @ConfigProperty(
                    name = "alerts.retention.window-millis",
                    defaultValue = "86400000") long retentionWindowMillis,
            @ConfigProperty(
                    name = "alerts.display-zone",
                    defaultValue = "Europe/Athens") String displayZone,
            @ConfigProperty(
                    name = "alerts.sweep.last-cleanup-key",
                    defaultValue = "lastCleanupTimestamp") String lastCleanupKey,
            @ConfigProperty(
                    name = "alerts.sweep.last-deleted-key",
                    defaultValue = "lastNumOfDeletedAlerts") String lastDeletedKey) {
        if (retentionWindowMillis <= 0) {
            throw new IllegalArgumentException("alerts.retention.window-millis must be positive");
        }
        this.formsRoot = StorePaths.join(formsRoot);
        this.membersRoot = StorePaths.join(membersRoot);
        this.countsRoot = StorePaths.join(countsRoot);
        this.retentionWindowMillis = retentionWindowMillis;
        this.displayZone = ZoneId.of(displayZone);
        this.lastCleanupKey = StorePaths.join(lastCleanupKey);
        this.lastDeletedKey = StorePaths.join(lastDeletedKey);
    }

    /**
     * Returns a configuration with every property at its default value.
     */
    public static AggregationConfig defaults() {
        return new AggregationConfig("alertForms", "aggregation", "aggregationCounts",
                DEFAULT_RETENTION_WINDOW_MILLIS, "Europe/Athens", "lastCleanupTimestamp", "lastNumOfDeletedAlerts");
    }

    public String formsRoot() {
        return formsRoot;
    }

    public String membersRoot() {
        return membersRoot;
    }

    public String countsRoot() {
        return countsRoot;
    }

    public long retentionWindowMillis() {
        return retentionWindowMillis;
    }

    public ZoneId displayZone() {
        return displayZone;
    }

    public String lastCleanupKey() {
        return lastCleanupKey;
    }

    public String lastDeletedKey() {
        return lastDeletedKey;
    }
}
