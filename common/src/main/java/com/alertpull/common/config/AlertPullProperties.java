/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.common.config;

import com.alertpull.common.exception.ConfigurationException;

import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Typed, read-only view over a flat property map for code that is not managed by Spring.
 *
 * <p>The web module copies the resolved Spring {@code Environment} into one instance at
 * startup and hands it to whatever needs it; library code and tests build their own
 * from a {@link Map} or {@link Properties}. There is no global accessor. Values may carry
 * {@code ${key:default}} placeholders; they are resolved on read by a
 * {@link ConfigPropertyResolver} over the full map, so prefix views still see every key.</p>
 *
 * <h3>Usage</h3>
 * <pre>{@code
 *   AlertPullProperties props = AlertPullProperties.of(Map.of("alertpull.stream.max-backlog", "50"));
 *   Integer backlog = props.getInteger("alertpull.stream.max-backlog");
 *   Duration idle = props.getDuration("alertpull.stream.idle-timeout", null);
 *   AlertPullProperties stream = props.withPrefix("alertpull.stream.");
 * }</pre>
 */
public final class AlertPullProperties {

    private final Map<String, String> properties;
    private final ConfigPropertyResolver resolver;

    private AlertPullProperties(Map<String, String> properties, ConfigPropertyResolver resolver) {
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.resolver = resolver != null ? resolver : new ConfigPropertyResolver(this.properties);
    }

    public static AlertPullProperties of(Map<String, String> props) {
        return new AlertPullProperties(props, null);
    }

    public static AlertPullProperties of(Properties props) {
        Map<String, String> map = new LinkedHashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return new AlertPullProperties(map, null);
    }

    public static AlertPullProperties empty() {
        return new AlertPullProperties(Map.of(), null);
    }

    // ─── Core Typed Getters ─────────────────────────────────────────

    /**
     * Resolved property value, or {@code null} if absent.
     *
     * @throws ConfigurationException if the value holds a placeholder that cannot be resolved
     */
    public String getString(String key) {
        return resolver.resolve(properties.get(key));
    }

    public String getString(String key, String defaultValue) {
        String val = getString(key);
        return val != null ? val : defaultValue;
    }

    /**
     * Integer value, or {@code null} when the key is absent or blank.
     * Used for optional bounds where "unset" is meaningful.
     *
     * @throws ConfigurationException if the value is not an integer
     */
    public Integer getInteger(String key) {
        String val = getString(key);
        if (val == null || val.isBlank()) return null;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Property '" + key + "' is not an integer: '" + val + "'", e);
        }
    }

    /**
     * Parse a duration string. Supports:
     * <ul>
     *   <li>Plain number → milliseconds</li>
     *   <li>{@code "250ms"}, {@code "30s"}, {@code "5m"}, {@code "2h"}</li>
     *   <li>ISO-8601 ({@code "PT30S"}) via {@link Duration#parse}</li>
     * </ul>
     * Absent or blank values give {@code defaultValue}.
     *
     * @throws ConfigurationException if the value is not a duration
     */
    public Duration getDuration(String key, Duration defaultValue) {
        String val = getString(key);
        if (val == null || val.isBlank()) return defaultValue;
        Duration parsed = parseDuration(val);
        if (parsed == null) {
            throw new ConfigurationException("Property '" + key + "' is not a duration: '" + val + "'");
        }
        return parsed;
    }

    /**
     * Parse a comma-separated property value into a list, trimming elements and skipping blanks.
     */
    public List<String> getList(String key) {
        String val = getString(key);
        if (val == null || val.isBlank()) return Collections.emptyList();
        return Arrays.stream(val.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    // ─── Namespace Helpers ──────────────────────────────────────────

    /**
     * All properties under a prefix as a flat map with the prefix stripped and values resolved.
     */
    public Map<String, String> getSubProperties(String prefix) {
        return properties.entrySet().stream()
                .filter(e -> e.getKey().startsWith(prefix))
                .collect(Collectors.toMap(
                        e -> e.getKey().substring(prefix.length()),
                        e -> resolver.resolve(e.getValue()),
                        (a, b) -> b,
                        LinkedHashMap::new
                ));
    }

    /**
     * A new view containing only the keys under {@code prefix}, with the prefix stripped.
     * Placeholders in the view still resolve against the full map.
     */
    public AlertPullProperties withPrefix(String prefix) {
        Map<String, String> raw = new LinkedHashMap<>();
        properties.forEach((k, v) -> {
            if (k.startsWith(prefix)) raw.put(k.substring(prefix.length()), v);
        });
        return new AlertPullProperties(raw, resolver);
    }

    public int size() {
        return properties.size();
    }

    @Override
    public String toString() {
        return "AlertPullProperties{count=" + properties.size() + "}";
    }

    static Duration parseDuration(String raw) {
        String val = raw.trim().toLowerCase(Locale.ROOT);
        try {
            if (val.startsWith("pt")) return Duration.parse(val.toUpperCase(Locale.ROOT));
            if (val.endsWith("ms")) return Duration.ofMillis(Long.parseLong(val.substring(0, val.length() - 2).trim()));
            if (val.endsWith("s"))  return Duration.ofSeconds(Long.parseLong(val.substring(0, val.length() - 1).trim()));
            if (val.endsWith("m"))  return Duration.ofMinutes(Long.parseLong(val.substring(0, val.length() - 1).trim()));
            if (val.endsWith("h"))  return Duration.ofHours(Long.parseLong(val.substring(0, val.length() - 1).trim()));
            return Duration.ofMillis(Long.parseLong(val));
        } catch (RuntimeException e) {
            return null;
        }
    }
}
