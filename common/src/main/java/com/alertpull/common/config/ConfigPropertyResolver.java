/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.common.config;

import com.alertpull.common.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code ${key}} and {@code ${key:defaultValue}} placeholders in configuration values
 * using a waterfall:
 *
 * <ol>
 *   <li><strong>JVM system properties</strong> ({@code -Dkey=value})</li>
 *   <li><strong>The property map</strong> the resolver was built over</li>
 *   <li><strong>Environment variables</strong></li>
 *   <li><strong>Default value</strong> after the colon: {@code ${key:defaultValue}}</li>
 *   <li>Otherwise a {@link ConfigurationException}</li>
 * </ol>
 *
 * <p>Use {@code \:} for a literal colon inside a default, e.g.
 * {@code ${alertpull.broker.uri:amqp\://localhost\:5672}}.</p>
 */
public class ConfigPropertyResolver {

    private static final Logger log = LoggerFactory.getLogger(ConfigPropertyResolver.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

    private final Map<String, String> properties;

    public ConfigPropertyResolver(Map<String, String> properties) {
        this.properties = properties != null ? properties : Map.of();
    }

    /**
     * Resolve every placeholder in {@code value}. Values without a placeholder are returned as is.
     *
     * @throws ConfigurationException if a placeholder has no source and no default
     */
    public String resolve(String value) {
        if (value == null || !value.contains("${")) return value;

        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(resolveExpression(matcher.group(1))));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private String resolveExpression(String expr) {
        String key;
        String defaultValue = null;
        int colonIdx = findUnescapedColon(expr);
        if (colonIdx >= 0) {
            key = expr.substring(0, colonIdx).trim();
            defaultValue = unescape(expr.substring(colonIdx + 1));
        } else {
            key = expr.trim();
        }

        String val = System.getProperty(key);
        if (val != null) {
            log.debug("Resolved ${{{}}} from JVM system property", key);
            return val;
        }
        val = properties.get(key);
        if (val != null && !val.contains("${")) {
            log.debug("Resolved ${{{}}} from configuration", key);
            return val;
        }
        val = System.getenv(key);
        if (val != null) {
            log.debug("Resolved ${{{}}} from environment variable", key);
            return val;
        }
        if (defaultValue != null) {
            log.debug("Resolved ${{{}}} using default: {}", key, defaultValue);
            return defaultValue;
        }
        throw new ConfigurationException("Cannot resolve configuration placeholder ${" + key + "}. "
                + "Provide it as -D" + key + "=value, a configuration entry, an environment variable, "
                + "or an inline default ${" + key + ":defaultValue}");
    }

    private int findUnescapedColon(String expr) {
        for (int i = 0; i < expr.length(); i++) {
            if (expr.charAt(i) == ':' && (i == 0 || expr.charAt(i - 1) != '\\')) {
                return i;
            }
        }
        return -1;
    }

    private String unescape(String value) {
        return value.replace("\\:", ":");
    }
}
