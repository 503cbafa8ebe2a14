/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.filter;

import com.alertpull.common.exception.ConfigurationException;
import com.alertpull.server.engine.CallbackResult;
import com.alertpull.server.engine.UserCallback;

import java.util.Locale;
import java.util.Map;

/**
 * Keeps records whose numeric field lies on one side of a threshold. Records on the
 * other side are acknowledged but excluded from the results.
 *
 * <p>The field is looked up at the root of the record first; a dotted name such as
 * {@code candidate.classtar} walks nested objects when the record was not projected.</p>
 */
public class ThresholdFilter implements UserCallback {

    public enum Direction {
        /** keep {@code value < threshold} */
        LT,
        /** keep {@code value >= threshold} */
        GT;

        public static Direction parse(String value) {
            if (value == null || value.isBlank()) return LT;
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown filter direction '" + value + "' (expected lt or gt)", e);
            }
        }
    }

    public static final String DEFAULT_FIELD = "classtar";

    private final String field;
    private final Double threshold;
    private final Direction direction;

    public ThresholdFilter(String field, Double threshold, Direction direction) {
        this.field = field != null && !field.isBlank() ? field : DEFAULT_FIELD;
        this.threshold = threshold;
        this.direction = direction != null ? direction : Direction.LT;
    }

    @Override
    public CallbackResult process(Map<String, Object> record, Map<String, Object> context) {
        if (threshold == null) return CallbackResult.acceptUnchanged();
        double value = numericValue(record);
        boolean keep = direction == Direction.LT ? value < threshold : value >= threshold;
        return keep ? CallbackResult.acceptUnchanged() : CallbackResult.exclude();
    }

    private double numericValue(Map<String, Object> record) {
        Object value = record.get(field);
        if (value == null && field.contains(".")) {
            Object current = record;
            for (String part : field.split("\\.")) {
                current = current instanceof Map<?, ?> map ? map.get(part) : null;
            }
            value = current;
        }
        if (value instanceof Number number) return number.doubleValue();
        throw new IllegalArgumentException("Field '" + field + "' is missing or not numeric: " + value);
    }

    public String getField() { return field; }
    public Double getThreshold() { return threshold; }
    public Direction getDirection() { return direction; }
}
