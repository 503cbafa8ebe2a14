/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.filter;

import com.alertpull.common.exception.ConfigurationException;
import com.alertpull.server.engine.CallbackResult;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThresholdFilterTest {

    private static final Map<String, Object> STAR = Map.of("classtar", 0.98);
    private static final Map<String, Object> GALAXY = Map.of("classtar", 0.1);

    @Test
    void lessThanKeepsValuesBelowThreshold() {
        ThresholdFilter filter = new ThresholdFilter("classtar", 0.5, ThresholdFilter.Direction.LT);

        assertThat(filter.process(GALAXY, Map.of()).excluded()).isFalse();
        assertThat(filter.process(STAR, Map.of()).excluded()).isTrue();
    }

    @Test
    void greaterThanKeepsValuesAtOrAboveThreshold() {
        ThresholdFilter filter = new ThresholdFilter("classtar", 0.98, ThresholdFilter.Direction.GT);

        assertThat(filter.process(STAR, Map.of()).excluded()).isFalse();
        assertThat(filter.process(GALAXY, Map.of()).excluded()).isTrue();
    }

    @Test
    void filteredRecordsAreStillAcked() {
        CallbackResult verdict = new ThresholdFilter(null, 0.5, null).process(STAR, Map.of());

        assertThat(verdict.ack()).isTrue();
        assertThat(verdict.excluded()).isTrue();
    }

    @Test
    void noThresholdPassesEverything() {
        ThresholdFilter filter = new ThresholdFilter("classtar", null, ThresholdFilter.Direction.LT);

        assertThat(filter.process(Map.of(), Map.of()).excluded()).isFalse();
    }

    @Test
    void walksDottedPathIntoUnprojectedRecord() {
        ThresholdFilter filter = new ThresholdFilter("candidate.classtar", 0.5, ThresholdFilter.Direction.LT);

        assertThat(filter.process(Map.of("candidate", GALAXY), Map.of()).excluded()).isFalse();
        assertThat(filter.process(Map.of("candidate", STAR), Map.of()).excluded()).isTrue();
    }

    @Test
    void missingOrNonNumericFieldFails() {
        ThresholdFilter filter = new ThresholdFilter("classtar", 0.5, ThresholdFilter.Direction.LT);

        assertThatThrownBy(() -> filter.process(Map.of("classtar", "star"), Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> filter.process(Map.of(), Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parsesDirection() {
        assertThat(ThresholdFilter.Direction.parse("gt")).isEqualTo(ThresholdFilter.Direction.GT);
        assertThat(ThresholdFilter.Direction.parse(null)).isEqualTo(ThresholdFilter.Direction.LT);
        assertThatThrownBy(() -> ThresholdFilter.Direction.parse("between"))
                .isInstanceOf(ConfigurationException.class);
    }
}
