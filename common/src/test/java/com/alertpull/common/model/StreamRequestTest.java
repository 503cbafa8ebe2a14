/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.common.model;

import com.alertpull.common.util.JsonUtil;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamRequestTest {

    @Test
    void readsSnakeCaseJson() {
        StreamRequest request = JsonUtil.fromJson("{\"subscription_name\":\"ztf\",\"max_results\":10,"
                + "\"timeout_seconds\":30,\"lighten\":false,\"filter_threshold\":0.5,\"filter_direction\":\"gt\"}",
                StreamRequest.class);

        assertThat(request.getSubscriptionName()).isEqualTo("ztf");
        assertThat(request.getMaxResults()).isEqualTo(10);
        assertThat(request.getTimeoutSeconds()).isEqualTo(30);
        assertThat(request.isLighten()).isFalse();
        assertThat(request.getFilterThreshold()).isEqualTo(0.5);
        assertThat(request.getFilterDirection()).isEqualTo("gt");
    }

    @Test
    void defaultsWhenFieldsAreAbsent() {
        StreamRequest request = JsonUtil.fromJson("{}", StreamRequest.class);

        assertThat(request.getMaxResults()).isNull();
        assertThat(request.getMaxBacklog()).isNull();
        assertThat(request.isLighten()).isTrue();
        assertThat(request.isSaveMetadata()).isTrue();
        assertThat(request.getFilterField()).isEqualTo("classtar");
        assertThat(request.getFilterDirection()).isEqualTo("lt");
    }

    @Test
    void malformedJsonIsRejected() {
        assertThatThrownBy(() -> JsonUtil.fromJson("{", StreamRequest.class))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
