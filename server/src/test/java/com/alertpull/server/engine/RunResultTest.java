/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.engine;

import com.alertpull.common.util.JsonUtil;
import com.alertpull.server.policy.TerminationReason;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RunResultTest {

    @Test
    void serializesWithSnakeCaseNames() {
        RunResult result = new RunResult("subs/ztf", 1, 3, TerminationReason.MAX_RESULTS, 250,
                List.of(Map.of("objectId", "ZTF1")));

        String json = JsonUtil.toJson(result);

        assertThat(json).contains("\"accepted_count\":1", "\"receipts\":3",
                "\"termination_reason\":\"MAX_RESULTS\"", "\"elapsed_ms\":250", "\"objectId\":\"ZTF1\"");
        assertThat(result.elapsed()).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void uncollectedRunOmitsResults() {
        RunResult result = new RunResult("subs/ztf", 0, 0, TerminationReason.IDLE_TIMEOUT, 1000, null);

        assertThat(result.isCollected()).isFalse();
        assertThat(JsonUtil.toJson(result)).doesNotContain("results");
    }
}
