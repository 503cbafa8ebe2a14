/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.decode;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FieldSpecTest {

    @Test
    void keepsDeclarationOrder() {
        Map<String, List<String>> raw = new LinkedHashMap<>();
        raw.put("candidate", List.of("ra", "dec"));
        raw.put("top", List.of("objectId"));

        FieldSpec spec = FieldSpec.of(raw);

        assertThat(spec.groups().keySet()).containsExactly("candidate", "top");
        assertThat(spec.groups().get("candidate")).containsExactly("ra", "dec");
    }

    @Test
    void builderMergesRepeatedGroups() {
        FieldSpec spec = FieldSpec.builder().top("a").group("g", "x").top("b").build();

        assertThat(spec.groups()).containsEntry("top", List.of("a", "b")).containsEntry("g", List.of("x"));
    }

    @Test
    void recognisesTopLevelNames() {
        assertThat(FieldSpec.isTopLevel("top")).isTrue();
        assertThat(FieldSpec.isTopLevel("top-level")).isTrue();
        assertThat(FieldSpec.isTopLevel("candidate")).isFalse();
    }
}
