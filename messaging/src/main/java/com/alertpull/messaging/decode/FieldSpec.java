/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.decode;

import java.util.*;

/**
 * Field whitelist used to lighten a record: {@code {groupName: [fieldName, ...]}}.
 *
 * <p>The {@value #TOP_LEVEL} group (alias {@code top-level}) selects root fields; any
 * other group selects fields nested one level under the root field of the same name.
 * Groups and fields keep their declaration order.</p>
 */
public final class FieldSpec {

    public static final String TOP_LEVEL = "top";
    private static final String TOP_LEVEL_ALIAS = "top-level";

    /** The light alert shape: identifiers plus the candidate's position, time, magnitude and star score. */
    public static final FieldSpec ALERT_LITE = FieldSpec.builder()
            .top("objectId", "candid")
            .group("candidate", "jd", "ra", "dec", "magpsf", "classtar")
            .build();

    private final Map<String, List<String>> groups;

    private FieldSpec(Map<String, List<String>> groups) {
        this.groups = Collections.unmodifiableMap(groups);
    }

    /**
     * Build from the map form. Insertion order of {@code spec} is preserved.
     */
    public static FieldSpec of(Map<String, ? extends Collection<String>> spec) {
        Builder b = builder();
        spec.forEach((group, fields) -> b.group(group, fields.toArray(new String[0])));
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, List<String>> groups() {
        return groups;
    }

    static boolean isTopLevel(String group) {
        return TOP_LEVEL.equals(group) || TOP_LEVEL_ALIAS.equals(group);
    }

    @Override
    public String toString() {
        return "FieldSpec" + groups;
    }

    public static final class Builder {
        private final Map<String, List<String>> groups = new LinkedHashMap<>();

        public Builder top(String... fields) {
            return group(TOP_LEVEL, fields);
        }

        public Builder group(String name, String... fields) {
            groups.computeIfAbsent(name, k -> new ArrayList<>()).addAll(Arrays.asList(fields));
            return this;
        }

        public FieldSpec build() {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            groups.forEach((k, v) -> copy.put(k, List.copyOf(v)));
            return new FieldSpec(copy);
        }
    }
}
