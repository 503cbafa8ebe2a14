/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.engine;

import com.alertpull.messaging.decode.FieldSpec;
import com.alertpull.messaging.decode.MessageDecoder;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-run customisation of the message pipeline.
 */
public final class PipelineHooks {

    public static final String DEFAULT_METADATA_FIELD = "metadata";

    private final MessageDecoder decoder;
    private final FieldSpec fieldSpec;
    private final Set<String> metadataKeys;
    private final String metadataField;
    private final UserCallback userCallback;
    private final Map<String, Object> context;
    private final boolean collect;
    private final ResultSink resultSink;

    private PipelineHooks(Builder b) {
        this.decoder = b.decoder;
        this.fieldSpec = b.fieldSpec;
        this.metadataKeys = Collections.unmodifiableSet(new LinkedHashSet<>(b.metadataKeys));
        this.metadataField = b.metadataField;
        this.userCallback = b.userCallback;
        this.context = b.context != null ? Collections.unmodifiableMap(b.context) : Map.of();
        this.collect = b.collect;
        this.resultSink = b.resultSink;
    }

    public static Builder builder() { return new Builder(); }

    /** Decode, no projection, no callback, collect results. */
    public static PipelineHooks collecting() { return builder().collect(true).build(); }

    /** Overrides the context's decoder when set. */
    public MessageDecoder getDecoder() { return decoder; }
    public FieldSpec getFieldSpec() { return fieldSpec; }
    public Set<String> getMetadataKeys() { return metadataKeys; }
    public String getMetadataField() { return metadataField; }
    public UserCallback getUserCallback() { return userCallback; }
    public Map<String, Object> getContext() { return context; }
    public boolean isCollect() { return collect; }
    public ResultSink getResultSink() { return resultSink; }

    public static final class Builder {
        private MessageDecoder decoder;
        private FieldSpec fieldSpec;
        private Collection<String> metadataKeys = Set.of();
        private String metadataField = DEFAULT_METADATA_FIELD;
        private UserCallback userCallback;
        private Map<String, Object> context;
        private boolean collect;
        private ResultSink resultSink;

        public Builder decoder(MessageDecoder decoder) { this.decoder = decoder; return this; }
        public Builder fieldSpec(FieldSpec fieldSpec) { this.fieldSpec = fieldSpec; return this; }
        public Builder metadataKeys(Collection<String> keys) {
            this.metadataKeys = keys != null ? keys : Set.of();
            return this;
        }
        public Builder metadataField(String field) { this.metadataField = field; return this; }
        public Builder userCallback(UserCallback callback) { this.userCallback = callback; return this; }
        public Builder context(Map<String, Object> context) { this.context = context; return this; }
        public Builder collect(boolean collect) { this.collect = collect; return this; }
        public Builder resultSink(ResultSink sink) { this.resultSink = sink; return this; }

        public PipelineHooks build() {
            if (metadataField == null || metadataField.isBlank()) {
                throw new IllegalArgumentException("metadataField must not be blank");
            }
            return new PipelineHooks(this);
        }
    }
}
