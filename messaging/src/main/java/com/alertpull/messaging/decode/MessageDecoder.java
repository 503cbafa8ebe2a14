/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.decode;

import com.alertpull.common.exception.DecodeException;
import com.alertpull.messaging.core.ReceivedMessage;

import java.util.*;

/**
 * Decodes message payloads into records, lightens records to a {@link FieldSpec}, and
 * pulls delivery metadata out of a message. Stateless; one instance can serve any
 * number of streams.
 */
public class MessageDecoder {

    public static final String MESSAGE_ID = "message_id";
    public static final String PUBLISH_TIME = "publish_time";
    public static final String ATTRIBUTES = "attributes";

    /** Everything the transport reports about a delivery. */
    public static final Set<String> ALL_METADATA =
            Collections.unmodifiableSet(new LinkedHashSet<>(List.of(MESSAGE_ID, PUBLISH_TIME, ATTRIBUTES)));

    private final PayloadDecoder payloadDecoder;

    public MessageDecoder() {
        this(new JsonPayloadDecoder());
    }

    public MessageDecoder(PayloadDecoder payloadDecoder) {
        this.payloadDecoder = Objects.requireNonNull(payloadDecoder, "payloadDecoder");
    }

    /**
     * @throws DecodeException if the payload is malformed
     */
    public Map<String, Object> decode(byte[] payload) {
        return payloadDecoder.decode(payload);
    }

    /**
     * Keep only the fields named by {@code spec}, flattened into one map.
     *
     * @throws DecodeException if a requested field or group is missing, or a group is not an object
     */
    public Map<String, Object> project(Map<String, Object> record, FieldSpec spec) {
        Map<String, Object> projected = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> group : spec.groups().entrySet()) {
            Map<?, ?> source;
            if (FieldSpec.isTopLevel(group.getKey())) {
                source = record;
            } else {
                Object nested = record.get(group.getKey());
                if (!(nested instanceof Map<?, ?> nestedMap)) {
                    throw new DecodeException("Group '" + group.getKey() + "' is "
                            + (nested == null ? "missing" : "not an object"));
                }
                source = nestedMap;
            }
            for (String field : group.getValue()) {
                if (!source.containsKey(field)) {
                    throw new DecodeException("Missing field '" + field + "' in group '" + group.getKey() + "'");
                }
                projected.put(field, source.get(field));
            }
        }
        return projected;
    }

    /**
     * Whitelisted delivery metadata, every value rendered as a string.
     *
     * <p>{@value #MESSAGE_ID} and {@value #PUBLISH_TIME} (ISO-8601) come from the delivery;
     * {@value #ATTRIBUTES} copies every origin attribute as {@code attributes.<name>}; any
     * other key is looked up among the origin attributes. Keys with no value are left out.</p>
     */
    public Map<String, String> extractMetadata(ReceivedMessage message, Collection<String> whitelist) {
        Map<String, String> metadata = new LinkedHashMap<>();
        Map<String, String> attributes = message.attributes() != null ? message.attributes() : Map.of();
        for (String key : whitelist) {
            switch (key) {
                case MESSAGE_ID -> putIfPresent(metadata, key, message.messageId());
                case PUBLISH_TIME -> putIfPresent(metadata, key, message.publishTime());
                case ATTRIBUTES -> new TreeMap<>(attributes)
                        .forEach((k, v) -> putIfPresent(metadata, ATTRIBUTES + "." + k, v));
                default -> putIfPresent(metadata, key, attributes.get(key));
            }
        }
        return metadata;
    }

    private static void putIfPresent(Map<String, String> target, String key, Object value) {
        if (value != null) target.put(key, String.valueOf(value));
    }
}
