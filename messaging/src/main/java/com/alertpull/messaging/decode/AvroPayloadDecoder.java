/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.decode;

import com.alertpull.common.exception.DecodeException;
import org.apache.avro.AvroRuntimeException;
import org.apache.avro.Schema;
import org.apache.avro.file.DataFileStream;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericEnumSymbol;
import org.apache.avro.generic.GenericFixed;
import org.apache.avro.generic.GenericRecord;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes payloads that are an Avro object container file carrying the writer schema,
 * the format ZTF alerts are published in. The first record in the container is the alert.
 *
 * <p>Records become ordered maps keyed by field name, strings become {@link String},
 * arrays become lists, {@code bytes} and {@code fixed} become {@code byte[]}, enums
 * become their symbol.</p>
 */
public class AvroPayloadDecoder implements PayloadDecoder {

    @Override
    public Map<String, Object> decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new DecodeException("Empty payload");
        }
        try (DataFileStream<GenericRecord> stream =
                     new DataFileStream<>(new ByteArrayInputStream(payload), new GenericDatumReader<>())) {
            if (!stream.hasNext()) {
                throw new DecodeException("Avro container holds no records");
            }
            return toMap(stream.next());
        } catch (IOException | AvroRuntimeException e) {
            throw new DecodeException("Malformed Avro payload: " + e.getMessage(), e);
        }
    }

    static Map<String, Object> toMap(GenericRecord record) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Schema.Field field : record.getSchema().getFields()) {
            map.put(field.name(), toJava(record.get(field.pos())));
        }
        return map;
    }

    private static Object toJava(Object value) {
        if (value == null) return null;
        if (value instanceof GenericRecord nested) return toMap(nested);
        if (value instanceof CharSequence || value instanceof GenericEnumSymbol<?>) return value.toString();
        if (value instanceof ByteBuffer buffer) {
            ByteBuffer copy = buffer.duplicate();
            byte[] bytes = new byte[copy.remaining()];
            copy.get(bytes);
            return bytes;
        }
        if (value instanceof GenericFixed fixed) return fixed.bytes().clone();
        if (value instanceof Collection<?> items) {
            List<Object> list = new ArrayList<>(items.size());
            for (Object item : items) list.add(toJava(item));
            return list;
        }
        if (value instanceof Map<?, ?> entries) {
            Map<String, Object> map = new LinkedHashMap<>();
            entries.forEach((k, v) -> map.put(String.valueOf(k), toJava(v)));
            return map;
        }
        return value;
    }
}
