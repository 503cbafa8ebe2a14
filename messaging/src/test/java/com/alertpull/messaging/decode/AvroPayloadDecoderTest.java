/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.decode;

import com.alertpull.common.exception.ConfigurationException;
import com.alertpull.common.exception.DecodeException;
import org.apache.avro.Schema;
import org.apache.avro.file.DataFileWriter;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.generic.GenericRecordBuilder;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AvroPayloadDecoderTest {

    private static Schema alertSchema;

    private final AvroPayloadDecoder decoder = new AvroPayloadDecoder();

    @BeforeAll
    static void loadSchema() throws IOException {
        try (InputStream in = AvroPayloadDecoderTest.class.getResourceAsStream("/avro/ztf_alert.avsc")) {
            alertSchema = new Schema.Parser().parse(in);
        }
    }

    private static GenericRecord alert(String objectId, long candid) {
        Schema candidateSchema = alertSchema.getField("candidate").schema();
        Schema prvSchema = alertSchema.getField("prv_candidates").schema().getTypes().get(1).getElementType();
        GenericRecord candidate = new GenericRecordBuilder(candidateSchema)
                .set("jd", 2459000.5)
                .set("fid", 2)
                .set("ra", 150.25)
                .set("dec", -12.5)
                .set("magpsf", 18.5f)
                .set("sigmapsf", 0.1f)
                .set("classtar", 0.97f)
                .set("isdiffpos", new GenericData.EnumSymbol(candidateSchema.getField("isdiffpos").schema(), "t"))
                .build();
        GenericRecord previous = new GenericRecordBuilder(prvSchema)
                .set("jd", 2458990.5)
                .set("magpsf", null)
                .build();
        return new GenericRecordBuilder(alertSchema)
                .set("schemavsn", "3.3")
                .set("publisher", "ZTF (www.ztf.caltech.edu)")
                .set("objectId", objectId)
                .set("candid", candid)
                .set("candidate", candidate)
                .set("prv_candidates", List.of(previous))
                .set("cutoutScience", ByteBuffer.wrap(new byte[]{1, 2, 3}))
                .build();
    }

    private static byte[] container(GenericRecord... records) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DataFileWriter<GenericRecord> writer = new DataFileWriter<>(new GenericDatumWriter<>(alertSchema))) {
            writer.create(alertSchema, out);
            for (GenericRecord record : records) writer.append(record);
        }
        return out.toByteArray();
    }

    @Test
    void decodesAlertContainerIntoPlainJavaValues() throws IOException {
        Map<String, Object> record = decoder.decode(container(alert("ZTF21abcdefg", 1549473362115015004L)));

        assertThat(record).containsEntry("objectId", "ZTF21abcdefg")
                .containsEntry("candid", 1549473362115015004L)
                .containsEntry("schemavsn", "3.3");
        assertThat(new ArrayList<>(record.keySet())).startsWith("schemavsn", "publisher", "objectId", "candid", "candidate");

        @SuppressWarnings("unchecked")
        Map<String, Object> candidate = (Map<String, Object>) record.get("candidate");
        assertThat(candidate).containsEntry("magpsf", 18.5f)
                .containsEntry("classtar", 0.97f)
                .containsEntry("isdiffpos", "t");

        List<?> previous = (List<?>) record.get("prv_candidates");
        assertThat(previous).hasSize(1);
        assertThat((Map<String, Object>) previous.get(0)).containsEntry("jd", 2458990.5).containsEntry("magpsf", null);
        assertThat((byte[]) record.get("cutoutScience")).isEqualTo(new byte[]{1, 2, 3});
    }

    @Test
    void lightensAvroAlertsWithTheLiteSpec() throws IOException {
        MessageDecoder messageDecoder = new MessageDecoder(decoder);

        Map<String, Object> lite = messageDecoder.project(
                messageDecoder.decode(container(alert("ZTF21abcdefg", 42L))), FieldSpec.ALERT_LITE);

        assertThat(lite).containsExactly(
                Map.entry("objectId", "ZTF21abcdefg"),
                Map.entry("candid", 42L),
                Map.entry("jd", 2459000.5),
                Map.entry("ra", 150.25),
                Map.entry("dec", -12.5),
                Map.entry("magpsf", 18.5f),
                Map.entry("classtar", 0.97f));
    }

    @Test
    void firstRecordOfTheContainerIsTheAlert() throws IOException {
        Map<String, Object> record = decoder.decode(container(alert("ZTF21first", 1L), alert("ZTF21second", 2L)));

        assertThat(record).containsEntry("objectId", "ZTF21first");
    }

    @Test
    void malformedPayloadsFailWithDecodeException() throws IOException {
        byte[] valid = container(alert("ZTF21abcdefg", 1L));

        assertThatThrownBy(() -> decoder.decode("{\"objectId\":\"x\"}".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("Malformed Avro");
        assertThatThrownBy(() -> decoder.decode(Arrays.copyOf(valid, valid.length / 2)))
                .isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> decoder.decode(container()))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("no records");
        assertThatThrownBy(() -> decoder.decode(new byte[0])).isInstanceOf(DecodeException.class);
    }

    @Test
    void payloadFormatSelectsTheDecoder() {
        assertThat(PayloadFormat.parse("avro").newDecoder()).isInstanceOf(AvroPayloadDecoder.class);
        assertThat(PayloadFormat.parse(" JSON ").newDecoder()).isInstanceOf(JsonPayloadDecoder.class);
        assertThat(PayloadFormat.parse(null)).isEqualTo(PayloadFormat.JSON);
        assertThatThrownBy(() -> PayloadFormat.parse("protobuf"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("protobuf");
    }
}
