/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.kafka.connect.data.Decimal;
import org.apache.kafka.connect.data.Schema;
import org.apache.kafka.connect.data.SchemaBuilder;
import org.apache.kafka.connect.data.Struct;
import org.apache.kafka.connect.source.SourceRecord;
import org.junit.jupiter.api.Test;

public class ApproximateStructSizeCalculatorTest {

    private static final Schema KEY_SCHEMA = SchemaBuilder.struct()
            .field("id", Schema.INT32_SCHEMA)
            .build();

    private static final Schema VALUE_SCHEMA = SchemaBuilder.struct()
            .field("id", Schema.INT32_SCHEMA)
            .field("name", Schema.OPTIONAL_STRING_SCHEMA)
            .field("payload", Schema.OPTIONAL_BYTES_SCHEMA)
            .build();

    @Test
    public void shouldEstimateStringValue() {
        SourceRecord record = new SourceRecord(Collections.emptyMap(), Collections.emptyMap(), "t", null,
                null, null, Schema.STRING_SCHEMA, "hello");

        // timestamp + empty string + 5 characters + topic
        assertThat(ApproximateStructSizeCalculator.getApproximateRecordSize(record)).isEqualTo(8 + 56 + 5 + 1);
    }

    @Test
    public void shouldEstimateStructKeyAndValue() {
        Struct key = new Struct(KEY_SCHEMA).put("id", 1);
        Struct value = new Struct(VALUE_SCHEMA)
                .put("id", 1)
                .put("name", "abc")
                .put("payload", new byte[]{ 1, 2, 3, 4 });
        SourceRecord record = new SourceRecord(Map.of("server", "server1"), Map.of("scn", 42L), "server1.inventory.orders", null,
                KEY_SCHEMA, key, VALUE_SCHEMA, value);

        long keySize = 56 + 8 + 24;
        long valueSize = 56 + (8 + 24) + (8 + 56 + 3) + (8 + 24 + 4);
        assertThat(ApproximateStructSizeCalculator.getApproximateRecordSize(record))
                .isEqualTo(100 + 100 + 8 + keySize + valueSize + 24);
    }

    @Test
    public void shouldNotChargeNullFields() {
        Struct value = new Struct(VALUE_SCHEMA).put("id", 1);
        SourceRecord record = new SourceRecord(null, null, "t", null, null, null, VALUE_SCHEMA, value);

        assertThat(ApproximateStructSizeCalculator.getApproximateRecordSize(record)).isEqualTo(8 + 56 + (8 + 24) + 8 + 8 + 1);
    }

    @Test
    public void shouldChargeHeaders() {
        SourceRecord record = new SourceRecord(null, null, "t", null, null, null, Schema.STRING_SCHEMA, "");
        long withoutHeaders = ApproximateStructSizeCalculator.getApproximateRecordSize(record);
        record.headers().addString("op", "c");

        assertThat(ApproximateStructSizeCalculator.getApproximateRecordSize(record)).isEqualTo(withoutHeaders + 100);
    }

    @Test
    public void shouldEstimateBytesBackedLogicalTypes() {
        Schema decimal = Decimal.schema(2);
        SourceRecord fromDecimal = new SourceRecord(null, null, "t", null, null, null, decimal, new BigDecimal("12.34"));
        SourceRecord fromBuffer = new SourceRecord(null, null, "t", null, null, null, Schema.BYTES_SCHEMA,
                ByteBuffer.wrap(new byte[]{ 1, 2, 3, 4, 5 }));

        assertThat(ApproximateStructSizeCalculator.getApproximateRecordSize(fromDecimal)).isEqualTo(8 + 24 + 5 + 1);
        assertThat(ApproximateStructSizeCalculator.getApproximateRecordSize(fromBuffer)).isEqualTo(8 + 24 + 5 + 1);
    }

    @Test
    public void shouldEstimateArraysAndMaps() {
        Schema arraySchema = SchemaBuilder.array(Schema.INT64_SCHEMA).build();
        Schema mapSchema = SchemaBuilder.map(Schema.STRING_SCHEMA, Schema.INT32_SCHEMA).build();
        SourceRecord array = new SourceRecord(null, null, "t", null, null, null, arraySchema, List.of(1L, 2L));
        SourceRecord map = new SourceRecord(null, null, "t", null, null, null, mapSchema, Map.of("a", 1));

        assertThat(ApproximateStructSizeCalculator.getApproximateRecordSize(array)).isEqualTo(8 + 64 + 2 * (8 + 24) + 1);
        assertThat(ApproximateStructSizeCalculator.getApproximateRecordSize(map)).isEqualTo(8 + 88 + 16 + (56 + 1) + 24 + 1);
    }
}
