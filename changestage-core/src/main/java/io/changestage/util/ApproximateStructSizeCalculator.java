/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.util;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.apache.kafka.connect.data.Field;
import org.apache.kafka.connect.data.Schema;
import org.apache.kafka.connect.data.Struct;
import org.apache.kafka.connect.source.SourceRecord;

/**
 * Estimates how many heap bytes a change record occupies while it sits in the staging cache. Schemas are
 * not counted since they are shared between records of the same table.
 */
public class ApproximateStructSizeCalculator {

    private static final int EMPTY_STRUCT_SIZE = 56;
    private static final int EMPTY_STRING_SIZE = 56;
    private static final int EMPTY_BYTES_SIZE = 24;
    private static final int EMPTY_ARRAY_SIZE = 64;
    private static final int EMPTY_MAP_SIZE = 88;
    private static final int EMPTY_PRIMITIVE = 24;
    private static final int REFERENCE_SIZE = 8;
    private static final int ENTRY_SIZE = 100;

    private ApproximateStructSizeCalculator() {
    }

    public static long getApproximateRecordSize(SourceRecord record) {
        long value = (long) entryCount(record.sourcePartition()) * ENTRY_SIZE
                + (long) entryCount(record.sourceOffset()) * ENTRY_SIZE
                + (long) record.headers().size() * ENTRY_SIZE;
        value += 8; // timestamp

        return value + getKeyOrValueSize(record.keySchema(), record.key()) + getKeyOrValueSize(record.valueSchema(), record.value())
                + record.topic().getBytes(StandardCharsets.UTF_8).length;
    }

    private static int entryCount(Map<String, ?> map) {
        return map != null ? map.size() : 0;
    }

    private static long getKeyOrValueSize(Schema schema, Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Struct) {
            return getStructSize((Struct) value);
        }
        return schema != null ? getValueSize(schema, value) : EMPTY_PRIMITIVE;
    }

    private static long getStructSize(Struct struct) {
        if (struct == null) {
            return 0;
        }
        long size = EMPTY_STRUCT_SIZE;
        for (Field field : struct.schema().fields()) {
            size += REFERENCE_SIZE;
            size += getValueSize(field.schema(), struct.getWithoutDefault(field.name()));
        }
        return size;
    }

    @SuppressWarnings("unchecked")
    private static long getValueSize(Schema schema, Object value) {
        if (value == null) {
            return 0;
        }
        switch (schema.type()) {
            case BOOLEAN:
            case INT8:
            case INT16:
            case FLOAT32:
            case INT32:
            case FLOAT64:
            case INT64:
                return EMPTY_PRIMITIVE;
            case STRING:
                return EMPTY_STRING_SIZE + ((String) value).getBytes(StandardCharsets.UTF_8).length;
            case BYTES:
                return EMPTY_BYTES_SIZE + getBytesLength(value);
            case STRUCT:
                return getStructSize((Struct) value);
            case ARRAY:
                return getArraySize(schema.valueSchema(), (List<Object>) value);
            case MAP:
                return getMapSize(schema.keySchema(), schema.valueSchema(), (Map<Object, Object>) value);
            default:
                return 0L;
        }
    }

    // logical types such as Decimal keep a non-byte[] value behind a BYTES schema
    private static long getBytesLength(Object value) {
        if (value instanceof byte[]) {
            return ((byte[]) value).length;
        }
        if (value instanceof ByteBuffer) {
            return ((ByteBuffer) value).remaining();
        }
        return value.toString().length();
    }

    private static long getArraySize(Schema elementSchema, List<Object> array) {
        long size = EMPTY_ARRAY_SIZE;
        for (Object element : array) {
            size += REFERENCE_SIZE;
            size += getValueSize(elementSchema, element);
        }
        return size;
    }

    private static long getMapSize(Schema keySchema, Schema valueSchema, Map<Object, Object> map) {
        long size = EMPTY_MAP_SIZE;
        for (Map.Entry<Object, Object> entry : map.entrySet()) {
            size += REFERENCE_SIZE * 2;
            size += getValueSize(keySchema, entry.getKey());
            size += getValueSize(valueSchema, entry.getValue());
        }
        return size;
    }
}
