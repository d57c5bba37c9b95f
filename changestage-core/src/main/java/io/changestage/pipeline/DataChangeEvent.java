/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.pipeline;

import org.apache.kafka.connect.source.SourceRecord;

import io.changestage.util.ApproximateStructSizeCalculator;

/**
 * A {@link ChangeEvent} carrying a Kafka Connect {@link SourceRecord} as its payload.
 */
public class DataChangeEvent implements ChangeEvent {

    private final SourceRecord record;
    private final long commitSequence;
    private final long startSequence;

    public DataChangeEvent(SourceRecord record, long commitSequence, long startSequence) {
        this.record = record;
        this.commitSequence = commitSequence;
        this.startSequence = startSequence;
    }

    public SourceRecord getRecord() {
        return record;
    }

    @Override
    public long commitSequence() {
        return commitSequence;
    }

    @Override
    public long startSequence() {
        return startSequence;
    }

    @Override
    public long objectSize() {
        return ApproximateStructSizeCalculator.getApproximateRecordSize(record);
    }

    @Override
    public String toString() {
        return "DataChangeEvent [commitSequence=" + commitSequence + ", startSequence=" + startSequence + ", record=" + record + "]";
    }
}
