/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.pipeline;

/**
 * A row-level change that can be staged in the redo event cache. Events of one table are produced in
 * non-decreasing {@link #position() position} order.
 */
public interface ChangeEvent extends Sizeable {

    /**
     * @return the commit sequence of the transaction this change belongs to
     */
    long commitSequence();

    /**
     * @return the sequence at which the transaction of this change started
     */
    long startSequence();

    default Position position() {
        return Position.of(commitSequence(), startSequence());
    }
}
