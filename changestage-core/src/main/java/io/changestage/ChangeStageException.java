/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage;

/**
 * Base runtime exception raised by the staging cache when it is misconfigured or cannot expose its
 * metrics.
 */
public class ChangeStageException extends RuntimeException {

    private static final long serialVersionUID = 4376402511837622117L;

    public ChangeStageException(String message) {
        super(message);
    }

    public ChangeStageException(Throwable cause) {
        super(cause);
    }

    public ChangeStageException(String message, Throwable cause) {
        super(message, cause);
    }
}
