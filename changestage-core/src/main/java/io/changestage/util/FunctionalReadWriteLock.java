/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.util;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * A read-write lock whose shared and exclusive sections are passed in as lambdas, so that acquiring and
 * releasing can never get out of balance.
 *
 * @author Randall Hauch
 */
public class FunctionalReadWriteLock {

    /**
     * Create a read-write lock that supports reentrancy.
     * @return the functional read-write lock; never null
     */
    public static FunctionalReadWriteLock reentrant() {
        return create(new ReentrantReadWriteLock());
    }

    /**
     * Create a read-write lock around the given standard {@link ReadWriteLock}.
     * @param lock the standard lock; may not be null
     * @return the functional read-write lock; never null
     */
    public static FunctionalReadWriteLock create(ReadWriteLock lock) {
        assert lock != null;
        return new FunctionalReadWriteLock(lock);
    }

    private final ReadWriteLock lock;

    protected FunctionalReadWriteLock(ReadWriteLock lock) {
        this.lock = lock;
    }

    /**
     * Run the operation while holding the shared lock.
     *
     * @param operation the operation to perform while the read lock is held; may not be null
     * @return the result of the operation
     */
    public <T> T read(Supplier<T> operation) {
        lock.readLock().lock();
        try {
            return operation.get();
        }
        finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Run the operation while holding the exclusive lock.
     *
     * @param operation the operation to perform while the write lock is held; may not be null
     * @return the result of the operation
     */
    public <T> T write(Supplier<T> operation) {
        lock.writeLock().lock();
        try {
            return operation.get();
        }
        finally {
            lock.writeLock().unlock();
        }
    }
}
