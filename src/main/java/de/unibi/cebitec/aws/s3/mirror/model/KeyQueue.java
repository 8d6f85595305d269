package de.unibi.cebitec.aws.s3.mirror.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO of keys between one producer and many consumers. {@link #put(String)} blocks while the queue is full,
 * {@link #take()} blocks while it is empty and still open. Every key handed to {@link #put(String)} is returned by
 * exactly one {@link #take()} call, unless the queue is aborted first.
 */
public class KeyQueue {
    private final int capacity;
    private final Deque<String> keys;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = this.lock.newCondition();
    private final Condition notFull = this.lock.newCondition();
    private boolean closed;

    public KeyQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.keys = new ArrayDeque<>(capacity);
    }

    /**
     * @return false if the queue was closed before the key could be added
     */
    public boolean put(String key) throws InterruptedException {
        this.lock.lockInterruptibly();
        try {
            while (this.keys.size() == this.capacity && !this.closed) {
                this.notFull.await();
            }
            if (this.closed) {
                return false;
            }
            this.keys.addLast(key);
            this.notEmpty.signal();
            return true;
        } finally {
            this.lock.unlock();
        }
    }

    /**
     * @return the next key, or null once the queue is closed and drained
     */
    public String take() throws InterruptedException {
        this.lock.lockInterruptibly();
        try {
            while (this.keys.isEmpty() && !this.closed) {
                this.notEmpty.await();
            }
            String key = this.keys.pollFirst();
            if (key != null) {
                this.notFull.signal();
            }
            return key;
        } finally {
            this.lock.unlock();
        }
    }

    /**
     * No more keys will be added. Keys already queued are still handed out.
     */
    public void close() {
        this.lock.lock();
        try {
            this.closed = true;
            this.notEmpty.signalAll();
            this.notFull.signalAll();
        } finally {
            this.lock.unlock();
        }
    }

    /**
     * Closes the queue and discards every pending key.
     *
     * @return number of discarded keys
     */
    public int abort() {
        this.lock.lock();
        try {
            int discarded = this.keys.size();
            this.keys.clear();
            this.closed = true;
            this.notEmpty.signalAll();
            this.notFull.signalAll();
            return discarded;
        } finally {
            this.lock.unlock();
        }
    }

    public boolean isClosed() {
        this.lock.lock();
        try {
            return this.closed;
        } finally {
            this.lock.unlock();
        }
    }

    public int size() {
        this.lock.lock();
        try {
            return this.keys.size();
        } finally {
            this.lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }
}
