package com.example.evidenceledger.service;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Serializes ledger mutations inside this process so each one observes every earlier commit.
 * The lock is fair and reentrant: a commit may call into another committing operation.
 */
@Component
public class LedgerCommitLog {

    private final ReentrantLock lock = new ReentrantLock(true);

    public <T> T inCommit(Supplier<T> commit) {
        lock.lock();
        try {
            return commit.get();
        } finally {
            lock.unlock();
        }
    }
}
