package com.slb.chaos_engine.common.ledger;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 全局串行化锁 / Single global serialization order for every engine transition.
 * <p>
 * Each public write runs to completion under this lock before the next begins. The lock is
 * reentrant so composite entry points (claim touching the accumulator) nest freely.
 */
@Component
public class LedgerSerializer {

    private final ReentrantLock lock = new ReentrantLock(true);

    public <T> T call(Supplier<T> transition) {
        lock.lock();
        try {
            return transition.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable transition) {
        lock.lock();
        try {
            transition.run();
        } finally {
            lock.unlock();
        }
    }
}
