package com.contract.resolution.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process write lock: one {@link ReentrantLock} per contract id.
 */
public class LocalContractWriteLock implements ContractWriteLock {
    private static final Logger log = LoggerFactory.getLogger(LocalContractWriteLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalContractWriteLock() {
        this(LockConfig.defaults());
    }

    public LocalContractWriteLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public void lock(String contractId) {
        ReentrantLock lock = locks.computeIfAbsent(contractId, k -> new ReentrantLock(config.fair()));
        try {
            if (!lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(
                        "Failed to acquire write lock for contract '" + contractId + "' within " + config.timeoutMs() + "ms");
            }
            log.debug("Write lock acquired: {}", contractId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring write lock for contract: " + contractId, e);
        }
    }

    @Override
    public void unlock(String contractId) {
        ReentrantLock lock = locks.get(contractId);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("Write lock released: {}", contractId);
        }
    }
}
