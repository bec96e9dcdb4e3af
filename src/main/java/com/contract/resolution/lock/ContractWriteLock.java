package com.contract.resolution.lock;

/**
 * Serializes writers of one contract.
 */
public interface ContractWriteLock {

    /**
     * Acquires the write lock for a contract.
     *
     * @throws LockAcquisitionException if the lock is not acquired within the configured timeout
     */
    void lock(String contractId);

    /**
     * Releases the write lock held by the current thread, if any.
     */
    void unlock(String contractId);
}
