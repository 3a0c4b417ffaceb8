package io.leadscore.engine.leads.services;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per clientId. Every job that reads, merges and writes a client's conversion rates
 * runs under that client's lock, so two jobs for the same client never interleave.
 * Jobs for different clients do not block each other.
 */
@JBossLog
@ApplicationScoped
public class ClientJobLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withClientLock(String clientId, Supplier<T> job) {
        ReentrantLock lock = locks.computeIfAbsent(clientId, id -> new ReentrantLock(true));
        if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
            log.infof("[Locks] Client %s has a job in flight, waiting", clientId);
        }
        lock.lock();
        try {
            return job.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(String clientId) {
        ReentrantLock lock = locks.get(clientId);
        return lock != null && lock.isLocked();
    }
}
