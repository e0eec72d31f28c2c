package net.cadence.core.service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/** handlerId → handler. 쓰기: 등록, 읽기: 실행기 */
public final class JobRegistry {
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, JobHandler> handlers = new HashMap<>();

    /** @return 기존에 바인딩돼 있던 핸들러, 없으면 null */
    public JobHandler register(String handlerId, JobHandler handler) {
        lock.writeLock().lock();
        try {
            return handlers.put(handlerId, handler);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<JobHandler> lookup(String handlerId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(handlers.get(handlerId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String handlerId) {
        return lookup(handlerId).isPresent();
    }

    public Set<String> handlerIds() {
        lock.readLock().lock();
        try {
            return Set.copyOf(handlers.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }
}
