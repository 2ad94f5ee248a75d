package service;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 하나의 락으로 전체 맵을 보호하는 메모리 저장소.
 * 만료는 조회 시점에만 처리합니다 (백그라운드 정리 없음).
 */
@Slf4j
public class InMemoryStorageService implements StorageService {

    private final Map<String, StoreEntry> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final TimeSource timeSource;

    public InMemoryStorageService() {
        this(TimeSource.SYSTEM);
    }

    public InMemoryStorageService(TimeSource timeSource) {
        this.timeSource = timeSource;
    }

    @Override
    public void set(String key, String value) {
        put(key, new StoreEntry(value, null));
        log.debug("Stored: {}", key);
    }

    @Override
    public void setWithExpiry(String key, String value, long expiresAtMillis) {
        put(key, new StoreEntry(value, expiresAtMillis));
        log.debug("Stored with expiry: {} (expires at: {})", key, expiresAtMillis);
    }

    private void put(String key, StoreEntry entry) {
        lock.lock();
        try {
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String get(String key) {
        boolean expired = false;
        String value = null;

        lock.lock();
        try {
            StoreEntry entry = entries.get(key);
            if (entry != null) {
                if (entry.isExpired(timeSource.currentTimeMillis())) {
                    entries.remove(key);
                    expired = true;
                } else {
                    value = entry.getValue();
                }
            }
        } finally {
            lock.unlock();
        }

        if (expired) {
            log.debug("Key expired and removed: {}", key);
        }
        return value;
    }

    @Override
    public boolean remove(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long now() {
        return timeSource.currentTimeMillis();
    }
}
