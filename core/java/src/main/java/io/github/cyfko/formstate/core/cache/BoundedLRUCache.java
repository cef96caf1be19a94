package io.github.cyfko.formstate.core.cache;

import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Size bounded cache evicting the least recently used entry first.
 * <p>
 * Used to memoize the references scanned out of expression texts. The key space (distinct
 * expression texts of the loaded forms) is finite and entries never go stale, so a plain LRU
 * bound is all that is needed.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Reads share a read lock, writes take the write lock. Recency is tracked on a concurrent deque
 * from under the read lock, so under contention the eviction order is approximate.
 * </p>
 *
 * <pre>{@code
 * BoundedLRUCache<String, Set<Reference>> cache = new BoundedLRUCache<>(1000);
 * Set<Reference> refs = cache.computeIfAbsent(text, scanner::scan);
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BoundedLRUCache<K, V> {

    private final int maxSize;
    private final Map<K, V> entries;
    private final Deque<K> recency;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * @param maxSize maximum number of entries
     * @throws IllegalArgumentException if maxSize is not positive
     */
    public BoundedLRUCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }
        this.maxSize = maxSize;
        this.entries = new HashMap<>();
        this.recency = new ConcurrentLinkedDeque<>();
    }

    /**
     * @return the cached value, or null; a hit makes the entry the most recently used
     */
    public V get(K key) {
        lock.readLock().lock();
        try {
            V value = entries.get(key);
            if (value == null) {
                misses.incrementAndGet();
                return null;
            }
            hits.incrementAndGet();
            recency.remove(key);
            recency.addFirst(key);
            return value;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stores a value, evicting the least recently used entries beyond the bound.
     */
    public void put(K key, V value) {
        lock.writeLock().lock();
        try {
            if (entries.put(key, value) != null) {
                recency.remove(key);
            }
            recency.addFirst(key);
            while (recency.size() > maxSize) {
                entries.remove(recency.removeLast());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the cached value, computing and storing it first if absent. The mapping function
     * runs at most once per key even when called concurrently; null results are not cached.
     */
    public V computeIfAbsent(K key, Function<K, V> mappingFunction) {
        V value = get(key);
        if (value != null) {
            return value;
        }
        lock.writeLock().lock();
        try {
            value = entries.get(key);
            if (value == null) {
                value = mappingFunction.apply(key);
                if (value != null) {
                    put(key, value);
                }
            }
            return value;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
            recency.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }
}
