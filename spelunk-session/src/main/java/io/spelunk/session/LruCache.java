package io.spelunk.session;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Bounded LRU (Least Recently Used) map with automatic eviction.
 *
 * <p>Not thread-safe; callers guard it with their own lock.
 *
 * @param <K> key type
 * @param <V> value type
 */
final class LruCache<K, V> {

  private final int maxSize;
  private final Map<K, V> cache;

  /**
   * Creates an LRU cache with the specified maximum size.
   *
   * @param maxSize maximum number of entries to keep
   * @param onEvict called with each entry dropped to make room
   */
  LruCache(int maxSize, BiConsumer<K, V> onEvict) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
    }
    this.maxSize = maxSize;
    // LinkedHashMap with access-order (true) for LRU behavior
    this.cache =
        new LinkedHashMap<K, V>(16, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
            if (size() > LruCache.this.maxSize) {
              onEvict.accept(eldest.getKey(), eldest.getValue());
              return true;
            }
            return false;
          }
        };
  }

  /** Returns the value for the key, or null. Accessing a key marks it as recently used. */
  V get(K key) {
    return cache.get(key);
  }

  /** Adds an entry as most recently used, evicting the eldest entry when over capacity. */
  void put(K key, V value) {
    cache.put(key, value);
  }

  int size() {
    return cache.size();
  }

  int maxSize() {
    return maxSize;
  }

  void clear() {
    cache.clear();
  }
}
