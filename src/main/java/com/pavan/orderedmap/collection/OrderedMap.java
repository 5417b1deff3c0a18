package com.pavan.orderedmap.collection;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * Thread-safe map that remembers insertion order.
 * A hash index gives O(1) lookup, insert and delete, while a doubly linked list
 * of {@link Node}s keeps the entries in the order their keys were first inserted.
 * Updating an existing key replaces its value without moving it.
 * <p>
 * One {@link ReentrantReadWriteLock} guards the index and the list together:
 * reads share the read lock, mutations take the write lock.
 * Null keys are rejected; null values are allowed.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class OrderedMap<K, V> {
    
    private final Map<K, Node<K, V>> index;
    private final ReadWriteLock lock;
    private Node<K, V> head; // First inserted
    private Node<K, V> tail; // Last inserted
    private int size;
    
    public OrderedMap() {
        this.index = new HashMap<>();
        this.lock = new ReentrantReadWriteLock();
    }
    
    /**
     * Inserts or updates a key-value pair.
     * A new key is appended after the current last entry; an existing key
     * keeps its position and only its value changes.
     *
     * @param key the key to insert or update
     * @param value the value to associate with the key, may be null
     * @throws IllegalArgumentException if key is null
     */
    public void put(K key, V value) {
        requireKey(key);
        lock.writeLock().lock();
        try {
            putUnlocked(key, value);
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    /**
     * Retrieves a value by key.
     *
     * @param key the key to look up
     * @return the value, or null if the key is null, absent, or mapped to null
     */
    public V get(K key) {
        if (key == null) {
            return null;
        }
        lock.readLock().lock();
        try {
            Node<K, V> node = index.get(key);
            return node == null ? null : node.getValue();
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Retrieves the entry for a key, telling an absent key apart from one mapped to null.
     *
     * @param key the key to look up
     * @return the entry, or empty if the key is null or absent
     */
    public Optional<Map.Entry<K, V>> getEntry(K key) {
        if (key == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(index.get(key)).map(OrderedMap::entryOf);
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Removes a key-value pair. Removing an absent key is a no-op.
     *
     * @param key the key to remove
     * @return true if an entry was removed
     * @throws IllegalArgumentException if key is null
     */
    public boolean remove(K key) {
        requireKey(key);
        lock.writeLock().lock();
        try {
            Node<K, V> node = index.remove(key);
            if (node == null) {
                return false;
            }
            unlinkNode(node);
            size--;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    /**
     * Checks whether a key is present.
     *
     * @param key the key to check
     * @return true if the key is present, false if absent or null
     */
    public boolean containsKey(K key) {
        if (key == null) {
            return false;
        }
        lock.readLock().lock();
        try {
            return index.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Returns the number of entries.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return size;
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public boolean isEmpty() {
        return size() == 0;
    }
    
    /**
     * Removes all entries. The map stays usable.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            clearUnlocked();
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    /**
     * Replaces the whole content with the given entries, in the given order,
     * as one write. Readers see either the old content or the new one.
     * Repeated keys behave like repeated {@link #put} calls.
     *
     * @param entries the new content
     * @throws IllegalArgumentException if any key is null; the map is then left unchanged
     */
    public void replaceWith(List<? extends Map.Entry<? extends K, ? extends V>> entries) {
        for (Map.Entry<? extends K, ? extends V> entry : entries) {
            requireKey(entry.getKey());
        }
        lock.writeLock().lock();
        try {
            clearUnlocked();
            for (Map.Entry<? extends K, ? extends V> entry : entries) {
                putUnlocked(entry.getKey(), entry.getValue());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    /**
     * Returns the keys in insertion order. The list is a copy.
     */
    public List<K> keys() {
        lock.readLock().lock();
        try {
            List<K> keys = new ArrayList<>(size);
            for (Node<K, V> node = head; node != null; node = node.next) {
                keys.add(node.getKey());
            }
            return keys;
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Returns the values in insertion order. The list is a copy.
     */
    public List<V> values() {
        lock.readLock().lock();
        try {
            List<V> values = new ArrayList<>(size);
            for (Node<K, V> node = head; node != null; node = node.next) {
                values.add(node.getValue());
            }
            return values;
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Returns immutable key-value pairs in insertion order. The list is a copy.
     */
    public List<Map.Entry<K, V>> entries() {
        lock.readLock().lock();
        try {
            List<Map.Entry<K, V>> entries = new ArrayList<>(size);
            for (Node<K, V> node = head; node != null; node = node.next) {
                entries.add(entryOf(node));
            }
            return entries;
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Visits entries in insertion order until the visitor returns false.
     * The read lock is held for the whole walk, so the visitor must not
     * modify this map: doing so deadlocks.
     *
     * @param visitor called with each key and value; return false to stop
     */
    public void forEachWhile(BiPredicate<? super K, ? super V> visitor) {
        lock.readLock().lock();
        try {
            for (Node<K, V> node = head; node != null; node = node.next) {
                if (!visitor.test(node.getKey(), node.getValue())) {
                    break;
                }
            }
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Visits every entry in insertion order. Same locking rules as {@link #forEachWhile}.
     */
    public void forEach(BiConsumer<? super K, ? super V> action) {
        forEachWhile((key, value) -> {
            action.accept(key, value);
            return true;
        });
    }
    
    /**
     * Returns the earliest inserted entry still present, or empty if the map is empty.
     */
    public Optional<Map.Entry<K, V>> first() {
        lock.readLock().lock();
        try {
            return head == null ? Optional.empty() : Optional.of(entryOf(head));
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Returns the most recently inserted entry, or empty if the map is empty.
     */
    public Optional<Map.Entry<K, V>> last() {
        lock.readLock().lock();
        try {
            return tail == null ? Optional.empty() : Optional.of(entryOf(tail));
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Creates an independent map with the same entries in the same order.
     * Values are shared, not cloned.
     */
    public OrderedMap<K, V> copy() {
        return filter((key, value) -> true);
    }
    
    /**
     * Creates a new map holding the same entries, last inserted first.
     */
    public OrderedMap<K, V> reverse() {
        OrderedMap<K, V> reversed = new OrderedMap<>();
        lock.readLock().lock();
        try {
            for (Node<K, V> node = tail; node != null; node = node.prev) {
                reversed.put(node.getKey(), node.getValue());
            }
        } finally {
            lock.readLock().unlock();
        }
        return reversed;
    }
    
    /**
     * Creates a new map with the entries accepted by the predicate, in their original relative order.
     *
     * @param predicate returns true for entries to keep
     */
    public OrderedMap<K, V> filter(BiPredicate<? super K, ? super V> predicate) {
        OrderedMap<K, V> filtered = new OrderedMap<>();
        lock.readLock().lock();
        try {
            for (Node<K, V> node = head; node != null; node = node.next) {
                if (predicate.test(node.getKey(), node.getValue())) {
                    filtered.put(node.getKey(), node.getValue());
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return filtered;
    }
    
    /**
     * Creates a new map by transforming each entry in insertion order.
     * When two entries transform to the same key, the later value wins and
     * the key keeps the position of its first appearance in the result.
     *
     * @param transform maps a key and value to the new entry
     * @throws IllegalArgumentException if the transform returns a null entry or a null key
     */
    public <K2, V2> OrderedMap<K2, V2> map(
            BiFunction<? super K, ? super V, ? extends Map.Entry<? extends K2, ? extends V2>> transform) {
        OrderedMap<K2, V2> mapped = new OrderedMap<>();
        lock.readLock().lock();
        try {
            for (Node<K, V> node = head; node != null; node = node.next) {
                Map.Entry<? extends K2, ? extends V2> result = transform.apply(node.getKey(), node.getValue());
                if (result == null) {
                    throw new IllegalArgumentException("Transform returned null for key " + node.getKey());
                }
                mapped.put(result.getKey(), result.getValue());
            }
        } finally {
            lock.readLock().unlock();
        }
        return mapped;
    }
    
    /**
     * Renders the entries in insertion order as {@code {k1: v1, k2: v2}}.
     */
    @Override
    public String toString() {
        lock.readLock().lock();
        try {
            StringBuilder result = new StringBuilder("{");
            for (Node<K, V> node = head; node != null; node = node.next) {
                if (node != head) {
                    result.append(", ");
                }
                result.append(node.getKey()).append(": ").append(node.getValue());
            }
            return result.append('}').toString();
        } finally {
            lock.readLock().unlock();
        }
    }
    
    // Live node for a key, for structural checks within the package
    Node<K, V> nodeFor(K key) {
        lock.readLock().lock();
        try {
            return index.get(key);
        } finally {
            lock.readLock().unlock();
        }
    }
    
    // Caller holds the write lock
    private void putUnlocked(K key, V value) {
        Node<K, V> node = index.get(key);
        if (node != null) {
            node.setValue(value);
            return;
        }
        node = new Node<>(key, value);
        if (tail == null) {
            head = node;
        } else {
            node.prev = tail;
            tail.next = node;
        }
        tail = node;
        index.put(key, node);
        size++;
    }
    
    // Caller holds the write lock
    private void clearUnlocked() {
        index.clear();
        head = null;
        tail = null;
        size = 0;
    }
    
    // Splice the node out, moving head or tail when it sits at an end
    private void unlinkNode(Node<K, V> node) {
        if (node.prev != null) {
            node.prev.next = node.next;
        } else {
            head = node.next;
        }
        if (node.next != null) {
            node.next.prev = node.prev;
        } else {
            tail = node.prev;
        }
        node.unlink();
    }
    
    private static <K, V> Map.Entry<K, V> entryOf(Node<K, V> node) {
        return new AbstractMap.SimpleImmutableEntry<>(node.getKey(), node.getValue());
    }
    
    private static void requireKey(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
    }
}
