package com.pavan.orderedmap.collection;

/**
 * Doubly linked node holding one entry of an {@link OrderedMap}.
 * The key is immutable; the value is replaced in place on update, and links
 * are rewired only by the owning map while it holds its write lock.
 *
 * @param <K> the type of key
 * @param <V> the type of value
 */
class Node<K, V> {
    
    private final K key;
    private V value;
    Node<K, V> prev;
    Node<K, V> next;
    
    Node(K key, V value) {
        this.key = key;
        this.value = value;
    }
    
    K getKey() {
        return key;
    }
    
    V getValue() {
        return value;
    }
    
    void setValue(V value) {
        this.value = value;
    }
    
    // Drop both links once the node has been spliced out
    void unlink() {
        prev = null;
        next = null;
    }
}
