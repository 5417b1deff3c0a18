package com.pavan.orderedmap.collection;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrderedMapLinksTest {
    
    private OrderedMap<String, Integer> map;
    
    @BeforeEach
    void setUp() {
        map = new OrderedMap<>();
        map.put("a", 1);
        map.put("b", 2);
        map.put("c", 3);
        map.put("d", 4);
    }
    
    @Test
    void testLinksFollowInsertionOrder() {
        Node<String, Integer> a = map.nodeFor("a");
        Node<String, Integer> b = map.nodeFor("b");
        Node<String, Integer> d = map.nodeFor("d");
        
        assertNull(a.prev);
        assertSame(b, a.next);
        assertSame(a, b.prev);
        assertNull(d.next);
    }
    
    @Test
    void testRemovedMiddleNodeIsDetached() {
        Node<String, Integer> b = map.nodeFor("b");
        
        assertTrue(map.remove("b"));
        
        assertNull(b.prev);
        assertNull(b.next);
        assertNull(map.nodeFor("b"));
        assertSame(map.nodeFor("c"), map.nodeFor("a").next);
        assertSame(map.nodeFor("a"), map.nodeFor("c").prev);
    }
    
    @Test
    void testRemovedHeadNodeIsDetached() {
        Node<String, Integer> a = map.nodeFor("a");
        
        map.remove("a");
        
        assertNull(a.prev);
        assertNull(a.next);
        assertNull(map.nodeFor("b").prev);
        assertEquals("b", map.first().orElseThrow().getKey());
    }
    
    @Test
    void testRemovedTailNodeIsDetached() {
        Node<String, Integer> d = map.nodeFor("d");
        
        map.remove("d");
        
        assertNull(d.prev);
        assertNull(d.next);
        assertNull(map.nodeFor("c").next);
        assertEquals("c", map.last().orElseThrow().getKey());
    }
    
    @Test
    void testRemovedOnlyNodeIsDetached() {
        OrderedMap<String, Integer> single = new OrderedMap<>();
        single.put("only", 1);
        Node<String, Integer> only = single.nodeFor("only");
        
        single.remove("only");
        
        assertNull(only.prev);
        assertNull(only.next);
        assertTrue(single.first().isEmpty());
        assertTrue(single.last().isEmpty());
    }
    
    @Test
    void testUpdateKeepsSameNode() {
        Node<String, Integer> c = map.nodeFor("c");
        
        map.put("c", 30);
        
        assertSame(c, map.nodeFor("c"));
        assertEquals(30, c.getValue());
        assertEquals(List.of("a", "b", "c", "d"), map.keys());
    }
}
