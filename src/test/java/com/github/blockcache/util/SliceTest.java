package com.github.blockcache.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class SliceTest {

    @Test
    @DisplayName("基本访问：size / empty / get")
    void testBasicAccessors() {
        Slice s = Slice.of("HelloWorld");
        assertEquals(10, s.size());
        assertFalse(s.empty());
        assertEquals('H', s.get(0));
        assertEquals('d', s.get(9));
        assertThrows(IndexOutOfBoundsException.class, () -> s.get(10));
        assertThrows(IndexOutOfBoundsException.class, () -> s.get(-1));

        assertTrue(Slice.of("").empty());
        assertTrue(Slice.EMPTY.empty());
    }

    @Test
    @DisplayName("removePrefix返回新视图，原视图不变")
    void testRemovePrefix() {
        Slice s = Slice.of("WellHelloMac");
        Slice b = s.removePrefix(4);

        assertEquals("HelloMac", b.toString());
        assertEquals(8, b.size());
        assertEquals(12, s.size(), "原视图不应被修改");
        assertSame(s, s.removePrefix(0));
        assertTrue(s.removePrefix(12).empty());
        assertThrows(IndexOutOfBoundsException.class, () -> s.removePrefix(13));
        assertThrows(IndexOutOfBoundsException.class, () -> s.removePrefix(-1));
    }

    @Test
    @DisplayName("比较：无符号字典序，前缀较短者在前")
    void testCompare() {
        Slice s = Slice.of("HelloWorld");
        Slice b = Slice.of("WellHelloMac").removePrefix(4);

        assertTrue(s.compareTo(b) > 0, "HelloWorld > HelloMac");
        assertTrue(b.compareTo(s) < 0);
        assertEquals(0, s.compareTo(Slice.of("HelloWorld")));
        assertTrue(Slice.of("Hello").compareTo(s) < 0, "前缀应排在前面");

        // 0xff 按无符号比较应大于 0x01
        Slice high = new Slice(new byte[]{(byte) 0xff});
        Slice low = new Slice(new byte[]{0x01});
        assertTrue(high.compareTo(low) > 0);
    }

    @Test
    void testStartsWithAndEquality() {
        Slice s = Slice.of("HelloWorld");
        Slice hello = Slice.of("Hello");
        Slice mac = Slice.of("WellHelloMac").removePrefix(4);

        assertTrue(s.startsWith(hello));
        assertFalse(s.startsWith(mac));
        assertTrue(s.startsWith(Slice.EMPTY));
        assertFalse(hello.startsWith(s));

        assertNotEquals(s, mac);
        assertEquals(hello, Slice.of("Hello"));
        assertEquals(Slice.of("Hello"), new Slice("xHellox".getBytes(StandardCharsets.UTF_8), 1, 5));
        assertEquals(Slice.of("Hello").hashCode(),
                new Slice("xHellox".getBytes(StandardCharsets.UTF_8), 1, 5).hashCode());
    }

    @Test
    @DisplayName("视图不拷贝：底层数组修改后可见；toByteArray返回拷贝")
    void testViewSemantics() {
        byte[] buf = "abc".getBytes(StandardCharsets.UTF_8);
        Slice s = new Slice(buf);
        byte[] copy = s.toByteArray();

        buf[0] = 'x';
        assertEquals("xbc", s.toString());
        assertEquals('a', copy[0]);
    }

    @Test
    void testInvalidRange() {
        byte[] buf = new byte[4];
        assertThrows(IndexOutOfBoundsException.class, () -> new Slice(buf, 2, 3));
        assertThrows(IndexOutOfBoundsException.class, () -> new Slice(buf, -1, 1));
        assertThrows(NullPointerException.class, () -> new Slice(null));
    }
}
