package org.flatline;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class ClassMethodListTest {

    @Test
    public void testSingleStarStaysInSegment() {
        ClassMethodList list = ClassMethodList.parse(Collections.singletonList("com/example/*"));

        assertTrue(list.contains("com/example/Foo"));
        assertFalse(list.contains("com/example/sub/Foo"));
        assertFalse(list.contains("com/example/Foo#bar!()V"));
    }

    @Test
    public void testDoubleStarMatchesAnything() {
        ClassMethodList list = ClassMethodList.parse(Collections.singletonList("com/example/**"));

        assertTrue(list.contains("com/example/sub/Foo"));
        assertTrue(list.contains("com/example/Foo#bar!(Ljava/lang/String;)V"));
        assertFalse(list.contains("org/example/Foo"));
    }

    @Test
    public void testMethodEntries() {
        ClassMethodList list = ClassMethodList.parse(Arrays.asList(
                "com/example/Foo#bar!*",
                "com/example/Foo#baz!**"));

        assertTrue(list.contains("com/example/Foo#bar!(I)I"));
        assertFalse(list.contains("com/example/Foo#bar!(Ljava/lang/String;)V"));
        assertTrue(list.contains("com/example/Foo#baz!(Ljava/lang/String;)V"));
        assertFalse(list.contains("com/example/Foo"));
    }

    @Test
    public void testLiteralCharactersAreQuoted() {
        ClassMethodList list = ClassMethodList.parse(Collections.singletonList("com/example/Foo$1"));

        assertTrue(list.contains("com/example/Foo$1"));
        assertFalse(list.contains("com/example/Foo1"));
    }

    @Test
    public void testCommentsAndBlankLines() {
        ClassMethodList list = ClassMethodList.parse(Arrays.asList("# nothing here", "", "   "));
        assertTrue(list.isEmpty());
        assertTrue(ClassMethodList.parse(null).isEmpty());
        assertFalse(ClassMethodList.parse(Arrays.asList("  a/B  ", "#c")).isEmpty());
        assertTrue(ClassMethodList.parse(Collections.singletonList("  a/B  ")).contains("a/B"));
    }
}
