package org.flatline;

import org.flatline.annotations.Flatten;
import org.flatline.annotations.NoFlatten;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AnnotationNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class ClassMethodFilterTest {

    private static final String FLATTEN = Type.getDescriptor(Flatten.class);
    private static final String NO_FLATTEN = Type.getDescriptor(NoFlatten.class);

    private static ClassNode classNode(String name, String... methods) {
        ClassNode cn = new ClassNode(Opcodes.ASM9);
        cn.name = name;
        for (String method : methods) {
            cn.methods.add(new MethodNode(Opcodes.ACC_STATIC, method, "(I)I", null, null));
        }
        return cn;
    }

    private static MethodNode method(ClassNode cn, String name) {
        return cn.methods.stream().filter(m -> m.name.equals(name)).findFirst().orElseThrow();
    }

    private static void annotate(ClassNode cn, String desc) {
        if (cn.invisibleAnnotations == null) {
            cn.invisibleAnnotations = new ArrayList<>();
        }
        cn.invisibleAnnotations.add(new AnnotationNode(desc));
    }

    private static void annotate(MethodNode mn, String desc) {
        if (mn.invisibleAnnotations == null) {
            mn.invisibleAnnotations = new ArrayList<>();
        }
        mn.invisibleAnnotations.add(new AnnotationNode(desc));
    }

    private static ClassMethodList list(String... lines) {
        return ClassMethodList.parse(Arrays.asList(lines));
    }

    @Test
    public void testEverythingByDefault() {
        ClassMethodFilter filter = new ClassMethodFilter(list(), null, false);
        ClassNode cn = classNode("a/Foo", "one");

        assertTrue(filter.shouldProcess(cn));
        assertTrue(filter.shouldProcess(cn, method(cn, "one")));
    }

    @Test
    public void testBlackList() {
        ClassMethodFilter filter = new ClassMethodFilter(list("a/Hidden", "a/Foo#two!(I)I"), null, false);
        ClassNode hidden = classNode("a/Hidden", "one");
        ClassNode foo = classNode("a/Foo", "one", "two");

        assertFalse(filter.shouldProcess(hidden));
        assertFalse(filter.shouldProcess(hidden, method(hidden, "one")));
        assertTrue(filter.shouldProcess(foo));
        assertTrue(filter.shouldProcess(foo, method(foo, "one")));
        assertFalse(filter.shouldProcess(foo, method(foo, "two")));
    }

    @Test
    public void testWhiteListAcceptsClassesAndMethods() {
        ClassMethodFilter filter = new ClassMethodFilter(list(), list("a/Whole", "a/Part#two!*"), false);
        ClassNode whole = classNode("a/Whole", "one");
        ClassNode part = classNode("a/Part", "one", "two");
        ClassNode other = classNode("a/Other", "one");

        assertTrue(filter.shouldProcess(whole, method(whole, "one")));
        assertTrue(filter.shouldProcess(part));
        assertFalse(filter.shouldProcess(part, method(part, "one")));
        assertTrue(filter.shouldProcess(part, method(part, "two")));
        assertFalse(filter.shouldProcess(other));
    }

    @Test
    public void testAnnotations() {
        ClassMethodFilter filter = new ClassMethodFilter(list(), null, true);
        ClassNode plain = classNode("a/Plain", "one", "two");
        annotate(method(plain, "two"), FLATTEN);
        ClassNode marked = classNode("a/Marked", "one", "two");
        annotate(marked, FLATTEN);
        annotate(method(marked, "two"), NO_FLATTEN);
        ClassNode excluded = classNode("a/Excluded", "one");
        annotate(excluded, NO_FLATTEN);
        annotate(method(excluded, "one"), FLATTEN);

        assertTrue(filter.shouldProcess(plain));
        assertFalse(filter.shouldProcess(plain, method(plain, "one")));
        assertTrue(filter.shouldProcess(plain, method(plain, "two")));
        assertTrue(filter.shouldProcess(marked, method(marked, "one")));
        assertFalse(filter.shouldProcess(marked, method(marked, "two")));
        assertFalse(filter.shouldProcess(excluded));
        assertFalse(filter.shouldProcess(excluded, method(excluded, "one")));
        assertFalse(filter.shouldProcess(classNode("a/None", "one")));
    }

    @Test
    public void testCleanAnnotations() {
        ClassNode cn = classNode("a/Foo", "one");
        annotate(cn, FLATTEN);
        annotate(cn, "Ljava/lang/Deprecated;");
        annotate(method(cn, "one"), NO_FLATTEN);

        ClassMethodFilter.cleanAnnotations(cn);

        assertEquals(1, cn.invisibleAnnotations.size());
        assertEquals("Ljava/lang/Deprecated;", cn.invisibleAnnotations.get(0).desc);
        assertEquals(Collections.emptyList(), method(cn, "one").invisibleAnnotations);
    }

    @Test
    public void testNameOf() {
        ClassNode cn = classNode("a/Foo", "one");
        assertEquals("a/Foo#one!(I)I", ClassMethodFilter.nameOf(cn, method(cn, "one")));
    }
}
