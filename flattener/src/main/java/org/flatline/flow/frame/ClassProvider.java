package org.flatline.flow.frame;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.ClassNode;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Single source of class hierarchy information for the analyzer and the class writer. */
public interface ClassProvider {

    String OBJECT = "java/lang/Object";

    /** Returns the bytes of the class with the given internal name, or {@code null} if unknown. */
    byte[] getClassBytes(String internalName);

    /** Looks classes up as resources of the flattener's own class loader. */
    static ClassProvider ofClasspath() {
        return ofClassLoader(ClassProvider.class.getClassLoader());
    }

    static ClassProvider ofClassLoader(ClassLoader loader) {
        return new ClassProvider() {
            private final Map<String, byte[]> cache = new ConcurrentHashMap<>();
            private final Map<String, Boolean> missing = new ConcurrentHashMap<>();

            @Override
            public byte[] getClassBytes(String internalName) {
                if (missing.containsKey(internalName)) {
                    return null;
                }
                byte[] bytes = cache.computeIfAbsent(internalName, k -> {
                    try (InputStream in = loader.getResourceAsStream(k + ".class")) {
                        return in == null ? null : in.readAllBytes();
                    } catch (IOException e) {
                        return null;
                    }
                });
                if (bytes == null) {
                    missing.put(internalName, Boolean.TRUE);
                }
                return bytes;
            }
        };
    }

    /** Asks {@code this} first and {@code fallback} when the class is unknown here. */
    default ClassProvider orElse(ClassProvider fallback) {
        ClassProvider primary = this;
        return internalName -> {
            byte[] bytes = primary.getClassBytes(internalName);
            return bytes != null ? bytes : fallback.getClassBytes(internalName);
        };
    }

    default ClassNode readClassNode(String internalName) {
        if (internalName == null || internalName.startsWith("[")) {
            return null;
        }
        byte[] bytes = getClassBytes(internalName);
        if (bytes == null) {
            return null;
        }
        ClassNode cn = new ClassNode();
        new ClassReader(bytes).accept(cn, ClassReader.SKIP_CODE | ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
        return cn;
    }

    /**
     * @return the super class, {@code java/lang/Object} for unknown classes and arrays,
     * {@code null} for {@code java/lang/Object} itself
     */
    default String getSuperName(String internalName) {
        if (OBJECT.equals(internalName)) {
            return null;
        }
        ClassNode cn = readClassNode(internalName);
        return cn != null && cn.superName != null ? cn.superName : OBJECT;
    }

    default String[] getInterfaces(String internalName) {
        ClassNode cn = readClassNode(internalName);
        return cn != null ? cn.interfaces.toArray(String[]::new) : new String[0];
    }

    default boolean isInterface(String internalName) {
        ClassNode cn = readClassNode(internalName);
        return cn != null && (cn.access & Opcodes.ACC_INTERFACE) != 0;
    }

    /** Whether {@code a} is the same type as, or a super type of, {@code b}. Unknown types answer {@code false}. */
    default boolean isAssignableFrom(String a, String b) {
        if (a.equals(b) || OBJECT.equals(a)) {
            return true;
        }
        if (b.startsWith("[")) {
            if (a.startsWith("[")) {
                String ea = a.substring(1);
                String eb = b.substring(1);
                if (ea.startsWith("L") && eb.startsWith("L")) {
                    return isAssignableFrom(ea.substring(1, ea.length() - 1), eb.substring(1, eb.length() - 1));
                }
                if (ea.startsWith("[") && eb.startsWith("[")) {
                    return isAssignableFrom(ea, eb);
                }
                if (ea.startsWith("L") && eb.startsWith("[")) {
                    return isAssignableFrom(ea.substring(1, ea.length() - 1), eb);
                }
                return ea.equals(eb);
            }
            return "java/lang/Cloneable".equals(a) || "java/io/Serializable".equals(a);
        }
        if (a.startsWith("[")) {
            return false;
        }
        for (String cur = b; cur != null; cur = getSuperName(cur)) {
            if (a.equals(cur)) {
                return true;
            }
            for (String itf : getInterfaces(cur)) {
                if (isAssignableFrom(a, itf)) {
                    return true;
                }
            }
        }
        return false;
    }

    default String commonSuper(String t1, String t2) {
        if (isAssignableFrom(t1, t2)) return t1;
        if (isAssignableFrom(t2, t1)) return t2;
        if (t1.startsWith("[") || t2.startsWith("[") || isInterface(t1) || isInterface(t2)) {
            return OBJECT;
        }
        String s = t1;
        while (s != null && !isAssignableFrom(s, t2)) {
            s = getSuperName(s);
        }
        return s != null ? s : OBJECT;
    }
}
