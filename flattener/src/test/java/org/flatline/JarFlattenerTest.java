package org.flatline;

import org.flatline.annotations.Flatten;
import org.flatline.flow.IndexPolicy;
import org.flatline.flow.samples.Samples;
import org.flatline.samples.AnnotatedSamples;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.AnnotationNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.LookupSwitchInsnNode;
import org.objectweb.asm.tree.MethodNode;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.jar.Attributes;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;

import static org.junit.jupiter.api.Assertions.*;

class JarFlattenerTest {

    private static final String SAMPLES = Type.getInternalName(Samples.class);
    private static final String ANNOTATED = Type.getInternalName(AnnotatedSamples.class);

    @TempDir
    Path tempDir;

    private static byte[] classBytes(Class<?> type) throws IOException {
        String resource = Type.getInternalName(type) + ".class";
        try (InputStream in = type.getClassLoader().getResourceAsStream(resource)) {
            assertNotNull(in, resource);
            return in.readAllBytes();
        }
    }

    private Path inputJar() throws IOException {
        Path jar = tempDir.resolve("input.jar");
        Manifest manifest = new Manifest();
        manifest.getMainAttributes().put(Attributes.Name.MANIFEST_VERSION, "1.0");
        manifest.getMainAttributes().put(Attributes.Name.MAIN_CLASS, "org.flatline.flow.samples.Samples");
        try (JarOutputStream jos = new JarOutputStream(Files.newOutputStream(jar), manifest)) {
            jos.putNextEntry(new JarEntry(SAMPLES + ".class"));
            jos.write(classBytes(Samples.class));
            jos.closeEntry();
            jos.putNextEntry(new JarEntry(ANNOTATED + ".class"));
            jos.write(classBytes(AnnotatedSamples.class));
            jos.closeEntry();
            jos.putNextEntry(new JarEntry("data/readme.txt"));
            jos.write("untouched".getBytes(StandardCharsets.UTF_8));
            jos.closeEntry();
        }
        return jar;
    }

    private static FlattenerConfig.Builder config(Path input, Path output) {
        return new FlattenerConfig.Builder()
                .setInputJarPath(input)
                .setOutputDir(output)
                .setSeed(7L);
    }

    private static byte[] readEntry(Path jar, String name) throws IOException {
        try (JarFile jarFile = new JarFile(jar.toFile())) {
            JarEntry entry = jarFile.getJarEntry(name);
            assertNotNull(entry, name);
            try (InputStream in = jarFile.getInputStream(entry)) {
                return in.readAllBytes();
            }
        }
    }

    private static MethodNode readMethod(Path jar, String owner, String name) throws IOException {
        ClassNode cn = new ClassNode();
        new ClassReader(readEntry(jar, owner + ".class")).accept(cn, 0);
        return cn.methods.stream().filter(m -> m.name.equals(name)).findFirst().orElseThrow();
    }

    private static boolean dispatches(MethodNode mn) {
        for (AbstractInsnNode insn : mn.instructions) {
            if (insn instanceof LookupSwitchInsnNode) {
                return true;
            }
        }
        return false;
    }

    private static Object invoke(Class<?> type, String name, Object... args) throws Exception {
        Method method = Arrays.stream(type.getDeclaredMethods())
                .filter(m -> m.getName().equals(name))
                .findFirst()
                .orElseThrow();
        try {
            return method.invoke(null, args);
        } catch (InvocationTargetException e) {
            return e.getCause().getClass();
        }
    }

    @Test
    void flattensJarAndKeepsBehaviour() throws Exception {
        Path input = inputJar();
        Path output = tempDir.resolve("out");

        JarFlattener flattener = new JarFlattener();
        Path result = flattener.process(config(input, output).setVerify(true).build());

        assertEquals(output.resolve("input.jar"), result);
        assertTrue(flattener.getFlattenedMethods() > 0);
        assertTrue(flattener.getSkippedMethods() > 0);
        assertTrue(dispatches(readMethod(result, SAMPLES, "gcd")));
        assertTrue(dispatches(readMethod(result, SAMPLES, "lookupSwitch")));
        assertFalse(dispatches(readMethod(result, SAMPLES, "catches")));

        try (JarFile jarFile = new JarFile(result.toFile())) {
            assertEquals("org.flatline.flow.samples.Samples",
                    jarFile.getManifest().getMainAttributes().getValue(Attributes.Name.MAIN_CLASS));
        }
        assertEquals("untouched", new String(readEntry(result, "data/readme.txt"), StandardCharsets.UTF_8));

        try (URLClassLoader loader = new URLClassLoader(new URL[]{result.toUri().toURL()},
                ClassLoader.getPlatformClassLoader())) {
            Class<?> flat = loader.loadClass(Samples.class.getName());
            assertNotSame(Samples.class, flat);
            for (int x : new int[]{-50, -1, 0, 1, 7, 13, 1000, 65536}) {
                assertEquals(invoke(Samples.class, "lookupSwitch", x), invoke(flat, "lookupSwitch", x));
                assertEquals(invoke(Samples.class, "describe", x), invoke(flat, "describe", x));
                assertEquals(invoke(Samples.class, "gcd", Math.abs(x), 24), invoke(flat, "gcd", Math.abs(x), 24));
                assertEquals(invoke(Samples.class, "throwsOnNegative", x), invoke(flat, "throwsOnNegative", x));
                for (int y : new int[]{-3, 0, 4}) {
                    assertEquals(invoke(Samples.class, "pick", x, y), invoke(flat, "pick", x, y));
                }
            }
        }
    }

    @Test
    void sameSeedGivesSameOutput() throws Exception {
        Path input = inputJar();
        Path first = new JarFlattener().process(config(input, tempDir.resolve("a")).build());
        Path second = new JarFlattener().process(config(input, tempDir.resolve("b")).build());

        assertArrayEquals(readEntry(first, SAMPLES + ".class"), readEntry(second, SAMPLES + ".class"));
    }

    @Test
    void blackListedMethodIsLeftAlone() throws Exception {
        Path input = inputJar();
        Path result = new JarFlattener().process(config(input, tempDir.resolve("out"))
                .setBlackList(Collections.singletonList(SAMPLES + "#gcd!(II)I"))
                .setIndexPolicy(IndexPolicy.UNCHECKED)
                .build());

        assertFalse(dispatches(readMethod(result, SAMPLES, "gcd")));
        assertTrue(dispatches(readMethod(result, SAMPLES, "loopSum")));
    }

    @Test
    void annotationModeFlattensMarkedMethodsOnly() throws Exception {
        Path input = inputJar();
        Path result = new JarFlattener().process(config(input, tempDir.resolve("out"))
                .setUseAnnotations(true)
                .build());

        MethodNode chosen = readMethod(result, ANNOTATED, "chosen");
        assertTrue(dispatches(chosen));
        assertFalse(dispatches(readMethod(result, ANNOTATED, "ignored")));
        assertFalse(dispatches(readMethod(result, ANNOTATED, "excluded")));
        assertFalse(dispatches(readMethod(result, SAMPLES, "gcd")));

        String flattenDesc = Type.getDescriptor(Flatten.class);
        if (chosen.invisibleAnnotations != null) {
            for (AnnotationNode annotation : chosen.invisibleAnnotations) {
                assertNotEquals(flattenDesc, annotation.desc);
            }
        }
        assertArrayEquals(classBytes(Samples.class), readEntry(result, SAMPLES + ".class"));
    }

    @Test
    void refusesToOverwriteInput() throws Exception {
        Path input = inputJar();

        assertThrows(IllegalArgumentException.class,
                () -> new JarFlattener().process(config(input, tempDir).build()));
        assertTrue(Files.size(input) > 0);
    }
}
