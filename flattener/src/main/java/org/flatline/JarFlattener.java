package org.flatline;

import org.flatline.flow.ControlFlowFlattener;
import org.flatline.flow.EligibilityChecker;
import org.flatline.flow.FlattenResult;
import org.flatline.flow.FrameLegalizer;
import org.flatline.flow.SwitchLowering;
import org.flatline.flow.frame.ClassProvider;
import org.flatline.flow.frame.ComputingFrameClassWriter;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.util.CheckClassAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.jar.Manifest;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Flattens every selected method of a jar and writes the result as a jar of the same
 * name into the output directory.
 */
public class JarFlattener {

    private static final Logger logger = LoggerFactory.getLogger(JarFlattener.class);

    private int flattenedMethods;
    private int skippedMethods;
    private int failedClasses;

    public Path process(FlattenerConfig config) throws IOException {
        Objects.requireNonNull(config, "config");
        Path inputJarPath = config.getInputJarPath();
        Path outputDir = config.getOutputDir();
        Path outJar = outputDir.resolve(inputJarPath.getFileName().toString());
        Files.createDirectories(outputDir);
        if (Files.exists(outJar) && Files.isSameFile(inputJarPath, outJar)) {
            throw new IllegalArgumentException("Output jar would overwrite the input jar: " + outJar);
        }

        ClassMethodFilter filter = new ClassMethodFilter(
                ClassMethodList.parse(config.getBlackList()),
                config.getWhiteList() == null ? null : ClassMethodList.parse(config.getWhiteList()),
                config.isUseAnnotations());

        List<Path> jars = new ArrayList<>();
        jars.add(inputJarPath);
        jars.addAll(config.getInputLibs());

        flattenedMethods = 0;
        skippedMethods = 0;
        failedClasses = 0;

        try (JarClassProvider jarClasses = new JarClassProvider(jars);
             URLClassLoader verifierLoader = config.isVerify() ? newLoader(jars) : null;
             JarFile jar = new JarFile(inputJarPath.toFile());
             ZipOutputStream out = new ZipOutputStream(Files.newOutputStream(outJar))) {
            ClassProvider provider = jarClasses.orElse(ClassProvider.ofClasspath());
            ControlFlowFlattener flattener = config.getSeed() != null
                    ? ControlFlowFlattener.seeded(config.getSeed(), config.getIndexPolicy(), provider)
                    : new ControlFlowFlattener(Random::new, config.getIndexPolicy(), new FrameLegalizer(), provider);

            Manifest manifest = jar.getManifest();
            if (manifest != null) {
                out.putNextEntry(new ZipEntry(JarFile.MANIFEST_NAME));
                manifest.write(out);
                out.closeEntry();
            }

            jar.stream().forEach(entry -> {
                try {
                    if (entry.getName().equals(JarFile.MANIFEST_NAME)) {
                        return;
                    }
                    byte[] src;
                    try (InputStream in = jar.getInputStream(entry)) {
                        src = in.readAllBytes();
                    }
                    byte[] result = entry.getName().endsWith(".class")
                            ? processClass(src, filter, flattener, provider, config)
                            : src;
                    if (result != src && verifierLoader != null) {
                        verifyBytecode(result, entry.getName(), verifierLoader);
                    }
                    writeEntry(out, entry, result);
                } catch (IOException ex) {
                    throw new UncheckedIOException(ex);
                }
            });
        } catch (UncheckedIOException ex) {
            throw ex.getCause();
        }

        logger.info("Flattened {} method(s), skipped {}, {} class(es) written unchanged after errors. Output: {}",
                flattenedMethods, skippedMethods, failedClasses, outJar);
        return outJar;
    }

    public int getFlattenedMethods() {
        return flattenedMethods;
    }

    public int getSkippedMethods() {
        return skippedMethods;
    }

    private byte[] processClass(byte[] src, ClassMethodFilter filter, ControlFlowFlattener flattener,
                                ClassProvider provider, FlattenerConfig config) {
        ClassReader cr = new ClassReader(src);
        ClassNode cn = new ClassNode(Opcodes.ASM9);
        cr.accept(cn, 0);
        if (!filter.shouldProcess(cn)) {
            return src;
        }

        logger.debug("Processing class {}", cn.name);
        boolean changed = false;
        for (int i = 0; i < cn.methods.size(); i++) {
            MethodNode mn = cn.methods.get(i);
            if (!filter.shouldProcess(cn, mn)) {
                continue;
            }
            try {
                if (config.isLowerSwitches() && EligibilityChecker.checkMethod(mn) == null
                        && SwitchLowering.lower(mn) > 0) {
                    changed = true;
                }
                FlattenResult result = flattener.flatten(cn, mn);
                if (result.isApplied()) {
                    flattenedMethods++;
                    changed = true;
                } else {
                    skippedMethods++;
                    logger.debug("Skipping {}.{}{}: {}", cn.name, mn.name, mn.desc, result);
                }
            } catch (RuntimeException e) {
                logger.warn("Failed to flatten method {}.{}{}: {}", cn.name, mn.name, mn.desc, e.toString());
                cn.methods.set(i, pristineMethod(src, mn.name, mn.desc));
                skippedMethods++;
            }
        }
        if (!changed) {
            return src;
        }
        if (config.isUseAnnotations()) {
            ClassMethodFilter.cleanAnnotations(cn);
        }

        try {
            ClassWriter cw = new ComputingFrameClassWriter(ClassWriter.COMPUTE_FRAMES | ClassWriter.COMPUTE_MAXS, provider);
            cn.accept(cw);
            return cw.toByteArray();
        } catch (RuntimeException e) {
            logger.warn("Frame computation failed for {}, writing the original class", cn.name, e);
            failedClasses++;
            return src;
        }
    }

    private static MethodNode pristineMethod(byte[] src, String name, String desc) {
        ClassNode original = new ClassNode(Opcodes.ASM9);
        new ClassReader(src).accept(original, 0);
        for (MethodNode mn : original.methods) {
            if (mn.name.equals(name) && mn.desc.equals(desc)) {
                return mn;
            }
        }
        throw new IllegalStateException("Method " + name + desc + " vanished from " + original.name);
    }

    private static void verifyBytecode(byte[] bytecode, String entryName, ClassLoader loader) {
        StringWriter sw = new StringWriter();
        try (PrintWriter pw = new PrintWriter(sw, true)) {
            CheckClassAdapter.verify(new ClassReader(bytecode), loader, false, pw);
        }
        String report = sw.toString().trim();
        if (!report.isEmpty()) {
            throw new IllegalStateException("ASM verification failed for " + entryName + "\n" + report);
        }
    }

    private static URLClassLoader newLoader(List<Path> jars) throws MalformedURLException {
        URL[] urls = new URL[jars.size()];
        for (int i = 0; i < urls.length; i++) {
            urls[i] = jars.get(i).toUri().toURL();
        }
        return new URLClassLoader(urls, JarFlattener.class.getClassLoader());
    }

    private static void writeEntry(ZipOutputStream out, JarEntry source, byte[] data) throws IOException {
        ZipEntry entry = new ZipEntry(source.getName());
        if (source.getTime() != -1) {
            entry.setTime(source.getTime());
        }
        out.putNextEntry(entry);
        out.write(data);
        out.closeEntry();
    }
}
