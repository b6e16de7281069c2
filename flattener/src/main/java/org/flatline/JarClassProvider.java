package org.flatline;

import org.flatline.flow.frame.ClassProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.jar.JarFile;
import java.util.zip.ZipEntry;

/** Serves class bytes from the input jar and its libraries, first jar first. */
public class JarClassProvider implements ClassProvider, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(JarClassProvider.class);

    private final List<JarFile> jars = new ArrayList<>();
    private final Map<String, byte[]> cache = new ConcurrentHashMap<>();

    public JarClassProvider(List<Path> paths) throws IOException {
        try {
            for (Path path : paths) {
                jars.add(new JarFile(path.toFile()));
            }
        } catch (IOException e) {
            close();
            throw e;
        }
    }

    @Override
    public byte[] getClassBytes(String internalName) {
        byte[] cached = cache.get(internalName);
        if (cached != null) {
            return cached;
        }
        for (JarFile jar : jars) {
            ZipEntry entry = jar.getEntry(internalName + ".class");
            if (entry == null) {
                continue;
            }
            try (InputStream in = jar.getInputStream(entry)) {
                byte[] bytes = in.readAllBytes();
                cache.put(internalName, bytes);
                return bytes;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + internalName + " from " + jar.getName(), e);
            }
        }
        return null;
    }

    @Override
    public void close() {
        for (JarFile jar : jars) {
            try {
                jar.close();
            } catch (IOException e) {
                logger.warn("Failed to close {}", jar.getName(), e);
            }
        }
        jars.clear();
    }
}
