package org.flatline.flow.frame;

import org.objectweb.asm.ClassWriter;

/**
 * Class writer that answers common super class queries from a {@link ClassProvider}
 * instead of loading classes, so frames can be computed for code that is not on the
 * flattener's own class path.
 */
public class ComputingFrameClassWriter extends ClassWriter {
    private final ClassProvider provider;

    public ComputingFrameClassWriter(int flags, ClassProvider provider) {
        super(flags);
        this.provider = provider;
    }

    @Override
    protected String getCommonSuperClass(String type1, String type2) {
        return provider.commonSuper(type1, type2);
    }
}
