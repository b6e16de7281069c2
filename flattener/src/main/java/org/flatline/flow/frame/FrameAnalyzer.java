package org.flatline.flow.frame;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.analysis.Analyzer;
import org.objectweb.asm.tree.analysis.AnalyzerException;
import org.objectweb.asm.tree.analysis.BasicValue;
import org.objectweb.asm.tree.analysis.Frame;
import org.objectweb.asm.tree.analysis.SimpleVerifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes typed frames for a method before it is rewritten.
 * <p>
 * Reference types are resolved through a {@link ClassProvider} rather than by loading
 * classes. The analysis trusts the input code: reference subtype checks never fail, but
 * merges only use hierarchy facts the provider can prove.
 */
public final class FrameAnalyzer {

    private FrameAnalyzer() {}

    @SuppressWarnings("unchecked")
    public static Frame<BasicValue>[] analyze(ClassNode owner, MethodNode method, ClassProvider provider)
            throws AnalyzerException {
        List<Type> interfaces = new ArrayList<>();
        if (owner.interfaces != null) {
            for (String itf : owner.interfaces) {
                interfaces.add(Type.getObjectType(itf));
            }
        }
        SimpleVerifier verifier = new SimpleVerifier(
                Opcodes.ASM9,
                Type.getObjectType(owner.name),
                owner.superName == null ? null : Type.getObjectType(owner.superName),
                interfaces,
                (owner.access & Opcodes.ACC_INTERFACE) != 0) {

            @Override
            protected boolean isSubTypeOf(BasicValue value, BasicValue expected) {
                if (value.isReference() && expected.isReference()) {
                    return true;
                }
                return super.isSubTypeOf(value, expected);
            }

            @Override
            protected boolean isInterface(Type type) {
                return type != null && type.getSort() == Type.OBJECT && provider.isInterface(type.getInternalName());
            }

            @Override
            protected Type getSuperClass(Type type) {
                if (type == null || type.getSort() == Type.ARRAY) {
                    return type == null ? null : Type.getObjectType(ClassProvider.OBJECT);
                }
                String sup = provider.getSuperName(type.getInternalName());
                return sup == null ? null : Type.getObjectType(sup);
            }

            @Override
            protected boolean isAssignableFrom(Type type1, Type type2) {
                if (type1 == null || type2 == null) {
                    return false;
                }
                if (type1.equals(type2)) {
                    return true;
                }
                return provider.isAssignableFrom(type1.getInternalName(), type2.getInternalName());
            }

            @Override
            protected Class<?> getClass(Type type) {
                throw new UnsupportedOperationException("Class loading is disabled during flattening: " + type);
            }
        };
        Analyzer<BasicValue> analyzer = new Analyzer<>(verifier);
        return (Frame<BasicValue>[]) analyzer.analyze(owner.name, method);
    }
}
