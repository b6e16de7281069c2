package org.flatline.flow.debug;

import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.InsnList;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.util.Textifier;
import org.objectweb.asm.util.TraceMethodVisitor;

import java.io.PrintWriter;
import java.io.StringWriter;

/** Text dumps of method code for trace logging and failure reports. */
public final class AsmDebug {
    private AsmDebug() {}

    /** One line per node, prefixed with its index in the instruction list. */
    public static String disassembleWithIndex(MethodNode mn) {
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        InsnList insns = mn.instructions;
        int i = 0;
        for (AbstractInsnNode in = insns.getFirst(); in != null; in = in.getNext(), i++) {
            pw.printf("%5d: %s%n", i, insnToString(in));
        }
        pw.flush();
        return sw.toString();
    }

    public static String insnToString(AbstractInsnNode in) {
        Textifier t = new Textifier();
        TraceMethodVisitor tmv = new TraceMethodVisitor(t);
        in.accept(tmv);
        StringWriter line = new StringWriter();
        t.print(new PrintWriter(line));
        return line.toString().trim().replace("\n", " ");
    }
}
