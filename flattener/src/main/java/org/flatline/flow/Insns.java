package org.flatline.flow;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.InsnNode;
import org.objectweb.asm.tree.IntInsnNode;
import org.objectweb.asm.tree.LdcInsnNode;

final class Insns implements Opcodes {

    private Insns() {}

    static AbstractInsnNode iconst(int v) {
        if (v >= -1 && v <= 5) return new InsnNode(ICONST_M1 + (v + 1));
        if (v >= Byte.MIN_VALUE && v <= Byte.MAX_VALUE) return new IntInsnNode(BIPUSH, v);
        if (v >= Short.MIN_VALUE && v <= Short.MAX_VALUE) return new IntInsnNode(SIPUSH, v);
        return new LdcInsnNode(v);
    }

    static AbstractInsnNode op(int opcode) {
        return new InsnNode(opcode);
    }
}
