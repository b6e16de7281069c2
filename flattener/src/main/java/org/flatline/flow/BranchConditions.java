package org.flatline.flow;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.IntInsnNode;
import org.objectweb.asm.tree.JumpInsnNode;
import org.objectweb.asm.tree.MethodInsnNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates the condition of a conditional jump without branching.
 * <p>
 * The emitted code consumes the jump's operands and leaves an {@code int} that is
 * {@code 1} when the jump would be taken and {@code 0} otherwise. Integer comparisons
 * are widened to {@code long} so the difference of the operands cannot overflow, and the
 * answer is read from its sign bit.
 */
public final class BranchConditions implements Opcodes {

    private BranchConditions() {}

    public static List<AbstractInsnNode> materialize(JumpInsnNode jump) {
        List<AbstractInsnNode> out = new ArrayList<>();
        int op = jump.getOpcode();
        switch (op) {
            case IFEQ:
            case IFNE:
                out.add(Insns.op(DUP));
                out.add(Insns.op(INEG));
                out.add(Insns.op(IOR));
                intSign(out);
                if (op == IFEQ) negate(out);
                break;
            case IFLT:
            case IFGE:
                intSign(out);
                if (op == IFGE) negate(out);
                break;
            case IFGT:
            case IFLE:
                out.add(Insns.op(I2L));
                out.add(Insns.op(LNEG));
                longSign(out);
                if (op == IFLE) negate(out);
                break;
            case IF_ICMPEQ:
            case IF_ICMPNE:
                difference(out);
                out.add(Insns.op(DUP2));
                out.add(Insns.op(LNEG));
                out.add(Insns.op(LOR));
                longSign(out);
                if (op == IF_ICMPEQ) negate(out);
                break;
            case IF_ICMPLT:
            case IF_ICMPGE:
                difference(out);
                out.add(Insns.op(LNEG));
                longSign(out);
                if (op == IF_ICMPGE) negate(out);
                break;
            case IF_ICMPGT:
            case IF_ICMPLE:
                difference(out);
                longSign(out);
                if (op == IF_ICMPLE) negate(out);
                break;
            case IFNULL:
                out.add(new MethodInsnNode(INVOKESTATIC, "java/util/Objects", "isNull", "(Ljava/lang/Object;)Z", false));
                break;
            case IFNONNULL:
                out.add(new MethodInsnNode(INVOKESTATIC, "java/util/Objects", "nonNull", "(Ljava/lang/Object;)Z", false));
                break;
            default:
                throw new IllegalArgumentException("Not a supported conditional jump: opcode " + op);
        }
        return out;
    }

    /** [a, b] -> (long) b - (long) a */
    private static void difference(List<AbstractInsnNode> out) {
        out.add(Insns.op(I2L));
        out.add(Insns.op(DUP2_X1));
        out.add(Insns.op(POP2));
        out.add(Insns.op(I2L));
        out.add(Insns.op(LSUB));
    }

    private static void intSign(List<AbstractInsnNode> out) {
        out.add(new IntInsnNode(BIPUSH, 31));
        out.add(Insns.op(IUSHR));
    }

    private static void longSign(List<AbstractInsnNode> out) {
        out.add(new IntInsnNode(BIPUSH, 63));
        out.add(Insns.op(LUSHR));
        out.add(Insns.op(L2I));
    }

    private static void negate(List<AbstractInsnNode> out) {
        out.add(Insns.op(ICONST_1));
        out.add(Insns.op(IXOR));
    }
}
