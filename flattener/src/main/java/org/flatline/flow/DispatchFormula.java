package org.flatline.flow;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The branch-free update of the dispatcher state at the end of a block.
 * <p>
 * A block only runs while {@code state == self}, so
 * {@code (C & (t ^ f)) ^ state ^ (self ^ f)} is {@code t} when {@code C == -1} and
 * {@code f} when {@code C == 0}. A plain jump is the same formula with a zero mask.
 */
public final class DispatchFormula implements Opcodes {

    private DispatchFormula() {}

    /** Reference evaluation of the emitted code. */
    public static int next(int state, int self, boolean condition, int trueIndex, int falseIndex) {
        int c = -(condition ? 1 : 0);
        int mask = c & (trueIndex ^ falseIndex);
        return mask ^ (state ^ (self ^ falseIndex));
    }

    /** Expects the {@code 0/1} condition on the stack and leaves the next state there. */
    static List<AbstractInsnNode> branch(Dispatcher dispatcher, int self, int trueIndex, int falseIndex) {
        List<AbstractInsnNode> out = new ArrayList<>();
        out.add(Insns.op(INEG));
        out.add(Insns.iconst(trueIndex ^ falseIndex));
        out.add(Insns.op(IAND));
        out.add(dispatcher.loadState());
        out.add(Insns.iconst(self ^ falseIndex));
        out.add(Insns.op(IXOR));
        out.add(Insns.op(IXOR));
        return out;
    }

    /** Leaves the next state on the stack. */
    static List<AbstractInsnNode> jump(Dispatcher dispatcher, int self, int target) {
        List<AbstractInsnNode> out = new ArrayList<>();
        out.add(dispatcher.loadState());
        out.add(Insns.iconst(self ^ target));
        out.add(Insns.op(IXOR));
        return out;
    }
}
