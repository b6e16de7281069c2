package org.flatline.flow;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.InsnList;
import org.objectweb.asm.tree.JumpInsnNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.tree.LookupSwitchInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TableSwitchInsnNode;
import org.objectweb.asm.tree.VarInsnNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites {@code tableswitch} and {@code lookupswitch} into a balanced tree of two-way
 * integer comparisons, so every block ends with at most two successors.
 */
public final class SwitchLowering implements Opcodes {

    private SwitchLowering() {}

    /** @return the number of switches replaced */
    public static int lower(MethodNode method) {
        int lowered = 0;
        for (AbstractInsnNode insn : method.instructions.toArray()) {
            List<Integer> keys = new ArrayList<>();
            List<LabelNode> targets = new ArrayList<>();
            LabelNode dflt;
            if (insn instanceof TableSwitchInsnNode ts) {
                dflt = ts.dflt;
                for (int i = 0; i < ts.labels.size(); i++) {
                    if (ts.labels.get(i) != dflt) {
                        keys.add(ts.min + i);
                        targets.add(ts.labels.get(i));
                    }
                }
            } else if (insn instanceof LookupSwitchInsnNode ls) {
                dflt = ls.dflt;
                for (int i = 0; i < ls.keys.size(); i++) {
                    if (ls.labels.get(i) != dflt) {
                        keys.add(ls.keys.get(i));
                        targets.add(ls.labels.get(i));
                    }
                }
            } else {
                continue;
            }

            int tmp = method.maxLocals++;
            method.maxStack = Math.max(method.maxStack, 2);
            InsnList tree = new InsnList();
            tree.add(new VarInsnNode(ISTORE, tmp));
            emit(tree, tmp, keys, targets, 0, keys.size(), dflt);
            method.instructions.insert(insn, tree);
            method.instructions.remove(insn);
            lowered++;
        }
        return lowered;
    }

    // keys are sorted in both switch forms
    private static void emit(InsnList out, int tmp, List<Integer> keys, List<LabelNode> targets,
                             int from, int to, LabelNode dflt) {
        if (to - from <= 2) {
            for (int i = from; i < to; i++) {
                out.add(new VarInsnNode(ILOAD, tmp));
                out.add(Insns.iconst(keys.get(i)));
                out.add(new JumpInsnNode(IF_ICMPEQ, targets.get(i)));
            }
            out.add(new JumpInsnNode(GOTO, dflt));
            return;
        }
        int mid = (from + to) >>> 1;
        LabelNode upper = new LabelNode();
        out.add(new VarInsnNode(ILOAD, tmp));
        out.add(Insns.iconst(keys.get(mid)));
        out.add(new JumpInsnNode(IF_ICMPGE, upper));
        emit(out, tmp, keys, targets, from, mid, dflt);
        out.add(upper);
        emit(out, tmp, keys, targets, mid, to, dflt);
    }
}
