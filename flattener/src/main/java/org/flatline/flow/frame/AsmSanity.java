package org.flatline.flow.frame;

import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.FrameNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.tree.LocalVariableNode;
import org.objectweb.asm.tree.MethodNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

public final class AsmSanity {
    private AsmSanity() {}

    /** Removes every {@link FrameNode}; frames are recomputed by {@code COMPUTE_FRAMES}. */
    public static void stripFrames(List<AbstractInsnNode> nodes) {
        nodes.removeIf(node -> node instanceof FrameNode);
    }

    /**
     * Drops local variable entries whose range no longer makes sense after the code was
     * reordered: unknown labels, empty or inverted ranges, and duplicate (index, range) keys.
     */
    public static void sanitizeLocalVariables(MethodNode mn) {
        if (mn.localVariables == null || mn.localVariables.isEmpty()) {
            return;
        }
        IdentityHashMap<LabelNode, Integer> pos = new IdentityHashMap<>();
        int i = 0;
        for (AbstractInsnNode p = mn.instructions.getFirst(); p != null; p = p.getNext(), i++) {
            if (p instanceof LabelNode label) {
                pos.put(label, i);
            }
        }

        List<LocalVariableNode> keep = new ArrayList<>(mn.localVariables.size());
        Set<String> seen = new HashSet<>();
        for (LocalVariableNode lv : mn.localVariables) {
            if (lv == null || lv.start == null || lv.end == null) continue;
            Integer s = pos.get(lv.start), e = pos.get(lv.end);
            if (s == null || e == null) continue;
            if (s >= e) continue;
            if (!seen.add(lv.index + ":" + s + ":" + e)) continue;
            keep.add(lv);
        }
        keep.sort((a, b) -> {
            int x = Integer.compare(pos.get(a.start), pos.get(b.start));
            return x != 0 ? x : Integer.compare(pos.get(a.end), pos.get(b.end));
        });
        mn.localVariables = keep;
    }
}
