package org.flatline.flow;

import org.flatline.flow.cfg.BasicBlock;
import org.flatline.flow.cfg.MethodGraph;
import org.flatline.flow.cfg.Terminator;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.analysis.BasicValue;
import org.objectweb.asm.tree.analysis.Frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Makes the entry block a straight-line prefix with a single successor, so it can
 * become the block that seeds the dispatcher.
 */
public final class EntryNormalizer {

    private EntryNormalizer() {}

    /**
     * Normalizes the entry of {@code graph}.
     *
     * @return the dispatchable blocks, every block except the normalized entry, in natural
     * order; a split-off tail comes first
     */
    public static List<BasicBlock> normalize(MethodGraph graph) {
        BasicBlock entry = graph.getEntry();

        // The entry must never be re-entered, since it only seeds the dispatcher.
        if (graph.hasPredecessors(entry)) {
            BasicBlock fresh = BasicBlock.create(graph.nextBlockName(), Collections.emptyList());
            fresh.setTerminator(Terminator.jump(null, entry));
            graph.setEntry(fresh);
            entry = fresh;
        }

        Terminator terminator = entry.getTerminator();
        if (terminator.successorCount() > 1) {
            splitEntry(graph, entry, terminator);
        }

        List<BasicBlock> blocks = graph.getBlocks();
        return new ArrayList<>(blocks.subList(1, blocks.size()));
    }

    private static void splitEntry(MethodGraph graph, BasicBlock entry, Terminator terminator) {
        List<AbstractInsnNode> nodes = entry.getNodes();
        int cut = nodes.indexOf(terminator.getInsn());
        if (entry.realInsnCount() > 1) {
            do {
                cut--;
            } while (nodes.get(cut).getOpcode() < 0);
        }

        Frame<BasicValue> frame = graph.frameAt(nodes.get(cut));
        List<BasicValue> stack = new ArrayList<>();
        for (int i = 0; i < frame.getStackSize(); i++) {
            stack.add(frame.getStack(i));
        }

        BasicBlock tail = BasicBlock.create(graph.nextBlockName(), stack);
        List<AbstractInsnNode> moved = nodes.subList(cut, nodes.size());
        tail.getNodes().addAll(moved);
        moved.clear();

        tail.setTerminator(terminator);
        entry.setTerminator(Terminator.jump(null, tail));
        graph.insertAfter(entry, tail);
    }
}
