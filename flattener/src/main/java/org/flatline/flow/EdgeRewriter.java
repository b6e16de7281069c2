package org.flatline.flow;

import org.flatline.flow.cfg.BasicBlock;
import org.flatline.flow.cfg.Terminator;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.JumpInsnNode;

import java.util.List;
import java.util.Map;

/**
 * Replaces the exits of the dispatchable blocks with a state update followed by a jump
 * back to the dispatcher. Return blocks are left alone.
 */
public final class EdgeRewriter {

    private EdgeRewriter() {}

    /**
     * @param originals terminators captured before the dispatcher was synthesized
     */
    public static void rewrite(Dispatcher dispatcher, List<BasicBlock> dispatchable,
                               Map<BasicBlock, Terminator> originals, Map<BasicBlock, Integer> indices) {
        for (BasicBlock block : dispatchable) {
            Terminator original = originals.get(block);
            int self = indices.get(block);
            List<AbstractInsnNode> nodes = block.getNodes();
            BasicBlock successor;
            switch (original.getKind()) {
                case RETURN:
                    continue;
                case JUMP:
                    successor = original.getTarget();
                    block.dropTerminatorInsn();
                    nodes.addAll(DispatchFormula.jump(dispatcher, self, indices.get(successor)));
                    break;
                case BRANCH:
                    successor = original.getFalseTarget();
                    block.dropTerminatorInsn();
                    nodes.addAll(BranchConditions.materialize(original.getJumpInsn()));
                    nodes.addAll(DispatchFormula.branch(dispatcher, self,
                            indices.get(original.getTrueTarget()), indices.get(successor)));
                    break;
                default:
                    throw new IllegalStateException("Cannot rewrite " + original + " of " + block);
            }
            nodes.add(dispatcher.storeState());
            JumpInsnNode jump = dispatcher.jumpToHeader();
            nodes.add(jump);
            // Both sides of a branch see the same operand stack.
            block.setExitStack(successor.getEntryStack());
            block.setTerminator(Terminator.jump(jump, dispatcher.getHeader()));
        }
    }
}
