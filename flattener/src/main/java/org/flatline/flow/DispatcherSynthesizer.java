package org.flatline.flow;

import org.flatline.flow.cfg.BasicBlock;
import org.flatline.flow.cfg.MethodGraph;
import org.flatline.flow.cfg.Terminator;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.JumpInsnNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.tree.LookupSwitchInsnNode;
import org.objectweb.asm.tree.VarInsnNode;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the dispatch loop header, allocates the state local and turns the normalized
 * entry into "store the first index, jump to the header".
 */
public final class DispatcherSynthesizer implements Opcodes {

    private DispatcherSynthesizer() {}

    /**
     * @param presentation dispatchable blocks in the order their cases are added
     * @param indices      dispatch index of every dispatchable block
     */
    public static Dispatcher synthesize(MethodGraph graph, List<BasicBlock> presentation,
                                        Map<BasicBlock, Integer> indices) {
        BasicBlock entry = graph.getEntry();
        Terminator entryExit = entry.getTerminator();
        if (entryExit.getKind() != Terminator.Kind.JUMP) {
            throw new IllegalStateException("Entry is not normalized: " + entryExit);
        }
        BasicBlock first = entryExit.getTarget();

        int state = graph.allocateLocal(1);
        BasicBlock header = BasicBlock.create(graph.nextBlockName(), Collections.emptyList());

        // A lookup switch needs unique sorted keys; on a collision the first case added wins.
        Map<Integer, LabelNode> cases = new TreeMap<>();
        for (BasicBlock block : presentation) {
            cases.putIfAbsent(indices.get(block), block.getLabel());
        }
        int[] keys = new int[cases.size()];
        LabelNode[] labels = new LabelNode[cases.size()];
        int i = 0;
        for (Map.Entry<Integer, LabelNode> e : cases.entrySet()) {
            keys[i] = e.getKey();
            labels[i] = e.getValue();
            i++;
        }
        LookupSwitchInsnNode lookupSwitch = new LookupSwitchInsnNode(header.getLabel(), keys, labels);
        header.getNodes().add(new VarInsnNode(ILOAD, state));
        header.getNodes().add(lookupSwitch);
        header.setTerminator(Terminator.dispatch(lookupSwitch));
        graph.insertAfter(entry, header);

        Dispatcher dispatcher = new Dispatcher(header, lookupSwitch, state);

        entry.dropTerminatorInsn();
        entry.getNodes().add(Insns.iconst(indices.get(first)));
        entry.getNodes().add(dispatcher.storeState());
        JumpInsnNode jump = dispatcher.jumpToHeader();
        entry.getNodes().add(jump);
        entry.setExitStack(first.getEntryStack());
        entry.setTerminator(Terminator.jump(jump, header));
        return dispatcher;
    }
}
