package org.flatline.flow.cfg;

import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.tree.analysis.BasicValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A straight-line run of instructions owned by a {@link MethodGraph}.
 * <p>
 * The node list starts with the block label and includes the terminator instruction
 * when there is one. Blocks are edited through this list; the method's
 * {@code InsnList} is only rebuilt when the graph is laid out.
 */
public final class BasicBlock {

    private final String name;
    private final LabelNode label;
    private final List<AbstractInsnNode> nodes;
    private final List<BasicValue> entryStack;
    private Terminator terminator;
    private List<BasicValue> exitStack = Collections.emptyList();

    BasicBlock(String name, LabelNode label, List<AbstractInsnNode> nodes, List<BasicValue> entryStack) {
        this.name = name;
        this.label = label;
        this.nodes = nodes;
        this.entryStack = entryStack;
    }

    public static BasicBlock create(String name, List<BasicValue> entryStack) {
        LabelNode label = new LabelNode();
        List<AbstractInsnNode> nodes = new ArrayList<>();
        nodes.add(label);
        return new BasicBlock(name, label, nodes, new ArrayList<>(entryStack));
    }

    public String getName() {
        return name;
    }

    /** Label the dispatcher and jumps use to enter this block. */
    public LabelNode getLabel() {
        return label;
    }

    /** Mutable node list, label first. */
    public List<AbstractInsnNode> getNodes() {
        return nodes;
    }

    /** Operand stack types live on entry, bottom first; {@code null} when the block is unreachable. */
    public List<BasicValue> getEntryStack() {
        return entryStack == null ? null : Collections.unmodifiableList(entryStack);
    }

    public Terminator getTerminator() {
        return terminator;
    }

    public void setTerminator(Terminator terminator) {
        this.terminator = terminator;
    }

    /** Operand stack carried out of the block when it leaves through the dispatcher. */
    public List<BasicValue> getExitStack() {
        return exitStack;
    }

    public void setExitStack(List<BasicValue> exitStack) {
        this.exitStack = exitStack == null ? Collections.emptyList() : List.copyOf(exitStack);
    }

    /** Position of the first real instruction, or the node count when there is none. */
    public int firstRealIndex() {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).getOpcode() >= 0) {
                return i;
            }
        }
        return nodes.size();
    }

    public int realInsnCount() {
        int count = 0;
        for (AbstractInsnNode node : nodes) {
            if (node.getOpcode() >= 0) {
                count++;
            }
        }
        return count;
    }

    /** Removes the terminator instruction from the node list, if it has one. */
    public void dropTerminatorInsn() {
        AbstractInsnNode insn = terminator == null ? null : terminator.getInsn();
        if (insn != null && !nodes.remove(insn)) {
            throw new IllegalStateException("Terminator of " + name + " is not part of the block");
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
