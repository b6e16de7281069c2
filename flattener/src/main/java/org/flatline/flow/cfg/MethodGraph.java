package org.flatline.flow.cfg;

import org.flatline.flow.frame.ClassProvider;
import org.flatline.flow.frame.FrameAnalyzer;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.JumpInsnNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.tree.LookupSwitchInsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TableSwitchInsnNode;
import org.objectweb.asm.tree.analysis.AnalyzerException;
import org.objectweb.asm.tree.analysis.BasicValue;
import org.objectweb.asm.tree.analysis.Frame;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Control flow graph of one method.
 * <p>
 * Building the graph never touches the {@link MethodNode}: blocks own copies of the
 * node references, and frames are snapshotted by instruction identity so they stay
 * available while blocks are rewritten. The method's instruction list is only replaced
 * by {@link #writeBack(List)}.
 */
public final class MethodGraph implements Opcodes {

    private final ClassNode owner;
    private final MethodNode method;
    private final List<BasicBlock> blocks;
    private final List<AbstractInsnNode> trailer;
    private final Map<AbstractInsnNode, Frame<BasicValue>> frames;
    private final String analysisFailure;
    private final boolean uninitializedAcrossEdge;
    private int maxLocals;
    private int syntheticBlocks;

    private MethodGraph(ClassNode owner, MethodNode method, List<BasicBlock> blocks, List<AbstractInsnNode> trailer,
                        Map<AbstractInsnNode, Frame<BasicValue>> frames, String analysisFailure,
                        boolean uninitializedAcrossEdge) {
        this.owner = owner;
        this.method = method;
        this.blocks = blocks;
        this.trailer = trailer;
        this.frames = frames;
        this.analysisFailure = analysisFailure;
        this.uninitializedAcrossEdge = uninitializedAcrossEdge;
        this.maxLocals = method.maxLocals;
    }

    public static MethodGraph build(ClassNode owner, MethodNode method, ClassProvider provider) {
        Frame<BasicValue>[] analyzed;
        try {
            analyzed = FrameAnalyzer.analyze(owner, method, provider);
        } catch (AnalyzerException e) {
            return new MethodGraph(owner, method, new ArrayList<>(), new ArrayList<>(),
                    new IdentityHashMap<>(), "frame analysis failed: " + e.getMessage(), false);
        }

        Map<AbstractInsnNode, Frame<BasicValue>> frames = new IdentityHashMap<>();
        AbstractInsnNode[] insns = method.instructions.toArray();
        for (int i = 0; i < insns.length; i++) {
            if (analyzed[i] != null) {
                frames.put(insns[i], analyzed[i]);
            }
        }

        Set<AbstractInsnNode> leaders = findLeaders(insns);

        List<List<AbstractInsnNode>> runs = new ArrayList<>();
        List<AbstractInsnNode> current = null;
        List<AbstractInsnNode> pending = new ArrayList<>();
        boolean uninitializedAcrossEdge = false;
        int pendingNew = 0;
        for (AbstractInsnNode insn : insns) {
            if (insn.getOpcode() < 0) {
                pending.add(insn);
                continue;
            }
            if (current == null || leaders.contains(insn)) {
                if (pendingNew > 0 && current != null) {
                    uninitializedAcrossEdge = true;
                }
                current = new ArrayList<>();
                runs.add(current);
            }
            current.addAll(pending);
            pending.clear();
            current.add(insn);

            if (insn.getOpcode() == NEW) {
                pendingNew++;
            } else if (insn instanceof MethodInsnNode call && call.getOpcode() == INVOKESPECIAL
                    && "<init>".equals(call.name) && pendingNew > 0) {
                pendingNew--;
            }
        }

        List<BasicBlock> blocks = new ArrayList<>();
        Map<LabelNode, BasicBlock> labelToBlock = new IdentityHashMap<>();
        for (List<AbstractInsnNode> run : runs) {
            LabelNode label = null;
            AbstractInsnNode firstReal = null;
            for (AbstractInsnNode node : run) {
                if (node.getOpcode() >= 0) {
                    firstReal = node;
                    break;
                }
                if (label == null && node instanceof LabelNode l) {
                    label = l;
                }
            }
            List<AbstractInsnNode> nodes = new ArrayList<>(run);
            if (label == null) {
                label = new LabelNode();
                nodes.add(0, label);
            }
            Frame<BasicValue> entry = frames.get(firstReal);
            List<BasicValue> stack = new ArrayList<>();
            if (entry != null) {
                for (int i = 0; i < entry.getStackSize(); i++) {
                    stack.add(entry.getStack(i));
                }
            }
            BasicBlock block = new BasicBlock("B" + blocks.size(), label, nodes, entry == null ? null : stack);
            blocks.add(block);
            for (AbstractInsnNode node : run) {
                if (node.getOpcode() >= 0) {
                    break;
                }
                if (node instanceof LabelNode l) {
                    labelToBlock.put(l, block);
                }
            }
        }

        for (int i = 0; i < blocks.size(); i++) {
            BasicBlock next = i + 1 < blocks.size() ? blocks.get(i + 1) : null;
            blocks.get(i).setTerminator(classify(blocks.get(i), next, labelToBlock));
        }

        // Unreachable code has no frame and is dropped by the layout.
        List<BasicBlock> reachable = new ArrayList<>();
        for (BasicBlock block : blocks) {
            if (block.getEntryStack() != null) {
                reachable.add(block);
            }
        }
        return new MethodGraph(owner, method, reachable, new ArrayList<>(pending), frames, null,
                uninitializedAcrossEdge);
    }

    private static Set<AbstractInsnNode> findLeaders(AbstractInsnNode[] insns) {
        Set<LabelNode> targets = new HashSet<>();
        Set<AbstractInsnNode> leaders = new HashSet<>();
        boolean afterTransfer = true;
        for (AbstractInsnNode insn : insns) {
            if (insn.getOpcode() < 0) {
                continue;
            }
            if (afterTransfer) {
                leaders.add(insn);
            }
            afterTransfer = false;
            if (insn instanceof JumpInsnNode jump) {
                targets.add(jump.label);
                afterTransfer = true;
            } else if (insn instanceof TableSwitchInsnNode ts) {
                targets.add(ts.dflt);
                targets.addAll(ts.labels);
                afterTransfer = true;
            } else if (insn instanceof LookupSwitchInsnNode ls) {
                targets.add(ls.dflt);
                targets.addAll(ls.labels);
                afterTransfer = true;
            } else if (isExit(insn.getOpcode())) {
                afterTransfer = true;
            }
        }
        for (LabelNode target : targets) {
            AbstractInsnNode p = target;
            while (p != null && p.getOpcode() < 0) {
                p = p.getNext();
            }
            if (p != null) {
                leaders.add(p);
            }
        }
        return leaders;
    }

    private static boolean isExit(int opcode) {
        return (opcode >= IRETURN && opcode <= RETURN) || opcode == ATHROW || opcode == RET;
    }

    private static Terminator classify(BasicBlock block, BasicBlock next, Map<LabelNode, BasicBlock> labelToBlock) {
        AbstractInsnNode last = null;
        List<AbstractInsnNode> nodes = block.getNodes();
        for (int i = nodes.size() - 1; i >= 0; i--) {
            if (nodes.get(i).getOpcode() >= 0) {
                last = nodes.get(i);
                break;
            }
        }
        int op = last == null ? -1 : last.getOpcode();
        if (op >= IRETURN && op <= RETURN) {
            return Terminator.ofReturn(last);
        }
        if (op == GOTO) {
            return Terminator.jump(last, resolve(labelToBlock, ((JumpInsnNode) last).label));
        }
        if (op == IF_ACMPEQ || op == IF_ACMPNE) {
            return Terminator.unsupported(last, "reference identity comparison");
        }
        if (op == JSR || op == RET) {
            return Terminator.unsupported(last, "subroutine");
        }
        if (op == ATHROW) {
            return Terminator.unsupported(last, "exception unwinding");
        }
        if (op == TABLESWITCH || op == LOOKUPSWITCH) {
            return Terminator.unsupported(last, "multi-way branch");
        }
        if (last instanceof JumpInsnNode jump) {
            if (next == null) {
                return Terminator.unsupported(last, "branch falls off the end of the code");
            }
            return Terminator.branch(jump, resolve(labelToBlock, jump.label), next);
        }
        if (next == null) {
            return Terminator.unsupported(last, "falls off the end of the code");
        }
        return Terminator.jump(null, next);
    }

    private static BasicBlock resolve(Map<LabelNode, BasicBlock> labelToBlock, LabelNode label) {
        BasicBlock block = labelToBlock.get(label);
        if (block == null) {
            throw new IllegalStateException("Jump target does not start a block: " + label);
        }
        return block;
    }

    public ClassNode getOwner() {
        return owner;
    }

    public MethodNode getMethod() {
        return method;
    }

    /** Blocks in natural order; the entry comes first. */
    public List<BasicBlock> getBlocks() {
        return blocks;
    }

    public BasicBlock getEntry() {
        return blocks.get(0);
    }

    /** Whether any block transfers control to {@code block}. */
    public boolean hasPredecessors(BasicBlock block) {
        for (BasicBlock b : blocks) {
            if (b.getTerminator() != null && b.getTerminator().successors().contains(block)) {
                return true;
            }
        }
        return false;
    }

    public void setEntry(BasicBlock entry) {
        blocks.add(0, entry);
    }

    public void insertAfter(BasicBlock anchor, BasicBlock block) {
        int at = blocks.indexOf(anchor);
        if (at < 0) {
            throw new IllegalArgumentException(anchor + " is not part of the graph");
        }
        blocks.add(at + 1, block);
    }

    /** Frame in effect before {@code insn} in the original code, or {@code null} for synthesized code. */
    public Frame<BasicValue> frameAt(AbstractInsnNode insn) {
        return frames.get(insn);
    }

    public String getAnalysisFailure() {
        return analysisFailure;
    }

    public boolean hasUninitializedAcrossEdge() {
        return uninitializedAcrossEdge;
    }

    /** Number of local slots taken by {@code this} and the parameters. */
    public int getParameterSlots() {
        int size = Type.getArgumentsAndReturnSizes(method.desc) >> 2;
        return (method.access & ACC_STATIC) != 0 ? size - 1 : size;
    }

    public int getMaxLocals() {
        return maxLocals;
    }

    /** Reserves {@code size} new local slots and returns the first one. */
    public int allocateLocal(int size) {
        int slot = maxLocals;
        maxLocals += size;
        return slot;
    }

    public String nextBlockName() {
        return "S" + syntheticBlocks++;
    }

    /** Replaces the method's code with the blocks in {@code order}, followed by the trailer. */
    public void writeBack(List<BasicBlock> order) {
        for (AbstractInsnNode insn : method.instructions.toArray()) {
            method.instructions.remove(insn);
        }
        for (BasicBlock block : order) {
            for (AbstractInsnNode node : block.getNodes()) {
                method.instructions.add(node);
            }
        }
        for (AbstractInsnNode node : trailer) {
            method.instructions.add(node);
        }
        method.maxLocals = maxLocals;
        method.maxStack = 0;
    }
}
