package org.flatline.flow;

import org.flatline.flow.cfg.BasicBlock;
import org.flatline.flow.cfg.MethodGraph;
import org.flatline.flow.cfg.Terminator;
import org.flatline.flow.frame.AsmSanity;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.IincInsnNode;
import org.objectweb.asm.tree.LocalVariableNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TypeInsnNode;
import org.objectweb.asm.tree.VarInsnNode;
import org.objectweb.asm.tree.analysis.BasicValue;
import org.objectweb.asm.tree.analysis.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Makes flattened code pass the JVM verifier.
 * <p>
 * Once every block is entered from the dispatch header, the verifier merges the frames
 * of all blocks there. The original code relied on per-path types, so this pass:
 * <ol>
 *     <li>moves operand stack values that cross an edge into spill locals,</li>
 *     <li>casts loads of reassigned reference locals back to the type seen before flattening,</li>
 *     <li>gives each local slot a single value kind,</li>
 *     <li>initializes every non-parameter local at the entry,</li>
 *     <li>drops stale stack map frames and remaps the local variable table.</li>
 * </ol>
 */
public class FrameLegalizer implements Legalizer, Opcodes {

    private static final Logger logger = LoggerFactory.getLogger(FrameLegalizer.class);

    enum SlotKind {
        INT(ILOAD, ISTORE, ICONST_0, 1),
        FLOAT(FLOAD, FSTORE, FCONST_0, 1),
        LONG(LLOAD, LSTORE, LCONST_0, 2),
        DOUBLE(DLOAD, DSTORE, DCONST_0, 2),
        REFERENCE(ALOAD, ASTORE, ACONST_NULL, 1);

        final int load;
        final int store;
        final int zero;
        final int size;

        SlotKind(int load, int store, int zero, int size) {
            this.load = load;
            this.store = store;
            this.zero = zero;
            this.size = size;
        }

        static SlotKind of(Type type) {
            switch (type.getSort()) {
                case Type.BOOLEAN:
                case Type.CHAR:
                case Type.BYTE:
                case Type.SHORT:
                case Type.INT:
                    return INT;
                case Type.FLOAT:
                    return FLOAT;
                case Type.LONG:
                    return LONG;
                case Type.DOUBLE:
                    return DOUBLE;
                case Type.OBJECT:
                case Type.ARRAY:
                    return REFERENCE;
                default:
                    throw new IllegalArgumentException("No local slot kind for " + type);
            }
        }

        static SlotKind ofOpcode(int opcode) {
            switch (opcode) {
                case ILOAD:
                case ISTORE:
                case IINC:
                    return INT;
                case FLOAD:
                case FSTORE:
                    return FLOAT;
                case LLOAD:
                case LSTORE:
                    return LONG;
                case DLOAD:
                case DSTORE:
                    return DOUBLE;
                case ALOAD:
                case ASTORE:
                    return REFERENCE;
                default:
                    throw new IllegalArgumentException("Not a local variable opcode: " + opcode);
            }
        }
    }

    @Override
    public MethodGraph legalize(MethodGraph graph) {
        spillOperandStacks(graph);
        castReassignedReferences(graph);
        Map<String, Integer> slots = splitLocals(graph);
        initializeLocals(graph, slots);
        for (BasicBlock block : graph.getBlocks()) {
            AsmSanity.stripFrames(block.getNodes());
        }
        remapLocalVariables(graph.getMethod(), slots);
        return graph;
    }

    private static void spillOperandStacks(MethodGraph graph) {
        Map<String, Integer> spillSlots = new HashMap<>();
        for (BasicBlock block : graph.getBlocks()) {
            List<BasicValue> exit = block.getExitStack();
            if (!exit.isEmpty()) {
                List<AbstractInsnNode> nodes = block.getNodes();
                int at = nodes.indexOf(block.getTerminator().getInsn());
                List<AbstractInsnNode> stores = new ArrayList<>();
                for (int depth = exit.size() - 1; depth >= 0; depth--) {
                    SlotKind kind = SlotKind.of(exit.get(depth).getType());
                    stores.add(new VarInsnNode(kind.store, spillSlot(graph, spillSlots, depth, kind)));
                }
                nodes.addAll(at, stores);
            }
            List<BasicValue> entry = block.getEntryStack();
            if (!entry.isEmpty()) {
                List<AbstractInsnNode> loads = new ArrayList<>();
                for (int depth = 0; depth < entry.size(); depth++) {
                    Type type = entry.get(depth).getType();
                    SlotKind kind = SlotKind.of(type);
                    loads.add(new VarInsnNode(kind.load, spillSlot(graph, spillSlots, depth, kind)));
                    if (needsCast(type)) {
                        loads.add(new TypeInsnNode(CHECKCAST, type.getInternalName()));
                    }
                }
                block.getNodes().addAll(block.firstRealIndex(), loads);
            }
        }
        if (!spillSlots.isEmpty()) {
            logger.debug("{}.{}: {} spill slot(s)", graph.getOwner().name, graph.getMethod().name, spillSlots.size());
        }
    }

    private static int spillSlot(MethodGraph graph, Map<String, Integer> spillSlots, int depth, SlotKind kind) {
        return spillSlots.computeIfAbsent(depth + ":" + kind, k -> graph.allocateLocal(kind.size));
    }

    private static void castReassignedReferences(MethodGraph graph) {
        Set<Integer> reassigned = new HashSet<>();
        for (BasicBlock block : graph.getBlocks()) {
            for (AbstractInsnNode node : block.getNodes()) {
                if (node.getOpcode() == ASTORE) {
                    reassigned.add(((VarInsnNode) node).var);
                }
            }
        }
        if (reassigned.isEmpty()) {
            return;
        }
        for (BasicBlock block : graph.getBlocks()) {
            List<AbstractInsnNode> nodes = block.getNodes();
            for (int i = 0; i < nodes.size(); i++) {
                AbstractInsnNode node = nodes.get(i);
                if (node.getOpcode() != ALOAD || !reassigned.contains(((VarInsnNode) node).var)) {
                    continue;
                }
                Frame<BasicValue> frame = graph.frameAt(node);
                if (frame == null) {
                    continue;
                }
                Type type = frame.getLocal(((VarInsnNode) node).var).getType();
                if (type != null && needsCast(type)) {
                    nodes.add(++i, new TypeInsnNode(CHECKCAST, type.getInternalName()));
                }
            }
        }
    }

    private static boolean needsCast(Type type) {
        if (type.getSort() == Type.ARRAY) {
            return true;
        }
        if (type.getSort() != Type.OBJECT) {
            return false;
        }
        String name = type.getInternalName();
        return !"java/lang/Object".equals(name) && !"null".equals(name);
    }

    /**
     * Assigns every (slot, kind) pair its own slot. Parameters keep their slots and the
     * first pair seen for a slot keeps it when nothing else overlaps it.
     *
     * @return new slot by {@code slot + ":" + kind}, parameters included
     */
    private static Map<String, Integer> splitLocals(MethodGraph graph) {
        MethodNode method = graph.getMethod();
        Map<String, Integer> slots = new LinkedHashMap<>();
        Map<Integer, SlotKind> occupied = new HashMap<>();

        int slot = 0;
        if ((method.access & ACC_STATIC) == 0) {
            claim(slots, occupied, 0, SlotKind.REFERENCE, 0);
            slot = 1;
        }
        for (Type arg : Type.getArgumentTypes(method.desc)) {
            SlotKind kind = SlotKind.of(arg);
            claim(slots, occupied, slot, kind, slot);
            slot += kind.size;
        }

        for (BasicBlock block : graph.getBlocks()) {
            for (AbstractInsnNode node : block.getNodes()) {
                int var;
                if (node instanceof VarInsnNode v) {
                    var = v.var;
                } else if (node instanceof IincInsnNode iinc) {
                    var = iinc.var;
                } else {
                    continue;
                }
                SlotKind kind = SlotKind.ofOpcode(node.getOpcode());
                String key = var + ":" + kind;
                Integer mapped = slots.get(key);
                if (mapped == null) {
                    boolean free = true;
                    for (int i = var; i < var + kind.size; i++) {
                        free &= !occupied.containsKey(i);
                    }
                    mapped = free ? var : graph.allocateLocal(kind.size);
                    claim(slots, occupied, var, kind, mapped);
                }
                if (node instanceof VarInsnNode v) {
                    v.var = mapped;
                } else {
                    ((IincInsnNode) node).var = mapped;
                }
            }
        }
        return slots;
    }

    private static void claim(Map<String, Integer> slots, Map<Integer, SlotKind> occupied,
                              int var, SlotKind kind, int mapped) {
        slots.put(var + ":" + kind, mapped);
        for (int i = mapped; i < mapped + kind.size; i++) {
            occupied.put(i, kind);
        }
    }

    private static void initializeLocals(MethodGraph graph, Map<String, Integer> slots) {
        int parameterSlots = graph.getParameterSlots();
        Map<Integer, SlotKind> locals = new TreeMap<>();
        for (Map.Entry<String, Integer> e : slots.entrySet()) {
            int original = Integer.parseInt(e.getKey().substring(0, e.getKey().indexOf(':')));
            SlotKind kind = SlotKind.valueOf(e.getKey().substring(e.getKey().indexOf(':') + 1));
            boolean parameter = original < parameterSlots && original == e.getValue();
            if (!parameter) {
                locals.put(e.getValue(), kind);
            }
        }
        List<AbstractInsnNode> init = new ArrayList<>();
        for (Map.Entry<Integer, SlotKind> e : locals.entrySet()) {
            init.add(Insns.op(e.getValue().zero));
            init.add(new VarInsnNode(e.getValue().store, e.getKey()));
        }
        BasicBlock entry = graph.getEntry();
        entry.getNodes().addAll(entry.firstRealIndex(), init);
    }

    private static void remapLocalVariables(MethodNode method, Map<String, Integer> slots) {
        method.visibleLocalVariableAnnotations = null;
        method.invisibleLocalVariableAnnotations = null;
        if (method.localVariables == null) {
            return;
        }
        List<LocalVariableNode> kept = new ArrayList<>();
        for (LocalVariableNode lv : method.localVariables) {
            Integer mapped = slots.get(lv.index + ":" + SlotKind.of(Type.getType(lv.desc)));
            if (mapped != null) {
                lv.index = mapped;
                kept.add(lv);
            }
        }
        method.localVariables = kept;
    }
}
