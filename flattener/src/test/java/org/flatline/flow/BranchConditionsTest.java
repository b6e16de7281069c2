package org.flatline.flow;

import org.junit.jupiter.api.Test;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.InsnNode;
import org.objectweb.asm.tree.JumpInsnNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.VarInsnNode;

import java.util.function.IntBinaryOperator;
import java.util.function.IntUnaryOperator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class BranchConditionsTest implements Opcodes {

    private static final int[] VALUES = {Integer.MIN_VALUE, Integer.MIN_VALUE + 1, -65536, -2, -1, 0, 1, 2, 127,
            65536, Integer.MAX_VALUE - 1, Integer.MAX_VALUE};

    private static final int[] UNARY = {IFEQ, IFNE, IFLT, IFGE, IFGT, IFLE};
    private static final int[] BINARY = {IF_ICMPEQ, IF_ICMPNE, IF_ICMPLT, IF_ICMPGE, IF_ICMPGT, IF_ICMPLE};

    private static IntUnaryOperator unary(int opcode) {
        switch (opcode) {
            case IFEQ: return v -> v == 0 ? 1 : 0;
            case IFNE: return v -> v != 0 ? 1 : 0;
            case IFLT: return v -> v < 0 ? 1 : 0;
            case IFGE: return v -> v >= 0 ? 1 : 0;
            case IFGT: return v -> v > 0 ? 1 : 0;
            default: return v -> v <= 0 ? 1 : 0;
        }
    }

    private static IntBinaryOperator binary(int opcode) {
        switch (opcode) {
            case IF_ICMPEQ: return (a, b) -> a == b ? 1 : 0;
            case IF_ICMPNE: return (a, b) -> a != b ? 1 : 0;
            case IF_ICMPLT: return (a, b) -> a < b ? 1 : 0;
            case IF_ICMPGE: return (a, b) -> a >= b ? 1 : 0;
            case IF_ICMPGT: return (a, b) -> a > b ? 1 : 0;
            default: return (a, b) -> a <= b ? 1 : 0;
        }
    }

    /** One method per opcode: load the operands, materialize the condition, return it. */
    private static Class<?> conditions() {
        ClassNode cn = new ClassNode(ASM9);
        cn.version = V17;
        cn.access = ACC_PUBLIC | ACC_SUPER;
        cn.name = "org/flatline/flow/Conditions";
        cn.superName = "java/lang/Object";
        for (int op : UNARY) {
            cn.methods.add(condition("op" + op, "(I)I", op, ILOAD));
        }
        for (int op : BINARY) {
            cn.methods.add(condition("op" + op, "(II)I", op, ILOAD));
        }
        cn.methods.add(condition("op" + IFNULL, "(Ljava/lang/Object;)I", IFNULL, ALOAD));
        cn.methods.add(condition("op" + IFNONNULL, "(Ljava/lang/Object;)I", IFNONNULL, ALOAD));
        return FlatteningHarness.define(cn, "org/flatline/flow/Conditions");
    }

    private static MethodNode condition(String name, String desc, int opcode, int load) {
        MethodNode mn = new MethodNode(ACC_PUBLIC | ACC_STATIC, name, desc, null, null);
        int args = desc.startsWith("(II") ? 2 : 1;
        for (int i = 0; i < args; i++) {
            mn.instructions.add(new VarInsnNode(load, i));
        }
        BranchConditions.materialize(new JumpInsnNode(opcode, new LabelNode())).forEach(mn.instructions::add);
        mn.instructions.add(new InsnNode(IRETURN));
        mn.maxLocals = args;
        mn.maxStack = 8;
        return mn;
    }

    @Test
    public void testMaterializedConditionsMatchJumpSemantics() throws Exception {
        Class<?> conditions = conditions();
        for (int op : UNARY) {
            for (int v : VALUES) {
                assertEquals(unary(op).applyAsInt(v), FlatteningHarness.callStatic(conditions, "op" + op, v),
                        "opcode " + op + " on " + v);
            }
        }
        for (int op : BINARY) {
            for (int a : VALUES) {
                for (int b : VALUES) {
                    assertEquals(binary(op).applyAsInt(a, b), FlatteningHarness.callStatic(conditions, "op" + op, a, b),
                            "opcode " + op + " on " + a + ", " + b);
                }
            }
        }
        assertEquals(1, FlatteningHarness.callStatic(conditions, "op" + IFNULL, (Object) null));
        assertEquals(0, FlatteningHarness.callStatic(conditions, "op" + IFNULL, "x"));
        assertEquals(0, FlatteningHarness.callStatic(conditions, "op" + IFNONNULL, (Object) null));
        assertEquals(1, FlatteningHarness.callStatic(conditions, "op" + IFNONNULL, "x"));
    }

    @Test
    public void testReferenceIdentityIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> BranchConditions.materialize(new JumpInsnNode(IF_ACMPEQ, new LabelNode())));
        assertThrows(IllegalArgumentException.class,
                () -> BranchConditions.materialize(new JumpInsnNode(GOTO, new LabelNode())));
    }
}
