package org.flatline.flow;

import org.flatline.flow.cfg.BasicBlock;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.InsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.VarInsnNode;

import java.util.Collections;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class DispatchFormulaTest implements Opcodes {

    private static final int[] INDICES = {0, 1, -1, 7, 100, 0x55555555, 0xAAAAAAAA, Integer.MIN_VALUE,
            Integer.MAX_VALUE, 123456789, -987654321};

    @Test
    public void testFormulaSelectsTargetByCondition() {
        for (int self : INDICES) {
            for (int t : INDICES) {
                for (int f : INDICES) {
                    assertEquals(t, DispatchFormula.next(self, self, true, t, f));
                    assertEquals(f, DispatchFormula.next(self, self, false, t, f));
                }
            }
        }
        Random random = new Random(17L);
        for (int i = 0; i < 10_000; i++) {
            int self = random.nextInt();
            int t = random.nextInt();
            int f = random.nextInt();
            assertEquals(t, DispatchFormula.next(self, self, true, t, f));
            assertEquals(f, DispatchFormula.next(self, self, false, t, f));
        }
    }

    @Test
    public void testJumpIsTheZeroMaskCase() {
        for (int self : INDICES) {
            for (int s : INDICES) {
                assertEquals(s, DispatchFormula.next(self, self, false, s, s));
                assertEquals(s, DispatchFormula.next(self, self, true, s, s));
            }
        }
    }

    @Test
    public void testEmittedCodeMatchesFormula() throws Exception {
        Dispatcher dispatcher = new Dispatcher(BasicBlock.create("H", Collections.emptyList()), null, 0);
        int[][] cases = {{100, 7, 9}, {Integer.MIN_VALUE, Integer.MAX_VALUE, 0}, {-1, 0, -1}, {0x1234, 0x4321, 0x1234}};

        ClassNode cn = new ClassNode(ASM9);
        cn.version = V17;
        cn.access = ACC_PUBLIC | ACC_SUPER;
        cn.name = "org/flatline/flow/Formula";
        cn.superName = "java/lang/Object";
        for (int i = 0; i < cases.length; i++) {
            int self = cases[i][0];
            int t = cases[i][1];
            int f = cases[i][2];

            // (state, condition) -> next state
            MethodNode branch = new MethodNode(ACC_PUBLIC | ACC_STATIC, "branch" + i, "(II)I", null, null);
            branch.instructions.add(new VarInsnNode(ILOAD, 1));
            DispatchFormula.branch(dispatcher, self, t, f).forEach(branch.instructions::add);
            branch.instructions.add(new InsnNode(IRETURN));
            cn.methods.add(branch);

            MethodNode jump = new MethodNode(ACC_PUBLIC | ACC_STATIC, "jump" + i, "(I)I", null, null);
            DispatchFormula.jump(dispatcher, self, t).forEach(jump.instructions::add);
            jump.instructions.add(new InsnNode(IRETURN));
            cn.methods.add(jump);
        }
        Class<?> formula = FlatteningHarness.define(cn, "org/flatline/flow/Formula");

        for (int i = 0; i < cases.length; i++) {
            int self = cases[i][0];
            assertEquals(cases[i][1], FlatteningHarness.callStatic(formula, "branch" + i, self, 1));
            assertEquals(cases[i][2], FlatteningHarness.callStatic(formula, "branch" + i, self, 0));
            assertEquals(cases[i][1], FlatteningHarness.callStatic(formula, "jump" + i, self));
        }
    }
}
