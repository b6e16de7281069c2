package org.flatline.flow.cfg;

import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.JumpInsnNode;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Control transfer that ends a {@link BasicBlock}.
 * <p>
 * For a {@link Kind#BRANCH} the true target is the jump label and the false target is
 * the fall-through block, matching the JVM semantics of the conditional jump opcodes.
 */
public final class Terminator {

    public enum Kind {
        RETURN,
        JUMP,
        BRANCH,
        /** Synthesized multi-way dispatch; never recovered from input code. */
        DISPATCH,
        UNSUPPORTED
    }

    private final Kind kind;
    private final AbstractInsnNode insn;
    private final BasicBlock trueTarget;
    private final BasicBlock falseTarget;
    private final String reason;

    private Terminator(Kind kind, AbstractInsnNode insn, BasicBlock trueTarget, BasicBlock falseTarget, String reason) {
        this.kind = kind;
        this.insn = insn;
        this.trueTarget = trueTarget;
        this.falseTarget = falseTarget;
        this.reason = reason;
    }

    public static Terminator ofReturn(AbstractInsnNode insn) {
        return new Terminator(Kind.RETURN, Objects.requireNonNull(insn, "insn"), null, null, null);
    }

    /**
     * @param insn the {@code GOTO}, or {@code null} for an implicit fall-through
     */
    public static Terminator jump(AbstractInsnNode insn, BasicBlock target) {
        return new Terminator(Kind.JUMP, insn, Objects.requireNonNull(target, "target"), null, null);
    }

    public static Terminator branch(JumpInsnNode insn, BasicBlock trueTarget, BasicBlock falseTarget) {
        return new Terminator(Kind.BRANCH, Objects.requireNonNull(insn, "insn"),
                Objects.requireNonNull(trueTarget, "trueTarget"),
                Objects.requireNonNull(falseTarget, "falseTarget"), null);
    }

    public static Terminator dispatch(AbstractInsnNode insn) {
        return new Terminator(Kind.DISPATCH, Objects.requireNonNull(insn, "insn"), null, null, null);
    }

    public static Terminator unsupported(AbstractInsnNode insn, String reason) {
        return new Terminator(Kind.UNSUPPORTED, insn, null, null, reason);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the instruction carrying the transfer, or {@code null} for a fall-through jump
     */
    public AbstractInsnNode getInsn() {
        return insn;
    }

    public JumpInsnNode getJumpInsn() {
        return (JumpInsnNode) insn;
    }

    /** Jump target, or the taken side of a branch. */
    public BasicBlock getTarget() {
        return trueTarget;
    }

    public BasicBlock getTrueTarget() {
        return trueTarget;
    }

    public BasicBlock getFalseTarget() {
        return falseTarget;
    }

    public String getReason() {
        return reason;
    }

    public List<BasicBlock> successors() {
        switch (kind) {
            case JUMP:
                return Collections.singletonList(trueTarget);
            case BRANCH:
                return List.of(trueTarget, falseTarget);
            default:
                return Collections.emptyList();
        }
    }

    public int successorCount() {
        return successors().size();
    }

    @Override
    public String toString() {
        switch (kind) {
            case JUMP:
                return "Jump(" + trueTarget.getName() + ")";
            case BRANCH:
                return "Branch(" + trueTarget.getName() + ", " + falseTarget.getName() + ")";
            case UNSUPPORTED:
                return "Unsupported(" + reason + ")";
            default:
                return kind.name();
        }
    }
}
