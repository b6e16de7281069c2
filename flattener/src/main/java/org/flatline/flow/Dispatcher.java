package org.flatline.flow;

import org.flatline.flow.cfg.BasicBlock;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.JumpInsnNode;
import org.objectweb.asm.tree.LookupSwitchInsnNode;
import org.objectweb.asm.tree.VarInsnNode;

/**
 * The dispatch loop of one flattened method: an {@code int} state local and a header
 * block that switches on it. The switch default is the header itself.
 */
public final class Dispatcher implements Opcodes {

    private final BasicBlock header;
    private final LookupSwitchInsnNode lookupSwitch;
    private final int stateSlot;

    Dispatcher(BasicBlock header, LookupSwitchInsnNode lookupSwitch, int stateSlot) {
        this.header = header;
        this.lookupSwitch = lookupSwitch;
        this.stateSlot = stateSlot;
    }

    public BasicBlock getHeader() {
        return header;
    }

    public int getCaseCount() {
        return lookupSwitch.keys.size();
    }

    VarInsnNode loadState() {
        return new VarInsnNode(ILOAD, stateSlot);
    }

    VarInsnNode storeState() {
        return new VarInsnNode(ISTORE, stateSlot);
    }

    JumpInsnNode jumpToHeader() {
        return new JumpInsnNode(GOTO, header.getLabel());
    }
}
