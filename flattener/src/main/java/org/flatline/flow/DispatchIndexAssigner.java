package org.flatline.flow;

import org.flatline.flow.cfg.BasicBlock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/** Draws the random 32-bit dispatch index of every dispatchable block. */
public final class DispatchIndexAssigner {

    private DispatchIndexAssigner() {}

    public static Map<BasicBlock, Integer> assign(List<BasicBlock> dispatchable, Random random, IndexPolicy policy) {
        Map<BasicBlock, Integer> indices = new LinkedHashMap<>();
        Set<Integer> used = new HashSet<>();
        for (BasicBlock block : dispatchable) {
            int index = random.nextInt();
            if (policy == IndexPolicy.UNIQUE) {
                while (!used.add(index)) {
                    index = random.nextInt();
                }
            }
            indices.put(block, index);
        }
        return indices;
    }

    /**
     * Independent permutation of the dispatchable blocks. It decides the order cases are
     * added to the dispatcher and the physical order of the blocks, nothing else.
     */
    public static List<BasicBlock> shuffle(List<BasicBlock> dispatchable, Random random) {
        List<BasicBlock> order = new ArrayList<>(dispatchable);
        Collections.shuffle(order, random);
        return order;
    }
}
