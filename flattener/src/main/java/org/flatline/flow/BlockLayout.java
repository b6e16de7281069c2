package org.flatline.flow;

import org.flatline.flow.cfg.BasicBlock;
import org.flatline.flow.cfg.MethodGraph;
import org.flatline.flow.frame.AsmSanity;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes a flattened graph back into its method: entry, dispatch header, then the
 * dispatchable blocks in presentation order. Only the physical order is decided here;
 * every transfer already goes through the dispatcher.
 */
public final class BlockLayout {

    private BlockLayout() {}

    public static void apply(MethodGraph graph, Dispatcher dispatcher, List<BasicBlock> presentation) {
        List<BasicBlock> order = new ArrayList<>(presentation.size() + 2);
        order.add(graph.getEntry());
        order.add(dispatcher.getHeader());
        order.addAll(presentation);
        if (order.size() != graph.getBlocks().size()) {
            throw new IllegalStateException("Layout covers " + order.size() + " of "
                    + graph.getBlocks().size() + " blocks");
        }
        graph.writeBack(order);
        AsmSanity.sanitizeLocalVariables(graph.getMethod());
    }
}
