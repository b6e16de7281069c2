package org.flatline.flow;

import org.flatline.flow.cfg.BasicBlock;
import org.flatline.flow.cfg.MethodGraph;
import org.flatline.flow.cfg.Terminator;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.MethodNode;

/**
 * Decides whether a method can be flattened. Both checks are read-only: a method
 * rejected here is left exactly as it was.
 */
public final class EligibilityChecker implements Opcodes {

    private EligibilityChecker() {}

    /**
     * Checks that need no control flow graph.
     *
     * @return the rejection, or {@code null} when the method may proceed to graph analysis
     */
    public static FlattenResult checkMethod(MethodNode method) {
        if ((method.access & (ACC_ABSTRACT | ACC_NATIVE)) != 0
                || method.instructions == null || method.instructions.size() == 0) {
            return FlattenResult.trivial("no code");
        }
        if ("<init>".equals(method.name) || "<clinit>".equals(method.name)) {
            return FlattenResult.unsupported("initializer " + method.name);
        }
        if (method.tryCatchBlocks != null && !method.tryCatchBlocks.isEmpty()) {
            return FlattenResult.unsupported("exception handlers");
        }
        return null;
    }

    /**
     * @return the rejection, or {@code null} when the graph can be flattened
     */
    public static FlattenResult checkGraph(MethodGraph graph) {
        if (graph.getAnalysisFailure() != null) {
            return FlattenResult.unsupported(graph.getAnalysisFailure());
        }
        for (BasicBlock block : graph.getBlocks()) {
            Terminator t = block.getTerminator();
            if (t.getKind() == Terminator.Kind.UNSUPPORTED) {
                return FlattenResult.unsupported(t.getReason() + " in " + block.getName());
            }
        }
        if (graph.hasUninitializedAcrossEdge()) {
            return FlattenResult.unsupported("uninitialized object live across a branch");
        }
        if (graph.getBlocks().size() <= 1) {
            return FlattenResult.trivial("single block");
        }
        return null;
    }
}
