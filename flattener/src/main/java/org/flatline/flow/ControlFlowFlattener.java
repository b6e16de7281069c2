package org.flatline.flow;

import org.flatline.flow.cfg.BasicBlock;
import org.flatline.flow.cfg.MethodGraph;
import org.flatline.flow.cfg.Terminator;
import org.flatline.flow.debug.AsmDebug;
import org.flatline.flow.frame.ClassProvider;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Replaces the control flow of a method with a single dispatch loop.
 * <p>
 * Every block except the entry gets a random dispatch index. The entry stores the index
 * of its successor into a state local and jumps to a header that switches on it; every
 * other block computes the index of its successor without branching, stores it and
 * jumps back to the header. Return blocks keep their code.
 * <p>
 * Methods that cannot be flattened are reported through {@link FlattenResult} and left
 * unchanged. Instances hold no per-method state; a fresh {@link Random} is obtained for
 * every call.
 */
public final class ControlFlowFlattener {

    private static final Logger logger = LoggerFactory.getLogger(ControlFlowFlattener.class);

    private final Supplier<Random> randomSource;
    private final IndexPolicy indexPolicy;
    private final Legalizer legalizer;
    private final ClassProvider classProvider;

    public ControlFlowFlattener() {
        this(Random::new, IndexPolicy.UNIQUE, new FrameLegalizer(), ClassProvider.ofClasspath());
    }

    public ControlFlowFlattener(Supplier<Random> randomSource, IndexPolicy indexPolicy,
                                Legalizer legalizer, ClassProvider classProvider) {
        this.randomSource = Objects.requireNonNull(randomSource, "randomSource");
        this.indexPolicy = Objects.requireNonNull(indexPolicy, "indexPolicy");
        this.legalizer = Objects.requireNonNull(legalizer, "legalizer");
        this.classProvider = Objects.requireNonNull(classProvider, "classProvider");
    }

    /** Flattener whose n-th call draws from {@code new Random(seed)} advanced n times. */
    public static ControlFlowFlattener seeded(long seed, IndexPolicy indexPolicy, ClassProvider classProvider) {
        Random seeds = new Random(seed);
        return new ControlFlowFlattener(() -> new Random(seeds.nextLong()), indexPolicy,
                new FrameLegalizer(), classProvider);
    }

    public FlattenResult flatten(ClassNode owner, MethodNode method) {
        FlattenResult rejected = EligibilityChecker.checkMethod(method);
        if (rejected != null) {
            return rejected;
        }
        MethodGraph graph = MethodGraph.build(owner, method, classProvider);
        rejected = EligibilityChecker.checkGraph(graph);
        if (rejected != null) {
            return rejected;
        }

        Random random = randomSource.get();
        List<BasicBlock> dispatchable = EntryNormalizer.normalize(graph);
        Map<BasicBlock, Integer> indices = DispatchIndexAssigner.assign(dispatchable, random, indexPolicy);
        List<BasicBlock> presentation = DispatchIndexAssigner.shuffle(dispatchable, random);

        Map<BasicBlock, Terminator> originals = new LinkedHashMap<>();
        for (BasicBlock block : dispatchable) {
            originals.put(block, block.getTerminator());
        }

        Dispatcher dispatcher = DispatcherSynthesizer.synthesize(graph, presentation, indices);
        EdgeRewriter.rewrite(dispatcher, dispatchable, originals, indices);
        MethodGraph legal = legalizer.legalize(graph);
        BlockLayout.apply(legal, dispatcher, presentation);

        if (logger.isDebugEnabled()) {
            logger.debug("Flattened {}.{}{}: {} blocks, {} cases", owner.name, method.name, method.desc,
                    dispatchable.size(), dispatcher.getCaseCount());
        }
        if (logger.isTraceEnabled()) {
            logger.trace("Code of {}.{}{}:\n{}", owner.name, method.name, method.desc,
                    AsmDebug.disassembleWithIndex(method));
        }
        return FlattenResult.applied(dispatcher.getCaseCount());
    }
}
