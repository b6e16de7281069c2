package org.flatline.flow;

import org.flatline.flow.cfg.MethodGraph;

/**
 * Post-processing run once after a method's edges have been routed through the
 * dispatcher. It must return a graph with the same behavior whose code is still
 * acceptable where every block is entered from a single merge point.
 */
@FunctionalInterface
public interface Legalizer {

    MethodGraph legalize(MethodGraph graph);
}
