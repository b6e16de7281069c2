package org.flatline.flow;

/** How dispatch indices are drawn for the blocks of one method. */
public enum IndexPolicy {
    /** Redraw until every block has its own index. */
    UNIQUE,
    /** Independent draws; two blocks may share an index. */
    UNCHECKED
}
