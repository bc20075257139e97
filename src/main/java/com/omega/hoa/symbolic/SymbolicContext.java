package com.omega.hoa.symbolic;

import lombok.Getter;

/**
 * Owner of the decision-diagram tables. Guards and conditions are only comparable when they
 * come from the same context, so readers that should agree on equality share one.
 */
@Getter
public class SymbolicContext {
    public static final int DEFAULT_NODE_TABLE_SIZE = 10_000;
    public static final int DEFAULT_CACHE_SIZE = 1_000;

    private final LabelSpace labelSpace;
    private final AcceptanceSpace acceptanceSpace;

    public SymbolicContext(int nodeTableSize, int cacheSize) {
        this.labelSpace = new LabelSpace(nodeTableSize, cacheSize);
        this.acceptanceSpace = new AcceptanceSpace(nodeTableSize, cacheSize);
    }

    public static SymbolicContext create() {
        return new SymbolicContext(DEFAULT_NODE_TABLE_SIZE, DEFAULT_CACHE_SIZE);
    }
}
