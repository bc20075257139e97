package com.omega.hoa.config;

import com.omega.hoa.diagnostics.Diagnostics;
import com.omega.hoa.symbolic.SymbolicContext;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for reading HOA text.
 */
@Data
@Builder
public class HoaParserConfig {
    /** Errors kept per automaton; later ones are only counted. */
    @Builder.Default
    private int maxErrors = Diagnostics.DEFAULT_MAX_ERRORS;

    /** Compare the declared condition with the shape its {@code acc-name:} implies. */
    @Builder.Default
    private boolean checkAcceptanceName = true;

    /**
     * Read a body without any labels as implicitly labeled even when
     * {@code implicit-labels} is not declared.
     */
    @Builder.Default
    private boolean inferImplicitLabels = true;

    @Builder.Default
    private int nodeTableSize = SymbolicContext.DEFAULT_NODE_TABLE_SIZE;

    @Builder.Default
    private int cacheSize = SymbolicContext.DEFAULT_CACHE_SIZE;

    public static HoaParserConfig defaults() {
        return HoaParserConfig.builder().build();
    }

    public SymbolicContext newSymbolicContext() {
        return new SymbolicContext(nodeTableSize, cacheSize);
    }
}
