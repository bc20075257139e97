package com.omega.hoa.config;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for writing HOA text.
 */
@Data
@Builder
public class HoaWriterConfig {
    @Builder.Default
    private AliasPolicy aliasPolicy = AliasPolicy.INLINE;

    /** Omit labels when every state's edges are exactly the canonical valuation rows. */
    @Builder.Default
    private boolean implicitLabels = false;

    @Builder.Default
    private boolean includeStateNames = true;

    public static HoaWriterConfig defaults() {
        return HoaWriterConfig.builder().build();
    }
}
