package com.flowauto;

import lombok.Data;

/**
 * Per-call compilation options.
 */
@Data
public final class TranspilerOptions {
    /** Backend name to use instead of the analyzer's choice; null for automatic. */
    private String forceStrategy;
    private boolean includeMetadata = true;

    public static TranspilerOptions defaults() {
        return new TranspilerOptions();
    }

    public static TranspilerOptions forced(String strategy) {
        TranspilerOptions options = new TranspilerOptions();
        options.setForceStrategy(strategy);
        return options;
    }
}
