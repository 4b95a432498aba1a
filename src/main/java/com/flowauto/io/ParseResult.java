package com.flowauto.io;

import com.flowauto.node.FlowGraph;

import java.util.List;

/**
 * Outcome of decompiling one document.
 *
 * @param graph       the reconstructed graph; null on failure
 * @param format      {@code native} or {@code state-machine}; null when the text
 *                    could not be read at all
 * @param hadMetadata whether a valid round-trip metadata block was found
 */
public record ParseResult(boolean success, FlowGraph graph, List<String> errors, List<String> warnings,
        boolean hadMetadata, String format) {

    public ParseResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ParseResult success(FlowGraph graph, List<String> warnings, boolean hadMetadata, String format) {
        return new ParseResult(true, graph, List.of(), warnings, hadMetadata, format);
    }

    public static ParseResult failure(List<String> errors, List<String> warnings, boolean hadMetadata, String format) {
        return new ParseResult(false, null, errors, warnings, hadMetadata, format);
    }
}
