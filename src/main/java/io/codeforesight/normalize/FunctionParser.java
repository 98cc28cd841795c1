package io.codeforesight.normalize;

import java.util.List;

/**
 * Language-aware extraction of function definitions.
 */
interface FunctionParser {

    /**
     * Returns the outermost function definitions in source order.
     *
     * @throws SourceParseException if the text is not structurally well formed
     */
    List<FunctionSpan> parse(String text) throws SourceParseException;
}
