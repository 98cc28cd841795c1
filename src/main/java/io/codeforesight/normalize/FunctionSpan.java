package io.codeforesight.normalize;

/**
 * Character range of one function definition, from the start of its header line
 * to just after its closing delimiter.
 */
record FunctionSpan(String name, int startOffset, int endOffset) {

    FunctionSpan {
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("invalid span " + startOffset + "-" + endOffset);
        }
    }
}
