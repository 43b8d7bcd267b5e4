package com.solast.jackson;

/**
 * Ancestor state handed down the recursion by value.
 *
 * <p>Only one fact is tracked: how many event definitions enclose the node being converted.
 * A depth rather than a flag, so leaving an inner event can never hide an outer one.</p>
 */
record ConversionContext(int eventDepth) {

    static final ConversionContext ROOT = new ConversionContext(0);

    ConversionContext enterEvent() {
        return new ConversionContext(eventDepth + 1);
    }

    boolean inEvent() {
        return eventDepth > 0;
    }
}
