package io.kvcache.instrument;

/**
 * One recorded call: the rendered arguments and the rendered result.
 */
public record CallRecord(String input, String output) {
}
