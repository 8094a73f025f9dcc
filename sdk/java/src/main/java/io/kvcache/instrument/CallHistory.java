package io.kvcache.instrument;

import java.util.ArrayList;
import java.util.List;

/**
 * The recorded call count and input/output pairs of one operation.
 */
public record CallHistory(String operation, long callCount, List<CallRecord> calls) {

    public CallHistory {
        calls = List.copyOf(calls);
    }

    /**
     * Renders the history as report lines: a header, then one line per call
     * unless the operation was never called.
     *
     * @return the report lines
     */
    public List<String> lines() {
        List<String> lines = new ArrayList<>();
        lines.add(operation + " was called " + callCount + " times:");
        if (callCount == 0) {
            return lines;
        }
        for (CallRecord call : calls) {
            lines.add(operation + "(*" + call.input() + ") -> " + call.output());
        }
        return lines;
    }
}
