package io.kvcache.instrument;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kvcache.exception.DecodeException;
import io.kvcache.exception.KvCacheException;
import io.kvcache.store.StorageBackend;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Replays the recorded calls of an instrumented operation.
 *
 * <pre>
 * CallHistoryReporter reporter = new CallHistoryReporter(backend);
 * reporter.report("Cache.store");
 * // Cache.store was called 1 times:
 * // Cache.store(*('foo',)) -&gt; 5f0c...
 * </pre>
 */
public final class CallHistoryReporter {

    private final StorageBackend backend;
    private final PrintStream out;
    private final ObjectMapper objectMapper;

    public CallHistoryReporter(StorageBackend backend) {
        this(backend, System.out);
    }

    /**
     * Creates a reporter that prints to the given stream.
     *
     * @param backend the store holding counters and histories
     * @param out where reports are printed
     */
    public CallHistoryReporter(StorageBackend backend, PrintStream out) {
        this.backend = backend;
        this.out = out;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Reads the call count and the recorded calls of an operation. Inputs and outputs
     * are paired by position, up to the shorter of the two lists.
     *
     * @param operation the qualified operation name
     * @return the history, with a zero count if the operation was never called
     */
    public CallHistory history(String operation) {
        long count = callCount(operation);
        List<String> inputs = backend.range(Instrumentation.inputsKey(operation), 0, -1);
        List<String> outputs = backend.range(Instrumentation.outputsKey(operation), 0, -1);

        int paired = Math.min(inputs.size(), outputs.size());
        List<CallRecord> calls = new ArrayList<>(paired);
        for (int i = 0; i < paired; i++) {
            calls.add(new CallRecord(inputs.get(i), outputs.get(i)));
        }
        return new CallHistory(operation, count, calls);
    }

    /**
     * Prints the history of an operation and returns the printed text.
     *
     * @param operation the qualified operation name
     * @return the report, one line per entry
     */
    public String report(String operation) {
        List<String> lines = history(operation).lines();
        lines.forEach(out::println);
        return String.join("\n", lines);
    }

    /**
     * Renders the history of an operation as JSON.
     *
     * @param operation the qualified operation name
     * @return the JSON document
     */
    public String reportJson(String operation) {
        try {
            return objectMapper.writeValueAsString(history(operation));
        } catch (JsonProcessingException e) {
            throw new KvCacheException("Failed to serialize history of " + operation, e);
        }
    }

    /**
     * Reads the call counter of an operation.
     *
     * @param operation the qualified operation name
     * @return the count, 0 if never called
     */
    public long callCount(String operation) {
        Optional<byte[]> raw = backend.get(operation);
        if (raw.isEmpty()) {
            return 0;
        }
        try {
            return Long.parseLong(new String(raw.get(), StandardCharsets.US_ASCII));
        } catch (NumberFormatException e) {
            throw new DecodeException(operation, e);
        }
    }
}
