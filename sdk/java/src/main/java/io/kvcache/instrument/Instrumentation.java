package io.kvcache.instrument;

import io.kvcache.store.StorageBackend;

/**
 * Wraps operations with call counting and input/output history recording.
 * All state lives in the backend, keyed by the operation's qualified name.
 *
 * <pre>
 * Operation&lt;String, String&gt; op = Instrumentation.counted(backend, "Cache.store",
 *     Instrumentation.recorded(backend, "Cache.store", ArgumentFormatter.tuple(), body));
 * </pre>
 */
public final class Instrumentation {

    private Instrumentation() {
        // Utility class
    }

    /**
     * Gets the key of the list holding the inputs of an operation.
     *
     * @param qualifiedName the operation name
     * @return the inputs key
     */
    public static String inputsKey(String qualifiedName) {
        return qualifiedName + ":inputs";
    }

    /**
     * Gets the key of the list holding the outputs of an operation.
     *
     * @param qualifiedName the operation name
     * @return the outputs key
     */
    public static String outputsKey(String qualifiedName) {
        return qualifiedName + ":outputs";
    }

    /**
     * Increments the counter named {@code qualifiedName} before every call of {@code operation}.
     */
    public static <T, R> Operation<T, R> counted(StorageBackend backend, String qualifiedName, Operation<T, R> operation) {
        return argument -> {
            backend.increment(qualifiedName);
            return operation.apply(argument);
        };
    }

    /**
     * Runs {@code operation}, then appends the formatted argument to the inputs list and the
     * result's string form to the outputs list in one atomic backend step. Concurrent calls
     * therefore keep the i-th input paired with the i-th output. A failing call records nothing.
     */
    public static <T, R> Operation<T, R> recorded(StorageBackend backend, String qualifiedName,
                                                  ArgumentFormatter formatter, Operation<T, R> operation) {
        String inputs = inputsKey(qualifiedName);
        String outputs = outputsKey(qualifiedName);
        return argument -> {
            String input = formatter.format(new Object[]{argument});
            R result = operation.apply(argument);
            backend.appendPair(inputs, input, outputs, String.valueOf(result));
            return result;
        };
    }
}
