package io.kvcache.instrument;

/**
 * Renders the arguments of an instrumented call as the text kept in its input history.
 */
@FunctionalInterface
public interface ArgumentFormatter {

    String format(Object[] arguments);

    /**
     * Gets the formatter that renders arguments as a tuple literal, e.g. {@code ('foo',)}.
     * Histories written this way stay readable alongside those recorded by existing tooling.
     *
     * @return the tuple formatter
     */
    static ArgumentFormatter tuple() {
        return TupleFormatter.INSTANCE;
    }
}
