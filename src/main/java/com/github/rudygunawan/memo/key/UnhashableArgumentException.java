package com.github.rudygunawan.memo.key;

/**
 * Thrown when an argument passed to a memoized computation cannot take part in a cache key because
 * its equality and hash code are not stable. Java arrays are the typical offender: they compare by
 * identity and their contents may change after the key is built.
 *
 * <p>The cache is left untouched when this is thrown and the computation is not invoked.
 */
public class UnhashableArgumentException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final transient Object argument;

    /**
     * Constructs a new exception for the given offending argument.
     *
     * @param argument the argument that cannot be used as part of a key
     * @param position where the argument was found, for example {@code "args[1]"} or {@code "kwargs[name]"}
     */
    public UnhashableArgumentException(Object argument, String position) {
        super("unhashable argument at " + position + ": " + argument.getClass().getTypeName());
        this.argument = argument;
    }

    /**
     * Returns the argument that was rejected.
     */
    public Object getArgument() {
        return argument;
    }
}
