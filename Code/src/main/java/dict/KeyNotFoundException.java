package dict;

/**
 * Thrown by {@link Dictionary#read} when the key has no entry. A strict read
 * never fabricates a value, so the absence is reported to the caller.
 */
public class KeyNotFoundException extends Exception {

    private static final long serialVersionUID = 1L;

    private final transient Object key;

    public KeyNotFoundException(final Object key) {
        super("Not in dictionary: " + key);
        this.key = key;
    }

    /** The key that was looked up. */
    public Object getKey() {
        return key;
    }
}
