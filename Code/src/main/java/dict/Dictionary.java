package dict;

import java.util.Map;

/**
 * A collection of keys, each associated with one value.
 *
 * An element is either in the dictionary or not; there is no notion of
 * several equivalent keys. Keys iterate in the order the implementation
 * defines ({@link OrderedMap} iterates in ascending key order).
 *
 * @param <K> key type, must not be null
 * @param <V> value type
 */
public interface Dictionary<K, V> extends Iterable<K> {

    /** PRECONDITION: key CANNOT BE NULL **/
    boolean contains(K key);

    /**
     * Associate value with key, replacing the value of an existing entry.
     *
     * @return the previous value, or null if the key was not present
     */
    V insert(K key, V value);

    /**
     * Remove the entry for key. Removing an absent key is a no-op.
     *
     * @return true if an entry was removed
     */
    boolean remove(K key);

    /**
     * Strict read: never mutates the dictionary.
     *
     * @throws KeyNotFoundException if the key has no entry
     */
    V read(K key) throws KeyNotFoundException;

    /** Lenient read: null when the key has no entry. Never mutates. */
    V get(K key);

    /**
     * Mutable access. An absent key is added with a default value first.
     * The returned entry writes through to the dictionary until the next
     * structural modification.
     */
    Map.Entry<K, V> access(K key);

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Release every entry.
     *
     * @return the number of entries released
     */
    int clear();
}
