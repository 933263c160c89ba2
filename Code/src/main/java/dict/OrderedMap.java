package dict;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import java.io.PrintStream;
import java.util.AbstractMap;
import java.util.ArrayDeque;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Unbalanced binary search tree implementation of {@link Dictionary}.
 *
 * Nodes are linked by left, right and parent references. Keys in a left
 * subtree compare less than the node's key, keys in a right subtree compare
 * greater. {@link Comparable#compareTo} decides the branch and
 * {@link Object#equals} decides a match; the two must agree.
 *
 * Not thread-safe. Every walk is iterative, so chain-shaped trees built by
 * sorted insertion cost linear time but never overflow the stack.
 *
 * @param <K> key type, must not be null
 * @param <V> value type, null allowed
 */
public class OrderedMap<K extends Comparable<? super K>, V> implements Dictionary<K,V> {

    private static final Logger log = Logger.getLogger(OrderedMap.class);

    //--------------------------------------------------------------------------------
    // Class: Node
    //--------------------------------------------------------------------------------
    protected static final class Node<E extends Comparable<? super E>, V> implements Map.Entry<E,V> {
        E key;
        V value;
        Node<E,V> left;
        Node<E,V> right;
        Node<E,V> parent;   // back-reference, traversal only

        Node(final E key, final V value, final Node<E,V> parent) {
            this.key = key;
            this.value = value;
            this.parent = parent;
        }

        boolean isLeaf() {
            return left == null && right == null;
        }

        Node<E,V> minNode() {
            Node<E,V> p = this;
            while (p.left != null) p = p.left;
            return p;
        }

        Node<E,V> maxNode() {
            Node<E,V> p = this;
            while (p.right != null) p = p.right;
            return p;
        }

        @Override
        public E getKey() {
            return key;
        }

        @Override
        public V getValue() {
            return value;
        }

        @Override
        public V setValue(final V value) {
            final V old = this.value;
            this.value = value;
            return old;
        }

        @Override
        public boolean equals(final Object o) {
            if (!(o instanceof Map.Entry)) return false;
            final Map.Entry<?,?> e = (Map.Entry<?,?>) o;
            return Objects.equals(key, e.getKey()) && Objects.equals(value, e.getValue());
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(key) ^ Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return key + "=" + value;
        }
    }

    //--------------------------------------------------------------------------------
    // DICTIONARY
    //--------------------------------------------------------------------------------
    private Node<K,V> root;
    private int size;
    private int modCount;   // structural modifications, for fail-fast cursors
    private Supplier<? extends V> defaultValue;

    /** Auto-vivified entries start with a null value. */
    public OrderedMap() {
        this(() -> null);
    }

    /**
     * @param defaultValue produces the value of an entry created by {@link #access}
     */
    public OrderedMap(final Supplier<? extends V> defaultValue) {
        this.defaultValue = Objects.requireNonNull(defaultValue, "defaultValue");
    }

    /** Deep copy: same keys, values and shape, no node shared with other. */
    public OrderedMap(final OrderedMap<K,V> other) {
        this(other.defaultValue);
        this.root = copyTree(other.root);
        this.size = other.size;
        if (log.isDebugEnabled())
            log.debug("copied " + size + " nodes");
    }

//--------------------------------------------------------------------------------
// PUBLIC METHODS:
// - contains / read / get / access
// - insert
// - remove
//--------------------------------------------------------------------------------

    /** PRECONDITION: key CANNOT BE NULL **/
    @Override
    public final boolean contains(final K key) {
        return findNode(key) != null;
    }

    /** PRECONDITION: key CANNOT BE NULL **/
    @Override
    public final V read(final K key) throws KeyNotFoundException {
        final Node<K,V> n = findNode(key);
        if (n == null) throw new KeyNotFoundException(key);
        return n.value;
    }

    /** PRECONDITION: key CANNOT BE NULL **/
    @Override
    public final V get(final K key) {
        final Node<K,V> n = findNode(key);
        return (n == null) ? null : n.value;
    }

    /**
     * Returns the entry for key, creating it with the default value when
     * absent. The new node hangs off the last link followed by the failed
     * search. Callers that only want to look must use {@link #contains} or
     * {@link #read}. PRECONDITION: key CANNOT BE NULL
     */
    @Override
    public final Map.Entry<K,V> access(final K key) {
        return findOrCreate(key, defaultValue);
    }

    // Insert key to dictionary, returns the previous value associated with the specified key,
    // or null if there was no mapping for the key
    /** PRECONDITION: key CANNOT BE NULL **/
    @Override
    public final V insert(final K key, final V value) {
        final int before = size;
        final Node<K,V> n = findOrCreate(key, () -> value);
        if (size != before) return null;
        return n.setValue(value);   // equal key: value replaced, no new node
    }

    /**
     * Removes key's node. A leaf is unlinked directly. Otherwise the node
     * takes over the payload of its in-order predecessor (max of the left
     * subtree) or, with no left child, its successor (min of the right
     * subtree), and that node is removed in turn. The chain ends at a leaf.
     * PRECONDITION: key CANNOT BE NULL
     */
    @Override
    public final boolean remove(final K key) {
        Node<K,V> target = findNode(key);
        if (target == null) return false;

        while (!target.isLeaf()) {
            final Node<K,V> replacement = (target.left != null) ? target.left.maxNode() : target.right.minNode();
            if (log.isDebugEnabled())
                log.debug("remove " + target.key + ": promoting " + replacement.key);
            target.key = replacement.key;
            target.value = replacement.value;
            target = replacement;
        }
        unlink(target);
        size--;
        modCount++;
        return true;
    }

    @Override
    public final int size() {
        return size;
    }

    /** Smallest key. Throws NoSuchElementException when empty. */
    public final K firstKey() {
        if (root == null) throw new NoSuchElementException();
        return root.minNode().key;
    }

    /** Largest key. Throws NoSuchElementException when empty. */
    public final K lastKey() {
        if (root == null) throw new NoSuchElementException();
        return root.maxNode().key;
    }

//--------------------------------------------------------------------------------
// VALUE SEMANTICS:
// - copy / transferFrom / swap / clear
//--------------------------------------------------------------------------------

    public OrderedMap<K,V> copy() {
        return new OrderedMap<>(this);
    }

    /**
     * Move: releases this map's nodes, then takes ownership of donor's tree
     * without copying. The donor is left empty.
     */
    public final void transferFrom(final OrderedMap<K,V> donor) {
        Objects.requireNonNull(donor, "donor");
        if (donor == this) return;
        clear();
        root = donor.root;
        size = donor.size;
        defaultValue = donor.defaultValue;
        modCount++;
        donor.root = null;
        donor.size = 0;
        donor.modCount++;
        if (log.isDebugEnabled())
            log.debug("transferred " + size + " nodes");
    }

    /** Exchanges the contents of the two maps. */
    public final void swap(final OrderedMap<K,V> other) {
        Objects.requireNonNull(other, "other");
        if (other == this) return;
        final Node<K,V> r = root;
        final int s = size;
        final Supplier<? extends V> d = defaultValue;
        root = other.root;
        size = other.size;
        defaultValue = other.defaultValue;
        other.root = r;
        other.size = s;
        other.defaultValue = d;
        modCount++;
        other.modCount++;
    }

    /**
     * Post-order release: each node is unlinked after its children, using
     * parent links instead of a stack.
     */
    @Override
    public final int clear() {
        int released = 0;
        Node<K,V> n = root;
        while (n != null) {
            if (n.left != null) {
                n = n.left;
            } else if (n.right != null) {
                n = n.right;
            } else {
                final Node<K,V> p = n.parent;
                unlink(n);
                n.key = null;
                n.value = null;
                released++;
                n = p;
            }
        }
        root = null;
        size = 0;
        modCount++;
        if (log.isDebugEnabled())
            log.debug("released " + released + " nodes");
        return released;
    }

//--------------------------------------------------------------------------------
// ITERATION
//--------------------------------------------------------------------------------

    /** Cursor on the smallest key, or {@link #end()} when empty. */
    public final Cursor begin() {
        return new Cursor(root == null ? null : root.minNode());
    }

    /** The past-the-end cursor. */
    public final Cursor end() {
        return new Cursor(null);
    }

    /** Cursor on key, or {@link #end()} when the key is absent. */
    public final Cursor find(final K key) {
        return new Cursor(findNode(key));
    }

    /** Keys in ascending order. */
    @Override
    public final Iterator<K> iterator() {
        return new InOrderIterator<K>() {
            @Override
            K element(final Node<K,V> n) {
                return n.key;
            }
        };
    }

    /** Read-only key/value pairs in ascending key order. */
    public final Iterable<Map.Entry<K,V>> entries() {
        return () -> new InOrderIterator<Map.Entry<K,V>>() {
            @Override
            Map.Entry<K,V> element(final Node<K,V> n) {
                return new AbstractMap.SimpleImmutableEntry<>(n.key, n.value);
            }
        };
    }

    /**
     * A position in the in-order sequence: a node, or past-the-end.
     * Moving the cursor mutates it. Any structural modification of the map
     * made after the cursor was created invalidates it.
     */
    public final class Cursor {
        private Node<K,V> current;
        private final int expectedModCount;

        private Cursor(final Node<K,V> current) {
            this.current = current;
            this.expectedModCount = modCount;
        }

        public boolean isEnd() {
            return current == null;
        }

        public K key() {
            return node().key;
        }

        public V value() {
            return node().value;
        }

        /** Advance to the in-order successor. Throws NoSuchElementException at end. */
        public Cursor next() {
            current = successor(node());
            return this;
        }

        /** Step back to the in-order predecessor; from end, to the largest key. */
        public Cursor previous() {
            checkForComodification();
            if (current != null) {
                current = predecessor(current);
            } else if (root != null) {
                current = root.maxNode();
            } else {
                throw new NoSuchElementException();
            }
            return this;
        }

        private Node<K,V> node() {
            checkForComodification();
            if (current == null) throw new NoSuchElementException();
            return current;
        }

        private void checkForComodification() {
            if (modCount != expectedModCount)
                throw new ConcurrentModificationException();
        }

        private OrderedMap<K,V> owner() {
            return OrderedMap.this;
        }

        @Override
        public boolean equals(final Object o) {
            if (!(o instanceof OrderedMap.Cursor)) return false;
            final OrderedMap<?,?>.Cursor other = (OrderedMap<?,?>.Cursor) o;
            return owner() == other.owner() && current == other.current;
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(OrderedMap.this) + System.identityHashCode(current);
        }

        @Override
        public String toString() {
            return (current == null) ? "end" : String.valueOf(current);
        }
    }

    private abstract class InOrderIterator<T> implements Iterator<T> {
        private Node<K,V> next = (root == null) ? null : root.minNode();
        private final int expectedModCount = modCount;

        abstract T element(Node<K,V> n);

        @Override
        public final boolean hasNext() {
            return next != null;
        }

        @Override
        public final T next() {
            final Node<K,V> n = next;
            if (n == null) throw new NoSuchElementException();
            if (modCount != expectedModCount) throw new ConcurrentModificationException();
            next = successor(n);
            return element(n);
        }
    }

//--------------------------------------------------------------------------------
// PRIVATE METHODS
//--------------------------------------------------------------------------------

    private Node<K,V> findNode(final K key) {
        if (key == null) throw new NullPointerException();
        Node<K,V> p = root;
        while (p != null) {
            final int c = compare(key, p.key);
            if (c == 0) return p;
            p = (c < 0) ? p.left : p.right;
        }
        return null;
    }

    private Node<K,V> findOrCreate(final K key, final Supplier<? extends V> value) {
        if (key == null) throw new NullPointerException();
        if (root == null) {
            root = newNode(key, value.get(), null);
            return root;
        }
        Node<K,V> p = root;
        while (true) {
            final int c = compare(key, p.key);
            if (c == 0) return p;
            if (c < 0) {
                if (p.left == null) return p.left = newNode(key, value.get(), p);
                p = p.left;
            } else {
                if (p.right == null) return p.right = newNode(key, value.get(), p);
                p = p.right;
            }
        }
    }

    private Node<K,V> newNode(final K key, final V value, final Node<K,V> parent) {
        size++;
        modCount++;
        return new Node<>(key, value, parent);
    }

    // Detach a childless node from its parent's slot (or from root)
    private void unlink(final Node<K,V> leaf) {
        final Node<K,V> p = leaf.parent;
        if (p == null) {
            root = null;
        } else if (p.left == leaf) {
            p.left = null;
        } else {
            p.right = null;
        }
        leaf.parent = null;
    }

    private static <E extends Comparable<? super E>> int compare(final E key, final E nodeKey) {
        final int c = key.compareTo(nodeKey);
        if ((c == 0) != key.equals(nodeKey))
            throw new IllegalStateException("compareTo and equals disagree for keys " + key + " and " + nodeKey);
        return c;
    }

    static <E extends Comparable<? super E>, T> Node<E,T> successor(final Node<E,T> n) {
        if (n.right != null) return n.right.minNode();
        Node<E,T> child = n;
        Node<E,T> p = n.parent;
        while (p != null && child == p.right) {
            child = p;
            p = p.parent;
        }
        return p;
    }

    static <E extends Comparable<? super E>, T> Node<E,T> predecessor(final Node<E,T> n) {
        if (n.left != null) return n.left.maxNode();
        Node<E,T> child = n;
        Node<E,T> p = n.parent;
        while (p != null && child == p.left) {
            child = p;
            p = p.parent;
        }
        return p;
    }

    // Pre-order clone with an explicit work-list of (source, copy) pairs
    private static <E extends Comparable<? super E>, T> Node<E,T> copyTree(final Node<E,T> source) {
        if (source == null) return null;
        final Node<E,T> copyRoot = new Node<>(source.key, source.value, null);
        final ArrayDeque<Node<E,T>> work = new ArrayDeque<>();
        work.push(source);
        work.push(copyRoot);
        while (!work.isEmpty()) {
            final Node<E,T> to = work.pop();
            final Node<E,T> from = work.pop();
            if (from.left != null) {
                to.left = new Node<>(from.left.key, from.left.value, to);
                work.push(from.left);
                work.push(to.left);
            }
            if (from.right != null) {
                to.right = new Node<>(from.right.key, from.right.value, to);
                work.push(from.right);
                work.push(to.right);
            }
        }
        return copyRoot;
    }

    /**
     *
     * DEBUG CODE (FOR TESTBED)
     *
     */

    /** Node count by walking the tree, independent of the maintained size. */
    public int sizeStructural() {
        int count = 0;
        for (Node<K,V> n = (root == null) ? null : root.minNode(); n != null; n = successor(n))
            count++;
        return count;
    }

    /** Nodes on the longest root-to-leaf path; 0 when empty. */
    public int height() {
        if (root == null) return 0;
        int height = 0;
        final ArrayDeque<Node<K,V>> level = new ArrayDeque<>();
        level.add(root);
        while (!level.isEmpty()) {
            height++;
            for (int i = level.size(); i > 0; i--) {
                final Node<K,V> n = level.poll();
                if (n.left != null) level.add(n.left);
                if (n.right != null) level.add(n.right);
            }
        }
        return height;
    }

    /**
     * Writes one line per node in pre-order, indented by depth and tagged
     * with its path from the root ('0' = left, '1' = right), e.g.
     * <code>"    01: 4=d"</code>. The root's path is empty.
     */
    public void dump(final PrintStream out) {
        dumpLines(out::println);
    }

    /** Writes the dump to the log at the given level, if enabled. */
    public void dump(final Level level) {
        if (!log.isEnabledFor(level)) return;
        dumpLines(line -> log.log(level, line));
    }

    private void dumpLines(final Consumer<String> out) {
        if (root == null) return;
        final ArrayDeque<Node<K,V>> nodes = new ArrayDeque<>();
        final ArrayDeque<String> paths = new ArrayDeque<>();
        nodes.push(root);
        paths.push("");
        while (!nodes.isEmpty()) {
            final Node<K,V> n = nodes.pop();
            final String path = paths.pop();
            out.accept(indent(path.length()) + path + ": " + n);
            if (n.right != null) {
                nodes.push(n.right);
                paths.push(path + "1");
            }
            if (n.left != null) {
                nodes.push(n.left);
                paths.push(path + "0");
            }
        }
    }

    private static String indent(final int depth) {
        final StringBuilder sb = new StringBuilder(depth * 4);
        for (int i = 0; i < depth; i++) sb.append("    ");
        return sb.toString();
    }

    //--------------------------------------------------------------------------------
    // Object
    //--------------------------------------------------------------------------------

    /** Equal iff both yield the same in-order key/value sequence. */
    @Override
    public boolean equals(final Object o) {
        if (o == this) return true;
        if (!(o instanceof OrderedMap)) return false;
        final OrderedMap<?,?> other = (OrderedMap<?,?>) o;
        if (size != other.size) return false;
        final Iterator<Map.Entry<K,V>> a = entries().iterator();
        final Iterator<? extends Map.Entry<?,?>> b = other.entries().iterator();
        while (a.hasNext()) {
            if (!a.next().equals(b.next())) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Map.Entry<K,V> e : entries()) h += e.hashCode();
        return h;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        for (Map.Entry<K,V> e : entries()) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(e.getKey()).append('=').append(e.getValue());
        }
        return sb.append('}').toString();
    }
}
