package io.github.bluuewhale.keyedhash;

import java.util.AbstractSet;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Separate chaining map: each bucket holds a singly linked list of entries.
 * The table doubles before a new key would push the load factor past its maximum.
 */
public class ChainingMap<K, V> extends AbstractKeyedMap<K, V> {

	/* Defaults */
	private static final double DEFAULT_LOAD_FACTOR = 0.75d;

	/* Storage */
	private Node<K, V>[] buckets;
	private final KeyHasher<? super K> hasher;

	public ChainingMap() {
		this(DEFAULT_INITIAL_CAPACITY, DEFAULT_LOAD_FACTOR);
	}

	public ChainingMap(int initialCapacity) {
		this(initialCapacity, DEFAULT_LOAD_FACTOR);
	}

	/**
	 * @param loadFactor maximum load factor, in {@code (0, 1)}. Chains could run fuller, but the
	 *                   whole map family shares one bound.
	 * @throws IllegalArgumentException if {@code initialCapacity} is outside
	 *                                  {@code [1, 1 << 30]} or {@code loadFactor} is outside {@code (0, 1)}
	 */
	public ChainingMap(int initialCapacity, double loadFactor) {
		this(initialCapacity, loadFactor, SipHasher.standard());
	}

	/**
	 * Same bounds as {@link #ChainingMap(int, double)}; {@code hasher} replaces the default
	 * SipHash-1-3 over the canonical byte view.
	 */
	public ChainingMap(int initialCapacity, double loadFactor, KeyHasher<? super K> hasher) {
		super(initialCapacity, loadFactor);
		this.hasher = Objects.requireNonNull(hasher, "hasher");
	}

	static final class Node<K, V> {
		final K key;
		V value;
		Node<K, V> next;

		Node(K key, V value) {
			this.key = key;
			this.value = value;
		}
	}

	@Override
	protected void init(int initialCapacity) {
		this.capacity = initialCapacity;
		this.buckets = newTable(initialCapacity);
		this.size = 0;
	}

	@SuppressWarnings("unchecked")
	private static <K, V> Node<K, V>[] newTable(int capacity) {
		return (Node<K, V>[]) new Node<?, ?>[capacity];
	}

	private int bucketIndex(Object key) {
		return Utils.indexFor(hasher.hash(castKey(key)), capacity);
	}

	@Override
	public V put(K key, V value) {
		requireKey(key);
		Node<K, V> found = findNode(key);
		if (found != null) {
			V old = found.value;
			found.value = value;
			return old;
		}
		if (exceedsLoad(size + 1)) {
			int newCap = Utils.grownCapacity(capacity, size + 1, maxLoadFactor);
			if (newCap < 0) throw new IllegalStateException("Capacity limit reached: " + capacity);
			resize(newCap);
		}
		link(bucketIndex(key), new Node<>(key, value));
		size++;
		modCount++;
		return null;
	}

	@Override
	public V get(Object key) {
		Node<K, V> n = findNode(key);
		return (n != null) ? n.value : null;
	}

	@Override
	public boolean containsKey(Object key) {
		return findNode(key) != null;
	}

	@Override
	public V remove(Object key) {
		int idx = bucketIndex(requireKey(key));
		Node<K, V> prev = null;
		for (Node<K, V> n = buckets[idx]; n != null; prev = n, n = n.next) {
			if (n.key.equals(key)) {
				if (prev == null) buckets[idx] = n.next;
				else prev.next = n.next;
				size--;
				modCount++;
				return n.value;
			}
		}
		return null;
	}

	@Override
	public void clear() {
		for (int i = 0; i < capacity; i++) {
			buckets[i] = null;
		}
		size = 0;
		modCount++;
	}

	@Override
	public Set<Map.Entry<K, V>> entrySet() {
		return new EntrySet();
	}

	/* Resize helpers */
	private void resize(int newCapacity) {
		Node<K, V>[] old = this.buckets;
		this.capacity = newCapacity;
		this.buckets = newTable(newCapacity);
		modCount++;

		// Hasher unchanged, only the modulus moves entries.
		for (Node<K, V> head : old) {
			Node<K, V> n = head;
			while (n != null) {
				Node<K, V> next = n.next;
				n.next = null;
				link(bucketIndex(n.key), n);
				n = next;
			}
		}
	}

	/* Appends at the tail of the chain. */
	private void link(int idx, Node<K, V> node) {
		Node<K, V> n = buckets[idx];
		if (n == null) {
			buckets[idx] = node;
			return;
		}
		while (n.next != null) n = n.next;
		n.next = node;
	}

	private Node<K, V> findNode(Object key) {
		for (Node<K, V> n = buckets[bucketIndex(requireKey(key))]; n != null; n = n.next) {
			if (n.key.equals(key)) return n;
		}
		return null;
	}

	/** Length of the chain in bucket {@code idx}. */
	int chainLength(int idx) {
		int len = 0;
		for (Node<K, V> n = buckets[idx]; n != null; n = n.next) len++;
		return len;
	}

	/* ------------ EntrySet / Iterator ------------ */

	private final class EntrySet extends AbstractSet<Map.Entry<K, V>> {
		@Override
		public int size() {
			return ChainingMap.this.size;
		}

		@Override
		public void clear() {
			ChainingMap.this.clear();
		}

		@Override
		public Iterator<Map.Entry<K, V>> iterator() {
			return new EntryIterator();
		}
	}

	private final class EntryIterator implements Iterator<Map.Entry<K, V>> {
		private int expectedModCount = modCount;
		private int bucket = 0;
		private Node<K, V> next;
		private Node<K, V> last;

		EntryIterator() {
			advanceBucket();
		}

		private void advanceBucket() {
			while (next == null && bucket < capacity) {
				next = buckets[bucket++];
			}
		}

		@Override
		public boolean hasNext() {
			return next != null;
		}

		@Override
		public Map.Entry<K, V> next() {
			if (modCount != expectedModCount) throw new ConcurrentModificationException();
			if (next == null) throw new NoSuchElementException();
			last = next;
			next = next.next;
			advanceBucket();
			return new EntryView(last);
		}

		@Override
		public void remove() {
			if (last == null) throw new IllegalStateException();
			if (modCount != expectedModCount) throw new ConcurrentModificationException();
			ChainingMap.this.remove(last.key);
			expectedModCount = modCount;
			last = null;
		}
	}

	private final class EntryView implements Map.Entry<K, V> {
		private final Node<K, V> node;

		EntryView(Node<K, V> node) {
			this.node = node;
		}

		@Override
		public K getKey() {
			return node.key;
		}

		@Override
		public V getValue() {
			return node.value;
		}

		@Override
		public V setValue(V value) {
			V old = node.value;
			node.value = value;
			return old;
		}

		@Override
		public int hashCode() {
			return node.key.hashCode() ^ Objects.hashCode(node.value);
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Map.Entry<?, ?> e)) return false;
			return Objects.equals(node.key, e.getKey()) && Objects.equals(node.value, e.getValue());
		}

		@Override
		public String toString() {
			return node.key + "=" + node.value;
		}
	}
}
