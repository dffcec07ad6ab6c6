package io.github.bluuewhale.keyedhash;

import java.util.AbstractSet;
import java.util.Arrays;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Open addressing with linear probing and tombstone deletion.
 * <p>
 * Lookups probe past {@code DELETED} slots and stop only at an {@code EMPTY} one, so removing
 * an entry never cuts off a later entry of the same probe chain. Inserts reuse the first
 * non-occupied slot. The table doubles, dropping all tombstones, when either the prospective
 * load {@code (size+1)/capacity} or the effective load {@code (size+deleted)/capacity}
 * exceeds the maximum load factor.
 */
public class ProbingMap<K, V> extends AbstractKeyedMap<K, V> {

	/* Slot states */
	static final byte EMPTY = 0;
	static final byte OCCUPIED = 1;
	static final byte DELETED = 2; // tombstone

	/* Defaults */
	private static final double DEFAULT_LOAD_FACTOR = 0.7d;

	/* Storage and state */
	private byte[] states;
	private Object[] keys;
	private Object[] vals;
	private int deleted; // tombstone count
	private final KeyHasher<? super K> hasher;

	public ProbingMap() {
		this(DEFAULT_INITIAL_CAPACITY, DEFAULT_LOAD_FACTOR);
	}

	public ProbingMap(int initialCapacity) {
		this(initialCapacity, DEFAULT_LOAD_FACTOR);
	}

	public ProbingMap(int initialCapacity, double loadFactor) {
		this(initialCapacity, loadFactor, SipHasher.standard());
	}

	public ProbingMap(int initialCapacity, double loadFactor, KeyHasher<? super K> hasher) {
		super(initialCapacity, loadFactor);
		this.hasher = Objects.requireNonNull(hasher, "hasher");
	}

	@Override
	protected void init(int initialCapacity) {
		this.capacity = initialCapacity;
		this.states = new byte[initialCapacity];
		this.keys = new Object[initialCapacity];
		this.vals = new Object[initialCapacity];
		this.size = 0;
		this.deleted = 0;
	}

	private int homeIndex(Object key) {
		return Utils.indexFor(hasher.hash(castKey(key)), capacity);
	}

	@Override
	public V put(K key, V value) {
		int idx = findIndex(key);
		if (idx >= 0) {
			V old = castValue(vals[idx]);
			vals[idx] = value;
			return old;
		}
		maybeRehash();
		insertAt(findSlotForInsert(key), key, value);
		modCount++;
		return null;
	}

	@Override
	public V get(Object key) {
		int idx = findIndex(key);
		return (idx >= 0) ? castValue(vals[idx]) : null;
	}

	@Override
	public boolean containsKey(Object key) {
		return findIndex(key) >= 0;
	}

	@Override
	public V remove(Object key) {
		int idx = findIndex(key);
		if (idx < 0) return null;
		V old = castValue(vals[idx]);
		deleteAt(idx);
		return old;
	}

	@Override
	public void clear() {
		Arrays.fill(states, EMPTY);
		Arrays.fill(keys, null);
		Arrays.fill(vals, null);
		size = 0;
		deleted = 0;
		modCount++;
	}

	@Override
	public Set<Map.Entry<K, V>> entrySet() {
		return new EntrySet();
	}

	/** Number of tombstones currently in the table. */
	public int deletedCount() {
		return deleted;
	}

	/* Resize/rehash */
	private void maybeRehash() {
		// prospective load, or tombstones crowding the probe chains
		boolean overMaxLoad = exceedsLoad(size + 1);
		boolean overEffectiveLoad = exceedsLoad(size + deleted);
		if (!overMaxLoad && !overEffectiveLoad) return;

		int newCap = Utils.grownCapacity(capacity, size + 1, maxLoadFactor);
		if (newCap < 0) throw new IllegalStateException("Capacity limit reached: " + capacity);
		rehash(newCap);
	}

	private void rehash(int newCapacity) {
		byte[] oldStates = this.states;
		Object[] oldKeys = this.keys;
		Object[] oldVals = this.vals;

		init(newCapacity);
		modCount++;

		// Tombstones are dropped; only live entries move.
		for (int i = 0; i < oldStates.length; i++) {
			if (oldStates[i] != OCCUPIED) continue;
			K k = castKey(oldKeys[i]);
			insertAt(findSlotForInsert(k), k, castValue(oldVals[i]));
		}
	}

	/* lookup utilities */
	int findIndex(Object key) {
		int idx = homeIndex(requireKey(key));
		for (int probes = 0; probes < capacity; probes++) {
			byte s = states[idx];
			if (s == EMPTY) return -1;
			if (s == OCCUPIED && keys[idx].equals(key)) return idx;
			idx = (idx + 1 == capacity) ? 0 : idx + 1;
		}
		// every slot visited: nothing is EMPTY, and the key is not among the live entries
		return -1;
	}

	/* First non-occupied slot along the probe chain; the caller has ruled out a live copy of the key. */
	private int findSlotForInsert(Object key) {
		int idx = homeIndex(key);
		for (int probes = 0; probes < capacity; probes++) {
			if (states[idx] != OCCUPIED) return idx;
			idx = (idx + 1 == capacity) ? 0 : idx + 1;
		}
		throw new IllegalStateException("Probe cycle exhausted; table has no free slot (capacity " + capacity + ")");
	}

	private void insertAt(int idx, K key, V value) {
		if (states[idx] == DELETED) deleted--;
		states[idx] = OCCUPIED;
		keys[idx] = key;
		vals[idx] = value;
		size++;
	}

	private void deleteAt(int idx) {
		states[idx] = DELETED;
		keys[idx] = null;
		vals[idx] = null;
		deleted++;
		size--;
		modCount++;
	}

	/** Slot state at {@code idx}. */
	byte stateAt(int idx) {
		return states[idx];
	}

	/* ------------ EntrySet / Iterator ------------ */

	private final class EntrySet extends AbstractSet<Map.Entry<K, V>> {
		@Override
		public int size() {
			return ProbingMap.this.size;
		}

		@Override
		public void clear() {
			ProbingMap.this.clear();
		}

		@Override
		public Iterator<Map.Entry<K, V>> iterator() {
			return new EntryIterator();
		}
	}

	private final class EntryIterator implements Iterator<Map.Entry<K, V>> {
		private int expectedModCount = modCount;
		private int cursor = 0;
		private int nextIdx = -1;
		private int lastIdx = -1;

		EntryIterator() {
			advance();
		}

		private void advance() {
			nextIdx = -1;
			while (cursor < capacity) {
				int idx = cursor++;
				if (states[idx] == OCCUPIED) {
					nextIdx = idx;
					return;
				}
			}
		}

		@Override
		public boolean hasNext() {
			return nextIdx >= 0;
		}

		@Override
		public Map.Entry<K, V> next() {
			if (modCount != expectedModCount) throw new ConcurrentModificationException();
			if (nextIdx < 0) throw new NoSuchElementException();
			lastIdx = nextIdx;
			advance();
			return new EntryRef(lastIdx);
		}

		@Override
		public void remove() {
			if (lastIdx < 0) throw new IllegalStateException();
			if (modCount != expectedModCount) throw new ConcurrentModificationException();
			deleteAt(lastIdx);
			expectedModCount = modCount;
			lastIdx = -1;
		}
	}

	private final class EntryRef implements Map.Entry<K, V> {
		private final K key;
		private final int idx;
		private V value; // last value seen, kept once the entry is detached

		EntryRef(int idx) {
			this.idx = idx;
			this.key = castKey(keys[idx]);
			this.value = castValue(vals[idx]);
		}

		@Override
		public K getKey() {
			return key;
		}

		@Override
		public V getValue() {
			int slot = slot();
			if (slot >= 0) value = castValue(vals[slot]);
			return value;
		}

		@Override
		public V setValue(V value) {
			int slot = slot();
			V old = (slot >= 0) ? castValue(vals[slot]) : this.value;
			if (slot >= 0) vals[slot] = value;
			this.value = value;
			return old;
		}

		/* Current slot of the key, following a rehash; -1 once the key was removed. */
		private int slot() {
			if (states[idx] == OCCUPIED && keys[idx] == key) return idx;
			return findIndex(key);
		}

		@Override
		public int hashCode() {
			return key.hashCode() ^ Objects.hashCode(getValue());
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Map.Entry<?, ?> e)) return false;
			return Objects.equals(key, e.getKey()) && Objects.equals(getValue(), e.getValue());
		}

		@Override
		public String toString() {
			return key + "=" + getValue();
		}
	}
}
