package io.github.bluuewhale.keyedhash;

import java.util.AbstractSet;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cuckoo hashing over two tables with independently seeded hash functions.
 * <p>
 * A key lives either at {@code h1(key) mod capacity} in the first table or at
 * {@code h2(key) mod capacity} in the second, so lookups and removals inspect at most two
 * slots. Inserts that find both slots taken run an eviction walk of at most {@code capacity}
 * displacements. A walk that runs out is undone and the map is rebuilt at double capacity
 * with fresh seeds; up to {@value #MAX_REHASH_ATTEMPTS} such cycles are tried before
 * {@link CapacityExhaustedException} is thrown.
 * <p>
 * Slot indices returned by {@link #findIndex(Object)} address the first table as
 * {@code [0, capacity)} and the second as {@code [capacity, 2 * capacity)}. Each table holds
 * at most {@code 1 << 29} slots.
 */
public class CuckooMap<K, V> extends AbstractKeyedMap<K, V> {

	private static final Logger LOG = Logger.getLogger(CuckooMap.class.getName());

	/* Defaults */
	private static final double DEFAULT_LOAD_FACTOR = 0.5d;
	static final int MAX_REHASH_ATTEMPTS = 8;
	/* Per-table cap; both tables together stay within Utils.MAX_CAPACITY */
	static final int MAX_TABLE_CAPACITY = Utils.MAX_CAPACITY >> 1;

	/* Storage: a null key marks a free slot */
	private Object[] keys1;
	private Object[] vals1;
	private Object[] keys2;
	private Object[] vals2;

	/* Hashing */
	private final SeedableHasher<? super K> hasherFactory;
	private final SeedSource seeds;
	private KeyHasher<? super K> hasher1;
	private KeyHasher<? super K> hasher2;

	public CuckooMap() {
		this(DEFAULT_INITIAL_CAPACITY, DEFAULT_LOAD_FACTOR);
	}

	public CuckooMap(int initialCapacity) {
		this(initialCapacity, DEFAULT_LOAD_FACTOR);
	}

	public CuckooMap(int initialCapacity, double loadFactor) {
		this(initialCapacity, loadFactor, SeedableHasher.standard(), SeedSource.random());
	}

	public CuckooMap(int initialCapacity, SeedableHasher<? super K> hasherFactory, SeedSource seeds) {
		this(initialCapacity, DEFAULT_LOAD_FACTOR, hasherFactory, seeds);
	}

	public CuckooMap(int initialCapacity, double loadFactor,
					 SeedableHasher<? super K> hasherFactory, SeedSource seeds) {
		super(checkTableCapacity(initialCapacity), loadFactor);
		this.hasherFactory = Objects.requireNonNull(hasherFactory, "hasherFactory");
		this.seeds = Objects.requireNonNull(seeds, "seeds");
		this.hasher1 = freshHasher();
		this.hasher2 = freshHasher();
	}

	private static int checkTableCapacity(int initialCapacity) {
		if (initialCapacity > MAX_TABLE_CAPACITY) {
			throw new IllegalArgumentException("capacity must be in (0," + MAX_TABLE_CAPACITY + "]: " + initialCapacity);
		}
		return initialCapacity;
	}

	@Override
	protected void init(int initialCapacity) {
		allocate(initialCapacity);
		this.size = 0;
	}

	private void allocate(int cap) {
		this.capacity = cap;
		this.keys1 = new Object[cap];
		this.vals1 = new Object[cap];
		this.keys2 = new Object[cap];
		this.vals2 = new Object[cap];
	}

	private KeyHasher<? super K> freshHasher() {
		return hasherFactory.withSeeds(seeds.nextSeed(), seeds.nextSeed());
	}

	private int index1(Object key) {
		return Utils.indexFor(hasher1.hash(castKey(key)), capacity);
	}

	private int index2(Object key) {
		return Utils.indexFor(hasher2.hash(castKey(key)), capacity);
	}

	@Override
	public V put(K key, V value) {
		int idx = findIndex(key);
		if (idx >= 0) {
			V old = valueAt(idx);
			setValueAt(idx, value);
			return old;
		}
		if (exceedsLoad(size + 1) || !place(key, value)) {
			rehashAndPlace(key, value);
		}
		size++;
		modCount++;
		return null;
	}

	@Override
	public V get(Object key) {
		int idx = findIndex(key);
		return (idx >= 0) ? valueAt(idx) : null;
	}

	@Override
	public boolean containsKey(Object key) {
		return findIndex(key) >= 0;
	}

	@Override
	public V remove(Object key) {
		int idx = findIndex(key);
		if (idx < 0) return null;
		V old = valueAt(idx);
		clearAt(idx);
		return old;
	}

	@Override
	public void clear() {
		for (int i = 0; i < capacity; i++) {
			keys1[i] = null;
			vals1[i] = null;
			keys2[i] = null;
			vals2[i] = null;
		}
		size = 0;
		modCount++;
	}

	/** Both tables together. */
	@Override
	public int bucketCount() {
		return capacity * 2;
	}

	@Override
	public Set<Map.Entry<K, V>> entrySet() {
		return new EntrySet();
	}

	/* Placement */

	/**
	 * Places a key known to be absent. Tries its slot in table 1, then table 2, then walks
	 * evictions starting in table 1. Returns false, with both tables exactly as they were,
	 * when the walk exhausts its budget.
	 */
	private boolean place(Object key, Object value) {
		int p1 = index1(key);
		if (keys1[p1] == null) {
			keys1[p1] = key;
			vals1[p1] = value;
			return true;
		}
		int p2 = index2(key);
		if (keys2[p2] == null) {
			keys2[p2] = key;
			vals2[p2] = value;
			return true;
		}

		Object curKey = key;
		Object curVal = value;
		for (int step = 0; step < capacity; step++) {
			boolean first = (step & 1) == 0;
			Object[] ks = first ? keys1 : keys2;
			Object[] vs = first ? vals1 : vals2;
			int p = first ? index1(curKey) : index2(curKey);
			if (ks[p] == null) {
				ks[p] = curKey;
				vs[p] = curVal;
				return true;
			}
			Object k = ks[p];
			Object v = vs[p];
			ks[p] = curKey;
			vs[p] = curVal;
			curKey = k;
			curVal = v;
		}

		// Undo, newest swap first. The entry carried out of step i sat at its own slot in that
		// step's table, so recomputing its index finds the swapped slot again.
		for (int step = capacity - 1; step >= 0; step--) {
			boolean first = (step & 1) == 0;
			Object[] ks = first ? keys1 : keys2;
			Object[] vs = first ? vals1 : vals2;
			int p = first ? index1(curKey) : index2(curKey);
			Object k = ks[p];
			Object v = vs[p];
			ks[p] = curKey;
			vs[p] = curVal;
			curKey = k;
			curVal = v;
		}
		return false;
	}

	/**
	 * Rebuilds both tables at double capacity with fresh seeds and places every stored entry
	 * plus the pending one. A cycle that fails is discarded and the next one doubles again.
	 * On success the pending entry is stored; {@code size} is left to the caller.
	 */
	private void rehashAndPlace(Object pendingKey, Object pendingVal) {
		Object[] oldKeys1 = keys1;
		Object[] oldVals1 = vals1;
		Object[] oldKeys2 = keys2;
		Object[] oldVals2 = vals2;
		KeyHasher<? super K> oldHasher1 = hasher1;
		KeyHasher<? super K> oldHasher2 = hasher2;
		int oldCapacity = capacity;

		long newCap = oldCapacity;
		int attempts = 0;
		while (attempts < MAX_REHASH_ATTEMPTS) {
			newCap <<= 1;
			if (newCap > MAX_TABLE_CAPACITY) break;
			attempts++;

			allocate((int) newCap);
			hasher1 = freshHasher();
			hasher2 = freshHasher();
			if (LOG.isLoggable(Level.FINE)) {
				LOG.log(Level.FINE, "Cuckoo rehash attempt {0}: capacity {1} -> {2}, {3} entries",
					new Object[] { attempts, oldCapacity, newCap, size + 1 });
			}

			if (placeAll(oldKeys1, oldVals1) && placeAll(oldKeys2, oldVals2) && place(pendingKey, pendingVal)) {
				modCount++;
				return;
			}
		}

		// Nothing was placed for good; restore the pre-insert state.
		capacity = oldCapacity;
		keys1 = oldKeys1;
		vals1 = oldVals1;
		keys2 = oldKeys2;
		vals2 = oldVals2;
		hasher1 = oldHasher1;
		hasher2 = oldHasher2;
		LOG.log(Level.WARNING, "Cuckoo insert gave up after {0} rehash attempts at capacity {1} ({2} entries)",
			new Object[] { attempts, oldCapacity, size });
		throw new CapacityExhaustedException(attempts, oldCapacity);
	}

	private boolean placeAll(Object[] ks, Object[] vs) {
		for (int i = 0; i < ks.length; i++) {
			if (ks[i] != null && !place(ks[i], vs[i])) return false;
		}
		return true;
	}

	/* lookup utilities */
	int findIndex(Object key) {
		requireKey(key);
		int p1 = index1(key);
		Object k1 = keys1[p1];
		if (k1 != null && k1.equals(key)) return p1;
		int p2 = index2(key);
		Object k2 = keys2[p2];
		if (k2 != null && k2.equals(key)) return capacity + p2;
		return -1;
	}

	private V valueAt(int idx) {
		return castValue(idx < capacity ? vals1[idx] : vals2[idx - capacity]);
	}

	private void setValueAt(int idx, Object value) {
		if (idx < capacity) vals1[idx] = value;
		else vals2[idx - capacity] = value;
	}

	private Object keyAt(int idx) {
		return idx < capacity ? keys1[idx] : keys2[idx - capacity];
	}

	private void clearAt(int idx) {
		if (idx < capacity) {
			keys1[idx] = null;
			vals1[idx] = null;
		} else {
			keys2[idx - capacity] = null;
			vals2[idx - capacity] = null;
		}
		size--;
		modCount++;
	}

	/* ------------ EntrySet / Iterator ------------ */

	private final class EntrySet extends AbstractSet<Map.Entry<K, V>> {
		@Override
		public int size() {
			return CuckooMap.this.size;
		}

		@Override
		public void clear() {
			CuckooMap.this.clear();
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
			int end = capacity * 2;
			while (cursor < end) {
				int idx = cursor++;
				if (keyAt(idx) != null) {
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
			return new EntryView(castKey(keyAt(lastIdx)), valueAt(lastIdx));
		}

		@Override
		public void remove() {
			if (lastIdx < 0) throw new IllegalStateException();
			if (modCount != expectedModCount) throw new ConcurrentModificationException();
			clearAt(lastIdx);
			expectedModCount = modCount;
			lastIdx = -1;
		}
	}

	/* Reads and writes through to the map while the key is present; detached afterwards. */
	private final class EntryView implements Map.Entry<K, V> {
		private final K key;
		private V value;

		EntryView(K key, V value) {
			this.key = key;
			this.value = value;
		}

		@Override
		public K getKey() {
			return key;
		}

		@Override
		public V getValue() {
			int idx = findIndex(key);
			if (idx >= 0) value = valueAt(idx);
			return value;
		}

		@Override
		public V setValue(V value) {
			int idx = findIndex(key);
			V old = (idx >= 0) ? valueAt(idx) : this.value;
			if (idx >= 0) setValueAt(idx, value);
			this.value = value;
			return old;
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
