package io.github.bluuewhale.keyedhash;

import java.util.AbstractMap;
import java.util.function.Supplier;

/**
 * Shared Map boilerplate for the keyed map family: size and capacity bookkeeping, the
 * native operations ({@code insert}, {@code at}, {@code getOrInsert}) and a modification
 * counter for fail-fast iteration.
 * <p>
 * Null keys are rejected; null values are allowed.
 */
public abstract class AbstractKeyedMap<K, V> extends AbstractMap<K, V> {

	protected static final int DEFAULT_INITIAL_CAPACITY = 16;

	protected int capacity;
	protected int size;
	protected int modCount;
	protected final double maxLoadFactor;

	protected AbstractKeyedMap(int initialCapacity, double maxLoadFactor) {
		Utils.validateCapacity(initialCapacity);
		Utils.validateLoadFactor(maxLoadFactor);
		this.maxLoadFactor = maxLoadFactor;
		init(initialCapacity);
	}

	/* Hooks for subclasses */
	protected abstract void init(int initialCapacity);

	@Override
	public abstract boolean containsKey(Object key);

	@Override
	public abstract V get(Object key);

	@Override
	public int size() {
		return size;
	}

	@Override
	public boolean isEmpty() {
		return size == 0;
	}

	/**
	 * Upsert: maps {@code key} to {@code value}, replacing any previous value.
	 */
	public void insert(K key, V value) {
		put(key, value);
	}

	/**
	 * Returns the value mapped to {@code key}.
	 *
	 * @throws KeyNotFoundException if the key has no mapping
	 */
	public V at(K key) {
		V v = get(key);
		if (v == null && !containsKey(key)) throw new KeyNotFoundException(key);
		return v;
	}

	/**
	 * Returns the existing value for {@code key}, or inserts and returns the value produced
	 * by {@code defaultValue}. Unlike {@link #computeIfAbsent}, a key mapped to {@code null}
	 * counts as present.
	 */
	public V getOrInsert(K key, Supplier<? extends V> defaultValue) {
		V v = get(key);
		if (v != null || containsKey(key)) return v;
		V created = defaultValue.get();
		put(key, created);
		return created;
	}

	/** Occupied entries divided by {@link #capacity()}. */
	public double loadFactor() {
		return (double) size / capacity;
	}

	/** Slot count of one table. */
	public int capacity() {
		return capacity;
	}

	/** Total slot count over all tables. */
	public int bucketCount() {
		return capacity;
	}

	public double maxLoadFactor() {
		return maxLoadFactor;
	}

	/* Common utilities */
	protected static Object requireKey(Object key) {
		if (key == null) throw new NullPointerException("Null keys not supported");
		return key;
	}

	protected boolean exceedsLoad(int count) {
		return Utils.exceedsLoad(count, capacity, maxLoadFactor);
	}

	@SuppressWarnings("unchecked")
	protected K castKey(Object key) {
		return (K) key;
	}

	@SuppressWarnings("unchecked")
	protected V castValue(Object value) {
		return (V) value;
	}
}
