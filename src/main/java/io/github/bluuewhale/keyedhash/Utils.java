package io.github.bluuewhale.keyedhash;

/**
 * Shared utilities for the keyed map family.
 */
final class Utils {
	private Utils() {}

	/* Largest slot count a single table may reach */
	static final int MAX_CAPACITY = 1 << 30;

	static void validateLoadFactor(double lf) {
		if (!(lf > 0.0d && lf < 1.0d)) {
			throw new IllegalArgumentException("loadFactor must be in (0,1): " + lf);
		}
	}

	static void validateCapacity(int capacity) {
		if (capacity <= 0 || capacity > MAX_CAPACITY) {
			throw new IllegalArgumentException("capacity must be in (0," + MAX_CAPACITY + "]: " + capacity);
		}
	}

	/**
	 * Unsigned {@code hash mod capacity}; capacities are not restricted to powers of two.
	 */
	static int indexFor(long hash, int capacity) {
		return (int) Long.remainderUnsigned(hash, capacity);
	}

	static boolean exceedsLoad(int count, int capacity, double loadFactor) {
		return (double) count / capacity > loadFactor;
	}

	/**
	 * Doubles {@code capacity} until {@code count} entries fit under {@code loadFactor}.
	 * Returns -1 when that would pass {@link #MAX_CAPACITY}.
	 */
	static int grownCapacity(int capacity, int count, double loadFactor) {
		long cap = capacity;
		do {
			cap <<= 1;
			if (cap > MAX_CAPACITY) return -1;
		} while (exceedsLoad(count, (int) cap, loadFactor));
		return (int) cap;
	}
}
