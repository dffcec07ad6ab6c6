package io.github.bluuewhale.keyedhash;

/**
 * Thrown when a {@link CuckooMap} cannot place its entries after the bounded number of
 * rehash cycles. The hash functions could not separate the key set with any of the seeds
 * tried; the map keeps the contents it had before the failing insert.
 */
public class CapacityExhaustedException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final int attempts;
	private final int capacity;

	public CapacityExhaustedException(int attempts, int capacity) {
		super("Failed to insert after " + attempts + " rehash attempts (capacity " + capacity + ")");
		this.attempts = attempts;
		this.capacity = capacity;
	}

	/** Number of rehash cycles tried before giving up. */
	public int getAttempts() {
		return attempts;
	}

	/** Per-table capacity the map kept. */
	public int getCapacity() {
		return capacity;
	}
}
