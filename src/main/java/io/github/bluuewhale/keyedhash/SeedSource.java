package io.github.bluuewhale.keyedhash;

import java.security.SecureRandom;

/**
 * Supplies seed words for {@link SeedableHasher}s.
 * Instances are not thread-safe, matching the maps that use them.
 */
@FunctionalInterface
public interface SeedSource {

	long nextSeed();

	/**
	 * Unpredictable seeds; the generator itself is seeded from {@link SecureRandom}.
	 */
	static SeedSource random() {
		return new SplittableSeedSource(new SecureRandom().nextLong());
	}

	/**
	 * Reproducible seed sequence, for tests and benchmarks.
	 */
	static SeedSource fixed(long seed) {
		return new SplittableSeedSource(seed);
	}
}
