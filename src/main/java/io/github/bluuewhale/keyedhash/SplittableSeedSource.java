package io.github.bluuewhale.keyedhash;

import java.util.SplittableRandom;

/**
 * {@link SeedSource} backed by a {@link SplittableRandom}.
 */
final class SplittableSeedSource implements SeedSource {

	private final SplittableRandom rnd;

	SplittableSeedSource(long seed) {
		this.rnd = new SplittableRandom(seed);
	}

	@Override
	public long nextSeed() {
		return rnd.nextLong();
	}

	@Override
	public String toString() {
		return "SplittableSeedSource";
	}
}
