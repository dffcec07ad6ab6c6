package io.github.bluuewhale.keyedhash;

/**
 * A family of hash functions indexed by two 64-bit seed words.
 * <p>
 * {@link CuckooMap} needs this variant: every rehash draws fresh seeds so that a key set the
 * previous pair of functions could not separate gets a new chance.
 */
@FunctionalInterface
public interface SeedableHasher<K> {

	KeyHasher<K> withSeeds(long seed0, long seed1);

	/**
	 * SipHash-1-3 over {@link ByteView#canonical()}.
	 */
	static SeedableHasher<Object> standard() {
		return SipHasher.seedable(ByteView.canonical());
	}
}
