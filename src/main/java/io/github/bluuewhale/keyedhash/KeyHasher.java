package io.github.bluuewhale.keyedhash;

/**
 * A 64-bit hash function over keys, with fixed parameters.
 * <p>
 * Equal keys must hash equally. {@link ChainingMap} and {@link ProbingMap} take one instance
 * at construction and keep it for their whole life.
 */
@FunctionalInterface
public interface KeyHasher<K> {

	long hash(K key);
}
