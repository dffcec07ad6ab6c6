package io.github.bluuewhale.keyedhash;

/**
 * Converts a key into the byte sequence that is fed to a keyed hash function.
 * <p>
 * The bytes must be a pure function of the key's value: keys that are equal according to
 * {@link Object#equals(Object)} must produce identical sequences. Fixed-width values are
 * written little-endian, the word order {@link SipHash13} reads them in.
 */
@FunctionalInterface
public interface ByteView<K> {

	byte[] bytesOf(K key);

	/**
	 * View that dispatches on the runtime type of the key. See {@link ByteViews#canonical(Object)}.
	 */
	static ByteView<Object> canonical() {
		return ByteViews::canonical;
	}

	static ByteView<String> utf8() {
		return ByteViews::utf8;
	}

	static ByteView<Integer> int32() {
		return key -> ByteViews.int32(key);
	}

	static ByteView<Long> int64() {
		return key -> ByteViews.int64(key);
	}
}
