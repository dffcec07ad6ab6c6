package io.github.bluuewhale.keyedhash;

import java.util.NoSuchElementException;

/**
 * Thrown by {@link AbstractKeyedMap#at(Object)} when the key has no mapping.
 */
public class KeyNotFoundException extends NoSuchElementException {

	private static final long serialVersionUID = 1L;

	private final transient Object key;

	public KeyNotFoundException(Object key) {
		super("Key not found: " + key);
		this.key = key;
	}

	public Object getKey() {
		return key;
	}
}
