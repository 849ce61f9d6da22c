package io.github.bluuewhale.probetable;

import java.util.NoSuchElementException;

/**
 * Thrown by {@link ProbingTable#get(String)} and {@link ProbingTable#delete(String)}
 * when the key is not stored in the table.
 */
public class KeyNotFoundException extends NoSuchElementException {

	private final String key;

	public KeyNotFoundException(String key) {
		super("key not found: " + key);
		this.key = key;
	}

	public String key() {
		return key;
	}
}
