package io.github.bluuewhale.probetable;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

import org.jspecify.annotations.Nullable;

/**
 * {@link Map} view over a {@link ProbingTable} (null keys NOT allowed, null values allowed).
 * Queries with a missing, {@code null} or non-String key answer {@code null}/{@code false}
 * instead of throwing.
 */
final class ProbingTableMap<V> extends AbstractMap<String, V> {

	private final ProbingTable<V> table;

	ProbingTableMap(ProbingTable<V> table) {
		this.table = table;
	}

	@Override
	public int size() {
		return table.size();
	}

	@Override
	public boolean isEmpty() {
		return table.isEmpty();
	}

	@Override
	public boolean containsKey(@Nullable Object key) {
		return findIndex(key) >= 0;
	}

	@Override
	public @Nullable V get(@Nullable Object key) {
		int idx = findIndex(key);
		return (idx >= 0) ? table.valueAt(idx) : null;
	}

	@Override
	public @Nullable V put(String key, @Nullable V value) {
		if (key == null) throw new NullPointerException("Null keys not supported");
		int idx = table.findPosition(key);
		V old = (idx >= 0) ? table.valueAt(idx) : null;
		table.set(key, value);
		return old;
	}

	@Override
	public @Nullable V remove(@Nullable Object key) {
		if (findIndex(key) < 0) return null;
		return table.delete((String) key);
	}

	@Override
	public void clear() {
		for (String key : table.keys()) {
			table.delete(key);
		}
	}

	@Override
	public Set<Map.Entry<String, V>> entrySet() {
		return new EntrySet();
	}

	private int findIndex(@Nullable Object key) {
		if (!(key instanceof String)) return -1;
		return table.findPosition((String) key);
	}

	/* ------------ EntrySet / Iterator ------------ */

	private final class EntrySet extends AbstractSet<Map.Entry<String, V>> {
		@Override
		public int size() {
			return table.size();
		}

		@Override
		public void clear() {
			ProbingTableMap.this.clear();
		}

		@Override
		public Iterator<Map.Entry<String, V>> iterator() {
			return new EntryIterator();
		}

		/* Membership by a single probe instead of a scan */
		@Override
		public boolean contains(@Nullable Object o) {
			if (!(o instanceof Map.Entry<?, ?> e)) return false;
			int idx = findIndex(e.getKey());
			return idx >= 0 && Objects.equals(table.valueAt(idx), e.getValue());
		}

		@Override
		public boolean remove(@Nullable Object o) {
			if (!contains(o)) return false;
			table.delete((String) ((Map.Entry<?, ?>) o).getKey());
			return true;
		}
	}

	/**
	 * Walks a snapshot of the keys: a delete rehashes the rest of its cluster, which can move
	 * entries behind a slot cursor.
	 */
	private final class EntryIterator implements Iterator<Map.Entry<String, V>> {
		private final String[] keys = table.keys();
		private int nextIdx = 0;
		private @Nullable String lastKey;

		@Override
		public boolean hasNext() {
			return nextIdx < keys.length;
		}

		@Override
		public Map.Entry<String, V> next() {
			if (nextIdx >= keys.length) throw new NoSuchElementException();
			String key = keys[nextIdx++];
			lastKey = key;
			return new EntryView(key);
		}

		@Override
		public void remove() {
			if (lastKey == null) throw new IllegalStateException();
			ProbingTableMap.this.remove(lastKey);
			lastKey = null;
		}
	}

	private final class EntryView implements Map.Entry<String, V> {
		private final String key;

		EntryView(String key) {
			this.key = key;
		}

		@Override
		public String getKey() {
			return key;
		}

		@Override
		public @Nullable V getValue() {
			return ProbingTableMap.this.get(key);
		}

		@Override
		public @Nullable V setValue(@Nullable V value) {
			return ProbingTableMap.this.put(key, value);
		}

		// key is never null; value follows the table
		@Override
		public int hashCode() {
			return key.hashCode() ^ Objects.hashCode(getValue());
		}

		@Override
		public boolean equals(@Nullable Object obj) {
			return obj instanceof Map.Entry<?, ?> e
				&& key.equals(e.getKey())
				&& Objects.equals(getValue(), e.getValue());
		}

		@Override
		public String toString() {
			return key + "=" + getValue();
		}
	}
}
