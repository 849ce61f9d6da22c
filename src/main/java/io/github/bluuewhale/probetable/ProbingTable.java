package io.github.bluuewhale.probetable;

import java.util.Map;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Linear probing hash table keyed by {@code String} (null keys NOT allowed, null values allowed).
 * Eager cluster rehash on delete (no tombstones), growth through a ladder of prime capacities
 * once every slot is taken.
 *
 * <p>Not thread-safe.
 */
public class ProbingTable<V> {

	private static final Logger logger = LogManager.getLogger(ProbingTable.class);

	/* Defaults */
	public static final int MIN_CAPACITY = 1;
	public static final int DEFAULT_TABLE_SIZE = 17;

	/* Hash parameters */
	static final int HASH_BASE = 31;
	static final int HASH_SEED = 31415;

	/* Probe outcomes other than a slot position */
	private static final int FULL = Integer.MIN_VALUE;
	private static final int ABSENT = Integer.MIN_VALUE + 1;

	/* Storage */
	private @Nullable Entry<V>[] slots;
	private int count;
	private int nextPrime; // cursor into Capacities for the next growth step

	public ProbingTable() {
		this(DEFAULT_TABLE_SIZE);
	}

	/**
	 * Creates a table of {@code max(MIN_CAPACITY, tableSize)} slots. The growth cursor is placed on
	 * the first prime above {@code tableSize} as requested, not above the clamped size.
	 */
	public ProbingTable(int tableSize) {
		this.slots = newSlots(Math.max(MIN_CAPACITY, tableSize));
		this.count = 0;
		this.nextPrime = Capacities.firstCursorAbove(tableSize);
	}

	public int size() {
		return count;
	}

	public int capacity() {
		return slots.length;
	}

	public boolean isEmpty() {
		return count == 0;
	}

	public boolean isFull() {
		return count == slots.length;
	}

	/**
	 * @throws KeyNotFoundException when the key is not stored
	 */
	public @Nullable V get(String key) {
		int pos = probe(key, false);
		if (pos < 0) throw new KeyNotFoundException(key);
		return slots[pos].value;
	}

	public boolean containsKey(String key) {
		return probe(key, false) >= 0;
	}

	/**
	 * Stores {@code value} under {@code key}, replacing any previous value. Grows the table when
	 * every slot is taken.
	 *
	 * @throws CapacityExhaustedException when growth would need a capacity beyond the largest prime
	 */
	public void set(String key, @Nullable V value) {
		boolean grown = false;
		for (;;) {
			int pos = probe(key, true);
			if (pos == FULL) {
				// growth always leaves a free slot, so one retry is enough
				if (grown) throw new IllegalStateException("table still full after growth, capacity " + slots.length);
				grow();
				grown = true;
				continue;
			}
			if (pos < 0) {
				pos = insertionSlot(pos);
				count++;
			}
			slots[pos] = new Entry<>(key, value);
			return;
		}
	}

	public void insert(String key, @Nullable V value) {
		set(key, value);
	}

	/**
	 * Removes {@code key} and rehashes the rest of its primary cluster so every remaining key
	 * stays reachable from its hash position.
	 *
	 * @return the removed value
	 * @throws KeyNotFoundException when the key is not stored
	 */
	public @Nullable V delete(String key) {
		int pos = probe(key, false);
		if (pos < 0) throw new KeyNotFoundException(key);
		V removed = slots[pos].value;
		slots[pos] = null;
		count--;

		// capacity cannot change here: every re-insert finds the slot it was just taken from
		int capacity = slots.length;
		pos = (pos + 1) % capacity;
		while (slots[pos] != null) {
			Entry<V> moved = slots[pos];
			slots[pos] = null;
			count--;
			set(moved.key, moved.value);
			pos = (pos + 1) % capacity;
		}
		return removed;
	}

	/**
	 * Universal hash over the key's chars.
	 *
	 * @return a position in {@code [0, capacity())}
	 */
	public int hash(String key) {
		int capacity = slots.length;
		if (capacity == 1) return 0;
		long value = 0;
		long a = HASH_SEED;
		for (int i = 0; i < key.length(); i++) {
			value = (key.charAt(i) + a * value) % capacity;
			a = a * HASH_BASE % (capacity - 1);
		}
		return (int) value;
	}

	/**
	 * Returns a {@link Map} view backed by this table.
	 */
	public Map<String, V> asMap() {
		return new ProbingTableMap<>(this);
	}

	/* Resize */
	void grow() {
		int oldCapacity = slots.length;
		if (Capacities.isExhausted(nextPrime)) {
			logger.warn("cannot grow table of [{}] entries past capacity [{}]", count, oldCapacity);
			throw new CapacityExhaustedException(oldCapacity);
		}
		@Nullable Entry<V>[] oldSlots = slots;

		this.slots = newSlots(Capacities.primeAt(nextPrime));
		this.count = 0;
		nextPrime++;

		for (@Nullable Entry<V> e : oldSlots) {
			if (e == null) continue;
			int pos = probe(e.key, true);
			slots[insertionSlot(pos)] = e;
			count++;
		}
		logger.debug("grew table from [{}] to [{}] slots, [{}] entries", oldCapacity, slots.length, count);
	}

	/**
	 * Linear probe from {@code hash(key)}.
	 *
	 * @return the slot holding {@code key}; {@code -(slot + 1)} for the empty slot to insert into
	 *         (insertion only); {@link #FULL} when inserting into a full table; {@link #ABSENT}
	 *         when the key is missing (lookup only)
	 */
	private int probe(String key, boolean forInsertion) {
		Objects.requireNonNull(key, "Null keys not supported");
		if (forInsertion && isFull()) return FULL;

		int capacity = slots.length;
		int pos = hash(key);
		for (int i = 0; i < capacity; i++) {
			Entry<V> e = slots[pos];
			if (e == null) {
				return forInsertion ? -(pos + 1) : ABSENT;
			}
			if (e.key.equals(key)) return pos;
			pos = (pos + 1) % capacity;
		}
		if (forInsertion) {
			throw new IllegalStateException("no free slot in table of capacity " + capacity + " holding " + count);
		}
		return ABSENT;
	}

	private static int insertionSlot(int probed) {
		return -probed - 1;
	}

	/* Hooks for ProbingTableMap and tests */

	/** Slot holding {@code key}, or a negative value when it is missing. */
	int findPosition(String key) {
		return probe(key, false);
	}

	@Nullable V valueAt(int pos) {
		return slots[pos].value;
	}

	@Nullable String keyAt(int pos) {
		Entry<V> e = slots[pos];
		return e == null ? null : e.key;
	}

	int nextPrimeCursor() {
		return nextPrime;
	}

	String[] keys() {
		String[] out = new String[count];
		int n = 0;
		for (@Nullable Entry<V> e : slots) {
			if (e != null) out[n++] = e.key;
		}
		return out;
	}

	/**
	 * Lists every entry as {@code (key,value)}, one per line, in slot order.
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (@Nullable Entry<V> e : slots) {
			if (e == null) continue;
			sb.append('(').append(e.key).append(',').append(e.value).append(")\n");
		}
		return sb.toString();
	}

	@SuppressWarnings("unchecked")
	private static <V> @Nullable Entry<V>[] newSlots(int capacity) {
		return (Entry<V>[]) new Entry<?>[capacity];
	}

	private static final class Entry<V> {
		final String key;
		final @Nullable V value;

		Entry(String key, @Nullable V value) {
			this.key = key;
			this.value = value;
		}
	}
}
