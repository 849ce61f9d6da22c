package io.github.bluuewhale.probetable;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ProbingTableTest {

	@Test
	void init() {
		var table = new ProbingTable<String>();

		assertEquals(0, table.size(), "table should be empty");
		assertEquals(ProbingTable.DEFAULT_TABLE_SIZE, table.capacity());
	}

	@Test
	void isEmpty() {
		var table = new ProbingTable<String>();
		assertTrue(table.isEmpty());

		table.set("test", "test");
		assertFalse(table.isEmpty());
	}

	@Test
	void isFull() {
		var table = new ProbingTable<Integer>(10);
		assertFalse(table.isFull());

		for (int i = 0; i < 10; i++) table.set(String.valueOf(i), i);

		assertTrue(table.isFull());
		assertEquals(table.capacity(), table.size());
	}

	@Test
	void growsAndKeepsEveryEntry() {
		var table = new ProbingTable<Integer>(5);
		for (int i = 0; i < 10; i++) table.set(String.valueOf(i), i);

		assertTrue(table.capacity() > 5, "table should have grown");
		assertEquals(10, table.size());
		for (int i = 0; i < 10; i++) {
			assertEquals(i, table.get(String.valueOf(i)), "could not find item: " + i);
		}
	}

	@Test
	void size() {
		var table = new ProbingTable<Integer>(5);
		assertEquals(0, table.size(), "table should be empty");

		for (int i = 0; i < 3; i++) table.set(String.valueOf(i), i);

		assertEquals(3, table.size(), "table should contain 3 items");
	}

	@Test
	void setReplacesExistingValue() {
		var table = new ProbingTable<String>(7);
		table.set("k", "v1");
		table.set("k", "v2");

		assertEquals("v2", table.get("k"));
		assertEquals(1, table.size());
	}

	@Test
	void insertIsSet() {
		var table = new ProbingTable<Integer>();
		table.insert("a", 1);
		table.insert("a", 2);

		assertEquals(2, table.get("a"));
		assertEquals(1, table.size());
	}

	@Test
	void nullValuesAreStored() {
		var table = new ProbingTable<String>(3);
		table.set("a", null);

		assertTrue(table.containsKey("a"));
		assertNull(table.get("a"));
		assertEquals(1, table.size());
	}

	@Test
	void nullKeysRejected() {
		var table = new ProbingTable<String>();

		assertThrows(NullPointerException.class, () -> table.set(null, "x"));
		assertThrows(NullPointerException.class, () -> table.get(null));
		assertThrows(NullPointerException.class, () -> table.delete(null));
	}

	@Test
	void getMissingKeyThrows() {
		var table = new ProbingTable<Integer>(5);
		table.set("present", 1);

		var e = assertThrows(KeyNotFoundException.class, () -> table.get("absent"));
		assertEquals("absent", e.key());
		assertFalse(table.containsKey("absent"));
	}

	@Test
	void getOnFullTableMissingKeyThrows() {
		var table = new ProbingTable<Integer>(4);
		for (int i = 0; i < 4; i++) table.set("k" + i, i);
		assertTrue(table.isFull());

		assertThrows(KeyNotFoundException.class, () -> table.get("nope"));
	}

	@Test
	void deleteFromFullTable() {
		var table = new ProbingTable<Integer>(10);
		for (int i = 0; i < 10; i++) table.set(String.valueOf(i), i);
		assertTrue(table.isFull());

		for (int i = 0; i < 5; i++) table.delete(String.valueOf(i));

		for (int i = 0; i < 10; i++) {
			String key = String.valueOf(i);
			if (i < 5) {
				assertThrows(KeyNotFoundException.class, () -> table.get(key));
			} else {
				assertEquals(i, table.get(key), "could not find item: " + i);
			}
		}
		assertEquals(5, table.size());
	}

	@Test
	void deleteAfterGrowth() {
		var table = new ProbingTable<Integer>(5);
		for (int i = 0; i < 10; i++) table.set(String.valueOf(i), i);

		for (int i = 0; i < 5; i++) table.delete(String.valueOf(i));

		for (int i = 0; i < 10; i++) {
			String key = String.valueOf(i);
			if (i < 5) {
				assertThrows(KeyNotFoundException.class, () -> table.get(key));
			} else {
				assertEquals(i, table.get(key), "could not find item: " + i);
			}
		}
	}

	@Test
	void deleteReturnsRemovedValue() {
		var table = new ProbingTable<String>();
		table.set("a", "x");

		assertEquals("x", table.delete("a"));
		assertTrue(table.isEmpty());
	}

	@Test
	void deleteMissingKeyThrows() {
		var table = new ProbingTable<Integer>(5);
		table.set("a", 1);

		assertThrows(KeyNotFoundException.class, () -> table.delete("b"));
		assertEquals(1, table.size());
		assertEquals(1, table.get("a"));
	}

	@Test
	void displayForm() {
		var table = new ProbingTable<Integer>(5);
		assertEquals("", table.toString(), "table should be empty");

		for (int i = 0; i < 5; i++) table.set(String.valueOf(i), i);

		String display = table.toString();
		for (int i = 0; i < 5; i++) {
			assertTrue(display.contains("(" + i + "," + i + ")"), display);
		}
		assertEquals(5, display.chars().filter(c -> c == '(').count());
		assertEquals(5, display.lines().count());
	}

	@ParameterizedTest(name = "capacity {0}")
	@ValueSource(ints = { 2, 3, 5, 10, 17, 101, 7013, 7199369 })
	void hashStaysInRange(int capacity) {
		var table = new ProbingTable<Integer>(capacity);
		String[] keys = { "a", "0", "hello", "a much longer key with spaces", "\uffff\uffff\uffff", "zzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzz" };
		for (String key : keys) {
			int h = table.hash(key);
			assertTrue(h >= 0 && h < capacity, key + " -> " + h);
		}
		for (int i = 0; i < 1_000; i++) {
			int h = table.hash("key-" + i);
			assertTrue(h >= 0 && h < capacity, "key-" + i + " -> " + h);
		}
	}

	@Test
	void hashIsDeterministic() {
		var table = new ProbingTable<Integer>(101);

		assertEquals(table.hash("stable"), table.hash("stable"));
		assertEquals(table.hash("stable"), new ProbingTable<Integer>(101).hash("stable"));
	}

	@Test
	void hashOfSingleChar() {
		// single char: value = ch mod capacity
		var table = new ProbingTable<Integer>(10);

		assertEquals('0' % 10, table.hash("0"));
		assertEquals('A' % 10, table.hash("A"));
	}

	@Test
	void hashOfEmptyKeyIsZero() {
		assertEquals(0, new ProbingTable<Integer>(11).hash(""));
	}

	@Test
	void singleSlotTable() {
		var table = new ProbingTable<Integer>(0);
		assertEquals(ProbingTable.MIN_CAPACITY, table.capacity());

		table.set("a", 1);
		assertTrue(table.isFull());
		table.set("b", 2);

		assertEquals(3, table.capacity());
		assertEquals(1, table.get("a"));
		assertEquals(2, table.get("b"));
	}

	@Test
	void deleteFromSingleSlotTable() {
		var table = new ProbingTable<Integer>(1);
		table.set("a", 1);
		assertTrue(table.isFull());

		assertEquals(1, table.delete("a"));

		assertTrue(table.isEmpty());
		assertEquals(1, table.capacity());
		assertThrows(KeyNotFoundException.class, () -> table.get("a"));
		assertThrows(KeyNotFoundException.class, () -> table.delete("a"));

		table.set("b", 2);
		assertEquals(2, table.get("b"));
		assertEquals(1, table.capacity());
	}
}
