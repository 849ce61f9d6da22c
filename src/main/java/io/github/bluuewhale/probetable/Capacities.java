package io.github.bluuewhale.probetable;

/**
 * Prime table sizes used when a {@link ProbingTable} grows.
 */
final class Capacities {
	private Capacities() {}

	/* Ascending, roughly x1.2 apart */
	private static final int[] PRIMES = {
		3, 7, 11, 17, 23, 29, 37, 47, 59, 71, 89, 107, 131, 163, 197, 239, 293, 353, 431, 521, 631, 761, 919,
		1103, 1327, 1597, 1931, 2333, 2801, 3371, 4049, 4861, 5839, 7013, 8419, 10103, 12143, 14591, 17519, 21023,
		25229, 30313, 36353, 43627, 52361, 62851, 75521, 90523, 108631, 130363, 156437, 187751, 225307, 270371,
		324449, 389357, 467237, 560689, 672827, 807403, 968897, 1162687, 1395263, 1674319, 2009191, 2411033,
		2893249, 3471899, 4166287, 4999559, 5999471, 7199369
	};

	static int count() {
		return PRIMES.length;
	}

	static int primeAt(int cursor) {
		return PRIMES[cursor];
	}

	static int largest() {
		return PRIMES[PRIMES.length - 1];
	}

	/**
	 * Index of the first prime strictly greater than {@code requested},
	 * or {@link #count()} when no such prime exists.
	 */
	static int firstCursorAbove(int requested) {
		int cursor = 0;
		while (cursor < PRIMES.length && PRIMES[cursor] <= requested) {
			cursor++;
		}
		return cursor;
	}

	static boolean isExhausted(int cursor) {
		return cursor >= PRIMES.length;
	}
}
