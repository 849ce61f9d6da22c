package io.github.bluuewhale.probetable;

/**
 * The table has outgrown the largest prime capacity it knows about.
 */
public class CapacityExhaustedException extends IllegalStateException {

	private final int capacity;

	public CapacityExhaustedException(int capacity) {
		super("cannot grow table beyond capacity " + capacity
			+ " (largest supported capacity is " + Capacities.largest() + ")");
		this.capacity = capacity;
	}

	public int capacity() {
		return capacity;
	}
}
