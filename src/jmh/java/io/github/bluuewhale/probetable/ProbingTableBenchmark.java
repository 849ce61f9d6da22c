package io.github.bluuewhale.probetable;

import java.util.HashMap;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.eclipse.collections.impl.map.mutable.UnifiedMap;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

@Fork(value = 1)
@Warmup(iterations = 5)
@Measurement(iterations = 5)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class ProbingTableBenchmark {

	private static String randomUuidString(Random rnd) {
		return new UUID(rnd.nextLong(), rnd.nextLong()).toString();
	}

	/**
	 * Unique keys plus unique misses that never overlap with the keys.
	 */
	private static void generateKeysAndMisses(Random rnd, String[] keys, String[] misses) {
		if (keys.length != misses.length) throw new IllegalArgumentException("keys and misses must have same length");
		int size = keys.length;
		var set = new java.util.HashSet<String>(size * 2);
		for (int i = 0; i < size; i++) {
			String k;
			do { k = randomUuidString(rnd); } while (!set.add(k));
			keys[i] = k;
		}
		for (int i = 0; i < size; i++) {
			String miss;
			do { miss = randomUuidString(rnd); } while (set.contains(miss));
			misses[i] = miss;
			set.add(miss);
		}
	}

	@State(Scope.Benchmark)
	public static class ReadState {
		// the table only grows once full, so sizes sit on the prime ladder at varying load
		@Param({ "1000", "10000", "100000" })
		int size;

		ProbingTable<Object> table;
		Object2ObjectOpenHashMap<String, Object> fastutil;
		UnifiedMap<String, Object> unified;
		HashMap<String, Object> jdk;
		String[] keys;
		String[] misses;
		int nextKeyIndex;
		int nextMissIndex;

		@Setup(Level.Trial)
		public void setup() {
			var rnd = new Random(123);
			keys = new String[size];
			misses = new String[size];
			generateKeysAndMisses(rnd, keys, misses);
			nextKeyIndex = 0;
			nextMissIndex = 0;
			table = new ProbingTable<>();
			fastutil = new Object2ObjectOpenHashMap<>();
			unified = new UnifiedMap<>();
			jdk = new HashMap<>();
			for (int i = 0; i < size; i++) {
				table.set(keys[i], "dummy");
				fastutil.put(keys[i], "dummy");
				unified.put(keys[i], "dummy");
				jdk.put(keys[i], "dummy");
			}
		}

		String nextHitKey() {
			var k = keys[nextKeyIndex];
			nextKeyIndex = (nextKeyIndex + 1) % keys.length;
			return k;
		}

		String nextMissingKey() {
			var k = misses[nextMissIndex];
			nextMissIndex = (nextMissIndex + 1) % misses.length;
			return k;
		}
	}

	/**
	 * Keeps entry count constant by doing the compensating delete in
	 * {@code @Setup(Level.Invocation)}, so the measured region is the insertion only.
	 */
	@State(Scope.Thread)
	public static class PutMissState {
		@Param({ "1000", "10000", "100000" })
		int size;

		int idx;
		String[] keys;   // keys currently present
		String[] misses; // keys currently absent
		String nextKey;

		ProbingTable<Object> table;
		Object2ObjectOpenHashMap<String, Object> fastutil;
		UnifiedMap<String, Object> unified;
		HashMap<String, Object> jdk;

		@Setup(Level.Trial)
		public void initKeys() {
			var rnd = new Random(456);
			keys = new String[size];
			misses = new String[size];
			generateKeysAndMisses(rnd, keys, misses);
		}

		@Setup(Level.Iteration)
		public void resetMaps() {
			idx = 0;
			table = new ProbingTable<>();
			fastutil = new Object2ObjectOpenHashMap<>();
			unified = new UnifiedMap<>();
			jdk = new HashMap<>();
			for (int i = 0; i < size; i++) {
				table.set(keys[i], "dummy");
				fastutil.put(keys[i], "dummy");
				unified.put(keys[i], "dummy");
				jdk.put(keys[i], "dummy");
			}
		}

		@Setup(Level.Invocation)
		public void beforeInvocation() {
			String evictKey = keys[idx];
			table.delete(evictKey);
			fastutil.remove(evictKey);
			unified.remove(evictKey);
			jdk.remove(evictKey);

			nextKey = misses[idx];

			// nextKey becomes present, evictKey becomes absent
			keys[idx] = nextKey;
			misses[idx] = evictKey;

			idx = (idx + 1) % keys.length;
		}

		String nextMissKey() { return nextKey; }
		String nextValue() { return "dummy"; }
	}

	// ------- get hit/miss -------
	@Benchmark
	public void tableGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.table.get(s.nextHitKey()));
	}

	@Benchmark
	public void fastutilGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.fastutil.get(s.nextHitKey()));
	}

	@Benchmark
	public void unifiedGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.unified.get(s.nextHitKey()));
	}

	@Benchmark
	public void jdkGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.jdk.get(s.nextHitKey()));
	}

	@Benchmark
	public void tableGetMiss(ReadState s, Blackhole bh) {
		bh.consume(s.table.containsKey(s.nextMissingKey()));
	}

	@Benchmark
	public void jdkGetMiss(ReadState s, Blackhole bh) {
		bh.consume(s.jdk.containsKey(s.nextMissingKey()));
	}

	// ------- mutating: put miss -------
	@Benchmark
	public void tablePutMiss(PutMissState s) {
		s.table.set(s.nextMissKey(), s.nextValue());
	}

	@Benchmark
	public void fastutilPutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.fastutil.put(s.nextMissKey(), s.nextValue()));
	}

	@Benchmark
	public void unifiedPutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.unified.put(s.nextMissKey(), s.nextValue()));
	}

	@Benchmark
	public void jdkPutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.jdk.put(s.nextMissKey(), s.nextValue()));
	}
}
