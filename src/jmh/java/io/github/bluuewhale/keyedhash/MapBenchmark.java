package io.github.bluuewhale.keyedhash;

import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.eclipse.collections.impl.map.mutable.UnifiedMap;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Insert, lookup and remove at three table loads.
 * <p>
 * Every map is built in {@code @Setup} and only driven through its public {@link Map}
 * operations. The mutating states undo the measured operation in an invocation-level setup
 * so the entry count, and with it the load, stays fixed across an iteration.
 */
@Fork(value = 1)
@Warmup(iterations = 5)
@Measurement(iterations = 5)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class MapBenchmark {

	public enum Kind {
		CHAINING, PROBING, CUCKOO, JDK, FASTUTIL, UNIFIED;

		Map<Integer, Integer> create(int capacity) {
			return switch (this) {
				case CHAINING -> new ChainingMap<>(capacity);
				case PROBING -> new ProbingMap<>(capacity);
				case CUCKOO -> new CuckooMap<>(capacity, SeedableHasher.standard(), SeedSource.fixed(99L));
				case JDK -> new HashMap<>(capacity);
				case FASTUTIL -> new Object2ObjectOpenHashMap<>(capacity);
				case UNIFIED -> new UnifiedMap<>(capacity);
			};
		}
	}

	/** Initial capacity and pre-filled entry count, as multiples of {@code size}. */
	public enum Load {
		OPTIMISTIC, AVERAGE, PESSIMISTIC;

		double capacityFactor(Kind kind) {
			return switch (this) {
				case OPTIMISTIC -> kind == Kind.CHAINING ? 2.0 : 4.0;
				case AVERAGE -> kind == Kind.CHAINING ? 1.0 : 2.0;
				case PESSIMISTIC -> 1.0;
			};
		}

		double fillFactor(Kind kind) {
			return switch (this) {
				case OPTIMISTIC -> 0.0;
				case AVERAGE -> switch (kind) {
					case PROBING -> 0.4;
					case CUCKOO -> 0.3;
					default -> 0.5;
				};
				case PESSIMISTIC -> switch (kind) {
					case PROBING -> 0.65;
					case CUCKOO -> 0.45;
					default -> 0.7;
				};
			};
		}

		/* remove scenarios always hold `size` entries; a smaller table means more growth */
		double removeCapacityFactor() {
			return switch (this) {
				case OPTIMISTIC -> 2.0;
				case AVERAGE -> 1.0;
				case PESSIMISTIC -> 0.5;
			};
		}
	}

	private static Integer[] shuffledKeys(int from, int count, long seed) {
		Integer[] keys = new Integer[count];
		for (int i = 0; i < count; i++) keys[i] = from + i;
		Random rnd = new Random(seed);
		for (int i = count - 1; i > 0; i--) {
			int j = rnd.nextInt(i + 1);
			Integer t = keys[i];
			keys[i] = keys[j];
			keys[j] = t;
		}
		return keys;
	}

	@State(Scope.Thread)
	public static class InsertState {
		@Param({ "1000", "10000", "100000" })
		int size;

		@Param
		Kind kind;

		@Param
		Load load;

		Map<Integer, Integer> map;
		Integer[] fresh; // keys never present at setup time
		int idx;
		Integer pending;
		int expectedSize;

		@Setup(Level.Iteration)
		public void fill() {
			int capacity = Math.max(1, (int) (size * load.capacityFactor(kind)));
			int filled = (int) (size * load.fillFactor(kind));
			map = kind.create(capacity);
			for (int i = 0; i < filled; i++) map.put(i, i);
			fresh = shuffledKeys(size, size, 11L);
			idx = 0;
			pending = null;
			expectedSize = filled;
		}

		@Setup(Level.Invocation)
		public void nextKey() {
			if (pending != null) map.remove(pending);
			pending = fresh[idx];
			idx = (idx + 1) % fresh.length;
		}

		@TearDown(Level.Iteration)
		public void check() {
			if (pending != null) map.remove(pending);
			if (map.size() != expectedSize) {
				throw new IllegalStateException(kind + " drifted to " + map.size() + " entries, expected " + expectedSize);
			}
		}
	}

	@State(Scope.Thread)
	public static class LookupState {
		@Param({ "1000", "10000", "100000" })
		int size;

		@Param
		Kind kind;

		@Param
		Load load;

		Map<Integer, Integer> map;
		Integer[] hits;
		Integer[] misses;
		int hitIdx;
		int missIdx;

		@Setup(Level.Trial)
		public void fill() {
			int capacity = Math.max(1, (int) (size * load.capacityFactor(kind)));
			int filled = Math.max(1, (int) (size * load.fillFactor(kind)));
			map = kind.create(capacity);
			for (int i = 0; i < filled; i++) map.put(i, i);
			hits = shuffledKeys(0, filled, 23L);
			misses = shuffledKeys(size, size, 29L);
		}

		Integer nextHit() {
			Integer k = hits[hitIdx];
			hitIdx = (hitIdx + 1) % hits.length;
			return k;
		}

		Integer nextMiss() {
			Integer k = misses[missIdx];
			missIdx = (missIdx + 1) % misses.length;
			return k;
		}
	}

	@State(Scope.Thread)
	public static class RemoveState {
		@Param({ "1000", "10000", "100000" })
		int size;

		@Param
		Kind kind;

		@Param
		Load load;

		Map<Integer, Integer> map;
		Integer[] present;
		int idx;
		Integer removed;

		@Setup(Level.Iteration)
		public void fill() {
			int capacity = Math.max(1, (int) (size * load.removeCapacityFactor()));
			map = kind.create(capacity);
			for (int i = 0; i < size; i++) map.put(i, i);
			present = shuffledKeys(0, size, 31L);
			idx = 0;
			removed = null;
		}

		/** Puts back the key removed by the previous invocation. */
		@Setup(Level.Invocation)
		public void restore() {
			if (removed != null) map.put(removed, removed);
			removed = present[idx];
			idx = (idx + 1) % present.length;
		}

		@TearDown(Level.Iteration)
		public void check() {
			if (removed != null) map.put(removed, removed);
			if (map.size() != size) {
				throw new IllegalStateException(kind + " drifted to " + map.size() + " entries, expected " + size);
			}
		}
	}

	@Benchmark
	public void insert(InsertState s, Blackhole bh) {
		bh.consume(s.map.put(s.pending, s.pending));
	}

	@Benchmark
	public void getHit(LookupState s, Blackhole bh) {
		bh.consume(s.map.get(s.nextHit()));
	}

	@Benchmark
	public void getMiss(LookupState s, Blackhole bh) {
		bh.consume(s.map.get(s.nextMiss()));
	}

	@Benchmark
	public void remove(RemoveState s, Blackhole bh) {
		bh.consume(s.map.remove(s.removed));
	}
}
