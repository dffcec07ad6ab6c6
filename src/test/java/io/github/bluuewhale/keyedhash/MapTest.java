package io.github.bluuewhale.keyedhash;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ConcurrentModificationException;
import java.util.Map;
import java.util.function.IntFunction;
import java.util.function.Supplier;
import java.util.stream.Stream;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class MapTest {

	record MapSpec(
		String name,
		Supplier<AbstractKeyedMap<?, ?>> mapSupplier,
		IntFunction<AbstractKeyedMap<?, ?>> mapWithCapacitySupplier,
		double maxLoadFactor,
		boolean storesFullCollisions
	) {
		@Override public String toString() { return name; }
	}

	private static Stream<MapSpec> mapSpecs() {
		return Stream.of(
			new MapSpec(
				"ChainingMap",
				ChainingMap::new,
				ChainingMap::new,
				0.75,
				true
			),
			new MapSpec(
				"ProbingMap",
				ProbingMap::new,
				ProbingMap::new,
				0.7,
				true
			),
			new MapSpec(
				"CuckooMap",
				CuckooMap::new,
				CuckooMap::new,
				0.5,
				false
			)
		);
	}

	@SuppressWarnings("unchecked")
	private static <K, V> AbstractKeyedMap<K, V> newMap(MapSpec spec) {
		return (AbstractKeyedMap<K, V>) spec.mapSupplier().get();
	}

	@SuppressWarnings("unchecked")
	private static <K, V> AbstractKeyedMap<K, V> newMap(MapSpec spec, int capacity) {
		return (AbstractKeyedMap<K, V>) spec.mapWithCapacitySupplier().apply(capacity);
	}

	@ParameterizedTest(name = "{0} isEmpty")
	@MethodSource("mapSpecs")
	void isEmpty(MapSpec spec) {
		var m = newMap(spec);

		assertTrue(m.isEmpty());

		m.put("a", 1);
		assertFalse(m.isEmpty());
	}

	@ParameterizedTest(name = "{0} containsKey")
	@MethodSource("mapSpecs")
	void containsKey(MapSpec spec) {
		var m = newMap(spec);
		m.put("a", 1);

		assertTrue(m.containsKey("a"));
		assertFalse(m.containsKey("b"));
		assertThrows(NullPointerException.class, () -> m.containsKey(null));
	}

	@ParameterizedTest(name = "{0} basicCrud")
	@MethodSource("mapSpecs")
	void basicCrud(MapSpec spec) {
		var m = newMap(spec);

		var first = m.put("a", 1);
		var replaced = m.put("a", 2);
		var removed = m.remove("a");

		assertNull(first);
		assertEquals(1, replaced);
		assertEquals(2, removed);
		assertFalse(m.containsKey("a"));
		assertEquals(0, m.size());
	}

	@ParameterizedTest(name = "{0} roundTrip")
	@MethodSource("mapSpecs")
	void roundTrip(MapSpec spec) {
		AbstractKeyedMap<Object, Object> m = newMap(spec);
		Object[] keys = { 0, -1, Long.MAX_VALUE, "", "key", 'c', 3.5d, 2.5f, (short) 7, (byte) 9, true };

		for (int i = 0; i < keys.length; i++) m.insert(keys[i], i);
		for (int i = 0; i < keys.length; i++) assertEquals(i, m.at(keys[i]));
		assertEquals(keys.length, m.size());
	}

	@ParameterizedTest(name = "{0} upsertKeepsSize")
	@MethodSource("mapSpecs")
	void upsertKeepsSize(MapSpec spec) {
		var m = newMap(spec);

		m.insert("k", 1);
		m.insert("k", 2);

		assertEquals(2, m.at("k"));
		assertEquals(1, m.size());
	}

	@ParameterizedTest(name = "{0} removeAbsentKeepsSize")
	@MethodSource("mapSpecs")
	void removeAbsentKeepsSize(MapSpec spec) {
		var m = newMap(spec);
		m.put("a", 1);

		assertNull(m.remove("missing"));
		assertNull(m.remove("missing"));
		assertEquals(1, m.size());
	}

	@ParameterizedTest(name = "{0} removeThenReinsert")
	@MethodSource("mapSpecs")
	void removeThenReinsert(MapSpec spec) {
		var m = newMap(spec);

		m.insert("k", 1);
		m.remove("k");
		assertFalse(m.containsKey("k"));

		m.insert("k", 2);
		assertEquals(2, m.at("k"));
		assertEquals(1, m.size());
	}

	@ParameterizedTest(name = "{0} atThrowsKeyNotFound")
	@MethodSource("mapSpecs")
	void atThrowsKeyNotFound(MapSpec spec) {
		var m = newMap(spec);
		m.put("a", null);

		assertNull(m.at("a"));
		var e = assertThrows(KeyNotFoundException.class, () -> m.at("b"));
		assertEquals("b", e.getKey());
	}

	@ParameterizedTest(name = "{0} getOrInsert")
	@MethodSource("mapSpecs")
	void getOrInsert(MapSpec spec) {
		AbstractKeyedMap<String, Integer> m = newMap(spec);
		m.put("present", 5);

		assertEquals(5, m.getOrInsert("present", () -> 0));
		assertEquals(0, m.getOrInsert("absent", () -> 0));
		assertEquals(0, m.at("absent"));
		assertEquals(2, m.size());
	}

	@ParameterizedTest(name = "{0} nullKeyAndValue")
	@MethodSource("mapSpecs")
	void nullKeyAndValue(MapSpec spec) {
		var m = newMap(spec);

		assertThrows(NullPointerException.class, () -> m.put(null, 10));
		assertThrows(NullPointerException.class, () -> m.get(null));
		assertThrows(NullPointerException.class, () -> m.remove(null));

		m.put("x", null);
		assertNull(m.get("x"));
		assertTrue(m.containsKey("x"));
		assertTrue(m.containsValue(null));
	}

	@ParameterizedTest(name = "{0} reuseTombstone")
	@MethodSource("mapSpecs")
	void reuseTombstone(MapSpec spec) {
		var m = newMap(spec);

		m.put("a", 1);
		m.remove("a");
		m.put("a", 2);

		assertEquals(2, m.get("a"));
	}

	@ParameterizedTest(name = "{0} rehashOnLoad")
	@MethodSource("mapSpecs")
	void rehashOnLoad(MapSpec spec) {
		var m = newMap(spec, 4);

		for (int i = 0; i < 32; i++) m.put(i, i * 10);
		for (int i = 0; i < 32; i++) assertEquals(i * 10, m.get(i));
		assertTrue(m.capacity() > 4);
	}

	@ParameterizedTest(name = "{0} loadFactorStaysBounded")
	@MethodSource("mapSpecs")
	void loadFactorStaysBounded(MapSpec spec) {
		var m = newMap(spec);

		for (int i = 0; i < 2000; i++) {
			m.put(i, i);
			assertTrue(m.loadFactor() <= spec.maxLoadFactor(), () -> "load factor " + m.loadFactor());
			if (i % 3 == 0) {
				m.remove(i / 2);
				assertTrue(m.loadFactor() <= spec.maxLoadFactor());
			}
		}
	}

	@ParameterizedTest(name = "{0} clearResetsState")
	@MethodSource("mapSpecs")
	void clearResetsState(MapSpec spec) {
		var m = newMap(spec);

		m.put("a", 1);
		int cap = m.capacity();
		m.clear();

		assertEquals(0, m.size());
		assertEquals(cap, m.capacity());
		assertEquals(0.0, m.loadFactor());
		assertFalse(m.containsKey("a"));

		m.put("b", 2);
		assertEquals(2, m.get("b"));
	}

	@ParameterizedTest(name = "{0} entrySetRemoveByValue")
	@MethodSource("mapSpecs")
	void entrySetRemoveByValue(MapSpec spec) {
		var m = newMap(spec);

		m.put("a", 1);
		m.put("b", 2);

		assertTrue(m.entrySet().remove(Map.entry("a", 1)));
		assertFalse(m.containsKey("a"));
		assertEquals(1, m.size());

		assertFalse(m.entrySet().remove(Map.entry("b", 999)));
		assertTrue(m.containsKey("b"));
	}

	@ParameterizedTest(name = "{0} iteratorRemove")
	@MethodSource("mapSpecs")
	void iteratorRemove(MapSpec spec) {
		var m = newMap(spec);

		m.put("a", 1);
		m.put("b", 2);

		var it = m.keySet().iterator();
		assertTrue(it.hasNext());

		it.next();
		it.remove();

		assertEquals(1, m.size());
	}

	@ParameterizedTest(name = "{0} iteratorFailsFast")
	@MethodSource("mapSpecs")
	void iteratorFailsFast(MapSpec spec) {
		var m = newMap(spec);
		m.put("a", 1);
		m.put("b", 2);

		var it = m.entrySet().iterator();
		it.next();
		m.put("c", 3);

		assertThrows(ConcurrentModificationException.class, it::next);
	}

	@ParameterizedTest(name = "{0} overwriteDuringIteration")
	@MethodSource("mapSpecs")
	void overwriteDuringIteration(MapSpec spec) {
		var m = newMap(spec);
		for (int i = 0; i < 20; i++) m.put(i, i);

		for (var key : m.keySet()) m.put(key, -1);

		assertEquals(20, m.size());
		for (int i = 0; i < 20; i++) assertEquals(-1, m.get(i));
	}

	@ParameterizedTest(name = "{0} entrySetSetValueReflectsInMap")
	@MethodSource("mapSpecs")
	void entrySetSetValueReflectsInMap(MapSpec spec) {
		var m = newMap(spec);
		m.put("k", 1);

		var it = m.entrySet().iterator();
		var e = it.next();
		e.setValue(99);

		assertEquals(99, m.get("k"));
	}

	@ParameterizedTest(name = "{0} detachedEntrySetValueLeavesMapAlone")
	@MethodSource("mapSpecs")
	void detachedEntrySetValueLeavesMapAlone(MapSpec spec) {
		var m = newMap(spec);
		m.put("k", 1);
		m.put("other", 2);

		Map.Entry<Object, Object> entry = null;
		for (var e : m.entrySet()) {
			if (e.getKey().equals("k")) entry = e;
		}
		m.remove("k");
		entry.setValue(5);

		assertFalse(m.containsKey("k"));
		assertEquals(1, m.size());
		assertEquals(2, m.get("other"));
	}

	@ParameterizedTest(name = "{0} entrySetValueFollowsRehash")
	@MethodSource("mapSpecs")
	void entrySetValueFollowsRehash(MapSpec spec) {
		var m = newMap(spec, 4);
		m.put(0, 0);
		var entry = m.entrySet().iterator().next();

		for (int i = 1; i < 64; i++) m.put(i, i);
		entry.setValue(-1);

		assertEquals(-1, m.get(0));
		assertEquals(-1, entry.getValue());
		assertEquals(64, m.size());
	}

	@ParameterizedTest(name = "{0} iteratorRemovesAll")
	@MethodSource("mapSpecs")
	void iteratorRemovesAll(MapSpec spec) {
		var m = newMap(spec);
		for (int i = 0; i < 10; i++) m.put(i, i);

		var it = m.entrySet().iterator();
		while (it.hasNext()) {
			it.next();
			it.remove();
		}

		assertEquals(0, m.size());
		assertTrue(m.isEmpty());
	}

	@ParameterizedTest(name = "{0} highCollision")
	@MethodSource("mapSpecs")
	void highCollision(MapSpec spec) {
		record Fixed(int val) {
			@Override public int hashCode() { return 0x1234_5601; }
		}
		var m = newMap(spec);

		m.put(new Fixed(1), 10);
		m.put(new Fixed(2), 20);

		if (!spec.storesFullCollisions()) {
			// two candidate slots per key, and every seed maps these keys to the same two
			assertThrows(CapacityExhaustedException.class, () -> m.put(new Fixed(3), 30));
			assertEquals(2, m.size());
			assertEquals(10, m.get(new Fixed(1)));
			assertEquals(20, m.get(new Fixed(2)));
			return;
		}

		m.put(new Fixed(3), 30);
		m.remove(new Fixed(2));

		assertEquals(10, m.get(new Fixed(1)));
		assertEquals(30, m.get(new Fixed(3)));
		assertNull(m.get(new Fixed(2)));
	}

	@ParameterizedTest(name = "{0} putAllBulk")
	@MethodSource("mapSpecs")
	void putAllBulk(MapSpec spec) {
		var m = newMap(spec);
		var src = new java.util.HashMap<Integer, Integer>();
		for (int i = 0; i < 50; i++) src.put(i, i * 2);

		m.putAll(src);

		assertEquals(src.size(), m.size());
		assertEquals(src, m);
		for (int i = 0; i < 50; i++) assertEquals(i * 2, m.get(i));
	}

	@ParameterizedTest(name = "{0} valuesContainsAndIteratorRemove")
	@MethodSource("mapSpecs")
	void valuesContainsAndIteratorRemove(MapSpec spec) {
		var m = newMap(spec);
		m.put("a", 1);
		m.put("b", null);

		assertTrue(m.values().contains(1));
		assertTrue(m.values().contains(null));

		var it = m.values().iterator();
		assertTrue(it.hasNext());
		it.next();
		it.remove();

		assertEquals(1, m.size());
	}

	@ParameterizedTest(name = "{0} keySetRemoveAllRetainAll")
	@MethodSource("mapSpecs")
	void keySetRemoveAllRetainAll(MapSpec spec) {
		var m = newMap(spec);
		m.put("a", 1);
		m.put("b", 2);
		m.put("c", 3);
		var removeSet = java.util.Set.of("a", "x");

		m.keySet().removeAll(removeSet);
		assertFalse(m.containsKey("a"));
		assertEquals(2, m.size());

		m.keySet().retainAll(java.util.Set.of("b"));
		assertTrue(m.containsKey("b"));
		assertEquals(1, m.size());
	}

	@ParameterizedTest(name = "{0} iteratorRemoveIllegalState")
	@MethodSource("mapSpecs")
	void iteratorRemoveIllegalState(MapSpec spec) {
		var m = newMap(spec);

		m.put("a", 1);
		var it = m.entrySet().iterator();

		assertThrows(IllegalStateException.class, it::remove);
	}

	@ParameterizedTest(name = "{0} duplicateRemoveIllegalState")
	@MethodSource("mapSpecs")
	void duplicateRemoveIllegalState(MapSpec spec) {
		var m = newMap(spec);
		m.put("a", 1);
		var it = m.entrySet().iterator();
		it.next();
		it.remove();

		assertThrows(IllegalStateException.class, it::remove);
	}

	@ParameterizedTest(name = "{0} largeDeleteAndReinsert")
	@MethodSource("mapSpecs")
	void largeDeleteAndReinsert(MapSpec spec) {
		var m = newMap(spec);
		for (int i = 0; i < 500; i++) m.put(i, i);

		for (int i = 0; i < 400; i++) m.remove(i);
		for (int i = 0; i < 400; i++) m.put(i, i * 2);

		assertEquals(500, m.size());
		for (int i = 0; i < 500; i++) {
			int expected = (i < 400) ? i * 2 : i;
			assertEquals(expected, m.get(i));
		}
	}

	@ParameterizedTest(name = "{0} entrySetSetValueAcrossAll")
	@MethodSource("mapSpecs")
	void entrySetSetValueAcrossAll(MapSpec spec) {
		var m = newMap(spec);
		m.put("a", 1);
		m.put("b", 2);
		m.put("c", 3);

		for (var e : m.entrySet()) {
			e.setValue(100);
		}

		for (var e : m.entrySet()) assertEquals(100, e.getValue());
	}

	@ParameterizedTest(name = "{0} iteratorCoversAllEntries")
	@MethodSource("mapSpecs")
	void iteratorCoversAllEntries(MapSpec spec) {
		var m = newMap(spec);
		int n = 10000;
		int expectedSum = 0;
		for (int i = 0; i < n; i++) {
			int v = i + 1; // avoid zero to make sum check meaningful
			m.put(i, v);
			expectedSum += v;
		}

		int actualSum = 0;
		int count = 0;
		for (var e : m.entrySet()) {
			actualSum += (Integer) e.getValue();
			count++;
		}

		assertEquals(n, count);
		assertEquals(n, m.size());
		assertEquals(expectedSum, actualSum);
	}

	@ParameterizedTest(name = "{0} rejectsBadConstructorArguments")
	@MethodSource("mapSpecs")
	void rejectsBadConstructorArguments(MapSpec spec) {
		assertThrows(IllegalArgumentException.class, () -> spec.mapWithCapacitySupplier().apply(0));
		assertThrows(IllegalArgumentException.class, () -> spec.mapWithCapacitySupplier().apply(-1));
	}
}
