package io.github.bluuewhale.keyedhash;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ProbingMapTest {

	private static final KeyHasher<Object> SAME_SLOT = key -> 0L;
	private static final KeyHasher<Integer> IDENTITY = Integer::longValue;

	@Test
	void tombstoneDoesNotBreakProbeChain() {
		var m = new ProbingMap<String, Integer>(16, 0.7, SAME_SLOT);

		m.put("first", 1);
		m.put("second", 2); // probes past slot 0
		assertEquals(ProbingMap.OCCUPIED, m.stateAt(1));

		m.remove("first");

		assertEquals(ProbingMap.DELETED, m.stateAt(0));
		assertEquals(1, m.deletedCount());
		assertTrue(m.containsKey("second"));
		assertEquals(2, m.at("second"));
		assertFalse(m.containsKey("first"));
	}

	@Test
	void reinsertingKeyBehindTombstoneKeepsItUnique() {
		var m = new ProbingMap<String, Integer>(16, 0.7, SAME_SLOT);
		m.put("a", 1);
		m.put("b", 2);
		m.remove("a");

		m.put("b", 20);

		assertEquals(1, m.size());
		assertEquals(20, m.at("b"));
		// the tombstone in front of "b" is left alone
		assertEquals(ProbingMap.DELETED, m.stateAt(0));
		assertEquals(1, m.deletedCount());

		m.remove("b");
		assertFalse(m.containsKey("b"));
		assertTrue(m.isEmpty());
	}

	@Test
	void newKeyReusesFirstTombstone() {
		var m = new ProbingMap<String, Integer>(16, 0.7, SAME_SLOT);
		m.put("a", 1);
		m.put("b", 2);
		m.remove("a");

		m.put("c", 3);

		assertEquals(ProbingMap.OCCUPIED, m.stateAt(0));
		assertEquals(0, m.deletedCount());
		assertEquals(3, m.at("c"));
		assertEquals(2, m.at("b"));
	}

	@Test
	void prospectiveLoadDoublesCapacity() {
		var m = new ProbingMap<Integer, Integer>(16);

		for (int i = 0; i < 11; i++) m.insert(i, i);
		assertEquals(16, m.capacity());

		// (11 + 1) / 16 = 0.75 > 0.7
		m.insert(11, 11);
		assertEquals(32, m.capacity());
		for (int i = 0; i < 12; i++) assertEquals(i, m.at(i));
	}

	@Test
	void tombstonesTriggerRehashAndAreDropped() {
		var m = new ProbingMap<Integer, Integer>(10, 0.7, IDENTITY);
		for (int i = 0; i < 7; i++) m.put(i, i);
		for (int i = 0; i < 6; i++) m.remove(i);
		assertEquals(1, m.size());
		assertEquals(6, m.deletedCount());

		m.put(7, 7); // lands in the empty slot 7: size 2, tombstones 6
		assertEquals(10, m.capacity());

		// (2 + 6) / 10 > 0.7 even though the live load is tiny
		m.put(8, 8);

		assertEquals(20, m.capacity());
		assertEquals(0, m.deletedCount());
		assertEquals(3, m.size());
		for (int i = 0; i < 6; i++) assertFalse(m.containsKey(i));
		for (int i = 6; i <= 8; i++) assertEquals(i, m.at(i));
	}

	@Test
	void lookupWrapsAroundTableEnd() {
		KeyHasher<Object> lastSlot = key -> 7L;
		var m = new ProbingMap<String, Integer>(8, 0.7, lastSlot);

		m.put("a", 1);
		m.put("b", 2);

		assertEquals(ProbingMap.OCCUPIED, m.stateAt(7));
		assertEquals(ProbingMap.OCCUPIED, m.stateAt(0));
		assertEquals(2, m.at("b"));
	}

	@Test
	void absentKeyInTableWithoutEmptySlotsReportsAbsence() {
		var m = new ProbingMap<Integer, Integer>(4, 0.9, IDENTITY);
		for (int i = 0; i < 3; i++) m.put(i, i);
		m.remove(0);
		m.remove(1);
		m.put(3, 3); // (1 + 2) / 4 stays under 0.9; every slot is now non-empty

		assertEquals(4, m.capacity());
		assertFalse(m.containsKey(100));
		assertNull(m.get(100));
	}

	@Test
	void clearEmptiesEveryState() {
		var m = new ProbingMap<String, Integer>(8, 0.7, SAME_SLOT);
		m.put("a", 1);
		m.put("b", 2);
		m.remove("a");

		m.clear();

		assertEquals(0, m.deletedCount());
		for (int i = 0; i < m.capacity(); i++) assertEquals(ProbingMap.EMPTY, m.stateAt(i));
	}
}
