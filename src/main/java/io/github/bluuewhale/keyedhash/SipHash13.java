package io.github.bluuewhale.keyedhash;

import java.util.Objects;

/**
 * SipHash-1-3: one compression round per 8-byte word, three finalization rounds.
 * <p>
 * A keyed 64-bit PRF by Jean-Philippe Aumasson and Daniel J. Bernstein. Keying resists
 * hash-flooding by callers who do not know the seeds; it is not meant as a MAC.
 */
public final class SipHash13 {
	private SipHash13() {}

	public static final long DEFAULT_SEED0 = 0x0706050403020100L;
	public static final long DEFAULT_SEED1 = 0x0f0e0d0c0b0a0908L;

	private static final int COMPRESSION_ROUNDS = 1;
	private static final int FINALIZATION_ROUNDS = 3;

	public static long hash(long seed0, long seed1, byte[] data) {
		return hash(seed0, seed1, data, 0, data.length);
	}

	public static long hash(long seed0, long seed1, byte[] data, int offset, int length) {
		Objects.checkFromIndexSize(offset, length, data.length);
		State s = new State(seed0, seed1);

		int end = offset + (length & ~7);
		for (int p = offset; p < end; p += 8) {
			s.compress(readLongLE(data, p));
		}

		// trailing 0-7 bytes, length mod 256 in the top byte
		long b = ((long) length) << 56;
		for (int i = 0, tail = length & 7; i < tail; i++) {
			b |= (data[end + i] & 0xFFL) << (i << 3);
		}
		s.compress(b);

		return s.finish();
	}

	private static long readLongLE(byte[] b, int off) {
		return (b[off] & 0xFFL)
			| (b[off + 1] & 0xFFL) << 8
			| (b[off + 2] & 0xFFL) << 16
			| (b[off + 3] & 0xFFL) << 24
			| (b[off + 4] & 0xFFL) << 32
			| (b[off + 5] & 0xFFL) << 40
			| (b[off + 6] & 0xFFL) << 48
			| (b[off + 7] & 0xFFL) << 56;
	}

	private static final class State {
		/* "somepseudorandomlygeneratedbytes" */
		private long v0 = 0x736f6d6570736575L;
		private long v1 = 0x646f72616e646f6dL;
		private long v2 = 0x6c7967656e657261L;
		private long v3 = 0x7465646279746573L;

		State(long k0, long k1) {
			v0 ^= k0;
			v1 ^= k1;
			v2 ^= k0;
			v3 ^= k1;
		}

		void compress(long m) {
			v3 ^= m;
			sipRound(COMPRESSION_ROUNDS);
			v0 ^= m;
		}

		long finish() {
			v2 ^= 0xffL;
			sipRound(FINALIZATION_ROUNDS);
			return v0 ^ v1 ^ v2 ^ v3;
		}

		private void sipRound(int rounds) {
			for (int i = 0; i < rounds; i++) {
				v0 += v1;
				v2 += v3;
				v1 = Long.rotateLeft(v1, 13);
				v3 = Long.rotateLeft(v3, 16);
				v1 ^= v0;
				v3 ^= v2;
				v0 = Long.rotateLeft(v0, 32);
				v2 += v1;
				v0 += v3;
				v1 = Long.rotateLeft(v1, 17);
				v3 = Long.rotateLeft(v3, 21);
				v1 ^= v2;
				v3 ^= v0;
				v2 = Long.rotateLeft(v2, 32);
			}
		}
	}
}
