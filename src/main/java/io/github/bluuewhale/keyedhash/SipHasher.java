package io.github.bluuewhale.keyedhash;

import java.util.Objects;

/**
 * {@link KeyHasher} computing SipHash-1-3 over a key's {@link ByteView}.
 */
public final class SipHasher<K> implements KeyHasher<K> {

	private static final SipHasher<Object> STANDARD =
		new SipHasher<>(ByteView.canonical(), SipHash13.DEFAULT_SEED0, SipHash13.DEFAULT_SEED1);

	private final ByteView<? super K> view;
	private final long seed0;
	private final long seed1;

	private SipHasher(ByteView<? super K> view, long seed0, long seed1) {
		this.view = Objects.requireNonNull(view, "view");
		this.seed0 = seed0;
		this.seed1 = seed1;
	}

	/** Canonical byte view, default seeds. */
	public static SipHasher<Object> standard() {
		return STANDARD;
	}

	public static <K> SipHasher<K> of(ByteView<? super K> view) {
		return new SipHasher<>(view, SipHash13.DEFAULT_SEED0, SipHash13.DEFAULT_SEED1);
	}

	public static <K> SipHasher<K> of(ByteView<? super K> view, long seed0, long seed1) {
		return new SipHasher<>(view, seed0, seed1);
	}

	public static <K> SeedableHasher<K> seedable(ByteView<? super K> view) {
		return new Family<>(view);
	}

	/* Named class: heap walkers such as JOL cannot read fields of hidden lambda classes. */
	private static final class Family<K> implements SeedableHasher<K> {
		private final ByteView<? super K> view;

		Family(ByteView<? super K> view) {
			this.view = Objects.requireNonNull(view, "view");
		}

		@Override
		public KeyHasher<K> withSeeds(long seed0, long seed1) {
			return new SipHasher<>(view, seed0, seed1);
		}
	}

	@Override
	public long hash(K key) {
		return SipHash13.hash(seed0, seed1, view.bytesOf(key));
	}

	public long seed0() {
		return seed0;
	}

	public long seed1() {
		return seed1;
	}

	@Override
	public String toString() {
		return String.format("SipHasher[seed0=%016x, seed1=%016x]", seed0, seed1);
	}
}
