package io.github.bluuewhale.keyedhash;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Canonical byte encodings for common key types.
 */
public final class ByteViews {
	private ByteViews() {}

	private static final byte[] EMPTY = new byte[0];

	/**
	 * Canonical bytes of {@code key}, chosen by runtime type:
	 * <ul>
	 * <li>boxed primitives: their raw little-endian representation ({@code Float} and
	 * {@code Double} through {@code floatToIntBits}/{@code doubleToLongBits}, which is how
	 * their {@code equals} compares);</li>
	 * <li>{@code String}: UTF-8 content;</li>
	 * <li>{@code byte[]} and {@code ByteBuffer}: the content;</li>
	 * <li>primitive arrays: the concatenated element representations;</li>
	 * <li>{@code List}: the concatenated canonical bytes of its elements;</li>
	 * <li>anything else: the little-endian bytes of {@code hashCode()}.</li>
	 * </ul>
	 */
	public static byte[] canonical(Object key) {
		if (key instanceof String s) return utf8(s);
		if (key instanceof Integer i) return int32(i);
		if (key instanceof Long l) return int64(l);
		if (key instanceof Short s) return int16(s);
		if (key instanceof Character c) return int16(c);
		if (key instanceof Byte b) return new byte[] { b };
		if (key instanceof Boolean b) return new byte[] { (byte) (b ? 1 : 0) };
		if (key instanceof Double d) return int64(Double.doubleToLongBits(d));
		if (key instanceof Float f) return int32(Float.floatToIntBits(f));
		if (key instanceof byte[] a) return a.length == 0 ? EMPTY : a.clone();
		if (key instanceof ByteBuffer buf) return bytes(buf);
		if (key instanceof int[] a) return ints(a);
		if (key instanceof long[] a) return longs(a);
		if (key instanceof short[] a) return shorts(a);
		if (key instanceof char[] a) return chars(a);
		if (key instanceof double[] a) return doubles(a);
		if (key instanceof float[] a) return floats(a);
		if (key instanceof List<?> list) return concat(list);
		return int32(key.hashCode());
	}

	public static byte[] utf8(String s) {
		return s.isEmpty() ? EMPTY : s.getBytes(StandardCharsets.UTF_8);
	}

	public static byte[] int16(int v) {
		return new byte[] { (byte) v, (byte) (v >>> 8) };
	}

	public static byte[] int32(int v) {
		byte[] out = new byte[Integer.BYTES];
		putInt(out, 0, v);
		return out;
	}

	public static byte[] int64(long v) {
		byte[] out = new byte[Long.BYTES];
		putLong(out, 0, v);
		return out;
	}

	public static byte[] ints(int[] a) {
		byte[] out = new byte[a.length * Integer.BYTES];
		for (int i = 0; i < a.length; i++) putInt(out, i * Integer.BYTES, a[i]);
		return out;
	}

	public static byte[] longs(long[] a) {
		byte[] out = new byte[a.length * Long.BYTES];
		for (int i = 0; i < a.length; i++) putLong(out, i * Long.BYTES, a[i]);
		return out;
	}

	public static byte[] shorts(short[] a) {
		byte[] out = new byte[a.length * Short.BYTES];
		for (int i = 0; i < a.length; i++) putShort(out, i * Short.BYTES, a[i]);
		return out;
	}

	public static byte[] chars(char[] a) {
		byte[] out = new byte[a.length * Character.BYTES];
		for (int i = 0; i < a.length; i++) putShort(out, i * Character.BYTES, a[i]);
		return out;
	}

	public static byte[] doubles(double[] a) {
		byte[] out = new byte[a.length * Long.BYTES];
		for (int i = 0; i < a.length; i++) putLong(out, i * Long.BYTES, Double.doubleToLongBits(a[i]));
		return out;
	}

	public static byte[] floats(float[] a) {
		byte[] out = new byte[a.length * Integer.BYTES];
		for (int i = 0; i < a.length; i++) putInt(out, i * Integer.BYTES, Float.floatToIntBits(a[i]));
		return out;
	}

	/** Remaining bytes of {@code buf}; its position is left untouched. */
	public static byte[] bytes(ByteBuffer buf) {
		byte[] out = new byte[buf.remaining()];
		buf.duplicate().get(out);
		return out;
	}

	private static byte[] concat(List<?> list) {
		if (list.isEmpty()) return EMPTY;
		byte[][] parts = new byte[list.size()][];
		int total = 0;
		int i = 0;
		for (Object e : list) {
			if (e == null) throw new NullPointerException("Null list elements not supported");
			parts[i] = canonical(e);
			total += parts[i].length;
			i++;
		}
		byte[] out = new byte[total];
		int pos = 0;
		for (byte[] p : parts) {
			System.arraycopy(p, 0, out, pos, p.length);
			pos += p.length;
		}
		return out;
	}

	/* Little-endian writers */
	private static void putShort(byte[] b, int off, int v) {
		b[off] = (byte) v;
		b[off + 1] = (byte) (v >>> 8);
	}

	private static void putInt(byte[] b, int off, int v) {
		b[off] = (byte) v;
		b[off + 1] = (byte) (v >>> 8);
		b[off + 2] = (byte) (v >>> 16);
		b[off + 3] = (byte) (v >>> 24);
	}

	private static void putLong(byte[] b, int off, long v) {
		for (int i = 0; i < Long.BYTES; i++) {
			b[off + i] = (byte) (v >>> (i << 3));
		}
	}
}
