package works.schematic.serializer;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Base64;
import java.util.regex.Pattern;
import works.schematic.schema.TypeTag;

/**
 * Base64 text for binary values, with multi-byte elements in little-endian order.
 */
public final class BinaryCodec {
	private BinaryCodec() { }

	public static boolean isBinary(Object value) {
		return value instanceof byte[]
			|| value instanceof short[]
			|| value instanceof int[]
			|| value instanceof float[]
			|| value instanceof double[]
			|| value instanceof ByteBuffer;
	}

	public static boolean isBase64(String text) {
		return text.length() % 4 == 0 && BASE64.matcher(text).matches();
	}

	public static String encode(Object value) {
		return Base64.getEncoder().encodeToString(toBytes(value));
	}

	/**
	 * @throws IllegalArgumentException if {@code text} isn't Base64,
	 * or its length doesn't fit the element size of {@code tag}
	 */
	public static Object decode(String text, TypeTag tag) {
		return fromBytes(Base64.getDecoder().decode(text), tag);
	}

	public static byte[] toBytes(Object value) {
		if (value instanceof byte[] bytes) {
			return bytes;
		} else if (value instanceof ByteBuffer buffer) {
			ByteBuffer view = buffer.duplicate();
			byte[] result = new byte[view.remaining()];
			view.get(result);
			return result;
		} else if (value instanceof short[] shorts) {
			ByteBuffer buffer = allocate(shorts.length * Short.BYTES);
			buffer.asShortBuffer().put(shorts);
			return buffer.array();
		} else if (value instanceof int[] ints) {
			ByteBuffer buffer = allocate(ints.length * Integer.BYTES);
			buffer.asIntBuffer().put(ints);
			return buffer.array();
		} else if (value instanceof float[] floats) {
			ByteBuffer buffer = allocate(floats.length * Float.BYTES);
			buffer.asFloatBuffer().put(floats);
			return buffer.array();
		} else if (value instanceof double[] doubles) {
			ByteBuffer buffer = allocate(doubles.length * Double.BYTES);
			buffer.asDoubleBuffer().put(doubles);
			return buffer.array();
		} else {
			throw new IllegalArgumentException("Not a binary value: " + value.getClass().getSimpleName());
		}
	}

	public static Object fromBytes(byte[] bytes, TypeTag tag) {
		ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
		if (TypeTag.ARRAY_BUFFER.equals(tag)) {
			return buffer;
		} else if (TypeTag.UINT8_ARRAY.equals(tag) || TypeTag.INT8_ARRAY.equals(tag)) {
			return bytes;
		} else if (TypeTag.INT16_ARRAY.equals(tag)) {
			short[] result = new short[elementCount(bytes, Short.BYTES)];
			buffer.asShortBuffer().get(result);
			return result;
		} else if (TypeTag.INT32_ARRAY.equals(tag)) {
			int[] result = new int[elementCount(bytes, Integer.BYTES)];
			buffer.asIntBuffer().get(result);
			return result;
		} else if (TypeTag.FLOAT32_ARRAY.equals(tag)) {
			float[] result = new float[elementCount(bytes, Float.BYTES)];
			buffer.asFloatBuffer().get(result);
			return result;
		} else if (TypeTag.FLOAT64_ARRAY.equals(tag)) {
			double[] result = new double[elementCount(bytes, Double.BYTES)];
			buffer.asDoubleBuffer().get(result);
			return result;
		} else {
			throw new IllegalArgumentException("Not a binary type: " + tag);
		}
	}

	private static ByteBuffer allocate(int size) {
		return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
	}

	private static int elementCount(byte[] bytes, int elementSize) {
		if (bytes.length % elementSize != 0) {
			throw new IllegalArgumentException(bytes.length + " bytes is not a whole number of " + elementSize + "-byte elements");
		}
		return bytes.length / elementSize;
	}

	private static final Pattern BASE64 = Pattern.compile("[A-Za-z0-9+/]*={0,2}");
}
