package works.schematic.compiler;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Coercion between the numeric types an entity field may declare.
 */
public final class Numbers {
	private Numbers() { }

	public static boolean isNumeric(Class<?> type) {
		return BOXED.containsKey(type) || Number.class.isAssignableFrom(type);
	}

	/**
	 * Conversions to {@code double} and {@code float} round to the nearest value;
	 * all others must be exact.
	 *
	 * @return {@code n} as an instance of {@code type}, or of its boxed form if it's primitive
	 * @throws ArithmeticException if {@code n} has a fractional part or is out of range for an integral
	 * {@code type}, is out of range for {@code float}, or is not finite and {@code type} can't hold that
	 */
	public static Number coerce(Number n, Class<?> type) {
		Class<?> target = BOXED.getOrDefault(type, type);
		if (target.isInstance(n)) {
			return n;
		} else if (target == Double.class || target == Number.class) {
			return n.doubleValue();
		} else if (target == Float.class) {
			float result = n.floatValue();
			if (Float.isInfinite(result) && isFinite(n)) {
				throw new ArithmeticException(n + " is out of range for float");
			}
			return result;
		}
		if (!isFinite(n)) {
			throw new ArithmeticException(n + " has no " + target.getSimpleName() + " value");
		}
		BigDecimal exact = toBigDecimal(n);
		if (target == Integer.class) {
			return exact.intValueExact();
		} else if (target == Long.class) {
			return exact.longValueExact();
		} else if (target == Short.class) {
			return exact.shortValueExact();
		} else if (target == Byte.class) {
			return exact.byteValueExact();
		} else if (target == BigDecimal.class) {
			return exact;
		} else if (target == BigInteger.class) {
			return exact.toBigIntegerExact();
		} else {
			throw new IllegalArgumentException("Unsupported number type " + type.getName());
		}
	}

	/**
	 * @return false for NaN and the infinities
	 */
	public static boolean isFinite(Number n) {
		if (n instanceof Double d) {
			return Double.isFinite(d);
		} else if (n instanceof Float f) {
			return Float.isFinite(f);
		} else {
			return true;
		}
	}

	/**
	 * Compares by value regardless of type, so {@code 1} and {@code 1.0} are the same number.
	 * NaN is the same number as NaN.
	 */
	public static boolean sameNumber(Number a, Number b) {
		if (isFinite(a) && isFinite(b)) {
			return toBigDecimal(a).compareTo(toBigDecimal(b)) == 0;
		}
		return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
	}

	/**
	 * @return null if {@code text} isn't a number
	 */
	public static @Nullable BigDecimal parse(String text) {
		String trimmed = text.trim();
		if (trimmed.isEmpty()) {
			return null;
		}
		try {
			return new BigDecimal(trimmed);
		} catch (NumberFormatException e) {
			return null;
		}
	}

	private static BigDecimal toBigDecimal(Number n) {
		assert isFinite(n);
		if (n instanceof BigDecimal d) {
			return d;
		} else if (n instanceof BigInteger i) {
			return new BigDecimal(i);
		} else {
			return new BigDecimal(n.toString());
		}
	}

	private static final Map<Class<?>, Class<?>> BOXED = Map.of(
		int.class, Integer.class,
		long.class, Long.class,
		double.class, Double.class,
		float.class, Float.class,
		short.class, Short.class,
		byte.class, Byte.class
	);
}
