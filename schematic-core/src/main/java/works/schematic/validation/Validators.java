package works.schematic.validation;

import java.util.Collection;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Built-in {@link PropertyValidator} rules.
 * <p>
 * Length rules apply to strings, collections and maps;
 * range rules apply to numbers. Values of other kinds pass.
 */
public final class Validators {
	private Validators() { }

	public static PropertyValidator minLength(int min) {
		return (value, field) -> {
			int length = lengthOf(value);
			if (length >= 0 && length < min) {
				return new PropertyValidatorError("minLength", "Min length is " + min);
			}
			return null;
		};
	}

	public static PropertyValidator maxLength(int max) {
		return (value, field) -> {
			int length = lengthOf(value);
			if (length > max) {
				return new PropertyValidatorError("maxLength", "Max length is " + max);
			}
			return null;
		};
	}

	public static PropertyValidator pattern(String regex) {
		Pattern compiled = Pattern.compile(regex);
		return (value, field) -> {
			if (value instanceof CharSequence s && !compiled.matcher(s).matches()) {
				return new PropertyValidatorError("pattern", "Pattern " + regex + " does not match");
			}
			return null;
		};
	}

	public static PropertyValidator minimum(double min) {
		return (value, field) -> {
			if (value instanceof Number n && n.doubleValue() < min) {
				return new PropertyValidatorError("minimum", "Number needs to be greater than or equal to " + format(min));
			}
			return null;
		};
	}

	public static PropertyValidator maximum(double max) {
		return (value, field) -> {
			if (value instanceof Number n && n.doubleValue() > max) {
				return new PropertyValidatorError("maximum", "Number needs to be smaller than or equal to " + format(max));
			}
			return null;
		};
	}

	/**
	 * @return -1 if the value has no length
	 */
	private static int lengthOf(Object value) {
		if (value instanceof CharSequence s) {
			return s.length();
		} else if (value instanceof Collection<?> c) {
			return c.size();
		} else if (value instanceof Map<?, ?> m) {
			return m.size();
		} else {
			return -1;
		}
	}

	private static String format(double d) {
		if (d == Math.rint(d) && !Double.isInfinite(d)) {
			return Long.toString((long) d);
		}
		return Double.toString(d);
	}
}
