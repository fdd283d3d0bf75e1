package works.schematic.schema;

import java.util.List;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import works.schematic.compiler.Numbers;

/**
 * The external values and labels of one enum class.
 */
public final class EnumValues {
	private final Class<? extends Enum<?>> enumType;
	private final List<Enum<?>> constants;
	private final List<Object> values;
	private final List<String> labels;

	private EnumValues(Class<? extends Enum<?>> enumType) {
		this.enumType = enumType;
		this.constants = List.of(enumType.getEnumConstants());
		this.values = constants.stream().map(EnumValues::externalValueOf).toList();
		this.labels = constants.stream().map(Enum::name).toList();
	}

	public static EnumValues of(Class<? extends Enum<?>> enumType) {
		return MEMO.get(enumType);
	}

	public Class<? extends Enum<?>> enumType() {
		return enumType;
	}

	public List<Object> values() {
		return values;
	}

	public List<String> labels() {
		return labels;
	}

	/**
	 * @return the values, followed by the labels if {@code allowLabels}
	 */
	public List<Object> validInputs(boolean allowLabels) {
		if (allowLabels) {
			return Stream.concat(values.stream(), labels.stream()).distinct().toList();
		} else {
			return values;
		}
	}

	public boolean isValid(Object input, boolean allowLabels) {
		return resolve(input, allowLabels) != null;
	}

	/**
	 * @return the constant whose external value matches {@code input},
	 * or whose label does if {@code allowLabels};
	 * null if there's no such constant
	 */
	public @Nullable Enum<?> resolve(Object input, boolean allowLabels) {
		if (enumType.isInstance(input)) {
			return (Enum<?>) input;
		}
		for (int i = 0; i < constants.size(); i++) {
			if (sameValue(values.get(i), input)) {
				return constants.get(i);
			}
		}
		if (allowLabels && input instanceof String s) {
			int index = labels.indexOf(s);
			if (index >= 0) {
				return constants.get(index);
			}
		}
		return null;
	}

	public static Object externalValueOf(Enum<?> constant) {
		if (constant instanceof ValuedEnum v) {
			return v.value();
		} else {
			return constant.name();
		}
	}

	private static boolean sameValue(Object value, Object input) {
		if (value instanceof Number a && input instanceof Number b) {
			return Numbers.sameNumber(a, b);
		}
		return value.equals(input);
	}

	@SuppressWarnings("unchecked")
	private static final ClassValue<EnumValues> MEMO = new ClassValue<>() {
		@Override
		protected EnumValues computeValue(Class<?> type) {
			return new EnumValues((Class<? extends Enum<?>>) type);
		}
	};
}
