package works.schematic.validation;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.jetbrains.annotations.Nullable;
import works.schematic.schema.TypeTag;

import static java.util.Objects.requireNonNull;

/**
 * The {@link TypeCheckGenerator} for each {@link TypeTag}, used by a {@link ValidationCompiler}.
 * The last registration for a tag wins.
 */
public final class TypeCheckRegistry {
	private final Map<TypeTag, TypeCheckGenerator> generators = new ConcurrentHashMap<>();

	public static TypeCheckRegistry withDefaults() {
		TypeCheckRegistry result = new TypeCheckRegistry();
		DefaultTypeChecks.registerAll(result);
		return result;
	}

	public TypeCheckRegistry register(TypeTag tag, TypeCheckGenerator generator) {
		generators.put(requireNonNull(tag), requireNonNull(generator));
		return this;
	}

	public @Nullable TypeCheckGenerator generatorFor(TypeTag tag) {
		return generators.get(tag);
	}
}
