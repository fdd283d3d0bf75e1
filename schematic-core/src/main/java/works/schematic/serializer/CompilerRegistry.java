package works.schematic.serializer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.schematic.schema.TypeTag;

import static java.util.Objects.requireNonNull;

/**
 * The generators one {@link Serializer} uses in one {@link Direction}, keyed by {@link TypeTag}.
 * <p>
 * Each tag has at most one primary generator; the last registration wins.
 * Prepended {@link PrecheckGenerator}s accumulate in registration order.
 * Binary tags with no primary generator of their own use the binary generator.
 * Anything not found here is looked up in the parent registry, if any.
 * <p>
 * Changes affect only pipelines compiled afterward.
 */
public final class CompilerRegistry {
	private final Direction direction;
	private final @Nullable CompilerRegistry parent;
	private final Map<TypeTag, ConverterGenerator> generators = new ConcurrentHashMap<>();
	private final Map<TypeTag, List<PrecheckGenerator>> prechecks = new ConcurrentHashMap<>();
	private volatile ConverterGenerator binaryGenerator;

	CompilerRegistry(Direction direction, @Nullable CompilerRegistry parent) {
		assert parent == null || parent.direction == direction;
		this.direction = direction;
		this.parent = parent;
	}

	public Direction direction() {
		return direction;
	}

	public CompilerRegistry register(TypeTag tag, ConverterGenerator generator) {
		ConverterGenerator old = generators.put(requireNonNull(tag), requireNonNull(generator));
		if (old != null) {
			LOGGER.debug("Replaced {} generator for {}", direction, tag);
		}
		return this;
	}

	public CompilerRegistry prepend(TypeTag tag, PrecheckGenerator generator) {
		requireNonNull(generator);
		prechecks.compute(requireNonNull(tag), (t, existing) -> {
			List<PrecheckGenerator> result = (existing == null) ? new ArrayList<>() : new ArrayList<>(existing);
			result.add(generator);
			return List.copyOf(result);
		});
		return this;
	}

	public CompilerRegistry registerForBinary(ConverterGenerator generator) {
		this.binaryGenerator = requireNonNull(generator);
		return this;
	}

	/**
	 * @return null if neither this registry nor its ancestors have a generator for {@code tag}
	 */
	public @Nullable ConverterGenerator generatorFor(TypeTag tag) {
		ConverterGenerator result = generators.get(tag);
		if (result == null && tag.isBinary()) {
			result = binaryGenerator;
		}
		if (result == null && parent != null) {
			result = parent.generatorFor(tag);
		}
		return result;
	}

	/**
	 * @return the ancestors' prechecks followed by this registry's own
	 */
	public List<PrecheckGenerator> prechecksFor(TypeTag tag) {
		List<PrecheckGenerator> own = prechecks.getOrDefault(tag, List.of());
		if (parent == null) {
			return own;
		}
		List<PrecheckGenerator> inherited = parent.prechecksFor(tag);
		if (inherited.isEmpty()) {
			return own;
		} else if (own.isEmpty()) {
			return inherited;
		}
		List<PrecheckGenerator> result = new ArrayList<>(inherited);
		result.addAll(own);
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CompilerRegistry.class);
}
