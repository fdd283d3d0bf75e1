package works.schematic.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.schematic.ConverterOptions;
import works.schematic.schema.FieldSchema;

import static java.util.Objects.requireNonNull;

/**
 * Per-invocation state threaded through a running pipeline:
 * the caller's options, the path to the value being converted,
 * and the entities enclosing it.
 * <p>
 * Immutable; each nesting level gets its own instance.
 * The path is only assembled when something asks for it.
 */
public final class ConversionContext {
	private final ConverterOptions options;
	private final @Nullable ConversionContext parent;
	private final @Nullable String segment;
	private final List<Object> ancestors;
	private final @Nullable Object current;

	private ConversionContext(ConverterOptions options, @Nullable ConversionContext parent, @Nullable String segment, List<Object> ancestors, @Nullable Object current) {
		this.options = requireNonNull(options);
		this.parent = parent;
		this.segment = segment;
		this.ancestors = ancestors;
		this.current = current;
	}

	public static ConversionContext root(ConverterOptions options) {
		return new ConversionContext(options, null, null, List.copyOf(options.parents()), null);
	}

	public ConverterOptions options() {
		return options;
	}

	public boolean loosely() {
		return options.loosely();
	}

	/**
	 * @return a context for a value nested under this one at {@code segment}
	 */
	public ConversionContext child(String segment) {
		return new ConversionContext(options, this, requireNonNull(segment), ancestors, current);
	}

	public ConversionContext child(int index) {
		return child(Integer.toString(index));
	}

	/**
	 * @return a context for the fields of {@code entity}, which becomes the innermost
	 * enclosing entity for anything nested within it
	 */
	public ConversionContext enter(Object entity) {
		List<Object> newAncestors = ancestors;
		if (current != null) {
			newAncestors = new ArrayList<>(ancestors.size() + 1);
			newAncestors.addAll(ancestors);
			newAncestors.add(current);
		}
		return new ConversionContext(options, parent, segment, newAncestors, requireNonNull(entity));
	}

	/**
	 * @return the innermost enclosing entity of the given type,
	 * not counting the one whose fields are being converted; null if there's none
	 */
	public @Nullable Object nearestAncestor(Class<?> type) {
		for (int i = ancestors.size() - 1; i >= 0; i--) {
			Object candidate = ancestors.get(i);
			if (type.isInstance(candidate)) {
				return candidate;
			}
		}
		return null;
	}

	/**
	 * @return dotted path from the root value; empty at the root
	 */
	public String path() {
		if (parent == null) {
			return (segment == null) ? "" : segment;
		}
		String prefix = parent.path();
		return prefix.isEmpty() ? segment : prefix + "." + segment;
	}

	public boolean includes(FieldSchema field) {
		Set<String> groups = options.groups();
		if (!groups.isEmpty() && field.groups().stream().noneMatch(groups::contains)) {
			return false;
		}
		Set<String> excluded = options.groupsExclude();
		return excluded.isEmpty() || field.groups().stream().noneMatch(excluded::contains);
	}

	@Override
	public String toString() {
		return "ConversionContext(" + path() + ")";
	}
}
