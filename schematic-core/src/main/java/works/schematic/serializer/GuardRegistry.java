package works.schematic.serializer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.jetbrains.annotations.Nullable;
import works.schematic.schema.TypeTag;

import static java.util.Objects.requireNonNull;

/**
 * The union {@link Guard}s one {@link Serializer} uses in one {@link Direction}.
 * <p>
 * Each registration carries a <em>specificality</em>: candidates are tried in order of
 * ascending specificality, so a guard that accepts few values should have a low number.
 * Loose guards are only consulted once every strict guard has failed,
 * and only when the caller allows loose conversion.
 * <p>
 * A registry with its own guards for a tag hides its parent's guards for that tag.
 */
public final class GuardRegistry {
	private final @Nullable GuardRegistry parent;
	private final Map<TypeTag, List<Entry>> entries = new ConcurrentHashMap<>();

	public record Entry(TypeTag tag, double specificality, boolean loose, GuardGenerator generator) {
		public Entry {
			requireNonNull(tag);
			requireNonNull(generator);
		}
	}

	GuardRegistry(@Nullable GuardRegistry parent) {
		this.parent = parent;
	}

	public GuardRegistry register(double specificality, TypeTag tag, GuardGenerator generator) {
		add(new Entry(tag, specificality, false, generator));
		return this;
	}

	public GuardRegistry registerLoose(double specificality, TypeTag tag, GuardGenerator generator) {
		add(new Entry(tag, specificality, true, generator));
		return this;
	}

	public List<Entry> entriesFor(TypeTag tag) {
		List<Entry> own = entries.get(tag);
		if (own != null) {
			return own;
		} else if (parent != null) {
			return parent.entriesFor(tag);
		} else {
			return List.of();
		}
	}

	public @Nullable GuardRegistry parent() {
		return parent;
	}

	private void add(Entry entry) {
		entries.compute(entry.tag(), (t, existing) -> {
			List<Entry> result = (existing == null) ? new ArrayList<>() : new ArrayList<>(existing);
			result.add(entry);
			return List.copyOf(result);
		});
	}
}
