package works.schematic.serializer;

import java.util.EnumMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;
import static works.schematic.serializer.Direction.DECODE;
import static works.schematic.serializer.Direction.ENCODE;

/**
 * A named collection of per-{@link works.schematic.schema.TypeTag type tag} generators,
 * one {@link CompilerRegistry} and one {@link GuardRegistry} per {@link Direction}.
 * <p>
 * A serializer may {@link #fork fork} a parent, inheriting everything
 * it doesn't register for itself.
 * Serializers compare by identity, so compiled pipelines are never shared between them.
 */
public class Serializer {
	private final String name;
	private final @Nullable Serializer parent;
	private final Map<Direction, CompilerRegistry> compilers = new EnumMap<>(Direction.class);
	private final Map<Direction, GuardRegistry> guards = new EnumMap<>(Direction.class);

	public Serializer(String name) {
		this(name, null);
	}

	public Serializer(String name, @Nullable Serializer parent) {
		this.name = requireNonNull(name);
		this.parent = parent;
		for (Direction d : Direction.values()) {
			compilers.put(d, new CompilerRegistry(d, (parent == null) ? null : parent.compilers(d)));
			guards.put(d, new GuardRegistry((parent == null) ? null : parent.guards(d)));
		}
	}

	public String name() {
		return name;
	}

	public @Nullable Serializer parent() {
		return parent;
	}

	public Serializer fork(String name) {
		return new Serializer(name, this);
	}

	public CompilerRegistry compilers(Direction direction) {
		return compilers.get(direction);
	}

	public GuardRegistry guards(Direction direction) {
		return guards.get(direction);
	}

	public CompilerRegistry decoders() {
		return compilers(DECODE);
	}

	public CompilerRegistry encoders() {
		return compilers(ENCODE);
	}

	@Override
	public String toString() {
		return (parent == null) ? name : name + "<" + parent.name;
	}
}
