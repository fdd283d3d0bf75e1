package works.schematic.schema;

import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * A lazily resolved pointer from a field to the {@link ClassSchema} it references.
 * <p>
 * Resolution is deferred until first use,
 * which lets a schema refer to itself, directly or through other schemas,
 * before it has finished being built.
 */
public final class SchemaReference implements Supplier<ClassSchema> {
	private final Supplier<ClassSchema> resolver;
	private volatile ClassSchema resolved;

	private SchemaReference(Supplier<ClassSchema> resolver) {
		this.resolver = requireNonNull(resolver);
	}

	public static SchemaReference lazy(Supplier<ClassSchema> resolver) {
		return new SchemaReference(resolver);
	}

	public static SchemaReference to(ClassSchema schema) {
		SchemaReference result = new SchemaReference(() -> schema);
		result.resolved = requireNonNull(schema);
		return result;
	}

	@Override
	public ClassSchema get() {
		ClassSchema result = resolved;
		if (result == null) {
			result = requireNonNull(resolver.get(), "Schema reference resolved to null");
			resolved = result;
		}
		return result;
	}

	public boolean isResolved() {
		return resolved != null;
	}

	@Override
	public String toString() {
		ClassSchema r = resolved;
		return "->" + ((r == null) ? "<unresolved>" : r.name());
	}
}
