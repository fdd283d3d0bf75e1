package works.schematic.schema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.schematic.exceptions.SchemaDefinitionException;

import static java.util.Objects.requireNonNull;

/**
 * Immutable description of an entity: its ordered fields plus entity-level metadata.
 * <p>
 * Schemas compare by identity. Two separately built schemas for the same class
 * are distinct as far as pipeline caches are concerned.
 */
public final class ClassSchema {
	private final String name;
	private final Class<?> entityClass;
	private final List<FieldSchema> fields;
	private final FieldSchema primaryField;
	private final FieldSchema autoIncrementField;

	private ClassSchema(String name, Class<?> entityClass, List<FieldSchema> fields) {
		this.name = name;
		this.entityClass = entityClass;
		this.fields = List.copyOf(fields);

		Set<String> names = new HashSet<>();
		FieldSchema primary = null;
		FieldSchema autoIncrement = null;
		for (FieldSchema f : this.fields) {
			if (!names.add(f.name())) {
				throw SchemaDefinitionException.forField(name, f.name(), "duplicate field name");
			}
			if (f.isPrimary()) {
				if (primary != null) {
					throw SchemaDefinitionException.forField(name, f.name(), "already has primary field " + primary.name());
				}
				primary = f;
			}
			if (f.isAutoIncrement()) {
				if (autoIncrement != null) {
					throw SchemaDefinitionException.forField(name, f.name(), "already has auto-increment field " + autoIncrement.name());
				}
				autoIncrement = f;
			}
		}
		this.primaryField = primary;
		this.autoIncrementField = autoIncrement;
	}

	public static Builder builder(String name, Class<?> entityClass) {
		return new Builder(name, entityClass);
	}

	public String name() {
		return name;
	}

	public Class<?> entityClass() {
		return entityClass;
	}

	public List<FieldSchema> fields() {
		return fields;
	}

	public Optional<FieldSchema> field(String fieldName) {
		return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
	}

	/**
	 * @throws IllegalArgumentException if there's no such field
	 */
	public FieldSchema getField(String fieldName) {
		return field(fieldName).orElseThrow(() ->
			new IllegalArgumentException("Schema " + name + " has no field " + fieldName));
	}

	public Optional<FieldSchema> primaryField() {
		return Optional.ofNullable(primaryField);
	}

	/**
	 * @throws IllegalStateException if there's no primary field
	 */
	public FieldSchema requirePrimaryField() {
		if (primaryField == null) {
			throw new IllegalStateException("Schema " + name + " has no primary field");
		}
		return primaryField;
	}

	public Optional<FieldSchema> autoIncrementField() {
		return Optional.ofNullable(autoIncrementField);
	}

	/**
	 * The first literal-typed field, which union resolution uses to tell
	 * this schema apart from its siblings.
	 */
	public @Nullable FieldSchema discriminantField() {
		for (FieldSchema f : fields) {
			if (TypeTag.LITERAL.equals(f.type())) {
				return f;
			}
		}
		return null;
	}

	@Override
	public String toString() {
		return name + fields;
	}

	public static final class Builder {
		private final String name;
		private final Class<?> entityClass;
		private final List<FieldSchema> fields = new ArrayList<>();

		Builder(String name, Class<?> entityClass) {
			this.name = requireNonNull(name);
			this.entityClass = requireNonNull(entityClass);
		}

		public Builder field(FieldSchema field) {
			fields.add(requireNonNull(field));
			return this;
		}

		public Builder field(FieldSchema.Builder field) {
			return field(field.build());
		}

		public Builder fields(List<FieldSchema> fields) {
			fields.forEach(this::field);
			return this;
		}

		public ClassSchema build() {
			return new ClassSchema(name, entityClass, fields);
		}
	}
}
