package works.schematic.schema;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import works.schematic.exceptions.SchemaDefinitionException;
import works.schematic.validation.PropertyValidator;

import static java.util.Objects.requireNonNull;

/**
 * Describes one attribute of a {@link ClassSchema}:
 * its {@link TypeTag}, modifiers, default, and any nested or union structure.
 * <p>
 * Immutable. Referenced schemas are held in a {@link SchemaReference}
 * so that a field may refer back to the schema that owns it.
 * <p>
 * {@link #optional()} and {@link #hasDefault()} are independent:
 * the former permits absent input, the latter supplies a value when input is absent.
 */
public final class FieldSchema {
	private final String name;
	private final String memberName;
	private final TypeTag type;
	private final Class<?> javaType;
	private final boolean optional;
	private final boolean nullable;
	private final boolean hasDefault;
	private final Supplier<?> defaultValue;
	private final boolean defaultFromInitializer;
	private final FieldSchema element;
	private final SchemaReference referencedSchema;
	private final List<FieldSchema> unionCandidates;
	private final boolean hasLiteral;
	private final Object literalValue;
	private final Class<? extends Enum<?>> enumType;
	private final boolean allowLabelsAsValue;
	private final boolean reference;
	private final boolean parentReference;
	private final boolean primary;
	private final boolean autoIncrement;
	private final Set<String> groups;
	private final List<PropertyValidator> validators;

	private FieldSchema(Builder b) {
		this.name = b.name;
		this.memberName = b.memberName;
		this.type = b.type;
		this.javaType = b.javaType;
		this.optional = b.optional;
		this.nullable = b.nullable;
		this.hasDefault = b.hasDefault;
		this.defaultValue = b.defaultValue;
		this.defaultFromInitializer = b.defaultFromInitializer;
		this.element = b.element;
		this.referencedSchema = b.referencedSchema;
		this.unionCandidates = List.copyOf(b.unionCandidates);
		this.hasLiteral = b.hasLiteral;
		this.literalValue = b.literalValue;
		this.enumType = b.enumType;
		this.allowLabelsAsValue = b.allowLabelsAsValue;
		this.reference = b.reference;
		this.parentReference = b.parentReference;
		this.primary = b.primary;
		this.autoIncrement = b.autoIncrement;
		this.groups = Set.copyOf(b.groups);
		this.validators = List.copyOf(b.validators);
	}

	public static Builder builder(String name, TypeTag type) {
		return new Builder(name, type);
	}

	public static FieldSchema of(String name, TypeTag type) {
		return builder(name, type).build();
	}

	public static FieldSchema literal(String name, Object value) {
		return builder(name, TypeTag.LITERAL).literal(value).build();
	}

	public static FieldSchema classRef(String name, Supplier<ClassSchema> schema) {
		return builder(name, TypeTag.CLASS).schema(schema).build();
	}

	public static FieldSchema arrayOf(String name, FieldSchema element) {
		return builder(name, TypeTag.ARRAY).element(element).build();
	}

	public static FieldSchema mapOf(String name, FieldSchema element) {
		return builder(name, TypeTag.MAP).element(element).build();
	}

	public static FieldSchema union(String name, FieldSchema... candidates) {
		return builder(name, TypeTag.UNION).candidates(List.of(candidates)).build();
	}

	public Builder toBuilder() {
		return new Builder(this);
	}

	public String name() {
		return name;
	}

	/**
	 * @return the name of the entity member holding this field's value,
	 * which differs from {@link #name()} when the external name is overridden
	 */
	public String memberName() {
		return memberName;
	}

	public TypeTag type() {
		return type;
	}

	/**
	 * @return the Java class of values of this field as held by entities
	 */
	public Class<?> javaType() {
		return javaType;
	}

	public boolean optional() {
		return optional;
	}

	public boolean nullable() {
		return nullable;
	}

	public boolean hasDefault() {
		return hasDefault;
	}

	/**
	 * @return a default value, freshly supplied for mutable defaults
	 * @throws IllegalStateException if there's no default
	 */
	public Object defaultValue() {
		if (!hasDefault) {
			throw new IllegalStateException("Field " + name + " has no default value");
		}
		return defaultValue.get();
	}

	/**
	 * @return true if the default comes from the entity's field initializer,
	 * meaning a freshly constructed entity already holds it
	 */
	public boolean defaultFromInitializer() {
		return defaultFromInitializer;
	}

	public boolean isArray() {
		return TypeTag.ARRAY.equals(type);
	}

	public boolean isMap() {
		return TypeTag.MAP.equals(type);
	}

	public boolean isUnion() {
		return !unionCandidates.isEmpty();
	}

	/**
	 * @return the field describing each item of an array or map field
	 */
	public FieldSchema element() {
		if (element == null) {
			throw new IllegalStateException("Field " + name + " has no element type");
		}
		return element;
	}

	public boolean hasReferencedSchema() {
		return referencedSchema != null;
	}

	public ClassSchema referencedSchema() {
		if (referencedSchema == null) {
			throw new IllegalStateException("Field " + name + " does not reference a schema");
		}
		return referencedSchema.get();
	}

	public List<FieldSchema> unionCandidates() {
		return unionCandidates;
	}

	public boolean hasLiteral() {
		return hasLiteral;
	}

	public @Nullable Object literalValue() {
		return literalValue;
	}

	public Class<? extends Enum<?>> enumType() {
		if (enumType == null) {
			throw new IllegalStateException("Field " + name + " is not an enum");
		}
		return enumType;
	}

	public boolean allowLabelsAsValue() {
		return allowLabelsAsValue;
	}

	/**
	 * @return true if this field refers to a separately stored entity,
	 * which input may identify by primary key alone
	 */
	public boolean isReference() {
		return reference;
	}

	/**
	 * @return true if this field is filled from the chain of enclosing entities
	 * instead of from input
	 */
	public boolean isParentReference() {
		return parentReference;
	}

	public boolean isPrimary() {
		return primary;
	}

	public boolean isAutoIncrement() {
		return autoIncrement;
	}

	public Set<String> groups() {
		return groups;
	}

	public List<PropertyValidator> validators() {
		return validators;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(name).append(':').append(type);
		if (element != null) {
			sb.append('<').append(element.type).append('>');
		}
		if (!unionCandidates.isEmpty()) {
			sb.append(unionCandidates.stream().map(c -> c.type.toString()).toList());
		}
		if (optional) {
			sb.append('?');
		}
		if (nullable) {
			sb.append("|null");
		}
		return sb.toString();
	}

	public static final class Builder {
		private final String name;
		private final TypeTag type;
		private String memberName;
		private Class<?> javaType;
		private boolean optional;
		private boolean nullable;
		private boolean hasDefault;
		private Supplier<?> defaultValue;
		private boolean defaultFromInitializer;
		private FieldSchema element;
		private SchemaReference referencedSchema;
		private List<FieldSchema> unionCandidates = new ArrayList<>();
		private boolean hasLiteral;
		private Object literalValue;
		private Class<? extends Enum<?>> enumType;
		private boolean allowLabelsAsValue;
		private boolean reference;
		private boolean parentReference;
		private boolean primary;
		private boolean autoIncrement;
		private Set<String> groups = Set.of();
		private final List<PropertyValidator> validators = new ArrayList<>();

		Builder(String name, TypeTag type) {
			this.name = requireNonNull(name);
			this.type = requireNonNull(type);
			this.memberName = name;
		}

		Builder(FieldSchema f) {
			this(f.name, f.type);
			this.memberName = f.memberName;
			this.javaType = f.javaType;
			this.optional = f.optional;
			this.nullable = f.nullable;
			this.hasDefault = f.hasDefault;
			this.defaultValue = f.defaultValue;
			this.defaultFromInitializer = f.defaultFromInitializer;
			this.element = f.element;
			this.referencedSchema = f.referencedSchema;
			this.unionCandidates = new ArrayList<>(f.unionCandidates);
			this.hasLiteral = f.hasLiteral;
			this.literalValue = f.literalValue;
			this.enumType = f.enumType;
			this.allowLabelsAsValue = f.allowLabelsAsValue;
			this.reference = f.reference;
			this.parentReference = f.parentReference;
			this.primary = f.primary;
			this.autoIncrement = f.autoIncrement;
			this.groups = f.groups;
			this.validators.addAll(f.validators);
		}

		public Builder member(String memberName) {
			this.memberName = requireNonNull(memberName);
			return this;
		}

		public Builder javaType(Class<?> javaType) {
			this.javaType = requireNonNull(javaType);
			return this;
		}

		public Builder optional() {
			return optional(true);
		}

		public Builder optional(boolean optional) {
			this.optional = optional;
			return this;
		}

		public Builder nullable() {
			return nullable(true);
		}

		public Builder nullable(boolean nullable) {
			this.nullable = nullable;
			return this;
		}

		/**
		 * Use only for immutable values; mutable defaults need {@link #defaultSupplier}.
		 */
		public Builder defaultValue(Object value) {
			return defaultSupplier(() -> value);
		}

		public Builder defaultSupplier(Supplier<?> supplier) {
			this.hasDefault = true;
			this.defaultValue = requireNonNull(supplier);
			this.defaultFromInitializer = false;
			return this;
		}

		public Builder initializerDefault(Supplier<?> supplier) {
			defaultSupplier(supplier);
			this.defaultFromInitializer = true;
			return this;
		}

		public Builder element(FieldSchema element) {
			this.element = requireNonNull(element);
			return this;
		}

		public Builder schema(Supplier<ClassSchema> schema) {
			if (schema instanceof SchemaReference r) {
				this.referencedSchema = r;
			} else {
				this.referencedSchema = SchemaReference.lazy(schema);
			}
			return this;
		}

		public Builder schema(ClassSchema schema) {
			this.referencedSchema = SchemaReference.to(schema);
			if (javaType == null) {
				javaType = schema.entityClass();
			}
			return this;
		}

		public Builder candidates(List<FieldSchema> candidates) {
			this.unionCandidates = new ArrayList<>(candidates);
			return this;
		}

		public Builder literal(@Nullable Object value) {
			this.hasLiteral = true;
			this.literalValue = value;
			return this;
		}

		public Builder enumType(Class<? extends Enum<?>> enumType) {
			this.enumType = requireNonNull(enumType);
			return this;
		}

		public Builder allowLabelsAsValue() {
			this.allowLabelsAsValue = true;
			return this;
		}

		public Builder reference() {
			this.reference = true;
			return this;
		}

		public Builder parentReference() {
			this.parentReference = true;
			return this;
		}

		public Builder primary() {
			this.primary = true;
			return this;
		}

		public Builder autoIncrement() {
			this.autoIncrement = true;
			return this;
		}

		public Builder groups(String... groups) {
			this.groups = Set.of(groups);
			return this;
		}

		public Builder validator(PropertyValidator validator) {
			this.validators.add(requireNonNull(validator));
			return this;
		}

		public FieldSchema build() {
			if ((TypeTag.ARRAY.equals(type) || TypeTag.MAP.equals(type)) && element == null) {
				throw invalid("array and map fields need an element type");
			}
			if ((TypeTag.CLASS.equals(type) || TypeTag.PARTIAL.equals(type)) && referencedSchema == null) {
				throw invalid("needs a referenced schema");
			}
			if (TypeTag.UNION.equals(type) && unionCandidates.isEmpty()) {
				throw invalid("union field needs at least one candidate");
			}
			if (!unionCandidates.isEmpty() && !TypeTag.UNION.equals(type)) {
				throw invalid("only union fields can have candidates");
			}
			if (TypeTag.LITERAL.equals(type) && !hasLiteral) {
				throw invalid("literal field needs a literal value");
			}
			if (TypeTag.ENUM.equals(type) && enumType == null) {
				throw invalid("enum field needs an enum type");
			}
			if (parentReference && !TypeTag.CLASS.equals(type)) {
				throw invalid("parent references must be class fields");
			}
			if (javaType == null) {
				javaType = defaultJavaType();
			}
			return new FieldSchema(this);
		}

		private Class<?> defaultJavaType() {
			if (TypeTag.ENUM.equals(type)) {
				return enumType;
			} else if (TypeTag.LITERAL.equals(type) && literalValue != null) {
				return literalValue.getClass();
			} else {
				return DEFAULT_JAVA_TYPES.getOrDefault(type, Object.class);
			}
		}

		private SchemaDefinitionException invalid(String message) {
			return new SchemaDefinitionException("Invalid field " + name + ": " + message);
		}
	}

	private static final Map<TypeTag, Class<?>> DEFAULT_JAVA_TYPES = Map.ofEntries(
		Map.entry(TypeTag.STRING, String.class),
		Map.entry(TypeTag.NUMBER, Double.class),
		Map.entry(TypeTag.BOOLEAN, Boolean.class),
		Map.entry(TypeTag.DATE, Instant.class),
		Map.entry(TypeTag.UUID, java.util.UUID.class),
		Map.entry(TypeTag.ARRAY, List.class),
		Map.entry(TypeTag.MAP, Map.class),
		Map.entry(TypeTag.PARTIAL, Map.class),
		Map.entry(TypeTag.ARRAY_BUFFER, ByteBuffer.class),
		Map.entry(TypeTag.UINT8_ARRAY, byte[].class),
		Map.entry(TypeTag.INT8_ARRAY, byte[].class),
		Map.entry(TypeTag.INT16_ARRAY, short[].class),
		Map.entry(TypeTag.INT32_ARRAY, int[].class),
		Map.entry(TypeTag.FLOAT32_ARRAY, float[].class),
		Map.entry(TypeTag.FLOAT64_ARRAY, double[].class)
	);
}
