package works.schematic.compiler;

import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.schematic.schema.ClassSchema;
import works.schematic.schema.FieldSchema;

/**
 * Constructs entities of one schema and reads and writes their fields.
 * <p>
 * Schemas whose entity class is a {@link Map} hold their fields as map entries;
 * all others are accessed through method handles prepared once per schema.
 */
public sealed interface EntityAccessor permits ReflectiveEntityAccessor, MapEntityAccessor {
	ClassSchema schema();

	Object newInstance();

	Slot slot(FieldSchema field);

	interface Slot {
		@Nullable Object get(Object entity);

		/**
		 * @throws ClassCastException if {@code value} doesn't suit the entity's member
		 */
		void set(Object entity, @Nullable Object value);
	}

	static EntityAccessor of(ClassSchema schema) {
		if (Map.class.isAssignableFrom(schema.entityClass())) {
			return new MapEntityAccessor(schema);
		} else {
			return new ReflectiveEntityAccessor(schema);
		}
	}
}
