package works.schematic.compiler;

import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.schematic.schema.ClassSchema;
import works.schematic.serializer.Direction;
import works.schematic.serializer.Serializer;

import static java.util.Objects.requireNonNull;

/**
 * Identifies one compiled pipeline.
 * Schemas and serializers compare by identity; a null subset means all fields.
 */
record PipelineKey(
	ClassSchema schema,
	Serializer serializer,
	Direction direction,
	@Nullable Set<String> fieldSubset
) {
	PipelineKey {
		requireNonNull(schema);
		requireNonNull(serializer);
		requireNonNull(direction);
		if (fieldSubset != null) {
			fieldSubset = Set.copyOf(fieldSubset);
		}
	}

	boolean isPartial() {
		return fieldSubset != null;
	}

	@Override
	public String toString() {
		return schema.name() + "/" + serializer.name() + "/" + direction
			+ ((fieldSubset == null) ? "" : fieldSubset.toString());
	}
}
