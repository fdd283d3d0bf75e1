package works.schematic.sql;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.schematic.ConverterOptions;
import works.schematic.Schematic;
import works.schematic.ScopedSerializer;
import works.schematic.compiler.CompiledPipeline;
import works.schematic.schema.ClassSchema;
import works.schematic.schema.FieldSchema;
import works.schematic.serializer.Direction;

import static java.util.Objects.requireNonNull;

/**
 * Maps entities of one class to and from relational rows, keyed by field name,
 * using the {@link SqlSerializer sql} serializer.
 * <p>
 * Rows are plain maps; issuing the statements that read and write them is up to the caller.
 */
public final class SqlRowMapper<T> {
	private final Schematic schematic;
	private final ClassSchema schema;
	private final ScopedSerializer<T> sql;
	private final List<String> columns;

	public SqlRowMapper(Schematic schematic, Class<T> entityClass) {
		this.schematic = SqlSerializer.install(requireNonNull(schematic));
		this.schema = schematic.getSchema(entityClass);
		this.sql = schematic.scoped(SqlSerializer.NAME, entityClass);
		this.columns = schema.fields().stream()
			.filter(f -> !f.isParentReference())
			.map(FieldSchema::name)
			.toList();
		LOGGER.debug("Row mapper for {} with columns {}", schema.name(), columns);
	}

	public ClassSchema schema() {
		return schema;
	}

	/**
	 * @return the names of the fields stored as columns, in declaration order
	 */
	public List<String> columns() {
		return columns;
	}

	public Map<String, Object> toRow(T entity) {
		return sql.serialize(entity);
	}

	public T fromRow(Map<String, ?> row) {
		return sql.deserialize(row);
	}

	public T fromRow(Map<String, ?> row, ConverterOptions options) {
		return sql.deserialize(row, options);
	}

	/**
	 * @return the primary key column of {@code entity} and its value, suitable for a {@code WHERE} clause
	 * @throws IllegalStateException if the schema has no primary field
	 */
	@SuppressWarnings("unchecked")
	public Map<String, Object> primaryKey(T entity) {
		FieldSchema primary = schema.requirePrimaryField();
		CompiledPipeline keyPipeline = schematic.compiler()
			.compilePartial(schema, schematic.serializer(SqlSerializer.NAME), Direction.ENCODE, Set.of(primary.name()));
		return (Map<String, Object>) keyPipeline.run(entity);
	}

	/**
	 * Converts a set of changed field values, as held by entities, to column values.
	 *
	 * @param set field names and their new values; names that aren't fields are dropped
	 */
	public Map<String, Object> changes(Map<String, ?> set) {
		return sql.partialSerialize(set);
	}

	/**
	 * Applies the columns present in {@code row} to {@code target}.
	 */
	public T patch(T target, Map<String, ?> row) {
		return sql.patch(target, row);
	}

	@Override
	public String toString() {
		return "SqlRowMapper(" + schema.name() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SqlRowMapper.class);
}
