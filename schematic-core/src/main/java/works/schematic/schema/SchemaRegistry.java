package works.schematic.schema;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Memoizes one {@link ClassSchema} per entity class.
 * <p>
 * Schemas are scanned lazily on first request. Scanning does not recurse into
 * referenced classes; those are looked up here when first resolved,
 * so cyclic class graphs scan without trouble.
 */
public class SchemaRegistry {
	private final Map<Class<?>, ClassSchema> schemas = new ConcurrentHashMap<>();
	private final SchemaScanner scanner = new SchemaScanner(this);

	public static SchemaRegistry global() {
		return GLOBAL;
	}

	/**
	 * @return the schema registered for {@code entityClass}, scanning it if necessary
	 */
	public ClassSchema getSchema(Class<?> entityClass) {
		ClassSchema existing = schemas.get(requireNonNull(entityClass));
		if (existing != null) {
			return existing;
		}
		// Scan outside the map so a scan can consult the registry for other classes
		ClassSchema scanned = scanner.scan(entityClass);
		ClassSchema winner = schemas.putIfAbsent(entityClass, scanned);
		if (winner == null) {
			LOGGER.debug("Scanned schema {}", scanned);
			return scanned;
		} else {
			return winner;
		}
	}

	/**
	 * Installs an explicitly built schema, replacing any existing one for the same class.
	 */
	public ClassSchema register(ClassSchema schema) {
		ClassSchema old = schemas.put(schema.entityClass(), schema);
		if (old != null && old != schema) {
			LOGGER.debug("Replaced schema for {}", schema.entityClass().getName());
		}
		return schema;
	}

	public boolean isRegistered(Class<?> entityClass) {
		return schemas.containsKey(entityClass);
	}

	private static final SchemaRegistry GLOBAL = new SchemaRegistry();
	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaRegistry.class);
}
