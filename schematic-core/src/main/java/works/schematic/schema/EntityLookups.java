package works.schematic.schema;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import works.schematic.exceptions.SchemaDefinitionException;

/**
 * Source of {@link Lookup}s with enough privilege to construct entities
 * and access their non-public fields.
 */
public final class EntityLookups {
	private EntityLookups() { }

	public static Lookup lookupFor(Class<?> entityClass) {
		try {
			return MethodHandles.privateLookupIn(entityClass, MethodHandles.lookup());
		} catch (IllegalAccessException e) {
			throw new SchemaDefinitionException("Unable to access members of " + entityClass.getName(), e);
		}
	}
}
