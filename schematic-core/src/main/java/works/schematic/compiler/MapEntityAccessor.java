package works.schematic.compiler;

import java.lang.invoke.MethodHandle;
import java.lang.reflect.Modifier;
import java.util.LinkedHashMap;
import java.util.Map;
import works.schematic.exceptions.SchemaDefinitionException;
import works.schematic.schema.ClassSchema;
import works.schematic.schema.EntityLookups;
import works.schematic.schema.FieldSchema;

import static java.lang.invoke.MethodType.methodType;

final class MapEntityAccessor implements EntityAccessor {
	private final ClassSchema schema;
	private final MethodHandle constructor;

	MapEntityAccessor(ClassSchema schema) {
		this.schema = schema;
		Class<?> entityClass = schema.entityClass();
		if (entityClass.isInterface() || Modifier.isAbstract(entityClass.getModifiers())) {
			this.constructor = null;
		} else {
			try {
				this.constructor = EntityLookups.lookupFor(entityClass)
					.findConstructor(entityClass, methodType(void.class))
					.asType(methodType(Object.class));
			} catch (NoSuchMethodException | IllegalAccessException e) {
				throw new SchemaDefinitionException("Map class " + entityClass.getName() + " needs a no-argument constructor", e);
			}
		}
	}

	@Override
	public ClassSchema schema() {
		return schema;
	}

	@Override
	public Object newInstance() {
		if (constructor == null) {
			return new LinkedHashMap<String, Object>();
		}
		try {
			return (Object) constructor.invokeExact();
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new IllegalStateException("Unable to construct " + schema.name(), e);
		}
	}

	@Override
	@SuppressWarnings("unchecked")
	public Slot slot(FieldSchema field) {
		String key = field.memberName();
		return new Slot() {
			@Override
			public Object get(Object entity) {
				return ((Map<String, Object>) entity).get(key);
			}

			@Override
			public void set(Object entity, Object value) {
				((Map<String, Object>) entity).put(key, value);
			}
		};
	}
}
