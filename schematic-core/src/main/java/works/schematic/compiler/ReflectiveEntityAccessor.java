package works.schematic.compiler;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import works.schematic.exceptions.SchemaDefinitionException;
import works.schematic.schema.ClassSchema;
import works.schematic.schema.EntityLookups;
import works.schematic.schema.FieldSchema;

import static java.lang.invoke.MethodType.methodType;

final class ReflectiveEntityAccessor implements EntityAccessor {
	private final ClassSchema schema;
	private final MethodHandle constructor;

	ReflectiveEntityAccessor(ClassSchema schema) {
		this.schema = schema;
		Class<?> entityClass = schema.entityClass();
		try {
			this.constructor = EntityLookups.lookupFor(entityClass)
				.findConstructor(entityClass, methodType(void.class))
				.asType(methodType(Object.class));
		} catch (NoSuchMethodException | IllegalAccessException e) {
			throw new SchemaDefinitionException("Entity class " + entityClass.getName() + " needs a no-argument constructor", e);
		}
	}

	@Override
	public ClassSchema schema() {
		return schema;
	}

	@Override
	public Object newInstance() {
		try {
			return (Object) constructor.invokeExact();
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new IllegalStateException("Unable to construct " + schema.name(), e);
		}
	}

	@Override
	public Slot slot(FieldSchema field) {
		Field member = findMember(schema.entityClass(), field.memberName());
		if (Modifier.isFinal(member.getModifiers())) {
			throw SchemaDefinitionException.forField(schema.name(), field.name(), "member is final");
		}
		Lookup lookup = EntityLookups.lookupFor(member.getDeclaringClass());
		MethodHandle getter, setter;
		try {
			getter = lookup.unreflectGetter(member).asType(methodType(Object.class, Object.class));
			setter = lookup.unreflectSetter(member).asType(methodType(void.class, Object.class, Object.class));
		} catch (IllegalAccessException e) {
			throw new SchemaDefinitionException("Unable to access " + member, e);
		}
		return new HandleSlot(getter, setter, member.getType());
	}

	private Field findMember(Class<?> type, String name) {
		for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
			for (Field f : c.getDeclaredFields()) {
				if (f.getName().equals(name) && !Modifier.isStatic(f.getModifiers())) {
					return f;
				}
			}
		}
		throw SchemaDefinitionException.forField(schema.name(), name, "no such member in " + type.getName());
	}

	private record HandleSlot(MethodHandle getter, MethodHandle setter, Class<?> memberType) implements Slot {
		@Override
		public Object get(Object entity) {
			try {
				return (Object) getter.invokeExact(entity);
			} catch (RuntimeException | Error e) {
				throw e;
			} catch (Throwable e) {
				throw new IllegalStateException("Unexpected exception reading field", e);
			}
		}

		@Override
		public void set(Object entity, Object value) {
			if (value == null && memberType.isPrimitive()) {
				// Primitives keep whatever they had
				return;
			}
			if (value instanceof Number n && Numbers.isNumeric(memberType) && !memberType.isInstance(value)) {
				value = Numbers.coerce(n, memberType);
			}
			try {
				setter.invokeExact(entity, value);
			} catch (RuntimeException | Error e) {
				throw e;
			} catch (Throwable e) {
				throw new IllegalStateException("Unexpected exception writing field", e);
			}
		}
	}
}
