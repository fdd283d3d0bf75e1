package works.schematic.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the candidates of a union-typed field, in declaration order:
 * first the string literals, then the entity classes.
 * <p>
 * {@link #tags} adds candidates by type tag name, such as {@code "number"}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Union {
	String[] literals() default {};

	Class<?>[] types() default {};

	String[] tags() default {};
}
