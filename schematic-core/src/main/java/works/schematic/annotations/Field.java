package works.schematic.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Modifiers for one scanned field. Unannotated instance fields are scanned with all defaults.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Field {
	/**
	 * Overrides the field's name in external data.
	 */
	String name() default "";

	boolean optional() default false;

	boolean nullable() default false;

	/**
	 * For enum fields: also accept constant names where values are expected.
	 */
	boolean allowLabelsAsValue() default false;

	/**
	 * Makes this a literal field whose value is always this string.
	 */
	String literal() default "";

	/**
	 * Overrides the scanned type tag name, e.g. {@code "any"} or {@code "uint8array"}.
	 */
	String type() default "";

	String[] groups() default {};

	/**
	 * For {@code Map<String, Object>} fields: holds partial values of this entity class.
	 */
	Class<?> partialOf() default Void.class;
}
