package works.schematic.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Built-in validator rules for the annotated field.
 * Unset members impose no rule; the rules run in the order declared here.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Validate {
	int minLength() default -1;

	int maxLength() default -1;

	String pattern() default "";

	double minimum() default Double.NaN;

	double maximum() default Double.NaN;
}
