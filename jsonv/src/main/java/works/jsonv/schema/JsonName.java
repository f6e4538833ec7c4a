package works.jsonv.schema;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Overrides the name by which a {@link Property} finds this field.
 * When two fields at the same depth compete for one name,
 * the one named by this annotation wins.
 *
 * @see FieldResolver
 */
@Retention(RUNTIME)
@Target(FIELD)
public @interface JsonName {
	String value();
}
