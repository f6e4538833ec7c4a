package works.jsonv.schema;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * The fields of the annotated field's class are treated as though
 * they belonged to the enclosing class, one level deeper.
 * The annotated field's own name is not eligible.
 * <p>
 * The embedded object is allocated with its no-argument constructor
 * when one of its fields is first assigned.
 *
 * @see FieldResolver
 */
@Retention(RUNTIME)
@Target(FIELD)
public @interface Embedded {
}
