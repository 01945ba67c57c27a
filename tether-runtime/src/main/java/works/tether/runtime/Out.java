package works.tether.runtime;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The parameter is storage the native function writes its result into.
 * Its type is a {@link com.sun.jna.ptr.ByReference} or a {@link com.sun.jna.Structure}.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.PARAMETER)
public @interface Out {
}
