package works.tether.runtime;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The value is an unsigned native integer carried in a signed Java type of the same width.
 * Use {@link Integer#toUnsignedLong}, {@link Long#toUnsignedString} and friends to interpret it.
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target({ElementType.PARAMETER, ElementType.METHOD, ElementType.FIELD, ElementType.RECORD_COMPONENT})
public @interface Unsigned {
}
