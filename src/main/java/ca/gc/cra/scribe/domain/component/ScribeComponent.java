package ca.gc.cra.scribe.domain.component;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class for registration during component discovery.
 *
 * <p>Blank string attributes fall back to the registry defaults: a generated id and the simple class
 * name.</p>
 *
 * @since 0.1.0
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ScribeComponent {
  ComponentType type();

  String id() default "";

  String name() default "";

  String description() default "";

  String version() default "1.0.0";

  String[] tags() default {};

  ComponentScope scope() default ComponentScope.SINGLETON;

  String[] dependencies() default {};

  String parent() default "";
}
