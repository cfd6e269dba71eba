package io.vena.nodesim.junit;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import org.junit.jupiter.api.TestTemplate;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Runs the annotated test once for every combination of its parameter values.
 *
 * <p>
 * Values for a parameter named <code>foo</code> come from a static, no-argument
 * method of the test class or one of its superclasses, also named <code>foo</code>,
 * returning a {@link java.util.stream.Stream}.
 * Parameters of a test-class constructor carrying this annotation are bound the same way.
 * Requires classes to be compiled with <code>-parameters</code>.
 */
@Target({ ElementType.ANNOTATION_TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR })
@Retention(RetentionPolicy.RUNTIME)
@ExtendWith(ParametersByNameContextProvider.class)
@TestTemplate
public @interface ParametersByName {
}
