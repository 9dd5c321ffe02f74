package tsp.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a command-tree class. The class must implement the generated {@code Outer_Inner_ASTNode}
 * interface, which supplies {@code accept} and {@code visitChildren}.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface ASTNode {}
