package io.github.panghy.roundengine.test;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Indicates that a test should run with a fresh random seed.
 * The seed is printed so that failures can be reproduced with {@link FixedSeed}.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface RandomSeed {
}
