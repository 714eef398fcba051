package com.github.salilvnair.coopassist.engine.pipeline.annotation;

import java.lang.annotation.*;

/**
 * Marks the single step that always runs last.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TerminalStep {
}
