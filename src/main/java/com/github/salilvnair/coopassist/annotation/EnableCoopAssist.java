package com.github.salilvnair.coopassist.annotation;

import com.github.salilvnair.coopassist.config.CoopAssistAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(CoopAssistAutoConfiguration.class)
public @interface EnableCoopAssist {
}
