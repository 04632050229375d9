package com.postflow.spring;

import com.postflow.adapter.spring.PostflowAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Registers the scheduling engine, its rule store and the live-state probe in the
 * annotated application's context. Settings come from the {@code postflow.*} properties;
 * any of the beans can be replaced by declaring one of the same type.
 *
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnablePostflow
 * public class EditBayApplication { }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(PostflowAutoConfiguration.class)
public @interface EnablePostflow {
}
