package com.jobrelay.annotation;

import com.jobrelay.MisfirePolicy;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the job type a {@link com.jobrelay.JobWorker} handles and the defaults applied to jobs of that type
 * when they are submitted without explicit options.
 * <p>
 * Numeric attributes left at {@code -1} fall back to {@code jobrelay.jobs.*}.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Job {

    /**
     * The job type (queue name) this worker handles.
     */
    String value();

    /**
     * Spring six-field cron expression, evaluated in UTC. When set, a cron definition named after the job type is
     * created at startup unless one already exists.
     */
    String cron() default "";

    MisfirePolicy misfirePolicy() default MisfirePolicy.COLLAPSE;

    int maxAttempts() default -1;

    /**
     * Backoff base for the first retry, in milliseconds. Doubles on every further attempt.
     */
    long baseDelayMs() default -1;

    long maxDelayMs() default -1;

    long leaseDurationMs() default -1;

    int priority() default 0;

    /**
     * Rate limiter key gating dispatch of jobs of this type. Empty means unlimited.
     */
    String rateKey() default "";
}
