package com.jobrelay;

import org.springframework.core.ResolvableType;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executes jobs of one type. Register implementations as Spring beans; the worker runtime picks them up.
 *
 * @param <T> the payload type, deserialized from the job's JSON payload
 */
public interface JobWorker<T> {

    Map<Class<?>, Class<?>> PAYLOAD_CLASS_CACHE = new ConcurrentHashMap<>();

    /**
     * The job type handled by this worker. Defaults to the value of {@link com.jobrelay.annotation.Job}.
     */
    default String getJobType() {
        Class<?> targetClass = ClassUtils.getUserClass(this);
        com.jobrelay.annotation.Job annotation = AnnotationUtils.findAnnotation(targetClass,
                com.jobrelay.annotation.Job.class);
        if (annotation == null || annotation.value().isBlank()) {
            throw new IllegalStateException("JobWorker " + targetClass.getName()
                    + " must either be annotated with @Job or override getJobType()");
        }
        return annotation.value().trim();
    }

    /**
     * Executes one attempt. Returning normally reports success; throwing reports a failure that the retry policy
     * of the job handles. Long-running work should call {@link JobContext#checkpoint()} periodically.
     */
    void process(JobContext context, T payload) throws Exception;

    /**
     * Invoked after {@link #process(JobContext, Object)} threw, before the failure is reported. Exceptions thrown
     * here are logged and do not change the outcome.
     */
    default void onError(JobContext context, T payload, Exception exception) {
    }

    /**
     * Invoked once the success report was acknowledged. Exceptions thrown here are logged and the job stays
     * completed.
     */
    default void onSuccess(JobContext context, T payload) {
    }

    @SuppressWarnings("unchecked")
    default Class<T> getPayloadClass() {
        Class<?> targetClass = ClassUtils.getUserClass(this);
        return (Class<T>) PAYLOAD_CLASS_CACHE.computeIfAbsent(targetClass, JobWorker::inferPayloadClass);
    }

    private static Class<?> inferPayloadClass(Class<?> targetClass) {
        Class<?> resolved = ResolvableType.forClass(targetClass).as(JobWorker.class).getGeneric(0).resolve();
        if (resolved == null) {
            throw new IllegalStateException("JobWorker " + targetClass.getName()
                    + " payload type cannot be inferred. Use a concrete generic type or override getPayloadClass().");
        }
        return resolved;
    }
}
