package jobflow.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler for one or more operation types.
 *
 * <p>The annotated bean must implement {@link jobflow.worker.JobHandler}.
 *
 * <pre>{@code
 * @Component
 * @JobHandlerFor("EXTRACT_INVOICE")
 * public class InvoiceExtractor implements JobHandler<Object> {
 *   public Object execute(Job job, Object subject) { ... }
 * }
 * }</pre>
 *
 * @see JobHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface JobHandlerFor {

    /**
     * Operation types handled by the bean. At least one is required.
     */
    String[] value();
}
