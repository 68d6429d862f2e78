package jobflow.spring.boot;

import jobflow.worker.DefaultHandlerRegistry;
import jobflow.worker.JobHandler;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;

/**
 * Scans for beans annotated with {@link JobHandlerFor} and registers them
 * in the {@link DefaultHandlerRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * before the worker starts polling.
 *
 * @see JobHandlerFor
 */
public class JobHandlerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final DefaultHandlerRegistry<Object> registry;

    public JobHandlerRegistrar(ListableBeanFactory beanFactory, DefaultHandlerRegistry<Object> registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    @SuppressWarnings("unchecked")
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(JobHandlerFor.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof JobHandler<?> handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @JobHandlerFor must implement JobHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // Proxies may hide the annotation
            JobHandlerFor annotation = AnnotationUtils.findAnnotation(bean.getClass(), JobHandlerFor.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @JobHandlerFor annotation on " + bean.getClass().getName());
            }
            if (annotation.value().length == 0) {
                throw new BeanCreationException(beanName,
                        "@JobHandlerFor must name at least one operation type");
            }

            for (String operationType : annotation.value()) {
                if (operationType.isBlank()) {
                    throw new BeanCreationException(beanName,
                            "@JobHandlerFor operation types must not be blank");
                }
                registry.register(operationType, (JobHandler<Object>) handler);
            }
        }
    }
}
