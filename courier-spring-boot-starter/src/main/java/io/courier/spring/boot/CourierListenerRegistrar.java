package io.courier.spring.boot;

import io.courier.Courier;
import io.courier.consume.EventHandler;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;

import java.util.Arrays;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Scans for beans annotated with {@link CourierListener} and subscribes them on the
 * {@link Courier}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * which is before {@link CourierLifecycle} starts the courier.
 *
 * @see CourierListener
 */
public class CourierListenerRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(CourierListenerRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final Courier courier;

    public CourierListenerRegistrar(ListableBeanFactory beanFactory, Courier courier) {
        this.beanFactory = beanFactory;
        this.courier = courier;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(CourierListener.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof EventHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @CourierListener must implement EventHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // Proxies may hide the annotation; the factory looks through to the target class
            CourierListener annotation = beanFactory.findAnnotationOnBean(beanName, CourierListener.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @CourierListener annotation on " + bean.getClass().getName());
            }
            if (annotation.routingKeys().length == 0) {
                throw new BeanCreationException(beanName,
                        "@CourierListener must specify at least one routing key");
            }

            try {
                courier.subscribe(annotation.queue(), Arrays.asList(annotation.routingKeys()),
                        annotation.exchange(), handler);
            } catch (IllegalArgumentException e) {
                throw new BeanCreationException(beanName, "Invalid @CourierListener: " + e.getMessage(), e);
            }
            logger.fine("Subscribed bean '" + beanName + "' to queue " + annotation.queue());
        }
    }
}
