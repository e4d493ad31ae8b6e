package relay.spring.boot;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;
import relay.DeliveryCallback;
import relay.registry.DefaultCallbackRegistry;

import java.util.Map;

/**
 * Scans for beans annotated with {@link RelayListener} and registers them
 * in the {@link DefaultCallbackRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * before the subscriber starts.
 *
 * @see RelayListener
 */
public class RelayListenerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final DefaultCallbackRegistry registry;

    public RelayListenerRegistrar(ListableBeanFactory beanFactory, DefaultCallbackRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(RelayListener.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof DeliveryCallback callback)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @RelayListener must implement DeliveryCallback, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // proxies may hide the annotation on the target class
            RelayListener annotation = AnnotationUtils.findAnnotation(bean.getClass(), RelayListener.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @RelayListener annotation on " + bean.getClass().getName());
            }
            if (annotation.routingKey().length == 0) {
                throw new BeanCreationException(beanName, "@RelayListener must name at least one routingKey");
            }

            for (String routingKey : annotation.routingKey()) {
                try {
                    registry.register(routingKey, callback);
                } catch (IllegalStateException e) {
                    throw new BeanCreationException(beanName, e.getMessage(), e);
                }
            }
        }
    }
}
