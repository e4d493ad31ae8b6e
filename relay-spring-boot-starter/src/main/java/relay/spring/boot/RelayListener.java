package relay.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a relay delivery callback.
 *
 * <p>The annotated bean must implement {@link relay.DeliveryCallback}. Each routing key
 * is bound to the subscriber's queue and dispatched to this bean.
 *
 * <pre>{@code
 * @Component
 * @RelayListener(routingKey = "report.raw")
 * public class RawReportHandler implements DeliveryCallback {
 *   public void onDelivery(Delivery delivery) { ... }
 * }
 * }</pre>
 *
 * @see RelayListenerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RelayListener {

    /**
     * Routing keys (or topic patterns on a topic exchange) this callback handles.
     */
    String[] routingKey();
}
