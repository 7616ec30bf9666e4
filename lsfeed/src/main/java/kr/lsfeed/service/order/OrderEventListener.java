package kr.lsfeed.service.order;

import kr.lsfeed.domain.stream.OrderEvent;
import kr.lsfeed.domain.stream.OrderEventType;

/**
 * Receives order lifecycle events on the router thread.
 */
@FunctionalInterface
public interface OrderEventListener {

    void onOrderEvent(OrderEventType type, OrderEvent event);
}
