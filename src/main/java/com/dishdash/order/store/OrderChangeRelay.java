package com.dishdash.order.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands JPA store changes to the subscription hub once the writing transaction has
 * committed, so subscribers never see a change that was rolled back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderChangeRelay {

    private final OrderChangeHub changeHub;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void relay(OrderChange change) {
        log.debug("Relaying committed change: type={}, orderId={}, version={}",
                change.type(), change.orderId(), change.version());
        changeHub.publish(change);
    }
}
