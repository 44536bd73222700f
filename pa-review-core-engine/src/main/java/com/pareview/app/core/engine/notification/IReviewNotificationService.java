package com.pareview.app.core.engine.notification;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Delivers the final outcome of a case.
 */
public interface IReviewNotificationService {

    /**
     * Attempts delivery on every channel of the event. A channel that fails is reported in the
     * result rather than as an error signal.
     */
    Mono<DeliveryResult> notify(ReviewNotificationEvent event);

    record DeliveryResult(List<String> delivered, List<String> failed) {

        public boolean isFullyDelivered() {
            return failed.isEmpty();
        }
    }
}
