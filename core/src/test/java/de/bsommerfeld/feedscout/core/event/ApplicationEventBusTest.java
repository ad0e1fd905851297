package de.bsommerfeld.feedscout.core.event;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.feedscout.core.domain.PaginationState;
import de.bsommerfeld.feedscout.core.domain.SourceEntity;
import de.bsommerfeld.feedscout.core.event.DiscoveryEvents.PaginationFinishedEvent;
import de.bsommerfeld.feedscout.core.event.DiscoveryEvents.RoundCompletedEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationEventBusTest {

    @Test
    void post_shouldDeliverEventToRegisteredListener() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<RoundCompletedEvent>();

        Object listener = new Object() {
            @Subscribe
            public void onRound(RoundCompletedEvent event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        RoundCompletedEvent event = new RoundCompletedEvent(SourceEntity.handle("a"), 1, 3, 3, 0);
        eventBus.post(event);

        assertEquals(event, received.get());
    }

    @Test
    void post_shouldRouteByEventType() {
        var eventBus = new ApplicationEventBus();
        List<Object> rounds = new ArrayList<>();
        List<Object> finished = new ArrayList<>();

        eventBus.register(new Object() {
            @Subscribe
            public void onRound(RoundCompletedEvent event) {
                rounds.add(event);
            }

            @Subscribe
            public void onFinished(PaginationFinishedEvent event) {
                finished.add(event);
            }
        });

        SourceEntity source = SourceEntity.handle("a");
        eventBus.post(new RoundCompletedEvent(source, 1, 0, 0, 1));
        eventBus.post(new PaginationFinishedEvent(source, PaginationState.STOPPING_STAGNANT, 1, 0));

        assertEquals(1, rounds.size());
        assertEquals(1, finished.size());
    }

    @Test
    void unregister_shouldStopDeliveringEvents() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<String>();

        Object listener = new Object() {
            @Subscribe
            public void onEvent(String event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post("first");
        eventBus.unregister(listener);
        eventBus.post("second");

        assertEquals("first", received.get());
    }
}
