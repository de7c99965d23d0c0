package com.jay.valuator.layer4_pipeline;

import com.jay.valuator.model.StepEvent;
import com.jay.valuator.model.enums.StepStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class StatusEventBusTest {

    @Test
    void eventsAreDeliveredOnceInOrder() throws Exception {
        StatusEventBus bus = new StatusEventBus("run-1");
        bus.publish(StepEvent.of("validate", StepStatus.COMPLETED));
        bus.publish(StepEvent.of("enrich", StepStatus.RUNNING));

        List<StepEvent> first = bus.awaitEvents(Duration.ofMillis(10));
        assertThat(first).extracting(StepEvent::step).containsExactly("validate", "enrich");

        bus.publish(StepEvent.of("enrich", StepStatus.COMPLETED));
        List<StepEvent> second = bus.awaitEvents(Duration.ofMillis(10));
        assertThat(second).singleElement().satisfies(e -> {
            assertThat(e.step()).isEqualTo("enrich");
            assertThat(e.status()).isEqualTo(StepStatus.COMPLETED);
        });

        assertThat(bus.snapshot()).hasSize(3);
    }

    @Test
    void awaitTimesOutWithNothing() throws Exception {
        StatusEventBus bus = new StatusEventBus("run-2");
        assertThat(bus.awaitEvents(Duration.ofMillis(20))).isEmpty();
        assertThat(bus.isComplete()).isFalse();
    }

    @Test
    void drainedOnlyAfterCompleteAndAllRead() throws Exception {
        StatusEventBus bus = new StatusEventBus("run-3");
        bus.publish(StepEvent.of("persist", StepStatus.COMPLETED));
        bus.markComplete();

        assertThat(bus.isComplete()).isTrue();
        assertThat(bus.isDrained()).isFalse();

        bus.awaitEvents(Duration.ofMillis(10));
        assertThat(bus.isDrained()).isTrue();
    }

    @Test
    void waitingReaderWakesOnPublish() throws Exception {
        StatusEventBus bus = new StatusEventBus("run-4");
        CompletableFuture<List<StepEvent>> reader = CompletableFuture.supplyAsync(() -> {
            try {
                return bus.awaitEvents(Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(50);
        bus.publish(StepEvent.of("fetch", StepStatus.RUNNING));

        assertThat(reader.get(2, TimeUnit.SECONDS)).extracting(StepEvent::step).containsExactly("fetch");
    }

    @Test
    void completionWakesWaitingReader() throws Exception {
        StatusEventBus bus = new StatusEventBus("run-5");
        CompletableFuture<List<StepEvent>> reader = CompletableFuture.supplyAsync(() -> {
            try {
                return bus.awaitEvents(Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(50);
        bus.markComplete();

        assertThat(reader.get(2, TimeUnit.SECONDS)).isEmpty();
        assertThat(bus.isDrained()).isTrue();
    }
}
