package de.bsommerfeld.feedscout.discovery.collect;

import de.bsommerfeld.feedscout.core.domain.CandidateRef;
import de.bsommerfeld.feedscout.core.domain.RawFields;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DetailResolverTest {

    @Mock
    private DetailFetcher failingFetcher;

    @Test
    void awaitAll_shouldReturnOutcomesInSubmissionOrder() {
        DetailFetcher fetcher = ref -> {
            // later submissions finish first
            sleep(ref.id().equals("a") ? 100 : 0);
            return new RawFields(ref.id(), null, "body of " + ref.id());
        };

        try (DetailResolver resolver = new DetailResolver(fetcher, 3)) {
            resolver.submit(new CandidateRef("a", 1));
            resolver.submit(new CandidateRef("b", 1));
            resolver.submit(new CandidateRef("c", 2));

            List<Resolution> outcomes = resolver.awaitAll();

            assertEquals(List.of("a", "b", "c"), outcomes.stream().map(r -> r.ref().id()).toList());
            assertTrue(outcomes.stream().allMatch(Resolution::isResolved));
            assertEquals(3, resolver.submitted());
        }
    }

    @Test
    void failures_shouldOnlyAffectTheirOwnItem() throws DetailFetchException {
        when(failingFetcher.fetch(any())).thenAnswer(invocation -> {
            CandidateRef ref = invocation.getArgument(0);
            switch (ref.id()) {
                case "checked":
                    throw new DetailFetchException("timeout");
                case "runtime":
                    throw new IllegalStateException("tab crashed");
                case "null":
                    return null;
                default:
                    return new RawFields(ref.id(), null, "ok");
            }
        });

        try (DetailResolver resolver = new DetailResolver(failingFetcher, 2)) {
            for (String id : List.of("ok-1", "checked", "runtime", "null", "ok-2")) {
                resolver.submit(new CandidateRef(id, 1));
            }
            List<Resolution> outcomes = resolver.awaitAll();

            assertEquals(List.of(true, false, false, false, true),
                    outcomes.stream().map(Resolution::isResolved).toList());
        }
    }

    @Test
    void pool_shouldNotExceedParallelism() throws InterruptedException {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(8);
        ConcurrentHashMap<String, String> threads = new ConcurrentHashMap<>();

        DetailFetcher fetcher = ref -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            threads.put(Thread.currentThread().getName(), ref.id());
            sleep(20);
            active.decrementAndGet();
            done.countDown();
            return new RawFields(ref.id(), null, "");
        };

        try (DetailResolver resolver = new DetailResolver(fetcher, 2)) {
            for (int i = 0; i < 8; i++) {
                resolver.submit(new CandidateRef("item-" + i, 1));
            }
            resolver.awaitAll();
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
        assertTrue(threads.keySet().stream().allMatch(name -> name.startsWith("detail-fetch-")));
    }

    @Test
    void constructor_shouldRejectZeroParallelism() {
        assertThrows(IllegalArgumentException.class, () -> new DetailResolver(ref -> null, 0));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
