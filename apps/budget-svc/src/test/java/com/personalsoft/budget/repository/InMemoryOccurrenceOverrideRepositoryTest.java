package com.personalsoft.budget.repository;

import static com.personalsoft.budget.BudgetFixtures.USER;
import static com.personalsoft.budget.BudgetFixtures.monthly;
import static com.personalsoft.budget.BudgetFixtures.paid;
import static org.assertj.core.api.Assertions.assertThat;

import com.personalsoft.budget.model.OccurrenceKey;
import com.personalsoft.budget.model.OccurrenceOverride;
import com.personalsoft.budget.model.RecurringRule;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class InMemoryOccurrenceOverrideRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-03-05T00:00:00Z");

    private final InMemoryOccurrenceOverrideRepository repository = new InMemoryOccurrenceOverrideRepository();
    private final RecurringRule rent = monthly("Rent", 1, LocalDate.of(2025, 1, 1), new BigDecimal("900"));

    @Test
    void updateStartsFromEmptyThenSeesStoredOverride() {
        LocalDate date = LocalDate.of(2025, 3, 1);
        OccurrenceKey key = new OccurrenceKey(rent.id(), date);

        repository.update(USER, key, current -> {
            assertThat(current).isEmpty();
            return paid(rent, date, date);
        });
        OccurrenceOverride skipped = repository.update(USER, key, current -> current.orElseThrow().withSkipped(true, NOW));

        assertThat(skipped.paidOn()).contains(date);
        assertThat(repository.findByUserId(USER)).containsExactly(skipped);
    }

    @Test
    void overridesAreScopedPerUser() {
        LocalDate date = LocalDate.of(2025, 3, 1);
        OccurrenceKey key = new OccurrenceKey(rent.id(), date);
        UUID other = UUID.randomUUID();
        repository.update(USER, key, current -> paid(rent, date, date));

        repository.update(other, key, current -> {
            assertThat(current).isEmpty();
            return new OccurrenceOverride(other, rent.id(), date, Optional.empty(), Optional.empty(), true, NOW);
        });

        assertThat(repository.findByUserId(USER)).singleElement().satisfies(override -> assertThat(override.skipped()).isFalse());
        assertThat(repository.findByUserId(other)).singleElement().satisfies(override -> assertThat(override.skipped()).isTrue());
    }

    @Test
    void findByUserIdIsOrderedByRuleThenDate() {
        LocalDate april = LocalDate.of(2025, 4, 1);
        LocalDate march = LocalDate.of(2025, 3, 1);
        repository.update(USER, new OccurrenceKey(rent.id(), april), current -> paid(rent, april, april));
        repository.update(USER, new OccurrenceKey(rent.id(), march), current -> paid(rent, march, march));

        assertThat(repository.findByUserId(USER))
                .extracting(OccurrenceOverride::occurrenceDate)
                .containsExactly(march, april);
    }

    @Test
    void concurrentUpdatesOfOneKeyAreAllApplied() throws Exception {
        LocalDate date = LocalDate.of(2025, 3, 1);
        OccurrenceKey key = new OccurrenceKey(rent.id(), date);
        int writers = 8;
        int rounds = 250;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int round = 0; round < rounds; round++) {
                        // each write pushes the effective date one day further
                        repository.update(USER, key, current -> {
                            OccurrenceOverride base = current.orElseGet(() -> OccurrenceOverride.blank(USER, key, NOW));
                            return base.withEffectiveDate(base.effectiveDate().orElse(date).plusDays(1), NOW);
                        });
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(repository.findByUserId(USER)).singleElement()
                .satisfies(override -> assertThat(override.effectiveDate()).contains(date.plusDays((long) writers * rounds)));
    }
}
