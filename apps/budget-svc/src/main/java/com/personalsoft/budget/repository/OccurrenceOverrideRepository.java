package com.personalsoft.budget.repository;

import com.personalsoft.budget.model.OccurrenceKey;
import com.personalsoft.budget.model.OccurrenceOverride;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

public interface OccurrenceOverrideRepository {

    List<OccurrenceOverride> findByUserId(UUID userId);

    /**
     * Atomically stores {@code change} applied to the current override for the key (empty when
     * none is stored yet). Concurrent updates of one key are serialized, so neither is lost.
     */
    OccurrenceOverride update(UUID userId, OccurrenceKey key, Function<Optional<OccurrenceOverride>, OccurrenceOverride> change);
}
