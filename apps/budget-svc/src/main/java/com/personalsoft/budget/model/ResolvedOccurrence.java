package com.personalsoft.budget.model;

import java.time.LocalDate;
import java.util.Optional;

/** An occurrence after its override: where it now falls and whether it was paid. */
public record ResolvedOccurrence(LocalDate effectiveDate, Optional<LocalDate> paidOn) {
}
