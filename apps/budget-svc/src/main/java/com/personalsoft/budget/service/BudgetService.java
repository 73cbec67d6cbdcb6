package com.personalsoft.budget.service;

import com.personalsoft.budget.config.BudgetProperties;
import com.personalsoft.budget.model.OccurrenceKey;
import com.personalsoft.budget.model.OccurrenceOverride;
import com.personalsoft.budget.model.OneTimeEntry;
import com.personalsoft.budget.model.RecurringRule;
import com.personalsoft.budget.model.Snapshot;
import com.personalsoft.budget.model.UnifiedRow;
import com.personalsoft.budget.repository.BudgetEntryRepository;
import com.personalsoft.budget.repository.OccurrenceOverrideRepository;
import com.personalsoft.budget.repository.RecurringRuleRepository;
import com.personalsoft.budget.schedule.RecurringRuleValidator;
import com.personalsoft.budget.schedule.RuleExpander;
import com.personalsoft.budget.schedule.SnapshotAssembler;
import com.personalsoft.budget.security.AuthenticatedUserProvider;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Budget reads and writes for the current user. Every read re-loads the user's entries, rules and
 * overrides and hands them to the {@link SnapshotAssembler}; nothing is cached between calls, so a
 * mutation is visible to the very next read.
 */
@Service
public class BudgetService {

    private static final Logger log = LoggerFactory.getLogger(BudgetService.class);

    private final BudgetEntryRepository entryRepository;
    private final RecurringRuleRepository ruleRepository;
    private final OccurrenceOverrideRepository overrideRepository;
    private final SnapshotAssembler snapshotAssembler;
    private final RuleExpander ruleExpander;
    private final RecurringRuleValidator ruleValidator;
    private final AuthenticatedUserProvider authenticatedUserProvider;
    private final BudgetProperties properties;
    private final Clock clock;

    public BudgetService(
            BudgetEntryRepository entryRepository,
            RecurringRuleRepository ruleRepository,
            OccurrenceOverrideRepository overrideRepository,
            SnapshotAssembler snapshotAssembler,
            RuleExpander ruleExpander,
            RecurringRuleValidator ruleValidator,
            AuthenticatedUserProvider authenticatedUserProvider,
            BudgetProperties properties,
            Clock clock
    ) {
        this.entryRepository = entryRepository;
        this.ruleRepository = ruleRepository;
        this.overrideRepository = overrideRepository;
        this.snapshotAssembler = snapshotAssembler;
        this.ruleExpander = ruleExpander;
        this.ruleValidator = ruleValidator;
        this.authenticatedUserProvider = authenticatedUserProvider;
        this.properties = properties;
        this.clock = clock;
    }

    /** The user's local calendar date, in the configured budget zone. */
    public LocalDate today() {
        return LocalDate.now(clock.withZone(properties.zoneId()));
    }

    public Snapshot snapshot(LocalDate from, LocalDate to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        long days = ChronoUnit.DAYS.between(from, to) + 1;
        if (days > properties.snapshot().maxWindowDays()) {
            throw new IllegalArgumentException("window must not exceed " + properties.snapshot().maxWindowDays() + " days");
        }
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        Snapshot snapshot = snapshotAssembler.computeSnapshot(
                entryRepository.findByUserId(userId),
                ruleRepository.findByUserId(userId),
                overrideRepository.findByUserId(userId),
                from,
                to,
                today()
        );
        log.debug("Budget snapshot user={} window={}..{} rows={}", userId, from, to, snapshot.rows().size());
        return snapshot;
    }

    public Snapshot monthSnapshot(YearMonth month) {
        return snapshot(month.atDay(1), month.atEndOfMonth());
    }

    /** Unpaid obligations whose effective date falls inside the window. */
    public List<UnifiedRow> unpaidInWindow(LocalDate from, LocalDate to) {
        return snapshot(from, to).unpaidRows();
    }

    public OneTimeEntry upsertEntry(EntryCommand command) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        requireNonNegative(command.amount());
        Objects.requireNonNull(command.dueDate(), "dueDate");
        Objects.requireNonNull(command.type(), "type");
        OneTimeEntry saved;
        if (command.id().isPresent()) {
            UUID entryId = requireEntry(userId, command.id().get()).id();
            // payment state is read inside the update so a concurrent payment is kept
            saved = updateEntry(entryId, existing -> toEntry(entryId, userId, command, existing.paidOn()));
        } else {
            saved = entryRepository.save(toEntry(UUID.randomUUID(), userId, command, Optional.empty()));
        }
        log.info("Budget: saved entry {} due {}", saved.id(), saved.dueDate());
        return saved;
    }

    public void deleteEntry(UUID entryId) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        requireEntry(userId, entryId);
        entryRepository.deleteById(entryId);
        log.info("Budget: deleted entry {}", entryId);
    }

    public OneTimeEntry markEntryPaid(UUID entryId, LocalDate paidOn) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        Objects.requireNonNull(paidOn, "paidOn");
        requireEntry(userId, entryId);
        OneTimeEntry saved = updateEntry(entryId, entry -> entry.withPaidOn(paidOn));
        log.info("Budget: entry {} paid on {}", entryId, paidOn);
        return saved;
    }

    public OneTimeEntry postponeEntry(UUID entryId, LocalDate newDueDate) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        Objects.requireNonNull(newDueDate, "newDueDate");
        requireEntry(userId, entryId);
        OneTimeEntry saved = updateEntry(entryId, entry -> entry.withDueDate(newDueDate));
        log.info("Budget: entry {} moved to {}", entryId, newDueDate);
        return saved;
    }

    public RecurringRule upsertRule(RuleCommand command) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        UUID ruleId = command.id()
                .map(id -> requireRule(userId, id).id())
                .orElseGet(UUID::randomUUID);
        RecurringRule rule = new RecurringRule(
                ruleId,
                userId,
                command.type(),
                command.category(),
                command.description(),
                command.amount(),
                command.frequency(),
                command.dom(),
                command.dow(),
                command.startAnchor(),
                command.activeFlag(),
                command.endDate()
        );
        ruleValidator.validate(rule);
        RecurringRule saved = ruleRepository.save(rule);
        log.info("Budget: saved {} rule {}", saved.frequency(), saved.id());
        return saved;
    }

    public void deleteRule(UUID ruleId) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        requireRule(userId, ruleId);
        ruleRepository.deleteById(ruleId);
        log.info("Budget: deleted rule {}", ruleId);
    }

    public OccurrenceOverride markOccurrencePaid(UUID ruleId, LocalDate occurrenceDate, LocalDate paidOn) {
        Objects.requireNonNull(paidOn, "paidOn");
        return updateOccurrence(ruleId, occurrenceDate, (override, now) -> override.withPaidOn(paidOn, now), "paid on " + paidOn);
    }

    /**
     * Moves one occurrence to {@code newDate}, or one cadence step later when no date is given.
     * The override stays keyed by the original occurrence date.
     */
    public OccurrenceOverride postponeOccurrence(UUID ruleId, LocalDate occurrenceDate, Optional<LocalDate> newDate) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        RecurringRule rule = requireRule(userId, ruleId);
        LocalDate target = newDate.orElseGet(() -> ruleExpander.nextAfter(rule, occurrenceDate));
        return updateOccurrence(ruleId, occurrenceDate, (override, now) -> override.withEffectiveDate(target, now), "moved to " + target);
    }

    public OccurrenceOverride skipOccurrence(UUID ruleId, LocalDate occurrenceDate) {
        return updateOccurrence(ruleId, occurrenceDate, (override, now) -> override.withSkipped(true, now), "skipped");
    }

    private OccurrenceOverride updateOccurrence(UUID ruleId, LocalDate occurrenceDate, OverrideChange change, String description) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        Objects.requireNonNull(occurrenceDate, "occurrenceDate");
        RecurringRule rule = requireRule(userId, ruleId);
        ruleValidator.validate(rule);
        if (!ruleExpander.expand(rule, occurrenceDate, occurrenceDate).contains(occurrenceDate)) {
            throw new IllegalArgumentException(occurrenceDate + " is not a scheduled occurrence of rule " + ruleId);
        }
        OccurrenceKey key = new OccurrenceKey(ruleId, occurrenceDate);
        Instant now = clock.instant();
        OccurrenceOverride saved = overrideRepository.update(userId, key, current -> change.apply(
                current.orElseGet(() -> OccurrenceOverride.blank(userId, key, now)),
                now
        ));
        log.info("Budget: occurrence {} {}", key.asOccurrenceId(), description);
        return saved;
    }

    private OneTimeEntry updateEntry(UUID entryId, UnaryOperator<OneTimeEntry> change) {
        return entryRepository.update(entryId, change)
                .orElseThrow(() -> new BudgetItemNotFoundException("Entry", entryId));
    }

    private static OneTimeEntry toEntry(UUID entryId, UUID userId, EntryCommand command, Optional<LocalDate> paidOn) {
        return new OneTimeEntry(
                entryId,
                userId,
                command.type(),
                command.category(),
                command.description(),
                command.amount(),
                command.dueDate(),
                paidOn
        );
    }

    private OneTimeEntry requireEntry(UUID userId, UUID entryId) {
        return entryRepository.findById(entryId)
                .filter(entry -> entry.userId().equals(userId))
                .orElseThrow(() -> new BudgetItemNotFoundException("Entry", entryId));
    }

    private RecurringRule requireRule(UUID userId, UUID ruleId) {
        return ruleRepository.findById(ruleId)
                .filter(rule -> rule.userId().equals(userId))
                .orElseThrow(() -> new BudgetItemNotFoundException("Rule", ruleId));
    }

    private static void requireNonNegative(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be zero or positive");
        }
    }

    @FunctionalInterface
    private interface OverrideChange {
        OccurrenceOverride apply(OccurrenceOverride current, Instant now);
    }
}
