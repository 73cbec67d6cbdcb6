package com.personalsoft.budget.controller;

import com.personalsoft.budget.controller.dto.EntryRequestDto;
import com.personalsoft.budget.controller.dto.EntryResponseDto;
import com.personalsoft.budget.controller.dto.OverrideResponseDto;
import com.personalsoft.budget.controller.dto.PaymentRequestDto;
import com.personalsoft.budget.controller.dto.PostponeRequestDto;
import com.personalsoft.budget.controller.dto.RuleRequestDto;
import com.personalsoft.budget.controller.dto.RuleResponseDto;
import com.personalsoft.budget.controller.dto.SnapshotResponseDto;
import com.personalsoft.budget.model.Snapshot;
import com.personalsoft.budget.model.Totals;
import com.personalsoft.budget.model.UnifiedRow;
import com.personalsoft.budget.security.RequestContextHolder;
import com.personalsoft.budget.service.BudgetService;
import com.personalsoft.budget.service.EntryCommand;
import com.personalsoft.budget.service.RuleCommand;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/budget")
public class BudgetController {

    private final BudgetService budgetService;

    public BudgetController(BudgetService budgetService) {
        this.budgetService = budgetService;
    }

    @GetMapping("/snapshot")
    public ResponseEntity<SnapshotResponseDto> snapshot(
            @RequestParam(value = "month", required = false) String month,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to
    ) {
        boolean hasFrom = from != null && !from.isBlank();
        boolean hasTo = to != null && !to.isBlank();
        if (hasFrom != hasTo) {
            throw new IllegalArgumentException("from and to must be provided together");
        }
        Snapshot snapshot;
        YearMonth targetMonth = null;
        if (hasFrom) {
            snapshot = budgetService.snapshot(parseDate(from, "from"), parseDate(to, "to"));
        } else {
            targetMonth = month != null && !month.isBlank()
                    ? parseMonth(month)
                    : YearMonth.from(budgetService.today());
            snapshot = budgetService.monthSnapshot(targetMonth);
        }
        return ResponseEntity.ok(BudgetDtoMapper.toSnapshot(snapshot, targetMonth, traceId()));
    }

    @GetMapping("/unpaid")
    public ResponseEntity<SnapshotResponseDto> unpaid(
            @RequestParam("from") String from,
            @RequestParam("to") String to
    ) {
        LocalDate fromDate = parseDate(from, "from");
        LocalDate toDate = parseDate(to, "to");
        List<UnifiedRow> rows = budgetService.unpaidInWindow(fromDate, toDate);
        Snapshot unpaid = new Snapshot(fromDate, toDate, budgetService.today(), rows, Totals.of(rows));
        return ResponseEntity.ok(BudgetDtoMapper.toSnapshot(unpaid, null, traceId()));
    }

    @PostMapping("/entries")
    public ResponseEntity<EntryResponseDto> createEntry(@RequestBody @Valid EntryRequestDto request) {
        var saved = budgetService.upsertEntry(toCommand(Optional.empty(), request));
        return ResponseEntity.status(HttpStatus.CREATED).body(BudgetDtoMapper.toEntry(saved));
    }

    @PutMapping("/entries/{entryId}")
    public ResponseEntity<EntryResponseDto> updateEntry(
            @PathVariable("entryId") UUID entryId,
            @RequestBody @Valid EntryRequestDto request
    ) {
        var saved = budgetService.upsertEntry(toCommand(Optional.of(entryId), request));
        return ResponseEntity.ok(BudgetDtoMapper.toEntry(saved));
    }

    @DeleteMapping("/entries/{entryId}")
    public ResponseEntity<Void> deleteEntry(@PathVariable("entryId") UUID entryId) {
        budgetService.deleteEntry(entryId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/entries/{entryId}/paid")
    public ResponseEntity<EntryResponseDto> markEntryPaid(
            @PathVariable("entryId") UUID entryId,
            @RequestBody(required = false) PaymentRequestDto request
    ) {
        var saved = budgetService.markEntryPaid(entryId, paidOnOrToday(request));
        return ResponseEntity.ok(BudgetDtoMapper.toEntry(saved));
    }

    @PostMapping("/entries/{entryId}/postpone")
    public ResponseEntity<EntryResponseDto> postponeEntry(
            @PathVariable("entryId") UUID entryId,
            @RequestBody PostponeRequestDto request
    ) {
        if (request == null || request.newDate() == null) {
            throw new IllegalArgumentException("newDate must be provided");
        }
        var saved = budgetService.postponeEntry(entryId, request.newDate());
        return ResponseEntity.ok(BudgetDtoMapper.toEntry(saved));
    }

    @PostMapping("/rules")
    public ResponseEntity<RuleResponseDto> createRule(@RequestBody @Valid RuleRequestDto request) {
        var saved = budgetService.upsertRule(toCommand(Optional.empty(), request));
        return ResponseEntity.status(HttpStatus.CREATED).body(BudgetDtoMapper.toRule(saved));
    }

    @PutMapping("/rules/{ruleId}")
    public ResponseEntity<RuleResponseDto> updateRule(
            @PathVariable("ruleId") UUID ruleId,
            @RequestBody @Valid RuleRequestDto request
    ) {
        var saved = budgetService.upsertRule(toCommand(Optional.of(ruleId), request));
        return ResponseEntity.ok(BudgetDtoMapper.toRule(saved));
    }

    @DeleteMapping("/rules/{ruleId}")
    public ResponseEntity<Void> deleteRule(@PathVariable("ruleId") UUID ruleId) {
        budgetService.deleteRule(ruleId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/rules/{ruleId}/occurrences/{occurrenceDate}/paid")
    public ResponseEntity<OverrideResponseDto> markOccurrencePaid(
            @PathVariable("ruleId") UUID ruleId,
            @PathVariable("occurrenceDate") String occurrenceDate,
            @RequestBody(required = false) PaymentRequestDto request
    ) {
        var saved = budgetService.markOccurrencePaid(ruleId, parseDate(occurrenceDate, "occurrenceDate"), paidOnOrToday(request));
        return ResponseEntity.ok(BudgetDtoMapper.toOverride(saved));
    }

    @PostMapping("/rules/{ruleId}/occurrences/{occurrenceDate}/postpone")
    public ResponseEntity<OverrideResponseDto> postponeOccurrence(
            @PathVariable("ruleId") UUID ruleId,
            @PathVariable("occurrenceDate") String occurrenceDate,
            @RequestBody(required = false) PostponeRequestDto request
    ) {
        Optional<LocalDate> newDate = Optional.ofNullable(request).map(PostponeRequestDto::newDate);
        var saved = budgetService.postponeOccurrence(ruleId, parseDate(occurrenceDate, "occurrenceDate"), newDate);
        return ResponseEntity.ok(BudgetDtoMapper.toOverride(saved));
    }

    @PostMapping("/rules/{ruleId}/occurrences/{occurrenceDate}/skip")
    public ResponseEntity<OverrideResponseDto> skipOccurrence(
            @PathVariable("ruleId") UUID ruleId,
            @PathVariable("occurrenceDate") String occurrenceDate
    ) {
        var saved = budgetService.skipOccurrence(ruleId, parseDate(occurrenceDate, "occurrenceDate"));
        return ResponseEntity.ok(BudgetDtoMapper.toOverride(saved));
    }

    private LocalDate paidOnOrToday(PaymentRequestDto request) {
        return request != null && request.paidOn() != null ? request.paidOn() : budgetService.today();
    }

    private static EntryCommand toCommand(Optional<UUID> id, EntryRequestDto request) {
        return new EntryCommand(
                id,
                request.type(),
                request.category(),
                request.description(),
                request.amount(),
                request.dueDate()
        );
    }

    private static RuleCommand toCommand(Optional<UUID> id, RuleRequestDto request) {
        return new RuleCommand(
                id,
                request.type(),
                request.category(),
                request.description(),
                request.amount(),
                request.frequency(),
                request.dom(),
                request.dow(),
                request.startAnchor(),
                request.active(),
                Optional.ofNullable(request.endDate())
        );
    }

    private static String traceId() {
        return RequestContextHolder.traceId().orElse(null);
    }

    private static LocalDate parseDate(String value, String param) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid " + param + " format");
        }
    }

    private static YearMonth parseMonth(String value) {
        try {
            return YearMonth.parse(value);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid month format");
        }
    }
}
