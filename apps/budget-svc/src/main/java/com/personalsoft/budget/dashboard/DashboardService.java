package com.personalsoft.budget.dashboard;

import com.personalsoft.budget.config.BudgetProperties;
import com.personalsoft.budget.model.EntryType;
import com.personalsoft.budget.model.Snapshot;
import com.personalsoft.budget.model.UnifiedRow;
import com.personalsoft.budget.service.BudgetService;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Personal dashboard views over the budget engine: the bill KPIs for the current month and the
 * unpaid bills of the coming week.
 */
@Service
public class DashboardService {

    private static final Logger log = LoggerFactory.getLogger(DashboardService.class);

    private final BudgetService budgetService;
    private final BudgetProperties properties;

    public DashboardService(BudgetService budgetService, BudgetProperties properties) {
        this.budgetService = budgetService;
        this.properties = properties;
    }

    public DashboardKpis kpis() {
        LocalDate today = budgetService.today();
        Snapshot month = budgetService.monthSnapshot(YearMonth.from(today));
        DashboardKpis kpis = new DashboardKpis(month.dueTodayRows().size(), month.overdueRows().size());
        log.debug("Dashboard KPIs for {}: dueToday={} overdue={}", today, kpis.billsDueToday(), kpis.overdueBills());
        return kpis;
    }

    /** Unpaid expenses from today through the end of the configured week. */
    public List<UnifiedRow> weekItems() {
        LocalDate today = budgetService.today();
        LocalDate end = today.plusDays(properties.dashboard().weekDays() - 1L);
        return budgetService.snapshot(today, end).rows().stream()
                .filter(row -> row.type() == EntryType.EXPENSE)
                .filter(row -> !row.isPaid())
                .toList();
    }
}
