package com.personalsoft.budget.controller;

import com.personalsoft.budget.controller.dto.DashboardKpisResponseDto;
import com.personalsoft.budget.controller.dto.WeekItemsResponseDto;
import com.personalsoft.budget.controller.dto.WeekItemsResponseDto.WeekItemDto;
import com.personalsoft.budget.dashboard.DashboardKpis;
import com.personalsoft.budget.dashboard.DashboardService;
import com.personalsoft.budget.security.RequestContextHolder;
import com.personalsoft.budget.service.BudgetService;
import java.time.LocalDate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/dashboard")
public class DashboardController {

    private final DashboardService dashboardService;
    private final BudgetService budgetService;

    public DashboardController(DashboardService dashboardService, BudgetService budgetService) {
        this.dashboardService = dashboardService;
        this.budgetService = budgetService;
    }

    @GetMapping("/kpis")
    public ResponseEntity<DashboardKpisResponseDto> kpis() {
        DashboardKpis kpis = dashboardService.kpis();
        return ResponseEntity.ok(new DashboardKpisResponseDto(
                budgetService.today(),
                kpis.billsDueToday(),
                kpis.overdueBills(),
                RequestContextHolder.traceId().orElse(null)
        ));
    }

    @GetMapping("/week")
    public ResponseEntity<WeekItemsResponseDto> week() {
        LocalDate today = budgetService.today();
        var items = dashboardService.weekItems().stream()
                .map(row -> new WeekItemDto(
                        row.occurrenceId(),
                        row.effectiveDate(),
                        row.description(),
                        "budget",
                        row.amount(),
                        row.isOverdue(today)
                ))
                .toList();
        return ResponseEntity.ok(new WeekItemsResponseDto(items, RequestContextHolder.traceId().orElse(null)));
    }
}
