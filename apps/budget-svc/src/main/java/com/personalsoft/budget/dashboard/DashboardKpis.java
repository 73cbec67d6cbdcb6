package com.personalsoft.budget.dashboard;

public record DashboardKpis(int billsDueToday, int overdueBills) {
}
