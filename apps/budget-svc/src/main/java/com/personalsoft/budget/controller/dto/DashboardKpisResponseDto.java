package com.personalsoft.budget.controller.dto;

import java.time.LocalDate;

public record DashboardKpisResponseDto(LocalDate today, int billsDueToday, int overdueBills, String traceId) {
}
