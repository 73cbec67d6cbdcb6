package com.personalsoft.budget.controller.dto;

import java.time.LocalDate;

public record PostponeRequestDto(LocalDate newDate) {
}
