package com.personalsoft.budget.controller.dto;

import java.time.LocalDate;

/** A missing {@code paidOn} means "paid today". */
public record PaymentRequestDto(LocalDate paidOn) {
}
