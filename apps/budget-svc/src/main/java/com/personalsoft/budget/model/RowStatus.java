package com.personalsoft.budget.model;

public enum RowStatus {
    PAID,
    OVERDUE,
    UPCOMING
}
