package com.personalsoft.budget.model;

public enum Frequency {
    MONTHLY,
    WEEKLY,
    BIWEEKLY
}
