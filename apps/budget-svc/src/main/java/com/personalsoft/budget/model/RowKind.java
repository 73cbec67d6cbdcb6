package com.personalsoft.budget.model;

public enum RowKind {
    ONE_TIME,
    RECURRING
}
