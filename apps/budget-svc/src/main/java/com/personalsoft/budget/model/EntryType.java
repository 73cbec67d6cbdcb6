package com.personalsoft.budget.model;

public enum EntryType {
    INCOME,
    EXPENSE
}
