package com.personalsoft.budget.service;

import java.util.UUID;

public class BudgetItemNotFoundException extends RuntimeException {

    public BudgetItemNotFoundException(String kind, UUID id) {
        super(kind + " not found: " + id);
    }
}
