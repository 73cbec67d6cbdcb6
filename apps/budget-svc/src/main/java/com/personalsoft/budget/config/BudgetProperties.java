package com.personalsoft.budget.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "budget")
public record BudgetProperties(
        String zone,
        Snapshot snapshot,
        Dashboard dashboard
) {

    private static final String DEFAULT_ZONE = "America/New_York";

    @ConstructorBinding
    public BudgetProperties {
        if (zone == null || zone.isBlank()) {
            zone = DEFAULT_ZONE;
        }
        try {
            ZoneId.of(zone);
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("zone must be a valid time-zone id: " + zone, ex);
        }
        // snapshot and dashboard fall back to defaults via their accessors
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public Snapshot snapshot() {
        return snapshot != null ? snapshot : new Snapshot(null);
    }

    public Dashboard dashboard() {
        return dashboard != null ? dashboard : new Dashboard(null);
    }

    public record Snapshot(Integer maxWindowDays) {
        public Snapshot {
            if (maxWindowDays == null) {
                maxWindowDays = 366;
            }
            if (maxWindowDays <= 0) {
                throw new IllegalArgumentException("maxWindowDays must be positive");
            }
        }
    }

    public record Dashboard(Integer weekDays) {
        public Dashboard {
            if (weekDays == null) {
                weekDays = 7;
            }
            if (weekDays <= 0 || weekDays > 31) {
                throw new IllegalArgumentException("weekDays must be between 1 and 31");
            }
        }
    }
}
