package com.personalsoft.budget.health;

import com.personalsoft.budget.config.BudgetProperties;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated liveness check for the load balancer. Also reports the zone the budget
 * calendar runs in, so a misconfigured "today" is visible without a tenant header.
 */
@RestController
public class HealthzController {

    private final BudgetProperties properties;
    private final Clock clock;

    public HealthzController(BudgetProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("zone", properties.zoneId().getId());
        body.put("today", LocalDate.now(clock.withZone(properties.zoneId())).toString());
        return body;
    }
}
