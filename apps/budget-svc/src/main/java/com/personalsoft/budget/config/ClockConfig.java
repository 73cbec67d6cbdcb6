package com.personalsoft.budget.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    @Bean
    public Clock budgetClock(BudgetProperties properties) {
        return Clock.system(properties.zoneId());
    }
}
