package com.example.cameratrap;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class TestClockConfiguration {

    @Bean
    @Primary
    public AdjustableClock adjustableClock() {
        return new AdjustableClock();
    }
}
