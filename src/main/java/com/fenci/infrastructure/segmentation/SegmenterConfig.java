package com.fenci.infrastructure.segmentation;

import com.fenci.infrastructure.segmentation.rule.RuleCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.random.RandomGenerator;

@Configuration
public class SegmenterConfig {

    @Bean
    public RuleCatalog ruleCatalog() {
        return RuleCatalog.standard();
    }

    @Bean
    public RandomGenerator chaosRandom() {
        return new SecureRandom();
    }
}
