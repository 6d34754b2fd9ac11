package com.queryroute.config;

import com.queryroute.analyzer.KeywordVocabulary;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RoutingConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public KeywordVocabulary keywordVocabulary() {
        return KeywordVocabulary.defaults();
    }
}
