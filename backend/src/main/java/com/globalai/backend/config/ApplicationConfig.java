package com.globalai.backend.config;

import com.globalai.backend.service.registry.SymbolRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.time.Clock;

@Configuration
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SymbolRegistry symbolRegistry(@Value("${symbols.source:classpath:symbol-mappings.csv}") Resource source) {
        return SymbolRegistry.load(source);
    }
}
