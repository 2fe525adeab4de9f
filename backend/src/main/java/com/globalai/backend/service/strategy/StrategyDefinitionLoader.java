package com.globalai.backend.service.strategy;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.globalai.backend.exception.StrategyValidationException;
import com.globalai.backend.model.StrategyVersion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads strategy definitions from JSON resources and validates each one. Any invalid file
 * aborts loading.
 */
@Slf4j
public class StrategyDefinitionLoader {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);
    private final ResourcePatternResolver resolver;

    public StrategyDefinitionLoader() {
        this(new PathMatchingResourcePatternResolver());
    }

    public StrategyDefinitionLoader(ResourcePatternResolver resolver) {
        this.resolver = resolver;
    }

    public List<StrategyVersion> load(String locationPattern) {
        Resource[] resources;
        try {
            resources = resolver.getResources(locationPattern);
        } catch (IOException e) {
            throw new StrategyValidationException("Cannot list strategy definitions at " + locationPattern, e);
        }
        List<Resource> ordered = new ArrayList<>(List.of(resources));
        ordered.sort(Comparator.comparing(resource -> String.valueOf(resource.getFilename())));
        List<StrategyVersion> strategies = new ArrayList<>();
        for (Resource resource : ordered) {
            strategies.add(read(resource));
        }
        return strategies;
    }

    public StrategyVersion read(Resource resource) {
        StrategyVersion strategy;
        try (InputStream in = resource.getInputStream()) {
            strategy = objectMapper.readValue(in, StrategyVersion.class);
        } catch (IOException e) {
            throw new StrategyValidationException("Unreadable strategy definition " + resource.getFilename() + ": " + e.getMessage(), e);
        }
        if (strategy == null) {
            throw new StrategyValidationException("Empty strategy definition " + resource.getFilename());
        }
        StrategyValidator.validate(strategy);
        log.info("Loaded strategy {} v{} ({} positions) from {}",
                strategy.id(), strategy.version(), strategy.positions().size(), resource.getFilename());
        return strategy;
    }
}
