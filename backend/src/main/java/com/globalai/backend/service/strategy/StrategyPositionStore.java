package com.globalai.backend.service.strategy;

import com.globalai.backend.config.AllocationProperties;
import com.globalai.backend.exception.NotFoundException;
import com.globalai.backend.exception.StrategyValidationException;
import com.globalai.backend.model.StrategyVersion;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Immutable strategy revisions keyed by (id, version). A registered version is never replaced.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StrategyPositionStore {

    private final AllocationProperties allocationProperties;
    private final StrategyDefinitionLoader loader = new StrategyDefinitionLoader();
    private final Map<String, NavigableMap<Integer, StrategyVersion>> versions = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        List<StrategyVersion> loaded = loader.load(allocationProperties.getStrategyLocations());
        loaded.forEach(this::register);
        if (find(allocationProperties.getDefaultStrategy()).isEmpty()) {
            throw new StrategyValidationException("Default strategy " + allocationProperties.getDefaultStrategy() + " was not loaded");
        }
        log.info("Strategy store ready with {} strategies", versions.size());
    }

    public void register(StrategyVersion strategy) {
        StrategyValidator.validate(strategy);
        NavigableMap<Integer, StrategyVersion> byVersion =
                versions.computeIfAbsent(strategy.id(), id -> new ConcurrentSkipListMap<>());
        if (byVersion.putIfAbsent(strategy.version(), strategy) != null) {
            throw new StrategyValidationException("Strategy " + strategy.id() + " v" + strategy.version() + " is already registered");
        }
    }

    public Optional<StrategyVersion> find(String id) {
        NavigableMap<Integer, StrategyVersion> byVersion = versions.get(id);
        if (byVersion == null || byVersion.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(byVersion.lastEntry().getValue());
    }

    public StrategyVersion latest(String id) {
        return find(id).orElseThrow(() -> new NotFoundException("Unknown strategy: " + id));
    }

    public StrategyVersion version(String id, int version) {
        return Optional.ofNullable(versions.get(id))
                .map(byVersion -> byVersion.get(version))
                .orElseThrow(() -> new NotFoundException("Unknown strategy version: " + id + " v" + version));
    }

    public StrategyVersion defaultStrategy() {
        return latest(allocationProperties.getDefaultStrategy());
    }

    public List<String> ids() {
        return versions.keySet().stream().sorted().toList();
    }
}
