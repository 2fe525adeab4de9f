package com.globalai.backend.service.registry;

import com.globalai.backend.exception.UnmappedInstrumentException;
import com.globalai.backend.model.Broker;
import com.globalai.backend.model.BrokerSymbolMapping;
import com.globalai.backend.model.CanonicalInstrument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable ticker to broker listing table. Holds data only: adding a broker means adding rows.
 */
@Slf4j
public final class SymbolRegistry {

    private static final int COLUMNS = 5;

    private final Map<Key, BrokerSymbolMapping> mappings;

    private SymbolRegistry(Map<Key, BrokerSymbolMapping> mappings) {
        this.mappings = Collections.unmodifiableMap(mappings);
    }

    public static SymbolRegistry of(List<BrokerSymbolMapping> rows) {
        Map<Key, BrokerSymbolMapping> mappings = new LinkedHashMap<>();
        for (BrokerSymbolMapping row : rows) {
            Key key = new Key(normalize(row.ticker()), row.broker());
            if (mappings.putIfAbsent(key, row) != null) {
                throw new IllegalStateException("Duplicate symbol mapping for " + row.ticker() + "/" + row.broker());
            }
        }
        return new SymbolRegistry(mappings);
    }

    public static SymbolRegistry load(Resource source) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(source.getInputStream(), StandardCharsets.UTF_8))) {
            SymbolRegistry registry = of(parseCsv(reader));
            log.info("Loaded {} broker symbol mappings from {}", registry.size(), source.getDescription());
            return registry;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read symbol mappings from " + source.getDescription(), e);
        }
    }

    public BrokerSymbolMapping resolve(String ticker, Broker broker) {
        return find(ticker, broker).orElseThrow(() -> new UnmappedInstrumentException(ticker, broker));
    }

    public BrokerSymbolMapping resolve(CanonicalInstrument instrument, Broker broker) {
        return find(instrument.ticker(), broker).orElseThrow(() -> new UnmappedInstrumentException(instrument, broker));
    }

    public Optional<BrokerSymbolMapping> find(String ticker, Broker broker) {
        if (ticker == null || broker == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mappings.get(new Key(normalize(ticker), broker)));
    }

    public List<BrokerSymbolMapping> mappingsFor(Broker broker) {
        return mappings.values().stream()
                .filter(mapping -> mapping.broker() == broker)
                .toList();
    }

    public int size() {
        return mappings.size();
    }

    private static List<BrokerSymbolMapping> parseCsv(BufferedReader reader) throws IOException {
        List<BrokerSymbolMapping> rows = new ArrayList<>();
        String header = reader.readLine();
        if (header == null) {
            return rows;
        }
        String line;
        int lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank() || line.startsWith("#")) {
                continue;
            }
            String[] parts = line.split(",", -1);
            if (parts.length < COLUMNS) {
                throw new IllegalStateException("Malformed symbol mapping at line " + lineNumber + ": " + line);
            }
            rows.add(new BrokerSymbolMapping(
                    parts[0].trim().toUpperCase(Locale.ROOT),
                    Broker.valueOf(parts[1].trim().toUpperCase(Locale.ROOT)),
                    parts[2].trim(),
                    parts[3].trim().toUpperCase(Locale.ROOT),
                    parts[4].trim()
            ));
        }
        return rows;
    }

    private static String normalize(String ticker) {
        return ticker.trim().toUpperCase(Locale.ROOT);
    }

    private record Key(String ticker, Broker broker) {
    }
}
