package io.histingest.market.extract;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Extractors by provider name, resolved when a job is configured.
 */
public class ExtractorRegistry {
    private final Map<String, Extractor> extractors = new ConcurrentHashMap<>();

    public ExtractorRegistry register(Extractor extractor) {
        Extractor previous = extractors.putIfAbsent(extractor.provider(), extractor);
        if (previous != null) {
            throw new IllegalStateException("provider '" + extractor.provider() + "' is already registered");
        }
        return this;
    }

    public Optional<Extractor> resolve(String provider) {
        if (provider == null) return Optional.empty();
        return Optional.ofNullable(extractors.get(provider));
    }

    public Set<String> providers() { return new TreeSet<>(extractors.keySet()); }
}
