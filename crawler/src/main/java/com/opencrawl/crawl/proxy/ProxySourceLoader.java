package com.opencrawl.crawl.proxy;

import com.opencrawl.config.ProxySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ProxySourceLoader {
    private static final Logger log = LoggerFactory.getLogger(ProxySourceLoader.class);

    private ProxySourceLoader() {
    }

    public static List<ProxyAddress> load(ProxySettings settings) {
        List<String> entries = new ArrayList<>();
        for (String address : settings.addresses()) {
            entries.addAll(splitCommaSeparated(address));
        }
        if (settings.file() != null && !settings.file().isBlank()) {
            entries.addAll(readLines(Path.of(settings.file().trim())));
        }
        return parseEntries(entries);
    }

    /**
     * Accepts either a path to a proxy file or a comma-separated list of entries.
     */
    public static List<ProxyAddress> fromSource(String source) {
        if (source == null || source.isBlank()) {
            return List.of();
        }
        Path candidate;
        try {
            candidate = Path.of(source.trim());
        } catch (RuntimeException e) {
            candidate = null;
        }
        if (candidate != null && Files.isRegularFile(candidate)) {
            return parseEntries(readLines(candidate));
        }
        return parseEntries(splitCommaSeparated(source));
    }

    public static List<ProxyAddress> parseEntries(Collection<String> entries) {
        Map<String, ProxyAddress> unique = new LinkedHashMap<>();
        for (String entry : entries) {
            if (entry == null) {
                continue;
            }
            String value = entry.trim();
            if (value.isEmpty() || value.startsWith("#")) {
                continue;
            }
            try {
                ProxyAddress address = ProxyAddress.parse(value);
                unique.putIfAbsent(address.key(), address);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping proxy entry: {}", e.getMessage());
            }
        }
        return List.copyOf(unique.values());
    }

    static List<String> readLines(Path file) {
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read proxy file " + file, e);
        }
    }

    private static List<String> splitCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }
}
