package com.vision_assistant_service.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Reads the list of detector classes worth alerting on: one label per line, blank lines
 * and {@code #} comments ignored. Startup fails if the list is missing or empty.
 */
final class RelevantClassesLoader {

    private RelevantClassesLoader() {
    }

    static Set<String> load(ResourceLoader resourceLoader, String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Relevant class list not found: " + location);
        }
        Set<String> classes = new LinkedHashSet<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String label = line.trim();
                if (!label.isEmpty() && !label.startsWith("#")) {
                    classes.add(label.toLowerCase(Locale.ROOT));
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Could not read relevant class list " + location, e);
        }
        if (classes.isEmpty()) {
            throw new IllegalStateException("Relevant class list is empty: " + location);
        }
        return classes;
    }
}
