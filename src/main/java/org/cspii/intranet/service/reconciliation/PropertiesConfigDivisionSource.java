package org.cspii.intranet.service.reconciliation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Reads the canonical divisions from a UTF-8 properties file, one
 * {@code machine-name=Display Name} line per division.
 */
@Slf4j
@Component
public class PropertiesConfigDivisionSource implements ConfigDivisionSource {

    private final Resource divisionsFile;

    public PropertiesConfigDivisionSource(
            @Value("${app.hierarchy.divisions-file:classpath:divisions.properties}") Resource divisionsFile) {
        this.divisionsFile = divisionsFile;
    }

    @Override
    public Map<String, String> loadDivisions() {
        if (!divisionsFile.exists()) {
            log.warn("Divisions file {} not found, treating configuration as empty", divisionsFile.getDescription());
            return Map.of();
        }

        Properties properties = new Properties();
        try (Reader reader = new InputStreamReader(divisionsFile.getInputStream(), StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read divisions file " + divisionsFile.getDescription(), e);
        }

        Map<String, String> divisions = new TreeMap<>();
        properties.stringPropertyNames().forEach(name -> divisions.put(name, properties.getProperty(name).trim()));
        log.info("Loaded {} configured divisions from {}", divisions.size(), divisionsFile.getDescription());
        return divisions;
    }
}
