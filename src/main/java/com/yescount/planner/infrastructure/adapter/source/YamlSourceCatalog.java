package com.yescount.planner.infrastructure.adapter.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.yescount.planner.domain.model.SourceTarget;
import com.yescount.planner.domain.port.out.SourceCatalog;
import com.yescount.planner.infrastructure.config.IngestionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Scraped-site list read from a YAML file with a top-level {@code sources:} list.
 * When the file does not exist the built-in list is used.
 */
@Component
public class YamlSourceCatalog implements SourceCatalog {

    private static final Logger logger = LoggerFactory.getLogger(YamlSourceCatalog.class);

    static final List<SourceTarget> DEFAULT_SOURCES = List.of(
            new SourceTarget("secretnyc", "https://secretnyc.co/", true, true),
            new SourceTarget("timeout_newyork", "https://www.timeout.com/newyork", true, true),
            new SourceTarget("hiddennyc", "https://hiddennyc.net/", true, true),
            new SourceTarget("untappedcities", "https://www.untappedcities.com/", true, true),
            new SourceTarget("anisah_immersive",
                    "https://anisahauduevans.com/new-york-immersive-experiences-nyc/", true, true),
            new SourceTarget("fever_newyork", "https://feverup.com/en/new-york", true, true));

    private final IngestionProperties properties;
    private final YAMLMapper yamlMapper;

    public YamlSourceCatalog(IngestionProperties properties) {
        this.properties = properties;
        this.yamlMapper = new YAMLMapper();
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public List<SourceTarget> loadSources() {
        Path path = Path.of(properties.getSitesConfigPath());
        if (!Files.exists(path)) {
            logger.debug("No source config at {}, using {} built-in sources", path, DEFAULT_SOURCES.size());
            return DEFAULT_SOURCES;
        }

        SourcesFile file;
        try {
            file = yamlMapper.readValue(path.toFile(), SourcesFile.class);
        } catch (IOException e) {
            logger.error("Unreadable source config {}: {}", path, e.getMessage());
            throw new UncheckedIOException("Failed to read source config " + path, e);
        }
        if (file == null || file.sources() == null) {
            return List.of();
        }

        List<SourceTarget> targets = file.sources().stream()
                .map(SourceEntry::toTarget)
                .filter(SourceTarget::isUsable)
                .toList();
        logger.debug("Loaded {} sources from {}", targets.size(), path);
        return targets;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SourcesFile(List<SourceEntry> sources) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SourceEntry(String name, String url, Boolean required, Boolean enabled) {

        SourceTarget toTarget() {
            return new SourceTarget(name, url, Boolean.TRUE.equals(required), !Boolean.FALSE.equals(enabled));
        }
    }
}
