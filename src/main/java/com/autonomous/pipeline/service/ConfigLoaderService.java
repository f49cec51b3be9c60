package com.autonomous.pipeline.service;

import com.autonomous.pipeline.exception.ConfigurationException;
import com.autonomous.pipeline.model.ProjectConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads the project configuration. The directory holding the config file is the project root.
 */
@Slf4j
@Service
public class ConfigLoaderService {

    static final String LEGACY_PIPELINE_NAME = "default";

    @Value("${agent.config.path:pipeline-agent.yaml}")
    private String configPath = "pipeline-agent.yaml";

    private final ObjectMapper yamlMapper;

    public ConfigLoaderService() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public void setConfigPath(String path) {
        this.configPath = path;
    }

    public ProjectConfig load() {
        return load(Paths.get(configPath));
    }

    public ProjectConfig load(Path file) {
        Path configFile = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(configFile)) {
            throw new ConfigurationException("Config file not found: " + configFile);
        }

        ProjectConfig config;
        try {
            config = yamlMapper.readValue(configFile.toFile(), ProjectConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load config from " + configFile + ": " + e.getMessage(), e);
        }
        if (config == null) {
            config = new ProjectConfig();
        }
        config.setProjectRoot(configFile.getParent());

        if (config.getPipeline() != null && !config.getPipeline().isEmpty()) {
            if (config.getPipelines().isEmpty()) {
                log.warn("The single 'pipeline' setting is deprecated; loading it as pipeline '{}'.", LEGACY_PIPELINE_NAME);
                config.getPipelines().put(LEGACY_PIPELINE_NAME, config.getPipeline());
            } else {
                log.warn("Both 'pipeline' and 'pipelines' are set; ignoring 'pipeline'.");
            }
            config.setPipeline(null);
        }
        if (config.getDefaultPipeline() == null && !config.getPipelines().isEmpty()) {
            config.setDefaultPipeline(config.getPipelines().keySet().iterator().next());
        }

        log.info("Loaded config from {} ({} pipelines)", configFile, config.getPipelines().size());
        return config;
    }
}
