package com.ryuqq.conductor.adapter.runner.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * conductor.yaml 로더.
 *
 * <p>파일 시스템을 먼저 찾고, 없으면 클래스패스에서 읽습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EngineConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);

    public static final String DEFAULT_LOCATION = "conductor.yaml";

    private final Path configPath;
    private final Yaml yaml;

    public EngineConfigLoader() {
        this(DEFAULT_LOCATION);
    }

    public EngineConfigLoader(String configPath) {
        if (configPath == null || configPath.isBlank()) {
            throw new IllegalArgumentException("configPath cannot be null or blank");
        }
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(EngineProperties.class, new LoaderOptions()));
    }

    /**
     * 설정 로드.
     *
     * @return 설정 (값 검증 전)
     * @throws ConfigurationException 파일이 없거나 YAML이 잘못된 경우
     */
    public EngineProperties load() {
        // 1. 파일 시스템
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream in = Files.newInputStream(configPath)) {
                return parse(in, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        // 2. 클래스패스
        String resource = configPath.toString().replace('\\', '/');
        if (resource.startsWith("/")) {
            resource = resource.substring(1);
        }
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                log.info("Loading configuration from classpath: {}", resource);
                return parse(in, resource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + resource, e);
        }
        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    /**
     * 스트림에서 로드.
     *
     * @param in YAML 입력
     * @return 설정
     */
    public EngineProperties loadFromStream(InputStream in) {
        return parse(in, "stream");
    }

    private EngineProperties parse(InputStream in, String source) {
        try {
            EngineProperties loaded = yaml.load(in);
            return loaded == null ? new EngineProperties() : loaded;
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * 설정 로드 실패.
     */
    public static class ConfigurationException extends RuntimeException {

        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
