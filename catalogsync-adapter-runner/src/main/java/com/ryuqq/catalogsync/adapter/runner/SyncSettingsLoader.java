package com.ryuqq.catalogsync.adapter.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.ryuqq.catalogsync.core.catalog.CatalogSettings;
import com.ryuqq.catalogsync.core.protection.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * YAML 설정 파일을 {@link SyncSettings}로 읽기.
 *
 * <p>문자열 값의 {@code ${VAR:default}}는 환경 변수로 치환합니다. 변수가 없으면 default,
 * default도 없으면 빈 문자열입니다. 없는 섹션이나 항목은 기본값을 씁니다.</p>
 *
 * <pre>
 * catalog:
 *   vendor: ${CATALOG_VENDOR:Charles Colvard}
 *   status: ACTIVE
 *   max_options: 3
 *   max_title_length: 255
 *   max_handle_length: 255
 * processing:
 *   concurrency: 4
 *   bulk_threshold: 10
 *   max_retries: 3                 # 최초 시도 제외 재시도 횟수
 *   retry_delay_ms: 1000
 *   retry_max_delay_ms: 300000
 *   retry_jitter: 0.1
 *   rate_limit_per_second: 2
 *   rate_limit_burst: 2
 *   bulk_poll_interval_ms: 1000
 *   bulk_timeout_ms: 600000
 *   shutdown_timeout_seconds: 60
 * </pre>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class SyncSettingsLoader {

    private static final Logger log = LoggerFactory.getLogger(SyncSettingsLoader.class);

    private static final Pattern ENV_REFERENCE = Pattern.compile("\\$\\{([^:}]+)(?::([^}]*))?}");

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Function<String, String> environment;

    public SyncSettingsLoader() {
        this(System::getenv);
    }

    /**
     * @param environment 환경 변수 조회 함수 (없으면 null 반환)
     */
    public SyncSettingsLoader(Function<String, String> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        this.environment = environment;
    }

    public SyncSettings load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            log.info("Loading sync settings from {}", path);
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read settings file " + path, e);
        }
    }

    /**
     * @throws UncheckedIOException YAML을 읽을 수 없는 경우
     * @throws IllegalArgumentException 값이 설정 제약을 위반한 경우
     */
    public SyncSettings load(InputStream in) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse settings YAML", e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new SyncSettings();
        }
        root = substitute(root);

        SyncSettings defaults = new SyncSettings();
        JsonNode catalogNode = root.path("catalog");
        CatalogSettings catalogDefaults = defaults.catalog();
        CatalogSettings catalog = new CatalogSettings(
            text(catalogNode, "vendor", catalogDefaults.vendor()),
            text(catalogNode, "status", catalogDefaults.status()),
            catalogNode.path("max_title_length").asInt(catalogDefaults.maxTitleLength()),
            catalogNode.path("max_handle_length").asInt(catalogDefaults.maxHandleLength()),
            catalogNode.path("max_options").asInt(catalogDefaults.maxOptions())
        );

        JsonNode processing = root.path("processing");
        SyncRunnerConfig runnerDefaults = defaults.runner();
        int maxRetries = processing.path("max_retries").asInt(runnerDefaults.maxAttempts() - 1);
        SyncRunnerConfig runner = new SyncRunnerConfig(
            processing.path("concurrency").asInt(runnerDefaults.concurrency()),
            processing.path("bulk_threshold").asInt(runnerDefaults.bulkThreshold()),
            maxRetries + 1,
            processing.path("bulk_poll_interval_ms").asLong(runnerDefaults.bulkPollIntervalMs()),
            processing.path("bulk_timeout_ms").asLong(runnerDefaults.bulkTimeoutMs()),
            processing.path("shutdown_timeout_seconds").asLong(runnerDefaults.shutdownTimeoutSeconds())
        );

        RateLimiterConfig limiterDefaults = defaults.rateLimiter();
        RateLimiterConfig rateLimiter = new RateLimiterConfig(
            processing.path("rate_limit_per_second").asDouble(limiterDefaults.permitsPerSecond()),
            processing.path("rate_limit_burst").asInt(limiterDefaults.maxBurstSize())
        );

        return new SyncSettings(
            catalog,
            runner,
            rateLimiter,
            processing.path("retry_delay_ms").asLong(defaults.retryBaseDelayMs()),
            processing.path("retry_max_delay_ms").asLong(defaults.retryMaxDelayMs()),
            processing.path("retry_jitter").asDouble(defaults.retryJitterFactor())
        );
    }

    /**
     * 트리의 모든 문자열 값에서 환경 변수 참조를 치환한 사본.
     */
    JsonNode substitute(JsonNode node) {
        if (node.isTextual()) {
            return TextNode.valueOf(expand(node.textValue()));
        }
        if (node.isObject()) {
            ObjectNode copy = yamlMapper.createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), substitute(field.getValue()));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = yamlMapper.createArrayNode();
            for (JsonNode element : node) {
                copy.add(substitute(element));
            }
            return copy;
        }
        return node;
    }

    String expand(String text) {
        Matcher matcher = ENV_REFERENCE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = environment.apply(matcher.group(1));
            if (value == null) {
                value = matcher.group(2) == null ? "" : matcher.group(2);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String text(JsonNode section, String field, String defaultValue) {
        JsonNode node = section.path(field);
        if (node.isMissingNode() || node.isNull() || node.asText().isBlank()) {
            return defaultValue;
        }
        return node.asText();
    }
}
