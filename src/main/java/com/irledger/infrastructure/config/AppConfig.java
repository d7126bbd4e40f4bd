package com.irledger.infrastructure.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.irledger.application.service.TerminalTransitionPolicy;
import com.irledger.domain.model.Participant;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Typed view of the application configuration (application.yml)
 */
@Slf4j
public class AppConfig {

    public static final String DEFAULT_RESOURCE = "application.yml";

    private static final int DEFAULT_PORT = 8080;
    private static final int DEFAULT_CREDIT_MAX_ATTEMPTS = 5;
    private static final int DEFAULT_PREVIEW_LENGTH = 100;

    private final JsonObject config;

    public AppConfig(JsonObject config) {
        this.config = config;
    }

    /**
     * Parse a YAML resource from the classpath into a JsonObject
     */
    public static JsonObject loadYaml(String resource) {
        try (InputStream is = AppConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " not found in classpath");
            }
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            Map<String, Object> values = yamlMapper.readValue(is, new TypeReference<Map<String, Object>>() {});
            log.info("Loaded configuration from {}", resource);
            return new JsonObject(values);
        } catch (IOException e) {
            throw new IllegalStateException("Configuration error: cannot read " + resource, e);
        }
    }

    public JsonObject asJson() {
        return config;
    }

    public int httpPort() {
        return section("http").getInteger("port", DEFAULT_PORT);
    }

    public String storeType() {
        return section("store").getString("type", "memory");
    }

    /**
     * Vert.x Mongo client options
     */
    public JsonObject mongoConfig() {
        JsonObject mongo = section("store").getJsonObject("mongo", new JsonObject());
        return new JsonObject()
                .put("connection_string", mongo.getString("connection_string", "mongodb://localhost:27017"))
                .put("db_name", mongo.getString("db_name", "investor_ledger"));
    }

    public int creditMaxAttempts() {
        return section("ledger").getInteger("credit_max_attempts", DEFAULT_CREDIT_MAX_ATTEMPTS);
    }

    public TerminalTransitionPolicy terminalTransitionPolicy() {
        return TerminalTransitionPolicy.fromValue(
                section("withdrawals").getString("terminal_transition_policy", TerminalTransitionPolicy.REJECT.getValue()));
    }

    public int previewLength() {
        return section("messaging").getInteger("preview_length", DEFAULT_PREVIEW_LENGTH);
    }

    public String adminEmail() {
        return section("messaging").getString("admin_email", "");
    }

    /**
     * Counter-party used for new conversations when the designated admin account cannot be found
     */
    public Participant fallbackAdmin() {
        JsonObject messaging = section("messaging");
        return new Participant(
                messaging.getString("fallback_admin_id", "admin_fallback"),
                messaging.getString("fallback_admin_name", "Administrator"));
    }

    private JsonObject section(String name) {
        return config.getJsonObject(name, new JsonObject());
    }
}
