package com.irledger.infrastructure.config;

import com.irledger.application.service.TerminalTransitionPolicy;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AppConfig
 */
class AppConfigTest {

    @Test
    void loadYaml_readsBundledConfiguration() {
        AppConfig config = new AppConfig(AppConfig.loadYaml(AppConfig.DEFAULT_RESOURCE));

        assertEquals(8081, config.httpPort());
        assertEquals("memory", config.storeType());
        assertEquals("investor_ledger", config.mongoConfig().getString("db_name"));
        assertEquals(5, config.creditMaxAttempts());
        assertEquals(TerminalTransitionPolicy.REJECT, config.terminalTransitionPolicy());
        assertEquals(100, config.previewLength());
        assertEquals("admin@example.com", config.adminEmail());
        assertEquals("admin_fallback", config.fallbackAdmin().id());
    }

    @Test
    void loadYaml_missingResource_fails() {
        assertThrows(IllegalStateException.class, () -> AppConfig.loadYaml("missing.yml"));
    }

    @Test
    void emptyConfig_usesDefaults() {
        AppConfig config = new AppConfig(new JsonObject());

        assertEquals(8080, config.httpPort());
        assertEquals("memory", config.storeType());
        assertEquals("mongodb://localhost:27017", config.mongoConfig().getString("connection_string"));
        assertEquals(TerminalTransitionPolicy.REJECT, config.terminalTransitionPolicy());
        assertEquals("Administrator", config.fallbackAdmin().name());
    }

    @Test
    void terminalTransitionPolicy_readsIgnore() {
        AppConfig config = new AppConfig(new JsonObject()
                .put("withdrawals", new JsonObject().put("terminal_transition_policy", "IGNORE")));

        assertEquals(TerminalTransitionPolicy.IGNORE, config.terminalTransitionPolicy());
    }
}
