package com.researchbot.app;

import com.researchbot.app.properties.SessionProperties;
import com.researchbot.config.Config;
import com.researchbot.core.FailureKind;
import com.researchbot.core.ResearchException;
import com.researchbot.memory.MemoryBank;
import com.researchbot.pipeline.ResearchSystem;
import com.researchbot.session.SessionManager;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.core.env.AbstractEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ResearchBotBootstrapConfigTest {
    private final ResearchBotBootstrapConfig bootstrap = new ResearchBotBootstrapConfig();

    @Test
    void researchBotConfig_shouldExposeBoundPropertiesAsOverrides() {
        Map<String, Object> props = new HashMap<>();
        props.put("outputs.dir", "custom-out");
        props.put("news.lang", "de");
        AbstractEnvironment env = environment(props);

        Config config = bootstrap.researchBotConfig(env);

        assertEquals("custom-out", config.getString("outputs.dir"));
        assertEquals("de", config.getString("news.lang"));
        assertEquals("override", config.sourceOf("news.lang"));
        assertEquals("US", config.getString("news.region"));
    }

    @Test
    void sessionProperties_shouldBindFromEnvironment() {
        Map<String, Object> props = new HashMap<>();
        props.put("session.timeout_sec", "120");
        props.put("session.max-concurrent", "3");

        SessionProperties bound = Binder.get(environment(props))
                .bind("session", Bindable.of(SessionProperties.class))
                .orElseGet(SessionProperties::new);

        assertEquals(120, bound.getTimeoutSec());
        assertEquals(3, bound.getMaxConcurrent());
    }

    @Test
    void sessionManager_shouldHonorConfiguredCapacity() {
        SessionProperties props = new SessionProperties();
        props.setTimeoutSec(60);
        props.setMaxConcurrent(1);

        SessionManager manager = bootstrap.sessionManager(props);
        manager.createSession();

        assertEquals(FailureKind.CAPACITY_EXCEEDED,
                assertThrows(ResearchException.class, manager::createSession).kind());
    }

    @Test
    void researchSystem_shouldShareSessionsAndMemoryBank(@TempDir Path dir) {
        Config config = Config.fromConfigurationProperties(dir, Map.of("memory", Map.of("path", "mem/bank.json")));
        SessionManager sessions = bootstrap.sessionManager(new SessionProperties());
        MemoryBank bank = bootstrap.memoryBank(config);

        try (ResearchSystem system = bootstrap.researchSystem(config, sessions, bank)) {
            assertSame(sessions, system.sessions());
            assertSame(bank, system.memoryBank());
            assertEquals(dir.resolve("mem/bank.json"), bank.storagePath());
        }
    }

    private static AbstractEnvironment environment(Map<String, Object> props) {
        AbstractEnvironment env = new AbstractEnvironment() {
        };
        env.getPropertySources().addFirst(new MapPropertySource("test", props));
        return env;
    }
}
