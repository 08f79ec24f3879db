package com.researchbot.app;

import com.researchbot.app.properties.SessionProperties;
import com.researchbot.config.Config;
import com.researchbot.memory.MemoryBank;
import com.researchbot.pipeline.ResearchSystem;
import com.researchbot.session.SessionManager;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(SessionProperties.class)
public class ResearchBotBootstrapConfig {

    @Bean
    public Config researchBotConfig(Environment environment) {
        Map<String, Object> rawProperties = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, rawProperties);
    }

    @Bean
    public SessionManager sessionManager(SessionProperties sessionProperties) {
        return new SessionManager(
                Duration.ofSeconds(Math.max(1, sessionProperties.getTimeoutSec())),
                Math.max(1, sessionProperties.getMaxConcurrent())
        );
    }

    @Bean
    @Lazy
    public MemoryBank memoryBank(Config config) {
        Path path = config.getPath("memory.path");
        return path == null ? new MemoryBank() : MemoryBank.open(path);
    }

    @Bean(destroyMethod = "close")
    @Lazy
    public ResearchSystem researchSystem(Config config, SessionManager sessionManager, MemoryBank memoryBank) {
        return ResearchSystem.fromConfig(config, sessionManager, memoryBank);
    }
}
