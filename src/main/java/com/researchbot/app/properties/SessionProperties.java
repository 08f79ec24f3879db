package com.researchbot.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "session")
public class SessionProperties {
    private int timeoutSec = 3600;
    private int maxConcurrent = 10;
}
