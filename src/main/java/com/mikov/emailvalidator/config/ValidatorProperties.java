package com.mikov.emailvalidator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code validator.*} keys of application.yml.
 *
 * @author zahari.mikov
 */
@Data
@ConfigurationProperties(prefix = "validator")
public class ValidatorProperties {

    private Dns dns = new Dns();
    private Batch batch = new Batch();
    private Lists lists = new Lists();

    @Data
    public static class Dns {
        /**
         * TTL of a priority 3 entry; other priorities scale it by powers of the golden ratio.
         */
        private Duration baseTtl = Duration.ofHours(1);
        private int cacheCapacity = 1000;
        private List<String> servers = new ArrayList<>(List.of("8.8.8.8", "1.1.1.1"));
        private Duration timeout = Duration.ofSeconds(3);
        private int lookupThreads = 8;
        private Duration cleanupInterval = Duration.ofMinutes(10);
    }

    @Data
    public static class Batch {
        private Duration itemTimeout = Duration.ofMillis(1618);
        private Duration interBatchDelay = Duration.ofMillis(62);
        private int maxEmails = 1000;
        private int schedulerThreads = 2;
        private int sinkThreads = 2;
    }

    @Data
    public static class Lists {
        private Duration refreshInterval = Duration.ofHours(6);
    }
}
