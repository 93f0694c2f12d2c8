package com.example.osr.infrastructure.config;

import com.example.osr.application.service.LifecycleSettings;
import com.example.osr.domain.document.DocumentSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration bound from the {@code osr.*} properties.
 */
@ConfigurationProperties(prefix = "osr")
public record OsrProperties(
        @DefaultValue("OSR1") String osrId,
        @DefaultValue("false") boolean dryRun,
        @DefaultValue Gateway gateway,
        @DefaultValue Document document,
        @DefaultValue History history,
        @DefaultValue Catalog catalog
) {

    /**
     * HTTP gateway in front of the OSR host interface.
     */
    public record Gateway(
            @DefaultValue("http://localhost:8090") String baseUrl,
            @DefaultValue("2s") Duration connectTimeout,
            @DefaultValue("10s") Duration callTimeout
    ) {
    }

    /**
     * @param orderPrefix   prefix of every remote order number
     * @param capacitySpecs compartment type to maximum quantity, announced with goods-in orders
     */
    public record Document(
            @DefaultValue(DocumentSettings.DEFAULT_PREFIX) String orderPrefix,
            Map<String, Integer> capacitySpecs
    ) {
        public DocumentSettings toSettings() {
            return new DocumentSettings(orderPrefix, capacitySpecs);
        }
    }

    /**
     * @param retention       age after which records are purged automatically, or null to keep them
     * @param purgeIntervalMs delay between automatic purges
     */
    public record History(
            Duration retention,
            @DefaultValue("3600000") long purgeIntervalMs
    ) {
    }

    public record Catalog(@DefaultValue("false") boolean enabled) {
    }

    public LifecycleSettings toLifecycleSettings() {
        return new LifecycleSettings(osrId, gateway.callTimeout(), dryRun);
    }
}
