package com.isolend.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Rate models registered at startup, keyed by the name pools reference them by.
 * Properties are read from the {@code isolend.irm} prefix.
 *
 * <pre>
 * isolend:
 *   irm:
 *     models:
 *       fixed-5:
 *         type: FIXED
 *         rate: 0.05
 *       linear-2-50:
 *         type: LINEAR
 *         min-rate: 0.02
 *         max-rate: 0.5
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "isolend.irm")
@Getter
@Setter
public class RateModelConfig {

    private Map<String, Definition> models = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Definition {

        private Type type = Type.FIXED;

        /** Annual rate for {@link Type#FIXED}, as a decimal fraction. */
        private String rate = "0";

        /** Rate at zero utilization for {@link Type#LINEAR}. */
        private String minRate = "0";

        /** Rate at full utilization for {@link Type#LINEAR}. */
        private String maxRate = "0";
    }

    public enum Type {
        FIXED,
        LINEAR
    }
}
