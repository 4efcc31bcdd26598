package com.ironcage.gateway.config;

import com.ironcage.gateway.pricing.ModelPricing;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Model prices used for cost estimation and reconciliation.
 *
 * <pre>
 * gateway:
 *   pricing:
 *     defaults: { input-usd-per-million: 5.0, output-usd-per-million: 15.0, max-output-tokens: 4096 }
 *     models:
 *       gpt-4o: { input-usd-per-million: 2.5, output-usd-per-million: 10.0, max-output-tokens: 16384 }
 * </pre>
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "gateway.pricing")
public class PricingConfig {

    private Entry defaults = new Entry();

    private Map<String, Entry> models = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Entry {
        private double inputUsdPerMillion = 5.0;
        private double outputUsdPerMillion = 15.0;
        private int maxOutputTokens = 4096;

        public ModelPricing toPricing(String model) {
            return new ModelPricing(model, inputUsdPerMillion, outputUsdPerMillion, maxOutputTokens);
        }
    }
}
