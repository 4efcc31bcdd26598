package com.ironcage.gateway.pricing;

import com.ironcage.gateway.config.PricingConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Model price lookup, loaded from {@code gateway.pricing}.
 * Entries without a positive input or output price are skipped; unknown models
 * fall back to the configured default pricing.
 */
@Slf4j
public class PricingCatalog {

    private final Map<String, ModelPricing> models;
    private final ModelPricing defaultPricing;

    public PricingCatalog(Map<String, ModelPricing> models, ModelPricing defaultPricing) {
        Map<String, ModelPricing> valid = new HashMap<>();
        models.forEach((name, pricing) -> {
            if (pricing.hasValidPricing()) {
                valid.put(name, pricing);
            } else {
                log.warn("Skipping model {} without valid pricing", name);
            }
        });
        this.models = Collections.unmodifiableMap(valid);
        this.defaultPricing = defaultPricing;
    }

    public static PricingCatalog fromConfig(PricingConfig config) {
        Map<String, ModelPricing> models = new HashMap<>();
        config.getModels().forEach((name, entry) -> models.put(name, entry.toPricing(name)));
        return new PricingCatalog(models, config.getDefaults().toPricing("default"));
    }

    public ModelPricing pricingFor(String model) {
        ModelPricing pricing = models.get(model);
        if (pricing == null) {
            log.debug("No pricing for model {}, using default", model);
            return defaultPricing;
        }
        return pricing;
    }

    public int size() {
        return models.size();
    }
}
