package com.commerce.sync.service.catalog;

import com.commerce.sync.domain.PricingTerms;
import com.commerce.sync.domain.ResourceKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Currency;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Catalog backed by application configuration: a fixed list of resource keys sharing one set
 * of pricing terms.
 */
@Service
@Slf4j
public class ConfiguredProductCatalog implements ProductCatalog {

    private final List<ResourceKey> resourceKeys;
    private final PricingTerms pricingTerms;

    public ConfiguredProductCatalog(
            @Value("${sync.catalog.resource-keys:}") String resourceKeys,
            @Value("${sync.pricing.exchange-rate:1}") BigDecimal exchangeRate,
            @Value("${sync.pricing.margin-multiplier:1}") BigDecimal marginMultiplier,
            @Value("${sync.pricing.target-currency:USD}") String targetCurrency) {
        this.resourceKeys = List.copyOf(Arrays.stream(resourceKeys.split(","))
                .filter(raw -> !raw.isBlank())
                .map(ResourceKey::of)
                .collect(Collectors.toCollection(LinkedHashSet::new)));
        this.pricingTerms = PricingTerms.builder()
                .exchangeRate(exchangeRate)
                .marginMultiplier(marginMultiplier)
                .targetCurrency(Currency.getInstance(targetCurrency))
                .build();
        log.info("Catalog configured with {} resource key(s), exchange rate {}, margin {}, target currency {}",
                this.resourceKeys.size(), exchangeRate, marginMultiplier, targetCurrency);
    }

    @Override
    public List<ResourceKey> activeResourceKeys() {
        return resourceKeys;
    }

    @Override
    public PricingTerms pricingTermsFor(ResourceKey resourceKey) {
        return pricingTerms;
    }
}
