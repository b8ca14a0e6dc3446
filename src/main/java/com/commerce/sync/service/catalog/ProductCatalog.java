package com.commerce.sync.service.catalog;

import com.commerce.sync.domain.PricingTerms;
import com.commerce.sync.domain.ResourceKey;

import java.util.List;

/**
 * Which resources are kept in sync, and how their target prices are derived.
 */
public interface ProductCatalog {

    List<ResourceKey> activeResourceKeys();

    PricingTerms pricingTermsFor(ResourceKey resourceKey);
}
