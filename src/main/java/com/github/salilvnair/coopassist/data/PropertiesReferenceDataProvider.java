package com.github.salilvnair.coopassist.data;

import com.github.salilvnair.coopassist.catalog.Product;
import com.github.salilvnair.coopassist.config.CoopAssistDataProperties;
import com.github.salilvnair.coopassist.policy.PolicyCategory;
import com.github.salilvnair.coopassist.policy.PolicySection;
import lombok.RequiredArgsConstructor;

import java.util.List;

@RequiredArgsConstructor
public class PropertiesReferenceDataProvider implements ReferenceDataProvider {

    private final CoopAssistDataProperties properties;

    @Override
    public List<Product> products() {
        return properties.getProducts();
    }

    @Override
    public List<PolicySection> policySections() {
        return properties.getPolicySections();
    }

    @Override
    public List<PolicyCategory> policyCategories() {
        return properties.getPolicyCategories();
    }

    @Override
    public String policyVersion() {
        return properties.getPolicyVersion();
    }

    @Override
    public String policyLastUpdated() {
        return properties.getPolicyLastUpdated();
    }
}
