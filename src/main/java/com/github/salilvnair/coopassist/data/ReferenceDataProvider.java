package com.github.salilvnair.coopassist.data;

import com.github.salilvnair.coopassist.catalog.Product;
import com.github.salilvnair.coopassist.policy.PolicyCategory;
import com.github.salilvnair.coopassist.policy.PolicySection;

import java.util.List;

/**
 * Source of the read-only tables loaded at startup. Replace the default bean to read them from elsewhere.
 */
public interface ReferenceDataProvider {

    List<Product> products();

    List<PolicySection> policySections();

    default List<PolicyCategory> policyCategories() {
        return List.of();
    }

    String policyVersion();

    String policyLastUpdated();
}
