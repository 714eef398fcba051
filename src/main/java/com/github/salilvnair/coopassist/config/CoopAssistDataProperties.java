package com.github.salilvnair.coopassist.config;

import com.github.salilvnair.coopassist.catalog.Product;
import com.github.salilvnair.coopassist.policy.PolicyCategory;
import com.github.salilvnair.coopassist.policy.PolicySection;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Catalog and policy text bound from {@code coopassist.data}. Empty policy categories mean the built-in set.
 */
@Component
@ConfigurationProperties(prefix = "coopassist.data")
@Getter
@Setter
public class CoopAssistDataProperties {

    private List<Product> products = new ArrayList<>();
    private List<PolicySection> policySections = new ArrayList<>();
    private List<PolicyCategory> policyCategories = new ArrayList<>();
    private String policyVersion;
    private String policyLastUpdated;
}
