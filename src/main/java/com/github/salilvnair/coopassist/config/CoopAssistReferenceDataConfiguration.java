package com.github.salilvnair.coopassist.config;

import com.github.salilvnair.coopassist.catalog.ProductCatalog;
import com.github.salilvnair.coopassist.data.PropertiesReferenceDataProvider;
import com.github.salilvnair.coopassist.data.ReferenceDataProvider;
import com.github.salilvnair.coopassist.engine.text.FillerStripper;
import com.github.salilvnair.coopassist.intent.DefaultIntentRules;
import com.github.salilvnair.coopassist.intent.IntentRuleTables;
import com.github.salilvnair.coopassist.policy.DefaultPolicyCategories;
import com.github.salilvnair.coopassist.policy.PolicyCategorizer;
import com.github.salilvnair.coopassist.policy.PolicyCategory;
import com.github.salilvnair.coopassist.policy.PolicyCorpus;
import com.github.salilvnair.coopassist.policy.TfIdfIndex;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Read-only tables built once at startup. Malformed data fails the bean creation and with it the startup.
 */
@Configuration(proxyBeanMethods = false)
public class CoopAssistReferenceDataConfiguration {

    @Bean
    @ConditionalOnMissingBean(ReferenceDataProvider.class)
    public ReferenceDataProvider referenceDataProvider(CoopAssistDataProperties properties) {
        return new PropertiesReferenceDataProvider(properties);
    }

    @Bean
    public ProductCatalog productCatalog(ReferenceDataProvider provider) {
        return new ProductCatalog(provider.products());
    }

    @Bean
    public PolicyCategorizer policyCategorizer(ReferenceDataProvider provider) {
        List<PolicyCategory> categories = provider.policyCategories();
        return new PolicyCategorizer(categories == null || categories.isEmpty()
                ? DefaultPolicyCategories.defaults()
                : categories);
    }

    @Bean
    public PolicyCorpus policyCorpus(ReferenceDataProvider provider, PolicyCategorizer categorizer) {
        return new PolicyCorpus(provider.policySections(), categorizer,
                provider.policyVersion(), provider.policyLastUpdated());
    }

    @Bean
    public TfIdfIndex policyTfIdfIndex(PolicyCorpus corpus) {
        return new TfIdfIndex(corpus.sentences());
    }

    @Bean
    @ConditionalOnMissingBean
    public FillerStripper fillerStripper() {
        return FillerStripper.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public IntentRuleTables intentRuleTables() {
        return DefaultIntentRules.tables();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock coopAssistClock() {
        return Clock.systemDefaultZone();
    }
}
