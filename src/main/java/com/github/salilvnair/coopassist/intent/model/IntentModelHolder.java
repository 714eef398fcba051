package com.github.salilvnair.coopassist.intent.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.coopassist.config.CoopAssistFlowConfig;
import com.github.salilvnair.coopassist.engine.exception.CoopAssistException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Holds the statistical intent model. A host-provided {@link StatisticalIntentModel} bean wins over the
 * bundled naive Bayes artifact. Absence is a supported mode: the classifier then runs on rules only.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class IntentModelHolder {

    private final CoopAssistFlowConfig flowConfig;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final ObjectProvider<StatisticalIntentModel> externalModel;

    private volatile StatisticalIntentModel model;

    @PostConstruct
    public void init() {
        StatisticalIntentModel provided = externalModel.getIfAvailable();
        if (provided != null) {
            model = provided;
            log.info("Co-op Assist: using provided statistical intent model version={}", provided.version());
            return;
        }
        if (!flowConfig.getIntent().isModelEnabled()) {
            log.info("Co-op Assist: statistical intent model disabled, classifier runs rule-only.");
            return;
        }
        model = load(flowConfig.getIntent().getModelLocation()).orElse(null);
    }

    public Optional<StatisticalIntentModel> current() {
        return Optional.ofNullable(model);
    }

    public boolean isAvailable() {
        return model != null;
    }

    Optional<StatisticalIntentModel> load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Co-op Assist: intent model artifact not found at {}, classifier runs rule-only.", location);
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            NaiveBayesArtifact artifact = objectMapper.readValue(in, NaiveBayesArtifact.class);
            NaiveBayesIntentModel loaded = new NaiveBayesIntentModel(artifact);
            log.info("Co-op Assist: loaded intent model version={} from {}", loaded.version(), location);
            return Optional.of(loaded);
        } catch (IOException | CoopAssistException ex) {
            log.warn("Co-op Assist: intent model artifact at {} is unreadable, classifier runs rule-only. cause={}",
                    location, ex.getMessage());
            return Optional.empty();
        } catch (RuntimeException ex) {
            log.warn("Co-op Assist: intent model artifact at {} could not be built, classifier runs rule-only.",
                    location, ex);
            return Optional.empty();
        }
    }
}
