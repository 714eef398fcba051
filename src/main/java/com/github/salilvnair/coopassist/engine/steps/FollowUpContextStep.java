package com.github.salilvnair.coopassist.engine.steps;

import com.github.salilvnair.coopassist.config.CoopAssistFlowConfig;
import com.github.salilvnair.coopassist.engine.model.ProductCandidate;
import com.github.salilvnair.coopassist.engine.model.Utterance;
import com.github.salilvnair.coopassist.engine.pipeline.EngineStep;
import com.github.salilvnair.coopassist.engine.pipeline.StepResult;
import com.github.salilvnair.coopassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.coopassist.engine.session.EngineSession;
import com.github.salilvnair.coopassist.engine.text.TextNormalizer;
import com.github.salilvnair.coopassist.session.DialogueSessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Rewrites elliptical follow-ups against the last product the user was answered about:
 * "它多少钱" becomes "草莓多少钱", a bare "多少钱" becomes "草莓 多少钱".
 */
@Slf4j
@RequiredArgsConstructor
@Component
@MustRunAfter(PendingSelectionStep.class)
public class FollowUpContextStep implements EngineStep {

    private static final List<String> PARTICLES = List.of("吗", "呢", "啊", "呀", "吧", "的", "了");

    private final DialogueSessionManager sessions;
    private final CoopAssistFlowConfig flowConfig;

    @Override
    public StepResult execute(EngineSession session) {
        if (session.isPreheat()) {
            return new StepResult.Continue();
        }
        Optional<ProductCandidate> last = sessions.getLastContext(session.getUserId());
        if (last.isEmpty()) {
            return new StepResult.Continue();
        }
        String normalized = session.getUtterance().normalized();
        String rewritten = rewrite(normalized, last.get());
        if (rewritten != null) {
            log.debug("Co-op Assist: follow-up '{}' rewritten as '{}' for user={}",
                    normalized, rewritten, session.getUserId());
            session.setUtterance(new Utterance(session.getUtterance().raw(), rewritten));
            session.setContextToken(last.get().key());
        }
        return new StepResult.Continue();
    }

    String rewrite(String normalized, ProductCandidate product) {
        String name = TextNormalizer.normalize(product.name());
        if (normalized.contains(name)) {
            return null;
        }
        for (String pronoun : flowConfig.getSession().getFollowUpKeywords()) {
            if (normalized.contains(pronoun)) {
                return normalized.replace(pronoun, name);
            }
        }
        if (isPurePriceQuestion(normalized)) {
            return name + " " + normalized;
        }
        return null;
    }

    private boolean isPurePriceQuestion(String normalized) {
        String rest = TextNormalizer.compact(normalized);
        boolean asked = false;
        for (String keyword : flowConfig.getSession().getPriceFollowUpKeywords()) {
            if (rest.contains(keyword)) {
                asked = true;
                rest = rest.replace(keyword, "");
            }
        }
        for (String particle : PARTICLES) {
            rest = rest.replace(particle, "");
        }
        return asked && rest.isEmpty();
    }
}
