package com.github.salilvnair.coopassist.engine.service;

import com.github.salilvnair.coopassist.catalog.Product;
import com.github.salilvnair.coopassist.catalog.ProductCatalog;
import com.github.salilvnair.coopassist.catalog.ProductPopularity;
import com.github.salilvnair.coopassist.catalog.resolver.CategoryGuesser;
import com.github.salilvnair.coopassist.catalog.resolver.EntityResolver;
import com.github.salilvnair.coopassist.config.CoopAssistFlowConfig;
import com.github.salilvnair.coopassist.engine.constants.ReplyConstants;
import com.github.salilvnair.coopassist.engine.constants.SelectionConstants;
import com.github.salilvnair.coopassist.engine.model.EngineResult;
import com.github.salilvnair.coopassist.engine.model.ProductCandidate;
import com.github.salilvnair.coopassist.engine.model.ResolutionResult;
import com.github.salilvnair.coopassist.engine.model.SelectableOption;
import com.github.salilvnair.coopassist.engine.response.ReplyComposer;
import com.github.salilvnair.coopassist.engine.session.EngineSession;
import com.github.salilvnair.coopassist.engine.type.AnswerSource;
import com.github.salilvnair.coopassist.engine.type.ClarificationKind;
import com.github.salilvnair.coopassist.engine.type.ClassificationTier;
import com.github.salilvnair.coopassist.engine.type.Intent;
import com.github.salilvnair.coopassist.session.DialogueSessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
@RequiredArgsConstructor
@Component
public class ProductInquiryService {

    private final EntityResolver entityResolver;
    private final ProductCatalog catalog;
    private final ProductPopularity popularity;
    private final CategoryGuesser categoryGuesser;
    private final DialogueSessionManager sessions;
    private final ReplyComposer replies;
    private final CoopAssistFlowConfig flowConfig;

    /**
     * Resolves the product mentioned in the message and completes the session with the answer.
     *
     * @param replyWhenNotFound when false an unmatched message is left unanswered for the next tier
     * @return true when the session was completed
     */
    public boolean answer(EngineSession session, Intent intent, ClassificationTier tier, boolean replyWhenNotFound) {
        ResolutionResult resolution = entityResolver.resolve(session.getUtterance().normalized());
        Intent answeredAs = intent == Intent.UNKNOWN ? Intent.INQUIRY_AVAILABILITY : intent;
        switch (resolution.status()) {
            case RESOLVED -> {
                Optional<Product> product = catalog.findByKey(resolution.best().key());
                if (product.isPresent()) {
                    rememberProduct(session, resolution.best());
                    recordView(session, product.get());
                    session.complete(productResult(product.get(), answeredAs, tier, AnswerSource.CATALOG), true);
                    return true;
                }
                return notFound(session, resolution.fragment(), answeredAs, tier, replyWhenNotFound);
            }
            case AMBIGUOUS -> {
                List<SelectableOption> options = resolution.candidates().stream()
                        .limit(flowConfig.getResolver().getMaxOptions())
                        .map(c -> new SelectableOption(c.displayText(), SelectionConstants.PRODUCT_SELECTION_PREFIX + c.key()))
                        .toList();
                if (!session.isPreheat()) {
                    sessions.setPending(session.getUserId(), ClarificationKind.PRODUCT, options);
                }
                EngineResult result = new EngineResult(replies.clarifyProducts(options), options,
                        answeredAs, tier, AnswerSource.CATALOG, null, false);
                session.complete(result, false);
                return true;
            }
            default -> {
                return notFound(session, resolution.fragment(), answeredAs, tier, replyWhenNotFound);
            }
        }
    }

    /** Direct resolution of an offered choice; no scoring involved. */
    public Optional<EngineResult> select(EngineSession session, String catalogKey) {
        ResolutionResult resolution = entityResolver.resolveSelection(catalogKey);
        if (resolution.best() == null) {
            return Optional.empty();
        }
        return catalog.findByKey(resolution.best().key()).map(product -> {
            rememberProduct(session, resolution.best());
            recordView(session, product);
            return productResult(product, Intent.INQUIRY_AVAILABILITY, ClassificationTier.NONE, AnswerSource.SELECTION);
        });
    }

    public EngineResult catalogOverview(ClassificationTier tier) {
        Map<String, List<Product>> grouped = new LinkedHashMap<>();
        catalog.groupedByCategory().forEach((category, products) -> grouped.put(category, popularity.rank(products)));
        return EngineResult.text(replies.catalogOverview(grouped), Intent.WHAT_DO_YOU_SELL, tier, AnswerSource.CATALOG);
    }

    public EngineResult recommendation(ClassificationTier tier) {
        Set<Product> picks = new LinkedHashSet<>(popularity.rank(catalog.seasonal()));
        picks.addAll(popularity.popular(catalog));
        List<Product> list = new ArrayList<>(picks);
        if (list.isEmpty()) {
            list = catalog.products();
        }
        list = list.stream().limit(flowConfig.getResolver().getMaxOptions()).toList();
        return EngineResult.text(replies.productList(ReplyConstants.RECOMMENDATION_HEADER, list),
                Intent.REQUEST_RECOMMENDATION, tier, AnswerSource.CATALOG);
    }

    public List<String> catalogHints() {
        return catalog.products().stream().map(replies::productLine).toList();
    }

    private boolean notFound(EngineSession session, String fragment, Intent intent, ClassificationTier tier,
                             boolean replyWhenNotFound) {
        Optional<String> category = categoryGuesser.guess(fragment, replyWhenNotFound);
        List<Product> inCategory = category.map(c -> popularity.rank(catalog.byCategory(c))).orElse(List.of());
        if (!inCategory.isEmpty()) {
            String header = "【" + category.get() + "】" + ReplyConstants.CATALOG_HEADER;
            session.complete(EngineResult.text(replies.productList(header, inCategory), intent, tier, AnswerSource.CATALOG), true);
            return true;
        }
        if (!replyWhenNotFound) {
            return false;
        }
        log.debug("Co-op Assist: no catalog match for '{}'", fragment);
        Set<Product> suggestions = new LinkedHashSet<>(popularity.rank(catalog.seasonal()));
        suggestions.addAll(popularity.popular(catalog));
        List<Product> shown = suggestions.stream().limit(flowConfig.getResolver().getNotFoundSuggestions()).toList();
        String display = fragment == null || fragment.isBlank() ? session.getRawMessage() : fragment;
        session.complete(EngineResult.text(replies.notFound(display, shown), intent, tier, AnswerSource.CATALOG), true);
        return true;
    }

    private EngineResult productResult(Product product, Intent intent, ClassificationTier tier, AnswerSource source) {
        String text = replies.price(product, intent == Intent.INQUIRY_PRICE_OR_BUY);
        return new EngineResult(text, List.of(), intent, tier, source, product.getKey(), false);
    }

    private void recordView(EngineSession session, Product product) {
        if (!session.isPreheat()) {
            popularity.recordView(product.getKey());
        }
    }

    private void rememberProduct(EngineSession session, ProductCandidate candidate) {
        if (!session.isPreheat()) {
            sessions.setLastContext(session.getUserId(), candidate);
        }
    }
}
