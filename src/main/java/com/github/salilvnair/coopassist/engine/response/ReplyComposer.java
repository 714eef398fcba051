package com.github.salilvnair.coopassist.engine.response;

import com.github.salilvnair.coopassist.catalog.Product;
import com.github.salilvnair.coopassist.engine.constants.ReplyConstants;
import com.github.salilvnair.coopassist.engine.model.SelectableOption;
import com.github.salilvnair.coopassist.policy.RankedSentence;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns resolved catalog rows and policy sentences into the user-facing reply text.
 */
@Component
public class ReplyComposer {

    /** {@code name: $price/spec - description}, seasonal items flagged. */
    public String productLine(Product product) {
        StringBuilder sb = new StringBuilder();
        if (product.isSeasonal()) {
            sb.append(ReplyConstants.SEASONAL_MARKER);
        }
        sb.append(product.getName());
        String price = price(product);
        if (!price.isEmpty()) {
            sb.append(": ").append(price);
        }
        if (product.getDescription() != null && !product.getDescription().isBlank()) {
            sb.append(" - ").append(product.getDescription().trim());
        }
        return sb.toString();
    }

    public String availability(Product product) {
        return String.format(ReplyConstants.PRODUCT_AVAILABLE, productLine(product));
    }

    public String price(Product product, boolean priceQuestion) {
        return priceQuestion
                ? String.format(ReplyConstants.PRODUCT_PRICE, productLine(product))
                : availability(product);
    }

    public String catalogOverview(Map<String, List<Product>> grouped) {
        StringBuilder sb = new StringBuilder(ReplyConstants.CATALOG_HEADER);
        grouped.forEach((category, products) -> sb.append("\n【").append(category).append("】")
                .append(products.stream().map(Product::getName).collect(Collectors.joining("、"))));
        return sb.toString();
    }

    public String productList(String header, List<Product> products) {
        StringBuilder sb = new StringBuilder(header);
        for (Product product : products) {
            sb.append("\n- ").append(productLine(product));
        }
        return sb.toString();
    }

    public String notFound(String fragment, List<Product> suggestions) {
        if (suggestions.isEmpty()) {
            return String.format(ReplyConstants.PRODUCT_NOT_FOUND_NO_SUGGESTION, fragment);
        }
        String names = suggestions.stream().map(Product::getName).collect(Collectors.joining("、"));
        return String.format(ReplyConstants.PRODUCT_NOT_FOUND, fragment, names);
    }

    public String clarifyProducts(List<SelectableOption> options) {
        String names = options.stream().map(o -> "[" + o.displayText() + "]").collect(Collectors.joining("、"));
        return String.format(ReplyConstants.CLARIFY_PRODUCT, names);
    }

    public String clarifyPolicy(List<SelectableOption> options) {
        StringBuilder sb = new StringBuilder(ReplyConstants.CLARIFY_POLICY);
        for (int i = 0; i < options.size(); i++) {
            sb.append("\n").append(i + 1).append(". ").append(options.get(i).displayText());
        }
        return sb.toString();
    }

    public String policyAnswer(String topic, List<RankedSentence> sentences) {
        StringBuilder sb = new StringBuilder(String.format(ReplyConstants.POLICY_HEADER, topic));
        for (RankedSentence sentence : sentences) {
            sb.append("\n- ").append(sentence.content());
        }
        return sb.toString();
    }

    public String refundAnswer(List<RankedSentence> sentences) {
        StringBuilder sb = new StringBuilder(ReplyConstants.REFUND_GUIDANCE);
        for (RankedSentence sentence : sentences) {
            sb.append("\n- ").append(sentence.content());
        }
        sb.append("\n").append(ReplyConstants.REFUND_CONTACT);
        return sb.toString();
    }

    private String price(Product product) {
        BigDecimal price = product.getPrice();
        if (price == null) {
            return "";
        }
        String amount = "$" + price.stripTrailingZeros().toPlainString();
        String per = product.getSpecification() != null && !product.getSpecification().isBlank()
                ? product.getSpecification()
                : product.getUnit();
        return per == null || per.isBlank() ? amount : amount + "/" + per;
    }
}
