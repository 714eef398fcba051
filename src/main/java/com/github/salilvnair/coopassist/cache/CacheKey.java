package com.github.salilvnair.coopassist.cache;

import com.github.salilvnair.coopassist.engine.text.TextNormalizer;
import com.github.salilvnair.coopassist.engine.type.QueryType;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Cache identity: normalized query, optional conversational context token and the query type tag.
 */
public record CacheKey(
        QueryType queryType,
        String query,
        String contextToken
) {

    // particles that do not change what is being asked
    private static final List<String> STOPWORDS = List.of("的", "了", "吗", "呢", "啊", "呀", "吧");

    public static CacheKey of(QueryType queryType, String rawQuery, String contextToken) {
        String compact = TextNormalizer.compact(rawQuery);
        for (String stopword : STOPWORDS) {
            compact = compact.replace(stopword, "");
        }
        return new CacheKey(
                queryType == null ? QueryType.GENERAL : queryType,
                compact,
                contextToken == null ? "" : contextToken);
    }

    public static CacheKey of(QueryType queryType, String rawQuery) {
        return of(queryType, rawQuery, null);
    }

    /** Stable external form used by the secondary store: {@code type:md5(query||context)}. */
    public String asString() {
        String digest = DigestUtils.md5DigestAsHex((query + "||" + contextToken).getBytes(StandardCharsets.UTF_8));
        return queryType.name().toLowerCase() + ":" + digest;
    }

    public boolean isEmpty() {
        return query.isEmpty();
    }
}
