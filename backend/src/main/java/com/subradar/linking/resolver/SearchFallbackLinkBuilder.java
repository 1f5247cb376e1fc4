package com.subradar.linking.resolver;

import com.subradar.linking.config.LinkingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Last stage: generic "how to cancel" search URL. Spaces are encoded as '+'.
 */
@Component
@RequiredArgsConstructor
public class SearchFallbackLinkBuilder {

    static final String PLACEHOLDER = "{merchant}";

    private final LinkingProperties linkingProperties;

    public String build(String merchant) {
        String encoded = URLEncoder.encode(merchant != null ? merchant.strip() : "", StandardCharsets.UTF_8);
        String template = linkingProperties.getFallbackSearchUrl();
        if (template == null || !template.contains(PLACEHOLDER)) {
            template = LinkingProperties.DEFAULT_FALLBACK_SEARCH_URL;
        }
        return template.replace(PLACEHOLDER, encoded);
    }
}
