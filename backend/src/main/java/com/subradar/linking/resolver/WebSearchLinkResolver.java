package com.subradar.linking.resolver;

import com.subradar.common.MerchantNormalizer;
import com.subradar.linking.config.LinkingProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rate-limited web lookup against an HTML search page (GET {search-base-url}?q=cancel {merchant}).
 * Picks the first result whose host matches the merchant key. Disabled unless
 * subradar.linking.discovery.enabled=true; every failure is "no link".
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSearchLinkResolver implements MerchantLinkResolver {

    private static final Pattern HREF = Pattern.compile("href\\s*=\\s*[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE);
    private static final Pattern UDDG = Pattern.compile("[?&]uddg=([^&]+)");
    private static final Set<String> SEARCH_HOSTS = Set.of("duckduckgo", "google", "bing", "yahoo", "startpage");
    private static final int MIN_HOST_LABEL_LENGTH = 4;

    private final LinkingProperties linkingProperties;
    private final WebClient.Builder webClientBuilder;
    private final RateLimiter linkDiscoveryRateLimiter;

    @Override
    public Optional<String> resolve(String merchant) {
        LinkingProperties.DiscoveryProperties discovery = linkingProperties.getDiscovery();
        if (discovery == null || !discovery.isEnabled() || merchant == null || merchant.isBlank()) {
            return Optional.empty();
        }
        String merchantKey = MerchantNormalizer.canonicalize(merchant);
        if (merchantKey.isEmpty()) {
            return Optional.empty();
        }
        if (!linkDiscoveryRateLimiter.acquirePermission()) {
            log.debug("Discovery limiter denied lookup for '{}'", merchant);
            return Optional.empty();
        }
        URI uri = UriComponentsBuilder.fromUriString(discovery.getSearchBaseUrl())
                .queryParam("q", "cancel " + merchant.strip())
                .encode()
                .build()
                .toUri();
        try {
            String html = webClientBuilder.build()
                    .get()
                    .uri(uri)
                    .header(HttpHeaders.USER_AGENT, discovery.getUserAgent())
                    .accept(MediaType.TEXT_HTML)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(Math.max(1L, discovery.getRequestTimeoutMs())))
                    .block();
            Optional<String> link = extractCancellationLink(html, merchantKey);
            if (link.isPresent()) {
                log.info("Discovered cancellation link for '{}': {}", merchant, link.get());
            } else {
                log.debug("No matching search result for '{}'", merchant);
            }
            return link;
        } catch (WebClientResponseException e) {
            log.warn("Link discovery HTTP {} for '{}'", e.getStatusCode().value(), merchant);
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Link discovery failed for '{}': {}", merchant, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * First anchor target (after unwrapping search redirects) whose host matches the merchant key.
     */
    static Optional<String> extractCancellationLink(String html, String merchantKey) {
        if (html == null || html.isEmpty() || merchantKey == null || merchantKey.isEmpty()) {
            return Optional.empty();
        }
        Matcher m = HREF.matcher(html);
        while (m.find()) {
            String target = unwrapRedirect(m.group(1).replace("&amp;", "&"));
            if (target.startsWith("//")) {
                target = "https:" + target;
            }
            if (!target.startsWith("http://") && !target.startsWith("https://")) {
                continue;
            }
            String host = hostOf(target);
            if (host == null || isSearchHost(host)) {
                continue;
            }
            if (hostMatches(host, merchantKey)) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }

    private static String unwrapRedirect(String href) {
        Matcher uddg = UDDG.matcher(href);
        if (uddg.find()) {
            return URLDecoder.decode(uddg.group(1), StandardCharsets.UTF_8);
        }
        return href;
    }

    private static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : null;
        } catch (IllegalArgumentException e) {
            log.debug("Skipping malformed result link {}", url);
            return null;
        }
    }

    private static boolean isSearchHost(String host) {
        for (String label : host.split("\\.")) {
            if (SEARCH_HOSTS.contains(label)) {
                return true;
            }
        }
        return false;
    }

    static boolean hostMatches(String host, String merchantKey) {
        String bare = host.startsWith("www.") ? host.substring(4) : host;
        if (MerchantNormalizer.normalize(bare).contains(merchantKey)) {
            return true;
        }
        // short brand host such as "hulu.com" for "hulu plus"
        int dot = bare.lastIndexOf('.');
        String name = MerchantNormalizer.normalize(dot > 0 ? bare.substring(0, dot) : bare);
        return name.length() >= MIN_HOST_LABEL_LENGTH && merchantKey.contains(name);
    }
}
