package com.subradar.api.controller;

import com.subradar.api.dto.CancellationLinkResponse;
import com.subradar.api.dto.ErrorBody;
import com.subradar.common.MerchantNormalizer;
import com.subradar.linking.CancellationLinkResolver;
import com.subradar.linking.cache.LinkCacheStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * GET /cancellation-links?merchant=, DELETE /cancellation-links/cache/{key}.
 */
@RestController
@RequestMapping("/api/v1/cancellation-links")
@RequiredArgsConstructor
public class CancellationLinkController {

    private final CancellationLinkResolver cancellationLinkResolver;
    private final LinkCacheStore linkCacheStore;

    @GetMapping
    public Mono<ResponseEntity<?>> resolve(@RequestParam String merchant) {
        if (merchant.isBlank()) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_MERCHANT", "Merchant is required")));
        }
        String name = merchant.strip();
        return Mono.fromCallable(() -> cancellationLinkResolver.resolve(name))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(r -> ResponseEntity.ok(new CancellationLinkResponse(name, r.url(), r.source().name())));
    }

    /** Accepts a raw merchant or an already normalized key. */
    @DeleteMapping("/cache/{key}")
    public ResponseEntity<Void> invalidate(@PathVariable String key) {
        linkCacheStore.invalidate(MerchantNormalizer.normalize(key));
        return ResponseEntity.noContent().build();
    }
}
