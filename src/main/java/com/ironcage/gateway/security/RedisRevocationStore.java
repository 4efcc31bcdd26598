package com.ironcage.gateway.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Revocation store backed by Redis keys {@code revoked:<tokenId>}.
 *
 * Revocation is permanent, so positive answers are cached locally and repeated checks
 * for the same token stay in process. The cache is bounded in size and age; an evicted
 * token is simply looked up in Redis again. Negative answers are not cached: a revocation
 * made on another node must be seen on the next request.
 */
@Slf4j
public class RedisRevocationStore implements RevocationStore {

    private static final String TOKEN_REVOKED_KEY_PREFIX = "revoked:";
    private static final long DEFAULT_CACHE_SIZE = 10_000;
    private static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(1);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final Cache<String, Boolean> revokedCache;

    public RedisRevocationStore(ReactiveRedisTemplate<String, String> redisTemplate) {
        this(redisTemplate, DEFAULT_CACHE_SIZE, DEFAULT_CACHE_TTL);
    }

    public RedisRevocationStore(ReactiveRedisTemplate<String, String> redisTemplate,
                                long maxCachedTokens,
                                Duration cacheTtl) {
        this.redisTemplate = redisTemplate;
        this.revokedCache = Caffeine.newBuilder()
                .maximumSize(maxCachedTokens)
                .expireAfterWrite(cacheTtl)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public Mono<Boolean> isRevoked(String tokenId) {
        if (revokedCache.getIfPresent(tokenId) != null) {
            return Mono.just(true);
        }
        return redisTemplate.hasKey(TOKEN_REVOKED_KEY_PREFIX + tokenId)
                .doOnNext(revoked -> {
                    if (revoked) {
                        revokedCache.put(tokenId, Boolean.TRUE);
                    }
                });
    }

    @Override
    public Mono<Void> revoke(String tokenId) {
        revokedCache.put(tokenId, Boolean.TRUE);
        return redisTemplate.opsForValue()
                .set(TOKEN_REVOKED_KEY_PREFIX + tokenId, "1")
                .doOnNext(ok -> log.info("Token {} revoked", tokenId))
                .then();
    }

    long cachedCount() {
        revokedCache.cleanUp();
        return revokedCache.estimatedSize();
    }
}
