package com.ironcage.gateway.budget;

import com.ironcage.gateway.directory.AgentDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Ledger persistence in Redis, shared by every gateway instance.
 *
 * Per agent, with a hash tag so the keys share a cluster slot:
 * <ul>
 *   <li>{@code budget:{agentId}} hash, field {@code spent}: committed spend</li>
 *   <li>{@code budget:{agentId}:holds} hash: reservation id to held micros</li>
 *   <li>{@code budget:{agentId}:expiry} sorted set: reservation id scored by expiry millis</li>
 * </ul>
 *
 * Admission runs as one Lua script: holds past their expiry are dropped (which also
 * reclaims holds of an instance that died mid-request), then the hold is written only if
 * committed spend plus every open hold plus the new amount fits in the limit.
 */
@Slf4j
public class RedisBudgetStore implements BudgetStore {

    private static final String SPENT_FIELD = "spent";

    @SuppressWarnings("rawtypes")
    private static final RedisScript<List> ADMIT_SCRIPT = RedisScript.of("""
            local expired = redis.call('ZRANGEBYSCORE', KEYS[3], '-inf', ARGV[5])
            for _, id in ipairs(expired) do
              redis.call('HDEL', KEYS[2], id)
              redis.call('ZREM', KEYS[3], id)
            end
            local pending = 0
            for _, held in ipairs(redis.call('HVALS', KEYS[2])) do
              pending = pending + tonumber(held)
            end
            local spent = tonumber(redis.call('HGET', KEYS[1], 'spent') or '0')
            local available = tonumber(ARGV[1]) - spent - pending
            if tonumber(ARGV[2]) > available then
              return {0, spent, available}
            end
            redis.call('HSET', KEYS[2], ARGV[3], ARGV[2])
            redis.call('ZADD', KEYS[3], ARGV[4], ARGV[3])
            return {1, spent, available}
            """, List.class);

    private static final RedisScript<Long> COMMIT_SCRIPT = RedisScript.of("""
            redis.call('HDEL', KEYS[2], ARGV[1])
            redis.call('ZREM', KEYS[3], ARGV[1])
            return redis.call('HINCRBY', KEYS[1], 'spent', ARGV[2])
            """, Long.class);

    private static final RedisScript<Long> RELEASE_SCRIPT = RedisScript.of("""
            redis.call('ZREM', KEYS[3], ARGV[1])
            return redis.call('HDEL', KEYS[2], ARGV[1])
            """, Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final AgentDirectory agentDirectory;

    public RedisBudgetStore(ReactiveRedisTemplate<String, String> redisTemplate, AgentDirectory agentDirectory) {
        this.redisTemplate = redisTemplate;
        this.agentDirectory = agentDirectory;
    }

    @Override
    public Mono<StoredBudget> getBudget(String agentId) {
        return agentDirectory.findAgent(agentId)
                .flatMap(agent -> redisTemplate.<String, String>opsForHash()
                        .get(budgetKey(agentId), SPENT_FIELD)
                        .map(Long::parseLong)
                        .defaultIfEmpty(0L)
                        .map(spent -> new StoredBudget(agentId, agent.limitMicros(), spent)));
    }

    @Override
    public Mono<StoreAdmission> beginReservation(Reservation reservation, long limitMicros) {
        List<String> args = List.of(
                String.valueOf(limitMicros),
                String.valueOf(reservation.amountMicros()),
                reservation.id(),
                String.valueOf(reservation.expiresAt().toEpochMilli()),
                String.valueOf(reservation.createdAt().toEpochMilli()));
        return redisTemplate.execute(ADMIT_SCRIPT, keys(reservation.agentId()), args)
                .next()
                .map(result -> {
                    long spent = ((Number) result.get(1)).longValue();
                    if (((Number) result.get(0)).longValue() == 1L) {
                        return StoreAdmission.admitted(spent);
                    }
                    long available = ((Number) result.get(2)).longValue();
                    log.info("Shared budget refused {} micros for agent {}: available {} micros",
                            reservation.amountMicros(), reservation.agentId(), available);
                    return StoreAdmission.refused(spent, available);
                });
    }

    @Override
    public Mono<Long> commitReservation(Reservation reservation, long actualMicros) {
        return redisTemplate.execute(COMMIT_SCRIPT, keys(reservation.agentId()),
                        List.of(reservation.id(), String.valueOf(actualMicros)))
                .next()
                .doOnNext(total -> log.debug("Agent {} committed spend now {} micros", reservation.agentId(), total));
    }

    @Override
    public Mono<Void> releaseReservation(Reservation reservation) {
        return redisTemplate.execute(RELEASE_SCRIPT, keys(reservation.agentId()), List.of(reservation.id()))
                .then();
    }

    private static String budgetKey(String agentId) {
        return "budget:{" + agentId + "}";
    }

    private static List<String> keys(String agentId) {
        String budgetKey = budgetKey(agentId);
        return List.of(budgetKey, budgetKey + ":holds", budgetKey + ":expiry");
    }
}
