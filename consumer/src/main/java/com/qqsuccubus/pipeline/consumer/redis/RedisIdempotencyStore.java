package com.qqsuccubus.pipeline.consumer.redis;

import com.qqsuccubus.pipeline.core.error.ConflictException;
import com.qqsuccubus.pipeline.core.error.PipelineException;
import com.qqsuccubus.pipeline.core.error.StoreUnavailableException;
import com.qqsuccubus.pipeline.core.idempotency.IdempotencyStore;
import com.qqsuccubus.pipeline.core.model.IdempotencyKey;
import io.lettuce.core.RedisClient;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Reactive Redis idempotency store.
 * <p>
 * {@code SET key value NX PX ttl} is the atomic compare-and-set; expiry is left to Redis,
 * so {@link #sweepExpired()} has nothing to remove. Any Redis failure surfaces as
 * {@link StoreUnavailableException}.
 * </p>
 */
public class RedisIdempotencyStore implements IdempotencyStore, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RedisIdempotencyStore.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;
    private final Clock clock;

    public RedisIdempotencyStore(String redisUrl) {
        this.client = RedisClient.create(redisUrl);
        this.connection = client.connect();
        this.commands = connection.reactive();
        this.clock = Clock.systemUTC();
        log.info("Connected to Redis: {}", redisUrl);
    }

    @Override
    public Mono<Boolean> hasProcessed(IdempotencyKey key) {
        return commands.exists(Keys.processed(key.getValue()))
            .map(count -> count > 0)
            .onErrorMap(error -> unavailable("EXISTS", key, error));
    }

    @Override
    public Mono<Void> markProcessed(IdempotencyKey key, Duration ttl) {
        return commands.set(Keys.processed(key.getValue()), clock.instant().toString(),
                SetArgs.Builder.nx().px(ttl.toMillis()))
            .onErrorMap(error -> unavailable("SET NX", key, error))
            .filter("OK"::equals)
            .switchIfEmpty(Mono.defer(() -> Mono.error(new ConflictException(key.getValue()))))
            .then();
    }

    @Override
    public Mono<Integer> sweepExpired() {
        return Mono.just(0);
    }

    private static Throwable unavailable(String command, IdempotencyKey key, Throwable error) {
        if (error instanceof PipelineException) {
            return error;
        }
        log.warn("Redis {} failed for {}: {}", command, key, error.toString());
        return new StoreUnavailableException("Redis " + command + " failed for " + key, error);
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
