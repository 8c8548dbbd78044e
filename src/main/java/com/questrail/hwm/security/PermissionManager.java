package com.questrail.hwm.security;

import com.questrail.hwm.internal.time.WallClock;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * PermissionManager
 * -----------------------------------------------------------------------------
 * Caches user command permissions for the command parser.
 *
 * <h2>Expiry</h2>
 * Each cached record carries the time it was cached. A record whose age has
 * reached {@code maxAge} is refused by {@link #getUserPermissions(String)} and
 * evicted on the spot, exactly as if it had never been loaded; it must be
 * reloaded with {@link #addUserPermissions(String)}.
 * {@link #purgeUserPermissions(Duration)} additionally sweeps old records in bulk.
 *
 * <h2>Threading</h2>
 * Loads run on the supplied executor. Lookups are safe from any thread.
 */
public final class PermissionManager
{
    private record Cached(UserPermissions permissions, Instant cachedAt) {}

    private final PermissionSource source;
    private final Executor executor;
    private final WallClock clock;
    private final Duration maxAge;

    private final ConcurrentMap<String, Cached> permissions = new ConcurrentHashMap<>();

    public PermissionManager(PermissionSource source, Executor executor, WallClock clock, Duration maxAge) {
        this.source = Objects.requireNonNull(source, "source");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxAge = Objects.requireNonNull(maxAge, "maxAge");
        if (maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be > 0");
        }
    }

    /**
     * Loads, validates and caches the permissions for {@code userId}, replacing
     * any cached record. Every other record in the loaded resource is cached too.
     *
     * @return a future completed with the user's record, or exceptionally with
     *         {@link PermissionsUserNotFoundException} if the resource does not
     *         list the user, or the source's {@link PermissionsException}
     */
    public CompletableFuture<UserPermissions> addUserPermissions(String userId) {
        Objects.requireNonNull(userId, "userId");
        return CompletableFuture
            .supplyAsync(() -> source.load(userId), executor)
            .thenApply(loaded -> save(loaded, userId));
    }

    private UserPermissions save(List<UserPermissions> loaded, String userId) {
        Instant now = clock.now();
        UserPermissions target = null;
        for (UserPermissions record : loaded) {
            permissions.put(record.userId(), new Cached(record, now));
            if (record.userId().equals(userId)) {
                target = record;
            }
        }
        if (target == null) {
            throw new PermissionsUserNotFoundException("The permissions for user '" + userId
                + "' could not be found upon loading the latest version of the permissions resource.");
        }
        return target;
    }

    /**
     * @throws PermissionsUserNotFoundException if the user has no cached record
     *         or the cached record has expired
     */
    public UserPermissions getUserPermissions(String userId) {
        Cached cached = permissions.get(userId);
        if (cached == null) {
            throw new PermissionsUserNotFoundException("The user '" + userId
                + "' does not have any permission settings saved.");
        }
        if (isOlderThan(cached, maxAge, clock.now())) {
            permissions.remove(userId, cached);
            throw new PermissionsUserNotFoundException("The permission settings for user '" + userId
                + "' have expired and must be reloaded.");
        }
        return cached.permissions();
    }

    /**
     * Removes every record cached {@code age} or longer ago.
     *
     * @return the number of records removed
     */
    public int purgeUserPermissions(Duration age) {
        Objects.requireNonNull(age, "age");
        Instant now = clock.now();
        int before = permissions.size();
        permissions.values().removeIf(cached -> isOlderThan(cached, age, now));
        return before - permissions.size();
    }

    public Duration maxAge() {
        return maxAge;
    }

    private static boolean isOlderThan(Cached cached, Duration age, Instant now) {
        return Duration.between(cached.cachedAt(), now).compareTo(age) >= 0;
    }
}
