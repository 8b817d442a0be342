package com.flagship.rural_ledger.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.rural_ledger.config.LookupProperties;
import com.flagship.rural_ledger.ledger.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the registered name of a tax id on the public identity API.
 *
 * Answers from the cache when it can. Otherwise each HTTP attempt waits for
 * the minimum spacing since the previous request, and rate-limit or network
 * failures are retried with exponential backoff. When every attempt fails
 * the error sentinel is returned instead of an exception.
 */
@Slf4j
public class IdentityLookupClient {

    private final RestTemplate restTemplate;
    private final LookupCache cache;
    private final LookupProperties properties;
    private final Sleeper sleeper;
    private final RetryTemplate retryTemplate;
    private final Object spacingLock = new Object();
    private long lastRequestNanos;
    private boolean requested;

    public IdentityLookupClient(RestTemplate restTemplate, LookupCache cache, LookupProperties properties) {
        this(restTemplate, cache, properties, new ThreadWaitSleeper());
    }

    public IdentityLookupClient(RestTemplate restTemplate, LookupCache cache, LookupProperties properties,
                                Sleeper sleeper) {
        this.restTemplate = restTemplate;
        this.cache = cache;
        this.properties = properties;
        this.sleeper = sleeper;
        this.retryTemplate = retryTemplate(properties, sleeper);
    }

    private static RetryTemplate retryTemplate(LookupProperties properties, Sleeper sleeper) {
        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(properties.getBaseDelay().toMillis());
        backOff.setMultiplier(2.0);
        backOff.setSleeper(sleeper);

        Map<Class<? extends Throwable>, Boolean> retryable = Map.of(RestClientException.class, true);
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(properties.getMaxAttempts(), retryable, true));
        template.setBackOffPolicy(backOff);
        return template;
    }

    /**
     * @param taxId CPF or CNPJ, punctuation allowed
     * @throws ValidationException if the id has the wrong number of digits for {@code kind}
     */
    public LookupResult lookup(String taxId, LookupKind kind) {
        String digits = taxId == null ? "" : taxId.replaceAll("\\D+", "");
        int expected = kind == LookupKind.CNPJ ? 14 : 11;
        if (digits.length() != expected) {
            throw new ValidationException(kind + " must have " + expected + " digits: " + taxId);
        }

        String key = kind.cacheKey(digits);
        Optional<JsonNode> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Lookup cache hit for {}", key);
            return new LookupResult(cached.get());
        }

        String url = (kind == LookupKind.CNPJ ? properties.getCnpjUrl() : properties.getCpfUrl()) + digits;
        return retryTemplate.execute(context -> {
            awaitSpacing();
            log.debug("Lookup {} attempt {}", key, context.getRetryCount() + 1);
            JsonNode body = restTemplate.getForObject(url, JsonNode.class);
            if (body == null) {
                throw new ResourceAccessException("Empty lookup response for " + key);
            }
            remember(key, body);
            return new LookupResult(body);
        }, context -> {
            Throwable last = context.getLastThrowable();
            log.warn("Lookup {} failed after {} attempts: {}", key, context.getRetryCount(),
                last != null ? last.getMessage() : "unknown");
            return LookupResult.error();
        });
    }

    /**
     * Registered name for the tax id, or "" when the lookup failed.
     */
    public String displayName(String taxId, LookupKind kind) {
        return lookup(taxId, kind).displayName();
    }

    private void remember(String key, JsonNode body) {
        try {
            cache.put(key, body);
        } catch (UncheckedIOException e) {
            log.warn("Lookup {} not cached: {}", key, e.getMessage());
        }
    }

    private void awaitSpacing() {
        synchronized (spacingLock) {
            long minInterval = properties.getMinInterval().toNanos();
            if (requested) {
                long wait = minInterval - (System.nanoTime() - lastRequestNanos);
                if (wait > 0) {
                    try {
                        sleeper.sleep(Math.max(1, wait / 1_000_000));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new ResourceAccessException("Interrupted while spacing lookup requests");
                    }
                }
            }
            lastRequestNanos = System.nanoTime();
            requested = true;
        }
    }
}
