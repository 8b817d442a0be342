package com.flagship.rural_ledger.sync;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * {@link RemoteSession} over the backend's HTTP surface:
 * {@code /rest/v1/<table>} for rows, {@code /rest/v1/rpc/<fn>} for stored
 * procedures and {@code /auth/v1} for password sessions.
 *
 * Holds the signed-in access token without synchronization; the bridge
 * confines every call to one thread.
 */
@Slf4j
public class PostgrestRemoteSession implements RemoteSession {

    private static final ParameterizedTypeReference<List<Map<String, Object>>> ROWS =
        new ParameterizedTypeReference<>() {
        };

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String apiKey;
    private String accessToken;

    public PostgrestRemoteSession(RestTemplate restTemplate, String baseUrl, String apiKey) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    public List<Map<String, Object>> select(RemoteQuery query) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
            .path("/rest/v1/" + query.getTable());
        query.toParameters().forEach(p -> uri.queryParam(p.getKey(), p.getValue()));
        List<Map<String, Object>> rows = restTemplate.exchange(
            uri.build().encode().toUri(), HttpMethod.GET, new HttpEntity<>(headers()), ROWS).getBody();
        log.debug("Selected {} rows: {}", rows != null ? rows.size() : 0, query);
        return rows != null ? rows : List.of();
    }

    @Override
    public List<Map<String, Object>> upsert(String table, List<Map<String, Object>> rows, String onConflict) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
            .path("/rest/v1/" + table)
            .queryParam("on_conflict", onConflict)
            .build().encode().toUri();
        HttpHeaders headers = headers();
        headers.add("Prefer", "resolution=merge-duplicates,return=representation");
        List<Map<String, Object>> stored = restTemplate.exchange(
            uri, HttpMethod.POST, new HttpEntity<>(rows, headers), ROWS).getBody();
        log.debug("Upserted {} rows into {}", rows.size(), table);
        return stored != null ? stored : List.of();
    }

    @Override
    public int delete(String table, String column, Object value) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
            .path("/rest/v1/" + table)
            .queryParam(column, "eq." + value)
            .build().encode().toUri();
        HttpHeaders headers = headers();
        headers.add("Prefer", "return=representation");
        List<Map<String, Object>> deleted = restTemplate.exchange(
            uri, HttpMethod.DELETE, new HttpEntity<>(headers), ROWS).getBody();
        return deleted != null ? deleted.size() : 0;
    }

    @Override
    public JsonNode rpc(String function, Map<String, Object> params) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
            .path("/rest/v1/rpc/" + function)
            .build().encode().toUri();
        log.debug("Calling remote procedure {}", function);
        return restTemplate.exchange(uri, HttpMethod.POST, new HttpEntity<>(params, headers()), JsonNode.class)
            .getBody();
    }

    @Override
    public AuthSession signIn(String email, String password) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
            .path("/auth/v1/token")
            .queryParam("grant_type", "password")
            .build().encode().toUri();
        JsonNode body = restTemplate.exchange(uri, HttpMethod.POST,
            new HttpEntity<>(Map.of("email", email, "password", password), headers()), JsonNode.class).getBody();
        if (body == null || !body.hasNonNull("access_token")) {
            throw new RemoteOperationException("Sign-in returned no access token for " + email);
        }
        accessToken = body.get("access_token").asText();
        JsonNode user = body.path("user");
        log.info("Signed in to remote backend as {}", email);
        return new AuthSession(user.path("id").asText(null), user.path("email").asText(email), accessToken);
    }

    @Override
    public void signOut() {
        if (accessToken == null) {
            return;
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl).path("/auth/v1/logout").build().encode().toUri();
        try {
            restTemplate.exchange(uri, HttpMethod.POST, new HttpEntity<>(headers()), Void.class);
        } finally {
            accessToken = null;
        }
        log.info("Signed out of remote backend");
    }

    @Override
    public void close() {
        accessToken = null;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set("apikey", apiKey);
        headers.setBearerAuth(accessToken != null ? accessToken : apiKey);
        return headers;
    }
}
