package ru.javaboys.huntysourcing.email;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Best-guess corporate email through the Hunter.io email-finder endpoint.
 */
@Slf4j
@Service
public class HunterEmailFinder implements EmailFinder {

    static final String PLACEHOLDER_KEY = "your_hunter_api_key_here";

    private final RestTemplate restTemplate;
    private final String url;
    private final String apiKey;

    public HunterEmailFinder(RestTemplate restTemplate,
                             @Value("${hunty.email.hunter.url:https://api.hunter.io/v2/email-finder}") String url,
                             @Value("${hunty.email.hunter.api-key:}") String apiKey) {
        this.restTemplate = restTemplate;
        this.url = url;
        this.apiKey = apiKey;
    }

    @Override
    @Nullable
    public String findEmail(String firstName, String lastName, String domain) {
        if (StringUtils.isAnyBlank(domain, apiKey) || PLACEHOLDER_KEY.equals(apiKey)) {
            return null;
        }
        URI uri = UriComponentsBuilder.fromUriString(url)
                .queryParam("domain", domain)
                .queryParam("first_name", StringUtils.defaultString(firstName))
                .queryParam("last_name", StringUtils.defaultString(lastName))
                .queryParam("api_key", apiKey)
                .encode()
                .build()
                .toUri();
        try {
            ResponseEntity<JsonNode> res = restTemplate.getForEntity(uri, JsonNode.class);
            if (!res.getStatusCode().is2xxSuccessful() || res.getBody() == null) {
                return null;
            }
            String email = res.getBody().path("data").path("email").asText("");
            return email.isBlank() ? null : email;
        } catch (RestClientException e) {
            log.error("Hunter.io error for {} {} @ {}: {}", firstName, lastName, domain, e.getMessage());
            return null;
        }
    }
}
