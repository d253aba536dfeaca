package ru.javaboys.huntysourcing.search;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;
import ru.javaboys.huntysourcing.engine.RawResult;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Google results through SerpAPI, filtered down to profile pages.
 */
@Slf4j
@Service
public class SerpApiSearchClient implements SearchClient {

    private final RestTemplate restTemplate;
    private final String url;
    private final int resultsPerQuery;
    private final String profileUrlMarker;

    public SerpApiSearchClient(RestTemplate restTemplate,
                               @Value("${hunty.search.serpapi.url:https://serpapi.com/search.json}") String url,
                               @Value("${hunty.search.serpapi.results-per-query:10}") int resultsPerQuery,
                               @Value("${hunty.search.profile-url-marker:linkedin.com/in}") String profileUrlMarker) {
        this.restTemplate = restTemplate;
        this.url = url;
        this.resultsPerQuery = resultsPerQuery;
        this.profileUrlMarker = profileUrlMarker;
    }

    @Override
    public List<RawResult> search(String query, String apiKey) {
        if (StringUtils.isBlank(apiKey)) {
            log.warn("SerpAPI key is not configured, returning empty results");
            return List.of();
        }
        if (StringUtils.isBlank(query)) return List.of();

        URI uri = UriComponentsBuilder.fromUriString(url)
                .queryParam("engine", "google")
                .queryParam("q", query)
                .queryParam("num", resultsPerQuery)
                .queryParam("api_key", apiKey)
                .encode()
                .build()
                .toUri();
        try {
            JsonNode body = restTemplate.getForObject(uri, JsonNode.class);
            List<RawResult> results = parse(body);
            log.debug("SerpAPI '{}' -> {} profile results", query, results.size());
            return results;
        } catch (RestClientException e) {
            // ключ не логируем: он в URI
            log.error("SerpAPI error for query '{}': {}", query, e.getMessage());
            return List.of();
        }
    }

    List<RawResult> parse(JsonNode body) {
        List<RawResult> out = new ArrayList<>();
        if (body == null) return out;
        JsonNode organic = body.path("organic_results");
        if (!organic.isArray()) return out;

        for (JsonNode item : organic) {
            String link = item.path("link").asText("");
            if (!link.contains(profileUrlMarker)) continue;
            String snippet = item.hasNonNull("snippet") ? item.get("snippet").asText() : null;
            out.add(new RawResult(item.path("title").asText(""), link, snippet));
        }
        return out;
    }
}
