package com.jreinhal.scrubber.fusion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.jreinhal.scrubber.model.ExternalCandidate;
import com.jreinhal.scrubber.model.Span;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Calls a recognition microservice over HTTP.
 *
 * Request:  POST {service-url}/recognize  {"text": "..."}
 * Response: {"entities": [{"label": "PER", "start": 0, "end": 5, "score": 0.93}]}
 */
public class HttpRecognitionModel implements RecognitionModel {
    private static final Logger log = LoggerFactory.getLogger(HttpRecognitionModel.class);

    private final String name;
    private final String serviceUrl;
    private final RestTemplate restTemplate;

    public HttpRecognitionModel(String name, String serviceUrl, int timeoutMs) {
        this(name, serviceUrl, createRestTemplate(timeoutMs));
    }

    HttpRecognitionModel(String name, String serviceUrl, RestTemplate restTemplate) {
        this.name = name;
        this.serviceUrl = serviceUrl.endsWith("/") ? serviceUrl.substring(0, serviceUrl.length() - 1) : serviceUrl;
        this.restTemplate = restTemplate;
    }

    private static RestTemplate createRestTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory() {
            @Override
            protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
                super.prepareConnection(connection, httpMethod);
                connection.setInstanceFollowRedirects(false);
            }
        };
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    @Override
    public String name() {
        return this.name;
    }

    @Override
    public List<ExternalCandidate> recognize(String content) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        RecognizeRequest request = new RecognizeRequest();
        request.text = content;
        ResponseEntity<RecognizeResponse> response = this.restTemplate.postForEntity(
                this.serviceUrl + "/recognize", new HttpEntity<RecognizeRequest>(request, headers), RecognizeResponse.class);
        RecognizeResponse body = response.getBody();
        if (body == null || body.entities == null) {
            return List.of();
        }
        List<ExternalCandidate> candidates = new ArrayList<ExternalCandidate>();
        for (RecognizedEntity entity : body.entities) {
            if (entity.start < 0 || entity.end < entity.start || entity.score < 0.0 || entity.score > 1.0) {
                log.debug("Ignoring malformed entity from {}: [{},{}) score={}", this.name, entity.start, entity.end, entity.score);
                continue;
            }
            candidates.add(new ExternalCandidate(entity.label, new Span(entity.start, entity.end), entity.score));
        }
        return candidates;
    }

    static class RecognizeRequest {
        @JsonProperty("text")
        public String text;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RecognizeResponse {
        @JsonProperty("entities")
        public List<RecognizedEntity> entities;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RecognizedEntity {
        @JsonProperty("label")
        public String label;
        @JsonProperty("start")
        public int start;
        @JsonProperty("end")
        public int end;
        @JsonProperty("score")
        public double score;
    }
}
