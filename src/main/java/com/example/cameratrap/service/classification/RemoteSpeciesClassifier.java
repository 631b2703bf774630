package com.example.cameratrap.service.classification;

import com.example.cameratrap.exception.InferenceRejectedException;
import com.example.cameratrap.exception.InferenceUnavailableException;
import com.example.cameratrap.model.SpeciesCandidate;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;

/**
 * HTTP classifier client. The service answers with
 * {@code {"predictions":[{"scientific_name":"Panthera leo","common_name":"Lion","confidence":0.91}]}}.
 */
public class RemoteSpeciesClassifier implements SpeciesClassifier {

    private final RestTemplate restTemplate;
    private final String endpoint;

    public RemoteSpeciesClassifier(RestTemplate restTemplate, String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalStateException("camera-trap.classification.endpoint must be configured for the remote backend");
        }
        this.restTemplate = restTemplate;
        this.endpoint = endpoint;
    }

    @Override
    public List<SpeciesCandidate> classify(byte[] crop, int topK) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.IMAGE_JPEG);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        String uri = UriComponentsBuilder.fromUriString(endpoint).queryParam("top_k", topK).toUriString();
        ClassifierResponse response;
        try {
            response = restTemplate.postForObject(uri, new HttpEntity<>(crop, headers), ClassifierResponse.class);
        } catch (ResourceAccessException | HttpServerErrorException | HttpClientErrorException.TooManyRequests ex) {
            throw new InferenceUnavailableException("Classifier service unavailable: " + ex.getMessage(), ex);
        } catch (HttpClientErrorException ex) {
            throw new InferenceRejectedException("Classifier service rejected the crop: " + ex.getStatusCode(), ex);
        } catch (RestClientException ex) {
            throw new InferenceRejectedException("Unreadable classifier response: " + ex.getMessage(), ex);
        }
        if (response == null || response.predictions() == null) {
            return List.of();
        }
        return response.predictions();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ClassifierResponse(List<SpeciesCandidate> predictions) {
    }
}
