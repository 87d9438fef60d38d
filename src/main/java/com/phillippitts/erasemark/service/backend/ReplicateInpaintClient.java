package com.phillippitts.erasemark.service.backend;

import com.phillippitts.erasemark.config.inpaint.CloudConfig;
import com.phillippitts.erasemark.exception.InpaintException;
import com.phillippitts.erasemark.exception.InpaintExceptionBuilder;
import com.phillippitts.erasemark.util.LogSanitizer;
import com.phillippitts.erasemark.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.Base64;

/**
 * Client for Replicate's predictions API.
 *
 * <p>Images travel inline as {@code data:image/png;base64,...} URIs. A job is created with
 * {@code POST /predictions} (expects 201) and polled with {@code GET /predictions/{id}}.
 */
@Component
class ReplicateInpaintClient implements CloudInpaintClient {
    private static final Logger LOG = LogManager.getLogger(ReplicateInpaintClient.class);

    private static final int MAX_BODY_PREVIEW = 200;

    private final RestTemplate rest;
    private final CloudConfig config;

    ReplicateInpaintClient(@Qualifier("cloudRestTemplate") RestTemplate rest, CloudConfig config) {
        this.rest = rest;
        this.config = config;
    }

    @Override
    public String submit(byte[] imagePng, byte[] maskPng) {
        JSONObject input = new JSONObject()
                .put("image", dataUri(imagePng))
                .put("mask", dataUri(maskPng))
                .put("prompt", config.prompt())
                .put("negative_prompt", config.negativePrompt())
                .put("num_inference_steps", config.inferenceSteps())
                .put("guidance_scale", config.guidanceScale());
        JSONObject body = new JSONObject()
                .put("version", versionId(config.modelVersion()))
                .put("input", input);

        long start = System.nanoTime();
        ResponseEntity<String> response = exchange(config.baseUrl() + "/predictions", HttpMethod.POST,
                new HttpEntity<>(body.toString(), jsonHeaders()), start);
        if (response.getStatusCode().value() != HttpStatus.CREATED.value()) {
            throw InpaintExceptionBuilder.create("Prediction was not created")
                    .backend(BackendNames.CLOUD)
                    .httpStatus(response.getStatusCode().value())
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .build();
        }
        String id = parse(response.getBody()).optString("id", "");
        if (id.isBlank()) {
            throw new InpaintException("Prediction response has no id", BackendNames.CLOUD);
        }
        LOG.info("Submitted cloud prediction id={} in {} ms", id, TimeUtils.elapsedMillis(start));
        return id;
    }

    @Override
    public PredictionStatus poll(String jobId) {
        long start = System.nanoTime();
        ResponseEntity<String> response = exchange(config.baseUrl() + "/predictions/" + jobId, HttpMethod.GET,
                new HttpEntity<>(authHeaders()), start);
        JSONObject json = parse(response.getBody());
        String status = json.optString("status", "");
        String error = json.isNull("error") ? null : json.optString("error", null);
        PredictionStatus result = new PredictionStatus(status, outputUrl(json), error);
        LOG.debug("Prediction {} status={}", jobId, status);
        return result;
    }

    @Override
    public byte[] download(String url) {
        long start = System.nanoTime();
        try {
            byte[] bytes = rest.getForObject(url, byte[].class);
            if (bytes == null || bytes.length == 0) {
                throw new InpaintException("Empty prediction output at " + url, BackendNames.CLOUD);
            }
            LOG.debug("Downloaded prediction output: {} bytes in {} ms", bytes.length, TimeUtils.elapsedMillis(start));
            return bytes;
        } catch (RestClientException e) {
            throw InpaintExceptionBuilder.create("Failed to download prediction output")
                    .backend(BackendNames.CLOUD)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .build();
        }
    }

    private ResponseEntity<String> exchange(String url, HttpMethod method, HttpEntity<?> entity, long start) {
        try {
            return rest.exchange(url, method, entity, String.class);
        } catch (RestClientResponseException e) {
            throw InpaintExceptionBuilder.create("Cloud request failed: " + method + " " + url)
                    .backend(BackendNames.CLOUD)
                    .httpStatus(e.getStatusCode().value())
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("body", LogSanitizer.preview(e.getResponseBodyAsString(), MAX_BODY_PREVIEW))
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw InpaintExceptionBuilder.create("Cloud request failed: " + method + " " + url)
                    .backend(BackendNames.CLOUD)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .cause(e)
                    .build();
        }
    }

    private HttpHeaders authHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(config.apiToken());
        return headers;
    }

    private HttpHeaders jsonHeaders() {
        HttpHeaders headers = authHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    private static JSONObject parse(String body) {
        if (body == null || body.isBlank()) {
            throw new InpaintException("Empty response body", BackendNames.CLOUD);
        }
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw new InpaintException("Malformed JSON response: " + LogSanitizer.preview(body, MAX_BODY_PREVIEW),
                    BackendNames.CLOUD, e);
        }
    }

    // Output is either a URL or a list of URLs
    static String outputUrl(JSONObject json) {
        if (!json.has("output") || json.isNull("output")) {
            return null;
        }
        Object output = json.get("output");
        if (output instanceof JSONArray array) {
            return array.isEmpty() ? null : array.optString(0, null);
        }
        String url = output.toString();
        return url.isBlank() ? null : url;
    }

    // "owner/model:version" or a bare version id
    static String versionId(String modelVersion) {
        int colon = modelVersion.lastIndexOf(':');
        return colon >= 0 ? modelVersion.substring(colon + 1) : modelVersion;
    }

    private static String dataUri(byte[] png) {
        return "data:image/png;base64," + Base64.getEncoder().encodeToString(png);
    }
}
