package me.golemcore.incident.adapter.outbound.llm.converse;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseRequest;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseResponse;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseStreamEvent;
import me.golemcore.incident.infrastructure.config.IncidentProperties;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Converse transport over HTTP using OkHttp.
 *
 * <p>
 * Endpoints (relative to {@code incident.llm.converse.endpoint}):
 * <ul>
 * <li>POST {@code /model/{modelId}/converse} - single response</li>
 * <li>POST {@code /model/{modelId}/converse-stream} - newline-delimited JSON
 * events, one {@link ConverseStreamEvent} per line</li>
 * </ul>
 *
 * <p>
 * The API key, when configured, is sent as a bearer token. Non-2xx responses
 * become {@link ConverseApiException} using the {@code x-amzn-ErrorType} header
 * and the body's {@code message} field.
 */
@Component
@Slf4j
public class HttpConverseTransport implements ConverseTransport {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String ERROR_TYPE_HEADER = "x-amzn-ErrorType";
    private static final String MODEL_ID_PLACEHOLDER = "{modelId}";

    private final IncidentProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpConverseTransport(IncidentProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        long timeout = properties.getLlm().getConverse().getRequestTimeout();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeout, TimeUnit.MILLISECONDS)
                .readTimeout(timeout, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public ConverseResponse converse(ConverseRequest request) {
        IncidentProperties.ConverseProperties config = properties.getLlm().getConverse();
        Request httpRequest = buildRequest(config.getConversePath(), request);

        try (Response response = httpClient.newCall(httpRequest).execute()) {
            ResponseBody body = response.body();
            String bodyText = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw toApiException(response, bodyText);
            }
            return objectMapper.readValue(bodyText, ConverseResponse.class);
        } catch (JsonProcessingException e) {
            throw new ConverseApiException("Malformed Converse response: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConverseApiException("Converse call failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Flux<ConverseStreamEvent> converseStream(ConverseRequest request) {
        return Flux.<ConverseStreamEvent>create(sink -> {
            IncidentProperties.ConverseProperties config = properties.getLlm().getConverse();
            Call call = httpClient.newCall(buildRequest(config.getStreamPath(), request));
            sink.onCancel(call::cancel);
            readEvents(call, sink);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private void readEvents(Call call, FluxSink<ConverseStreamEvent> sink) {
        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                sink.error(toApiException(response, body != null ? body.string() : ""));
                return;
            }
            if (body == null) {
                sink.complete();
                return;
            }
            BufferedSource source = body.source();
            String line;
            while (!sink.isCancelled() && (line = source.readUtf8Line()) != null) {
                if (!line.isBlank()) {
                    sink.next(objectMapper.readValue(line, ConverseStreamEvent.class));
                }
            }
            sink.complete();
        } catch (JsonProcessingException e) {
            sink.error(new ConverseApiException("Malformed Converse stream event: " + e.getOriginalMessage(), e));
        } catch (IOException e) {
            if (sink.isCancelled()) {
                log.debug("[Converse] Stream read stopped after cancellation");
                return;
            }
            sink.error(new ConverseApiException("Converse stream failed: " + e.getMessage(), e));
        }
    }

    private Request buildRequest(String pathTemplate, ConverseRequest request) {
        IncidentProperties.ConverseProperties config = properties.getLlm().getConverse();
        String body;
        try {
            body = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize Converse request", e);
        }

        Request.Builder builder = new Request.Builder()
                .url(buildUrl(config.getEndpoint(), pathTemplate, request.getModelId()))
                .post(RequestBody.create(body, JSON));
        String apiKey = config.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    static HttpUrl buildUrl(String endpoint, String pathTemplate, String modelId) {
        HttpUrl base = endpoint != null ? HttpUrl.parse(endpoint) : null;
        if (base == null) {
            throw new IllegalStateException("Converse endpoint is not configured or invalid: " + endpoint);
        }
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalStateException("No Converse model id configured");
        }
        HttpUrl.Builder url = base.newBuilder();
        for (String segment : pathTemplate.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            url.addPathSegment(MODEL_ID_PLACEHOLDER.equals(segment) ? modelId : segment);
        }
        return url.build();
    }

    private ConverseApiException toApiException(Response response, String bodyText) {
        String errorType = response.header(ERROR_TYPE_HEADER);
        if (errorType != null && errorType.contains(":")) {
            errorType = errorType.substring(0, errorType.indexOf(':'));
        }
        String message = bodyText;
        try {
            JsonNode node = objectMapper.readTree(bodyText);
            if (node != null && node.hasNonNull("message")) {
                message = node.get("message").asText();
            } else if (node != null && node.hasNonNull("Message")) {
                message = node.get("Message").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("[Converse] Error body is not JSON");
        }
        log.warn("[Converse] HTTP {} ({}): {}", response.code(), errorType, message);
        return ConverseApiException.fromResponse(response.code(), errorType, message);
    }
}
