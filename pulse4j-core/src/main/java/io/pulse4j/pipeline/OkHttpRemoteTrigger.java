package io.pulse4j.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Posts {@code {"timestamp": ISO-8601, "source": ...}} plus the step payload to the step target
 * with OkHttp.
 */
public class OkHttpRemoteTrigger implements RemoteTrigger {
    private static final Logger log = LoggerFactory.getLogger(OkHttpRemoteTrigger.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OkHttpRemoteTrigger(OkHttpClient client, ObjectMapper objectMapper, Clock clock) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public OkHttpRemoteTrigger(ObjectMapper objectMapper) {
        this(defaultClient(), objectMapper, Clock.systemUTC());
    }

    // The runner owns step timeouts; the client only bounds abandoned calls.
    public static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofMinutes(10))
                .build();
    }

    @Override
    public CompletableFuture<TriggerResponse> dispatch(PipelineSpec pipeline, PipelineStep step) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body(pipeline, step));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }

        Request request = new Request.Builder()
                .url(step.target().toString())
                .post(RequestBody.create(json, JSON))
                .build();

        CompletableFuture<TriggerResponse> future = new CompletableFuture<>();
        log.debug("Remote trigger dispatched pipeline={} step={} target={}", pipeline.name(), step.name(), step.target());
        client.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (ResponseBody responseBody = response.body()) {
                    String text = responseBody != null ? responseBody.string() : "";
                    future.complete(new TriggerResponse(response.code(), text));
                } catch (IOException e) {
                    future.completeExceptionally(e);
                }
            }
        });
        return future;
    }

    private Map<String, Object> body(PipelineSpec pipeline, PipelineStep step) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", clock.instant().toString());
        body.put("source", pipeline.source());
        step.payload().forEach(body::putIfAbsent);
        return body;
    }
}
