package me.golemcore.gateway.adapter.outbound.llm;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.CanonicalResponse;
import me.golemcore.gateway.domain.model.StreamDelta;
import me.golemcore.gateway.domain.model.TranslationException;
import me.golemcore.gateway.domain.model.UpstreamException;
import me.golemcore.gateway.domain.system.StreamAccumulator;
import okhttp3.Call;
import okhttp3.Callback;
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
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Sends {@link WireRequest}s over OkHttp and maps transport outcomes onto the
 * gateway error taxonomy.
 *
 * <p>
 * Non-2xx replies become {@link UpstreamException} with the provider's status
 * and body; I/O failures become {@link UpstreamException} with status 0.
 * Cancelling the returned future or the stream subscription cancels the
 * in-flight OkHttp call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UpstreamClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_ERROR_BODY = 4000;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public CompletableFuture<CanonicalResponse> execute(ProviderAdapter adapter, WireRequest wire) {
        CompletableFuture<CanonicalResponse> future = new CompletableFuture<>();
        Call call = httpClient.newCall(buildRequest(adapter, wire));
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                call.cancel();
            }
        });
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failedCall, IOException e) {
                future.completeExceptionally(new UpstreamException(adapter.getProviderId(), e.getMessage(), e));
            }

            @Override
            public void onResponse(Call okCall, Response response) {
                try (response) {
                    String body = readBody(response);
                    if (!response.isSuccessful()) {
                        log.warn("[Provider] {} returned HTTP {}", adapter.getProviderId(), response.code());
                        future.completeExceptionally(
                                new UpstreamException(adapter.getProviderId(), response.code(), truncate(body)));
                        return;
                    }
                    future.complete(adapter.fromWire(new WireResponse(response.code(), body)));
                } catch (IOException e) {
                    future.completeExceptionally(new UpstreamException(adapter.getProviderId(), e.getMessage(), e));
                } catch (RuntimeException e) { // NOSONAR - surfaced through the future
                    future.completeExceptionally(e);
                }
            }
        });
        return future;
    }

    /**
     * Streams deltas for {@code wire}. Malformed chunks are skipped with a
     * warning; a connection that drops after some deltas were received
     * completes the stream normally so the consumer can mark the response
     * incomplete.
     */
    public Flux<StreamDelta> stream(ProviderAdapter adapter, WireRequest wire) {
        return Flux.<StreamDelta>create(sink -> {
            Call call = httpClient.newCall(buildRequest(adapter, wire));
            sink.onDispose(call::cancel);
            StreamAccumulator state = new StreamAccumulator(objectMapper, adapter.getProviderId());
            try (Response response = call.execute()) {
                if (!response.isSuccessful()) {
                    sink.error(new UpstreamException(adapter.getProviderId(), response.code(),
                            truncate(readBody(response))));
                    return;
                }
                ResponseBody body = response.body();
                if (body == null) {
                    sink.complete();
                    return;
                }
                readEvents(body.source(), adapter, state, sink);
                sink.complete();
            } catch (IOException e) {
                if (sink.isCancelled() || call.isCanceled()) {
                    log.debug("[Provider] {} stream cancelled", adapter.getProviderId());
                    return;
                }
                if (state.receivedCount() > 0) {
                    log.warn("[Provider] {} stream interrupted after {} deltas: {}",
                            adapter.getProviderId(), state.receivedCount(), e.getMessage());
                    sink.complete();
                } else {
                    sink.error(new UpstreamException(adapter.getProviderId(), e.getMessage(), e));
                }
            } catch (RuntimeException e) { // NOSONAR - surfaced through the sink
                sink.error(e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private void readEvents(BufferedSource source, ProviderAdapter adapter, StreamAccumulator state,
            FluxSink<StreamDelta> sink) throws IOException {
        StringBuilder data = new StringBuilder();
        String line;
        while (!sink.isCancelled() && (line = source.readUtf8Line()) != null) {
            if (line.isEmpty()) {
                dispatch(data, adapter, state, sink);
                continue;
            }
            if (line.startsWith(":")) {
                continue;
            }
            if (line.startsWith("data:")) {
                if (!data.isEmpty()) {
                    data.append('\n');
                }
                data.append(line.substring(5).stripLeading());
            }
        }
        dispatch(data, adapter, state, sink);
    }

    private void dispatch(StringBuilder data, ProviderAdapter adapter, StreamAccumulator state,
            FluxSink<StreamDelta> sink) {
        if (data.isEmpty()) {
            return;
        }
        String payload = data.toString();
        data.setLength(0);
        List<StreamDelta> deltas;
        try {
            deltas = adapter.fromWireChunk(payload, state);
        } catch (TranslationException e) {
            log.warn("[Provider] {} skipped malformed stream chunk: {}", adapter.getProviderId(), e.getMessage());
            return;
        }
        for (StreamDelta delta : deltas) {
            state.accept(delta);
            sink.next(delta);
        }
    }

    private Request buildRequest(ProviderAdapter adapter, WireRequest wire) {
        String json;
        try {
            json = objectMapper.writeValueAsString(wire.body());
        } catch (JsonProcessingException e) {
            throw new TranslationException(adapter.getProviderId(), "Cannot serialize request body", e);
        }
        Request.Builder builder = new Request.Builder()
                .url(wire.url())
                .post(RequestBody.create(json, JSON));
        for (Map.Entry<String, String> header : wire.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        if (wire.stream()) {
            builder.header("Accept", "text/event-stream");
        }
        return builder.build();
    }

    private static String readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    private static String truncate(String body) {
        if (body == null || body.length() <= MAX_ERROR_BODY) {
            return body;
        }
        return body.substring(0, MAX_ERROR_BODY) + "...";
    }
}
