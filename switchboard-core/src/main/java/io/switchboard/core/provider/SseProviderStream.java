package io.switchboard.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.model.ErrorKind;
import io.switchboard.core.model.GatewayError;
import io.switchboard.core.model.StreamEvent;
import io.switchboard.core.model.TokenUsage;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;
import okhttp3.Call;
import okhttp3.Response;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class SseProviderStream implements ProviderStream {
    private static final Logger LOG = LoggerFactory.getLogger(SseProviderStream.class);
    private static final String DATA_PREFIX = "data:";
    private static final String DONE = "[DONE]";

    private final String modelId;
    private final Call call;
    private final Response response;
    private final BufferedSource source;
    private final ObjectMapper mapper;
    private final Function<JsonNode, List<StreamEvent>> chunkParser;
    private final Deque<StreamEvent> pending = new ArrayDeque<>();
    private TokenUsage lastUsage = TokenUsage.empty();
    private boolean finished;

    SseProviderStream(
        String modelId,
        Call call,
        Response response,
        ObjectMapper mapper,
        Function<JsonNode, List<StreamEvent>> chunkParser
    ) {
        this.modelId = modelId;
        this.call = call;
        this.response = response;
        this.source = response.body() == null ? null : response.body().source();
        this.mapper = mapper;
        this.chunkParser = chunkParser;
    }

    @Override
    public boolean hasNext() {
        if (!pending.isEmpty()) {
            return true;
        }
        if (finished) {
            return false;
        }
        fill();
        return !pending.isEmpty();
    }

    @Override
    public StreamEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return pending.poll();
    }

    @Override
    public void close() {
        if (!finished) {
            finished = true;
            pending.clear();
            call.cancel();
        }
        response.close();
    }

    private void fill() {
        if (source == null) {
            finish(StreamEvent.end(lastUsage));
            return;
        }
        try {
            while (pending.isEmpty()) {
                String line = source.readUtf8Line();
                if (line == null) {
                    finish(StreamEvent.end(lastUsage));
                    return;
                }
                if (line.isBlank() || !line.startsWith(DATA_PREFIX)) {
                    continue;
                }
                String payload = line.substring(DATA_PREFIX.length()).trim();
                if (payload.isEmpty()) {
                    continue;
                }
                if (DONE.equals(payload)) {
                    finish(StreamEvent.end(lastUsage));
                    return;
                }
                JsonNode chunk;
                try {
                    chunk = mapper.readTree(payload);
                } catch (JsonProcessingException e) {
                    LOG.warn("Skipping malformed stream chunk from model {}: {}", modelId, e.getOriginalMessage());
                    continue;
                }
                for (StreamEvent event : chunkParser.apply(chunk)) {
                    if (event.type() == StreamEvent.Type.USAGE) {
                        lastUsage = event.usage();
                    }
                    if (event.type() == StreamEvent.Type.ERROR) {
                        finish(event);
                        return;
                    }
                    if (event.type() != StreamEvent.Type.END) {
                        pending.add(event);
                    }
                }
            }
        } catch (IOException e) {
            if (call.isCanceled()) {
                finish(StreamEvent.error(GatewayError.of(ErrorKind.CANCELLED, "stream cancelled")));
            } else {
                finish(StreamEvent.error(ErrorClassifier.fromException(e)));
            }
        }
    }

    private void finish(StreamEvent terminal) {
        pending.add(terminal);
        finished = true;
        response.close();
    }
}
