package io.switchboard.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Backend-neutral inference request accepted by the gateway.
 */
public record AIRequest(
    TaskType taskType,
    String prompt,
    String systemPrompt,
    ImageInput image,
    Map<String, Object> context,
    List<ChatTurn> history,
    GenerationParams params,
    boolean stream,
    OutputShape outputShape,
    String preferredModel,
    String preferredProvider
) {

    public AIRequest {
        Objects.requireNonNull(taskType, "taskType must not be null");
        prompt = prompt == null ? "" : prompt;
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        context = context == null ? Map.of() : copyContext(context);
        history = history == null ? List.of() : List.copyOf(history);
        params = params == null ? GenerationParams.defaults() : params;
        outputShape = outputShape == null ? OutputShape.TEXT : outputShape;
        preferredModel = preferredModel == null ? "" : preferredModel.trim();
        preferredProvider = preferredProvider == null ? "" : preferredProvider.trim();
        if (prompt.isBlank() && image == null && history.isEmpty()) {
            throw new IllegalArgumentException("request needs a prompt, an image or history");
        }
    }

    private static Map<String, Object> copyContext(Map<String, Object> context) {
        Map<String, Object> copy = new LinkedHashMap<>();
        context.forEach((key, value) -> {
            if (key == null || value == null) {
                throw new IllegalArgumentException("context entries need a non-null key and value, got " + key + "=" + value);
            }
            copy.put(key, value);
        });
        return Collections.unmodifiableMap(copy);
    }

    public static Builder builder(TaskType taskType) {
        return new Builder(taskType);
    }

    public boolean hasImage() {
        return image != null;
    }

    public boolean wantsJson() {
        return outputShape == OutputShape.JSON;
    }

    public AIRequest withParams(GenerationParams newParams) {
        return new AIRequest(
            taskType,
            prompt,
            systemPrompt,
            image,
            context,
            history,
            newParams,
            stream,
            outputShape,
            preferredModel,
            preferredProvider
        );
    }

    public static final class Builder {
        private final TaskType taskType;
        private String prompt = "";
        private String systemPrompt = "";
        private ImageInput image;
        private final Map<String, Object> context = new LinkedHashMap<>();
        private final List<ChatTurn> history = new ArrayList<>();
        private GenerationParams params = GenerationParams.defaults();
        private boolean stream;
        private OutputShape outputShape = OutputShape.TEXT;
        private String preferredModel = "";
        private String preferredProvider = "";

        private Builder(TaskType taskType) {
            this.taskType = taskType;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder image(ImageInput image) {
            this.image = image;
            return this;
        }

        public Builder context(String key, Object value) {
            this.context.put(key, value);
            return this;
        }

        public Builder history(List<ChatTurn> turns) {
            this.history.addAll(turns);
            return this;
        }

        public Builder params(GenerationParams params) {
            this.params = params;
            return this;
        }

        public Builder stream(boolean stream) {
            this.stream = stream;
            return this;
        }

        public Builder outputShape(OutputShape outputShape) {
            this.outputShape = outputShape;
            return this;
        }

        public Builder preferredModel(String preferredModel) {
            this.preferredModel = preferredModel;
            return this;
        }

        public Builder preferredProvider(String preferredProvider) {
            this.preferredProvider = preferredProvider;
            return this;
        }

        public AIRequest build() {
            return new AIRequest(
                taskType,
                prompt,
                systemPrompt,
                image,
                context,
                history,
                params,
                stream,
                outputShape,
                preferredModel,
                preferredProvider
            );
        }
    }
}
