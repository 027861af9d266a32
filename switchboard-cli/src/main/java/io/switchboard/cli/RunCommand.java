package io.switchboard.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.model.AIRequest;
import io.switchboard.core.model.AIResponse;
import io.switchboard.core.model.GenerationParams;
import io.switchboard.core.model.ImageInput;
import io.switchboard.core.model.OutputShape;
import io.switchboard.core.model.StreamEvent;
import io.switchboard.core.model.TaskType;
import io.switchboard.core.streaming.GatewayStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "run", description = "Send one request through the gateway")
public final class RunCommand implements Callable<Integer> {
    private final CliContext context;
    private final ObjectMapper mapper = new ObjectMapper();

    @Parameters(index = "0", arity = "0..1", description = "Prompt text")
    String prompt;

    @Option(names = {"-t", "--task"}, defaultValue = "SUMMARIZATION", description = "Task type: ${COMPLETION-CANDIDATES}")
    TaskType task;

    @Option(names = {"-s", "--system"}, description = "System prompt")
    String systemPrompt;

    @Option(names = {"-i", "--image"}, description = "Image file to attach")
    Path image;

    @Option(names = {"--image-url"}, description = "Image URL to attach")
    String imageUrl;

    @Option(names = {"-m", "--model"}, description = "Preferred model name or id")
    String model;

    @Option(names = {"-p", "--provider"}, description = "Preferred provider")
    String provider;

    @Option(names = "--json", description = "Ask for a JSON response")
    boolean json;

    @Option(names = "--stream", description = "Print the response as it arrives")
    boolean stream;

    @Option(names = "--max-tokens", description = "Maximum output tokens")
    Integer maxTokens;

    @Option(names = "--temperature", description = "Sampling temperature")
    Double temperature;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            AIRequest request = buildRequest();
            return stream ? streamResponse(request) : printResponse(request);
        } catch (Exception e) {
            System.err.println("Run command failed: " + e.getMessage());
            return 1;
        }
    }

    private AIRequest buildRequest() throws Exception {
        GenerationParams defaults = GenerationParams.defaults();
        AIRequest.Builder builder = AIRequest.builder(task)
            .prompt(prompt)
            .systemPrompt(systemPrompt)
            .preferredModel(model)
            .preferredProvider(provider)
            .outputShape(json ? OutputShape.JSON : OutputShape.TEXT)
            .stream(stream)
            .params(new GenerationParams(
                temperature != null ? temperature : defaults.temperature(),
                maxTokens != null ? maxTokens : defaults.maxOutputTokens(),
                defaults.topP()
            ));
        if (image != null) {
            builder.image(ImageInput.inline(Files.readAllBytes(image), Files.probeContentType(image)));
        } else if (imageUrl != null && !imageUrl.isBlank()) {
            builder.image(ImageInput.ofUrl(imageUrl));
        }
        return builder.build();
    }

    private int printResponse(AIRequest request) throws Exception {
        AIResponse response = context.gateway().execute(request);
        if (!response.success()) {
            System.err.println("Request failed (" + response.errorKind().wireName() + "): " + response.errorMessage());
            return 1;
        }
        if (response.json() != null) {
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(response.json()));
        } else {
            System.out.println(response.text());
        }
        System.err.printf(
            "model=%s tokens=%d cost=%.6f duration=%dms%n",
            response.modelName(),
            response.usage().totalTokens(),
            response.cost(),
            response.durationMs()
        );
        return 0;
    }

    private int streamResponse(AIRequest request) {
        PrintStream out = System.out;
        try (GatewayStream events = context.gateway().executeStream(request)) {
            while (events.hasNext()) {
                StreamEvent event = events.next();
                switch (event.type()) {
                    case CONTENT -> {
                        out.print(event.content());
                        out.flush();
                    }
                    case END -> {
                        out.println();
                        System.err.println("tokens=" + event.usage().totalTokens());
                        return 0;
                    }
                    case ERROR -> {
                        out.println();
                        System.err.println("Stream failed: " + event.error());
                        return 1;
                    }
                    default -> {
                    }
                }
            }
        }
        return 0;
    }
}
