package io.switchboard.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.model.AIRequest;
import io.switchboard.core.model.ChatRole;
import io.switchboard.core.model.ChatTurn;
import java.util.ArrayList;
import java.util.List;

final class PromptAssembler {
    static final String JSON_INSTRUCTION =
        "Respond with a single valid JSON value only. Do not wrap it in markdown or add commentary.";

    private final ObjectMapper mapper;

    PromptAssembler(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    String systemInstruction(AIRequest request) {
        StringBuilder system = new StringBuilder(request.systemPrompt().trim());
        for (ChatTurn turn : request.history()) {
            if (turn.role() == ChatRole.SYSTEM && !turn.content().isBlank()) {
                appendParagraph(system, turn.content().trim());
            }
        }
        if (request.wantsJson()) {
            appendParagraph(system, JSON_INSTRUCTION);
        }
        return system.toString();
    }

    // System turns are folded into the system instruction.
    List<ChatTurn> conversation(AIRequest request) {
        List<ChatTurn> turns = new ArrayList<>();
        for (ChatTurn turn : request.history()) {
            if (turn.role() != ChatRole.SYSTEM) {
                turns.add(turn);
            }
        }
        return turns;
    }

    String userText(AIRequest request) {
        StringBuilder text = new StringBuilder(request.prompt());
        if (!request.context().isEmpty()) {
            appendParagraph(text, "Context:\n" + renderContext(request));
        }
        return text.toString();
    }

    boolean hasUserTurn(AIRequest request) {
        return !request.prompt().isBlank() || request.hasImage() || !request.context().isEmpty();
    }

    private String renderContext(AIRequest request) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(request.context());
        } catch (JsonProcessingException e) {
            return request.context().toString();
        }
    }

    private static void appendParagraph(StringBuilder target, String paragraph) {
        if (target.length() > 0) {
            target.append("\n\n");
        }
        target.append(paragraph);
    }
}
