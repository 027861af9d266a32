package io.switchboard.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchboard.core.model.AIRequest;
import io.switchboard.core.model.TaskType;
import org.junit.jupiter.api.Test;

class PromptAssemblerTest {
    private final PromptAssembler assembler = new PromptAssembler(new ObjectMapper());

    @Test
    void shouldRenderContextKeysInInsertionOrder() {
        AIRequest request = AIRequest.builder(TaskType.STRUCTURED_ANALYSIS)
            .prompt("analyse the order")
            .context("zeta", 1)
            .context("alpha", 2)
            .context("mid", 3)
            .build();

        String text = assembler.userText(request);

        assertThat(text).startsWith("analyse the order\n\nContext:\n");
        assertThat(text.indexOf("\"zeta\"")).isLessThan(text.indexOf("\"alpha\""));
        assertThat(text.indexOf("\"alpha\"")).isLessThan(text.indexOf("\"mid\""));
    }
}
