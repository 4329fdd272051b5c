package com.zzf.localagent.core.planner;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

class LlmPlanGeneratorTest {

    private ChatModel model;
    private LlmPlanGenerator generator;

    @BeforeEach
    void setUp() {
        model = Mockito.mock(ChatModel.class);
        generator = new LlmPlanGenerator(model, new ObjectMapper(), 3);
    }

    @Test
    void testFencedReply() {
        when(model.chat(anyString())).thenReturn("Sure:\n```json\n{\"steps\": [\" read auth.py \", \"\", \"fix login\"]}\n```");
        assertEquals(List.of("read auth.py", "fix login"), generator.generatePlan("fix login"));
    }

    @Test
    void testBareReplyIsCapped() {
        when(model.chat(anyString())).thenReturn("plan {\"steps\": [\"a\", \"b\", \"c\", \"d\"]} done");
        assertEquals(List.of("a", "b", "c"), generator.generatePlan("do things"));
    }

    @Test
    void testUnparsableReplyYieldsEmptyPlan() {
        when(model.chat(anyString())).thenReturn("I cannot help with that");
        assertTrue(generator.generatePlan("fix login").isEmpty());
    }
}
