package com.zzf.localagent.core.planner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.localagent.util.JsonUtils;
import com.zzf.localagent.util.StringUtils;
import dev.langchain4j.model.chat.ChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@link PlanGenerator} that asks a chat model for a short JSON step list.
 */
public class LlmPlanGenerator implements PlanGenerator {
    private static final Logger logger = LoggerFactory.getLogger(LlmPlanGenerator.class);

    private static final String PLAN_PROMPT = "You are planning a change in a software repository.\n" +
            "Break the request into a few short, concrete steps (at most one line each).\n" +
            "Output strictly in JSON format: {\"steps\": [\"step 1\", \"step 2\"]}\n" +
            "User request: ";

    private final ChatModel model;
    private final ObjectMapper mapper;
    private final int maxSteps;

    public LlmPlanGenerator(ChatModel model, ObjectMapper mapper, int maxSteps) {
        this.model = model;
        this.mapper = mapper;
        this.maxSteps = maxSteps;
    }

    @Override
    public List<String> generatePlan(String userText) {
        String raw = model.chat(PLAN_PROMPT + StringUtils.truncate(userText, 2000));
        List<String> steps;
        try {
            JsonNode node = mapper.readTree(JsonUtils.extractFirstJsonObject(raw));
            steps = JsonUtils.textList(node, "steps");
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.warn("plan.generate.unparsable err={} raw={}", e.getMessage(), StringUtils.truncate(raw, 200));
            return List.of();
        }
        if (steps.size() > maxSteps) {
            return List.copyOf(steps.subList(0, maxSteps));
        }
        return steps;
    }
}
