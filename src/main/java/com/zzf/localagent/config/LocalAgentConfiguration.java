package com.zzf.localagent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.localagent.checkpoint.CheckpointService;
import com.zzf.localagent.core.planner.LlmPlanGenerator;
import com.zzf.localagent.core.planner.PlanGenerator;
import com.zzf.localagent.core.planner.QueryPlanner;
import com.zzf.localagent.exception.ValidationException;
import com.zzf.localagent.project.AgentContext;
import com.zzf.localagent.task.TaskHandler;
import com.zzf.localagent.task.TaskHandlerRegistry;
import com.zzf.localagent.task.TaskMetrics;
import com.zzf.localagent.task.TaskQueue;
import com.zzf.localagent.task.TaskWorker;
import com.zzf.localagent.task.TaskWorkerHealthIndicator;
import com.zzf.localagent.task.handler.QueryTaskHandler;
import com.zzf.localagent.task.handler.RevertTaskHandler;
import com.zzf.localagent.task.handler.SnapshotTaskHandler;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

@Configuration
public class LocalAgentConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(LocalAgentConfiguration.class);

    @Bean
    public AgentContext agentContext(LocalAgentProperties properties, ObjectMapper mapper) {
        if (properties.getSnapshot().getMaxSnapshots() < 1) {
            throw new ValidationException("localagent.snapshot.max-snapshots must be >= 1");
        }
        AgentContext context = new AgentContext(properties, mapper);
        String repoRoot = properties.getRepoRoot();
        if (repoRoot != null && !repoRoot.isBlank()) {
            context.init(repoRoot);
        } else {
            logger.info("context.init skip reason=no_repo_root");
        }
        return context;
    }

    @Bean
    public CheckpointService checkpointService(AgentContext context) {
        return new CheckpointService(context);
    }

    @Bean
    public TaskQueue taskQueue(LocalAgentProperties properties, ObjectMapper mapper) {
        Path tasksRoot = resolveTasksRoot(properties);
        logger.info("tasks.root path={}", tasksRoot);
        return new TaskQueue(tasksRoot, mapper);
    }

    @Bean
    public QueryTaskHandler queryTaskHandler(QueryPlanner planner, ObjectMapper mapper) {
        return new QueryTaskHandler(planner, mapper);
    }

    @Bean
    public SnapshotTaskHandler snapshotTaskHandler(AgentContext context) {
        return new SnapshotTaskHandler(context);
    }

    @Bean
    public RevertTaskHandler revertTaskHandler(CheckpointService checkpoints) {
        return new RevertTaskHandler(checkpoints);
    }

    @Bean
    public TaskHandlerRegistry taskHandlerRegistry(List<TaskHandler> handlers) {
        return new TaskHandlerRegistry(handlers);
    }

    @Bean
    public TaskMetrics taskMetrics(MeterRegistry registry) {
        return new TaskMetrics(registry);
    }

    @Bean
    public TaskWorker taskWorker(TaskQueue queue, TaskHandlerRegistry handlers, TaskMetrics metrics,
                                 LocalAgentProperties properties) {
        return new TaskWorker(queue, handlers, metrics,
                properties.getWorker().getPollInterval(), properties.getWorker().isAutostart());
    }

    @Bean
    public TaskWorkerHealthIndicator taskWorkerHealthIndicator(TaskWorker worker) {
        return new TaskWorkerHealthIndicator(worker);
    }

    @Bean
    @ConditionalOnProperty(prefix = "localagent.plan-generator", name = "enabled", havingValue = "true")
    public PlanGenerator planGenerator(LocalAgentProperties properties, ObjectMapper mapper) {
        LocalAgentProperties.PlanGenerator cfg = properties.getPlanGenerator();
        if (cfg.getApiKey() == null || cfg.getApiKey().isBlank()) {
            throw new ValidationException("localagent.plan-generator.api-key is required when the plan generator is enabled");
        }
        OpenAiChatModel model = OpenAiChatModel.builder()
                .apiKey(cfg.getApiKey().trim())
                .baseUrl(cfg.getBaseUrl())
                .modelName(cfg.getModelName())
                .temperature(0.0)
                .timeout(cfg.getTimeout())
                .build();
        logger.info("plan.generator selected=openai url={} model={} maxSteps={}", cfg.getBaseUrl(), cfg.getModelName(), cfg.getMaxSteps());
        return new LlmPlanGenerator(model, mapper, cfg.getMaxSteps());
    }

    static Path resolveTasksRoot(LocalAgentProperties properties) {
        if (properties.getTasksDir() != null && !properties.getTasksDir().isBlank()) {
            return Paths.get(properties.getTasksDir().trim()).toAbsolutePath().normalize();
        }
        String base = properties.getRepoRoot();
        if (base == null || base.isBlank()) {
            base = System.getProperty("user.dir");
        }
        return Paths.get(base.trim()).toAbsolutePath().normalize().resolve(properties.getStateDir()).resolve("tasks");
    }
}
