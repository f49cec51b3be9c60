package com.autonomous.pipeline.service;

import com.autonomous.pipeline.exception.ConfigurationException;
import com.autonomous.pipeline.exception.PipelineException;
import com.autonomous.pipeline.model.Interaction;
import com.autonomous.pipeline.model.PipelineStep;
import com.autonomous.pipeline.model.TaskDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Builds the prompt the agent receives for a step: pipeline overview, autonomy instructions,
 * task context and the step's command instructions.
 */
@Slf4j
@Service
public class PromptBuilderService {

    public static final String TASK_DEFINITION = "TASK DEFINITION";
    public static final String PLAN_CONTENT = "PLAN CONTENT";
    public static final String INTERACTION_HISTORY = "INTERACTION HISTORY";

    static final String PLAN_STEP = "plan";
    static final String PLAN_FILE = "PLAN.md";

    private static final Pattern FRONT_MATTER = Pattern.compile("^---\\s*(.+?)\\s*---", Pattern.DOTALL);
    private static final String INTRO_TEMPLATE = "prompts/interaction-intro.md";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private String introTemplate;

    // =================================================================
    // Task files
    // =================================================================

    public TaskDefinition readTask(Path taskPath) {
        try {
            return parseTask(Files.readString(taskPath, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new PipelineException("Could not read task file " + taskPath, e);
        }
    }

    /**
     * Splits optional YAML front matter off a task file. Front matter that does not parse
     * is left in place and the whole file becomes the body.
     */
    public TaskDefinition parseTask(String content) {
        Matcher matcher = FRONT_MATTER.matcher(content);
        if (!matcher.find()) {
            return new TaskDefinition(null, null, content);
        }
        Map<String, Object> frontMatter;
        try {
            frontMatter = yamlMapper.readValue(matcher.group(1), new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unparsable front matter: {}", e.getOriginalMessage());
            return new TaskDefinition(null, null, content);
        }
        String body = content.substring(matcher.end()).trim();
        if (frontMatter == null) {
            return new TaskDefinition(null, null, body);
        }

        Object autonomy = frontMatter.get("autonomyLevel");
        if (frontMatter.containsKey("interactionThreshold")) {
            log.warn("'interactionThreshold' in task front matter is deprecated. Please rename it to 'autonomyLevel'.");
            autonomy = frontMatter.get("interactionThreshold");
        }
        Object pipeline = frontMatter.get("pipeline");
        return new TaskDefinition(
            pipeline != null ? pipeline.toString() : null,
            autonomy instanceof Number ? ((Number) autonomy).intValue() : null,
            body);
    }

    // =================================================================
    // Step commands
    // =================================================================

    /**
     * Location of a step's instructions: {@code .pipeline-agent/steps/} first, then the legacy
     * {@code .claude/commands/}. Returns the preferred location when neither exists.
     */
    public Path resolveCommandFile(Path projectRoot, String command) {
        Path preferred = projectRoot.resolve(".pipeline-agent").resolve("steps").resolve(command + ".md");
        if (Files.exists(preferred)) {
            return preferred;
        }
        Path legacy = projectRoot.resolve(".claude").resolve("commands").resolve(command + ".md");
        return Files.exists(legacy) ? legacy : preferred;
    }

    public String readCommandInstructions(Path projectRoot, String command) {
        Path file = resolveCommandFile(projectRoot, command);
        if (!Files.exists(file)) {
            throw new ConfigurationException("Command instruction file not found for \"" + command + "\": " + file);
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PipelineException("Could not read command file " + file, e);
        }
    }

    // =================================================================
    // Prompt assembly
    // =================================================================

    /**
     * Context sections for the step at {@code stepIndex}. Plan content is only offered to steps
     * that come after a {@code plan} step, and only once the plan file exists.
     */
    public Map<String, String> buildContext(List<PipelineStep> pipeline, int stepIndex, String taskBody,
                                            List<Interaction> history, Path projectRoot) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put(TASK_DEFINITION, taskBody);

        int planIndex = IntStream.range(0, pipeline.size())
            .filter(i -> PLAN_STEP.equals(pipeline.get(i).getName()))
            .findFirst()
            .orElse(-1);
        if (planIndex >= 0 && stepIndex > planIndex) {
            Path plan = projectRoot.resolve(PLAN_FILE);
            try {
                context.put(PLAN_CONTENT, Files.readString(plan, StandardCharsets.UTF_8));
            } catch (IOException e) {
                log.warn("Could not load plan content for step '{}'. {} may not exist yet.",
                    pipeline.get(stepIndex).getName(), PLAN_FILE);
            }
        }

        if (history != null && !history.isEmpty()) {
            context.put(INTERACTION_HISTORY, formatHistory(history));
        }
        return context;
    }

    public String assemblePrompt(List<PipelineStep> pipeline, String currentStep, Map<String, String> context,
                                 String commandInstructions, int autonomyLevel, Path sequenceFolder) {
        StringBuilder intro = new StringBuilder("Here is a task that has been broken down into several steps. "
            + "You are an autonomous agent responsible for completing one step at a time.");
        if (sequenceFolder != null) {
            intro.append(String.format("%n%nYou are currently running a task from a folder in \"%s\". "
                + "In this task, whenever the \"sequence folder\" or \"sequence directory\" is mentioned, "
                + "it is referring to the \"%s\" folder.", sequenceFolder, sequenceFolder));
        }

        String steps = IntStream.range(0, pipeline.size())
            .mapToObj(i -> (i + 1) + ". " + pipeline.get(i).getName())
            .collect(Collectors.joining("\n"));

        String contextSections = context.entrySet().stream()
            .map(e -> "--- " + e.getKey() + " ---\n" + e.getValue().trim())
            .collect(Collectors.joining("\n\n"));

        return Stream.of(
                intro.toString(),
                interactionIntro(autonomyLevel),
                "This is the full pipeline for your awareness:\n" + steps,
                "You are responsible for executing step \"" + currentStep + "\".",
                contextSections,
                "--- YOUR INSTRUCTIONS FOR THE \"" + currentStep + "\" STEP ---",
                commandInstructions)
            .filter(part -> part != null && !part.isBlank())
            .collect(Collectors.joining("\n\n"));
    }

    /**
     * Autonomy instructions for {@code level}: nothing for 0, maximum autonomy for 1-2,
     * balanced for 3-4, guided for 5.
     */
    public String interactionIntro(int level) {
        if (level <= 0) {
            return "";
        }
        String template = loadIntroTemplate();
        String section;
        if (level <= 2) {
            section = section(template, "AUTONOMY_LEVEL_MAXIMUM");
        } else if (level <= 4) {
            section = section(template, "AUTONOMY_LEVEL_BALANCED");
        } else {
            section = section(template, "AUTONOMY_LEVEL_GUIDED");
        }
        String intro = (section + "\n\n" + section(template, "COMMON_INSTRUCTIONS")).trim();
        return intro.replace("%%AUTONOMY_LEVEL%%", String.valueOf(level));
    }

    private static String section(String template, String marker) {
        Matcher matcher = Pattern.compile("<!-- " + marker + " -->(.*?)(<!--|\\z)", Pattern.DOTALL).matcher(template);
        return matcher.find() ? matcher.group(1).trim() : "";
    }

    private synchronized String loadIntroTemplate() {
        if (introTemplate == null) {
            try (InputStream in = getClass().getClassLoader().getResourceAsStream(INTRO_TEMPLATE)) {
                if (in == null) {
                    throw new PipelineException("Prompt template not found on classpath: " + INTRO_TEMPLATE);
                }
                introTemplate = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new PipelineException("Could not read prompt template " + INTRO_TEMPLATE, e);
            }
        }
        return introTemplate;
    }

    private static String formatHistory(List<Interaction> history) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < history.size(); i++) {
            Interaction interaction = history.get(i);
            if (i > 0) {
                text.append("\n\n");
            }
            text.append("Q").append(i + 1).append(": ").append(interaction.getQuestion()).append('\n');
            text.append("A").append(i + 1).append(": ").append(interaction.getAnswer());
        }
        return text.toString();
    }
}
