package com.autonomous.pipeline.runner;

import com.autonomous.pipeline.exception.ConfigurationException;
import com.autonomous.pipeline.exception.InterruptedWhileWaitingException;
import com.autonomous.pipeline.exception.PipelineException;
import com.autonomous.pipeline.exception.TaskInterruptedException;
import com.autonomous.pipeline.model.RunOptions;
import com.autonomous.pipeline.model.SequenceStatus;
import com.autonomous.pipeline.model.TaskStatus;
import com.autonomous.pipeline.service.SequenceRunnerService;
import com.autonomous.pipeline.service.TaskRunnerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.Arrays;

/**
 * Command line entry: {@code run <taskPath> [--pipeline=<name>]} or {@code sequence [folderPath]}.
 */
@Slf4j
@Component
public class PipelineCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INTERRUPTED = 130;

    static final String USAGE = "Usage:\n"
        + "  run <taskPath> [--pipeline=<name>]   Run every step of one task\n"
        + "  sequence [folderPath]                Run the task files of a folder in order\n"
        + "                                       (defaults to the configured task_folder)";

    private static final String PIPELINE_OPTION = "--pipeline=";

    private final TaskRunnerService taskRunner;
    private final SequenceRunnerService sequenceRunner;
    private int exitCode = EXIT_OK;

    public PipelineCommandRunner(TaskRunnerService taskRunner, SequenceRunnerService sequenceRunner) {
        this.taskRunner = taskRunner;
        this.sequenceRunner = sequenceRunner;
    }

    @Override
    public void run(String... args) {
        // Spring passes its own --property=value arguments through; they are not commands
        String[] commandArgs = Arrays.stream(args)
            .filter(arg -> !arg.startsWith("--") || arg.startsWith(PIPELINE_OPTION))
            .toArray(String[]::new);
        if (commandArgs.length == 0) {
            System.out.println(USAGE);
            return;
        }
        exitCode = execute(commandArgs);
    }

    int execute(String[] args) {
        String command = args[0];
        try {
            switch (command) {
                case "run" -> {
                    if (args.length < 2) {
                        return usageError("Missing <taskPath>.");
                    }
                    String pipeline = null;
                    for (int i = 2; i < args.length; i++) {
                        if (args[i].startsWith(PIPELINE_OPTION)) {
                            pipeline = args[i].substring(PIPELINE_OPTION.length());
                        } else {
                            return usageError("Unknown argument: " + args[i]);
                        }
                    }
                    TaskStatus status = taskRunner.run(Paths.get(args[1]),
                        RunOptions.builder().pipeline(pipeline).build());
                    log.info("Task {} finished: {}", status.getTaskId(), status.getPhase());
                    return EXIT_OK;
                }
                case "sequence" -> {
                    if (args.length > 2) {
                        return usageError("Expected at most one [folderPath].");
                    }
                    SequenceStatus status = sequenceRunner.run(args.length == 2 ? Paths.get(args[1]) : null);
                    log.info("Sequence {} finished: {} ({} tasks)", status.getSequenceId(), status.getPhase(),
                        status.getCompletedTasks().size());
                    return EXIT_OK;
                }
                default -> {
                    return usageError("Unknown command: " + command);
                }
            }
        } catch (InterruptedWhileWaitingException | TaskInterruptedException e) {
            log.warn(e.getMessage());
            return EXIT_INTERRUPTED;
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_FAILED;
        } catch (PipelineException e) {
            log.error("Workflow failed: {}", e.getMessage());
            return EXIT_FAILED;
        }
    }

    private int usageError(String message) {
        log.error(message);
        System.out.println(USAGE);
        return EXIT_USAGE;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
