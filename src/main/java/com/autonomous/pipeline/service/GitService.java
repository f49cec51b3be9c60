package com.autonomous.pipeline.service;

import com.autonomous.pipeline.exception.GitStateException;
import com.autonomous.pipeline.model.ProjectConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Branch lifecycle around a run and checkpoint commits after each step.
 * Shells out to the {@code git} CLI.
 */
@Slf4j
@Service
public class GitService {

    private static final long GIT_TIMEOUT_SECONDS = 60;
    private static final long SYNC_TIMEOUT_SECONDS = 30;

    /**
     * Puts the repository on the task's branch and returns the branch the task runs on.
     */
    public String ensureTaskBranch(ProjectConfig config, String taskId) {
        return ensureBranch(config, TaskIds.taskBranch(config.getBranchPrefix(), taskId));
    }

    public String ensureSequenceBranch(ProjectConfig config, String sequenceId) {
        return ensureBranch(config, TaskIds.sequenceBranch(config.getBranchPrefix(), sequenceId));
    }

    /**
     * Re-entering on the expected branch resumes in place. Otherwise the working tree must be
     * clean; the integration branch is checked out, synced best-effort, and the branch is
     * created or checked out from there.
     */
    public String ensureBranch(ProjectConfig config, String expectedBranch) {
        Path repo = config.getProjectRoot();
        String currentBranch = currentBranch(repo);

        if (!config.isManageGitBranch()) {
            log.info("Automatic branch management is disabled. Running on current branch \"{}\"", currentBranch);
            return currentBranch;
        }

        if (expectedBranch.equals(currentBranch)) {
            log.info("Resuming on existing branch \"{}\"", expectedBranch);
            return expectedBranch;
        }

        log.info("Setting up git environment for branch \"{}\"", expectedBranch);
        if (!isClean(repo)) {
            throw new GitStateException(String.format(
                "Git working directory on branch \"%s\" is not clean. Please commit or stash your changes.",
                currentBranch));
        }

        String integrationBranch = config.getIntegrationBranch();
        if (git(repo, GIT_TIMEOUT_SECONDS, "checkout", integrationBranch).failed()) {
            throw new GitStateException(String.format(
                "Could not check out '%s' branch. It is required for automated branch management.",
                integrationBranch));
        }

        syncWithRemote(repo, config.getRemote(), integrationBranch);

        if (branchExists(repo, expectedBranch)) {
            log.info("Branch \"{}\" already exists. Checking it out.", expectedBranch);
            requireSuccess(git(repo, GIT_TIMEOUT_SECONDS, "checkout", expectedBranch), "checkout " + expectedBranch);
        } else {
            log.info("Creating and checking out new branch \"{}\"", expectedBranch);
            requireSuccess(git(repo, GIT_TIMEOUT_SECONDS, "checkout", "-b", expectedBranch),
                "checkout -b " + expectedBranch);
        }
        return expectedBranch;
    }

    /**
     * Commits everything in the working tree as the checkpoint of {@code stepName} and
     * returns the new commit hash. A step that changed nothing still gets its checkpoint.
     */
    public String commitCheckpoint(Path repo, String stepName) {
        log.info("Committing checkpoint for step: {}", stepName);
        requireSuccess(git(repo, GIT_TIMEOUT_SECONDS, "add", "-A"), "add -A");
        requireSuccess(git(repo, GIT_TIMEOUT_SECONDS, "commit", "--allow-empty", "-m",
            String.format("chore(%s): checkpoint", stepName)), "commit");
        return git(repo, GIT_TIMEOUT_SECONDS, "rev-parse", "HEAD").output().trim();
    }

    public String currentBranch(Path repo) {
        GitResult result = git(repo, GIT_TIMEOUT_SECONDS, "branch", "--show-current");
        if (result.failed()) {
            throw new GitStateException("Not a git repository or git is unavailable: " + repo
                + "\n" + result.output().trim());
        }
        return result.output().trim();
    }

    public boolean isClean(Path repo) {
        GitResult result = git(repo, GIT_TIMEOUT_SECONDS, "status", "--porcelain");
        requireSuccess(result, "status");
        return result.output().isBlank();
    }

    public boolean branchExists(Path repo, String branchName) {
        return !git(repo, GIT_TIMEOUT_SECONDS, "branch", "--list", branchName).output().isBlank();
    }

    private void syncWithRemote(Path repo, String remote, String branch) {
        if (git(repo, GIT_TIMEOUT_SECONDS, "remote", "get-url", remote).failed()) {
            log.info("No remote '{}' found. Proceeding with local '{}'.", remote, branch);
            return;
        }
        log.info("Remote '{}' found. Syncing '{}'...", remote, branch);
        GitResult pull = git(repo, SYNC_TIMEOUT_SECONDS, "pull", remote, branch);
        if (pull.failed()) {
            log.warn("Pull from '{}' failed. Proceeding with local '{}': {}", remote, branch, pull.output().trim());
        }
    }

    private void requireSuccess(GitResult result, String description) {
        if (result.failed()) {
            throw new GitStateException(String.format("git %s failed (exit code %d): %s",
                description, result.exitCode(), result.output().trim()));
        }
    }

    private GitResult git(Path repo, long timeoutSeconds, String... args) {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(repo.toFile());
            pb.redirectErrorStream(true);

            Process process = pb.start();
            process.getOutputStream().close();
            CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readProcessOutput(process));
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);

            if (!finished) {
                process.destroyForcibly();
                output.cancel(true);
                return new GitResult(-1, "git " + String.join(" ", args) + " timed out after " + timeoutSeconds + "s");
            }
            return new GitResult(process.exitValue(), output.get());
        } catch (IOException e) {
            throw new GitStateException("Could not run git " + String.join(" ", args) + ": " + e.getMessage());
        } catch (ExecutionException e) {
            throw new GitStateException("Could not read output of git " + String.join(" ", args) + ": "
                + e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitStateException("Interrupted while running git " + String.join(" ", args));
        }
    }

    private static String readProcessOutput(Process process) {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return output.toString();
    }

    private static final class GitResult {
        private final int exitCode;
        private final String output;

        GitResult(int exitCode, String output) {
            this.exitCode = exitCode;
            this.output = output;
        }

        int exitCode() {
            return exitCode;
        }

        String output() {
            return output;
        }

        boolean failed() {
            return exitCode != 0;
        }
    }
}
