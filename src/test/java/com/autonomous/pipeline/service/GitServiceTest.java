package com.autonomous.pipeline.service;

import com.autonomous.pipeline.exception.GitStateException;
import com.autonomous.pipeline.model.ProjectConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs against a real repository in a temp directory.
 */
class GitServiceTest {

    private GitService gitService;
    private ProjectConfig config;

    @TempDir
    Path repo;

    @BeforeEach
    void setUp() throws Exception {
        assumeTrue(gitAvailable(), "git is not installed");
        gitService = new GitService();

        git("init", "-q");
        git("symbolic-ref", "HEAD", "refs/heads/main");
        git("config", "user.email", "pipeline@example.com");
        git("config", "user.name", "Pipeline Test");
        git("config", "commit.gpgsign", "false");
        Files.writeString(repo.resolve("README.md"), "# demo\n");
        git("add", "-A");
        git("commit", "-q", "-m", "initial");

        config = new ProjectConfig();
        config.setProjectRoot(repo);
    }

    @Test
    void shouldCreateTaskBranchFromIntegrationBranch() throws Exception {
        String branch = gitService.ensureTaskBranch(config, "task-pipeline-tasks-01-login");

        assertEquals("claude/pipeline-tasks-01-login", branch);
        assertEquals(branch, gitService.currentBranch(repo));
    }

    @Test
    void shouldResumeInPlaceWhenAlreadyOnBranch() throws Exception {
        gitService.ensureTaskBranch(config, "task-a");
        Files.writeString(repo.resolve("work-in-progress.txt"), "half done");

        // Dirty tree is fine when re-entering the same branch
        String branch = gitService.ensureTaskBranch(config, "task-a");

        assertEquals("claude/a", branch);
        assertTrue(Files.exists(repo.resolve("work-in-progress.txt")));
    }

    @Test
    void shouldCheckOutExistingBranch() throws Exception {
        gitService.ensureTaskBranch(config, "task-a");
        git("checkout", "-q", "main");

        assertEquals("claude/a", gitService.ensureTaskBranch(config, "task-a"));
        assertEquals("claude/a", gitService.currentBranch(repo));
    }

    @Test
    void shouldRefuseDirtyWorkingTree() throws Exception {
        Files.writeString(repo.resolve("uncommitted.txt"), "oops");

        GitStateException e = assertThrows(GitStateException.class,
            () -> gitService.ensureTaskBranch(config, "task-a"));

        assertTrue(e.getMessage().contains("not clean"));
        assertEquals("main", gitService.currentBranch(repo));
    }

    @Test
    void shouldFailWhenIntegrationBranchIsMissing() {
        config.setIntegrationBranch("develop");

        GitStateException e = assertThrows(GitStateException.class,
            () -> gitService.ensureTaskBranch(config, "task-a"));

        assertTrue(e.getMessage().contains("develop"));
    }

    @Test
    void shouldStayOnCurrentBranchWhenManagementDisabled() throws Exception {
        git("checkout", "-q", "-b", "my-feature");
        config.setManageGitBranch(false);

        assertEquals("my-feature", gitService.ensureTaskBranch(config, "task-a"));
        assertFalse(gitService.branchExists(repo, "claude/a"));
    }

    @Test
    void shouldCreateSequenceBranch() {
        assertEquals("claude/sequence-sprint-1", gitService.ensureSequenceBranch(config, "sequence-sprint-1"));
    }

    @Test
    void shouldCommitCheckpointScopedToStep() throws Exception {
        Files.writeString(repo.resolve("PLAN.md"), "# Plan\n");

        String hash = gitService.commitCheckpoint(repo, "plan");

        assertEquals(hash, git("rev-parse", "HEAD").trim());
        assertEquals("chore(plan): checkpoint", git("log", "-1", "--format=%s").trim());
        assertTrue(gitService.isClean(repo));
    }

    @Test
    void shouldCommitCheckpointEvenWithoutChanges() throws Exception {
        String before = git("rev-parse", "HEAD").trim();

        String hash = gitService.commitCheckpoint(repo, "review");

        assertNotEquals(before, hash);
    }

    private String git(String... args) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));
        Process process = new ProcessBuilder(command).directory(repo.toFile()).redirectErrorStream(true).start();
        String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        assertEquals(0, process.waitFor(), "git " + String.join(" ", args) + " failed: " + output);
        return output;
    }

    private static boolean gitAvailable() {
        try {
            return new ProcessBuilder("git", "--version").start().waitFor() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
