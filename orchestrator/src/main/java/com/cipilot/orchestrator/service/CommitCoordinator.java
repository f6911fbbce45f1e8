package com.cipilot.orchestrator.service;

import com.cipilot.orchestrator.model.ExecutionHandle;
import com.cipilot.orchestrator.model.PipelineArtifact;
import com.cipilot.orchestrator.model.RepositoryProfile;
import com.cipilot.orchestrator.model.WorkflowRequest;
import com.cipilot.orchestrator.store.ArtifactDocument;
import com.cipilot.orchestrator.vcs.CommitAction;
import com.cipilot.orchestrator.vcs.GitLabClient;
import com.cipilot.orchestrator.vcs.GitLabProject;
import com.cipilot.orchestrator.vcs.VcsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Writes an artifact pair to GitLab as a single commit.
 *
 * The first commit of a workflow goes to a fresh branch forked from the default
 * branch; healing fixes go to the same branch as new commits. Each file is
 * created or updated depending on whether it already exists on the branch.
 * Returns as soon as the commit exists; CI picks it up on its own.
 */
@Component
public class CommitCoordinator {

    private static final Logger log = LoggerFactory.getLogger(CommitCoordinator.class);

    static final String BRANCH_PREFIX = "cipilot/pipeline-";

    private static final DateTimeFormatter BRANCH_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final GitLabClient gitLab;
    private final Clock        clock;
    private final SecureRandom random = new SecureRandom();

    public CommitCoordinator(GitLabClient gitLab, Clock clock) {
        this.gitLab = gitLab;
        this.clock  = clock;
    }

    /**
     * Create the workflow branch (unless the request names an existing one) and
     * commit the artifact to it.
     *
     * @throws CommitFailedException on any GitLab error
     */
    public ExecutionHandle commit(PipelineArtifact artifact, RepositoryProfile profile, WorkflowRequest request) {
        GitLabProject project = gitLab.project(request.repoUrl());
        String branch = request.branchName() != null && !request.branchName().isBlank()
                ? request.branchName().strip()
                : newBranchName();
        try {
            if (!gitLab.branchExists(project, request.token(), branch)) {
                String base = gitLab.defaultBranch(project, request.token());
                gitLab.createBranch(project, request.token(), branch, base);
            }
            String message = "ci: add %s/%s pipeline (%s)".formatted(
                    profile.language(), profile.framework(), artifact.source().name().toLowerCase());
            return commitTo(project, request, branch, artifact, message);
        } catch (VcsException e) {
            throw new CommitFailedException("Commit to " + project.path() + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Commit a repaired artifact to the branch of the previous execution. The
     * new commit triggers a new pipeline; the old one has already finished.
     *
     * @throws CommitFailedException on any GitLab error
     */
    public ExecutionHandle commitFix(ExecutionHandle previous, PipelineArtifact artifact,
                                     WorkflowRequest request, String message) {
        GitLabProject project = gitLab.project(request.repoUrl());
        try {
            return commitTo(project, request, previous.branch(), artifact, message);
        } catch (VcsException e) {
            throw new CommitFailedException("Fix commit to " + project.path() + " failed: " + e.getMessage(), e);
        }
    }

    String newBranchName() {
        byte[] suffix = new byte[2];
        random.nextBytes(suffix);
        return BRANCH_PREFIX + BRANCH_TIMESTAMP.format(clock.instant()) + "-" + HexFormat.of().formatHex(suffix);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private ExecutionHandle commitTo(GitLabProject project, WorkflowRequest request, String branch,
                                     PipelineArtifact artifact, String message) {
        List<CommitAction> actions = new ArrayList<>();
        actions.add(action(project, request.token(), branch,
                ArtifactDocument.PIPELINE_FILE, artifact.pipelineDefinition()));
        if (!request.pipelineOnly() && artifact.hasImageBuild()) {
            actions.add(action(project, request.token(), branch,
                    ArtifactDocument.IMAGE_BUILD_FILE, artifact.imageBuildDefinition()));
        }

        String commitId = gitLab.commitFiles(project, request.token(), branch, actions, message);
        log.info("Committed {} to {}@{} ({})", actions.stream().map(CommitAction::filePath).toList(),
                project.path(), branch, commitId);
        return new ExecutionHandle(commitId, branch, clock.instant());
    }

    private CommitAction action(GitLabProject project, String token, String branch, String path, String content) {
        return gitLab.fileExists(project, token, path, branch)
                ? CommitAction.update(path, content)
                : CommitAction.create(path, content);
    }
}
