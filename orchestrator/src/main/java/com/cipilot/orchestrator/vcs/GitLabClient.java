package com.cipilot.orchestrator.vcs;

import com.cipilot.orchestrator.model.JobLog;
import com.cipilot.orchestrator.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP client for the GitLab REST API v4: repository, commit, pipeline, job and
 * issue endpoints.
 *
 * Every call carries the caller's token in the PRIVATE-TOKEN header and a
 * request timeout shorter than the monitor's poll interval, so a slow GitLab
 * never makes two polls overlap. Callers run on request threads (commit) or on
 * the workflow worker pool (monitoring, healing); blocking I/O is fine in both.
 */
@Component
public class GitLabClient {

    private static final Logger log = LoggerFactory.getLogger(GitLabClient.class);

    private static final int PAGE_SIZE = 100;
    private static final int MAX_TREE_PAGES = 20;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProjectResponse(@JsonProperty("default_branch") String defaultBranch) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CommitResponse(String id) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PipelineResponse(long id, String status) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record JobResponse(long id, String name, String stage, String status,
                       @JsonProperty("allow_failure") boolean allowFailure) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TreeEntry(String path, String type) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record IssueResponse(long iid, @JsonProperty("web_url") String webUrl) {}

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     timeout;

    public GitLabClient(@Value("${cipilot.gitlab.base-url}") String baseUrl,
                        @Value("${cipilot.gitlab.request-timeout:20s}") Duration timeout,
                        ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.timeout = timeout;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /** Resolve a user-supplied repository reference against the configured GitLab. */
    public GitLabProject project(String repoUrl) {
        return GitLabProject.parse(repoUrl, baseUrl);
    }

    // ------------------------------------------------------------------
    // Repository
    // ------------------------------------------------------------------

    /**
     * @throws VcsException with status 404 when the project does not exist or
     *                      the token cannot see it
     */
    public String defaultBranch(GitLabProject project, String token) {
        String body = send(get(project.apiUrl(), token), "get project " + project.path());
        ProjectResponse resp = fromJson(body, ProjectResponse.class, "get project");
        return resp.defaultBranch() != null ? resp.defaultBranch() : "main";
    }

    public boolean branchExists(GitLabProject project, String token, String branch) {
        return exists(get(project.apiUrl() + "/repository/branches/" + encode(branch), token),
                "get branch " + branch);
    }

    public void createBranch(GitLabProject project, String token, String branch, String ref) {
        log.info("Creating branch '{}' from '{}' in {}", branch, ref, project.path());
        String uri = project.apiUrl() + "/repository/branches?branch=" + encode(branch)
                + "&ref=" + encode(ref);
        send(post(uri, token, "{}"), "create branch " + branch);
    }

    public boolean fileExists(GitLabProject project, String token, String filePath, String ref) {
        String uri = project.apiUrl() + "/repository/files/" + encode(filePath) + "?ref=" + encode(ref);
        return exists(get(uri, token), "get file " + filePath);
    }

    /**
     * All file paths in the repository at ref (recursive tree listing, paginated).
     */
    public List<String> listFiles(GitLabProject project, String token, String ref) {
        List<String> paths = new ArrayList<>();
        for (int page = 1; page <= MAX_TREE_PAGES; page++) {
            String uri = project.apiUrl() + "/repository/tree?recursive=true&per_page=" + PAGE_SIZE
                    + "&page=" + page + "&ref=" + encode(ref);
            String body = send(get(uri, token), "list tree of " + project.path());
            List<TreeEntry> entries = fromJson(body, new TypeReference<List<TreeEntry>>() {}, "list tree");
            entries.stream()
                    .filter(e -> "blob".equals(e.type()))
                    .map(TreeEntry::path)
                    .forEach(paths::add);
            if (entries.size() < PAGE_SIZE) break;
        }
        return paths;
    }

    /**
     * Write all actions as one commit on an existing branch.
     *
     * @return the new commit sha
     */
    public String commitFiles(GitLabProject project, String token, String branch,
                              List<CommitAction> actions, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("branch",         branch);
        payload.put("commit_message", message);
        payload.put("actions", actions.stream()
                .map(a -> Map.of("action", a.action(), "file_path", a.filePath(), "content", a.content()))
                .toList());

        String body = send(post(project.apiUrl() + "/repository/commits", token, toJson(payload)),
                "commit to " + branch);
        CommitResponse resp = fromJson(body, CommitResponse.class, "commit");
        log.info("Committed {} file(s) to '{}' in {}: {}", actions.size(), branch, project.path(), resp.id());
        return resp.id();
    }

    // ------------------------------------------------------------------
    // Pipelines and jobs
    // ------------------------------------------------------------------

    /**
     * Latest pipeline for exactly this branch + commit, or empty if CI has not
     * created one yet.
     */
    public Optional<ExecutionStatus> getExecutionStatus(GitLabProject project, String token,
                                                        String branch, String sha) {
        String uri = project.apiUrl() + "/pipelines?ref=" + encode(branch) + "&sha=" + encode(sha)
                + "&order_by=id&sort=desc&per_page=1";
        String body = send(get(uri, token), "list pipelines for " + branch);
        List<PipelineResponse> pipelines = fromJson(body, new TypeReference<List<PipelineResponse>>() {}, "list pipelines");
        return pipelines.stream().findFirst().map(p -> new ExecutionStatus(p.id(), p.status()));
    }

    public List<JobStatus> getJobs(GitLabProject project, String token, long pipelineId) {
        String uri = project.apiUrl() + "/pipelines/" + pipelineId + "/jobs?per_page=" + PAGE_SIZE;
        String body = send(get(uri, token), "list jobs of pipeline " + pipelineId);
        List<JobResponse> jobs = fromJson(body, new TypeReference<List<JobResponse>>() {}, "list jobs");
        return jobs.stream()
                .map(j -> new JobStatus(j.id(), j.name(), j.stage(), j.status(), j.allowFailure()))
                .toList();
    }

    /**
     * Jobs of a pipeline with the full trace of every failed job. Traces of
     * jobs that did not fail are not fetched and come back empty.
     */
    public List<JobLog> getJobLogs(GitLabProject project, String token, long pipelineId) {
        List<JobLog> logs = new ArrayList<>();
        for (JobStatus job : getJobs(project, token, pipelineId)) {
            String trace = "";
            if (job.failed()) {
                trace = send(get(project.apiUrl() + "/jobs/" + job.id() + "/trace", token),
                        "trace of job " + job.id());
            }
            logs.add(new JobLog(job.name(), job.stage(), job.status(), job.allowFailure(), trace));
        }
        return logs;
    }

    // ------------------------------------------------------------------
    // Issues
    // ------------------------------------------------------------------

    /** @return the web URL of the new issue */
    public String createIssue(GitLabProject project, String token, String title, String description,
                              List<String> labels) {
        String body = toJson(Map.of(
                "title",       title,
                "description", description,
                "labels",      String.join(",", labels)));
        String resp = send(post(project.apiUrl() + "/issues", token, body), "create issue");
        IssueResponse issue = fromJson(resp, IssueResponse.class, "create issue");
        log.info("Opened issue #{} in {}", issue.iid(), project.path());
        return issue.webUrl();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest get(String uri, String token) {
        return HttpRequest.newBuilder()
                .uri(URI.create(uri))
                .timeout(timeout)
                .header("PRIVATE-TOKEN", token)
                .header("Accept",        "application/json")
                .GET()
                .build();
    }

    private HttpRequest post(String uri, String token, String jsonBody) {
        return HttpRequest.newBuilder()
                .uri(URI.create(uri))
                .timeout(timeout)
                .header("PRIVATE-TOKEN", token)
                .header("Content-Type",  "application/json")
                .header("Accept",        "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();
    }

    private String send(HttpRequest req, String opName) {
        HttpResponse<String> resp = execute(req, opName);
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new VcsException(resp.statusCode(),
                    opName + " failed: HTTP " + resp.statusCode() + ": " + abbreviate(resp.body()));
        }
        return resp.body();
    }

    /** 2xx means true, 404 means false, anything else is an error. */
    private boolean exists(HttpRequest req, String opName) {
        HttpResponse<String> resp = execute(req, opName);
        if (resp.statusCode() == 404) return false;
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new VcsException(resp.statusCode(),
                    opName + " failed: HTTP " + resp.statusCode() + ": " + abbreviate(resp.body()));
        }
        return true;
    }

    private HttpResponse<String> execute(HttpRequest req, String opName) {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VcsException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new VcsException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new VcsException("JSON serialization failed", e);
        }
    }

    private <T> T fromJson(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new VcsException("Failed to parse " + opName + " response", e);
        }
    }

    private <T> T fromJson(String body, TypeReference<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new VcsException("Failed to parse " + opName + " response", e);
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
