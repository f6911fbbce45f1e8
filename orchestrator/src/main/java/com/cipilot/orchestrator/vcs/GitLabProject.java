package com.cipilot.orchestrator.vcs;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Where a project lives: the GitLab host and the namespaced project path.
 *
 * Accepts full web URLs (https://gitlab.example.com/group/app.git) and bare
 * paths (group/app); bare paths resolve against the configured base URL.
 */
public record GitLabProject(String host, String path) {

    public GitLabProject {
        if (host == null || host.isBlank() || path == null || path.isBlank()) {
            throw new IllegalArgumentException("GitLab project needs a host and a path");
        }
    }

    public static GitLabProject parse(String repoUrl, String defaultBaseUrl) {
        if (repoUrl == null || repoUrl.isBlank()) {
            throw new IllegalArgumentException("Repository reference is empty");
        }
        String ref = repoUrl.strip();
        if (!ref.contains("://")) {
            return new GitLabProject(trimSlashes(defaultBaseUrl), cleanPath(ref));
        }

        URI uri;
        try {
            uri = URI.create(ref);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Not a valid repository URL: " + repoUrl, e);
        }
        if (uri.getHost() == null || uri.getPath() == null) {
            throw new IllegalArgumentException("Not a valid repository URL: " + repoUrl);
        }
        String host = uri.getScheme() + "://" + uri.getHost()
                + (uri.getPort() > 0 ? ":" + uri.getPort() : "");
        return new GitLabProject(host, cleanPath(uri.getPath()));
    }

    /** Base URL of the v4 REST API for this project. */
    public String apiUrl() {
        return host + "/api/v4/projects/" + URLEncoder.encode(path, StandardCharsets.UTF_8);
    }

    public String webUrl() {
        return host + "/" + path;
    }

    private static String cleanPath(String raw) {
        String p = trimSlashes(raw);
        if (p.endsWith(".git")) p = p.substring(0, p.length() - 4);
        if (p.isBlank() || !p.contains("/")) {
            throw new IllegalArgumentException("Repository path must be <namespace>/<project>: " + raw);
        }
        return p;
    }

    private static String trimSlashes(String s) {
        String t = s.strip();
        while (t.startsWith("/")) t = t.substring(1);
        while (t.endsWith("/"))   t = t.substring(0, t.length() - 1);
        return t;
    }
}
