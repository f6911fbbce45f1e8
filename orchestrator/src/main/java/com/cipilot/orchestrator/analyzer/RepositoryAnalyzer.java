package com.cipilot.orchestrator.analyzer;

import com.cipilot.orchestrator.model.RepositoryProfile;
import com.cipilot.orchestrator.store.ArtifactDocument;
import com.cipilot.orchestrator.vcs.GitLabClient;
import com.cipilot.orchestrator.vcs.GitLabProject;
import com.cipilot.orchestrator.vcs.VcsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Detects language, framework and package manager from the repository's file tree.
 *
 * Detection only looks at file names, never at file contents. Language rules use
 * every path in the tree (Kotlin and C# sources are rarely at the root); framework
 * and package-manager rules only use root-level names. Each table is tried top to
 * bottom and the first matching rule wins.
 */
@Component
public class RepositoryAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(RepositoryAnalyzer.class);

    /** Root names plus all paths of one repository tree. */
    record Tree(Set<String> rootNames, List<String> allPaths) {

        static Tree of(List<String> paths) {
            Set<String> root = paths.stream()
                    .filter(p -> !p.contains("/"))
                    .collect(Collectors.toSet());
            return new Tree(root, paths);
        }

        boolean hasRoot(String... names) {
            for (String n : names) {
                if (rootNames.contains(n)) return true;
            }
            return false;
        }

        boolean anyEndsWith(String suffix) {
            return allPaths.stream().anyMatch(p -> p.endsWith(suffix));
        }
    }

    record Rule(Predicate<Tree> matches, String value) {}

    static final List<Rule> LANGUAGE_RULES = List.of(
            new Rule(t -> t.hasRoot("package.json") && t.hasRoot("tsconfig.json"), "typescript"),
            new Rule(t -> t.hasRoot("package.json"), "javascript"),
            new Rule(t -> t.hasRoot("requirements.txt", "setup.py", "pyproject.toml", "Pipfile"), "python"),
            new Rule(t -> t.anyEndsWith(".kt"), "kotlin"),
            new Rule(t -> t.hasRoot("pom.xml", "build.gradle", "build.gradle.kts"), "java"),
            new Rule(t -> t.hasRoot("build.sbt"), "scala"),
            new Rule(t -> t.hasRoot("go.mod"), "go"),
            new Rule(t -> t.hasRoot("Cargo.toml"), "rust"),
            new Rule(t -> t.hasRoot("Gemfile"), "ruby"),
            new Rule(t -> t.hasRoot("composer.json") || t.anyEndsWith(".php"), "php"),
            new Rule(t -> t.anyEndsWith(".csproj") || t.anyEndsWith(".sln"), "csharp"),
            new Rule(t -> t.anyEndsWith(".ts"), "typescript")
    );

    static final List<Rule> FRAMEWORK_RULES = List.of(
            new Rule(t -> t.hasRoot("next.config.js", "next.config.mjs"), "nextjs"),
            new Rule(t -> t.hasRoot("angular.json"), "angular"),
            new Rule(t -> t.hasRoot("vue.config.js", "vite.config.js"), "vue"),
            new Rule(t -> t.hasRoot("manage.py"), "django"),
            new Rule(t -> t.hasRoot("app.py", "main.py") && t.hasRoot("requirements.txt"), "flask"),
            new Rule(t -> t.hasRoot("pom.xml"), "spring"),
            new Rule(t -> t.hasRoot("build.gradle", "build.gradle.kts"), "gradle"),
            new Rule(t -> t.hasRoot("build.sbt"), "akka"),
            new Rule(t -> t.hasRoot("artisan"), "laravel"),
            new Rule(t -> t.hasRoot("config.ru"), "rails")
    );

    static final List<Rule> PACKAGE_MANAGER_RULES = List.of(
            new Rule(t -> t.hasRoot("yarn.lock"), "yarn"),
            new Rule(t -> t.hasRoot("pnpm-lock.yaml"), "pnpm"),
            new Rule(t -> t.hasRoot("package-lock.json", "package.json"), "npm"),
            new Rule(t -> t.hasRoot("poetry.lock"), "poetry"),
            new Rule(t -> t.hasRoot("Pipfile", "Pipfile.lock"), "pipenv"),
            new Rule(t -> t.hasRoot("requirements.txt", "pyproject.toml"), "pip"),
            new Rule(t -> t.hasRoot("pom.xml"), "maven"),
            new Rule(t -> t.hasRoot("build.gradle", "build.gradle.kts"), "gradle"),
            new Rule(t -> t.hasRoot("build.sbt"), "sbt"),
            new Rule(t -> t.hasRoot("go.mod"), "go"),
            new Rule(t -> t.hasRoot("Cargo.toml"), "cargo"),
            new Rule(t -> t.hasRoot("Gemfile"), "bundler"),
            new Rule(t -> t.hasRoot("composer.json"), "composer"),
            new Rule(t -> t.anyEndsWith(".csproj"), "dotnet")
    );

    private final GitLabClient gitLab;

    public RepositoryAnalyzer(GitLabClient gitLab) {
        this.gitLab = gitLab;
    }

    /**
     * @throws RepositoryNotFoundException if GitLab answers 404 for the project
     */
    public RepositoryProfile analyze(String repoUrl, String token) {
        GitLabProject project = gitLab.project(repoUrl);
        try {
            String ref = gitLab.defaultBranch(project, token);
            List<String> paths = gitLab.listFiles(project, token, ref);
            RepositoryProfile profile = detect(paths);
            log.info("Analyzed {}: language={} framework={} packageManager={} existingPipeline={}",
                    project.path(), profile.language(), profile.framework(),
                    profile.packageManager(), profile.hasExistingPipelineFiles());
            return profile;
        } catch (VcsException e) {
            if (e.isNotFound()) {
                throw new RepositoryNotFoundException("Repository not found: " + project.webUrl(), e);
            }
            throw e;
        }
    }

    static RepositoryProfile detect(List<String> paths) {
        Tree tree = Tree.of(paths);
        return new RepositoryProfile(
                firstMatch(LANGUAGE_RULES, tree, "unknown"),
                firstMatch(FRAMEWORK_RULES, tree, "generic"),
                firstMatch(PACKAGE_MANAGER_RULES, tree, "unknown"),
                tree.hasRoot(ArtifactDocument.PIPELINE_FILE));
    }

    private static String firstMatch(List<Rule> rules, Tree tree, String fallback) {
        return rules.stream()
                .filter(r -> r.matches().test(tree))
                .map(Rule::value)
                .findFirst()
                .orElse(fallback);
    }
}
