package com.cipilot.orchestrator.pipeline;

import com.cipilot.orchestrator.model.ArtifactSource;
import com.cipilot.orchestrator.model.PipelineArtifact;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Hard-coded minimal templates, the last tier of reference selection.
 *
 * Every language shares one pipeline skeleton (compile, build, test, security,
 * push, notify); only the toolchain image, the compile and test commands and the
 * Dockerfile differ. Unknown languages get the polyglot default, so a lookup here
 * never fails. The learn stage is not part of the skeleton; normalisation adds it.
 */
public final class DefaultTemplates {

    public static final List<String> STAGES =
            List.of("compile", "build", "test", "security", "push", "notify");

    public static final String POLYGLOT = "polyglot";

    record Toolchain(String image, List<String> compile, List<String> test, String dockerfile) {}

    private DefaultTemplates() {}

    public static boolean isKnown(String language) {
        return language != null && TOOLCHAINS.containsKey(language.toLowerCase());
    }

    /**
     * Default artifact for a language; the polyglot default when the language is
     * not recognised. Provenance is GENERATED with templateId "default_&lt;language&gt;".
     */
    public static PipelineArtifact forLanguage(String language) {
        String key = isKnown(language) ? language.toLowerCase() : POLYGLOT;
        Toolchain tc = key.equals(POLYGLOT) ? POLYGLOT_TOOLCHAIN : TOOLCHAINS.get(key);
        String pipeline = PIPELINE_SKELETON
                .replace("{{IMAGE}}",   tc.image())
                .replace("{{COMPILE}}", scriptLines(tc.compile()))
                .replace("{{TEST}}",    scriptLines(tc.test()));
        return new PipelineArtifact(pipeline, tc.dockerfile(), ArtifactSource.GENERATED, "default_" + key);
    }

    private static String scriptLines(List<String> commands) {
        return commands.stream()
                .map(c -> "    - " + c)
                .collect(Collectors.joining("\n"));
    }

    // ------------------------------------------------------------------
    // Pipeline skeleton
    // ------------------------------------------------------------------

    private static final String PIPELINE_SKELETON = """
            stages:
              - compile
              - build
              - test
              - security
              - push
              - notify

            variables:
              IMAGE_NAME: "${CI_REGISTRY_IMAGE}"
              IMAGE_TAG: "${CI_COMMIT_SHORT_SHA}"

            compile:
              stage: compile
              image: {{IMAGE}}
              script:
            {{COMPILE}}

            build_image:
              stage: build
              image:
                name: gcr.io/kaniko-project/executor:v1.23.2-debug
                entrypoint: [""]
              script:
                - /kaniko/executor --context "${CI_PROJECT_DIR}" --dockerfile "${CI_PROJECT_DIR}/Dockerfile" --destination "${IMAGE_NAME}:${IMAGE_TAG}" --no-push --tar-path image.tar
              artifacts:
                paths:
                  - image.tar
                expire_in: 1 hour

            test:
              stage: test
              image: {{IMAGE}}
              script:
            {{TEST}}

            security_scan:
              stage: security
              image:
                name: aquasec/trivy:0.53.0
                entrypoint: [""]
              script:
                - trivy image --input image.tar --exit-code 0 --severity HIGH,CRITICAL

            push_image:
              stage: push
              image:
                name: gcr.io/go-containerregistry/crane:debug
                entrypoint: [""]
              script:
                - crane auth login "${CI_REGISTRY}" -u "${CI_REGISTRY_USER}" -p "${CI_REGISTRY_PASSWORD}"
                - crane push image.tar "${IMAGE_NAME}:${IMAGE_TAG}"

            notify_success:
              stage: notify
              image: alpine:3.20
              when: on_success
              script:
                - echo "Pipeline ${CI_PIPELINE_ID} succeeded for ${CI_PROJECT_PATH}@${CI_COMMIT_SHORT_SHA}"

            notify_failure:
              stage: notify
              image: alpine:3.20
              when: on_failure
              script:
                - echo "Pipeline ${CI_PIPELINE_ID} failed for ${CI_PROJECT_PATH}@${CI_COMMIT_SHORT_SHA}"
            """;

    // ------------------------------------------------------------------
    // Toolchains
    // ------------------------------------------------------------------

    private static final Toolchain POLYGLOT_TOOLCHAIN = new Toolchain(
            "alpine:3.20",
            List.of("echo \"No compile step detected for ${CI_PROJECT_NAME}\""),
            List.of("echo \"No test step detected for ${CI_PROJECT_NAME}\""),
            """
            FROM alpine:3.20
            WORKDIR /app
            COPY . .
            CMD ["sh", "-c", "ls -la /app"]
            """);

    private static final Map<String, Toolchain> TOOLCHAINS = Map.ofEntries(
            Map.entry("java", new Toolchain(
                    "maven:3.9-eclipse-temurin-17",
                    List.of("mvn -B -ntp compile"),
                    List.of("mvn -B -ntp test"),
                    """
                    FROM maven:3.9-eclipse-temurin-17 AS build
                    WORKDIR /src
                    COPY . .
                    RUN mvn -B -ntp package -DskipTests

                    FROM eclipse-temurin:17-jre
                    WORKDIR /app
                    COPY --from=build /src/target/*.jar app.jar
                    EXPOSE 8080
                    ENTRYPOINT ["java", "-jar", "app.jar"]
                    """)),
            Map.entry("kotlin", new Toolchain(
                    "gradle:8.8-jdk17",
                    List.of("gradle assemble --no-daemon"),
                    List.of("gradle test --no-daemon"),
                    """
                    FROM gradle:8.8-jdk17 AS build
                    WORKDIR /src
                    COPY . .
                    RUN gradle assemble --no-daemon

                    FROM eclipse-temurin:17-jre
                    WORKDIR /app
                    COPY --from=build /src/build/libs/*.jar app.jar
                    EXPOSE 8080
                    ENTRYPOINT ["java", "-jar", "app.jar"]
                    """)),
            Map.entry("scala", new Toolchain(
                    "sbtscala/scala-sbt:eclipse-temurin-17.0.10_7_1.10.0_2.13.14",
                    List.of("sbt -batch compile"),
                    List.of("sbt -batch test"),
                    """
                    FROM sbtscala/scala-sbt:eclipse-temurin-17.0.10_7_1.10.0_2.13.14 AS build
                    WORKDIR /src
                    COPY . .
                    RUN sbt -batch package

                    FROM eclipse-temurin:17-jre
                    WORKDIR /app
                    COPY --from=build /src/target/scala-*/*.jar app.jar
                    ENTRYPOINT ["java", "-jar", "app.jar"]
                    """)),
            Map.entry("python", new Toolchain(
                    "python:3.12-slim",
                    List.of("if [ -f requirements.txt ]; then pip install -r requirements.txt; fi",
                            "python -m compileall -q ."),
                    List.of("pip install pytest",
                            "python -m pytest -q || [ $? -eq 5 ]"),
                    """
                    FROM python:3.12-slim
                    WORKDIR /app
                    COPY . .
                    RUN if [ -f requirements.txt ]; then pip install --no-cache-dir -r requirements.txt; fi
                    EXPOSE 8000
                    CMD ["python", "main.py"]
                    """)),
            Map.entry("go", new Toolchain(
                    "golang:1.22",
                    List.of("go build ./..."),
                    List.of("go test ./..."),
                    """
                    FROM golang:1.22 AS build
                    WORKDIR /src
                    COPY . .
                    RUN CGO_ENABLED=0 go build -o /out/app .

                    FROM gcr.io/distroless/static-debian12
                    COPY --from=build /out/app /app
                    ENTRYPOINT ["/app"]
                    """)),
            Map.entry("rust", new Toolchain(
                    "rust:1.79",
                    List.of("cargo build --release"),
                    List.of("cargo test"),
                    """
                    FROM rust:1.79 AS build
                    WORKDIR /src
                    COPY . .
                    RUN cargo build --release && cp "$(find target/release -maxdepth 1 -type f -perm -u+x | head -n1)" /app

                    FROM debian:bookworm-slim
                    COPY --from=build /app /usr/local/bin/app
                    ENTRYPOINT ["/usr/local/bin/app"]
                    """)),
            Map.entry("javascript", new Toolchain(
                    "node:20-alpine",
                    List.of("npm ci || npm install", "npm run build --if-present"),
                    List.of("npm ci || npm install", "npm test --if-present"),
                    """
                    FROM node:20-alpine
                    WORKDIR /app
                    COPY package*.json ./
                    RUN npm ci --omit=dev || npm install --omit=dev
                    COPY . .
                    EXPOSE 3000
                    CMD ["npm", "start"]
                    """)),
            Map.entry("typescript", new Toolchain(
                    "node:20-alpine",
                    List.of("npm ci || npm install", "npm run build --if-present"),
                    List.of("npm ci || npm install", "npm test --if-present"),
                    """
                    FROM node:20-alpine AS build
                    WORKDIR /src
                    COPY . .
                    RUN (npm ci || npm install) && npm run build --if-present

                    FROM node:20-alpine
                    WORKDIR /app
                    COPY --from=build /src .
                    EXPOSE 3000
                    CMD ["npm", "start"]
                    """)),
            Map.entry("ruby", new Toolchain(
                    "ruby:3.3",
                    List.of("bundle install"),
                    List.of("bundle install", "bundle exec rake test"),
                    """
                    FROM ruby:3.3-slim
                    WORKDIR /app
                    COPY Gemfile* ./
                    RUN bundle install
                    COPY . .
                    EXPOSE 3000
                    CMD ["bundle", "exec", "rackup", "-o", "0.0.0.0"]
                    """)),
            Map.entry("php", new Toolchain(
                    "composer:2",
                    List.of("composer install --no-interaction --prefer-dist"),
                    List.of("composer install --no-interaction --prefer-dist",
                            "if [ -x vendor/bin/phpunit ]; then vendor/bin/phpunit; fi"),
                    """
                    FROM composer:2 AS deps
                    WORKDIR /src
                    COPY . .
                    RUN composer install --no-interaction --no-dev --prefer-dist

                    FROM php:8.3-apache
                    COPY --from=deps /src /var/www/html
                    EXPOSE 80
                    """)),
            Map.entry("csharp", new Toolchain(
                    "mcr.microsoft.com/dotnet/sdk:8.0",
                    List.of("dotnet build -c Release"),
                    List.of("dotnet test"),
                    """
                    FROM mcr.microsoft.com/dotnet/sdk:8.0 AS build
                    WORKDIR /src
                    COPY . .
                    RUN dotnet publish -c Release -o /out

                    FROM mcr.microsoft.com/dotnet/aspnet:8.0
                    WORKDIR /app
                    COPY --from=build /out .
                    ENTRYPOINT ["sh", "-c", "dotnet $(ls *.dll | head -n1)"]
                    """))
    );
}
