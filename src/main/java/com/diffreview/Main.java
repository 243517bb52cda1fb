package com.diffreview;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diffreview.batch.ChangedFile;
import com.diffreview.batch.TokenEstimator;
import com.diffreview.batch.TokenEstimators;
import com.diffreview.generation.OpenAiGenerationClient;
import com.diffreview.github.GitHubClient;
import com.diffreview.review.ChangedFileLoader;
import com.diffreview.review.PlanReport;
import com.diffreview.review.PlanReporter;
import com.diffreview.review.ReviewPlan;
import com.diffreview.review.ReviewPlanner;
import com.diffreview.review.ReviewPreconditionException;
import com.diffreview.review.ReviewReport;
import com.diffreview.review.ReviewRunner;
import com.diffreview.runtime.AppConfig;
import com.diffreview.runtime.ReviewSettings;
import com.diffreview.runtime.ReviewSettingsResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "diff-review",
        mixinStandardHelpOptions = true,
        version = "diff-review 0.1.0",
        description = "Anchors generated review comments on the changed lines of a pull request.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_REVIEW_FAILURE = 3;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "review")
    Mode mode;

    @Option(names = "--input", description = "Plan mode input: JSON array of changed files or raw git diff output")
    Path input;

    @Option(names = "--output", description = "Plan mode output file; printed to stdout when omitted")
    Path output;

    @Option(names = "--repository", description = "Repository as owner/repo; defaults to GITHUB_REPOSITORY")
    String repository;

    @Option(names = "--pr", description = "Pull request number to review")
    Integer pullRequestNumber;

    @Option(names = "--base", description = "Base ref; defaults to the pull request's base branch")
    String baseRef;

    @Option(names = "--head", description = "Head ref; defaults to the pull request's head branch")
    String headRef;

    Map<String, String> environment = System.getenv();

    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    enum Mode {
        plan,
        review
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        ReviewSettings settings;
        try {
            AppConfig config = loadConfig(Path.of(configPath));
            settings = new ReviewSettingsResolver(environment).resolve(config);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Invalid configuration {}: {}", configPath, e.getMessage());
            return EXIT_USAGE_ERROR;
        }

        log.info("Starting diff-review in {} mode", mode);
        log.info("Using config file: {}", configPath);

        try {
            TokenEstimator estimator = TokenEstimators.named(settings.estimator(), settings.encoding());
            log.info("Settings maxTokens={} fileTokenLimit={} batchTokenBudget={} batchDelayMs={} estimator={} style={} model={}",
                    settings.maxTokens(),
                    settings.fileTokenLimit(),
                    settings.batchTokenBudget(),
                    settings.batchDelay().toMillis(),
                    estimator.name(),
                    settings.style(),
                    settings.model());
            if (mode == Mode.plan) {
                return runPlan(settings, estimator);
            }
            return runReview(settings, estimator);
        } catch (ReviewPreconditionException | IllegalArgumentException e) {
            log.error("Cannot start {}: {}", mode, e.getMessage());
            return EXIT_USAGE_ERROR;
        }
    }

    private int runPlan(ReviewSettings settings, TokenEstimator estimator) throws IOException {
        if (input == null) {
            throw new ReviewPreconditionException("--input is required in plan mode");
        }
        if (!Files.isRegularFile(input)) {
            throw new ReviewPreconditionException("Input file not found: " + input);
        }
        List<ChangedFile> files = new ChangedFileLoader(jsonMapper).load(input);
        ReviewPlan plan = new ReviewPlanner(estimator, settings).plan(files);
        PlanReport report = new PlanReporter().report(plan);
        String json = jsonMapper.writeValueAsString(report);
        if (output == null) {
            System.out.println(json);
        } else {
            Files.writeString(output, json, StandardCharsets.UTF_8);
            log.info("Plan written to {}", output);
        }
        return 0;
    }

    private int runReview(ReviewSettings settings, TokenEstimator estimator) {
        String githubToken = requireEnvironment("GITHUB_TOKEN");
        String apiKey = requireEnvironment("OPENAI_API_KEY");
        String slug = repository != null ? repository : environment.get("GITHUB_REPOSITORY");
        if (slug == null || slug.isBlank()) {
            throw new ReviewPreconditionException("--repository or GITHUB_REPOSITORY is required in review mode");
        }
        if (pullRequestNumber == null || pullRequestNumber < 1) {
            throw new ReviewPreconditionException("--pr is required in review mode");
        }

        GitHubClient github = new GitHubClient(
                httpClient(settings.githubTimeout()), settings.githubApiUrl(), githubToken, slug);
        OpenAiGenerationClient generation = new OpenAiGenerationClient(
                httpClient(settings.generationTimeout()),
                settings.generationEndpoint(),
                apiKey,
                settings.model(),
                settings.maxTokens());
        ReviewRunner runner = new ReviewRunner(github, generation, estimator, settings);
        try {
            ReviewReport report = runner.run(pullRequestNumber, baseRef, headRef);
            log.info("Review finished files={} rejected={} batches={} failedBatches={} lineComments={} prComments={} failedPlacements={}",
                    report.totalFiles(),
                    report.rejected().size(),
                    report.batches(),
                    report.failedBatches(),
                    report.lineComments(),
                    report.pullRequestComments(),
                    report.failedPlacements());
            return report.succeeded() ? 0 : EXIT_REVIEW_FAILURE;
        } catch (IOException e) {
            log.error("Review failed: {}", e.getMessage(), e);
            return EXIT_REVIEW_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Review interrupted before all batches were dispatched");
            return EXIT_REVIEW_FAILURE;
        }
    }

    private String requireEnvironment(String name) {
        String value = environment.get(name);
        if (value == null || value.isBlank()) {
            throw new ReviewPreconditionException(name + " is required in review mode");
        }
        return value;
    }

    private static OkHttpClient httpClient(Duration timeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .build();
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
