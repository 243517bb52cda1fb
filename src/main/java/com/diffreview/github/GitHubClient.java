package com.diffreview.github;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diffreview.batch.ChangedFile;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * GitHub REST v3 calls used by a review run.
 */
public class GitHubClient implements SourceControlClient {
    private static final Logger log = LoggerFactory.getLogger(GitHubClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final String API_VERSION = "2022-11-28";

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    private final HttpUrl apiUrl;
    private final String token;
    private final String owner;
    private final String repo;

    public GitHubClient(OkHttpClient httpClient, String apiUrl, String token, String repository) {
        this.httpClient = httpClient;
        HttpUrl parsed = HttpUrl.parse(apiUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid GitHub API url: " + apiUrl);
        }
        this.apiUrl = parsed;
        this.token = token;
        String[] parts = repository == null ? new String[0] : repository.split("/");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("Repository must be 'owner/repo' but was " + repository);
        }
        this.owner = parts[0];
        this.repo = parts[1];
    }

    @Override
    public PullRequest pullRequest(int number) throws IOException {
        JsonNode root = mapper.readTree(get(repoUrl().addPathSegment("pulls").addPathSegment(Integer.toString(number))));
        return new PullRequest(
                owner,
                repo,
                number,
                root.path("base").path("ref").asText(""),
                root.path("head").path("ref").asText(""),
                root.path("head").path("sha").asText(""));
    }

    @Override
    public List<ChangedFile> compare(String baseRef, String headRef) throws IOException {
        HttpUrl.Builder url = repoUrl()
                .addPathSegment("compare")
                .addPathSegments(baseRef + "..." + headRef);
        JsonNode files = mapper.readTree(get(url)).path("files");
        List<ChangedFile> changed = new ArrayList<>();
        if (files.isArray()) {
            for (JsonNode file : files) {
                changed.add(mapper.treeToValue(file, ChangedFile.class));
            }
        }
        log.info("github.compare base={} head={} files={}", baseRef, headRef, changed.size());
        return changed;
    }

    @Override
    public void createReviewComment(PullRequest pullRequest, String path, int line, String body) throws IOException {
        HttpUrl.Builder url = repoUrl()
                .addPathSegment("pulls")
                .addPathSegment(Integer.toString(pullRequest.number()))
                .addPathSegment("comments");
        post(url, Map.of(
                "body", body,
                "commit_id", pullRequest.headSha(),
                "path", path,
                "line", line));
    }

    @Override
    public void createIssueComment(PullRequest pullRequest, String body) throws IOException {
        HttpUrl.Builder url = repoUrl()
                .addPathSegment("issues")
                .addPathSegment(Integer.toString(pullRequest.number()))
                .addPathSegment("comments");
        post(url, Map.of("body", body));
    }

    private HttpUrl.Builder repoUrl() {
        return apiUrl.newBuilder()
                .addPathSegment("repos")
                .addPathSegment(owner)
                .addPathSegment(repo);
    }

    private String get(HttpUrl.Builder url) throws IOException {
        return execute(baseRequest(url).get().build());
    }

    private void post(HttpUrl.Builder url, Map<String, Object> payload) throws IOException {
        execute(baseRequest(url).post(RequestBody.create(mapper.writeValueAsString(payload), JSON)).build());
    }

    private Request.Builder baseRequest(HttpUrl.Builder url) {
        return new Request.Builder()
                .url(url.build())
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", API_VERSION);
    }

    private String execute(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new IOException("GitHub API error " + response.code() + " for "
                        + request.method() + " " + request.url().encodedPath() + ": " + text);
            }
            return text;
        }
    }
}
