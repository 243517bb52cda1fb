package com.diffreview.github;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.diffreview.batch.ChangedFile;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GitHubClientTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private GitHubClient client;

    @BeforeEach
    void startServer() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new GitHubClient(new OkHttpClient(), server.url("/").toString(), "gh-token", "octo/widgets");
    }

    @AfterEach
    void stopServer() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldReadPullRequestRefs() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"number":7,"base":{"ref":"main"},"head":{"ref":"feature/x","sha":"abc123"}}
                """));

        PullRequest pullRequest = client.pullRequest(7);

        assertEquals(new PullRequest("octo", "widgets", 7, "main", "feature/x", "abc123"), pullRequest);
        RecordedRequest request = server.takeRequest();
        assertEquals("/repos/octo/widgets/pulls/7", request.getPath());
        assertEquals("Bearer gh-token", request.getHeader("Authorization"));
        assertEquals("application/vnd.github+json", request.getHeader("Accept"));
    }

    @Test
    void shouldMapComparedFiles() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"status":"ahead","files":[
                  {"filename":"src/App.java","status":"modified","additions":1,"patch":"@@ -1 +1 @@\\n-a\\n+b"},
                  {"filename":"logo.png","status":"added"}
                ]}
                """));

        List<ChangedFile> files = client.compare("main", "feature/x");

        assertEquals(2, files.size());
        assertEquals("@@ -1 +1 @@\n-a\n+b", files.get(0).patch());
        assertNull(files.get(1).patch());
        assertEquals("/repos/octo/widgets/compare/main...feature/x", server.takeRequest().getPath());
    }

    @Test
    void shouldPostReviewCommentOnHeadCommit() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{}"));
        PullRequest pullRequest = new PullRequest("octo", "widgets", 7, "main", "dev", "abc123");

        client.createReviewComment(pullRequest, "src/App.java", 12, "Consider a null check");

        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/repos/octo/widgets/pulls/7/comments", request.getPath());
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertEquals("abc123", body.path("commit_id").asText());
        assertEquals("src/App.java", body.path("path").asText());
        assertEquals(12, body.path("line").asInt());
        assertEquals("Consider a null check", body.path("body").asText());
    }

    @Test
    void shouldSurfaceRejectedCommentAsIOException() {
        server.enqueue(new MockResponse().setResponseCode(422).setBody("{\"message\":\"line must be part of the diff\"}"));
        PullRequest pullRequest = new PullRequest("octo", "widgets", 7, "main", "dev", "abc123");

        IOException error = assertThrows(IOException.class,
                () -> client.createReviewComment(pullRequest, "src/App.java", 99, "body"));

        assertTrue(error.getMessage().contains("422"));
    }

    @Test
    void shouldPostIssueComment() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{}"));

        client.createIssueComment(new PullRequest("octo", "widgets", 7, "main", "dev", "abc123"), "summary");

        assertEquals("/repos/octo/widgets/issues/7/comments", server.takeRequest().getPath());
    }

    @Test
    void shouldRejectMalformedRepository() {
        assertThrows(IllegalArgumentException.class,
                () -> new GitHubClient(new OkHttpClient(), "https://api.github.com", "t", "widgets"));
    }
}
