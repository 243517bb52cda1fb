package com.diffreview.review;

import java.io.IOException;

import com.diffreview.github.PullRequest;
import com.diffreview.github.SourceControlClient;
import com.diffreview.placement.CommentPoster;

/**
 * Binds the comment API of one pull request. Every body gets the configured prefix line.
 */
public class GitHubCommentPoster implements CommentPoster {
    private final SourceControlClient client;
    private final PullRequest pullRequest;
    private final String prefix;

    public GitHubCommentPoster(SourceControlClient client, PullRequest pullRequest, String prefix) {
        this.client = client;
        this.pullRequest = pullRequest;
        this.prefix = prefix == null ? "" : prefix;
    }

    @Override
    public void postLineComment(String filename, int lineNumber, String body) throws IOException {
        client.createReviewComment(pullRequest, filename, lineNumber, prefixed(body));
    }

    @Override
    public void postPullRequestComment(String body) throws IOException {
        client.createIssueComment(pullRequest, prefixed(body));
    }

    String prefixed(String body) {
        return prefix.isBlank() ? body : prefix + "\n" + body;
    }
}
