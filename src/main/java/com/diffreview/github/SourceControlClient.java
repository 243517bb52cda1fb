package com.diffreview.github;

import java.io.IOException;
import java.util.List;

import com.diffreview.batch.ChangedFile;

public interface SourceControlClient {
    PullRequest pullRequest(int number) throws IOException;

    List<ChangedFile> compare(String baseRef, String headRef) throws IOException;

    void createReviewComment(PullRequest pullRequest, String path, int line, String body) throws IOException;

    void createIssueComment(PullRequest pullRequest, String body) throws IOException;
}
