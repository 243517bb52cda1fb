package com.diffreview.github;

public record PullRequest(String owner, String repo, int number, String baseRef, String headRef, String headSha) {

    public String slug() {
        return owner + "/" + repo + "#" + number;
    }
}
