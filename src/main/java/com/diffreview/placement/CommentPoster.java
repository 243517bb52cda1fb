package com.diffreview.placement;

import java.io.IOException;

/**
 * The hosting platform's comment API. A line comment that the platform refuses must surface as an exception.
 */
public interface CommentPoster {
    void postLineComment(String filename, int lineNumber, String body) throws IOException;

    void postPullRequestComment(String body) throws IOException;
}
