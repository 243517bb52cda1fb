package com.diffreview.placement;

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks ranked candidates against a {@link CommentPoster} and stops at the first accepted one. Rejections are
 * logged and never propagate.
 */
public class PlacementExecutor {
    private static final Logger log = LoggerFactory.getLogger(PlacementExecutor.class);

    private final CommentPoster poster;

    public PlacementExecutor(CommentPoster poster) {
        this.poster = poster;
    }

    public PlacementOutcome place(String filename, List<PlacementCandidate> candidates, String body) {
        int attempts = 0;
        for (PlacementCandidate candidate : candidates) {
            attempts++;
            try {
                if (candidate.isLineAnchored()) {
                    poster.postLineComment(filename, candidate.lineNumber(), body);
                    log.info("placement.accepted file={} line={} kind={} tier={} attempts={}",
                            filename, candidate.lineNumber(), candidate.kind(), candidate.tier().rank(), attempts);
                } else {
                    poster.postPullRequestComment(withFileReference(filename, body));
                    log.warn("placement.exhausted file={} attempts={}; posted as pull request comment",
                            filename, attempts);
                }
                return new PlacementOutcome(filename, candidate, attempts);
            } catch (IOException | RuntimeException e) {
                log.warn("placement.rejected file={} line={} tier={} reason={}",
                        filename, candidate.lineNumber(), candidate.tier().rank(), e.getMessage());
            }
        }
        log.error("placement.failed file={} attempts={}", filename, attempts);
        return PlacementOutcome.failed(filename, attempts);
    }

    private static String withFileReference(String filename, String body) {
        return filename == null ? body : filename + "\n\n" + body;
    }
}
