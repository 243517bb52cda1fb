package com.diffreview.review;

/**
 * A run cannot start. Raised before any batch is scheduled, so nothing has been posted.
 */
public class ReviewPreconditionException extends RuntimeException {
    public ReviewPreconditionException(String message) {
        super(message);
    }
}
