package com.diffreview.diff;

public enum LineKind {
    ADDED,
    MODIFIED,
    CONTEXT
}
