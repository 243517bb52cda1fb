package com.diffreview.generation;

public record Suggestion(String filename, String suggestionText) {
}
