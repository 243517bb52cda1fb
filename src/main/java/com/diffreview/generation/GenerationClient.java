package com.diffreview.generation;

import java.io.IOException;

public interface GenerationClient {
    /**
     * @param structured ask the backend for a single JSON object instead of free text
     */
    String complete(String systemPrompt, String userContent, boolean structured) throws IOException;
}
