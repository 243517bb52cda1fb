package com.diffreview.generation;

public final class PromptTemplates {
    public static final String DEFAULT_SUGGESTION_PROMPT = "You now assume the role of a code reviewer. "
            + "Based on the patch provide a list of suggestions how to improve the code with examples according to "
            + "coding standards and best practices.\n"
            + "Each file's patch is introduced by a line holding only its path. "
            + "Start every suggestion with path to the file. Path to the file should start with @@ and end with @@";

    public static final String DEFAULT_STRUCTURED_PROMPT = """
            You are a pull request code reviewer. Provide structured code review feedback in JSON format only.

            - Respond ONLY with the requested JSON format, without greetings or commentary.
            - Focus on code quality, bugs, security issues and best practices.
            - Each file's patch is introduced by a line holding only its path; use that path as "filename".
            - Use new-file line numbers of added or changed lines for "line_number".

            Return exactly this JSON shape:

            {
              "overall_review": {
                "summary": "Brief overall assessment of the PR",
                "recommendation": "APPROVE" | "REQUEST_CHANGES" | "COMMENT",
                "issues_count": number,
                "quality_score": number (1-10)
              },
              "file_reviews": [
                {
                  "filename": "exact/path/to/file.ext",
                  "line_comments": [
                    {
                      "line_number": number,
                      "comment": "Specific feedback for this line",
                      "severity": "error" | "warning" | "suggestion",
                      "category": "bug" | "security" | "performance" | "style" | "maintainability"
                    }
                  ],
                  "file_summary": "Overall assessment of changes in this file"
                }
              ]
            }
            """;

    private PromptTemplates() {
    }
}
