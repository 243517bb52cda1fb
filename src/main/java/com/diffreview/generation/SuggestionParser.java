package com.diffreview.generation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diffreview.diff.PatchLines;

/**
 * Splits free-text backend output into per-file suggestions. Each section starts with the file path wrapped in
 * {@code @@}, optionally behind a list bullet; text before the first section is ignored.
 */
public class SuggestionParser {
    private static final Logger log = LoggerFactory.getLogger(SuggestionParser.class);
    // DOTALL: text after the marker may hold U+2028 or U+0085, which '.' would otherwise stop at.
    private static final Pattern SECTION = Pattern.compile(
            "^\\s*(?:[-*]|\\d+[.)])?\\s*@@\\s*[`'\"]?([^\\s@`'\"]+)[`'\"]?\\s*@@(.*)$", Pattern.DOTALL);

    public List<Suggestion> parse(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Map<String, List<String>> sections = new LinkedHashMap<>();
        List<String> current = null;
        for (String line : PatchLines.split(text)) {
            Matcher matcher = SECTION.matcher(line);
            if (matcher.matches()) {
                current = sections.computeIfAbsent(matcher.group(1), key -> new ArrayList<>());
                if (!current.isEmpty()) {
                    current.add("");
                }
                current.add(matcher.group(2).trim());
            } else if (current != null) {
                current.add(line);
            }
        }

        List<Suggestion> suggestions = new ArrayList<>();
        sections.forEach((filename, lines) -> {
            String suggestionText = String.join("\n", lines).strip();
            if (!suggestionText.isEmpty()) {
                suggestions.add(new Suggestion(filename, suggestionText));
            }
        });
        log.debug("generation.suggestions.parsed sections={} suggestions={}", sections.size(), suggestions.size());
        return suggestions;
    }
}
