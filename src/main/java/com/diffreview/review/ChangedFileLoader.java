package com.diffreview.review;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diffreview.batch.ChangedFile;
import com.diffreview.diff.PatchLines;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads changed files for offline planning: either a JSON array shaped like the GitHub compare API's
 * {@code files}, or raw {@code git diff} output.
 */
public class ChangedFileLoader {
    private static final Logger log = LoggerFactory.getLogger(ChangedFileLoader.class);
    private static final String DIFF_GIT = "diff --git ";
    private static final String NEW_FILE = "+++ ";
    private static final String OLD_FILE = "--- ";
    private static final String DEV_NULL = "/dev/null";

    private final ObjectMapper mapper;

    public ChangedFileLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<ChangedFile> load(Path input) throws IOException {
        String content = Files.readString(input, StandardCharsets.UTF_8);
        if (content.stripLeading().startsWith("[")) {
            List<ChangedFile> files = mapper.readValue(content, new TypeReference<List<ChangedFile>>() {
            });
            log.info("plan.input format=json path={} files={}", input, files.size());
            return files;
        }
        List<ChangedFile> files = splitGitDiff(content);
        log.info("plan.input format=git-diff path={} files={}", input, files.size());
        return files;
    }

    /**
     * Splits on {@code diff --git} lines. The file is named by its {@code +++ b/} path, or by the {@code --- a/}
     * path for a deletion. Everything from the first hunk header on is kept as the patch.
     */
    static List<ChangedFile> splitGitDiff(String content) {
        List<ChangedFile> files = new ArrayList<>();
        List<String> section = null;
        for (String line : PatchLines.split(content)) {
            if (line.startsWith(DIFF_GIT)) {
                if (section != null) {
                    files.add(toChangedFile(section));
                }
                section = new ArrayList<>();
            }
            if (section != null) {
                section.add(line);
            }
        }
        if (section != null) {
            files.add(toChangedFile(section));
        }
        return files;
    }

    private static ChangedFile toChangedFile(List<String> section) {
        String oldPath = null;
        String newPath = null;
        int firstHunk = -1;
        for (int i = 0; i < section.size(); i++) {
            String line = section.get(i);
            if (line.startsWith("@@")) {
                firstHunk = i;
                break;
            }
            if (line.startsWith(OLD_FILE)) {
                oldPath = stripPrefix(line.substring(OLD_FILE.length()), "a/");
            } else if (line.startsWith(NEW_FILE)) {
                newPath = stripPrefix(line.substring(NEW_FILE.length()), "b/");
            }
        }
        if (newPath == null && oldPath == null) {
            newPath = pathFromDiffLine(section.get(0));
        }
        String status = status(oldPath, newPath);
        String filename = DEV_NULL.equals(newPath) || newPath == null ? oldPath : newPath;
        String patch = firstHunk < 0 ? null : String.join("\n", section.subList(firstHunk, section.size())) + "\n";
        return new ChangedFile(filename, status, patch);
    }

    private static String status(String oldPath, String newPath) {
        if (DEV_NULL.equals(oldPath)) {
            return "added";
        }
        if (DEV_NULL.equals(newPath)) {
            return "removed";
        }
        return "modified";
    }

    private static String pathFromDiffLine(String line) {
        int marker = line.lastIndexOf(" b/");
        return marker < 0 ? null : line.substring(marker + 3).trim();
    }

    private static String stripPrefix(String path, String prefix) {
        String trimmed = path.trim();
        int tab = trimmed.indexOf('\t');
        if (tab >= 0) {
            trimmed = trimmed.substring(0, tab);
        }
        return trimmed.startsWith(prefix) ? trimmed.substring(prefix.length()) : trimmed;
    }
}
