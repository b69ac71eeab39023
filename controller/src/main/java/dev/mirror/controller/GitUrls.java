package dev.mirror.controller;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns repository URLs as users paste them from a browser into clonable ones.
 */
public final class GitUrls {

    private static final Pattern TREE_URL =
        Pattern.compile("^https://(github\\.com|gitee\\.com)/([^/]+)/([^/]+)/tree/([^/]+)");

    private GitUrls() {
    }

    /**
     * @param url clonable repository URL
     * @param branch branch named by the input, {@code null} when it names none
     */
    public record GitUrl(String url, String branch) {
    }

    /**
     * GitHub and Gitee {@code /tree/<branch>} pages become the repository URL plus branch, bare
     * GitHub and Gitee repository URLs get {@code .git} appended, anything else passes through.
     */
    public static GitUrl parse(String input) {
        String trimmed = input == null ? "" : input.trim();
        Matcher tree = TREE_URL.matcher(trimmed);
        if (tree.find()) {
            return new GitUrl("https://" + tree.group(1) + "/" + tree.group(2) + "/" + tree.group(3) + ".git",
                tree.group(4));
        }
        boolean knownHost = trimmed.startsWith("https://github.com/") || trimmed.startsWith("https://gitee.com/");
        if (knownHost && !trimmed.endsWith(".git") && trimmed.split("/", -1).length == 5) {
            return new GitUrl(trimmed + ".git", null);
        }
        return new GitUrl(trimmed, null);
    }
}
