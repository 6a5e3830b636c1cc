package com.hookline.eventmodel.testing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds minimal webhook bodies that validate against the bundled descriptors.
 * <p>
 * Placed in {@code src/main/java} so other modules can use it from their tests. Every map is
 * mutable (nested maps included) so a test can break exactly the field it cares about.
 */
public final class TestPayloadFactory {

    /** Repository used when a test does not name one. */
    public static final String DEFAULT_REPOSITORY = "octo-org/hello-world";

    private TestPayloadFactory() {
        // utility class
    }

    public static Map<String, Object> user(String login, long id) {
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("login", login);
        user.put("id", id);
        user.put("type", "User");
        user.put("site_admin", false);
        user.put("following_url", "https://api.github.com/users/" + login + "/following{/other_user}");
        user.put("starred_url", "https://api.github.com/users/" + login + "/starred{/owner}{/repo}");
        return user;
    }

    public static Map<String, Object> repository(String fullName) {
        String owner = fullName.substring(0, fullName.indexOf('/'));
        String api = "https://api.github.com/repos/" + fullName;
        Map<String, Object> repository = new LinkedHashMap<>();
        repository.put("id", 1296269);
        repository.put("name", fullName.substring(fullName.indexOf('/') + 1));
        repository.put("full_name", fullName);
        repository.put("private", false);
        repository.put("owner", user(owner, 583231));
        repository.put("default_branch", "main");
        repository.put("contents_url", api + "/contents/{+path}");
        repository.put("issues_url", api + "/issues{/number}");
        repository.put("compare_url", api + "/compare/{base}...{head}");
        repository.put("notifications_url", api + "/notifications{?since,all,participating}");
        return repository;
    }

    public static Map<String, Object> label(String name) {
        Map<String, Object> label = new LinkedHashMap<>();
        label.put("id", 208045946);
        label.put("name", name);
        label.put("color", "f29513");
        label.put("default", true);
        return label;
    }

    /** A {@code label} event body. */
    public static Map<String, Object> labelEvent(String action, String repositoryFullName) {
        Map<String, Object> event = envelope(action, repositoryFullName);
        event.put("label", label("bug"));
        return event;
    }

    /** A {@code pull_request} event body for PR #1. */
    public static Map<String, Object> pullRequestEvent(String action, String repositoryFullName) {
        Map<String, Object> event = envelope(action, repositoryFullName);
        event.put("number", 1);
        event.put("pull_request", pullRequest(1, repositoryFullName));
        return event;
    }

    /** A {@code pull_request_review} event body. */
    public static Map<String, Object> pullRequestReviewEvent(String action, String repositoryFullName) {
        Map<String, Object> review = new LinkedHashMap<>();
        review.put("id", 237895671);
        review.put("user", user("hubot", 2));
        review.put("state", "approved");
        review.put("body", "LGTM");
        Map<String, Object> event = envelope(action, repositoryFullName);
        event.put("review", review);
        event.put("pull_request", pullRequest(1, repositoryFullName));
        return event;
    }

    /** An {@code issues} event body. */
    public static Map<String, Object> issuesEvent(String action, String repositoryFullName) {
        Map<String, Object> issue = new LinkedHashMap<>();
        issue.put("id", 444500041);
        issue.put("number", 1);
        issue.put("title", "Spelling error in the README file");
        issue.put("user", user("octocat", 1));
        issue.put("state", "open");
        issue.put("labels", new ArrayList<>(List.of(label("bug"))));
        issue.put("labels_url", "https://api.github.com/repos/" + repositoryFullName + "/issues/1/labels{/name}");
        Map<String, Object> event = envelope(action, repositoryFullName);
        event.put("issue", issue);
        return event;
    }

    /** A {@code push} event body with one commit. */
    public static Map<String, Object> pushEvent(String repositoryFullName) {
        Map<String, Object> commit = new LinkedHashMap<>();
        commit.put("id", "6113728f27ae82c7b1a177c8d03f9e96e0adf246");
        commit.put("message", "Update README.md");
        commit.put("added", new ArrayList<>());
        commit.put("removed", new ArrayList<>());
        commit.put("modified", new ArrayList<>(List.of("README.md")));
        Map<String, Object> pusher = new LinkedHashMap<>();
        pusher.put("name", "octocat");
        pusher.put("email", "octocat@github.com");
        Map<String, Object> event = envelope(null, repositoryFullName);
        event.remove("action");
        event.put("ref", "refs/heads/main");
        event.put("before", "0000000000000000000000000000000000000000");
        event.put("after", "6113728f27ae82c7b1a177c8d03f9e96e0adf246");
        event.put("created", false);
        event.put("deleted", false);
        event.put("forced", false);
        event.put("commits", new ArrayList<>(List.of(commit)));
        event.put("pusher", pusher);
        return event;
    }

    /** A {@code ping} event body. */
    public static Map<String, Object> pingEvent() {
        Map<String, Object> hook = new LinkedHashMap<>();
        hook.put("type", "Repository");
        hook.put("id", 30);
        hook.put("active", true);
        hook.put("events", new ArrayList<>(List.of("push", "pull_request")));
        Map<String, Object> event = envelope(null, DEFAULT_REPOSITORY);
        event.remove("action");
        event.put("zen", "Keep it logically awesome.");
        event.put("hook_id", 30);
        event.put("hook", hook);
        return event;
    }

    private static Map<String, Object> pullRequest(int number, String repositoryFullName) {
        Map<String, Object> pullRequest = new LinkedHashMap<>();
        pullRequest.put("id", 279147437);
        pullRequest.put("number", number);
        pullRequest.put("state", "open");
        pullRequest.put("title", "Update the README with new information.");
        pullRequest.put("user", user("octocat", 1));
        pullRequest.put("merged_at", null);
        pullRequest.put("head", ref("changes", "ec26c3e57ca3a959ca5aad62de7213c562f8c821"));
        pullRequest.put("base", ref("main", "f95f852bd8fca8fcc58a9a2d6c842781e32a215e"));
        pullRequest.put("labels", new ArrayList<>());
        pullRequest.put("review_comment_url",
                "https://api.github.com/repos/" + repositoryFullName + "/pulls/comments{/number}");
        Map<String, Object> links = new LinkedHashMap<>();
        links.put("self", Map.of("href", "https://api.github.com/repos/" + repositoryFullName + "/pulls/" + number));
        pullRequest.put("_links", links);
        return pullRequest;
    }

    private static Map<String, Object> ref(String branch, String sha) {
        Map<String, Object> ref = new LinkedHashMap<>();
        ref.put("label", "octocat:" + branch);
        ref.put("ref", branch);
        ref.put("sha", sha);
        ref.put("repo", null);
        return ref;
    }

    private static Map<String, Object> envelope(String action, String repositoryFullName) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("action", action);
        event.put("repository", repository(repositoryFullName));
        event.put("sender", user("octocat", 1));
        return event;
    }
}
