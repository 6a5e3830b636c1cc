package com.hookline.eventmodel.view;

import static com.hookline.recordmodel.UrlParam.of;

import com.hookline.recordmodel.UrlTemplates;
import com.hookline.recordmodel.ValidatedRecord;

import java.util.List;

/**
 * A repository as embedded in webhook payloads.
 *
 * <p>The {@code *Url(...)} methods expand the hypermedia templates GitHub sends; pass {@code null}
 * for an optional segment to get the collection URL.
 */
public class Repository extends RecordView {

    private static final String NOTIFICATIONS_QUERY = "{?since,all,participating}";

    public Repository(ValidatedRecord record, RecordViews views) {
        super(record, views);
    }

    public long id() {
        return integer("id");
    }

    public String name() {
        return string("name");
    }

    public String fullName() {
        return string("full_name");
    }

    public User owner() {
        return view("owner", User.class);
    }

    public boolean isPrivate() {
        return flag("private");
    }

    public boolean isFork() {
        return flag("fork");
    }

    public String description() {
        return string("description");
    }

    public String defaultBranch() {
        return string("default_branch");
    }

    public String htmlUrl() {
        return string("html_url");
    }

    public List<String> topics() {
        return record().getStrings("topics");
    }

    public String keysUrl(String keyId) {
        return url("keys_url", of("key_id", keyId));
    }

    public String collaboratorsUrl(String collaborator) {
        return url("collaborators_url", of("collaborator", collaborator));
    }

    public String issueEventsUrl(Object number) {
        return url("issue_events_url", of("number", number));
    }

    public String assigneesUrl(String user) {
        return url("assignees_url", of("user", user));
    }

    public String branchesUrl(String branch) {
        return url("branches_url", of("branch", branch));
    }

    public String blobsUrl(String sha) {
        return url("blobs_url", of("sha", sha));
    }

    public String gitTagsUrl(String sha) {
        return url("git_tags_url", of("sha", sha));
    }

    public String gitRefsUrl(String sha) {
        return url("git_refs_url", of("sha", sha));
    }

    public String treesUrl(String sha) {
        return url("trees_url", of("sha", sha));
    }

    public String statusesUrl(String sha) {
        return url("statuses_url", of("sha", sha));
    }

    public String commitsUrl(String sha) {
        return url("commits_url", of("sha", sha));
    }

    public String gitCommitsUrl(String sha) {
        return url("git_commits_url", of("sha", sha));
    }

    public String commentsUrl(Object number) {
        return url("comments_url", of("number", number));
    }

    public String issueCommentUrl(Object number) {
        return url("issue_comment_url", of("number", number));
    }

    /** GitHub sends {@code {+path}}; the reserved-expansion operator is dropped before filling. */
    public String contentsUrl(String path) {
        String template = string("contents_url");
        if (template == null) {
            return url("contents_url");
        }
        return UrlTemplates.interpolate(template.replace("+", ""), of("path", path));
    }

    public String compareUrl(String base, String head) {
        return url("compare_url", of("base", base), of("head", head));
    }

    public String archiveUrl(String archiveFormat, String ref) {
        return url("archive_url", of("archive_format", archiveFormat), of("ref", ref));
    }

    public String issuesUrl(Object number) {
        return url("issues_url", of("number", number));
    }

    public String pullsUrl(Object number) {
        return url("pulls_url", of("number", number));
    }

    public String milestonesUrl(Object number) {
        return url("milestones_url", of("number", number));
    }

    /**
     * Notifications URL with its query template replaced.
     *
     * @param params a query string starting with {@code ?}, or null for none
     * @throws IllegalArgumentException if {@code params} does not start with {@code ?}
     */
    public String notificationsUrl(String params) {
        if (params != null && !params.startsWith("?")) {
            throw new IllegalArgumentException("Params must be a query string starting with ?");
        }
        String template = string("notifications_url");
        if (template == null) {
            return url("notifications_url");
        }
        return template.replace(NOTIFICATIONS_QUERY, params == null ? "" : params);
    }

    public String labelsUrl(String name) {
        return url("labels_url", of("name", name));
    }

    public String releasesUrl(Object id) {
        return url("releases_url", of("id", id));
    }

    @Override
    public String toString() {
        return fullName();
    }
}
