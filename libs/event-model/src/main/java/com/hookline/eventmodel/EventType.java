package com.hookline.eventmodel;

import java.util.Optional;

/**
 * The GitHub webhook event names this library knows, as sent in the {@code X-GitHub-Event}
 * header.
 *
 * <p>{@code value} is the wire name; {@code descriptorName} names the descriptor in
 * {@code github-events.json} that payloads of this type are validated against.
 */
public enum EventType {

    CHECK_RUN("check_run", "CheckRunEvent"),
    CHECK_SUITE("check_suite", "CheckSuiteEvent"),
    COMMIT_COMMENT("commit_comment", "CommitCommentEvent"),
    CONTENT_REFERENCE("content_reference", "ContentReferenceEvent"),
    CREATE("create", "CreateEvent"),
    DELETE("delete", "DeleteEvent"),
    DEPLOY_KEY("deploy_key", "DeployKeyEvent"),
    DEPLOYMENT("deployment", "DeploymentEvent"),
    DEPLOYMENT_STATUS("deployment_status", "DeploymentStatusEvent"),
    FORK("fork", "ForkEvent"),
    GITHUB_APP_AUTHORIZATION("github_app_authorization", "GitHubAppAuthorizationEvent"),
    GOLLUM("gollum", "GollumEvent"),
    INSTALLATION("installation", "InstallationEvent"),
    INSTALLATION_REPOSITORIES("installation_repositories", "InstallationRepositoriesEvent"),
    ISSUE_COMMENT("issue_comment", "IssueCommentEvent"),
    ISSUES("issues", "IssuesEvent"),
    LABEL("label", "LabelEvent"),
    MARKETPLACE_PURCHASE("marketplace_purchase", "MarketplacePurchaseEvent"),
    MEMBER("member", "MemberEvent"),
    MEMBERSHIP("membership", "MembershipEvent"),
    META("meta", "MetaEvent"),
    MILESTONE("milestone", "MilestoneEvent"),
    ORG_BLOCK("org_block", "OrgBlockEvent"),
    ORGANIZATION("organization", "OrganizationEvent"),
    PACKAGE("package", "PackageEvent"),
    PAGE_BUILD("page_build", "PageBuildEvent"),
    PING("ping", "PingEvent"),
    PROJECT("project", "ProjectEvent"),
    PROJECT_CARD("project_card", "ProjectCardEvent"),
    PROJECT_COLUMN("project_column", "ProjectColumnEvent"),
    PUBLIC("public", "PublicEvent"),
    PULL_REQUEST("pull_request", "PullRequestEvent"),
    PULL_REQUEST_REVIEW("pull_request_review", "PullRequestReviewEvent"),
    PULL_REQUEST_REVIEW_COMMENT("pull_request_review_comment", "PullRequestReviewCommentEvent"),
    PUSH("push", "PushEvent"),
    RELEASE("release", "ReleaseEvent"),
    REPOSITORY("repository", "RepositoryEvent"),
    REPOSITORY_DISPATCH("repository_dispatch", "RepositoryDispatchEvent"),
    REPOSITORY_IMPORT("repository_import", "RepositoryImportEvent"),
    REPOSITORY_VULNERABILITY_ALERT("repository_vulnerability_alert", "RepositoryVulnerabilityAlertEvent"),
    SECURITY_ADVISORY("security_advisory", "SecurityAdvisoryEvent"),
    SPONSORSHIP("sponsorship", "SponsorshipEvent"),
    STAR("star", "StarEvent"),
    STATUS("status", "StatusEvent"),
    TEAM("team", "TeamEvent"),
    TEAM_ADD("team_add", "TeamAddEvent"),
    WATCH("watch", "WatchEvent");

    private final String value;
    private final String descriptorName;

    EventType(String value, String descriptorName) {
        this.value = value;
        this.descriptorName = descriptorName;
    }

    /** The wire name (e.g. "pull_request"). */
    public String value() {
        return value;
    }

    /** Name of the event descriptor (e.g. "PullRequestEvent"). */
    public String descriptorName() {
        return descriptorName;
    }

    /**
     * Looks up an EventType by its wire name.
     *
     * @param value the header value (e.g. "push")
     * @return the matching EventType, or empty if not found
     */
    public static Optional<EventType> fromString(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known event type. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
