package com.hookline.eventmodel.view;

import static com.hookline.recordmodel.UrlParam.of;

import com.hookline.recordmodel.ValidatedRecord;

import java.util.List;

/**
 * A pull request. {@code head} and {@code base} stay as records; their {@code ref} and {@code sha}
 * are exposed directly since handlers use little else.
 */
public class PullRequest extends RecordView {

    public PullRequest(ValidatedRecord record, RecordViews views) {
        super(record, views);
    }

    public long id() {
        return integer("id");
    }

    public long number() {
        return integer("number");
    }

    public String state() {
        return string("state");
    }

    public String title() {
        return string("title");
    }

    public String body() {
        return string("body");
    }

    public boolean draft() {
        return flag("draft");
    }

    public boolean merged() {
        return flag("merged");
    }

    public User user() {
        return view("user", User.class);
    }

    public User mergedBy() {
        return view("merged_by", User.class);
    }

    public List<User> assignees() {
        return viewList("assignees", User.class);
    }

    public List<User> requestedReviewers() {
        return viewList("requested_reviewers", User.class);
    }

    public List<Team> requestedTeams() {
        return viewList("requested_teams", Team.class);
    }

    public List<Label> labels() {
        return viewList("labels", Label.class);
    }

    public String headRef() {
        return record().getRecord("head").getString("ref");
    }

    public String headSha() {
        return record().getRecord("head").getString("sha");
    }

    public String baseRef() {
        return record().getRecord("base").getString("ref");
    }

    public String baseSha() {
        return record().getRecord("base").getString("sha");
    }

    public String reviewCommentUrl(Object number) {
        return url("review_comment_url", of("number", number));
    }

    @Override
    public String toString() {
        return "#" + number() + " " + title();
    }
}
