package com.hookline.eventmodel.view;

import static com.hookline.recordmodel.UrlParam.of;

import com.hookline.recordmodel.ValidatedRecord;

/** A GitHub user or bot account. */
public class User extends RecordView {

    public User(ValidatedRecord record, RecordViews views) {
        super(record, views);
    }

    public String login() {
        return string("login");
    }

    public long id() {
        return integer("id");
    }

    public String name() {
        return string("name");
    }

    public String email() {
        return string("email");
    }

    public String type() {
        return string("type");
    }

    public boolean siteAdmin() {
        return flag("site_admin");
    }

    public String htmlUrl() {
        return string("html_url");
    }

    public String followingUrl(String otherUser) {
        return url("following_url", of("other_user", otherUser));
    }

    public String gistsUrl(String gistId) {
        return url("gists_url", of("gist_id", gistId));
    }

    public String starredUrl(String owner, String repo) {
        return url("starred_url", of("owner", owner), of("repo", repo));
    }

    public String eventsUrl(String privacy) {
        return url("events_url", of("privacy", privacy));
    }

    @Override
    public String toString() {
        return login();
    }
}
