package com.hookline.eventmodel.view;

import static com.hookline.recordmodel.UrlParam.of;

import com.hookline.recordmodel.ValidatedRecord;

public class Organization extends RecordView {

    public Organization(ValidatedRecord record, RecordViews views) {
        super(record, views);
    }

    public String login() {
        return string("login");
    }

    public long id() {
        return integer("id");
    }

    public String description() {
        return string("description");
    }

    public String membersUrl(String member) {
        return url("members_url", of("member", member));
    }

    public String publicMembersUrl(String member) {
        return url("public_members_url", of("member", member));
    }

    @Override
    public String toString() {
        return login();
    }
}
