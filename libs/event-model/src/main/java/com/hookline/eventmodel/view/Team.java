package com.hookline.eventmodel.view;

import static com.hookline.recordmodel.UrlParam.of;

import com.hookline.recordmodel.ValidatedRecord;

public class Team extends RecordView {

    public Team(ValidatedRecord record, RecordViews views) {
        super(record, views);
    }

    public String name() {
        return string("name");
    }

    public long id() {
        return integer("id");
    }

    public String slug() {
        return string("slug");
    }

    public String privacy() {
        return string("privacy");
    }

    public String permission() {
        return string("permission");
    }

    public String membersUrl(String member) {
        return url("members_url", of("member", member));
    }

    @Override
    public String toString() {
        return name();
    }
}
