package com.hookline.eventmodel.view;

import static com.hookline.recordmodel.UrlParam.of;

import com.hookline.recordmodel.ValidatedRecord;

import java.util.List;

public class Issue extends RecordView {

    public Issue(ValidatedRecord record, RecordViews views) {
        super(record, views);
    }

    public long id() {
        return integer("id");
    }

    public long number() {
        return integer("number");
    }

    public String title() {
        return string("title");
    }

    public String state() {
        return string("state");
    }

    public String body() {
        return string("body");
    }

    public User user() {
        return view("user", User.class);
    }

    public User assignee() {
        return view("assignee", User.class);
    }

    public List<User> assignees() {
        return viewList("assignees", User.class);
    }

    public List<Label> labels() {
        return viewList("labels", Label.class);
    }

    public String labelsUrl(String name) {
        return url("labels_url", of("name", name));
    }

    @Override
    public String toString() {
        return "#" + number() + " " + title();
    }
}
