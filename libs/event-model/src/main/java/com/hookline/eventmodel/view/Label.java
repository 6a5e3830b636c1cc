package com.hookline.eventmodel.view;

import com.hookline.recordmodel.ValidatedRecord;

public class Label extends RecordView {

    public Label(ValidatedRecord record, RecordViews views) {
        super(record, views);
    }

    public long id() {
        return integer("id");
    }

    public String name() {
        return string("name");
    }

    public String color() {
        return string("color");
    }

    public String description() {
        return string("description");
    }

    public boolean isDefault() {
        return flag("default");
    }

    @Override
    public String toString() {
        return name();
    }
}
