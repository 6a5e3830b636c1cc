package com.hookline.eventmodel.view;

import com.hookline.recordmodel.UrlParam;
import com.hookline.recordmodel.ValidatedRecord;

import java.util.List;
import java.util.Objects;

/**
 * Named-accessor wrapper over a {@link ValidatedRecord}.
 *
 * <p>Subclasses add getters for the fields they care about; nested records are wrapped through the
 * {@link RecordViews} the view was created with, so overrides reach every depth.
 */
public abstract class RecordView {

    private final ValidatedRecord record;
    private final RecordViews views;

    protected RecordView(ValidatedRecord record, RecordViews views) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }
        if (views == null) {
            throw new IllegalArgumentException("views must not be null");
        }
        this.record = record;
        this.views = views;
    }

    /** The underlying record, for fields without a named accessor. */
    public ValidatedRecord record() {
        return record;
    }

    protected RecordViews views() {
        return views;
    }

    protected String string(String field) {
        return record.getString(field);
    }

    protected Long integer(String field) {
        return record.getLong(field);
    }

    protected boolean flag(String field) {
        return Boolean.TRUE.equals(record.getBoolean(field));
    }

    protected <V extends RecordView> V view(String field, Class<V> type) {
        ValidatedRecord nested = record.getRecord(field);
        return nested == null ? null : views.wrap(type, nested);
    }

    protected <V extends RecordView> List<V> viewList(String field, Class<V> type) {
        return record.getRecords(field).stream().map(r -> views.wrap(type, r)).toList();
    }

    protected String url(String field, UrlParam... params) {
        return record.expandUrl(field, params);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return record.equals(((RecordView) o).record);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), record);
    }
}
