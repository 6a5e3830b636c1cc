package com.hookline.eventmodel;

import java.util.Optional;

/**
 * Well-known values of the payload {@code action} field.
 *
 * <p>Not exhaustive: GitHub adds actions without notice, so envelopes carry the action as a plain
 * string and hook filters match on {@link #value()}.
 */
public enum EventAction {
    ADDED("added"),
    ANSWERED("answered"),
    ARCHIVED("archived"),
    ASSIGNED("assigned"),
    AUTO_MERGE_DISABLED("auto_merge_disabled"),
    AUTO_MERGE_ENABLED("auto_merge_enabled"),
    BLOCKED("blocked"),
    CANCELLED("cancelled"),
    CHANGED("changed"),
    CLOSED("closed"),
    COMPLETED("completed"),
    CONVERTED("converted"),
    CONVERTED_TO_DRAFT("converted_to_draft"),
    CREATED("created"),
    DELETED("deleted"),
    DEMILESTONED("demilestoned"),
    DISMISSED("dismissed"),
    EDITED("edited"),
    LABELED("labeled"),
    LOCKED("locked"),
    MEMBER_ADDED("member_added"),
    MEMBER_INVITED("member_invited"),
    MEMBER_REMOVED("member_removed"),
    MILESTONED("milestoned"),
    MOVED("moved"),
    NEW_PERMISSIONS_ACCEPTED("new_permissions_accepted"),
    OPENED("opened"),
    PENDING_CHANGE("pending_change"),
    PENDING_CHANGE_CANCELLED("pending_change_cancelled"),
    PERFORMED("performed"),
    PINNED("pinned"),
    PRERELEASED("prereleased"),
    PRIVATIZED("privatized"),
    PUBLICIZED("publicized"),
    PUBLISHED("published"),
    PURCHASED("purchased"),
    READY_FOR_REVIEW("ready_for_review"),
    RELEASED("released"),
    REMOVED("removed"),
    RENAMED("renamed"),
    REOPENED("reopened"),
    REQUESTED("requested"),
    REQUESTED_ACTION("requested_action"),
    REREQUESTED("rerequested"),
    RESOLVED("resolved"),
    REVIEW_REQUEST_REMOVED("review_request_removed"),
    REVIEW_REQUESTED("review_requested"),
    REVOKED("revoked"),
    STARTED("started"),
    SUBMITTED("submitted"),
    SUSPEND("suspend"),
    SYNCHRONIZE("synchronize"),
    TRANSFERRED("transferred"),
    UNARCHIVED("unarchived"),
    UNASSIGNED("unassigned"),
    UNBLOCKED("unblocked"),
    UNLABELED("unlabeled"),
    UNLOCKED("unlocked"),
    UNPINNED("unpinned"),
    UNPUBLISHED("unpublished"),
    UNSUSPEND("unsuspend"),
    UPDATED("updated");

    private final String value;

    EventAction(String value) {
        this.value = value;
    }

    /** The wire value (e.g. "opened"). */
    public String value() {
        return value;
    }

    public static Optional<EventAction> fromString(String value) {
        for (EventAction action : values()) {
            if (action.value.equals(value)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
