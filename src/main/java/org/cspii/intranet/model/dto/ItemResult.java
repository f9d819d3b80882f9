package org.cspii.intranet.model.dto;

/**
 * Result of a single sub-operation of a batch, e.g. one team creation.
 *
 * @param target    the machine name or path the sub-operation acted on
 * @param status    what happened
 * @param errorKind set for SKIPPED and FAILED items
 * @param message   human readable detail, may be null
 */
public record ItemResult(String target, ItemStatus status, ErrorKind errorKind, String message) {

    public static ItemResult created(String target) {
        return new ItemResult(target, ItemStatus.CREATED, null, null);
    }

    public static ItemResult applied(String target) {
        return new ItemResult(target, ItemStatus.APPLIED, null, null);
    }

    public static ItemResult skipped(String target, ErrorKind kind, String message) {
        return new ItemResult(target, ItemStatus.SKIPPED, kind, message);
    }

    public static ItemResult failed(String target, ErrorKind kind, String message) {
        return new ItemResult(target, ItemStatus.FAILED, kind, message);
    }

    public boolean isFailed() {
        return status == ItemStatus.FAILED;
    }
}
