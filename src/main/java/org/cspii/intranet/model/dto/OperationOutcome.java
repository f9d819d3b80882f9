package org.cspii.intranet.model.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * The structured result every hierarchy operation returns to its caller.
 * Operations never throw across this boundary; a failure is described by
 * {@link #status()} and {@link #errorKind()}, and batch operations carry one
 * {@link ItemResult} per sub-operation.
 */
public record OperationOutcome(
        OutcomeStatus status,
        ErrorKind errorKind,
        String message,
        List<ItemResult> items
) {

    public OperationOutcome {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static OperationOutcome succeeded(String message) {
        return new OperationOutcome(OutcomeStatus.SUCCEEDED, null, message, List.of());
    }

    public static OperationOutcome failed(ErrorKind kind, String message) {
        return new OperationOutcome(OutcomeStatus.FAILED, kind, message, List.of());
    }

    public static OperationOutcome failed(ErrorKind kind, String message, List<ItemResult> items) {
        return new OperationOutcome(OutcomeStatus.FAILED, kind, message, items);
    }

    /**
     * Summarises a batch: any failed item makes the whole batch a PARTIAL_FAILURE,
     * skipped items alone only downgrade it to SUCCEEDED_WITH_SKIPS.
     */
    public static OperationOutcome fromItems(String operation, List<ItemResult> items) {
        long failed = items.stream().filter(i -> i.status() == ItemStatus.FAILED).count();
        long skipped = items.stream().filter(i -> i.status() == ItemStatus.SKIPPED).count();
        long done = items.size() - failed - skipped;

        String message = String.format("%s: %d done, %d skipped, %d failed", operation, done, skipped, failed);
        if (failed > 0) {
            return new OperationOutcome(OutcomeStatus.FAILED, ErrorKind.PARTIAL_FAILURE, message, items);
        }
        if (skipped > 0) {
            return new OperationOutcome(OutcomeStatus.SUCCEEDED_WITH_SKIPS, null, message, items);
        }
        return new OperationOutcome(OutcomeStatus.SUCCEEDED, null, message, items);
    }

    /**
     * Combines two outcomes of one logical operation. The first failure wins the error kind.
     */
    public OperationOutcome and(OperationOutcome other) {
        List<ItemResult> merged = new ArrayList<>(items);
        merged.addAll(other.items());
        String mergedMessage = message == null ? other.message()
                : other.message() == null ? message : message + "; " + other.message();

        if (!isSuccess()) {
            return new OperationOutcome(OutcomeStatus.FAILED, errorKind, mergedMessage, merged);
        }
        if (!other.isSuccess()) {
            return new OperationOutcome(OutcomeStatus.FAILED, other.errorKind(), mergedMessage, merged);
        }
        OutcomeStatus status = this.status == OutcomeStatus.SUCCEEDED_WITH_SKIPS
                || other.status() == OutcomeStatus.SUCCEEDED_WITH_SKIPS
                ? OutcomeStatus.SUCCEEDED_WITH_SKIPS : OutcomeStatus.SUCCEEDED;
        return new OperationOutcome(status, null, mergedMessage, merged);
    }

    public boolean isSuccess() {
        return status != OutcomeStatus.FAILED;
    }

    public long count(ItemStatus itemStatus) {
        return items.stream().filter(i -> i.status() == itemStatus).count();
    }
}
