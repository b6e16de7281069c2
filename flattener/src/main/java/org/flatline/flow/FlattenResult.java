package org.flatline.flow;

/**
 * Outcome of flattening one method. Rejections are reported here rather than thrown;
 * a rejected method is left exactly as it was.
 */
public final class FlattenResult {

    public enum Status {
        APPLIED,
        /** The method contains a construct the transform cannot rewrite. */
        NOT_APPLICABLE_UNSUPPORTED,
        /** At most one block: nothing to flatten. */
        NOT_APPLICABLE_TRIVIAL
    }

    private final Status status;
    private final String reason;
    private final int caseCount;

    private FlattenResult(Status status, String reason, int caseCount) {
        this.status = status;
        this.reason = reason;
        this.caseCount = caseCount;
    }

    public static FlattenResult applied(int caseCount) {
        return new FlattenResult(Status.APPLIED, null, caseCount);
    }

    public static FlattenResult unsupported(String reason) {
        return new FlattenResult(Status.NOT_APPLICABLE_UNSUPPORTED, reason, 0);
    }

    public static FlattenResult trivial(String reason) {
        return new FlattenResult(Status.NOT_APPLICABLE_TRIVIAL, reason, 0);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }

    /** Why the method was rejected; {@code null} when applied. */
    public String getReason() {
        return reason;
    }

    /** Number of distinct keys in the dispatcher's switch. */
    public int getCaseCount() {
        return caseCount;
    }

    @Override
    public String toString() {
        return status == Status.APPLIED
                ? "APPLIED(" + caseCount + " cases)"
                : status + "(" + reason + ")";
    }
}
