package com.creditmemo.rules;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Result of resolving an approver designation against a matrix.
 *
 * UNRESOLVED means there was nothing to look up (no designation or no matrix).
 * NOT_FOUND means the matrix was consulted and no row matched.
 */
@EqualsAndHashCode
@ToString
public final class ApproverLevel {

    public enum Kind {
        UNRESOLVED,
        NOT_FOUND,
        LEVEL
    }

    private static final ApproverLevel UNRESOLVED = new ApproverLevel(Kind.UNRESOLVED, 0);
    private static final ApproverLevel NOT_FOUND = new ApproverLevel(Kind.NOT_FOUND, 0);

    private final Kind kind;
    private final int level;

    private ApproverLevel(Kind kind, int level) {
        this.kind = kind;
        this.level = level;
    }

    public static ApproverLevel unresolved() {
        return UNRESOLVED;
    }

    public static ApproverLevel notFound() {
        return NOT_FOUND;
    }

    public static ApproverLevel of(int level) {
        return new ApproverLevel(Kind.LEVEL, level);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isResolved() {
        return kind == Kind.LEVEL;
    }

    public int getLevel() {
        if (kind != Kind.LEVEL) {
            throw new IllegalStateException("Approver level is " + kind);
        }
        return level;
    }

    /**
     * Level for the output table; null unless resolved.
     */
    public Integer toNullableLevel() {
        return isResolved() ? level : null;
    }
}
