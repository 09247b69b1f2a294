package com.creditmemo.rules;

import lombok.Value;

import java.util.List;

/**
 * Ordered list of reasons a memo violates policy.
 */
@Value
public class ViolationBreakdown {

    List<String> reasons;

    public static ViolationBreakdown of(List<String> reasons) {
        return new ViolationBreakdown(List.copyOf(reasons));
    }

    public int getCount() {
        return reasons.size();
    }

    /**
     * Reasons joined for the output table, "None" when there are none.
     */
    public String getSummary() {
        return reasons.isEmpty() ? "None" : String.join(" | ", reasons);
    }
}
