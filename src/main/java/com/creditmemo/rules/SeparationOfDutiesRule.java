package com.creditmemo.rules;

import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Rule that the person who created a memo must not also approve it.
 */
@Component
public class SeparationOfDutiesRule {

    /**
     * @return true when creator and approver are the same (non-empty) person
     */
    public boolean isViolated(String createdBy, String approver) {
        String creator = normalize(createdBy);
        String approvedBy = normalize(approver);
        return !creator.isEmpty() && !approvedBy.isEmpty() && creator.equals(approvedBy);
    }

    private String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
