package com.creditmemo.rules;

import com.creditmemo.matrix.PolicyCategory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Maps a free-text memo reason to the policy category whose matrix applies.
 *
 * Promotional keywords are checked before contract keywords, so a reason
 * mentioning both is Promotional.
 */
@Component
public class ReasonClassifier {

    public PolicyCategory classify(String reason, ComplianceSettings settings) {
        String text = reason == null ? "" : reason.toLowerCase(Locale.ROOT);

        if (containsAny(text, settings.getKeywordsPromotional())) {
            return PolicyCategory.PROMOTIONAL;
        }
        if (containsAny(text, settings.getKeywordsContract())) {
            return PolicyCategory.CONTRACT;
        }
        return PolicyCategory.OTHER;
    }

    private boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}
