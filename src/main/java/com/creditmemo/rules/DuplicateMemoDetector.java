package com.creditmemo.rules;

import com.creditmemo.memo.CreditMemoRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags every memo whose identifier occurs more than once in the run.
 * Identifiers are compared exactly; absent identifiers count as equal.
 */
@Component
public class DuplicateMemoDetector {

    /**
     * @return one flag per record, in input order
     */
    public List<Boolean> detect(List<CreditMemoRecord> records) {
        Map<String, Integer> occurrences = new HashMap<>();
        for (CreditMemoRecord record : records) {
            occurrences.merge(record.getMemo(), 1, Integer::sum);
        }

        List<Boolean> flags = new ArrayList<>(records.size());
        for (CreditMemoRecord record : records) {
            flags.add(occurrences.get(record.getMemo()) > 1);
        }
        return flags;
    }
}
