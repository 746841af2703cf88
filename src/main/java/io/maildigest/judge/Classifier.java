package io.maildigest.judge;

import io.maildigest.model.MessageRecord;
import io.maildigest.model.Verdict;

import java.util.List;

@FunctionalInterface
public interface Classifier {
    /**
     * @return exactly one verdict per input, in input order
     */
    List<Verdict> classify(List<MessageRecord> batch);
}
