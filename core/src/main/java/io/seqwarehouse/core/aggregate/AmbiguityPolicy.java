package io.seqwarehouse.core.aggregate;

/** What the aggregator does with a target that matched more than one candidate. */
public enum AmbiguityPolicy {
    /** Copy nothing for the target and report it as failed. */
    FAIL,
    /** Copy the candidate with the latest modification time. */
    NEWEST_WINS
}
