package com.virtualcommittee.committee.evaluator;

/**
 * A scoring perspective on the committee. The five members' maxima sum to 100.
 */
public interface CommitteeMember {
    String memberName();
    int maxScore();
}
