package com.vlrnotify.domain.model;

import java.util.Objects;

/**
 * Final map score of a completed match, in participant order.
 */
public class MatchScore {

    private Integer first;

    private Integer second;

    public MatchScore() {
    }

    public MatchScore(Integer first, Integer second) {
        this.first = first;
        this.second = second;
    }

    public Integer getFirst() {
        return first;
    }

    public void setFirst(Integer first) {
        this.first = first;
    }

    public Integer getSecond() {
        return second;
    }

    public void setSecond(Integer second) {
        this.second = second;
    }

    /**
     * Returns 1 or 2 for the winning side, 0 when the score is level or incomplete.
     */
    public int winner() {
        if (first == null || second == null || first.equals(second)) {
            return 0;
        }
        return first > second ? 1 : 2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatchScore)) return false;
        MatchScore that = (MatchScore) o;
        return Objects.equals(first, that.first) && Objects.equals(second, that.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return first + " : " + second;
    }
}
