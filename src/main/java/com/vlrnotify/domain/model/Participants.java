package com.vlrnotify.domain.model;

import java.util.Objects;

/**
 * Ordered pair of teams taking part in a match.
 */
public class Participants {

    /** Team listed first by the source. */
    private String first;

    /** Team listed second by the source. */
    private String second;

    /** Two-letter country code of the first team, may be null. */
    private String firstFlag;

    /** Two-letter country code of the second team, may be null. */
    private String secondFlag;

    public Participants() {
    }

    public Participants(String first, String second) {
        this.first = first;
        this.second = second;
    }

    public String getFirst() {
        return first;
    }

    public void setFirst(String first) {
        this.first = first;
    }

    public String getSecond() {
        return second;
    }

    public void setSecond(String second) {
        this.second = second;
    }

    public String getFirstFlag() {
        return firstFlag;
    }

    public void setFirstFlag(String firstFlag) {
        this.firstFlag = firstFlag;
    }

    public String getSecondFlag() {
        return secondFlag;
    }

    public void setSecondFlag(String secondFlag) {
        this.secondFlag = secondFlag;
    }

    public Participants copy() {
        Participants copy = new Participants(first, second);
        copy.setFirstFlag(firstFlag);
        copy.setSecondFlag(secondFlag);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Participants)) return false;
        Participants that = (Participants) o;
        return Objects.equals(first, that.first)
            && Objects.equals(second, that.second)
            && Objects.equals(firstFlag, that.firstFlag)
            && Objects.equals(secondFlag, that.secondFlag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second, firstFlag, secondFlag);
    }

    @Override
    public String toString() {
        return first + " vs " + second;
    }
}
