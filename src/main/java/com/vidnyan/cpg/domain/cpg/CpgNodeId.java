package com.vidnyan.cpg.domain.cpg;

/**
 * Arena index of a node in a {@link CodePropertyGraph}.
 */
public record CpgNodeId(int value) implements Comparable<CpgNodeId> {

    @Override
    public int compareTo(CpgNodeId other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "cpg#" + value;
    }
}
