package com.vidnyan.cpg.domain.runtime;

import java.util.List;

final class Paths {

    private Paths() {
    }

    /** True when every element of {@code required} occurs in {@code path} in the same relative order. */
    static boolean containsInOrder(List<String> path, List<String> required) {
        int position = 0;
        for (String segment : required) {
            boolean found = false;
            while (position < path.size()) {
                if (path.get(position++).equalsIgnoreCase(segment)) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }
}
