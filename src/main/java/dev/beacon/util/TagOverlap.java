package dev.beacon.util;

import java.util.Collection;
import java.util.Set;

public final class TagOverlap {

    private TagOverlap() {
    }

    /**
     * Number of distinct needs that the offered tags cover. Null collections count as empty.
     */
    public static int count(Collection<String> offered, Set<String> needed) {
        if (offered == null || needed == null || offered.isEmpty() || needed.isEmpty()) {
            return 0;
        }
        return (int) needed.stream().filter(offered::contains).count();
    }
}
