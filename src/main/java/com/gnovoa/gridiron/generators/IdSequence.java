package com.gnovoa.gridiron.generators;

import java.util.Collection;
import java.util.concurrent.atomic.AtomicLong;

/** Counter-based ids, so a seeded run reproduces the same ids. */
public final class IdSequence {

    private final String prefix;
    private final AtomicLong counter;

    public IdSequence(String prefix) {
        this(prefix, 0);
    }

    public IdSequence(String prefix, long start) {
        this.prefix = prefix;
        this.counter = new AtomicLong(start);
    }

    /** A sequence that continues after the highest {@code prefix-N} id already taken. */
    public static IdSequence continuing(String prefix, Collection<String> existingIds) {
        String head = prefix + "-";
        long max = 0;
        for (String id : existingIds) {
            if (!id.startsWith(head)) continue;
            String suffix = id.substring(head.length());
            if (suffix.isEmpty() || suffix.length() > 18 || !suffix.chars().allMatch(Character::isDigit)) continue;
            max = Math.max(max, Long.parseLong(suffix));
        }
        return new IdSequence(prefix, max);
    }

    public String prefix() { return prefix; }

    public String next() {
        return prefix + "-" + counter.incrementAndGet();
    }
}
