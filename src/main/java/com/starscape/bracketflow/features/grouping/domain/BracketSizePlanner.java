package com.starscape.bracketflow.features.grouping.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions an oversized run of shots into full brackets.
 * <p>
 * Bottom-up table over the remaining shot count: {@code best[r]} is the largest number of
 * shots that can be placed into brackets of an allowed size using {@code r} shots. Sizes are
 * tried from largest to smallest and only a strict improvement replaces a choice, so ties
 * resolve towards larger leading brackets.
 */
public final class BracketSizePlanner {
    
    private BracketSizePlanner() {
    }
    
    public static Plan plan(int shots, int minSize, int maxSize) {
        if (shots < 0) {
            throw new IllegalArgumentException("shots must not be negative");
        }
        if (minSize < 1 || maxSize < minSize) {
            throw new IllegalArgumentException("invalid bracket size range " + minSize + ".." + maxSize);
        }
        int largest = Math.min(maxSize, shots);
        int[] best = new int[shots + 1];
        int[] choice = new int[shots + 1];
        for (int remaining = 1; remaining <= shots; remaining++) {
            for (int size = Math.min(largest, remaining); size >= minSize; size--) {
                int consumed = size + best[remaining - size];
                if (consumed > best[remaining]) {
                    best[remaining] = consumed;
                    choice[remaining] = size;
                }
            }
        }
        List<Integer> sizes = new ArrayList<>();
        int remaining = shots;
        while (remaining > 0 && choice[remaining] > 0) {
            sizes.add(choice[remaining]);
            remaining -= choice[remaining];
        }
        return new Plan(List.copyOf(sizes), shots - best[shots]);
    }
    
    /**
     * @param bracketSizes sizes of consecutive brackets, in order
     * @param leftover shots that fit no bracket and become singletons
     */
    public record Plan(List<Integer> bracketSizes, int leftover) {
        
        public int consumed() {
            return bracketSizes.stream().mapToInt(Integer::intValue).sum();
        }
    }
}
