package org.dheap.queue.instrumentation;

import lombok.experimental.UtilityClass;

/**
 * Worst-case comparison counts per queue operation, to check measured {@link ComparisonStats} against.
 * <p>
 * Bounds are expressed in terms of the height of a complete d-ary tree holding {@code n} items,
 * i.e. the depth of its last slot. For {@code d = 2} this is {@code floor(log2 n)}; for wider trees
 * it can exceed {@code floor(log_d n)} (six items in a 4-ary tree already span three levels).
 * </p>
 */
@UtilityClass
public final class ComparisonBounds {

    /**
     * Height of a complete {@code arity}-ary tree with {@code n} nodes.
     *
     * @param n node count.
     * @param arity children per node, at least 1.
     * @return depth of the last node, 0 when {@code n <= 1}.
     */
    public static int height(int n, int arity) {
        requireArity(arity);
        int depth = 0;
        for (int i = n - 1; i > 0; i = (i - 1) / arity) {
            depth++;
        }
        return depth;
    }

    /**
     * Insert walks toward the root: one comparison per level.
     *
     * @param n size after the insert.
     */
    public static long insert(int n, int arity) {
        return height(n, arity);
    }

    /**
     * Pop walks toward the leaves: {@code d - 1} comparisons to pick the best child plus one
     * against the moving item, per level.
     *
     * @param n size before the pop.
     */
    public static long pop(int n, int arity) {
        return (long) arity * height(n, arity);
    }

    /**
     * Increase-priority walks toward the root only.
     */
    public static long increasePriority(int n, int arity) {
        return height(n, arity);
    }

    /**
     * Decrease-priority walks toward the leaves only.
     */
    public static long decreasePriority(int n, int arity) {
        return (long) arity * height(n, arity);
    }

    /**
     * Direction-agnostic update pays for both walks in the worst case.
     */
    public static long updatePriority(int n, int arity) {
        return (long) (arity + 1) * height(n, arity);
    }

    private static void requireArity(int arity) {
        if (arity < 1) {
            throw new IllegalArgumentException("arity must be >= 1, got " + arity);
        }
    }
}
