package org.dheap.queue;

import lombok.experimental.UtilityClass;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Factory methods for common {@link PriorityCompare} strategies.
 */
@UtilityClass
public final class Comparators {

    /**
     * Min-heap ordering on an extracted key: lower keys sit closer to the root.
     *
     * @param keyFn priority key extractor.
     * @param <T> item type.
     * @param <P> priority key type.
     * @return min-oriented comparator.
     */
    public static <T, P extends Comparable<? super P>> PriorityCompare<T> minBy(Function<? super T, ? extends P> keyFn) {
        Objects.requireNonNull(keyFn, "keyFn");
        return (a, b) -> keyFn.apply(a).compareTo(keyFn.apply(b)) < 0;
    }

    /**
     * Max-heap ordering on an extracted key: higher keys sit closer to the root.
     *
     * @param keyFn priority key extractor.
     * @param <T> item type.
     * @param <P> priority key type.
     * @return max-oriented comparator.
     */
    public static <T, P extends Comparable<? super P>> PriorityCompare<T> maxBy(Function<? super T, ? extends P> keyFn) {
        Objects.requireNonNull(keyFn, "keyFn");
        return (a, b) -> keyFn.apply(a).compareTo(keyFn.apply(b)) > 0;
    }

    /**
     * Min-heap ordering on the items' natural order.
     */
    public static <T extends Comparable<? super T>> PriorityCompare<T> min() {
        return (a, b) -> a.compareTo(b) < 0;
    }

    /**
     * Max-heap ordering on the items' natural order.
     */
    public static <T extends Comparable<? super T>> PriorityCompare<T> max() {
        return (a, b) -> a.compareTo(b) > 0;
    }

    /**
     * Adapts a {@link Comparator}: items ordered first by it have higher priority.
     *
     * @param comparator ordering to adapt.
     * @param <T> item type.
     * @return min-oriented comparator over {@code comparator}.
     */
    public static <T> PriorityCompare<T> fromComparator(Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        return (a, b) -> comparator.compare(a, b) < 0;
    }

    /**
     * Swaps the arguments of {@code cmp}, turning a min-heap into a max-heap and vice versa.
     */
    public static <T> PriorityCompare<T> reverse(PriorityCompare<T> cmp) {
        Objects.requireNonNull(cmp, "cmp");
        return (a, b) -> cmp.higherPriority(b, a);
    }

    /**
     * Lexicographic combination: the first comparator that tells the two items apart decides.
     * Items tied under every comparator compare as not higher.
     *
     * @param comparators comparators in decreasing significance.
     * @param <T> item type.
     * @return chained comparator.
     */
    @SafeVarargs
    public static <T> PriorityCompare<T> chain(PriorityCompare<T>... comparators) {
        List<PriorityCompare<T>> chained = List.of(comparators);
        return (a, b) -> {
            for (PriorityCompare<T> cmp : chained) {
                if (cmp.higherPriority(a, b)) {
                    return true;
                }
                if (cmp.higherPriority(b, a)) {
                    return false;
                }
            }
            return false;
        };
    }
}
