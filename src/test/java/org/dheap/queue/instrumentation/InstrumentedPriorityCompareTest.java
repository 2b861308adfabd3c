package org.dheap.queue.instrumentation;

import org.dheap.queue.Comparators;
import org.dheap.queue.IndexedPriorityQueue;
import org.dheap.queue.OperationListener;
import org.dheap.queue.OperationType;
import org.dheap.queue.PriorityCompare;
import org.dheap.queue.PriorityQueueConfig;
import org.dheap.queue.PriorityQueueException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Comparison Instrumentation Tests")
class InstrumentedPriorityCompareTest {

    private static IndexedPriorityQueue<Integer, Integer> instrumentedQueue(
            int arity,
            InstrumentedPriorityCompare<Integer> compare
    ) {
        return IndexedPriorityQueue.create(
                PriorityQueueConfig.builder().arity(arity).operationListener(compare).build(),
                compare,
                Function.<Integer>identity()
        );
    }

    @Nested
    @DisplayName("Counting")
    class CountingTests {

        private InstrumentedPriorityCompare<Integer> compare;
        private IndexedPriorityQueue<Integer, Integer> queue;

        @BeforeEach
        void setUp() {
            compare = new InstrumentedPriorityCompare<>(Comparators.<Integer>min());
            queue = instrumentedQueue(2, compare);
        }

        @Test
        @DisplayName("Comparisons are attributed to insert and pop")
        void testInsertAndPopCounts() {
            queue.insert(5);
            assertEquals(0L, compare.stats().count(OperationType.INSERT), "first insert has no parent");

            queue.insert(3);
            assertEquals(1L, compare.stats().count(OperationType.INSERT));

            queue.insert(7);
            assertEquals(2L, compare.stats().count(OperationType.INSERT));

            assertEquals(3, queue.pop().orElseThrow());
            assertEquals(1L, compare.stats().count(OperationType.POP));
            assertEquals(3L, compare.stats().total());
        }

        @Test
        @DisplayName("Priority updates report under their own operation type")
        void testUpdateCounts() {
            queue.insertMany(List.of(10, 20, 30, 40, 50));
            compare.stats().reset();

            queue.increasePriority(50);
            queue.increasePriorityByIndex(0);
            queue.decreasePriorityByIndex(0);
            queue.updatePriorityByIndex(1);

            ComparisonTelemetry telemetry = compare.stats().snapshot();
            assertEquals(0L, telemetry.getInsertComparisons());
            assertEquals(0L, telemetry.getPopComparisons());
            assertTrue(telemetry.getIncreasePriorityComparisons() > 0);
            assertTrue(telemetry.getDecreasePriorityComparisons() > 0);
            assertTrue(telemetry.getUpdatePriorityComparisons() > 0);
            assertTrue(telemetry.getIncreasePriorityComparisons() <= 2 * ComparisonBounds.increasePriority(5, 2));
            assertTrue(telemetry.getDecreasePriorityComparisons() <= ComparisonBounds.decreasePriority(5, 2));
            assertTrue(telemetry.getUpdatePriorityComparisons() <= ComparisonBounds.updatePriority(5, 2));
            assertEquals(compare.stats().total(), telemetry.totalComparisons());
        }

        @Test
        @DisplayName("Direct calls outside an operation are not counted")
        void testOutsideOperationNotCounted() {
            assertTrue(compare.higherPriority(1, 2));
            assertFalse(compare.higherPriority(2, 1));
            assertEquals(0L, compare.stats().total());
        }

        @Test
        @DisplayName("Reset zeroes every counter; snapshot is detached")
        void testResetAndSnapshot() {
            queue.insertMany(List.of(9, 8, 7, 6, 5, 4));
            ComparisonTelemetry before = compare.stats().snapshot();
            assertTrue(before.getInsertComparisons() > 0);

            compare.stats().reset();

            assertEquals(0L, compare.stats().total());
            assertTrue(before.totalComparisons() > 0, "snapshot must not follow later resets");
            assertTrue(compare.stats().toString().contains("total=0"));
        }

        @Test
        @DisplayName("Higher arity trades fewer levels for more comparisons per level")
        void testArityAffectsCounts() {
            InstrumentedPriorityCompare<Integer> wide = new InstrumentedPriorityCompare<>(Comparators.<Integer>min());
            IndexedPriorityQueue<Integer, Integer> wideQueue = instrumentedQueue(8, wide);
            List<Integer> items = new ArrayList<>();
            for (int i = 1000; i > 0; i--) {
                items.add(i);
            }
            for (Integer item : items) {
                queue.insert(item);
                wideQueue.insert(item);
            }

            assertTrue(wide.stats().count(OperationType.INSERT) < compare.stats().count(OperationType.INSERT),
                    "shallower tree means fewer swim comparisons");
        }
    }

    @Nested
    @DisplayName("Operation Boundaries")
    class BoundaryTests {

        @Test
        @DisplayName("afterOperation runs even when the comparator throws")
        void testAfterOperationOnFailure() {
            boolean[] explode = {false};
            PriorityCompare<Integer> fragile = (a, b) -> {
                if (explode[0]) {
                    throw new IllegalStateException("comparator failure");
                }
                return a < b;
            };
            InstrumentedPriorityCompare<Integer> compare = new InstrumentedPriorityCompare<>(fragile);
            IndexedPriorityQueue<Integer, Integer> queue = instrumentedQueue(2, compare);
            queue.insert(4);

            explode[0] = true;
            assertThrows(IllegalStateException.class, () -> queue.insert(1));
            assertEquals(1L, compare.stats().count(OperationType.INSERT));

            explode[0] = false;
            compare.higherPriority(1, 2);
            assertEquals(1L, compare.stats().total(), "no operation is active after the failure");
            assertEquals(List.of(4), queue.toList(), "failed insert must not leave the item behind");
            assertFalse(queue.contains(1));

            queue.insert(1);
            assertEquals(Optional.of(1), queue.peek());
        }

        @Test
        @DisplayName("Rejected calls fire no operation events")
        void testRejectedCallsAreSilent() {
            List<String> events = new ArrayList<>();
            OperationListener recorder = new OperationListener() {
                @Override
                public void beforeOperation(OperationType type) {
                    events.add("before:" + type);
                }

                @Override
                public void afterOperation(OperationType type) {
                    events.add("after:" + type);
                }
            };
            IndexedPriorityQueue<Integer, Integer> queue = IndexedPriorityQueue.create(
                    PriorityQueueConfig.builder().operationListener(recorder).build(),
                    Comparators.<Integer>min(),
                    Function.<Integer>identity()
            );
            queue.insert(1);
            events.clear();

            assertThrows(PriorityQueueException.class, () -> queue.insert(1));
            assertThrows(PriorityQueueException.class, () -> queue.increasePriority(99));
            assertThrows(PriorityQueueException.class, () -> queue.decreasePriorityByIndex(5));
            assertTrue(events.isEmpty(), "unexpected events: " + events);

            queue.pop();
            queue.pop();
            assertEquals(List.of("before:POP", "after:POP"), events, "pop on empty queue is silent");
        }

        @Test
        @DisplayName("popMany reports each extraction separately")
        void testPopManyEvents() {
            List<OperationType> started = new ArrayList<>();
            OperationListener recorder = new OperationListener() {
                @Override
                public void beforeOperation(OperationType type) {
                    started.add(type);
                }
            };
            IndexedPriorityQueue<Integer, Integer> queue = IndexedPriorityQueue.create(
                    PriorityQueueConfig.builder().arity(3).operationListener(recorder).build(),
                    Comparators.<Integer>min(),
                    Function.<Integer>identity()
            );
            queue.insertMany(List.of(5, 1, 4, 2));
            queue.popMany(3);

            assertEquals(
                    List.of(OperationType.INSERT, OperationType.POP, OperationType.POP, OperationType.POP),
                    started
            );
        }
    }
    @Nested
    @DisplayName("Worst-Case Bounds")
    class BoundTests {

        private long measure(InstrumentedPriorityCompare<Integer> compare, OperationType type, Runnable action) {
            long before = compare.stats().count(type);
            action.run();
            return compare.stats().count(type) - before;
        }

        @ParameterizedTest(name = "arity {0}")
        @ValueSource(ints = {2, 4, 8})
        @DisplayName("Every operation stays within its comparison bound")
        void testMeasuredWithinBounds(int arity) {
            InstrumentedPriorityCompare<Integer> compare = new InstrumentedPriorityCompare<>(Comparators.<Integer>min());
            IndexedPriorityQueue<Integer, Integer> queue = instrumentedQueue(arity, compare);
            Random rand = new Random(99L + arity);
            List<Integer> live = new ArrayList<>();

            for (int step = 0; step < 2_000; step++) {
                int op = live.isEmpty() ? 0 : rand.nextInt(5);
                int n = queue.size();
                if (op == 0) {
                    int item = rand.nextInt(1_000_000);
                    if (queue.contains(item)) {
                        continue;
                    }
                    long used = measure(compare, OperationType.INSERT, () -> queue.insert(item));
                    assertTrue(used <= ComparisonBounds.insert(n + 1, arity),
                            "insert used " + used + " at size " + (n + 1));
                    live.add(item);
                } else if (op == 1) {
                    long used = measure(compare, OperationType.POP,
                            () -> live.remove(queue.pop().orElseThrow()));
                    assertTrue(used <= ComparisonBounds.pop(n, arity), "pop used " + used + " at size " + n);
                } else {
                    int index = rand.nextInt(n);
                    OperationType type = op == 2 ? OperationType.INCREASE_PRIORITY
                            : op == 3 ? OperationType.DECREASE_PRIORITY
                            : OperationType.UPDATE_PRIORITY;
                    long used = measure(compare, type, () -> {
                        if (type == OperationType.INCREASE_PRIORITY) {
                            queue.increasePriorityByIndex(index);
                        } else if (type == OperationType.DECREASE_PRIORITY) {
                            queue.decreasePriorityByIndex(index);
                        } else {
                            queue.updatePriorityByIndex(index);
                        }
                    });
                    long bound = type == OperationType.INCREASE_PRIORITY ? ComparisonBounds.increasePriority(n, arity)
                            : type == OperationType.DECREASE_PRIORITY ? ComparisonBounds.decreasePriority(n, arity)
                            : ComparisonBounds.updatePriority(n, arity);
                    assertTrue(used <= bound, type + " used " + used + " at size " + n);
                }
            }
        }

        @ParameterizedTest(name = "arity {0}")
        @ValueSource(ints = {2, 4, 8})
        @DisplayName("Worst-case walks reach the insert and decrease bounds exactly")
        void testBoundsAreTight(int arity) {
            InstrumentedPriorityCompare<Integer> compare = new InstrumentedPriorityCompare<>(Comparators.<Integer>min());
            IndexedPriorityQueue<Integer, Integer> queue = instrumentedQueue(arity, compare);
            for (int i = 0; i < 200; i++) {
                int item = -i;
                long used = measure(compare, OperationType.INSERT, () -> queue.insert(item));
                assertEquals(ComparisonBounds.insert(i + 1, arity), used, "descending inserts always climb to the root");
            }
        }
    }
}
