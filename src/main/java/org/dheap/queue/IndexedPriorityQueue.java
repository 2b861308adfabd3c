package org.dheap.queue;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * Generic d-ary heap priority queue with O(1) identity-to-position lookup.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Configurable Arity:</strong> Each node has at most {@code d} children, laid out
 * implicitly in a dense array (parent of {@code i} is {@code (i - 1) / d}).</li>
 * <li><strong>Injected Ordering:</strong> A {@link PriorityCompare} decides which item sits closer
 * to the root, so the same structure serves min-heaps, max-heaps and composite orderings.</li>
 * <li><strong>Priority Mutation:</strong> An identity-keyed position index locates any queued item in
 * O(1), allowing in-place increase/decrease/update of its priority.</li>
 * </ul>
 * </p>
 * <p>
 * Identity is derived from each item by a key extractor. The single-argument factories use the
 * item itself as its key; its {@code equals}/{@code hashCode} must then depend only on identity,
 * never on priority.
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. It is intended for single-threaded use
 * or must be guarded by an external lock.</p>
 *
 * @param <T> item type.
 * @param <K> identity key type.
 */
@Slf4j
public final class IndexedPriorityQueue<T, K> implements Iterable<T> {

    private static final int NOT_FOUND = -1;

    // Complete d-ary tree, index 0 is the root
    private final ObjectArrayList<T> heap;

    // positions[key(heap[p])] == p for every queued item
    private final Object2IntOpenHashMap<K> positions;

    private final PriorityCompare<? super T> comparator;
    private final Function<? super T, ? extends K> keyExtractor;
    private final OperationListener listener;

    // Scratch buffer for traceSink, reused across operations
    private final IntArrayList route = new IntArrayList();

    @Getter
    @Accessors(fluent = true)
    private int arity;

    private IndexedPriorityQueue(
            PriorityQueueConfig config,
            PriorityCompare<? super T> comparator,
            Function<? super T, ? extends K> keyExtractor
    ) {
        Objects.requireNonNull(config, "config");
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        this.keyExtractor = Objects.requireNonNull(keyExtractor, "keyExtractor");
        this.listener = Objects.requireNonNull(config.getOperationListener(), "operationListener");
        this.arity = requireValidArity(config.getArity());

        int capacity = config.getInitialCapacity();
        if (capacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be non-negative, got " + capacity);
        }
        this.heap = new ObjectArrayList<>(capacity);
        this.positions = new Object2IntOpenHashMap<>(capacity);
        this.positions.defaultReturnValue(NOT_FOUND);

        log.debug("Created {}-ary priority queue (initialCapacity={})", arity, capacity);
    }

    // --- Construction ---

    /**
     * Creates an empty queue keyed by the items themselves.
     *
     * @param arity maximum children per node, must be &gt;= 1.
     * @param comparator ordering strategy.
     * @throws PriorityQueueException with {@code INVALID_ARITY} when {@code arity < 1}.
     */
    public static <T> IndexedPriorityQueue<T, T> create(int arity, PriorityCompare<? super T> comparator) {
        return create(arity, comparator, Function.<T>identity());
    }

    /**
     * Creates an empty queue whose identity is extracted by {@code keyExtractor}.
     *
     * @param arity maximum children per node, must be &gt;= 1.
     * @param comparator ordering strategy.
     * @param keyExtractor stable identity key per item.
     * @throws PriorityQueueException with {@code INVALID_ARITY} when {@code arity < 1}.
     */
    public static <T, K> IndexedPriorityQueue<T, K> create(
            int arity,
            PriorityCompare<? super T> comparator,
            Function<? super T, ? extends K> keyExtractor
    ) {
        return create(PriorityQueueConfig.ofArity(arity), comparator, keyExtractor);
    }

    /**
     * Creates an empty queue from a full configuration.
     *
     * @param config arity, capacity hint and operation hooks.
     * @param comparator ordering strategy.
     * @param keyExtractor stable identity key per item.
     * @throws PriorityQueueException with {@code INVALID_ARITY} when the configured arity is below 1.
     */
    public static <T, K> IndexedPriorityQueue<T, K> create(
            PriorityQueueConfig config,
            PriorityCompare<? super T> comparator,
            Function<? super T, ? extends K> keyExtractor
    ) {
        return new IndexedPriorityQueue<>(config, comparator, keyExtractor);
    }

    /**
     * Creates a queue keyed by the items themselves, seeded with {@code first}.
     */
    public static <T> IndexedPriorityQueue<T, T> createWithFirst(
            int arity,
            PriorityCompare<? super T> comparator,
            T first
    ) {
        return createWithFirst(arity, comparator, Function.<T>identity(), first);
    }

    /**
     * Creates a queue seeded with {@code first}. A single item needs no rebalancing.
     */
    public static <T, K> IndexedPriorityQueue<T, K> createWithFirst(
            int arity,
            PriorityCompare<? super T> comparator,
            Function<? super T, ? extends K> keyExtractor,
            T first
    ) {
        IndexedPriorityQueue<T, K> queue = create(arity, comparator, keyExtractor);
        Objects.requireNonNull(first, "first");
        queue.heap.add(first);
        queue.positions.put(queue.keyExtractor.apply(first), 0);
        return queue;
    }

    // --- Queries ---

    /**
     * @return number of queued items.
     */
    public int size() {
        return heap.size();
    }

    /**
     * @return true when no item is queued.
     */
    public boolean isEmpty() {
        return heap.isEmpty();
    }

    /**
     * Checks whether an item with the same identity is queued.
     */
    public boolean contains(T item) {
        Objects.requireNonNull(item, "item");
        return positions.containsKey(keyExtractor.apply(item));
    }

    /**
     * Checks whether an item with identity {@code key} is queued.
     */
    public boolean containsKey(K key) {
        return positions.containsKey(key);
    }

    /**
     * Returns the current heap position of the item's identity.
     *
     * @param item item whose identity is looked up; its priority is ignored.
     * @return store index, or empty when the identity is not queued.
     */
    public OptionalInt positionOf(T item) {
        Objects.requireNonNull(item, "item");
        return positionOfKey(keyExtractor.apply(item));
    }

    /**
     * Returns the current heap position of identity {@code key}.
     */
    public OptionalInt positionOfKey(K key) {
        int position = positions.getInt(key);
        return position == NOT_FOUND ? OptionalInt.empty() : OptionalInt.of(position);
    }

    /**
     * Returns the highest-priority item without removing it.
     *
     * @return root item, or empty when the queue is empty.
     */
    public Optional<T> peek() {
        return heap.isEmpty() ? Optional.empty() : Optional.of(heap.get(0));
    }

    /**
     * Returns the highest-priority item without removing it.
     * <p>
     * Unlike {@link #peek()}, callers must know the queue is non-empty.
     * </p>
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public T front() {
        if (heap.isEmpty()) {
            throw new EmptyQueueException();
        }
        return heap.get(0);
    }

    /**
     * Returns a snapshot of the store in heap layout. This is NOT a sorted sequence.
     */
    public List<T> toList() {
        return List.copyOf(heap);
    }

    /**
     * Iterates items in heap layout. The queue must not be mutated during iteration.
     */
    @Override
    public Iterator<T> iterator() {
        return Collections.unmodifiableList(heap).iterator();
    }

    /**
     * Renders the store as {@code {item1, item2, ...}} in heap layout.
     */
    @Override
    public String toString() {
        StringBuilder out = new StringBuilder(2 + heap.size() * 4);
        out.append('{');
        for (int i = 0; i < heap.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            out.append(heap.get(i));
        }
        return out.append('}').toString();
    }

    // --- Insertion ---

    /**
     * Inserts a new item. O(log_d n).
     *
     * @param item item whose identity is not yet queued.
     * @throws PriorityQueueException with {@code DUPLICATE_ITEM} if the identity is already queued.
     */
    public void insert(T item) {
        Objects.requireNonNull(item, "item");
        K key = keyExtractor.apply(item);
        if (positions.containsKey(key)) {
            throw duplicateItem(key);
        }

        observed(OperationType.INSERT, () -> {
            int index = heap.size();
            int target = traceSwim(index, item);
            heap.add(item);
            positions.put(key, index);
            commitSwim(index, target);
        });
    }

    /**
     * Inserts a batch of items using linear-time heap construction.
     * <p>
     * The batch is validated before anything is appended: on failure the queue is unchanged.
     * After appending, every internal node from the last one back to the root is sunk,
     * which is O(n) rather than O(n log_d n) for repeated {@link #insert(Object)}.
     * If the comparator throws during construction, the batch is rolled back.
     * </p>
     *
     * @param items items with distinct identities not yet queued.
     * @throws PriorityQueueException with {@code DUPLICATE_ITEM} on an identity already queued
     * or repeated within the batch.
     */
    public void insertMany(Collection<? extends T> items) {
        Objects.requireNonNull(items, "items");
        if (items.isEmpty()) {
            return;
        }

        ObjectArrayList<T> batch = new ObjectArrayList<>(items.size());
        ObjectArrayList<K> keys = new ObjectArrayList<>(items.size());
        ObjectOpenHashSet<K> seen = new ObjectOpenHashSet<>(items.size());
        for (T item : items) {
            Objects.requireNonNull(item, "items must not contain null");
            K key = keyExtractor.apply(item);
            if (positions.containsKey(key) || !seen.add(key)) {
                throw duplicateItem(key);
            }
            batch.add(item);
            keys.add(key);
        }

        observed(OperationType.INSERT, () -> {
            ObjectArrayList<T> previous = new ObjectArrayList<>(heap);
            int start = heap.size();
            for (int offset = 0; offset < batch.size(); offset++) {
                heap.add(batch.get(offset));
                positions.put(keys.get(offset), start + offset);
            }
            try {
                heapify();
            } catch (RuntimeException e) {
                restore(previous, keys);
                throw e;
            }
        });

        log.debug("Bulk-loaded {} items into {}-ary queue (size={})", batch.size(), arity, heap.size());
    }

    // --- Extraction ---

    /**
     * Removes and returns the highest-priority item. O(d log_d n).
     *
     * @return former root, or empty when the queue is empty.
     */
    public Optional<T> pop() {
        if (heap.isEmpty()) {
            return Optional.empty();
        }
        listener.beforeOperation(OperationType.POP);
        try {
            return Optional.of(removeRoot());
        } finally {
            listener.afterOperation(OperationType.POP);
        }
    }

    /**
     * Removes up to {@code count} items, returned in strict priority order.
     *
     * @param count maximum number of items to extract, non-negative.
     * @return extracted items, fewer than {@code count} if the queue ran empty.
     */
    public List<T> popMany(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, got " + count);
        }
        int actual = Math.min(count, heap.size());
        ObjectArrayList<T> result = new ObjectArrayList<>(actual);
        for (int i = 0; i < actual; i++) {
            pop().ifPresent(result::add);
        }
        return result;
    }

    private T removeRoot() {
        int last = heap.size() - 1;
        // the last item will be sunk from the root of the shrunken store
        traceSink(0, heap.get(last), last);
        swap(0, last);
        T removed = heap.remove(last);
        positions.removeInt(keyExtractor.apply(removed));
        commitSink(0);
        return removed;
    }

    // --- Priority updates by identity ---

    /**
     * Replaces a queued item whose priority became more important and moves it toward the root.
     * <p>
     * For a min-heap this means a smaller priority value. O(log_d n).
     * </p>
     *
     * @param updatedItem item with the same identity and its new priority.
     * @throws PriorityQueueException with {@code ITEM_NOT_FOUND} if the identity is not queued.
     */
    public void increasePriority(T updatedItem) {
        int index = locate(updatedItem);
        observed(OperationType.INCREASE_PRIORITY, () -> raise(index, updatedItem));
    }

    /**
     * Replaces a queued item whose priority became less important and moves it toward the leaves.
     * O(d log_d n).
     *
     * @param updatedItem item with the same identity and its new priority.
     * @throws PriorityQueueException with {@code ITEM_NOT_FOUND} if the identity is not queued.
     */
    public void decreasePriority(T updatedItem) {
        int index = locate(updatedItem);
        observed(OperationType.DECREASE_PRIORITY, () -> lower(index, updatedItem));
    }

    /**
     * Replaces a queued item when the direction of the priority change is unknown.
     * The walk toward the leaves is only tried when the item cannot move toward the root.
     *
     * @param updatedItem item with the same identity and its new priority.
     * @throws PriorityQueueException with {@code ITEM_NOT_FOUND} if the identity is not queued.
     */
    public void updatePriority(T updatedItem) {
        int index = locate(updatedItem);
        observed(OperationType.UPDATE_PRIORITY, () -> reposition(index, updatedItem));
    }

    private int locate(T updatedItem) {
        Objects.requireNonNull(updatedItem, "updatedItem");
        K key = keyExtractor.apply(updatedItem);
        int index = positions.getInt(key);
        if (index == NOT_FOUND) {
            throw new PriorityQueueException(
                    PriorityQueueException.REASON_ITEM_NOT_FOUND,
                    "no queued item with key " + key
            );
        }
        return index;
    }

    // --- Priority updates by position ---

    /**
     * Moves the item at {@code index} toward the root after its priority became more important.
     *
     * @throws PriorityQueueException with {@code INDEX_OUT_OF_BOUNDS} unless {@code 0 <= index < size()}.
     */
    public void increasePriorityByIndex(int index) {
        checkIndex(index);
        observed(OperationType.INCREASE_PRIORITY, () -> raise(index, heap.get(index)));
    }

    /**
     * Moves the item at {@code index} toward the leaves after its priority became less important.
     *
     * @throws PriorityQueueException with {@code INDEX_OUT_OF_BOUNDS} unless {@code 0 <= index < size()}.
     */
    public void decreasePriorityByIndex(int index) {
        checkIndex(index);
        observed(OperationType.DECREASE_PRIORITY, () -> lower(index, heap.get(index)));
    }

    /**
     * Restores heap order around {@code index} in whichever direction is needed.
     *
     * @throws PriorityQueueException with {@code INDEX_OUT_OF_BOUNDS} unless {@code 0 <= index < size()}.
     */
    public void updatePriorityByIndex(int index) {
        checkIndex(index);
        observed(OperationType.UPDATE_PRIORITY, () -> reposition(index, heap.get(index)));
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= heap.size()) {
            throw new PriorityQueueException(
                    PriorityQueueException.REASON_INDEX_OUT_OF_BOUNDS,
                    "index " + index + " out of bounds (size: " + heap.size() + ")"
            );
        }
    }

    // --- Reset ---

    /**
     * Removes every item, keeping the current arity.
     */
    public void clear() {
        heap.clear();
        positions.clear();
    }

    /**
     * Removes every item and switches to {@code newArity}.
     * The arity is validated first; on failure the queue is left untouched.
     *
     * @throws PriorityQueueException with {@code INVALID_ARITY} when {@code newArity < 1}.
     */
    public void clear(int newArity) {
        int validated = requireValidArity(newArity);
        clear();
        if (validated != arity) {
            log.debug("Priority queue arity changed from {} to {}", arity, validated);
        }
        this.arity = validated;
    }

    // --- Heap Helper Methods ---
    //
    // Every walk is split in two: trace* consults the comparator and only reads,
    // commit* swaps along the traced route without consulting it. A comparator that
    // throws therefore leaves the store and the index as they were.

    private void raise(int index, T item) {
        int target = traceSwim(index, item);
        store(index, item);
        commitSwim(index, target);
    }

    private void lower(int index, T item) {
        traceSink(index, item, heap.size());
        store(index, item);
        commitSink(index);
    }

    private void reposition(int index, T item) {
        int target = traceSwim(index, item);
        if (target != index) {
            store(index, item);
            commitSwim(index, target);
        } else {
            lower(index, item);
        }
    }

    /**
     * Writes {@code item} into slot {@code index}, re-inserting its index entry so the map
     * holds the new representation of the identity.
     */
    private void store(int index, T item) {
        K key = keyExtractor.apply(item);
        positions.removeInt(key);
        heap.set(index, item);
        positions.put(key, index);
    }

    /**
     * Floyd's construction: sinks every internal node from the last one back to the root.
     */
    private void heapify() {
        int size = heap.size();
        if (size <= 1) {
            return;
        }
        for (int i = (size - 2) / arity; i >= 0; i--) {
            traceSink(i, heap.get(i), size);
            commitSink(i);
        }
    }

    private void restore(ObjectArrayList<T> previous, ObjectArrayList<K> batchKeys) {
        for (K key : batchKeys) {
            positions.removeInt(key);
        }
        heap.clear();
        heap.addAll(previous);
        for (int i = 0; i < heap.size(); i++) {
            positions.put(keyExtractor.apply(heap.get(i)), i);
        }
    }

    /**
     * Returns the slot {@code item} would reach moving toward the root from {@code index},
     * climbing while it outranks the parent.
     */
    private int traceSwim(int index, T item) {
        int i = index;
        while (i > 0) {
            int parent = (i - 1) / arity;
            if (!comparator.higherPriority(item, heap.get(parent))) {
                break;
            }
            i = parent;
        }
        return i;
    }

    private void commitSwim(int index, int target) {
        int i = index;
        while (i != target) {
            int parent = (i - 1) / arity;
            swap(i, parent);
            i = parent;
        }
    }

    /**
     * Records in {@code route} the children {@code item} would be swapped with moving toward
     * the leaves from {@code index}, considering only the first {@code size} slots.
     * Ties between children resolve to the leftmost one.
     */
    private void traceSink(int index, T item, int size) {
        route.clear();
        int i = index;
        while (true) {
            // long arithmetic: d * i + 1 may exceed int range for large arities
            long firstChild = (long) arity * i + 1;
            if (firstChild >= size) {
                return;
            }
            int lastChild = (int) Math.min(firstChild + arity - 1, size - 1);

            int best = (int) firstChild;
            for (int child = best + 1; child <= lastChild; child++) {
                if (comparator.higherPriority(heap.get(child), heap.get(best))) {
                    best = child;
                }
            }
            if (!comparator.higherPriority(heap.get(best), item)) {
                return;
            }
            route.add(best);
            i = best;
        }
    }

    private void commitSink(int index) {
        int i = index;
        for (int step = 0; step < route.size(); step++) {
            int child = route.getInt(step);
            swap(i, child);
            i = child;
        }
    }

    /**
     * Swaps two heap entries and updates both index entries.
     */
    private void swap(int i, int j) {
        if (i == j) {
            return;
        }
        T first = heap.get(i);
        T second = heap.get(j);

        heap.set(i, second);
        heap.set(j, first);

        positions.put(keyExtractor.apply(second), i);
        positions.put(keyExtractor.apply(first), j);
    }

    private void observed(OperationType type, Runnable action) {
        listener.beforeOperation(type);
        try {
            action.run();
        } finally {
            listener.afterOperation(type);
        }
    }

    private static int requireValidArity(int arity) {
        if (arity < 1) {
            throw PriorityQueueException.invalidArity(arity);
        }
        return arity;
    }

    private static PriorityQueueException duplicateItem(Object key) {
        return new PriorityQueueException(
                PriorityQueueException.REASON_DUPLICATE_ITEM,
                "an item with key " + key + " is already queued"
        );
    }
}
