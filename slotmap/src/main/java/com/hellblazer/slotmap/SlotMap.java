/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.slotmap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A generational slot map. Items are stored densely in a single array while callers hold {@link SlotHandle}s, which
 * stay valid across the addition and removal of other items. Each handle names a key in a key table and the
 * generation that key had when the handle was issued; removing an item advances its key's generation, so every
 * outstanding handle to it stops resolving.
 * <p>
 * Removal moves the last item into the hole, so item positions (and iteration order) change on removal while handles
 * do not. The key table only grows; the item store grows and shrinks in chunks of the configured allocation size.
 * <p>
 * Handle based operations are the checked path: a stale handle yields {@code false} or {@code null}, never an
 * exception. Position based operations ({@link #getAt(int)}, {@link #removeAt(int)}, {@link #getHandle(int)}) are
 * the fast path for callers iterating the store and fail with {@link IndexOutOfBoundsException} when misused.
 * <p>
 * Not thread safe. Iterators are fail-fast.
 *
 * @param <T> the item type
 * @author hal.hildebrand
 */
public class SlotMap<T> implements Iterable<T>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SlotMap.class);

    private final HandleLayout             layout;
    private final GrowthPolicy             growth;
    private final GenerationOverflowPolicy overflowPolicy;
    private final Consumer<? super T>      disposer;
    private final KeyTable                 keys;
    private final ItemStore<T>             store = new ItemStore<>();

    private int     modCount;
    private boolean closed;

    // Statistics
    private long keyGrowths;
    private long itemGrowths;
    private long itemShrinks;

    public SlotMap() {
        this(SlotMapConfig.defaults());
    }

    public SlotMap(SlotMapConfig config) {
        this(config, item -> {
        });
    }

    /**
     * @param config   allocation and handle layout settings, copied at construction
     * @param disposer invoked with every item the map releases through remove, clear or close
     */
    public SlotMap(SlotMapConfig config, Consumer<? super T> disposer) {
        Objects.requireNonNull(config, "Config cannot be null").validate();
        this.layout = config.layout();
        this.growth = new GrowthPolicy(config, layout);
        this.overflowPolicy = config.getOverflowPolicy();
        this.disposer = Objects.requireNonNull(disposer, "Disposer cannot be null");
        this.keys = new KeyTable(layout);
    }

    /**
     * Store an item
     *
     * @return the handle of the stored item
     * @throws SlotMapException.IndexSpaceExhaustedException if every key the index bits can address is in use
     */
    public SlotHandle add(T item) {
        Objects.requireNonNull(item, "Item cannot be null");
        return emplace(handle -> item);
    }

    /**
     * Number of allocated item slots
     */
    public int capacity() {
        return store.capacity();
    }

    /**
     * Remove every item, advancing the generation of every live key. Keys stay allocated.
     *
     * @throws SlotMapException.GenerationExhaustedException under {@link GenerationOverflowPolicy#FAIL} when any live
     *                                                       key cannot advance its generation, before anything is
     *                                                       removed
     */
    public void clear() {
        for (int i = 0; i < store.size(); i++) {
            checkGeneration(store.keyOf(i));
        }
        int cleared = store.size();
        while (store.size() > 0) {
            disposer.accept(removeKey(store.keyOf(store.size() - 1)));
        }
        if (cleared > 0) {
            log.debug("Cleared {} items", cleared);
        }
    }

    /**
     * Release every live item to the disposer and drop both backing arrays. A closed map holds no keys, so every
     * handle it ever issued is invalid, and it refuses new items.
     * <p>
     * Every item reaches the disposer even if it throws; the first failure is rethrown once the map is closed, with
     * any later ones attached as suppressed exceptions.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        int released = store.size();
        RuntimeException failure = null;
        for (int i = released - 1; i >= 0; i--) {
            try {
                disposer.accept(store.get(i));
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        store.reset();
        keys.reset();
        modCount++;
        log.debug("Closed, released {} items", released);
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Store the item produced by {@code factory}. The factory receives the handle the item will be stored under, so
     * items may keep their own handle. If the factory throws, no item is stored and no handle becomes valid; storage
     * reserved for the item stays allocated.
     *
     * @return the handle of the stored item
     * @throws SlotMapException.IndexSpaceExhaustedException if every key the index bits can address is in use
     * @throws ConcurrentModificationException                if the factory modifies this map
     */
    public SlotHandle emplace(Function<? super SlotHandle, ? extends T> factory) {
        Objects.requireNonNull(factory, "Factory cannot be null");
        checkOpen();
        reserveSlot();

        int key = keys.peekFree();
        var handle = new SlotHandle(key, keys.id(key));

        int expectedModCount = modCount;
        T item = Objects.requireNonNull(factory.apply(handle), "Factory produced a null item");
        if (modCount != expectedModCount) {
            throw new ConcurrentModificationException("SlotMap modified by item factory");
        }

        keys.acquire(store.append(item, key));
        modCount++;
        return handle;
    }

    /**
     * Visit every item with its handle, in store order
     */
    public void forEachEntry(BiConsumer<? super SlotHandle, ? super T> action) {
        Objects.requireNonNull(action, "Action cannot be null");
        int expectedModCount = modCount;
        for (int i = 0; i < store.size(); i++) {
            action.accept(handleOf(store.keyOf(i)), store.get(i));
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
        }
    }

    /**
     * @return the item the handle refers to, or null if the handle is stale, null or foreign
     */
    public T get(SlotHandle handle) {
        int key = resolve(handle);
        return key < 0 ? null : store.get(keys.index(key));
    }

    /**
     * Unchecked access by store position
     */
    public T getAt(int index) {
        Objects.checkIndex(index, store.size());
        return store.get(index);
    }

    /**
     * The handle of the item at a store position
     */
    public SlotHandle getHandle(int index) {
        Objects.checkIndex(index, store.size());
        return handleOf(store.keyOf(index));
    }

    /**
     * The handle of an item, located by identity
     *
     * @return the item's handle, or {@link SlotHandle#NULL} if the item is not stored here
     */
    public SlotHandle getHandle(T item) {
        int index = indexOf(item);
        return index < 0 ? SlotHandle.NULL : getHandle(index);
    }

    /**
     * Store position of an item, located by identity in a linear scan
     *
     * @return the position, or -1
     */
    public int indexOf(T item) {
        return item == null ? -1 : store.indexOf(item);
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isEmpty() {
        return store.size() == 0;
    }

    /**
     * A handle is valid while the item it was issued for has not been removed
     */
    public boolean isValid(SlotHandle handle) {
        return resolve(handle) >= 0;
    }

    /**
     * Items in store order. The iterator supports {@link Iterator#remove()}; the item moved into the removed
     * position is visited next, so every item is still seen exactly once.
     */
    @Override
    public Iterator<T> iterator() {
        return new Itr();
    }

    /**
     * Number of allocated keys, free and retired keys included
     */
    public int keyCount() {
        return keys.size();
    }

    public HandleLayout layout() {
        return layout;
    }

    /**
     * Remove the item a handle refers to and hand it to the disposer
     *
     * @return false if the handle was stale, null or foreign
     * @throws SlotMapException.GenerationExhaustedException under {@link GenerationOverflowPolicy#FAIL} when the key
     *                                                       cannot advance its generation
     */
    public boolean remove(SlotHandle handle) {
        int key = resolve(handle);
        if (key < 0) {
            return false;
        }
        disposer.accept(removeKey(key));
        return true;
    }

    /**
     * Unchecked removal by store position
     */
    public void removeAt(int index) {
        Objects.checkIndex(index, store.size());
        disposer.accept(removeKey(store.keyOf(index)));
    }

    /**
     * Remove an item located by identity
     *
     * @return false if the item is not stored here
     */
    public boolean removeItem(T item) {
        int index = indexOf(item);
        if (index < 0) {
            return false;
        }
        removeAt(index);
        return true;
    }

    /**
     * Replace the item a handle refers to. The handle stays valid; the previous item is returned, not disposed.
     *
     * @return the previous item, or null if the handle was stale (in which case nothing is stored)
     */
    public T replace(SlotHandle handle, T item) {
        Objects.requireNonNull(item, "Item cannot be null");
        int key = resolve(handle);
        return key < 0 ? null : store.set(keys.index(key), item);
    }

    /**
     * Unchecked replacement by store position
     *
     * @return the previous item, which is not disposed
     */
    public T setAt(int index, T item) {
        Objects.requireNonNull(item, "Item cannot be null");
        Objects.checkIndex(index, store.size());
        return store.set(index, item);
    }

    public int size() {
        return store.size();
    }

    @Override
    public Spliterator<T> spliterator() {
        return Spliterators.spliterator(iterator(), store.size(), Spliterator.SIZED | Spliterator.NONNULL);
    }

    public SlotMapStats stats() {
        return new SlotMapStats(store.size(), store.capacity(), keys.size(), keys.freeCount(), keys.retiredCount(),
                                keyGrowths, itemGrowths, itemShrinks);
    }

    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Remove the item a handle refers to and give it to the caller instead of the disposer
     *
     * @return the removed item, or null if the handle was stale, null or foreign
     */
    public T take(SlotHandle handle) {
        int key = resolve(handle);
        return key < 0 ? null : removeKey(key);
    }

    @Override
    public String toString() {
        return "SlotMap[size=" + store.size() + ", capacity=" + store.capacity() + ", keys=" + keys.size() + "]";
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("SlotMap is closed");
        }
    }

    /**
     * @throws SlotMapException.GenerationExhaustedException if the key is at the max generation under
     *                                                       {@link GenerationOverflowPolicy#FAIL}
     */
    private void checkGeneration(int key) {
        if (overflowPolicy == GenerationOverflowPolicy.FAIL && keys.id(key) >= layout.getIdMax()) {
            throw new SlotMapException.GenerationExhaustedException(handleOf(key), layout.getIdBits());
        }
    }

    private SlotHandle handleOf(int key) {
        return new SlotHandle(key, keys.id(key));
    }

    /**
     * Remove the item owned by a live key: advance the key's generation, move the last item into the hole, repoint
     * the moved item's key and return this key to the free list.
     */
    private T removeKey(int key) {
        checkGeneration(key);
        long idMax = layout.getIdMax();
        long next = Math.min(keys.id(key) + 1, idMax);
        keys.setId(key, next);

        int position = keys.index(key);
        T removed = store.removeAndCompact(position);
        if (position != store.size()) {
            // the former last item now lives at position
            keys.setIndex(store.keyOf(position), position);
        }

        if (overflowPolicy == GenerationOverflowPolicy.RETIRE && next == idMax) {
            keys.retire(key);
            log.warn("Retired key {} at max generation {}, {} keys retired", key, next, keys.retiredCount());
        } else {
            keys.release(key);
        }
        modCount++;

        if (growth.shouldShrinkItems(store.capacity(), store.size())) {
            int capacity = growth.shrunkItemCapacity(store.size());
            log.debug("Shrinking item store from {} to {} slots, {} live", store.capacity(), capacity, store.size());
            store.resize(capacity);
            itemShrinks++;
        }
        return removed;
    }

    /**
     * Ensure a free key and a free item slot exist for the next add
     */
    private void reserveSlot() {
        if (growth.needsMoreKeys(keys.freeCount())) {
            int current = keys.size();
            int target = growth.nextKeyCount(current, store.size() + keys.retiredCount());
            if (target > current) {
                log.debug("Growing key table from {} to {} keys", current, target);
                keys.grow(target);
                keyGrowths++;
                if (target == growth.getMaxKeys()) {
                    log.warn("Key table reached the {} keys addressable with {} index bits", target,
                             layout.getIndexBits());
                }
            } else if (keys.freeCount() == 0) {
                throw new SlotMapException.IndexSpaceExhaustedException(current, layout.getIndexBits());
            }
        }

        if (store.size() == store.capacity()) {
            int capacity = growth.grownItemCapacity(store.capacity());
            log.debug("Growing item store from {} to {} slots", store.capacity(), capacity);
            store.resize(capacity);
            itemGrowths++;
        }
    }

    /**
     * @return the key offset a handle refers to, or -1 if it does not resolve to a live item
     */
    private int resolve(SlotHandle handle) {
        if (handle == null || handle.isNull()) {
            return -1;
        }
        long index = handle.index();
        if (index < 0 || index >= keys.size()) {
            return -1;
        }
        int key = (int) index;
        if (keys.id(key) != handle.generation()) {
            return -1;
        }
        // a free key may carry a matching generation only for a fabricated handle
        int position = keys.index(key);
        if (position >= store.size() || store.keyOf(position) != key) {
            return -1;
        }
        return key;
    }

    private class Itr implements Iterator<T> {
        private int cursor;
        private int lastReturned     = -1;
        private int expectedModCount = modCount;

        @Override
        public boolean hasNext() {
            return cursor < store.size();
        }

        @Override
        public T next() {
            checkForComodification();
            if (cursor >= store.size()) {
                throw new NoSuchElementException();
            }
            lastReturned = cursor++;
            return store.get(lastReturned);
        }

        @Override
        public void remove() {
            if (lastReturned < 0) {
                throw new IllegalStateException();
            }
            checkForComodification();
            T removed = removeKey(store.keyOf(lastReturned));
            // the last item was moved into lastReturned, visit it next
            cursor = lastReturned;
            lastReturned = -1;
            expectedModCount = modCount;
            disposer.accept(removed);
        }

        private void checkForComodification() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException("SlotMap modified during iteration");
            }
        }
    }
}
