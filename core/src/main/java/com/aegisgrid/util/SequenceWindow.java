/*
 * Copyright 2025 The AegisGRID Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.aegisgrid.util;

import static com.aegisgrid.CommonUtils.checkArgument;
import static com.aegisgrid.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A fixed-capacity sliding window over the most recent items. Appending to a
 * full window evicts the oldest item.
 *
 * @param <T> the item type
 */
public class SequenceWindow<T> {

    /**
     * Maximum number of items held by the window.
     */
    private final int capacity;

    /**
     * Backing storage, reused as a ring.
     */
    private final Object[] arena;

    /**
     * The index where the next item will be written. Once the window is full
     * this is also the index of the oldest item.
     */
    private int writeIndex;

    private int size;

    public SequenceWindow(int capacity) {
        checkArgument(capacity > 0, "capacity must be greater than 0");
        this.capacity = capacity;
        this.arena = new Object[capacity];
        writeIndex = 0;
        size = 0;
    }

    public void append(T item) {
        checkNotNull(item, "item must not be null");
        arena[writeIndex] = item;
        writeIndex = (writeIndex + 1) % capacity;
        if (size < capacity) {
            size++;
        }
    }

    /**
     * @return a snapshot of the window, oldest item first
     */
    @SuppressWarnings("unchecked")
    public List<T> toList() {
        List<T> result = new ArrayList<>(size);
        int begin = (writeIndex - size + capacity) % capacity;
        for (int i = 0; i < size; i++) {
            result.add((T) arena[(begin + i) % capacity]);
        }
        return Collections.unmodifiableList(result);
    }

    public boolean isFull() {
        return size == capacity;
    }

    public int size() {
        return size;
    }

    public int getCapacity() {
        return capacity;
    }

    public void clear() {
        for (int i = 0; i < capacity; i++) {
            arena[i] = null;
        }
        writeIndex = 0;
        size = 0;
    }
}
