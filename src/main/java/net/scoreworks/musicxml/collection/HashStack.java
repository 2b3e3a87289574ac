/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.collection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * A map of stacks. Keys keep the order in which they were first used, values keep insertion order within their stack.
 * @param <K> key the stacks are grouped by
 * @param <V> stack entries
 */
public class HashStack<K, V> extends LinkedHashMap<K, List<V>> {

    public void pushValue(K key, V value) {
        computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    }

    public V popValue(K key) {
        List<V> stack = get(key);
        if (stack == null || stack.isEmpty())
            return null;
        return stack.remove(stack.size()-1);
    }

    public int getStackSize(K key) {
        List<V> stack = get(key);
        if (stack == null)
            return 0;
        return stack.size();
    }

    /**
     * @return all entries of all stacks, grouped by key
     */
    public List<V> allValues() {
        List<V> result = new ArrayList<>();
        for (List<V> stack : values()) {
            result.addAll(stack);
        }
        return result;
    }

    /**
     * Empty all stacks but keep the key order
     */
    public void clearStacks() {
        for (List<V> stack : values()) {
            stack.clear();
        }
    }

    @Override
    public boolean isEmpty() {
        for (List<V> stack : values()) {
            if (!stack.isEmpty())
                return false;
        }
        return true;
    }
}
