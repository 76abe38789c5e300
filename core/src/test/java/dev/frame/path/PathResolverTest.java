/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.path;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

import org.junit.jupiter.api.Test;

import dev.frame.path.PathResolutionException.Reason;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for dotted path resolution through nested values.
 */
public class PathResolverTest {

    record Address(String city, List<String> lines) {
    }

    record User(String name, Address address, Optional<String> nickname) {
    }

    static class Node {
        String label;
        Node next;

        Node(String label) {
            this.label = label;
        }
    }

    static class WithFunction {
        Function<String, String> transform = s -> s;
    }

    static class ByLength implements Comparator<String> {
        int weight = 2;

        @Override
        public int compare(String a, String b) {
            return Integer.compare(a.length(), b.length());
        }
    }

    record Schedule(LocalDate day, ByLength ordering, Object task) {
    }

    private static User user() {
        return new User("ann", new Address("Oslo", List.of("Main St 1", "Floor 2")), Optional.of("annie"));
    }

    // ==================== Objects ====================

    @Test
    void testNestedFields() {
        assertThat(PathResolver.getValueByPath(user(), "name")).isEqualTo("ann");
        assertThat(PathResolver.getValueByPath(user(), "address.city")).isEqualTo("Oslo");
        assertThat(PathResolver.getValueByPath(user(), "address.lines.1")).isEqualTo("Floor 2");
    }

    @Test
    void testOptionalIsUnwrapped() {
        assertThat(PathResolver.getValueByPath(user(), "nickname")).isEqualTo("annie");
        User noNickname = new User("bob", null, Optional.empty());
        assertThat(PathResolver.getValueByPath(noNickname, "nickname")).isNull();
        assertThat(PathResolver.getValueByPath(Optional.of(user()), "name")).isEqualTo("ann");
    }

    @Test
    void testEmptyOptionalInTheMiddle() {
        Map<String, Object> data = Map.of("inner", Optional.empty());
        assertThatThrownBy(() -> PathResolver.getValueByPath(data, "inner.x"))
                .isInstanceOf(PathResolutionException.class)
                .hasMessage("nil interface encountered at key: x")
                .extracting(e -> ((PathResolutionException) e).reason())
                .isEqualTo(Reason.NIL_INTERFACE);
    }

    @Test
    void testFieldNotFound() {
        assertThatThrownBy(() -> PathResolver.getValueByPath(user(), "address.zip"))
                .isInstanceOf(PathResolutionException.class)
                .hasMessage("field not found: zip");
    }

    @Test
    void testNilPointerNamesNextKey() {
        User noAddress = new User("bob", null, Optional.empty());
        assertThat(PathResolver.getValueByPath(noAddress, "address")).isNull();
        assertThatThrownBy(() -> PathResolver.getValueByPath(noAddress, "address.city"))
                .isInstanceOf(PathResolutionException.class)
                .hasMessage("nil pointer encountered at key: city");
    }

    @Test
    void testNullRoot() {
        assertThatThrownBy(() -> PathResolver.getValueByPath(null, "name"))
                .isInstanceOf(PathResolutionException.class)
                .hasMessage("invalid value encountered at key: name");
    }

    @Test
    void testEmptyPath() {
        assertThatThrownBy(() -> PathResolver.getValueByPath(user(), ""))
                .isInstanceOf(PathResolutionException.class)
                .extracting(e -> ((PathResolutionException) e).reason())
                .isEqualTo(Reason.EMPTY_PATH);
    }

    @Test
    void testCircularReference() {
        Node a = new Node("a");
        Node b = new Node("b");
        a.next = b;
        b.next = a;
        assertThat(PathResolver.getValueByPath(a, "next.label")).isEqualTo("b");
        assertThatThrownBy(() -> PathResolver.getValueByPath(a, "next.next.label"))
                .isInstanceOf(PathResolutionException.class)
                .hasMessage("circular reference detected at key: label");
    }

    @Test
    void testFunctionField() {
        assertThatThrownBy(() -> PathResolver.getValueByPath(new WithFunction(), "transform"))
                .isInstanceOf(PathResolutionException.class)
                .hasMessage("unsupported type: func at key: transform");
    }

    @Test
    void testValuesImplementingFunctionalInterfaces() {
        Schedule schedule = new Schedule(LocalDate.of(2024, 1, 2), new ByLength(), LocalDate.of(2024, 3, 4));
        assertThat(PathResolver.getValueByPath(schedule, "day")).isEqualTo(LocalDate.of(2024, 1, 2));
        assertThat(PathResolver.getValueByPath(schedule, "task")).isEqualTo(LocalDate.of(2024, 3, 4));
        assertThat(PathResolver.getValueByPath(schedule, "ordering.weight")).isEqualTo(2);
    }

    @Test
    void testFunctionInMapOrList() {
        Runnable task = () -> { };
        Map<String, Object> data = new HashMap<>();
        data.put("f", task);
        data.put("tasks", List.of(task));
        assertThatThrownBy(() -> PathResolver.getValueByPath(data, "f"))
                .isInstanceOf(PathResolutionException.class)
                .hasMessage("unsupported type: func at key: f");
        assertThatThrownBy(() -> PathResolver.getValueByPath(data, "tasks.0"))
                .isInstanceOf(PathResolutionException.class)
                .hasMessage("unsupported type: func at key: 0")
                .extracting(e -> ((PathResolutionException) e).reason())
                .isEqualTo(Reason.UNSUPPORTED_TYPE);
    }

    @Test
    void testScalarCannotBeEntered() {
        assertThatThrownBy(() -> PathResolver.getValueByPath(user(), "name.first"))
                .isInstanceOf(PathResolutionException.class)
                .hasMessage("unsupported type: string at key: first")
                .extracting(e -> ((PathResolutionException) e).segment())
                .isEqualTo("first");
    }

    // ==================== Maps ====================

    @Test
    void testMapKeys() {
        Map<String, Object> data = new HashMap<>();
        data.put("user", user());
        data.put("empty", null);
        assertThat(PathResolver.getValueByPath(data, "user.address.city")).isEqualTo("Oslo");
        assertThat(PathResolver.getValueByPath(data, "empty")).isNull();
        assertThatThrownBy(() -> PathResolver.getValueByPath(data, "other"))
                .isInstanceOf(PathResolutionException.class)
                .hasMessage("key not found in map: other");
    }

    @Test
    void testNonStringKeysMatchByText() {
        Map<Integer, String> byId = new TreeMap<>(Map.of(1, "one", 2, "two"));
        assertThat(PathResolver.getValueByPath(byId, "2")).isEqualTo("two");
    }

    // ==================== Sequences ====================

    @Test
    void testArraysAndCollections() {
        int[] numbers = { 10, 20, 30 };
        assertThat(PathResolver.getValueByPath(numbers, "2")).isEqualTo(30);
        LinkedHashSet<String> set = new LinkedHashSet<>(List.of("x", "y"));
        assertThat(PathResolver.getValueByPath(set, "1")).isEqualTo("y");
    }

    @Test
    void testBadIndexes() {
        List<String> list = new ArrayList<>(List.of("a"));
        assertThatThrownBy(() -> PathResolver.getValueByPath(list, "first"))
                .isInstanceOf(PathResolutionException.class)
                .hasMessage("invalid array index at key: first");
        assertThatThrownBy(() -> PathResolver.getValueByPath(list, "1"))
                .isInstanceOf(PathResolutionException.class)
                .hasMessage("array index out of bounds at key: 1");
        assertThatThrownBy(() -> PathResolver.getValueByPath(list, "-1"))
                .isInstanceOf(PathResolutionException.class)
                .hasMessage("array index out of bounds at key: -1");
    }
}
