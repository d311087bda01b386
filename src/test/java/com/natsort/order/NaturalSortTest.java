package com.natsort.order;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NaturalSortTest {

    @Test
    @DisplayName("文件名按数值排序")
    void testSortFileNames() {
        List<String> files = new ArrayList<>(List.of("file1.txt", "file11.txt", "file2.txt"));

        NaturalSort.sort(files);

        assertEquals(List.of("file1.txt", "file2.txt", "file11.txt"), files);
    }

    @Test
    @DisplayName("数组原地排序")
    void testSortArray() {
        String[] values = {"10", "9", "100", "1"};

        NaturalSort.sort(values);

        assertArrayEquals(new String[] {"1", "9", "10", "100"}, values);
    }

    @Test
    @DisplayName("sorted返回新列表且不修改输入")
    void testSortedCopy() {
        List<String> input = List.of("b", "a10", "a2", "a");

        List<String> result = NaturalSort.sorted(input);

        assertEquals(List.of("a", "a2", "a10", "b"), result);
        assertEquals(List.of("b", "a10", "a2", "a"), input);
    }

    @Test
    @DisplayName("降序排序")
    void testReverse() {
        List<String> versions = new ArrayList<>(List.of("v2", "v10", "v1"));

        NaturalSort.sort(versions, true);

        assertEquals(List.of("v10", "v2", "v1"), versions);
    }

    @Test
    @DisplayName("超长数字排序")
    void testSortLongNumbers() {
        List<String> ids = new ArrayList<>(List.of(
            "id123456789012345678901234567890",
            "id99999999999999999999",
            "id5"
        ));

        NaturalSort.sort(ids);

        assertEquals(List.of("id5", "id99999999999999999999", "id123456789012345678901234567890"), ids);
    }

    @Test
    @DisplayName("前导零不影响顺序")
    void testLeadingZerosEqualKeys() {
        List<String> values = NaturalSort.sorted(List.of("07", "8", "7", "6"));

        assertEquals("6", values.get(0));
        assertEquals(Set.of("07", "7"), Set.copyOf(values.subList(1, 3)));
        assertEquals("8", values.get(3));
    }

    @Test
    @DisplayName("空列表与空字符串")
    void testDegenerateInputs() {
        assertEquals(List.of(), NaturalSort.sorted(List.of()));
        assertEquals(List.of("", "a", "ab"), NaturalSort.sorted(List.of("ab", "", "a")));
    }

    @Test
    @DisplayName("无法比较的输入抛出异常并携带字符串对")
    void testUnorderableInputFails() {
        List<String> values = new ArrayList<>(List.of("1", "a"));

        UnorderablePairException exception = assertThrows(UnorderablePairException.class,
            () -> NaturalSort.sort(values));

        assertEquals(Set.of("1", "a"), Set.of(exception.getLeft(), exception.getRight()));
        assertEquals(List.of("1", "a"), values);
    }

    @Test
    @DisplayName("排序失败时数组保持原样")
    void testUnorderableArrayUntouched() {
        String[] values = {"z", "b2", "10", "a"};

        assertThrows(UnorderablePairException.class, () -> NaturalSort.sort(values));

        assertEquals(Arrays.asList("z", "b2", "10", "a"), Arrays.asList(values));
    }

    @Test
    @DisplayName("降序排序同样拒绝无法比较的输入")
    void testUnorderableInputFailsInReverse() {
        List<String> values = new ArrayList<>(List.of("a", "1"));

        assertThrows(UnorderablePairException.class, () -> NaturalSort.sort(values, true));
        assertEquals(List.of("a", "1"), values);
    }

    @Test
    @DisplayName("null元素被拒绝")
    void testNullElementRejected() {
        List<String> values = new ArrayList<>(Arrays.asList("a", null));

        assertThrows(NullPointerException.class, () -> NaturalSort.sort(values));
    }
}
