package net.scoreworks.musicxml.collection;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

public class HashStackTest {

    @Test
    public void testPushAndPop() {
        HashStack<Integer, String> stack = new HashStack<>();
        Assertions.assertNull(stack.popValue(1));
        stack.pushValue(1, "a");
        stack.pushValue(1, "b");
        stack.pushValue(2, "c");
        Assertions.assertEquals(2, stack.getStackSize(1));
        Assertions.assertEquals("b", stack.popValue(1));
        Assertions.assertEquals("a", stack.popValue(1));
        Assertions.assertEquals(0, stack.getStackSize(1));
        Assertions.assertNull(stack.popValue(1));
        Assertions.assertFalse(stack.isEmpty());
        Assertions.assertEquals(0, stack.getStackSize(3));
    }

    @Test
    public void testAllValuesKeepKeyOrder() {
        HashStack<String, Integer> stack = new HashStack<>();
        stack.pushValue("dir", 1);
        stack.pushValue("dynam", 2);
        stack.pushValue("dir", 3);
        Assertions.assertEquals(Arrays.asList(1, 3, 2), stack.allValues());

        stack.clearStacks();
        Assertions.assertTrue(stack.isEmpty());
        Assertions.assertTrue(stack.containsKey("dir"));
        Assertions.assertTrue(stack.allValues().isEmpty());
    }
}
