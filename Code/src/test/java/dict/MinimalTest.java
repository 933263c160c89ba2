package dict;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Minimal test - just insert/read/remove/access on the small example tree
 */
class MinimalTest {

    @Test
    void justInsertReadRemove() throws KeyNotFoundException {
        System.out.println("Creating OrderedMap...");
        OrderedMap<Integer, String> map = new OrderedMap<>(() -> "");
        System.out.println("OrderedMap created");

        System.out.println("Inserting 5 3 8 1 4 7 9...");
        String[] names = {"five", "three", "eight", "one", "four", "seven", "nine"};
        int[] keys = {5, 3, 8, 1, 4, 7, 9};
        for (int i = 0; i < keys.length; i++) {
            assertNull(map.insert(keys[i], names[i]));
        }
        System.out.println("Insert done: " + map);

        System.out.println("Reading 4...");
        String val = map.read(4);
        System.out.println("Read returned: " + val);
        assertEquals("four", val);

        System.out.println("Removing 5...");
        assertTrue(map.remove(5));
        System.out.println("After remove: " + map);
        assertEquals("{1=one, 3=three, 4=four, 7=seven, 8=eight, 9=nine}", map.toString());

        System.out.println("Reading 6...");
        assertThrows(KeyNotFoundException.class, () -> map.read(6));
        System.out.println("Read failed as expected");

        System.out.println("Accessing 6...");
        map.access(6).setValue("six");
        System.out.println("Access done, contains(6) = " + map.contains(6));
        assertTrue(map.contains(6));
        assertEquals("six", map.read(6));

        System.out.println("=== Test completed successfully! ===");
    }
}
