package net.normalform.util;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.normalform.api.NamedValue;
import org.junit.jupiter.api.Test;

public class NamedMapTest {

    private static class Item implements NamedValue {

        private final String name;

        Item(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

    }

    @Test
    public void testNamedSetRejectsForeignNames() {
        NamedSet<Item> s = new NamedSet<Item>("A");
        assertTrue(s.add(new Item("A")));
        assertThrows(IllegalArgumentException.class,
                     () -> s.add(new Item("B")));
        assertEquals(1, s.size());
    }

    @Test
    public void testNamedMapKeepsInsertionOrder() {
        NamedMap<NamedSet<Item>> m = new NamedMap<NamedSet<Item>>();
        for (String n : Arrays.asList("S", "A", "X1", "B"))
            m.add(new NamedSet<Item>(n));
        assertEquals(Arrays.asList("S", "A", "X1", "B"),
                     new ArrayList<String>(m.keySet()));
        List<String> names = new ArrayList<String>();
        for (NamedSet<Item> s : m.values()) names.add(s.getName());
        assertEquals(Arrays.asList("S", "A", "X1", "B"), names);
        assertThrows(IllegalArgumentException.class,
                     () -> m.put("Q", new NamedSet<Item>("R")));
    }

    @Test
    public void testBackingDataIsValidated() {
        Map<String, NamedSet<Item>> bad =
            new HashMap<String, NamedSet<Item>>();
        bad.put("A", new NamedSet<Item>("B"));
        assertThrows(IllegalArgumentException.class,
                     () -> new NamedMap<NamedSet<Item>>(bad));
    }

}
