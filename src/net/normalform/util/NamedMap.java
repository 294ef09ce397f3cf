package net.normalform.util;

import java.util.AbstractMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import net.normalform.api.NamedValue;

/**
 * A Map from names to values carrying the very same names.
 * Iteration follows insertion order unless a differently-ordered backing
 * map is supplied.
 */
public class NamedMap<V extends NamedValue> extends AbstractMap<String, V> {

    private final Map<String, V> data;

    public NamedMap(Map<String, V> data) {
        if (data == null)
            throw new NullPointerException(
                "NamedMap backing data may not be null");
        this.data = data;
        validateBackingMap(data);
    }
    public NamedMap() {
        this(new LinkedHashMap<String, V>());
    }

    protected void validateBackingMap(Map<String, V> map) {
        for (Map.Entry<String, V> ent : map.entrySet()) {
            // Intentionally permitting NPE-s.
            if (! ent.getKey().equals(ent.getValue().getName()))
                throw new IllegalArgumentException(
                    "Invalid pair in NamedMap backing data");
        }
    }

    public Set<Entry<String, V>> entrySet() {
        // entrySet()'s return value is supposed not to support addition, so
        // this should be fine.
        return data.entrySet();
    }

    public Set<String> keySet() {
        return data.keySet();
    }

    public boolean containsKey(Object key) {
        return data.containsKey(key);
    }

    public V get(Object key) {
        return data.get(key);
    }

    public V put(String key, V value) {
        // Intentionally permitting NPE-s.
        if (! key.equals(value.getName()))
            throw new IllegalArgumentException("Cannot insert pair " + key +
                ":" + value + " into NamedMap");
        return data.put(key, value);
    }

    /**
     * Insert value under its own name.
     */
    public V add(V value) {
        return put(value.getName(), value);
    }

    public V remove(Object key) {
        return data.remove(key);
    }

    public void clear() {
        data.clear();
    }

}
