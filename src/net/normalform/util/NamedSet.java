package net.normalform.util;

import java.util.AbstractSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import net.normalform.api.NamedValue;

/**
 * A Set whose elements all carry the same name as the set itself.
 * Used to hold all alternatives of one left-hand side.
 */
public class NamedSet<E extends NamedValue> extends AbstractSet<E>
        implements NamedValue {

    private final String name;
    private final Set<E> data;

    public NamedSet(String name, Set<E> data) {
        if (name == null)
            throw new NullPointerException("NamedSet name may not be null");
        if (data == null)
            throw new NullPointerException(
                "NamedSet backing data may not be null");
        this.name = name;
        this.data = data;
        validateBackingSet(data);
    }
    public NamedSet(String name) {
        this(name, new LinkedHashSet<E>());
    }

    protected void validateBackingSet(Set<E> set) {
        for (E item : set) {
            // Intentionally permitting NPE-s.
            if (! item.getName().equals(getName()))
                throw new IllegalArgumentException(
                    "NamedSet backing data contain invalid elements");
        }
    }

    public String getName() {
        return name;
    }

    public int size() {
        return data.size();
    }

    public Iterator<E> iterator() {
        // Iterator does not implement addition so exposing this is fine.
        return data.iterator();
    }

    public boolean contains(Object elem) {
        return data.contains(elem);
    }

    public boolean add(E elem) {
        if (! getName().equals(elem.getName()))
            throw new IllegalArgumentException("Cannot add " + elem +
                " to NamedSet " + getName());
        return data.add(elem);
    }

    public boolean remove(Object obj) {
        return data.remove(obj);
    }

    public void clear() {
        data.clear();
    }

}
