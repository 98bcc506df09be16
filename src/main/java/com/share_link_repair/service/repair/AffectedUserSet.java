package com.share_link_repair.service.repair;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Users to notify during one repair run. Owned by the run, never persisted.
 */
public class AffectedUserSet implements Iterable<String> {

    private final Set<String> users = new LinkedHashSet<>();

    /**
     * @return false when the user was already present
     */
    public boolean add(String uid) {
        return users.add(uid);
    }

    public int size() {
        return users.size();
    }

    public boolean isEmpty() {
        return users.isEmpty();
    }

    public Set<String> asSet() {
        return Collections.unmodifiableSet(users);
    }

    @Override
    public Iterator<String> iterator() {
        return asSet().iterator();
    }
}
