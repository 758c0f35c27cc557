package com.zzf.codesync.core.merkle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * File-level difference between two trees. Directories never appear; a rename shows up as
 * a removal of the old path plus an addition of the new one.
 */
public final class ChangeSet {
    private static final ChangeSet EMPTY = new ChangeSet(null, null, null);

    private final SortedSet<String> added;
    private final SortedSet<String> modified;
    private final SortedSet<String> removed;

    @JsonCreator
    public ChangeSet(
            @JsonProperty("added") Collection<String> added,
            @JsonProperty("modified") Collection<String> modified,
            @JsonProperty("removed") Collection<String> removed
    ) {
        this.added = freeze(added);
        this.modified = freeze(modified);
        this.removed = freeze(removed);
    }

    public static ChangeSet empty() {
        return EMPTY;
    }

    public SortedSet<String> getAdded() {
        return added;
    }

    public SortedSet<String> getModified() {
        return modified;
    }

    public SortedSet<String> getRemoved() {
        return removed;
    }

    /**
     * Paths whose content has to be transferred: added plus modified.
     */
    @JsonIgnore
    public SortedSet<String> changedPaths() {
        SortedSet<String> out = new TreeSet<String>(added);
        out.addAll(modified);
        return Collections.unmodifiableSortedSet(out);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return added.isEmpty() && modified.isEmpty() && removed.isEmpty();
    }

    public int size() {
        return added.size() + modified.size() + removed.size();
    }

    private static SortedSet<String> freeze(Collection<String> in) {
        if (in == null || in.isEmpty()) {
            return Collections.unmodifiableSortedSet(new TreeSet<String>());
        }
        return Collections.unmodifiableSortedSet(new TreeSet<String>(in));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChangeSet)) {
            return false;
        }
        ChangeSet that = (ChangeSet) o;
        return added.equals(that.added) && modified.equals(that.modified) && removed.equals(that.removed);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * added.hashCode() + modified.hashCode()) + removed.hashCode();
    }

    @Override
    public String toString() {
        return "ChangeSet{added=" + added + ", modified=" + modified + ", removed=" + removed + "}";
    }
}
