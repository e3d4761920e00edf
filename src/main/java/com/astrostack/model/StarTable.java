package com.astrostack.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

public final class StarTable implements Iterable<StarRecord> {

    public static final StarTable EMPTY = new StarTable(Collections.emptyList());

    private final List<StarRecord> stars;

    public StarTable(List<StarRecord> stars) {
        Set<Integer> ids = new HashSet<>();
        for (StarRecord s : stars) {
            if (!ids.add(s.id())) throw new IllegalArgumentException("Duplicate star id " + s.id());
        }
        this.stars = Collections.unmodifiableList(new ArrayList<>(stars));
    }

    public int size() { return stars.size(); }
    public boolean isEmpty() { return stars.isEmpty(); }
    public StarRecord get(int index) { return stars.get(index); }
    public List<StarRecord> asList() { return stars; }
    public Stream<StarRecord> stream() { return stars.stream(); }

    @Override
    public Iterator<StarRecord> iterator() { return stars.iterator(); }

    /** Brightest first; equal fluxes keep their current relative order. */
    public StarTable sortedByFluxDescending() {
        List<StarRecord> sorted = new ArrayList<>(stars);
        sorted.sort(Comparator.comparingDouble(StarRecord::flux).reversed());
        return new StarTable(sorted);
    }

    @Override
    public String toString() {
        return "StarTable[" + stars.size() + " stars]";
    }
}
