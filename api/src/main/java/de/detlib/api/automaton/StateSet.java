/* Copyright (C) 2024 DetLib contributors
 * This file is part of DetLib.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.detlib.api.automaton;

import java.util.Arrays;
import java.util.Iterator;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSortedSet;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A canonical, order-independent set of state labels.
 * <p>
 * State sets are the state identities used during the subset construction. Two state sets are equal iff they have
 * the same members, no matter in which order the members were added. The members are kept sorted, so the
 * {@link #toLabel() label} of a state set (its members joined by {@value #SEPARATOR}) is identical for identical
 * membership as well.
 */
public final class StateSet implements Iterable<String> {

    public static final String SEPARATOR = ",";

    private static final Joiner JOINER = Joiner.on(SEPARATOR);
    private static final StateSet EMPTY = new StateSet(ImmutableSortedSet.of());

    private final ImmutableSortedSet<String> members;
    private final String label;

    private StateSet(ImmutableSortedSet<String> members) {
        this.members = members;
        this.label = JOINER.join(members);
    }

    public static StateSet empty() {
        return EMPTY;
    }

    public static StateSet of(String... states) {
        return of(Arrays.asList(states));
    }

    public static StateSet of(Iterable<String> states) {
        ImmutableSortedSet<String> members = ImmutableSortedSet.copyOf(states);
        return members.isEmpty() ? EMPTY : new StateSet(members);
    }

    public boolean contains(String state) {
        return members.contains(state);
    }

    /**
     * Checks whether this state set shares at least one member with the given states.
     *
     * @param states
     *         the states to look for
     *
     * @return {@code true} if some member of this set is contained in {@code states}
     */
    public boolean containsAny(Set<String> states) {
        for (String member : members) {
            if (states.contains(member)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public ImmutableSortedSet<String> getMembers() {
        return members;
    }

    /**
     * Returns the canonical label of this state set: its members in natural order, joined by {@value #SEPARATOR}. A
     * singleton set is labeled with its only member.
     *
     * @return the canonical label
     */
    public String toLabel() {
        return label;
    }

    @Override
    public Iterator<String> iterator() {
        return members.iterator();
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StateSet)) {
            return false;
        }
        return members.equals(((StateSet) o).members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        return "{" + label + "}";
    }
}
