package org.pragmatica.bnf.lexer;

import org.pragmatica.bnf.pattern.CodepointMatcher;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Optional;

/**
 * Immutable Thompson automaton over code points. Every state carries at most one code point transition plus any
 * number of epsilon edges; accepting states carry a slot number, lower slots win ties.
 */
final class Nfa {
    static final int NO_SLOT = -1;

    private final CodepointMatcher[] edges;
    private final int[] next;
    private final int[][] epsilons;
    private final int[] accepts;
    private final int start;

    /**
     * Longest non-empty match ending at {@code end}, accepted by {@code slot}.
     */
    record Match(int slot, int end) {}

    Nfa(CodepointMatcher[] edges, int[] next, int[][] epsilons, int[] accepts, int start) {
        this.edges = edges;
        this.next = next;
        this.epsilons = epsilons;
        this.accepts = accepts;
        this.start = start;
    }

    int size() {
        return edges.length;
    }

    /**
     * Run the automaton from {@code from} and report the furthest accepting position with the lowest slot accepting
     * there. Empty matches are never reported.
     */
    Optional<Match> longestMatch(CharSequence input, int from) {
        var current = new BitSet(edges.length);
        closure(start, current);

        Match best = null;
        int pos = from;
        while (pos < input.length() && !current.isEmpty()) {
            int cp = Character.codePointAt(input, pos);
            var following = new BitSet(edges.length);
            for (int state = current.nextSetBit(0); state >= 0; state = current.nextSetBit(state + 1)) {
                var edge = edges[state];
                if (edge != null && edge.matches(cp)) {
                    closure(next[state], following);
                }
            }
            pos += Character.charCount(cp);
            current = following;

            int slot = acceptingSlot(current);
            if (slot != NO_SLOT) {
                best = new Match(slot, pos);
            }
        }
        return Optional.ofNullable(best);
    }

    private void closure(int state, BitSet states) {
        if (states.get(state)) {
            return;
        }
        var stack = new ArrayDeque<Integer>();
        states.set(state);
        stack.push(state);
        while (!stack.isEmpty()) {
            for (int target : epsilons[stack.pop()]) {
                if (!states.get(target)) {
                    states.set(target);
                    stack.push(target);
                }
            }
        }
    }

    private int acceptingSlot(BitSet states) {
        int slot = NO_SLOT;
        for (int state = states.nextSetBit(0); state >= 0; state = states.nextSetBit(state + 1)) {
            int accept = accepts[state];
            if (accept != NO_SLOT && (slot == NO_SLOT || accept < slot)) {
                slot = accept;
            }
        }
        return slot;
    }
}
