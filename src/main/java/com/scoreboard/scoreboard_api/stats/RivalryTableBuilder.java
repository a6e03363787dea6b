package com.scoreboard.scoreboard_api.stats;

import com.scoreboard.scoreboard_api.model.Match;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds every pairwise head-to-head record straight from the match log.
 *
 * Each match yields four winner-vs-loser pairs. Teammates are never paired,
 * so players who only ever played together do not appear. The result is the
 * raw relation; filtering and display order belong to the caller.
 */
public final class RivalryTableBuilder {

    private RivalryTableBuilder() {}

    public static Set<RivalryEntry> build(MatchSnapshot snapshot) {
        // Key: (lower id, higher id). Value: [lower id's wins, higher id's wins].
        Map<PairKey, int[]> h2h = new TreeMap<>();

        for (Match m : snapshot.matches()) {
            for (String winner : m.getWinnerIds()) {
                for (String loser : m.getLoserIds()) {
                    boolean winnerIsFirst = winner.compareTo(loser) < 0;
                    PairKey key = winnerIsFirst ? new PairKey(winner, loser) : new PairKey(loser, winner);
                    int[] counts = h2h.computeIfAbsent(key, k -> new int[2]);
                    counts[winnerIsFirst ? 0 : 1]++;
                }
            }
        }

        Set<RivalryEntry> entries = new LinkedHashSet<>();
        h2h.forEach((key, counts) ->
                entries.add(new RivalryEntry(key.first(), key.second(), counts[0], counts[1])));
        return Collections.unmodifiableSet(entries);
    }

    private record PairKey(String first, String second) implements Comparable<PairKey> {
        @Override
        public int compareTo(PairKey other) {
            int c = first.compareTo(other.first);
            return c != 0 ? c : second.compareTo(other.second);
        }
    }
}
