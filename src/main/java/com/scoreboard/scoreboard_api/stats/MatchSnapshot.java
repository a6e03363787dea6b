package com.scoreboard.scoreboard_api.stats;

import com.scoreboard.scoreboard_api.model.Match;
import com.scoreboard.scoreboard_api.model.Player;

import java.util.*;

/**
 * Validated, immutable point-in-time view of the match log and the player
 * directory. Every stats computation runs against one of these.
 *
 * Matches are held newest first: playedAt descending, then id ascending for
 * matches recorded at the same instant. Construction fails fast on the first
 * invalid match, so once a snapshot exists every aggregation over it is total.
 */
public final class MatchSnapshot {

    public static final Comparator<Match> NEWEST_FIRST =
            Comparator.comparing(Match::getPlayedAt, Comparator.reverseOrder())
                    .thenComparing(Match::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final List<Match> matches;
    private final Map<String, Player> players;
    private final Map<String, List<Match>> matchesByPlayer;

    private MatchSnapshot(List<Match> matches, Map<String, Player> players) {
        this.matches = matches;
        this.players = players;

        Map<String, List<Match>> index = new HashMap<>();
        for (Match m : matches) {
            for (String id : m.getWinnerIds()) index.computeIfAbsent(id, k -> new ArrayList<>()).add(m);
            for (String id : m.getLoserIds()) index.computeIfAbsent(id, k -> new ArrayList<>()).add(m);
        }
        index.replaceAll((id, list) -> List.copyOf(list));
        this.matchesByPlayer = Collections.unmodifiableMap(index);
    }

    // =========================================================================
    // Construction
    // =========================================================================

    /**
     * Build a snapshot, validating every match.
     *
     * @throws InvalidMatchDataException on the first match that breaks an invariant
     */
    public static MatchSnapshot of(Collection<Match> matches, Collection<Player> players) {
        List<Match> ordered = new ArrayList<>(matches.size());
        for (Match m : matches) {
            validate(m);
            ordered.add(m);
        }
        ordered.sort(NEWEST_FIRST);

        Map<String, Player> directory = new LinkedHashMap<>();
        for (Player p : players) {
            directory.put(p.getId(), p);
        }
        return new MatchSnapshot(List.copyOf(ordered), Collections.unmodifiableMap(directory));
    }

    public static MatchSnapshot empty() {
        return new MatchSnapshot(List.of(), Map.of());
    }

    /**
     * Check a single match against the snapshot invariants. Also used on the
     * write path so bad input never reaches the table.
     */
    public static void validate(Match match) {
        String id = match.getId();
        List<String> ids = List.of(
                nullToEmpty(match.getWinner1Id()), nullToEmpty(match.getWinner2Id()),
                nullToEmpty(match.getLoser1Id()), nullToEmpty(match.getLoser2Id()));

        for (String playerId : ids) {
            if (playerId.isBlank()) {
                throw new InvalidMatchDataException(id, "all four player ids are required");
            }
        }
        if (new HashSet<>(ids).size() != ids.size()) {
            throw new InvalidMatchDataException(id, "a player cannot appear twice in one match " + ids);
        }
        if (match.hasPartialScore()) {
            throw new InvalidMatchDataException(id, "winner and loser scores must be given together");
        }
        if (match.getPlayedAt() == null) {
            throw new InvalidMatchDataException(id, "missing playedAt timestamp");
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    /** All matches, newest first. */
    public List<Match> matches() {
        return matches;
    }

    /** One player's matches, newest first. Empty for an unknown id. */
    public List<Match> matchesFor(String playerId) {
        return matchesByPlayer.getOrDefault(playerId, List.of());
    }

    public Optional<Player> player(String playerId) {
        return Optional.ofNullable(players.get(playerId));
    }

    public Collection<Player> players() {
        return players.values();
    }

    /**
     * Directory players plus every id referenced by a match, in id order.
     */
    public SortedSet<String> knownPlayerIds() {
        SortedSet<String> ids = new TreeSet<>(players.keySet());
        ids.addAll(matchesByPlayer.keySet());
        return Collections.unmodifiableSortedSet(ids);
    }

    public boolean isKnown(String playerId) {
        return players.containsKey(playerId) || matchesByPlayer.containsKey(playerId);
    }

    public PlayerDisplay display(String playerId) {
        Player p = players.get(playerId);
        return p != null ? PlayerDisplay.of(p) : PlayerDisplay.unknown(playerId);
    }

    public String displayName(String playerId) {
        return display(playerId).name();
    }
}
