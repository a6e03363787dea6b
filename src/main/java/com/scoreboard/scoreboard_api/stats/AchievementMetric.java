package com.scoreboard.scoreboard_api.stats;

import com.scoreboard.scoreboard_api.stats.RelationshipStat.NemesisStat;
import com.scoreboard.scoreboard_api.stats.RelationshipStat.PartnerStat;

/**
 * Numbers a threshold rule can be written against.
 */
public enum AchievementMetric {

    WINS {
        @Override
        public double measure(WinLossStats stats, RelationshipStat relationships) {
            return stats.wins();
        }
    },
    LOSSES {
        @Override
        public double measure(WinLossStats stats, RelationshipStat relationships) {
            return stats.losses();
        }
    },
    TOTAL_GAMES {
        @Override
        public double measure(WinLossStats stats, RelationshipStat relationships) {
            return stats.totalGames();
        }
    },
    /** Fraction in [0, 1], so thresholds are written as 0.8 rather than 80. */
    WIN_RATE {
        @Override
        public double measure(WinLossStats stats, RelationshipStat relationships) {
            return stats.winRate();
        }
    },
    WIN_STREAK {
        @Override
        public double measure(WinLossStats stats, RelationshipStat relationships) {
            return stats.winStreak();
        }
    },
    LOSS_STREAK {
        @Override
        public double measure(WinLossStats stats, RelationshipStat relationships) {
            return stats.losingStreak();
        }
    },
    PARTNER_WINS {
        @Override
        public double measure(WinLossStats stats, RelationshipStat relationships) {
            return relationships.bestPartner().map(PartnerStat::wins).orElse(0);
        }
    },
    NEMESIS_LOSSES {
        @Override
        public double measure(WinLossStats stats, RelationshipStat relationships) {
            return relationships.nemesis().map(NemesisStat::lossesAgainst).orElse(0);
        }
    };

    public abstract double measure(WinLossStats stats, RelationshipStat relationships);
}
