package com.example.mediahooks.summary;

import com.example.mediahooks.analytics.AggregateWatchStats;
import com.example.mediahooks.analytics.ContentWatchStats;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a {@link SummaryDigest} into a Discord embed message.
 */
@Component
public class DiscordEmbedRenderer {

    static final int MOVIES_COLOR = 15844367;
    static final int SERIES_COLOR = 5793266;
    static final int STATS_COLOR = 5763719;

    static final String NO_DATA = "No data";

    private static final DateTimeFormatter FOOTER_DATE = DateTimeFormatter.ofPattern("M/d/yyyy", Locale.US);

    public DiscordMessage render(SummaryDigest digest) {
        List<DiscordMessage.Embed> embeds = List.of(
                new DiscordMessage.Embed("🎬 Most Watched Movies", MOVIES_COLOR,
                        rankingFields(digest.topMovies(), "No movies watched this month"), null),
                new DiscordMessage.Embed("📺 Most Watched Series", SERIES_COLOR,
                        rankingFields(digest.topSeries(), "No series watched this month"), null),
                new DiscordMessage.Embed("📈 General Statistics", STATS_COLOR,
                        statisticsFields(digest.stats()), footer(digest.period())));

        return new DiscordMessage("📊 **Monthly Report - " + digest.period().label() + "**", embeds);
    }

    private List<DiscordMessage.Field> rankingFields(List<ContentWatchStats> ranking, String emptyText) {
        if (ranking == null || ranking.isEmpty()) {
            return List.of(new DiscordMessage.Field(NO_DATA, emptyText, null));
        }
        List<DiscordMessage.Field> fields = new ArrayList<>(ranking.size());
        for (int i = 0; i < ranking.size(); i++) {
            ContentWatchStats entry = ranking.get(i);
            fields.add(new DiscordMessage.Field(
                    (i + 1) + ". " + entry.title(),
                    Math.round(entry.totalMinutes()) + " minutes • " + entry.uniqueViewers() + " viewers",
                    false));
        }
        return fields;
    }

    private List<DiscordMessage.Field> statisticsFields(AggregateWatchStats stats) {
        AggregateWatchStats values = stats == null ? AggregateWatchStats.empty() : stats;
        return List.of(
                new DiscordMessage.Field("Active Users", String.valueOf(values.activeUsers()), true),
                new DiscordMessage.Field("Total Plays", String.valueOf(values.totalPlays()), true),
                new DiscordMessage.Field("Total Hours Watched", String.valueOf(Math.round(values.totalHours())), true));
    }

    private DiscordMessage.Footer footer(SummaryDigest.Period period) {
        return new DiscordMessage.Footer("Period: from " + FOOTER_DATE.format(period.start())
                + " to " + FOOTER_DATE.format(period.end()));
    }
}
