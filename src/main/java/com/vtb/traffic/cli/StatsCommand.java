package com.vtb.traffic.cli;

import com.vtb.traffic.models.TrafficStatistics;
import com.vtb.traffic.query.QueryCriteria;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.Locale;

@Command(name = "stats", description = "Статистика по сохраненному трафику")
class StatsCommand extends AbstractTrafficCommand {

    private static final int TOP_HOSTS = 10;

    @Override
    protected int execute(CliContext context) {
        double slowThreshold = context.getConfig().getAnalyzer().getSlowRequestThresholdSec();
        TrafficStatistics stats = context.getQueryEngine().statistics(QueryCriteria.all(), slowThreshold, TOP_HOSTS);

        PrintWriter out = out();
        out.println(ConsoleFormat.LINE);
        out.println("Статистика трафика");
        out.println(ConsoleFormat.LINE);
        out.printf("Всего запросов:    %d%n", stats.getTotalRequests());
        out.printf("Уникальных хостов: %d%n", stats.getUniqueHosts());
        if (stats.getTotalRequests() > 0) {
            out.printf(Locale.ROOT, "Длительность:      средн. %.0f мс, мин. %.0f мс, макс. %.0f мс%n",
                stats.getAvgDurationSec() * 1000, stats.getMinDurationSec() * 1000, stats.getMaxDurationSec() * 1000);
            out.printf(Locale.ROOT, "Медленных (> %.1f с): %d%n", slowThreshold, stats.getSlowRequests());
        }
        if (!stats.getMethods().isEmpty()) {
            out.println();
            out.println("Методы:");
            stats.getMethods().forEach((method, count) -> out.printf("  %-8s %d%n", method, count));
        }
        if (!stats.getStatusCodes().isEmpty()) {
            out.println();
            out.println("Коды ответа:");
            stats.getStatusCodes().forEach((status, count) -> out.printf("  %-8d %d%n", status, count));
        }
        if (!stats.getTopHosts().isEmpty()) {
            out.println();
            out.println("Хосты:");
            stats.getTopHosts().forEach((host, count) -> out.printf("  %-40s %d%n", host, count));
        }
        return ExitCodes.OK;
    }
}
