package com.vtb.traffic.cli;

import com.vtb.traffic.models.Finding;
import com.vtb.traffic.models.FindingCategory;
import com.vtb.traffic.models.OffenderSummary;
import com.vtb.traffic.models.SessionReport;
import com.vtb.traffic.models.Transaction;
import com.vtb.traffic.models.TransactionAnalysis;
import com.vtb.traffic.reports.SessionReportWriter;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;

@Slf4j
@Command(name = "analyze", description = "Эвристический анализ транзакции или последней сессии")
class AnalyzeCommand extends AbstractTrafficCommand {

    @Option(names = {"--id"}, description = "Проанализировать одну транзакцию")
    private Long id;

    @Option(names = {"--limit"}, description = "Сколько последних транзакций анализировать (по умолчанию из конфигурации)")
    private Integer limit;

    @Option(names = {"--json"}, description = "Вывести результат в JSON")
    private boolean json;

    @Option(names = {"--output", "-o"}, description = "Сохранить сводку сессии в JSON файл")
    private Path output;

    @Override
    protected int execute(CliContext context) throws Exception {
        SessionReportWriter writer = new SessionReportWriter();
        if (id != null) {
            Transaction transaction = context.getQueryEngine().get(id);
            TransactionAnalysis analysis = context.transactionAnalyzer().inspect(transaction);
            context.getStore().markAnalyzed(id);
            if (json) {
                out().println(writer.toJson(analysis));
            } else {
                printAnalysis(transaction, analysis);
            }
            return ExitCodes.OK;
        }

        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("--limit должен быть положительным");
        }
        SessionReport report = limit != null
            ? context.sessionAnalyzer().analyzeSession(limit)
            : context.sessionAnalyzer().analyzeSession();
        if (json) {
            out().println(writer.toJson(report));
        } else {
            printReport(report);
        }
        if (output != null) {
            writer.write(report, output);
            out().println("Сводка сохранена: " + output);
        }
        return ExitCodes.OK;
    }

    private void printAnalysis(Transaction transaction, TransactionAnalysis analysis) {
        PrintWriter out = out();
        out.println(ConsoleFormat.LINE);
        out.println("Анализ: " + ConsoleFormat.row(transaction));
        out.println(ConsoleFormat.LINE);
        if (analysis.getFindings().isEmpty()) {
            out.println("Проблем не обнаружено");
        }
        for (FindingCategory category : FindingCategory.values()) {
            if (analysis.count(category) == 0) {
                continue;
            }
            out.println(category.getCode() + ":");
            for (Finding finding : analysis.getFindings()) {
                if (finding.getCategory() == category) {
                    ConsoleFormat.finding(out, finding);
                }
            }
        }
        if (!analysis.getSkippedRules().isEmpty()) {
            out.println("Пропущены правила (некорректные данные): " + String.join(", ", analysis.getSkippedRules()));
        }
        out.println("Оценка риска: " + analysis.score());
    }

    private void printReport(SessionReport report) {
        PrintWriter out = out();
        out.println(ConsoleFormat.LINE);
        out.println("Анализ сессии");
        out.println(ConsoleFormat.LINE);
        out.printf("Транзакций:        %d%n", report.getAnalyzedTransactions());
        out.printf("Уникальных хостов: %d%n", report.getUniqueHosts());
        out.printf(Locale.ROOT, "Среднее время:     %.0f мс%n", report.getAvgDurationSec() * 1000);
        out.println();
        out.println("Находки по категориям:");
        report.getCategoryCounts().forEach((category, count) -> out.printf("  %-16s %d%n", category.getCode(), count));
        out.println("Находки по критичности:");
        report.getSeverityCounts().forEach((severity, count) -> out.printf("  %-16s %d%n", severity, count));
        if (!report.getFindingCounts().isEmpty()) {
            out.println("Находки по правилам:");
            report.getFindingCounts().forEach((rule, count) -> out.printf("  %-32s %d%n", rule, count));
        }
        if (!report.getTopOffenders().isEmpty()) {
            out.println();
            out.println("Самые проблемные транзакции:");
            for (OffenderSummary offender : report.getTopOffenders()) {
                out.printf("  #%-6d score %-4d %-7s %s (%d находок, макс. %s)%n",
                    offender.getTransactionId(), offender.getScore(), offender.getMethod(),
                    ConsoleFormat.shorten(offender.getUrl(), 70), offender.getFindingCount(),
                    offender.getHighestSeverity());
            }
        }
        if (!report.getRecommendations().isEmpty()) {
            out.println();
            out.println("Рекомендации:");
            report.getRecommendations().forEach(r -> out.println("  • " + r));
        }
        if (report.getSkippedRules() > 0) {
            log.info("Пропущено проверок из-за некорректных данных: {}", report.getSkippedRules());
        }
    }
}
