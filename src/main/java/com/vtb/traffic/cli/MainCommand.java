package com.vtb.traffic.cli;

import com.vtb.traffic.config.TrafficConfig;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Главная CLI команда анализатора перехваченного трафика
 */
@Slf4j
@Command(
    name = "traffic-analyzer",
    mixinStandardHelpOptions = true,
    version = "VTB Traffic Analyzer 1.0.0",
    description = """

        VTB Traffic Analyzer

        Хранение, анализ, экспорт и воспроизведение перехваченного HTTP(S) трафика

        Возможности:
          • Поиск и статистика по сохраненным транзакциям
          • Эвристики безопасности, производительности и практик API
          • Экспорт в JSON (без потерь) и HAR 1.2
          • Повтор запросов и автоматизация по сессии из трафика

        """,
    subcommands = {
        StatsCommand.class,
        ListCommand.class,
        ShowCommand.class,
        AnalyzeCommand.class,
        SearchCommand.class,
        ExportCommand.class,
        ImportCommand.class,
        ClearCommand.class,
        NotesCommand.class,
        ReplayCommand.class,
        SummaryCommand.class,
        AuthCommand.class,
        AutoCommand.class,
        CompleteCommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(
        names = {"--db"},
        description = "Путь к базе SQLite (по умолчанию из конфигурации: data/traffic.db)"
    )
    private Path databasePath;

    @Option(
        names = {"--config"},
        description = "YAML файл конфигурации вместо встроенного traffic-config.yaml"
    )
    private Path configPath;

    @Option(
        names = {"--scope"},
        description = "Ограничить область хостом и его поддоменами (можно повторять)"
    )
    private List<String> scope = new ArrayList<>();

    @Spec
    private CommandSpec spec;

    private InputStream input = System.in;

    public static void main(String[] args) {
        int exitCode = newCommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    /**
     * CommandLine с кодами завершения анализатора: 1 для ошибок ввода, 2 для ошибок выполнения
     */
    public static CommandLine newCommandLine(MainCommand command) {
        CommandLine commandLine = new CommandLine(command);
        applyExitCodes(commandLine);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            log.debug("Команда завершилась ошибкой", ex);
            cmd.getErr().println("Ошибка: " + ex.getMessage());
            cmd.getErr().flush();
            return ExitCodes.forException(ex);
        });
        return commandLine;
    }

    private static void applyExitCodes(CommandLine commandLine) {
        commandLine.getCommandSpec().exitCodeOnInvalidInput(ExitCodes.USAGE);
        commandLine.getCommandSpec().exitCodeOnExecutionException(ExitCodes.RUNTIME);
        for (CommandLine sub : commandLine.getSubcommands().values()) {
            applyExitCodes(sub);
        }
    }

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        err.println("Укажите команду.");
        spec.commandLine().usage(err);
        return ExitCodes.USAGE;
    }

    CliContext openContext() {
        TrafficConfig config = configPath != null ? TrafficConfig.load(configPath) : TrafficConfig.load();
        Path database = databasePath != null ? databasePath : Path.of(config.getStore().getPath());
        return new CliContext(config, database, scope);
    }

    InputStream getInput() {
        return input;
    }

    public MainCommand withInput(InputStream input) {
        this.input = input;
        return this;
    }
}
