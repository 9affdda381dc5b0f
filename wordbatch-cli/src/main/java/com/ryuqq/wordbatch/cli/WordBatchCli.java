package com.ryuqq.wordbatch.cli;

import com.ryuqq.wordbatch.adapter.file.config.PipelinePaths;
import com.ryuqq.wordbatch.cli.commands.BatchCommand;
import com.ryuqq.wordbatch.cli.commands.RunCommand;
import com.ryuqq.wordbatch.cli.commands.ScheduleCommand;
import com.ryuqq.wordbatch.cli.commands.SelectCommand;
import com.ryuqq.wordbatch.core.exception.ConfigurationException;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Set;
import java.util.function.Function;

/**
 * WordBatch 명령줄 진입점.
 *
 * <p><strong>종료 코드:</strong></p>
 * <ul>
 *   <li>0: 성공</li>
 *   <li>1: 실행 실패 (배치 실패, 연속 생성 실패 등)</li>
 *   <li>2: 설정 오류 (잘못된 인자, 누락된 파일)</li>
 * </ul>
 *
 * <p>로그 파일 이름은 Logback 초기화 전에 {@value #LOG_NAME_PROPERTY} 시스템 속성으로 정해집니다.
 * 이 클래스는 static Logger를 두지 않습니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
@Command(
    name = "wordbatch",
    description = "Resumable vocabulary enrichment and example generation pipeline",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        SelectCommand.class,
        RunCommand.class,
        BatchCommand.class,
        ScheduleCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class WordBatchCli implements Runnable {

    public static final String LOG_NAME_PROPERTY = "wordbatch.log.name";

    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CONFIGURATION = 2;

    private static final Set<String> COMMANDS = Set.of("select", "run", "batch", "schedule");
    private static final DateTimeFormatter LOG_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    @Option(
        names = {"--root"},
        description = "Project root holding data/, checkpoints/, prompts/ and final_data/ (default: ${DEFAULT-VALUE})",
        defaultValue = "."
    )
    private Path root;

    private final Function<PipelinePaths, PipelineFactory> factories;

    public WordBatchCli() {
        this(PipelineFactory::create);
    }

    public WordBatchCli(Function<PipelinePaths, PipelineFactory> factories) {
        if (factories == null) {
            throw new IllegalArgumentException("factories cannot be null");
        }
        this.factories = factories;
    }

    public static void main(String[] args) {
        if (System.getProperty(LOG_NAME_PROPERTY) == null) {
            System.setProperty(LOG_NAME_PROPERTY, logName(args, LocalDateTime.now()));
        }
        System.exit(newCommandLine(new WordBatchCli()).execute(args));
    }

    /**
     * 종료 코드 규칙이 적용된 CommandLine 생성.
     *
     * @param cli 최상위 명령 인스턴스
     * @return CommandLine
     */
    public static CommandLine newCommandLine(WordBatchCli cli) {
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionExceptionHandler((exception, cmd, parseResult) -> {
            if (exception instanceof ConfigurationException) {
                LoggerFactory.getLogger(WordBatchCli.class).error("Configuration error: {}", exception.getMessage());
                return EXIT_CONFIGURATION;
            }
            LoggerFactory.getLogger(WordBatchCli.class).error("Pipeline error: {}", exception.getMessage(), exception);
            return EXIT_FAILURE;
        });
        return commandLine;
    }

    /**
     * 명령별 로그 파일 이름.
     *
     * <pre>
     * batch 40        → batch_from_40_{stamp}.log
     * schedule ...    → scheduler_{stamp}.log
     * select          → select_{stamp}.log
     * run / 기타       → run_{stamp}.log
     * </pre>
     *
     * @param args 명령줄 인자
     * @param now 현재 시각
     * @return 로그 파일 이름
     */
    static String logName(String[] args, LocalDateTime now) {
        String stamp = now.format(LOG_STAMP);
        String command = null;
        String firstArgument = null;
        for (int i = 0; i < args.length; i++) {
            if (COMMANDS.contains(args[i])) {
                command = args[i];
                if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                    firstArgument = args[i + 1];
                }
                break;
            }
        }
        if ("batch".equals(command)) {
            boolean numeric = firstArgument != null && !firstArgument.isEmpty()
                && firstArgument.chars().allMatch(Character::isDigit);
            String start = numeric ? firstArgument : "0";
            return "batch_from_" + start + "_" + stamp + ".log";
        }
        if ("schedule".equals(command)) {
            return "scheduler_" + stamp + ".log";
        }
        if ("select".equals(command)) {
            return "select_" + stamp + ".log";
        }
        return "run_" + stamp + ".log";
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    /**
     * 현재 --root 기준의 구성 요소.
     *
     * @return PipelineFactory
     */
    public PipelineFactory factory() {
        return factories.apply(new PipelinePaths(root));
    }
}
