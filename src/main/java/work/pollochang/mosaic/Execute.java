package work.pollochang.mosaic;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "photo-mosaic",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "以圖庫縮圖拼出相片馬賽克",
        subcommands = {PreprocessCommand.class, CreateCommand.class})
@Slf4j
public class Execute implements Callable<Integer> {

    /** 目錄中沒有與模型比例相同的圖片 */
    public static final int EXIT_NO_MATCHING_PICTURES = 1;
    /** 其他無法完成的錯誤 */
    public static final int EXIT_FAILURE = 2;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        // 未指定子命令時顯示說明
        spec.commandLine().usage(spec.commandLine().getErr());
        return CommandLine.ExitCode.USAGE;
    }

    /**
     * 建立設定好的命令列，列舉值的選項不分大小寫。
     */
    public static CommandLine commandLine() {
        return configure(new CommandLine(new Execute()));
    }

    /**
     * 列舉值不分大小寫；子命令沒有處理到的例外一律回傳 {@link #EXIT_FAILURE}，
     * 不與 {@link #EXIT_NO_MATCHING_PICTURES} 混淆。只套用到呼叫當下已加入的子命令。
     */
    static CommandLine configure(CommandLine commandLine) {
        return commandLine
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                    log.error("{} - 執行時發生未預期的錯誤", cmd.getCommandName(), e);
                    cmd.getErr().println(cmd.getCommandName() + " 失敗: " + e);
                    return EXIT_FAILURE;
                });
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
