package com.rit;

import com.rit.command.AddCommand;
import com.rit.command.CommitCommand;
import com.rit.command.InitCommand;
import com.rit.command.LogCommand;
import com.rit.command.ShowCommand;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * rit - 极简本地版本控制的命令行入口。
 * 所有 rit 命令的执行都通过此类作为唯一入口点。
 * 命令起始目录由本类的 -C / -d 统一提供，子命令通过 {@link #getStartPath()} 获取。
 */
@Command(name = "rit", mixinStandardHelpOptions = true, version = "rit 0.1.0",
        description = "rit - 极简本地版本控制")
public class Rit implements Runnable {

    @Option(names = {"-C", "-d", "--directory"}, paramLabel = "PATH",
            description = "以指定路径作为工作目录执行命令（默认为当前目录），子命令据此向上查找 .rit")
    private Path workingDirectory;

    /**
     * 未指定子命令时打印用法说明。
     */
    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    /**
     * 返回命令的起始路径（工作目录）。
     *
     * @return 已规范化的绝对路径，不会为 null
     */
    public Path getStartPath() {
        Path base = workingDirectory != null ? workingDirectory : Paths.get("");
        return base.toAbsolutePath().normalize();
    }

    /**
     * 创建配置好的 CommandLine 实例，包含所有已注册的子命令。供 main() 和测试使用。
     */
    public static CommandLine createCommandLine() {
        return new CommandLine(new Rit())
                .addSubcommand("init", new InitCommand())
                .addSubcommand("add", new AddCommand())
                .addSubcommand("commit", new CommitCommand())
                .addSubcommand("log", new LogCommand())
                .addSubcommand("show", new ShowCommand());
    }

    /**
     * 主入口方法。
     * 若需调试日志：-Drit.debug=true 或环境变量 RIT_DEBUG=true，或直接 -Drit.log.level=DEBUG。
     */
    public static void main(String[] args) {
        if ("true".equalsIgnoreCase(System.getProperty("rit.debug"))
                || "true".equalsIgnoreCase(System.getenv("RIT_DEBUG"))) {
            System.setProperty("rit.log.level", "DEBUG");
        }
        CommandLine cli = createCommandLine();
        String[] runArgs = args != null && args.length > 0 ? args : new String[]{"--help"};
        int exitCode = cli.execute(runArgs);
        System.exit(exitCode);
    }
}
