package com.weixiao.ent;

import com.weixiao.ent.command.DecodeCommand;
import com.weixiao.ent.command.EncodeCommand;
import com.weixiao.ent.command.ModeCommand;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * ent - 目录条目（tree entry）编解码与 mode 映射的命令行入口。
 * <p>
 * 子命令：encode、decode、mode。--file、--store、--of 等相对路径以 -C 指定的目录解析。
 */
@Command(name = "ent", mixinStandardHelpOptions = true, description = "ent - tree entry 编解码工具",
        subcommands = {EncodeCommand.class, DecodeCommand.class, ModeCommand.class})
public class Ent implements Runnable {

    static final String LOG_LEVEL_PROPERTY = "ent.log.level";

    @Spec
    private CommandSpec spec;

    @Option(names = {"-C", "-d", "--directory"}, paramLabel = "PATH",
            description = "解析相对路径的基准目录（默认为当前目录）")
    private Path baseDirectory;

    /** 只输入 ent 时打印用法。 */
    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    /**
     * 将 path 解析为绝对路径：相对路径以 -C 目录（缺省为进程工作目录）为基准。
     */
    public Path resolve(Path path) {
        Path base = baseDirectory != null ? baseDirectory : Paths.get("");
        return base.toAbsolutePath().resolve(path).normalize();
    }

    /** 基准目录本身。 */
    public Path getBaseDirectory() {
        return resolve(Paths.get(""));
    }

    /**
     * 执行一次 ent 命令并返回退出码，不调用 System.exit；main() 与测试共用。
     * 每次调用都新建 CommandLine，避免选项值在多次执行之间残留。
     */
    public static int execute(String... args) {
        return new CommandLine(new Ent()).execute(args);
    }

    /**
     * -Dent.debug=true 或 ENT_DEBUG=true 时把日志级别提到 DEBUG；已显式设置 ent.log.level 时不覆盖。
     */
    static void applyDebugSwitch() {
        boolean debug = Boolean.parseBoolean(System.getProperty("ent.debug"))
                || Boolean.parseBoolean(System.getenv("ENT_DEBUG"));
        if (debug && System.getProperty(LOG_LEVEL_PROPERTY) == null) {
            System.setProperty(LOG_LEVEL_PROPERTY, "DEBUG");
        }
    }

    public static void main(String[] args) {
        applyDebugSwitch();
        System.exit(execute(args == null || args.length == 0 ? new String[]{"--help"} : args));
    }
}
