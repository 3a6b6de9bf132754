package com.weixiao.ent.command;

import com.weixiao.ent.Ent;
import com.weixiao.ent.mode.FileModes;
import com.weixiao.ent.mode.ModeMapper;
import com.weixiao.ent.mode.SymlinkSupport;
import com.weixiao.ent.obj.TreeEntryType;
import com.weixiao.ent.repo.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Optional;

/**
 * ent mode - 类型与 POSIX mode 互查。
 * --type 打印该类型对应的八进制 mode；--of 打印路径归类后的类型（d/f/x/l）。
 */
@Command(name = "mode", mixinStandardHelpOptions = true, description = "类型与 POSIX mode 互查")
public class ModeCommand implements Runnable, IExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ModeCommand.class);

    @ParentCommand
    private Ent ent;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Query query;

    static class Query {
        @Option(names = {"--type"}, paramLabel = "d|f|x|l", description = "打印该类型的 mode")
        Character type;

        @Option(names = {"--of"}, paramLabel = "PATH", description = "打印该路径的类型")
        Path path;
    }

    @ArgGroup(exclusive = true)
    private Platform platform;

    static class Platform {
        @Option(names = {"--native"}, description = "按支持原生符号链接的平台映射")
        boolean nativeSymlinks;

        @Option(names = {"--narrowed"}, description = "按不支持符号链接的平台映射（符号链接视为可执行文件）")
        boolean narrowed;
    }

    private int exitCode = 0;

    @Override
    public void run() {
        exitCode = 0;
        ModeMapper mapper = selectMapper();
        log.debug("mode using {} mapper", mapper);
        if (query.type != null) {
            Optional<TreeEntryType> type = TreeEntryType.fromLogChar(query.type);
            if (type.isEmpty()) {
                System.err.println("fatal: unknown type '" + query.type + "', expected d, f, x or l");
                exitCode = 1;
                return;
            }
            System.out.println(FileModes.toOctal(mapper.modeFromType(type.get())));
            return;
        }

        Path target = ent.resolve(query.path);
        if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            log.warn("path not found: {}", target);
            System.err.println("fatal: path not found: " + query.path);
            exitCode = 1;
            return;
        }
        try {
            Workspace workspace = new Workspace(ent.getBaseDirectory(), mapper);
            Optional<TreeEntryType> type = workspace.classify(target);
            if (type.isEmpty()) {
                System.err.println("fatal: unsupported file type: " + query.path);
                exitCode = 1;
                return;
            }
            System.out.println(type.get().getLogChar());
        } catch (IOException e) {
            log.error("mode failed", e);
            System.err.println("fatal: " + e.getMessage());
            exitCode = 1;
        }
    }

    private ModeMapper selectMapper() {
        if (platform != null && platform.nativeSymlinks) {
            return SymlinkSupport.NATIVE.mapper();
        }
        if (platform != null && platform.narrowed) {
            return SymlinkSupport.NARROWED.mapper();
        }
        return ModeMapper.forPlatform();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
