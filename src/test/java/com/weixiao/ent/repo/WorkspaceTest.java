package com.weixiao.ent.repo;

import com.weixiao.ent.mode.FileModes;
import com.weixiao.ent.mode.SymlinkSupport;
import com.weixiao.ent.obj.TreeEntryType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Workspace 测试：依赖 POSIX 文件系统，其他平台跳过。
 */
@DisplayName("Workspace 测试")
class WorkspaceTest {

    private static void assumePosix() {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"),
                "requires a POSIX file system");
    }

    @Test
    @DisplayName("目录、普通文件、可执行文件、符号链接按 posix 映射归类")
    void classify_posix(@TempDir Path dir) throws Exception {
        assumePosix();
        Workspace workspace = new Workspace(dir, SymlinkSupport.NATIVE.mapper());
        Path sub = Files.createDirectory(dir.resolve("src"));
        Path file = Files.write(dir.resolve("a.txt"), "a".getBytes(StandardCharsets.UTF_8));
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-r--r--"));
        Path script = Files.write(dir.resolve("run.sh"), "#!/bin/sh".getBytes(StandardCharsets.UTF_8));
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        Path link = Files.createSymbolicLink(dir.resolve("link"), file.getFileName());

        assertThat(workspace.classify(sub)).contains(TreeEntryType.TREE);
        assertThat(workspace.classify(Path.of("a.txt"))).contains(TreeEntryType.REGULAR_FILE);
        assertThat(workspace.classify(script)).contains(TreeEntryType.EXECUTABLE_FILE);
        assertThat(workspace.classify(link)).contains(TreeEntryType.SYMLINK);
    }

    @Test
    @DisplayName("narrowed 映射下可执行文件归为普通文件")
    void classify_narrowed(@TempDir Path dir) throws Exception {
        assumePosix();
        Workspace workspace = new Workspace(dir, SymlinkSupport.NARROWED.mapper());
        Path script = Files.write(dir.resolve("run.sh"), "#!/bin/sh".getBytes(StandardCharsets.UTF_8));
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));

        assertThat(workspace.classify(script)).contains(TreeEntryType.REGULAR_FILE);
        assertThat(workspace.classify(dir)).contains(TreeEntryType.TREE);
    }

    @Test
    @DisplayName("readMode 读出类型位与权限位")
    void readMode(@TempDir Path dir) throws Exception {
        assumePosix();
        Workspace workspace = new Workspace(dir, SymlinkSupport.NATIVE.mapper());
        Path file = Files.write(dir.resolve("b.txt"), new byte[0]);
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-r-----"));

        int mode = workspace.readMode(file);
        assertThat(mode & FileModes.S_IFMT).isEqualTo(FileModes.S_IFREG);
        assertThat(mode & 0777).isEqualTo(0640);
    }
}
