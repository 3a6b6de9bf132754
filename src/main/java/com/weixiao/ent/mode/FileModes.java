package com.weixiao.ent.mode;

/**
 * POSIX st_mode 中的文件类型位与权限位常量（与 &lt;sys/stat.h&gt; 一致，八进制）。
 */
public final class FileModes {

    private FileModes() {
    }

    public static final int S_IFMT = 0170000;
    public static final int S_IFSOCK = 0140000;
    public static final int S_IFLNK = 0120000;
    public static final int S_IFREG = 0100000;
    public static final int S_IFBLK = 0060000;
    public static final int S_IFDIR = 0040000;
    public static final int S_IFCHR = 0020000;
    public static final int S_IFIFO = 0010000;

    public static final int S_IXUSR = 0100;

    public static boolean isRegular(int mode) {
        return (mode & S_IFMT) == S_IFREG;
    }

    public static boolean isDirectory(int mode) {
        return (mode & S_IFMT) == S_IFDIR;
    }

    public static boolean isSymlink(int mode) {
        return (mode & S_IFMT) == S_IFLNK;
    }

    /** 八进制字符串，如 0100644 → "100644"。 */
    public static String toOctal(int mode) {
        return Integer.toOctalString(mode);
    }
}
