package com.weixiao.ent.mode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * 目标平台是否支持原生符号链接：决定使用哪一张类型/mode 映射表。
 * <p>
 * 解析顺序：系统属性 ent.symlinks → 环境变量 ENT_SYMLINKS → os.name（Windows 为 NARROWED）。
 * 取值 native / narrowed，大小写不敏感。
 */
public enum SymlinkSupport {

    NATIVE,
    NARROWED;

    private static final Logger log = LoggerFactory.getLogger(SymlinkSupport.class);

    public static final String PROPERTY = "ent.symlinks";
    public static final String ENV = "ENT_SYMLINKS";

    /** 对应的映射实现。 */
    public ModeMapper mapper() {
        return switch (this) {
            case NATIVE -> PosixModeMapper.INSTANCE;
            case NARROWED -> NarrowedModeMapper.INSTANCE;
        };
    }

    /** 按系统属性、环境变量、操作系统依次判断。 */
    public static SymlinkSupport detect() {
        String configured = System.getProperty(PROPERTY);
        if (configured == null || configured.isBlank()) {
            configured = System.getenv(ENV);
        }
        if (configured != null && !configured.isBlank()) {
            SymlinkSupport parsed = parse(configured);
            log.debug("symlink support {} from configuration", parsed);
            return parsed;
        }
        SymlinkSupport detected = forOsName(System.getProperty("os.name", ""));
        log.debug("symlink support {} detected from os.name", detected);
        return detected;
    }

    /** 解析 "native" / "narrowed"。 */
    public static SymlinkSupport parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid symlink support '" + value + "', expected native or narrowed", e);
        }
    }

    /** Windows 上收窄，其余平台视为支持原生符号链接。 */
    static SymlinkSupport forOsName(String osName) {
        return osName.toLowerCase(Locale.ROOT).startsWith("windows") ? NARROWED : NATIVE;
    }
}
