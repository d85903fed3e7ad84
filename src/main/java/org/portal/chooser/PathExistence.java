package org.portal.chooser;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * 文件系统存在性判断（便于在测试中替换为内存集合）。
 */
@FunctionalInterface
public interface PathExistence {

    /**
     * 默认实现：不跟随符号链接，悬空链接也算“已存在”，避免生成的名字覆盖它。
     */
    PathExistence FILESYSTEM = path -> Files.exists(path, LinkOption.NOFOLLOW_LINKS);

    boolean exists(Path path);
}
