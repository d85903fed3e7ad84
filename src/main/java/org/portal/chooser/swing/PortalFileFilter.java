package org.portal.chooser.swing;

import org.portal.chooser.Filter;
import org.portal.chooser.FilterRule;

import javax.swing.filechooser.FileFilter;
import java.io.File;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 把 {@link Filter} 适配为 Swing 的 {@link FileFilter}：任意一条规则命中即接受，目录总是接受（便于浏览）。
 */
class PortalFileFilter extends FileFilter {

    private final Filter filter;
    private final List<PathMatcher> globs = new ArrayList<>();
    private final List<String> mimeTypes = new ArrayList<>();

    PortalFileFilter(Filter filter) {
        this.filter = filter;
        for (FilterRule rule : filter.rules()) {
            if (rule.kind() == FilterRule.Kind.GLOB) {
                globs.add(FileSystems.getDefault().getPathMatcher("glob:" + rule.value()));
            } else {
                mimeTypes.add(rule.value().toLowerCase(Locale.ROOT));
            }
        }
    }

    Filter filter() {
        return filter;
    }

    @Override
    public boolean accept(File file) {
        if (file.isDirectory()) {
            return true;
        }
        Path name = Path.of(file.getName());
        for (PathMatcher glob : globs) {
            if (glob.matches(name)) {
                return true;
            }
        }
        return !mimeTypes.isEmpty() && matchesMime(file.toPath());
    }

    private boolean matchesMime(Path path) {
        String probed;
        try {
            probed = Files.probeContentType(path);
        } catch (IOException e) {
            // 无法探测类型时视为不匹配
            return false;
        }
        if (probed == null) {
            return false;
        }
        String type = probed.toLowerCase(Locale.ROOT);
        for (String mime : mimeTypes) {
            if (mime.endsWith("/*") ? type.startsWith(mime.substring(0, mime.length() - 1)) : type.equals(mime)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String getDescription() {
        return filter.name();
    }
}
