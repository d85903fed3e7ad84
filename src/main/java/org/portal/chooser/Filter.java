package org.portal.chooser;

import java.util.List;
import java.util.Objects;

/**
 * 文件过滤器（名称 + 有序规则列表），按结构判等。
 *
 * @param name  展示给用户的名称，例如 "Text files"
 * @param rules 有序规则列表
 */
public record Filter(String name, List<FilterRule> rules) {

    public Filter {
        Objects.requireNonNull(name, "name 不能为空");
        rules = (rules == null) ? List.of() : List.copyOf(rules);
    }
}
