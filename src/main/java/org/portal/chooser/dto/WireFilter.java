package org.portal.chooser.dto;

import java.util.List;

/**
 * 过滤器的线上表示：{@code (name, [(kind, value)])}。
 *
 * @param name  过滤器名称
 * @param rules 有序规则
 */
public record WireFilter(String name, List<WireFilterRule> rules) {
}
