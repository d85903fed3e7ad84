package org.portal.chooser.dto;

/**
 * 过滤器规则的线上表示。
 *
 * @param kind  0 = glob，1 = mime；其它值会被忽略（线上是无符号 32 位整数，因此用 long 接收）
 * @param value 规则内容
 */
public record WireFilterRule(long kind, String value) {
}
