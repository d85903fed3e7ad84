package org.portal.chooser;

import java.util.Objects;

/**
 * 过滤器中的一条规则：glob 模式或 MIME 类型。
 *
 * @param kind  规则类型
 * @param value glob 模式（例如 {@code *.txt}）或 MIME 类型（例如 {@code text/plain}）
 */
public record FilterRule(Kind kind, String value) {

    public FilterRule {
        Objects.requireNonNull(kind, "kind 不能为空");
        Objects.requireNonNull(value, "value 不能为空");
    }

    public static FilterRule glob(String pattern) {
        return new FilterRule(Kind.GLOB, pattern);
    }

    public static FilterRule mime(String type) {
        return new FilterRule(Kind.MIME, type);
    }

    /**
     * 规则类型及其线上编码（0 = glob，1 = mime）。
     */
    public enum Kind {
        GLOB(0),
        MIME(1);

        private final int code;

        Kind(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }

        /**
         * 按线上编码查找规则类型。
         *
         * @return 未知编码返回 {@code null}（调用方应静默丢弃该规则）
         */
        public static Kind fromCode(long code) {
            for (Kind kind : values()) {
                if (kind.code == code) {
                    return kind;
                }
            }
            return null;
        }
    }
}
