package org.portal.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 每个请求唯一的响应信封：{@code (status, results)}。
 * <p>
 * status 为 0 表示成功，1 表示取消；取消时 results 必须是该类型的“空值”，不能带有半完成的数据。
 *
 * @param status  0 = success，1 = cancelled
 * @param results 结果
 */
public record PortalResponse<T>(
        @JsonProperty("status") int status,
        @JsonProperty("results") T results
) {

    public static final int SUCCESS = 0;
    public static final int CANCELLED = 1;

    public static <T> PortalResponse<T> success(T results) {
        return new PortalResponse<>(SUCCESS, results);
    }

    public static <T> PortalResponse<T> cancelled(T emptyResults) {
        return new PortalResponse<>(CANCELLED, emptyResults);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == SUCCESS;
    }

    @JsonIgnore
    public boolean isCancelled() {
        return status == CANCELLED;
    }
}
