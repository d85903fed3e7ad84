package org.portal.request;

import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 活跃请求的取消端点注册表（内存版，按客户端 token 索引）。
 * <p>
 * 说明：
 * <ul>
 *   <li>请求之间唯一共享的可变状态，支持并发注册/移除。</li>
 *   <li>token 采用对象路径格式（例如 {@code /org/portal/request/1_42/t1}），与客户端约定的 handle 一致。</li>
 *   <li>同一个 token 同时只能注册一次；重复注册视为导出失败。</li>
 * </ul>
 */
public class RequestHandleRegistry {

    private static final Pattern OBJECT_PATH = Pattern.compile("^/([A-Za-z0-9_]+(/[A-Za-z0-9_]+)*)?$");

    private final ConcurrentHashMap<String, RequestHandle> handles = new ConcurrentHashMap<>();

    public void export(RequestHandle handle) throws RequestExportException {
        String token = handle.token();
        if (token == null || !OBJECT_PATH.matcher(token).matches()) {
            throw new RequestExportException("非法的请求句柄：" + token);
        }
        RequestHandle previous = handles.putIfAbsent(token, handle);
        if (previous != null) {
            throw new RequestExportException("请求句柄已被占用：" + token);
        }
    }

    /**
     * 仅当 token 仍然指向该 handle 时才移除，避免误删同名的新请求。
     */
    public boolean remove(RequestHandle handle) {
        return handles.remove(handle.token(), handle);
    }

    /**
     * 客户端调用 Close()：通知对应请求取消。
     *
     * @return token 未注册（不存在、已结束或尚未完成注册）或已经关闭过时返回 false
     */
    public boolean close(String token) {
        if (token == null) {
            return false;
        }
        RequestHandle handle = handles.get(token);
        return handle != null && handle.close();
    }

    public boolean isExported(String token) {
        return token != null && handles.containsKey(token);
    }

    public int size() {
        return handles.size();
    }
}
