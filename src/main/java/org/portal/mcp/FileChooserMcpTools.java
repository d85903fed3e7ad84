package org.portal.mcp;

import org.portal.chooser.FileChooserPortal;
import org.portal.chooser.dto.OpenFileOptions;
import org.portal.chooser.dto.OpenFileResults;
import org.portal.chooser.dto.RequestCloseResult;
import org.portal.chooser.dto.SaveFileOptions;
import org.portal.chooser.dto.SaveFileResults;
import org.portal.chooser.dto.SaveFilesOptions;
import org.portal.chooser.dto.SaveFilesResults;
import org.portal.request.PortalResponse;
import org.portal.request.RequestHandleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

/**
 * 文件选择门户的 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>打开文件（{@code file_chooser_open_file}）。</li>
 *   <li>保存单个文件（{@code file_chooser_save_file}）。</li>
 *   <li>把多个文件保存到用户选择的目录（{@code file_chooser_save_files}），自动避开重名。</li>
 *   <li>取消进行中的请求（{@code request_close}）。</li>
 * </ul>
 * <p>
 * 调用约定：
 * <ul>
 *   <li>每次调用都由客户端给出 handle（对象路径格式），调用进行期间可用 {@code request_close} 按 handle 取消。</li>
 *   <li>返回值总是 {@code {status, results}}：0 表示成功，1 表示取消；失败也以 1 返回，不会报错。</li>
 *   <li>路径类参数是以 NUL 结尾的字节数组（JSON 数字数组或 base64 字符串）。</li>
 * </ul>
 */
@Component
public class FileChooserMcpTools {

    private static final Logger log = LoggerFactory.getLogger(FileChooserMcpTools.class);

    private final FileChooserPortal portal;
    private final RequestHandleRegistry registry;

    public FileChooserMcpTools(FileChooserPortal portal, RequestHandleRegistry registry) {
        this.portal = portal;
        this.registry = registry;
    }

    @Tool(
            name = "file_chooser_open_file",
            description = "让用户选择要打开的文件或目录。阻塞直到用户确认/取消，或客户端通过 request_close 取消。"
    )
    public PortalResponse<OpenFileResults> openFile(
            @ToolParam(description = "请求句柄（对象路径，例如 /org/portal/request/app_1/t1），用于 request_close") String handle,
            @ToolParam(required = false, description = "发起请求的应用 id") String appId,
            @ToolParam(required = false, description = "父窗口标识（例如 wayland:xxxx）") String parentWindow,
            @ToolParam(required = false, description = "对话框标题") String title,
            @ToolParam(required = false, description = "可选参数：accept_label/modal/multiple/directory/filters/current_filter/choices/current_folder") OpenFileOptions options
    ) {
        return portal.openFile(handle, nullToEmpty(appId), nullToEmpty(parentWindow), nullToEmpty(title), options);
    }

    @Tool(
            name = "file_chooser_save_file",
            description = "让用户选择保存位置与文件名。阻塞直到用户确认/取消，或客户端通过 request_close 取消。"
    )
    public PortalResponse<SaveFileResults> saveFile(
            @ToolParam(description = "请求句柄（对象路径），用于 request_close") String handle,
            @ToolParam(required = false, description = "发起请求的应用 id") String appId,
            @ToolParam(required = false, description = "父窗口标识") String parentWindow,
            @ToolParam(required = false, description = "对话框标题") String title,
            @ToolParam(required = false, description = "可选参数：accept_label/modal/multiple/filters/current_filter/choices/current_name/current_folder/current_filename") SaveFileOptions options
    ) {
        return portal.saveFile(handle, nullToEmpty(appId), nullToEmpty(parentWindow), nullToEmpty(title), options);
    }

    @Tool(
            name = "file_chooser_save_files",
            description = "让用户选择一个目录，并为 files 中的每个文件名计算不会覆盖已有文件的目标 URI（顺序与输入一致）。"
    )
    public PortalResponse<SaveFilesResults> saveFiles(
            @ToolParam(description = "请求句柄（对象路径），用于 request_close") String handle,
            @ToolParam(required = false, description = "发起请求的应用 id") String appId,
            @ToolParam(required = false, description = "父窗口标识") String parentWindow,
            @ToolParam(required = false, description = "对话框标题") String title,
            @ToolParam(description = "参数：files（必填，单级相对文件名）/accept_label/modal/choices/current_folder") SaveFilesOptions options
    ) {
        return portal.saveFiles(handle, nullToEmpty(appId), nullToEmpty(parentWindow), nullToEmpty(title), options);
    }

    @Tool(
            name = "request_close",
            description = "取消 handle 对应的进行中请求；请求已结束或不存在时不做任何事。"
    )
    public RequestCloseResult closeRequest(
            @ToolParam(description = "要取消的请求句柄") String handle
    ) {
        boolean closed = registry.close(handle);
        if (!closed) {
            log.debug("Close() 没有找到进行中的请求：{}", handle);
        }
        return new RequestCloseResult(handle, closed);
    }

    private static String nullToEmpty(String value) {
        return (value == null) ? "" : value;
    }
}
