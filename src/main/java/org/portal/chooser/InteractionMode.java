package org.portal.chooser;

/**
 * 选择对话框的工作模式。
 */
public enum InteractionMode {
    OPEN,
    SAVE,
    SELECT_FOLDER;

    /**
     * directory 优先于 save：两者都为 true 时是选择目录。
     */
    public static InteractionMode of(boolean directory, boolean save) {
        if (directory) {
            return SELECT_FOLDER;
        }
        return save ? SAVE : OPEN;
    }
}
