package com.mentionindex.config;

/**
 * 定义块分隔行配置。
 *
 * <p>两种分隔行都关闭时配置无效，此时解析不会主动结束任何块，直到输入结束。
 */
public record DividerConfig(boolean dash, boolean underscore) {

    /**
     * 默认仅启用 {@code ---}。
     */
    public static DividerConfig defaults() {
        return new DividerConfig(true, false);
    }

    public boolean isValid() {
        return dash || underscore;
    }

    /**
     * 判断一行是否为分隔行。
     */
    public boolean isDivider(String line) {
        if (dash && line.startsWith(Constants.DASH_DIVIDER)) {
            return true;
        }
        return underscore && line.startsWith(Constants.UNDERSCORE_DIVIDER);
    }

    /**
     * 新写入分隔行时使用的文本，启用下划线时优先使用下划线。
     */
    public String preferredDivider() {
        return underscore ? Constants.UNDERSCORE_DIVIDER : Constants.DASH_DIVIDER;
    }
}
