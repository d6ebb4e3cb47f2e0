package com.questhub.web.common;

/**
 * 从访问令牌中解析出的调用者身份
 *
 * @param userId      令牌 subject，即存储层的用户 ID
 * @param handle      登录名（preferred_username），缺失时退化为 userId
 * @param displayName 展示名（name 声明），可能为 null
 */
public record CurrentUserInfo(String userId, String handle, String displayName) {

    /**
     * UI 展示用名称：displayName > handle > userId
     */
    public String label() {
        if (displayName != null && !displayName.isBlank()) {
            return displayName;
        }
        if (handle != null && !handle.isBlank()) {
            return handle;
        }
        return userId;
    }
}
