package com.minicall.auth.web;

/**
 * 请求级别的“当前用户”上下文。
 *
 * <p>AccessTokenInterceptor 解析 accessToken 后把 userId 放进 ThreadLocal，
 * 并在 afterCompletion 里清理，避免线程复用时串号。</p>
 */
public final class AuthContext {

    private static final ThreadLocal<Long> USER_ID = new ThreadLocal<>();

    private AuthContext() {
    }

    public static void setUserId(Long userId) {
        USER_ID.set(userId);
    }

    public static Long getUserId() {
        return USER_ID.get();
    }

    public static void clear() {
        USER_ID.remove();
    }
}
