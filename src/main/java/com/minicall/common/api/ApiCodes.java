package com.minicall.common.api;

/**
 * 统一错误码定义。
 *
 * <p>按 HTTP 语义分段：4xx00 为调用方问题，5xx00 为服务端问题。</p>
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 / 业务校验失败 */
    public static final int BAD_REQUEST = 40000;

    /** 未登录 / token 无效 */
    public static final int UNAUTHORIZED = 40100;

    /** 不是会话成员 / 无权操作该通话 */
    public static final int FORBIDDEN = 40300;

    /** 通话或资源不存在 */
    public static final int NOT_FOUND = 40400;

    /** 通话状态冲突（例如对已结束通话执行 accept） */
    public static final int CONFLICT = 40900;

    /** 服务端未预期异常 */
    public static final int INTERNAL_ERROR = 50000;

    /** 服务端缺少签名配置（app id / app certificate），不可重试 */
    public static final int SERVER_CONFIG_ERROR = 50001;
}
