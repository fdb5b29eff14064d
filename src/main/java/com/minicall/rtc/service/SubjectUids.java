package com.minicall.rtc.service;

/**
 * 从持久账号 id 推导中继侧的 subject uid。
 *
 * <p>同一个人在所有通话里映射到同一个 uid，但中继看不到真实账号 id。
 * 取值范围 [0, 10^9)。</p>
 */
public final class SubjectUids {

    public static final long UID_MODULUS = 1_000_000_000L;

    private SubjectUids() {
    }

    public static long fromUserId(long userId) {
        return fromAccountId(String.valueOf(userId));
    }

    public static long fromAccountId(String accountId) {
        if (accountId == null || accountId.isEmpty()) {
            throw new IllegalArgumentException("missing_account_id");
        }
        int hash = 0;
        for (int i = 0; i < accountId.length(); i++) {
            hash = 31 * hash + accountId.charAt(i);
        }
        // 在 long 上取绝对值，Integer.MIN_VALUE 也不会变成负数
        return Math.abs((long) hash) % UID_MODULUS;
    }
}
