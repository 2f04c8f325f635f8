package com.tailtracker.cache.constant;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 模式 / 查询标识摘要
 */
public final class KeyDigests {

    private static final int ID_LENGTH = 16;

    private KeyDigests() {}

    /**
     * 多段文本拼接后取 MD5 十六进制前 16 位
     */
    public static String shortId(String... parts) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            for (int i = 0; i < parts.length; i++) {
                if (i > 0) {
                    md.update((byte) '_');
                }
                md.update(String.valueOf(parts[i]).getBytes(StandardCharsets.UTF_8));
            }
            return HexFormat.of().formatHex(md.digest()).substring(0, ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
