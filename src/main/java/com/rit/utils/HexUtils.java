package com.rit.utils;

import lombok.experimental.UtilityClass;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Pattern;

/**
 * 十六进制与字节互转、SHA-1 摘要工具，用于对象 hash（40 字符 hex）与 20 字节二进制之间的转换。
 */
@UtilityClass
public class HexUtils {

    private static final Pattern HASH = Pattern.compile("[0-9a-f]{40}");

    /**
     * 将 40 字符十六进制字符串转为 20 字节。
     *
     * @param hex 40 字符 0-9a-f 字符串
     * @return 20 字节
     */
    public static byte[] hexToBytes(String hex) {
        if (!isHash(hex)) {
            throw new IllegalArgumentException("hash must be 40 lowercase hex chars, got: " + hex);
        }
        byte[] b = new byte[20];
        for (int i = 0; i < 20; i++) {
            b[i] = (byte) Integer.parseInt(hex.substring(i * 2, i * 2 + 2), 16);
        }
        return b;
    }

    /**
     * 将字节数组转为小写十六进制字符串。
     * 例：20 字节 digest → "0b4e..." 共 40 字符。
     */
    public static String bytesToHex(byte[] bytes) {
        if (bytes == null) return "";
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b & 0xff));
        }
        return sb.toString();
    }

    /** 是否为合法的 40 字符小写 hex hash。 */
    public static boolean isHash(String s) {
        return s != null && HASH.matcher(s).matches();
    }

    /** 计算输入字节的 SHA-1 摘要（20 字节）。 */
    public static byte[] sha1(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-1").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    /** SHA-1 摘要的 40 字符 hex 形式。 */
    public static String sha1Hex(byte[] input) {
        return bytesToHex(sha1(input));
    }
}
