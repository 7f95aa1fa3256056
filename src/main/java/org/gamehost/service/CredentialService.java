package org.gamehost.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;

/**
 * 凭据生成服务，使用密码学安全随机源
 */
@Slf4j
@Service
public class CredentialService {

    public static final String ALPHABET =
        "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    public static final int MIN_LENGTH = 8;

    public static final double MIN_ENTROPY_BITS = 60.0;

    private final SecureRandom secureRandom = new SecureRandom();
    private final int defaultLength;

    public CredentialService(@Value("${gamehost.secret.length:12}") int defaultLength) {
        if (entropyBits(defaultLength) < MIN_ENTROPY_BITS) {
            throw new IllegalStateException(String.format(
                "默认密码长度 %d 的熵不足 %.0f 位", defaultLength, MIN_ENTROPY_BITS));
        }
        this.defaultLength = defaultLength;
    }

    public String generateSecret() {
        return generateSecret(defaultLength);
    }

    /**
     * 生成字母数字密码，每个字符独立均匀取自 62 个符号
     */
    public String generateSecret(int length) {
        if (length < MIN_LENGTH) {
            throw new IllegalArgumentException("密码长度不能小于 " + MIN_LENGTH);
        }
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = ALPHABET.charAt(secureRandom.nextInt(ALPHABET.length()));
        }
        return new String(chars);
    }

    public int getDefaultLength() {
        return defaultLength;
    }

    public static double entropyBits(int length) {
        return length * (Math.log(ALPHABET.length()) / Math.log(2));
    }
}
