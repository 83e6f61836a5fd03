package com.zia.ziacoinsystem.util;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jce.ECNamedCurveTable;
import org.bouncycastle.jce.interfaces.ECPublicKey;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.jce.spec.ECNamedCurveParameterSpec;
import org.bouncycastle.jce.spec.ECPublicKeySpec;
import org.bouncycastle.math.ec.ECPoint;

import java.nio.charset.StandardCharsets;
import java.security.*;
import java.security.spec.ECGenParameterSpec;


/**
 * 加密工具类 - 提供哈希、签名和密钥编码功能
 */
@Slf4j
public class CryptoUtil {

    private static final String CURVE_NAME = "secp256k1";

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    public static byte[] applySHA256(byte[] data) {
        try {
            // 优先使用BouncyCastle确保一致性
            return MessageDigest.getInstance("SHA-256", BouncyCastleProvider.PROVIDER_NAME)
                    .digest(data);
        } catch (Exception e) {
            // 降级使用系统默认提供者
            try {
                return MessageDigest.getInstance("SHA-256").digest(data);
            } catch (Exception ex) {
                throw new IllegalStateException("SHA-256算法不可用", ex);
            }
        }
    }

    /**
     * UTF-8字符串的SHA-256 十六进制结果
     */
    public static String sha256Hex(String data) {
        return bytesToHex(applySHA256(data.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * 字节数组转十六进制字符串
     */
    public static String bytesToHex(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        StringBuilder result = new StringBuilder();
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }

    /**
     * 十六进制字符串转字节数组
     */
    public static byte[] hexToBytes(String hex) {
        int len = hex.length();
        if (len % 2 != 0) {
            throw new IllegalArgumentException("十六进制长度必须为偶数: " + len);
        }
        byte[] data = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            int high = Character.digit(hex.charAt(i), 16);
            int low = Character.digit(hex.charAt(i + 1), 16);
            if (high < 0 || low < 0) {
                throw new IllegalArgumentException("非法的十六进制字符: " + hex);
            }
            data[i / 2] = (byte) ((high << 4) + low);
        }
        return data;
    }

    /**
     * 椭圆曲线
     */
    public static class ECDSASigner {

        /**
         * 生成ECDSA密钥对（secp256k1曲线）
         */
        public static KeyPair generateKeyPair() {
            try {
                KeyPairGenerator keyGen = KeyPairGenerator.getInstance("EC", BouncyCastleProvider.PROVIDER_NAME);
                keyGen.initialize(new ECGenParameterSpec(CURVE_NAME), new SecureRandom());
                return keyGen.generateKeyPair();
            } catch (Exception e) {
                throw new IllegalStateException("生成密钥对失败", e);
            }
        }

        /**
         * 应用ECDSA签名 - 对原始数据进行签名
         */
        public static byte[] applySignature(PrivateKey privateKey, byte[] data) {
            try {
                Signature dsa = Signature.getInstance("SHA256withECDSA", BouncyCastleProvider.PROVIDER_NAME);
                dsa.initSign(privateKey);
                dsa.update(data);
                return dsa.sign();
            } catch (Exception e) {
                throw new IllegalStateException("应用签名失败", e);
            }
        }

        /**
         * 验证ECDSA签名 签名格式错误时返回false
         */
        public static boolean verifySignature(PublicKey publicKey, byte[] data, byte[] signature) {
            try {
                Signature dsa = Signature.getInstance("SHA256withECDSA", BouncyCastleProvider.PROVIDER_NAME);
                dsa.initVerify(publicKey);
                dsa.update(data);//明文
                return dsa.verify(signature);
            } catch (SignatureException e) {
                log.debug("签名格式错误: {}", e.getMessage());
                return false;
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("验证签名失败", e);
            }
        }

        /**
         * 公钥压缩编码（33字节）的十六进制 作为交易发送方标识
         */
        public static String exportCompressedPublicKey(PublicKey publicKey) {
            if (!(publicKey instanceof ECPublicKey)) {
                throw new IllegalArgumentException("不支持的公钥类型: " + publicKey.getClass().getName());
            }
            return bytesToHex(((ECPublicKey) publicKey).getQ().getEncoded(true));
        }

        /**
         * 从压缩公钥十六进制恢复公钥
         */
        public static PublicKey importCompressedPublicKey(String compressedHex) {
            try {
                ECNamedCurveParameterSpec spec = ECNamedCurveTable.getParameterSpec(CURVE_NAME);
                ECPoint point = spec.getCurve().decodePoint(hexToBytes(compressedHex));
                KeyFactory keyFactory = KeyFactory.getInstance("EC", BouncyCastleProvider.PROVIDER_NAME);
                return keyFactory.generatePublic(new ECPublicKeySpec(point, spec));
            } catch (GeneralSecurityException e) {
                throw new IllegalArgumentException("无法解析公钥: " + compressedHex, e);
            }
        }
    }
}
