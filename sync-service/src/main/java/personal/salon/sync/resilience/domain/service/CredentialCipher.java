package personal.salon.sync.resilience.domain.service;

import org.springframework.stereotype.Component;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.config.SyncProperties;
import personal.salon.sync.resilience.domain.model.EncryptedCredential;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM 자격 증명 암복호화
 *
 * 평문 = key || secret 을 하나의 메시지로 암호화 (IV 12바이트, 태그 128비트)
 * 암호문을 key 길이에서 분할해 encrypted_key / encrypted_secret으로 저장
 */
@Component
public class CredentialCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final int TAG_LENGTH = TAG_LENGTH_BITS / 8;

    private final SecretKeySpec masterKey;
    private final SecureRandom secureRandom = new SecureRandom();

    public CredentialCipher(SyncProperties syncProperties) {
        this(syncProperties.credentials().masterKey());
    }

    CredentialCipher(String base64MasterKey) {
        if (base64MasterKey == null || base64MasterKey.isBlank()) {
            throw new IllegalStateException("sync.credentials.master-key is not configured");
        }
        byte[] keyBytes = Base64.getDecoder().decode(base64MasterKey);
        if (keyBytes.length != 32) {
            throw new IllegalStateException("Master key must be 256 bits");
        }
        this.masterKey = new SecretKeySpec(keyBytes, "AES");
    }

    public EncryptedCredential encrypt(String apiKey, String apiSecret) {
        byte[] keyBytes = apiKey.getBytes(StandardCharsets.UTF_8);
        byte[] secretBytes = apiSecret.getBytes(StandardCharsets.UTF_8);
        byte[] plain = new byte[keyBytes.length + secretBytes.length];
        System.arraycopy(keyBytes, 0, plain, 0, keyBytes.length);
        System.arraycopy(secretBytes, 0, plain, keyBytes.length, secretBytes.length);

        byte[] iv = new byte[IV_LENGTH];
        secureRandom.nextBytes(iv);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, masterKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            // JCE 출력 = 암호문 || 태그
            byte[] output = cipher.doFinal(plain);
            int cipherLength = output.length - TAG_LENGTH;

            Base64.Encoder encoder = Base64.getEncoder();
            return new EncryptedCredential(
                    encoder.encodeToString(Arrays.copyOfRange(output, 0, keyBytes.length)),
                    encoder.encodeToString(Arrays.copyOfRange(output, keyBytes.length, cipherLength)),
                    encoder.encodeToString(iv),
                    encoder.encodeToString(Arrays.copyOfRange(output, cipherLength, output.length)));
        } catch (GeneralSecurityException e) {
            throw new BusinessException(ErrorCode.CREDENTIAL_CRYPTO_FAILURE, "Credential encryption failed", e);
        } finally {
            Arrays.fill(plain, (byte) 0);
        }
    }

    /**
     * @return [apiKey, apiSecret]
     */
    public String[] decrypt(EncryptedCredential encrypted) {
        Base64.Decoder decoder = Base64.getDecoder();
        byte[] keyPart = decoder.decode(encrypted.encryptedKey());
        byte[] secretPart = decoder.decode(encrypted.encryptedSecret());
        byte[] tag = decoder.decode(encrypted.authTag());
        byte[] iv = decoder.decode(encrypted.iv());

        byte[] input = new byte[keyPart.length + secretPart.length + tag.length];
        System.arraycopy(keyPart, 0, input, 0, keyPart.length);
        System.arraycopy(secretPart, 0, input, keyPart.length, secretPart.length);
        System.arraycopy(tag, 0, input, keyPart.length + secretPart.length, tag.length);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, masterKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            byte[] plain = cipher.doFinal(input);
            String apiKey = new String(plain, 0, keyPart.length, StandardCharsets.UTF_8);
            String apiSecret = new String(plain, keyPart.length, plain.length - keyPart.length, StandardCharsets.UTF_8);
            Arrays.fill(plain, (byte) 0);
            return new String[]{apiKey, apiSecret};
        } catch (GeneralSecurityException e) {
            // 태그 불일치 = 변조 또는 마스터 키 불일치
            throw new BusinessException(ErrorCode.CREDENTIAL_CRYPTO_FAILURE, "Credential decryption failed", e);
        }
    }
}
