package personal.salon.sync.resilience.domain.model;

/**
 * 암호화된 자격 증명 (Base64)
 * 키와 시크릿은 하나의 GCM 메시지로 암호화되어 IV와 인증 태그를 공유
 */
public record EncryptedCredential(
        String encryptedKey,
        String encryptedSecret,
        String iv,
        String authTag) {
}
