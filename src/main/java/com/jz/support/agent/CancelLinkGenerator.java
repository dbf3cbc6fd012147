package com.jz.support.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.support.config.RetentionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 退订自助页链接：token = base64url(nonce(12) || AES-256-GCM 密文)，
 * 密钥为口令的 SHA-256，明文为 {"subscription_id", "email"} JSON。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CancelLinkGenerator implements LinkGenerator {

    private static final int NONCE_LEN = 12;
    private static final int TAG_BITS = 128;

    private final RetentionProperties props;
    private final ObjectMapper mapper;
    private final SecureRandom random = new SecureRandom();

    @Override
    public String cancelLink(String subscriptionRef, String email) {
        String password = props.getPassword();
        if (password == null || password.isBlank()) {
            log.error("cancel link password not set");
            return null;
        }
        try {
            Map<String, String> payload = new LinkedHashMap<>();
            payload.put("subscription_id", subscriptionRef);
            payload.put("email", email);
            byte[] plain = mapper.writeValueAsBytes(payload);

            byte[] key = MessageDigest.getInstance("SHA-256").digest(password.getBytes(StandardCharsets.UTF_8));
            byte[] nonce = new byte[NONCE_LEN];
            random.nextBytes(nonce);

            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, nonce));
            byte[] ct = cipher.doFinal(plain);

            byte[] token = new byte[nonce.length + ct.length];
            System.arraycopy(nonce, 0, token, 0, nonce.length);
            System.arraycopy(ct, 0, token, nonce.length, ct.length);

            log.info("cancel link generated. subscriptionId={}", subscriptionRef);
            return props.getCancelBaseUrl() + "?al=" + Base64.getUrlEncoder().encodeToString(token);
        } catch (Exception e) {
            log.error("cancel link generation failed. err={}", e.toString());
            return null;
        }
    }
}
