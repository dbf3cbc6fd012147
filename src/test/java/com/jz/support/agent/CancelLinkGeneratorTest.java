package com.jz.support.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.support.config.RetentionProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("退订链接加密")
class CancelLinkGeneratorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static RetentionProperties props(String password) {
        RetentionProperties p = new RetentionProperties();
        p.setPassword(password);
        return p;
    }

    @Test
    @DisplayName("token 可用同一口令解密，内容为 subscription_id + email")
    void tokenDecryptsToPayload() throws Exception {
        String url = new CancelLinkGenerator(props("s3cret"), mapper).cancelLink("sub_123", "sarah@example.com");

        assertThat(url).startsWith("https://levhaolam.com/pay/subscriptions/cancel?al=");
        byte[] token = Base64.getUrlDecoder().decode(url.substring(url.indexOf("?al=") + 4));
        byte[] nonce = Arrays.copyOfRange(token, 0, 12);
        byte[] ct = Arrays.copyOfRange(token, 12, token.length);

        byte[] key = MessageDigest.getInstance("SHA-256").digest("s3cret".getBytes(StandardCharsets.UTF_8));
        Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
        cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(128, nonce));
        JsonNode payload = mapper.readTree(cipher.doFinal(ct));

        assertThat(payload.get("subscription_id").asText()).isEqualTo("sub_123");
        assertThat(payload.get("email").asText()).isEqualTo("sarah@example.com");
    }

    @Test
    void nonceDiffersPerCall() {
        CancelLinkGenerator gen = new CancelLinkGenerator(props("s3cret"), mapper);
        assertThat(gen.cancelLink("sub_1", "a@b.c")).isNotEqualTo(gen.cancelLink("sub_1", "a@b.c"));
    }

    @Test
    void noPasswordNoLink() {
        assertThat(new CancelLinkGenerator(props(null), mapper).cancelLink("sub_1", "a@b.c")).isNull();
        assertThat(new CancelLinkGenerator(props("  "), mapper).cancelLink("sub_1", "a@b.c")).isNull();
    }
}
