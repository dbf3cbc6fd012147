package com.jz.support.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.support.config.ModelProperties;
import com.jz.support.domain.Category;
import com.jz.support.domain.Classification;
import com.jz.support.domain.Urgency;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 路由分类：一次快模型调用，严格 JSON。
 * 任何失败（调用异常/解析失败/越界分类）都降级到兜底分类，不升级人工。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmClassifier implements Classifier {

    @Qualifier("statelessChatClients")
    private final Map<String, ChatClient> chatClientMap;
    private final ModelProperties models;
    private final ObjectMapper mapper;

    private static final Set<String> SENTIMENTS = Set.of("positive", "neutral", "negative", "frustrated");

    static final String SYS = """
            You are a message classifier for Lev Haolam customer support.
            Classify the customer message into exactly one primary category.
            Valid categories: %s.
            If the message contains multiple intents, set the secondary category.
            Extract the customer email if present in the message.
            Set urgency:
            - critical: death threats, bank disputes, legal threats
            - high: damaged items, repeated cancellation requests
            - medium: most requests (default)
            - low: gratitude, simple questions
            Sentiment: positive | neutral | negative | frustrated (angry, repeated issue, CAPS, !!!!).
            escalation_signal=true if the customer explicitly asks for a human (manager, supervisor,
            live person) or shows extreme frustration.
            If unclear, use shipping_or_delivery_question with medium urgency.

            Respond ONLY with JSON:
            {"primary": "...", "secondary": null, "urgency": "medium", "email": null,
             "sentiment": "neutral", "escalation_signal": false}
            """.formatted(Category.allCodes());

    private ChatClient client() {
        return Optional.ofNullable(chatClientMap.get(models.getRouter()))
                .orElseGet(() -> chatClientMap.values().iterator().next());
    }

    @Override
    public Classification classify(String message) {
        if (message == null || message.isBlank()) return Classification.fallback();
        try {
            String out = client().prompt()
                    .system(SYS)
                    .user(message.trim())
                    .call()
                    .content();
            Classification c = parse(out);
            log.info("classified. primary={}, secondary={}, urgency={}",
                    c.getPrimary().code(), c.getSecondary() == null ? null : c.getSecondary().code(),
                    c.getUrgency().value());
            return c;
        } catch (Exception e) {
            log.warn("classifier call failed, fallback to {}. err={}", Category.SAFE_DEFAULT.code(), e.toString());
            return Classification.fallback();
        }
    }

    Classification parse(String out) {
        if (out == null || out.isBlank()) return Classification.fallback();
        int b = out.indexOf('{'), e = out.lastIndexOf('}');
        if (b < 0 || e < b) {
            log.warn("classifier output has no json, fallback");
            return Classification.fallback();
        }
        try {
            JsonNode root = mapper.readTree(out.substring(b, e + 1));
            String rawPrimary = root.path("primary").asText(null);
            Category primary = Category.fromCode(rawPrimary).orElseGet(() -> {
                log.warn("classifier invalid category: {}", rawPrimary);
                return Category.SAFE_DEFAULT;
            });
            Category secondary = Category.fromCode(root.path("secondary").asText(null))
                    .filter(c -> c != primary)
                    .orElse(null);
            String sentiment = root.path("sentiment").asText("neutral").toLowerCase();
            return Classification.builder()
                    .primary(primary)
                    .secondary(secondary)
                    .urgency(Urgency.parseOrMedium(root.path("urgency").asText(null)))
                    .email(blankToNull(root.path("email").asText(null)))
                    .sentiment(SENTIMENTS.contains(sentiment) ? sentiment : "neutral")
                    .escalationSignal(root.path("escalation_signal").asBoolean(false))
                    .build();
        } catch (Exception ex) {
            log.warn("classifier output parse failed, fallback. err={}", ex.toString());
            return Classification.fallback();
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() || "null".equalsIgnoreCase(s) ? null : s.trim();
    }
}
