package com.jz.support.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.support.config.ModelProperties;
import com.jz.support.domain.Category;
import com.jz.support.domain.Confidence;
import com.jz.support.domain.OutstandingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * 特殊案件检测（重复投诉、严重不满、高价值客户流失等）。
 * 失败时按"非特殊案件"处理，trigger 记为 detection_error。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmOutstandingDetector implements OutstandingDetector {

    @Qualifier("statelessChatClients")
    private final Map<String, ChatClient> chatClientMap;
    private final ModelProperties models;
    private final ObjectMapper mapper;

    static final String SYS = """
            You are an Outstanding Case Detector for Lev Haolam customer support.
            Determine if a customer request is an OUTSTANDING case: one that needs special handling
            or human review beyond a routine answer.

            HARD RULES (if ANY match, is_outstanding MUST be true):
            - the customer reports the same problem for the second time or more
            - the customer mentions a chargeback, bank dispute, press, or social media complaint
            - multiple damaged or missing boxes in a row
            - a request involving a deceased subscriber or a gift recipient who was never told

            SOFT RULES (use judgment on severity):
            - strong dissatisfaction or a long-time customer threatening to leave
            - requests for compensation beyond a normal replacement
            - anything that clearly falls outside standard policy

            If no rule matches, is_outstanding=false and trigger="none".

            Respond ONLY with JSON:
            {"is_outstanding": false, "trigger": "none", "confidence": "high|medium|low"}
            """;

    private ChatClient client() {
        return Optional.ofNullable(chatClientMap.get(models.getOutstanding()))
                .orElseGet(() -> chatClientMap.values().iterator().next());
    }

    @Override
    public OutstandingResult detect(String message, Category category) {
        try {
            String out = client().prompt()
                    .system(SYS)
                    .user("CATEGORY: " + category.code() + "\n\nCUSTOMER MESSAGE:\n" + message)
                    .call()
                    .content();
            OutstandingResult r = parse(out);
            log.info("outstanding detection complete. outstanding={}, trigger={}, confidence={}",
                    r.isOutstanding(), r.getTrigger(), r.getConfidence().value());
            return r;
        } catch (Exception e) {
            log.error("outstanding detection failed. err={}", e.toString());
            return OutstandingResult.detectionError();
        }
    }

    OutstandingResult parse(String out) {
        if (out == null || out.isBlank()) return OutstandingResult.none();
        int b = out.indexOf('{'), e = out.lastIndexOf('}');
        if (b < 0 || e < b) {
            log.warn("outstanding output has no json");
            return OutstandingResult.none();
        }
        try {
            JsonNode root = mapper.readTree(out.substring(b, e + 1));
            boolean outstanding = root.path("is_outstanding").asBoolean(false);
            String trigger = root.path("trigger").asText("none");
            if (trigger.isBlank()) trigger = "none";
            return OutstandingResult.builder()
                    .outstanding(outstanding)
                    .trigger(trigger)
                    .confidence(Confidence.parse(root.path("confidence").asText(null)).orElse(Confidence.HIGH))
                    .build();
        } catch (Exception ex) {
            log.warn("outstanding output parse failed. err={}", ex.toString());
            return OutstandingResult.none();
        }
    }
}
