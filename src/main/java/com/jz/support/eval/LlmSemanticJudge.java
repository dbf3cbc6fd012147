package com.jz.support.eval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.support.config.ModelProperties;
import com.jz.support.domain.Check;
import com.jz.support.domain.Confidence;
import com.jz.support.domain.Decision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 用 ChatClient 调评审模型，严格要求 JSON 输出。
 * 解析失败不抛异常，返回 UNPARSEABLE；模型调用失败原样抛出。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmSemanticJudge implements SemanticJudge {

    @Qualifier("statelessChatClients")
    private final Map<String, ChatClient> chatClientMap;
    private final ModelProperties models;
    private final ObjectMapper mapper;

    static final String OUTPUT_FORMAT = """

            Respond ONLY with JSON:
            {
              "decision": "send|draft|escalate|refine",
              "confidence": "high|medium|low",
              "checks": [
                {"name": "safety|tone|accuracy|completeness", "passed": true, "score": 0.0~1.0, "detail": "..."}
              ],
              "feedback": "only when decision is refine: exactly what must be fixed"
            }
            """;

    private ChatClient client() {
        return Optional.ofNullable(chatClientMap.get(models.getJudge()))
                .orElseGet(() -> chatClientMap.values().iterator().next());
    }

    @Override
    public JudgeVerdict judge(String instructions, String prompt) {
        String out = client().prompt()
                .system(instructions + OUTPUT_FORMAT)
                .user(prompt)
                .call()
                .content();
        return parse(out);
    }

    JudgeVerdict parse(String out) {
        if (out == null || out.isBlank()) return JudgeVerdict.unparseable("empty output");
        // 裁剪 { ... }
        int b = out.indexOf('{'), e = out.lastIndexOf('}');
        if (b < 0 || e < b) return JudgeVerdict.unparseable("no json object");
        try {
            JsonNode root = mapper.readTree(out.substring(b, e + 1));
            Optional<Decision> decision = Decision.parse(root.path("decision").asText(null));
            if (decision.isEmpty()) {
                return JudgeVerdict.unparseable("bad decision: " + root.path("decision").asText(""));
            }
            Confidence confidence = Confidence.parse(root.path("confidence").asText(null)).orElse(Confidence.MEDIUM);

            List<Check> checks = new ArrayList<>();
            for (JsonNode c : root.path("checks")) {
                String name = c.path("name").asText("");
                if (name.isBlank()) continue;
                checks.add(Check.of(name, c.path("passed").asBoolean(false),
                        c.path("score").asDouble(0.0), c.path("detail").asText("")));
            }
            String feedback = root.hasNonNull("feedback") ? root.get("feedback").asText() : null;
            if (feedback != null && feedback.isBlank()) feedback = null;
            return JudgeVerdict.parsed(decision.get(), confidence, checks, feedback);
        } catch (Exception ex) {
            log.warn("judge output parse failed. err={}", ex.toString());
            return JudgeVerdict.unparseable(ex.getClass().getSimpleName());
        }
    }
}
