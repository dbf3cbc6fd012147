package com.jz.support.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.support.config.ModelProperties;
import com.jz.support.config.PipelineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 取客户名（只要名，不要姓）。
 * 快路径：联系人信息里有名字直接用；否则让小模型从署名/自我介绍里抽。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmNameExtractor implements NameExtractor {

    @Qualifier("statelessChatClients")
    private final Map<String, ChatClient> chatClientMap;
    private final ModelProperties models;
    private final PipelineProperties props;
    private final ObjectMapper mapper;

    // 2~30 个字母，允许连字符和撇号
    private static final Pattern VALID_NAME = Pattern.compile("^[A-Za-zÀ-ÿ'\\-]{2,30}$");

    static final String SYS = """
            Extract the customer's FIRST NAME from the message.
            Look for a signature at the end ("Best, Sarah", "Thanks, John"),
            a self-introduction ("My name is David", "This is Rachel") or a sign-off ("Regards, Michael").
            If no name is found, return "Client".
            Return only the first name, capitalized properly.
            Respond ONLY with JSON: {"first_name": "..."}
            """;

    private ChatClient client() {
        return Optional.ofNullable(chatClientMap.get(models.getName()))
                .orElseGet(() -> chatClientMap.values().iterator().next());
    }

    @Override
    public String extract(String message, String knownName) {
        if (knownName != null && !knownName.isBlank()) {
            String name = clean(knownName.trim().split("\\s+")[0]);
            if (name != null) return name;
        }
        if (message == null || message.isBlank()) return props.getDefaultName();
        try {
            String out = client().prompt()
                    .system(SYS)
                    .user(message)
                    .call()
                    .content();
            if (out != null) {
                int b = out.indexOf('{'), e = out.lastIndexOf('}');
                if (b >= 0 && e >= b) {
                    JsonNode root = mapper.readTree(out.substring(b, e + 1));
                    String name = clean(root.path("first_name").asText(null));
                    if (name != null && !name.equalsIgnoreCase(props.getDefaultName())) return name;
                }
            }
        } catch (Exception e) {
            log.warn("name extraction failed. err={}", e.toString());
        }
        return props.getDefaultName();
    }

    /** 校验并规范化；不合法返回 null */
    static String clean(String raw) {
        if (raw == null) return null;
        String name = raw.strip().replaceAll("^[.,!?:;\"']+|[.,!?:;\"']+$", "");
        if (!VALID_NAME.matcher(name).matches()) return null;
        return name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1).toLowerCase(Locale.ROOT);
    }
}
