package com.jz.support.agent;

import com.jz.support.config.ModelProperties;
import com.jz.support.domain.Category;
import com.jz.support.domain.CustomerProfile;
import com.jz.support.domain.Specialist;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 回复生成。标准模式：通用客服人设 + 分类指引；团队模式：专员人设打头，换更强的模型。
 * 输出只是正文，开场白/结束语/署名由拼装器补。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmReplyGenerator implements ReplyGenerator {

    @Qualifier("statelessChatClients")
    private final Map<String, ChatClient> chatClientMap;
    private final ModelProperties models;
    private final ContextProvider contextProvider;

    static final String SAFETY_RULES = """
            CRITICAL SAFETY RULES (NEVER VIOLATE):
            1. NEVER confirm subscription cancellation directly. Always redirect to the self-service cancellation page.
            2. NEVER confirm pause directly. Redirect or require human confirmation.
            3. If you detect threats or disputes, respond that you are connecting them with a human agent.
            4. NEVER process or promise refunds without human approval.
            5. NEVER include sensitive customer data (card numbers, passwords) or internal field names.
            6. If you are unsure, state that a human agent will review the case.
            7. Always respond in the same language the customer used.
            """;

    static final String FORMAT_RULES = """
            Write ONLY the body of the reply: no greeting, no sign-off, no placeholders.
            For cancellation requests mention the "cancellation page"; the link is inserted automatically.
            """;

    private static final Map<Category, String> GUIDANCE = new EnumMap<>(Category.class);
    static {
        GUIDANCE.put(Category.SHIPPING_OR_DELIVERY_QUESTION,
                "Help with delivery status. Boxes ship from Israel; international delivery usually takes 2 to 4 weeks.");
        GUIDANCE.put(Category.PAYMENT_QUESTION,
                "Explain charges and billing dates. Never promise a refund; a human approves all refunds.");
        GUIDANCE.put(Category.FREQUENCY_CHANGE_REQUEST,
                "Explain the available delivery frequencies and how the change takes effect from the next cycle.");
        GUIDANCE.put(Category.SKIP_OR_PAUSE_REQUEST,
                "Acknowledge the request. Do not confirm the pause yourself; say the team will confirm it.");
        GUIDANCE.put(Category.RECIPIENT_OR_ADDRESS_CHANGE,
                "Collect the full new address or recipient and say the team will update it before the next shipment.");
        GUIDANCE.put(Category.CUSTOMIZATION_REQUEST,
                "Explain what can and cannot be customized in the box; pass allergy notes to the team.");
        GUIDANCE.put(Category.DAMAGED_OR_LEAKING_ITEM_REPORT,
                "Apologize, ask for photos of the damaged items and packaging, and say the team will review the case.");
        GUIDANCE.put(Category.GRATITUDE,
                "Thank the customer warmly and briefly. No upselling.");
        GUIDANCE.put(Category.RETENTION_PRIMARY_REQUEST,
                "Ask gently why they want to leave and mention pause or skip as alternatives, "
                        + "then point to the cancellation page.");
        GUIDANCE.put(Category.RETENTION_REPEATED_REQUEST,
                "The customer already asked to cancel. Do not push alternatives again; point to the cancellation page.");
    }

    @Override
    public GeneratedReply generate(GenerationRequest req) {
        Category category = req.getCategory();
        Specialist specialist = req.isTeamMode() ? category.specialist() : null;
        String modelName = specialist != null ? models.getSpecialist() : models.getReply();

        String out;
        try {
            out = client(modelName).prompt()
                    .system(systemPrompt(category, specialist, req.getCustomerEmail()))
                    .user(req.getInput())
                    .call()
                    .content();
        } catch (Exception e) {
            throw new ReplyGenerationException("reply generation failed: " + e.getMessage(), e);
        }
        if (out == null || out.isBlank()) {
            throw new ReplyGenerationException("reply generation returned empty output");
        }
        log.info("reply generated. category={}, model={}, specialist={}, length={}",
                category.code(), modelName, specialist == null ? null : specialist.key(), out.length());
        return new GeneratedReply(out.trim(), modelName, specialist == null ? null : specialist.key());
    }

    private ChatClient client(String modelName) {
        return Optional.ofNullable(chatClientMap.get(modelName))
                .orElseGet(() -> chatClientMap.values().iterator().next());
    }

    String systemPrompt(Category category, Specialist specialist, String email) {
        StringBuilder sb = new StringBuilder();
        if (specialist != null) {
            sb.append(specialist.role()).append("\n\n");
        } else {
            sb.append("You are a helpful customer support agent for Lev Haolam, an Israel-based subscription box company, ")
                    .append("handling ").append(category.code()).append(" requests. Be polite, professional and warm.\n\n");
        }
        sb.append(SAFETY_RULES).append('\n');
        sb.append("CATEGORY GUIDANCE: ").append(GUIDANCE.get(category)).append("\n\n");
        sb.append(FORMAT_RULES);

        if (email != null && !email.isBlank()) {
            sb.append("\nIMPORTANT: Customer email for this conversation: ").append(email).append('\n');
            contextProvider.profile(email).ifPresentOrElse(
                    p -> sb.append(profileBlock(p)),
                    () -> sb.append("CUSTOMER STATUS: email not found in database. Limited information available.\n"));
        }
        return sb.toString();
    }

    static String profileBlock(CustomerProfile p) {
        StringBuilder sb = new StringBuilder("\nCUSTOMER PROFILE:\n");
        if (p.getName() != null) sb.append("Name: ").append(p.getName()).append('\n');
        if (p.getJoinDate() != null) sb.append("Member since: ").append(p.getJoinDate()).append('\n');
        if (p.getTotalOrders() != null) sb.append("Total orders: ").append(p.getTotalOrders()).append('\n');
        if (p.getSubscriptionStatus() != null) {
            sb.append("\nSUBSCRIPTION:\n")
                    .append("Status: ").append(p.getSubscriptionStatus()).append('\n');
            if (p.getFrequency() != null) sb.append("Frequency: ").append(p.getFrequency()).append('\n');
            if (p.getNextChargeDate() != null) sb.append("Next charge: ").append(p.getNextChargeDate()).append('\n');
        }
        return sb.toString();
    }
}
