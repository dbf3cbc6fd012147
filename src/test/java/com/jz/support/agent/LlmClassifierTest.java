package com.jz.support.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.support.config.ModelProperties;
import com.jz.support.domain.Category;
import com.jz.support.domain.Classification;
import com.jz.support.domain.Urgency;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("路由分类输出解析")
class LlmClassifierTest {

    private final LlmClassifier classifier = new LlmClassifier(Map.of(), new ModelProperties(), new ObjectMapper());

    @Test
    void parsesFullOutput() {
        Classification c = classifier.parse("""
                {"primary": "damaged_or_leaking_item_report", "secondary": "retention_primary_request",
                 "urgency": "high", "email": "dan@example.com", "sentiment": "Frustrated", "escalation_signal": true}
                """);

        assertThat(c.getPrimary()).isEqualTo(Category.DAMAGED_OR_LEAKING_ITEM_REPORT);
        assertThat(c.getSecondary()).isEqualTo(Category.RETENTION_PRIMARY_REQUEST);
        assertThat(c.getUrgency()).isEqualTo(Urgency.HIGH);
        assertThat(c.getEmail()).isEqualTo("dan@example.com");
        assertThat(c.getSentiment()).isEqualTo("frustrated");
        assertThat(c.isEscalationSignal()).isTrue();
    }

    @Test
    @DisplayName("越界分类降级为默认分类")
    void unknownPrimaryFallsBack() {
        Classification c = classifier.parse("{\"primary\": \"refund_request\", \"urgency\": \"urgent\"}");

        assertThat(c.getPrimary()).isEqualTo(Category.SAFE_DEFAULT);
        assertThat(c.getUrgency()).isEqualTo(Urgency.MEDIUM);
        assertThat(c.getSentiment()).isEqualTo("neutral");
    }

    @Test
    void secondaryEqualToPrimaryIsDropped() {
        Classification c = classifier.parse("{\"primary\": \"gratitude\", \"secondary\": \"gratitude\", \"email\": null}");

        assertThat(c.getPrimary()).isEqualTo(Category.GRATITUDE);
        assertThat(c.getSecondary()).isNull();
        assertThat(c.getEmail()).isNull();
    }

    @Test
    void garbageFallsBack() {
        assertThat(classifier.parse("sorry, I can't").getPrimary()).isEqualTo(Category.SAFE_DEFAULT);
        assertThat(classifier.parse("{primary: }").getPrimary()).isEqualTo(Category.SAFE_DEFAULT);
    }

    @Test
    @DisplayName("模型不可用时返回兜底分类而不是抛异常")
    void unavailableModelFallsBack() {
        Classification c = classifier.classify("Where is my box?");

        assertThat(c.getPrimary()).isEqualTo(Category.SAFE_DEFAULT);
        assertThat(c.getUrgency()).isEqualTo(Urgency.MEDIUM);
    }
}
