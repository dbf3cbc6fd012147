package com.jz.support.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.support.config.ModelProperties;
import com.jz.support.config.PipelineProperties;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LlmNameExtractorTest {

    private final LlmNameExtractor extractor =
            new LlmNameExtractor(Map.of(), new ModelProperties(), new PipelineProperties(), new ObjectMapper());

    @Test
    void contactNameTakesFirstToken() {
        assertThat(extractor.extract("anything", "sarah COHEN")).isEqualTo("Sarah");
    }

    @Test
    void invalidContactNameFallsThroughToDefault() {
        // 联系人名不合法，模型也不可用
        assertThat(extractor.extract("hi there", "x")).isEqualTo("Client");
        assertThat(extractor.extract("", null)).isEqualTo("Client");
    }

    @Test
    void cleanValidatesAndCapitalizes() {
        assertThat(LlmNameExtractor.clean("o'brien")).isEqualTo("O'brien");
        assertThat(LlmNameExtractor.clean("Anne-Marie,")).isEqualTo("Anne-marie");
        assertThat(LlmNameExtractor.clean("José")).isEqualTo("José");
        assertThat(LlmNameExtractor.clean("R2D2")).isNull();
        assertThat(LlmNameExtractor.clean("a")).isNull();
        assertThat(LlmNameExtractor.clean(null)).isNull();
    }
}
