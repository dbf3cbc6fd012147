package com.jz.support.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "support.pipeline")
public class PipelineProperties {
    /** 请求没带 team_mode 时的默认值 */
    private boolean teamMode = false;
    /** 拼进生成输入的历史轮数 */
    private int historyTurns = 10;
    /** 单条历史的最大字符数，超出截断并补 "..." */
    private int turnCharCap = 500;
    /** 取不到名字时的称呼 */
    private String defaultName = "Client";
    private String defaultChannel = "widget";
}
