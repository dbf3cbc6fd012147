package com.jz.support.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@Data
@ConfigurationProperties(prefix = "support.models")
public class ModelProperties {

    /** 对外暴露的模型池（每个名字一个无记忆 ChatClient） */
    private List<String> available = List.of("qwen-max", "qwen-plus", "qwen-turbo");

    private String router = "qwen-turbo";       // 分类，要快
    private String name = "qwen-turbo";         // 抽取客户名
    private String reply = "qwen-plus";         // 通用客服回复
    private String specialist = "qwen-max";     // 团队模式专员
    private String outstanding = "qwen-turbo";  // 特殊案件检测
    private String judge = "qwen-max";          // 语义评审/QA
}
