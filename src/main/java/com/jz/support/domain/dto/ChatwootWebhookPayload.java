package com.jz.support.domain.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

/** Chatwoot webhook 事件，只取流水线用得到的字段 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatwootWebhookPayload {

    private String event;                    // message_created / message_updated / ...
    private Long id;                         // 消息 id，去重键
    private String content;
    @JsonProperty("message_type")
    private String messageType;              // incoming / outgoing
    @JsonProperty("private")
    private boolean privateNote;
    private Sender sender;
    private Conversation conversation;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Sender {
        private Long id;
        private String name;
        private String email;
        private String type;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Conversation {
        private Long id;
        @JsonProperty("inbox_id")
        private Long inboxId;
        private String status;
        private String channel;
    }
}
