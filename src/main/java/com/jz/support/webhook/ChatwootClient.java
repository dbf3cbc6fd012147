package com.jz.support.webhook;

import com.jz.support.config.ChatwootProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class ChatwootClient implements MessagingClient {

    private final RestClient http;
    private final ChatwootProperties props;

    public ChatwootClient(RestClient.Builder builder, ChatwootProperties props) {
        this.props = props;
        SimpleClientHttpRequestFactory rf = new SimpleClientHttpRequestFactory();
        rf.setConnectTimeout(props.getConnectTimeout());
        rf.setReadTimeout(props.getReadTimeout());
        this.http = builder
                .baseUrl(props.getUrl() + "/api/v1")
                .requestFactory(rf)
                .defaultHeader("api_access_token", props.getApiToken() == null ? "" : props.getApiToken())
                .build();
    }

    private String conv(long conversationId) {
        return "/accounts/" + props.getAccountId() + "/conversations/" + conversationId;
    }

    @Override
    public void sendMessage(long conversationId, String content, boolean privateNote) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", content);
        body.put("message_type", "outgoing");
        body.put("private", privateNote);
        post(conv(conversationId) + "/messages", body);
        log.info("chatwoot message sent. conversationId={}, private={}", conversationId, privateNote);
    }

    @Override
    public void setStatus(long conversationId, String status) {
        post(conv(conversationId) + "/toggle_status", Map.of("status", status));
        log.info("chatwoot status changed. conversationId={}, status={}", conversationId, status);
    }

    @Override
    public void addLabels(long conversationId, List<String> labels) {
        post(conv(conversationId) + "/labels", Map.of("labels", labels));
    }

    @Override
    public void assign(long conversationId, long agentId) {
        post(conv(conversationId) + "/assignments", Map.of("assignee_id", agentId));
        log.info("chatwoot conversation assigned. conversationId={}, agentId={}", conversationId, agentId);
    }

    private void post(String uri, Object body) {
        http.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .toBodilessEntity();
    }
}
