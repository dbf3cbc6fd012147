package com.jz.support.agent;

public interface LinkGenerator {
    /** 生成退订链接；不可用时返回 null */
    String cancelLink(String subscriptionRef, String email);
}
