package com.jz.support.agent;

import lombok.Value;

@Value
public class GeneratedReply {
    String text;
    String model;
    /** 团队模式下的专员 key，标准模式为 null */
    String specialist;
}
