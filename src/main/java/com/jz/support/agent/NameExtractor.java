package com.jz.support.agent;

public interface NameExtractor {
    /** 取不到名字时返回默认称呼，不抛异常 */
    String extract(String message, String knownName);
}
